package com.yieldvault.unit.api;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.yieldvault.api.controller.RequestController;
import com.yieldvault.config.ApiResponseAdvice;
import com.yieldvault.domain.enums.RequestStatus;
import com.yieldvault.domain.enums.RequestType;
import com.yieldvault.domain.model.PendingRequest;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.GlobalExceptionHandler;
import com.yieldvault.exception.VaultException;
import com.yieldvault.request.RequestQueue;
import com.yieldvault.service.VaultService;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RequestController.
 */
@ExtendWith(MockitoExtension.class)
class RequestControllerTest {

    private static final String BOB = "0x0000000000000000000000000000000000000b0b";

    private MockMvc mockMvc;

    @Mock
    private RequestQueue requestQueue;

    @Mock
    private VaultService vaultService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RequestController(requestQueue, vaultService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private PendingRequest pendingRedeem() {
        return PendingRequest.builder()
                .type(RequestType.REDEEM)
                .status(RequestStatus.PENDING)
                .operator(BOB)
                .owner(BOB)
                .amount(BigInteger.valueOf(80))
                .asset("0x00000000000000000000000000000000000a55e7")
                .requestTimestamp(Instant.parse("2026-01-05T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("POST /api/vault/requests/redeem submits the request and returns 201")
    void submitRedeem() throws Exception {
        when(requestQueue.requestRedeem(BOB, BOB, BigInteger.valueOf(80))).thenReturn(pendingRedeem());

        String json = """
                {"operator": "%s", "owner": "%s", "amount": 80}
                """.formatted(BOB, BOB);

        mockMvc.perform(post("/api/vault/requests/redeem")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.type").value("REDEEM"))
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andExpect(jsonPath("$.data.amount").value(80));
    }

    @Test
    @DisplayName("POST /api/vault/requests/withdraw submits a redeem request sized in assets")
    void submitWithdraw() throws Exception {
        when(requestQueue.requestWithdraw(BOB, BOB, BigInteger.valueOf(88))).thenReturn(pendingRedeem());

        String json = """
                {"operator": "%s", "owner": "%s", "amount": 88}
                """.formatted(BOB, BOB);

        mockMvc.perform(post("/api/vault/requests/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.type").value("REDEEM"))
                .andExpect(jsonPath("$.data.amount").value(80));

        verify(requestQueue).requestWithdraw(BOB, BOB, BigInteger.valueOf(88));
    }

    @Test
    @DisplayName("a second request from the same operator surfaces WRONG_REQUEST")
    void duplicateRequest() throws Exception {
        when(requestQueue.requestDeposit(BOB, BOB, BigInteger.TEN))
                .thenThrow(new VaultException(ErrorCode.WRONG_REQUEST, "Operator already has an open request"));

        mockMvc.perform(post("/api/vault/requests/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\": \"" + BOB + "\", \"owner\": \"" + BOB + "\", \"amount\": 10}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("WRONG_REQUEST"));
    }

    @Test
    @DisplayName("GET /api/vault/requests/{operator} returns 404 without an open request")
    void unknownOperator() throws Exception {
        when(requestQueue.pendingRequest(BOB)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/vault/requests/" + BOB))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/vault/requests lists requests with the queue totals")
    void listRequests() throws Exception {
        when(requestQueue.requests()).thenReturn(List.of(pendingRedeem()));
        when(requestQueue.totalDepositRequest()).thenReturn(BigInteger.ZERO);
        when(requestQueue.totalRedemptionRequest()).thenReturn(BigInteger.valueOf(80));
        when(requestQueue.totalRedemptionRequestAssets()).thenReturn(BigInteger.valueOf(80));
        when(requestQueue.totalClaimableRedemption()).thenReturn(BigInteger.ZERO);

        mockMvc.perform(get("/api/vault/requests"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.requests.length()").value(1))
                .andExpect(jsonPath("$.data.totalRedemptionRequest").value(80));
    }

    @Test
    @DisplayName("DELETE /api/vault/requests/redeem/{operator} returns the escrowed shares")
    void cancelRedeem() throws Exception {
        when(requestQueue.cancelRedeemRequest(BOB)).thenReturn(BigInteger.valueOf(80));

        mockMvc.perform(delete("/api/vault/requests/redeem/" + BOB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.returnedShares").value(80));
    }

    @Test
    @DisplayName("POST /api/vault/requests/settle-redemptions without a body delegates to the workflow")
    void settleRedemptions() throws Exception {
        when(vaultService.processRedemptions(isNull())).thenReturn(2);

        mockMvc.perform(post("/api/vault/requests/settle-redemptions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.settled").value(2));

        verify(vaultService).processRedemptions(null);
    }

    @Test
    @DisplayName("POST /api/vault/requests/claim-redeem passes the deadline as an instant")
    void claimRedeem() throws Exception {
        when(requestQueue.claimRedeem(BOB, BOB, Instant.ofEpochSecond(1_790_000_000L)))
                .thenReturn(BigInteger.valueOf(79));

        String json = """
                {"operator": "%s", "receiver": "%s", "deadline": 1790000000}
                """.formatted(BOB, BOB);

        mockMvc.perform(post("/api/vault/requests/claim-redeem")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assets").value(79));
    }

    @Test
    @DisplayName("claiming after the deadline surfaces TRANSACTION_EXPIRED")
    void claimExpired() throws Exception {
        when(requestQueue.claimDeposit(BOB, BOB, Instant.ofEpochSecond(1)))
                .thenThrow(new VaultException(ErrorCode.TRANSACTION_EXPIRED, "Deadline passed"));

        mockMvc.perform(post("/api/vault/requests/claim-deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\": \"" + BOB + "\", \"receiver\": \"" + BOB + "\", \"deadline\": 1}"))
                .andExpect(status().isRequestTimeout())
                .andExpect(jsonPath("$.code").value("TRANSACTION_EXPIRED"));
    }
}
