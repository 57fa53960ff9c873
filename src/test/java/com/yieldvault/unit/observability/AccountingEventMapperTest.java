package com.yieldvault.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.yieldvault.domain.model.AccountingEventRecord;
import com.yieldvault.entity.AccountingEventEntity;
import com.yieldvault.mapper.AccountingEventMapper;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for the AccountingEventMapper (MapStruct).
 *
 * <p>Verifies record <-> entity mapping, including JSON serialization of the details map.
 */
class AccountingEventMapperTest {

    private final AccountingEventMapper accountingEventMapper = Mappers.getMapper(AccountingEventMapper.class);

    @Test
    @DisplayName("toEntity maps all fields and writes wei amounts as exact JSON numbers")
    void toEntity() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("assets", new BigInteger("1000000000000000000000"));
        details.put("receiver", "0x0000000000000000000000000000000000000001");

        AccountingEventRecord eventRecord = AccountingEventRecord.builder()
                .id(3L)
                .timestamp(LocalDateTime.of(2026, 1, 5, 9, 0))
                .category("VAULT")
                .eventType("DEPOSIT")
                .details(details)
                .build();

        AccountingEventEntity entity = accountingEventMapper.toEntity(eventRecord);

        assertThat(entity.getId()).isEqualTo(3L);
        assertThat(entity.getTimestamp()).isEqualTo(eventRecord.getTimestamp());
        assertThat(entity.getCategory()).isEqualTo("VAULT");
        assertThat(entity.getEventType()).isEqualTo("DEPOSIT");
        assertThat(entity.getDetails()).contains("\"assets\":1000000000000000000000");
        assertThat(entity.getDetails()).contains("\"receiver\":\"0x0000000000000000000000000000000000000001\"");
    }

    @Test
    @DisplayName("toDomain reads large amounts back as BigInteger")
    void toDomain() {
        AccountingEventEntity entity = AccountingEventEntity.builder()
                .id(4L)
                .timestamp(LocalDateTime.of(2026, 1, 5, 9, 30))
                .category("ALLOCATOR")
                .eventType("LOSSES")
                .subject("remote")
                .details("{\"loss\":15000000000000000000,\"strategy\":\"remote\"}")
                .build();

        AccountingEventRecord eventRecord = accountingEventMapper.toDomain(entity);

        assertThat(eventRecord.getSubject()).isEqualTo("remote");
        assertThat(eventRecord.getDetails())
                .containsEntry("loss", new BigInteger("15000000000000000000"))
                .containsEntry("strategy", "remote");
    }

    @Test
    @DisplayName("null and blank details map to null")
    void nullDetails() {
        AccountingEventRecord fromBlank =
                accountingEventMapper.toDomain(AccountingEventEntity.builder().details(" ").build());
        AccountingEventEntity fromNull = accountingEventMapper.toEntity(AccountingEventRecord.builder().build());

        assertThat(fromBlank.getDetails()).isNull();
        assertThat(fromNull.getDetails()).isNull();
    }

    @Test
    @DisplayName("list mapping keeps order")
    void listMapping() {
        List<AccountingEventEntity> entities = List.of(
                AccountingEventEntity.builder().id(2L).eventType("INVEST").build(),
                AccountingEventEntity.builder().id(1L).eventType("DEPOSIT").build());

        assertThat(accountingEventMapper.toDomainList(entities))
                .extracting(AccountingEventRecord::getEventType)
                .containsExactly("INVEST", "DEPOSIT");
    }
}
