package com.yieldvault.unit.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReentrancyGuardTest {

    private final ReentrancyGuard guard = new ReentrancyGuard("vault");

    @Test
    @DisplayName("nested enter on the same thread fails with REENTRANT_CALL")
    void nestedEnterFails() {
        try (ReentrancyGuard.Scope ignored = guard.enter("invest")) {
            assertThatThrownBy(() -> guard.enter("deposit"))
                    .isInstanceOf(VaultException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.REENTRANT_CALL);
        }
    }

    @Test
    @DisplayName("guard is released when the scope exits with an exception")
    void releasedOnException() {
        assertThatThrownBy(() -> {
                    try (ReentrancyGuard.Scope ignored = guard.enter("invest")) {
                        throw new IllegalStateException("boom");
                    }
                })
                .isInstanceOf(IllegalStateException.class);

        assertThat(guard.isHeldByCurrentThread()).isFalse();
        try (ReentrancyGuard.Scope scope = guard.enter("deposit")) {
            assertThat(scope.getOperation()).isEqualTo("deposit");
        }
    }

    @Test
    @DisplayName("closing a scope twice releases the lock once")
    void doubleCloseIsHarmless() {
        ReentrancyGuard.Scope scope = guard.enter("deposit");
        scope.close();
        scope.close();

        assertThat(guard.isHeldByCurrentThread()).isFalse();
    }

    @Test
    @DisplayName("assertHeld fails outside a scope")
    void assertHeldOutsideScope() {
        assertThatThrownBy(guard::assertHeld).isInstanceOf(IllegalStateException.class);

        try (ReentrancyGuard.Scope ignored = guard.enter("mint")) {
            guard.assertHeld();
        }
    }

    @Test
    @DisplayName("another thread waits until the scope closes instead of failing")
    void otherThreadsBlock() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch attempted = new CountDownLatch(1);
        AtomicBoolean entered = new AtomicBoolean(false);
        try {
            Future<?> other;
            try (ReentrancyGuard.Scope ignored = guard.enter("invest")) {
                other = executor.submit(() -> {
                    attempted.countDown();
                    try (ReentrancyGuard.Scope inner = guard.enter("deposit")) {
                        entered.set(true);
                    }
                });
                assertThat(attempted.await(5, TimeUnit.SECONDS)).isTrue();
                Thread.sleep(50);
                assertThat(entered).isFalse();
            }
            other.get(5, TimeUnit.SECONDS);
            assertThat(entered).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
