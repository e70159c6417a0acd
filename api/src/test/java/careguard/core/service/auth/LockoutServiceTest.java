package careguard.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import careguard.core.model.account.Account;
import careguard.core.model.audit.AuditActions;
import careguard.core.port.out.CredentialStore;
import careguard.core.port.out.StoreUnavailableException;
import careguard.support.ServiceHarness;
import careguard.support.TestConfigs;

@DisplayName("LockoutService")
class LockoutServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ServiceHarness harness;
    private LockoutService lockout;

    @BeforeEach
    void setUp() {
        harness = new ServiceHarness();
        lockout = harness.lockout;
        harness.addAccount("b@x.com", "pw", "nurse", Set.of());
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private Account stored() {
        return harness.credentialStore.findByIdentity("b@x.com").await().atMost(TIMEOUT).orElseThrow();
    }

    @Nested
    @DisplayName("recordFailure()")
    class RecordFailureTests {

        @Test
        @DisplayName("should stay unlocked below the maximum")
        void shouldStayUnlockedBelowMaximum() {
            for (var i = 0; i < 4; i++) {
                final var state = lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);
                assertFalse(state.locked());
            }
            assertEquals(4, stored().failedAttempts());
        }

        @Test
        @DisplayName("should lock for the configured duration on the fifth failure")
        void shouldLockOnFifthFailure() {
            for (var i = 0; i < 4; i++) {
                lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);
            }

            final var state = lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);

            assertTrue(state.locked());
            assertEquals(5, state.failedAttempts());
            assertEquals(ServiceHarness.START.plus(Duration.ofMinutes(30)), state.lockExpiry());
            assertTrue(lockout.isLocked(stored()));
        }
    }

    @Nested
    @DisplayName("releaseIfExpired()")
    class ReleaseTests {

        @Test
        @DisplayName("should keep an active lock")
        void shouldKeepActiveLock() {
            harness.credentialStore.put(stored().withFailureState(5, ServiceHarness.START.plus(Duration.ofMinutes(30))));

            final var account = lockout.releaseIfExpired(stored()).await().atMost(TIMEOUT);

            assertTrue(lockout.isLocked(account));
        }

        @Test
        @DisplayName("should clear a lock that has run out together with the counter")
        void shouldClearExpiredLock() {
            harness.credentialStore.put(stored().withFailureState(5, ServiceHarness.START.plus(Duration.ofMinutes(30))));
            harness.clock.advance(Duration.ofMinutes(30));

            final var account = lockout.releaseIfExpired(stored()).await().atMost(TIMEOUT);

            assertFalse(lockout.isLocked(account));
            assertEquals(0, stored().failedAttempts());
            assertNull(stored().lockExpiry());
        }
    }

    @Nested
    @DisplayName("recordSuccess()")
    class RecordSuccessTests {

        @Test
        @DisplayName("should reset the counter when nothing changed since the read")
        void shouldResetUnchangedCounter() {
            for (var i = 0; i < 3; i++) {
                lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);
            }

            final var account = lockout.recordSuccess(stored()).await().atMost(TIMEOUT);

            assertEquals(0, account.failedAttempts());
            assertEquals(0, stored().failedAttempts());
        }

        @Test
        @DisplayName("should keep a lock set by a failure recorded after the read")
        void shouldKeepLockFromLaterFailure() {
            for (var i = 0; i < 4; i++) {
                lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);
            }
            final var beforeVerification = stored();
            lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);

            final var account = lockout.recordSuccess(beforeVerification).await().atMost(TIMEOUT);

            assertTrue(lockout.isLocked(account));
            assertTrue(lockout.isLocked(stored()));
            assertEquals(5, stored().failedAttempts());
        }

        @Test
        @DisplayName("should not wipe failures recorded after an expired lock was read")
        void shouldNotWipeFailuresAfterStaleExpiredRead() {
            harness.credentialStore.put(stored().withFailureState(5, ServiceHarness.START.plus(Duration.ofMinutes(30))));
            harness.clock.advance(Duration.ofMinutes(31));
            final var staleExpired = stored();
            lockout.releaseIfExpired(stored()).await().atMost(TIMEOUT);
            lockout.recordFailure("b@x.com").await().atMost(TIMEOUT);

            final var account = lockout.releaseIfExpired(staleExpired).await().atMost(TIMEOUT);

            assertEquals(1, account.failedAttempts());
            assertEquals(1, stored().failedAttempts());
        }
    }

    @Nested
    @DisplayName("administration")
    class AdministrationTests {

        @Test
        @DisplayName("should report an active lock")
        void shouldReportActiveLock() {
            harness.credentialStore.put(stored().withFailureState(5, ServiceHarness.START.plus(Duration.ofMinutes(30))));

            final var status = lockout.lockoutStatus("B@X.com").await().atMost(TIMEOUT).orElseThrow();

            assertTrue(status.locked());
            assertEquals(5, status.failedAttempts());
        }

        @Test
        @DisplayName("should not report a lock that has run out")
        void shouldNotReportExpiredLock() {
            harness.credentialStore.put(stored().withFailureState(5, ServiceHarness.START.minusSeconds(1)));

            final var status = lockout.lockoutStatus("b@x.com").await().atMost(TIMEOUT).orElseThrow();

            assertFalse(status.locked());
        }

        @Test
        @DisplayName("should return empty for an unknown account")
        void shouldReturnEmptyForUnknown() {
            assertTrue(lockout.lockoutStatus("nobody@x.com").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should clear a lock and audit who cleared it")
        void shouldClearAndAudit() {
            harness.credentialStore.put(stored().withFailureState(5, ServiceHarness.START.plus(Duration.ofMinutes(30))));

            lockout.clearLockout("b@x.com", "admin@x.com").await().atMost(TIMEOUT);

            assertFalse(lockout.isLocked(stored()));
            final var events = harness.auditEvents(AuditActions.LOCKOUT_CLEARED);
            assertEquals(1, events.size());
            assertEquals("admin@x.com", events.get(0).metadata().get("actor"));
        }
    }

    @Test
    @DisplayName("should surface store failures as StoreUnavailableException")
    void shouldSurfaceStoreFailures() {
        final var broken = mock(CredentialStore.class);
        when(broken.recordFailure(anyString(), anyInt(), any(), any()))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
        final var service = new LockoutService(TestConfigs.lockout(), broken, harness.auditLogger, harness.clock);

        final var uni = service.recordFailure("b@x.com");

        assertThrows(StoreUnavailableException.class, () -> uni.await().atMost(TIMEOUT));
    }
}
