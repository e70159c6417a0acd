package careguard.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import careguard.adapter.out.storage.memory.InMemoryAuditEventRepository;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.audit.RiskLevel;
import careguard.core.port.out.AuditEventRepository;
import careguard.core.port.out.ComplianceEventQueue;
import careguard.core.port.out.StoreUnavailableException;
import careguard.support.MutableClock;
import careguard.support.TestConfigs;

@DisplayName("AuditLogger")
@ExtendWith(MockitoExtension.class)
class AuditLoggerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2024-03-05T10:00:00Z");

    @Mock
    private ComplianceEventQueue queue;

    private MutableClock clock;
    private InMemoryAuditEventRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = new InMemoryAuditEventRepository();
    }

    private static AuditEvent.Builder authEvent(String action, boolean success) {
        return AuditEvent.builder(AuditEventType.AUTHENTICATION, action)
                .identity("a@x.com")
                .success(success);
    }

    @Nested
    @DisplayName("record()")
    class RecordTests {

        private AuditLogger logger;

        @BeforeEach
        void setUp() {
            logger = new AuditLogger(TestConfigs.audit(false), repository, queue, clock);
        }

        @Test
        @DisplayName("should stamp time, risk and retention before appending")
        void shouldPrepareEvent() {
            when(queue.enqueue(any())).thenReturn(true);

            logger.record(authEvent(AuditActions.LOGIN_SUCCESS, true).build()).await().atMost(TIMEOUT);

            final var stored = repository.snapshot().get(0);
            assertEquals(NOW, stored.timestamp());
            assertEquals(RiskLevel.LOW, stored.riskLevel());
            assertEquals(NOW.plus(Duration.ofDays(2557)), stored.retainUntil());
            assertNotNull(stored.id());
        }

        @Test
        @DisplayName("should keep a caller supplied timestamp and risk level")
        void shouldKeepCallerValues() {
            when(queue.enqueue(any())).thenReturn(true);
            final var at = NOW.minusSeconds(60);

            logger.record(authEvent(AuditActions.LOGIN_SUCCESS, true)
                            .timestamp(at)
                            .riskLevel(RiskLevel.CRITICAL)
                            .build())
                    .await()
                    .atMost(TIMEOUT);

            final var stored = repository.snapshot().get(0);
            assertEquals(at, stored.timestamp());
            assertEquals(RiskLevel.CRITICAL, stored.riskLevel());
        }

        @Test
        @DisplayName("should store identities in normalised form")
        void shouldNormaliseIdentity() {
            when(queue.enqueue(any())).thenReturn(true);

            logger.recordComplianceEvent(AuditEvent.builder(AuditEventType.DATA_ACCESS, "READ")
                            .identity("  Nurse@Clinic.ORG ")
                            .resource("patient", "patient-1")
                            .success(true)
                            .build())
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("nurse@clinic.org", repository.snapshot().get(0).identity());
        }

        @Test
        @DisplayName("should drop metadata entries without a value")
        void shouldDropNullMetadataValues() {
            when(queue.enqueue(any())).thenReturn(true);
            final var metadata = new HashMap<String, Object>();
            metadata.put("note", null);
            metadata.put("ward", "3B");

            logger.recordComplianceEvent(AuditEvent.builder(AuditEventType.DATA_ACCESS, "READ")
                            .identity("nurse@clinic.org")
                            .metadata(metadata)
                            .success(true)
                            .build())
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(Map.of("ward", "3B"), repository.snapshot().get(0).metadata());
        }

        @Test
        @DisplayName("should hand the recorded event to compliance analysis")
        void shouldEnqueueAfterAppend() {
            when(queue.enqueue(any())).thenReturn(true);

            logger.record(authEvent(AuditActions.LOGIN_SUCCESS, true).build()).await().atMost(TIMEOUT);

            verify(queue).enqueue(repository.snapshot().get(0));
        }

        @Test
        @DisplayName("should not fail the caller when the queue is full")
        void shouldTolerateFullQueue() {
            when(queue.enqueue(any())).thenReturn(false);

            assertDoesNotThrow(() -> logger.record(authEvent(AuditActions.LOGIN_SUCCESS, true).build())
                    .await()
                    .atMost(TIMEOUT));
            assertEquals(1, repository.snapshot().size());
        }
    }

    @Nested
    @DisplayName("sink failures")
    class SinkFailureTests {

        @Mock
        private AuditEventRepository brokenSink;

        @BeforeEach
        void setUp() {
            when(brokenSink.append(any())).thenReturn(Uni.createFrom().failure(new RuntimeException("disk full")));
        }

        @Test
        @DisplayName("should log and continue in non-blocking mode")
        void shouldContinueWhenNonBlocking() {
            final var logger = new AuditLogger(TestConfigs.audit(false), brokenSink, queue, clock);

            assertDoesNotThrow(() -> logger.record(authEvent(AuditActions.FAILED_LOGIN, false).build())
                    .await()
                    .atMost(TIMEOUT));
            verify(queue, never()).enqueue(any());
        }

        @Test
        @DisplayName("should fail the caller in blocking mode")
        void shouldFailWhenBlocking() {
            final var logger = new AuditLogger(TestConfigs.audit(true), brokenSink, queue, clock);

            final var uni = logger.record(authEvent(AuditActions.FAILED_LOGIN, false).build());

            final var error = assertThrows(StoreUnavailableException.class, () -> uni.await().atMost(TIMEOUT));
            assertTrue(error.getMessage().contains("audit-sink"));
        }
    }

    @Nested
    @DisplayName("assessRisk()")
    class AssessRiskTests {

        @Test
        @DisplayName("should rate a failed login medium")
        void failedLoginIsMedium() {
            assertEquals(RiskLevel.MEDIUM, AuditLogger.assessRisk(authEvent(AuditActions.FAILED_LOGIN, false).build()));
        }

        @Test
        @DisplayName("should rate the locking failure high")
        void lockingFailureIsHigh() {
            final var event = authEvent(AuditActions.FAILED_LOGIN, false)
                    .metadata(Map.of("locked", true))
                    .build();

            assertEquals(RiskLevel.HIGH, AuditLogger.assessRisk(event));
        }

        @Test
        @DisplayName("should rate an attempt against a locked account high")
        void lockedAccountIsHigh() {
            assertEquals(RiskLevel.HIGH, AuditLogger.assessRisk(authEvent(AuditActions.ACCOUNT_LOCKED, false).build()));
        }

        @Test
        @DisplayName("should rate a denied authorization medium")
        void deniedAuthorizationIsMedium() {
            final var event = AuditEvent.builder(AuditEventType.AUTHORIZATION, AuditActions.ACCESS_CHECK)
                    .success(false)
                    .build();

            assertEquals(RiskLevel.MEDIUM, AuditLogger.assessRisk(event));
        }

        @Test
        @DisplayName("should rate data modification medium and data access low")
        void dataEvents() {
            assertEquals(
                    RiskLevel.MEDIUM,
                    AuditLogger.assessRisk(AuditEvent.builder(AuditEventType.DATA_MODIFICATION, "UPDATE")
                            .success(true)
                            .build()));
            assertEquals(
                    RiskLevel.LOW,
                    AuditLogger.assessRisk(AuditEvent.builder(AuditEventType.DATA_ACCESS, "READ")
                            .success(true)
                            .build()));
        }
    }
}
