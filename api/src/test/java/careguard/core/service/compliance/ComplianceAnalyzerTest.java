package careguard.core.service.compliance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import careguard.adapter.out.storage.memory.InMemoryAuditEventRepository;
import careguard.adapter.out.storage.memory.InMemoryOriginHistoryRepository;
import careguard.adapter.out.storage.memory.InMemoryViolationRepository;
import careguard.core.config.ComplianceConfig;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationSeverity;
import careguard.core.model.compliance.ViolationStatus;
import careguard.core.model.compliance.ViolationType;
import careguard.core.port.out.AlertPublishing;
import careguard.support.TestConfigs;

@DisplayName("ComplianceAnalyzer")
@ExtendWith(MockitoExtension.class)
class ComplianceAnalyzerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    // Tuesday, inside business hours
    private static final Instant WEEKDAY_MORNING = Instant.parse("2024-03-05T10:00:00Z");
    private static final Instant WEEKDAY_NIGHT = Instant.parse("2024-03-05T22:00:00Z");
    private static final Instant SATURDAY_NOON = Instant.parse("2024-03-09T12:00:00Z");
    private static final String IDENTITY = "nurse@clinic.org";
    private static final String HOME = "10.0.0.1";

    @Mock
    private AlertPublishing alerts;

    private ComplianceConfig config;
    private InMemoryAuditEventRepository auditRepository;
    private InMemoryOriginHistoryRepository originRepository;
    private InMemoryViolationRepository violationRepository;
    private ComplianceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        config = TestConfigs.compliance();
        auditRepository = new InMemoryAuditEventRepository();
        originRepository = new InMemoryOriginHistoryRepository();
        violationRepository = new InMemoryViolationRepository();
        analyzer = newAnalyzer();
    }

    private ComplianceAnalyzer newAnalyzer() {
        return new ComplianceAnalyzer(config, auditRepository, originRepository, violationRepository, alerts);
    }

    private AuditEvent.Builder dataAccess(Instant at, String origin) {
        return AuditEvent.builder(AuditEventType.DATA_ACCESS, "READ")
                .identity(IDENTITY)
                .resource("patient-record", "p-1")
                .originAddress(origin)
                .timestamp(at)
                .success(true);
    }

    private AuditEvent.Builder failedLogin(Instant at) {
        return AuditEvent.builder(AuditEventType.AUTHENTICATION, AuditActions.FAILED_LOGIN)
                .identity(IDENTITY)
                .originAddress(HOME)
                .timestamp(at)
                .success(false);
    }

    /** Append to the audit trail, then analyse, as the pipeline does. */
    private List<ComplianceViolation> deliver(AuditEvent event) {
        auditRepository.append(event).await().atMost(TIMEOUT);
        return analyzer.analyze(event).await().atMost(TIMEOUT);
    }

    private static long countOf(List<ComplianceViolation> violations, ViolationType type) {
        return violations.stream().filter(v -> v.type() == type).count();
    }

    @Nested
    @DisplayName("bulk data access")
    class BulkAccessTests {

        @Test
        @DisplayName("should raise exactly one HIGH violation when 101 records are read within the window")
        void shouldRaiseOnceForBurst() {
            final var raised = new ArrayList<ComplianceViolation>();
            for (int i = 0; i < 101; i++) {
                raised.addAll(deliver(dataAccess(WEEKDAY_MORNING.plusSeconds(i), HOME).build()));
            }

            final var bulk = raised.stream()
                    .filter(v -> v.type() == ViolationType.BULK_DATA_ACCESS)
                    .toList();
            assertEquals(1, bulk.size());
            assertEquals(ViolationSeverity.HIGH, bulk.get(0).severity());
            assertEquals(ViolationStatus.OPEN, bulk.get(0).status());
            assertEquals(IDENTITY, bulk.get(0).identity());
            verify(alerts).publish(bulk.get(0));
        }

        @Test
        @DisplayName("should not raise at exactly the threshold")
        void shouldNotRaiseAtThreshold() {
            final var raised = new ArrayList<ComplianceViolation>();
            for (int i = 0; i < 100; i++) {
                raised.addAll(deliver(dataAccess(WEEKDAY_MORNING.plusSeconds(i), HOME).build()));
            }

            assertEquals(0, countOf(raised, ViolationType.BULK_DATA_ACCESS));
        }

        @Test
        @DisplayName("should also flag the burst as rapid activity")
        void shouldFlagRapidActivity() {
            final var raised = new ArrayList<ComplianceViolation>();
            for (int i = 0; i < 51; i++) {
                raised.addAll(deliver(dataAccess(WEEKDAY_MORNING.plusSeconds(i), HOME).build()));
            }

            assertEquals(1, countOf(raised, ViolationType.SUSPICIOUS_ACCESS_PATTERN));
        }
    }

    @Nested
    @DisplayName("suspicious access pattern")
    class SuspiciousPatternTests {

        @Test
        @DisplayName("should not flag the first origin an identity uses")
        void shouldNotFlagFirstOrigin() {
            final var raised = deliver(dataAccess(WEEKDAY_MORNING, HOME).build());

            assertTrue(raised.isEmpty());
        }

        @Test
        @DisplayName("should raise HIGH for an origin not seen in the history window")
        void shouldFlagNewOrigin() {
            deliver(dataAccess(WEEKDAY_MORNING, HOME).build());

            final var raised = deliver(dataAccess(WEEKDAY_MORNING.plusSeconds(60), "203.0.113.7").build());

            assertEquals(1, raised.size());
            final var violation = raised.get(0);
            assertEquals(ViolationType.SUSPICIOUS_ACCESS_PATTERN, violation.type());
            assertEquals(ViolationSeverity.HIGH, violation.severity());
            assertTrue(violation.description().contains("203.0.113.7"));
            verify(alerts).publish(violation);
        }

        @Test
        @DisplayName("should compare against an origin seen 29 days earlier")
        void shouldFlagNewOriginAgainstHistoryInsideWindow() {
            deliver(dataAccess(WEEKDAY_MORNING.minus(Duration.ofDays(29)), HOME).build());

            final var raised = deliver(dataAccess(WEEKDAY_MORNING, "203.0.113.7").build());

            assertEquals(1, countOf(raised, ViolationType.SUSPICIOUS_ACCESS_PATTERN));
        }

        @Test
        @DisplayName("should not count an origin seen 31 days earlier as history")
        void shouldIgnoreHistoryOutsideWindow() {
            deliver(dataAccess(WEEKDAY_MORNING.minus(Duration.ofDays(31)), HOME).build());

            final var raised = deliver(dataAccess(WEEKDAY_MORNING, "203.0.113.7").build());

            assertEquals(0, countOf(raised, ViolationType.SUSPICIOUS_ACCESS_PATTERN));
        }

        @Test
        @DisplayName("should treat an origin last seen 31 days earlier as new again")
        void shouldForgetOriginOutsideWindow() {
            deliver(dataAccess(WEEKDAY_MORNING.minus(Duration.ofDays(31)), HOME).build());
            deliver(dataAccess(WEEKDAY_MORNING.minus(Duration.ofDays(1)), "198.51.100.4").build());

            final var raised = deliver(dataAccess(WEEKDAY_MORNING, HOME).build());

            assertEquals(1, countOf(raised, ViolationType.SUSPICIOUS_ACCESS_PATTERN));
        }

        @Test
        @DisplayName("should accept an origin once it has been recorded")
        void shouldRememberOrigin() {
            deliver(dataAccess(WEEKDAY_MORNING, HOME).build());

            final var raised = deliver(dataAccess(WEEKDAY_MORNING.plusSeconds(60), HOME).build());

            assertTrue(raised.isEmpty());
        }

        @Test
        @DisplayName("should ignore an unknown origin")
        void shouldIgnoreUnknownOrigin() {
            deliver(dataAccess(WEEKDAY_MORNING, HOME).build());

            final var raised = deliver(dataAccess(WEEKDAY_MORNING.plusSeconds(60), "unknown").build());

            assertTrue(raised.isEmpty());
            assertEquals(
                    1,
                    originRepository
                            .findOrigins(IDENTITY, WEEKDAY_MORNING.minus(Duration.ofDays(1)))
                            .await()
                            .atMost(TIMEOUT)
                            .size());
        }
    }

    @Nested
    @DisplayName("excessive failed logins")
    class FailedLoginTests {

        @Test
        @DisplayName("should raise MEDIUM on the fifth failure within the window without alerting")
        void shouldRaiseAtThreshold() {
            final var raised = new ArrayList<ComplianceViolation>();
            for (int i = 0; i < 5; i++) {
                raised.addAll(deliver(failedLogin(WEEKDAY_MORNING.plusSeconds(i * 10L)).build()));
            }

            assertEquals(1, raised.size());
            assertEquals(ViolationType.EXCESSIVE_FAILED_LOGINS, raised.get(0).type());
            assertEquals(ViolationSeverity.MEDIUM, raised.get(0).severity());
            verify(alerts, never()).publish(any());
        }

        @Test
        @DisplayName("should not count failures outside the window")
        void shouldIgnoreOldFailures() {
            final var raised = new ArrayList<ComplianceViolation>();
            for (int i = 0; i < 4; i++) {
                raised.addAll(deliver(failedLogin(WEEKDAY_MORNING.plusSeconds(i)).build()));
            }
            raised.addAll(deliver(failedLogin(WEEKDAY_MORNING.plus(Duration.ofHours(2))).build()));

            assertEquals(0, countOf(raised, ViolationType.EXCESSIVE_FAILED_LOGINS));
        }
    }

    @Nested
    @DisplayName("after-hours access")
    class AfterHoursTests {

        @Test
        @DisplayName("should raise MEDIUM for data access outside business hours")
        void shouldFlagNightAccess() {
            final var raised = deliver(dataAccess(WEEKDAY_NIGHT, HOME).build());

            assertEquals(1, raised.size());
            assertEquals(ViolationType.AFTER_HOURS_ACCESS, raised.get(0).type());
            assertEquals(ViolationSeverity.MEDIUM, raised.get(0).severity());
            assertTrue(raised.get(0).description().contains("outside business hours"));
        }

        @Test
        @DisplayName("should raise for weekend access even during the day")
        void shouldFlagWeekend() {
            final var raised = deliver(dataAccess(SATURDAY_NOON, HOME).build());

            assertEquals(1, raised.size());
            assertTrue(raised.get(0).description().contains("weekend"));
        }

        @Test
        @DisplayName("should ignore data modification at night")
        void shouldIgnoreModification() {
            final var event = AuditEvent.builder(AuditEventType.DATA_MODIFICATION, "UPDATE")
                    .identity(IDENTITY)
                    .originAddress(HOME)
                    .timestamp(WEEKDAY_NIGHT)
                    .success(true)
                    .build();

            assertTrue(deliver(event).isEmpty());
        }
    }

    @Nested
    @DisplayName("delivery and suppression")
    class DeliveryTests {

        @Test
        @DisplayName("should store nothing new when the same event is delivered twice")
        void shouldBeIdempotent() {
            when(config.suppressionWindow()).thenReturn(Duration.ZERO);
            analyzer = newAnalyzer();
            final var event = dataAccess(WEEKDAY_NIGHT, HOME).build();

            final var first = deliver(event);
            final var second = analyzer.analyze(event).await().atMost(TIMEOUT);

            assertEquals(1, first.size());
            assertTrue(second.isEmpty());
            assertEquals(1, violationRepository.size());
            assertEquals(ComplianceViolation.idFor(event.id(), ViolationType.AFTER_HOURS_ACCESS), first.get(0).id());
        }

        @Test
        @DisplayName("should suppress a repeat of the same type within the suppression window")
        void shouldSuppressRepeat() {
            deliver(dataAccess(WEEKDAY_NIGHT, HOME).build());

            final var repeat = deliver(dataAccess(WEEKDAY_NIGHT.plus(Duration.ofMinutes(5)), HOME).build());

            assertTrue(repeat.isEmpty());
            assertEquals(1, violationRepository.size());
        }

        @Test
        @DisplayName("should raise again once the suppression window has passed")
        void shouldRaiseAfterWindow() {
            deliver(dataAccess(WEEKDAY_NIGHT, HOME).build());

            final var later = deliver(dataAccess(WEEKDAY_NIGHT.plus(Duration.ofMinutes(20)), HOME).build());

            assertEquals(1, later.size());
            assertEquals(2, violationRepository.size());
        }

        @Test
        @DisplayName("should let several rules fire for one event")
        void shouldRunRulesIndependently() {
            deliver(dataAccess(WEEKDAY_MORNING, HOME).build());

            final var raised = deliver(dataAccess(WEEKDAY_NIGHT, "198.51.100.4").build());

            assertEquals(1, countOf(raised, ViolationType.AFTER_HOURS_ACCESS));
            assertEquals(1, countOf(raised, ViolationType.SUSPICIOUS_ACCESS_PATTERN));
        }

        @Test
        @DisplayName("should do nothing when analysis is disabled")
        void shouldSkipWhenDisabled() {
            when(config.enabled()).thenReturn(false);

            assertTrue(deliver(dataAccess(WEEKDAY_NIGHT, HOME).build()).isEmpty());
            assertEquals(0, violationRepository.size());
        }
    }
}
