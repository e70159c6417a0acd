package careguard;

import static careguard.support.RestFixtures.FORWARDED_FOR;
import static careguard.support.RestFixtures.bearer;
import static careguard.support.RestFixtures.nextOrigin;
import static careguard.support.RestFixtures.token;
import static careguard.support.RestFixtures.uniqueIdentity;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationSeverity;
import careguard.core.model.compliance.ViolationType;
import careguard.core.port.out.AuditEventRepository;
import careguard.core.port.out.CredentialStore;
import careguard.core.port.out.ViolationRepository;
import careguard.core.service.auth.CredentialVerifier;
import careguard.support.RestFixtures;

@QuarkusTest
@DisplayName("Compliance Resource Tests")
public class ComplianceResourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Inject
    CredentialStore credentialStore;

    @Inject
    CredentialVerifier verifier;

    @Inject
    AuditEventRepository auditEventRepository;

    @Inject
    ViolationRepository violationRepository;

    private String origin;
    private String officerToken;
    private String auditorToken;

    @BeforeEach
    void setUp() {
        origin = nextOrigin();
        final var officer = uniqueIdentity("officer");
        RestFixtures.addAccount(credentialStore, verifier, officer, "compliance-officer", null);
        officerToken = token(officer, origin);
        final var auditor = uniqueIdentity("auditor");
        RestFixtures.addAccount(credentialStore, verifier, auditor, "auditor", null);
        auditorToken = token(auditor, origin);
    }

    @Nested
    @DisplayName("POST /compliance/events")
    class EventIntakeTests {

        private Response submit(String token, String body) {
            return given().contentType(ContentType.JSON)
                    .header("Authorization", bearer(token))
                    .header(FORWARDED_FOR, origin)
                    .body(body)
                    .when()
                    .post("/compliance/events");
        }

        @Test
        @DisplayName("should accept an event with 202 and store it under the normalised identity")
        void shouldAcceptEvent() {
            final var subject = uniqueIdentity("nurse");

            submit(officerToken, """
                            {
                                "type": "DATA_ACCESS",
                                "identity": "  %s ",
                                "resourceType": "patient-record",
                                "resourceId": "p-17",
                                "action": "READ",
                                "originAddress": "10.0.0.1",
                                "metadata": {"note": null, "ward": "3B"}
                            }
                            """.formatted(subject.toUpperCase(Locale.ROOT)))
                    .then()
                    .statusCode(202);

            final var stored = auditEventRepository
                    .findByIdentitySince(subject, Instant.EPOCH)
                    .await()
                    .atMost(TIMEOUT);
            assertEquals(1, stored.size());
            assertEquals(Map.of("ward", "3B"), stored.get(0).metadata());
        }

        @Test
        @DisplayName("should return 400 when the event type is missing")
        void shouldRequireType() {
            submit(officerToken, """
                            {"identity": "nurse@clinic.org", "action": "READ"}
                            """)
                    .then()
                    .statusCode(400)
                    .contentType("application/problem+json");
        }

        @Test
        @DisplayName("should answer a rejected event with a fixed detail")
        void shouldNotEchoValidationMessage() {
            submit(officerToken, """
                            {"type": "DATA_ACCESS", "identity": "nurse@clinic.org", "action": "   "}
                            """)
                    .then()
                    .statusCode(400)
                    .body("detail", equalTo("The request is invalid"));
        }

        @Test
        @DisplayName("should return 403 for a role without audit-events:write")
        void shouldForbidAuditor() {
            submit(auditorToken, """
                            {"type": "DATA_ACCESS", "identity": "nurse@clinic.org", "action": "READ"}
                            """)
                    .then()
                    .statusCode(403);
        }
    }

    @Nested
    @DisplayName("violation review")
    class ViolationTests {

        private String violationId;

        @BeforeEach
        void seedViolation() {
            final var violation = ComplianceViolation.open(
                    ViolationType.BULK_DATA_ACCESS,
                    ViolationSeverity.HIGH,
                    "Bulk read of patient records",
                    uniqueIdentity("nurse"),
                    "p-1",
                    Instant.now(),
                    UUID.randomUUID().toString());
            violationRepository.saveIfAbsent(violation).await().atMost(TIMEOUT);
            violationId = violation.id();
        }

        private Response transition(String token, String id, String status) {
            return given().contentType(ContentType.JSON)
                    .header("Authorization", bearer(token))
                    .header(FORWARDED_FOR, origin)
                    .body("""
                            {"status": "%s"}
                            """.formatted(status))
                    .when()
                    .put("/compliance/violations/" + id + "/status");
        }

        @Test
        @DisplayName("should list open violations for a reader")
        void shouldListOpenViolations() {
            given().header("Authorization", bearer(auditorToken))
                    .header(FORWARDED_FOR, origin)
                    .queryParam("status", "OPEN")
                    .when()
                    .get("/compliance/violations")
                    .then()
                    .statusCode(200)
                    .body("id", hasItem(violationId));
        }

        @Test
        @DisplayName("should move a violation forward and drop it from the open list")
        void shouldTransitionForward() {
            transition(officerToken, violationId, "REVIEWED")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("REVIEWED"));

            given().header("Authorization", bearer(auditorToken))
                    .header(FORWARDED_FOR, origin)
                    .queryParam("status", "OPEN")
                    .when()
                    .get("/compliance/violations")
                    .then()
                    .statusCode(200)
                    .body("id", not(hasItem(violationId)));
        }

        @Test
        @DisplayName("should return 409 with a fixed detail for a backward transition")
        void shouldRejectBackwardTransition() {
            transition(officerToken, violationId, "CLOSED").then().statusCode(200);

            transition(officerToken, violationId, "REVIEWED")
                    .then()
                    .statusCode(409)
                    .contentType("application/problem+json")
                    .body("detail", equalTo("The request conflicts with the current state of the resource"));
        }

        @Test
        @DisplayName("should return 404 for an unknown violation")
        void shouldReturn404ForUnknownViolation() {
            transition(officerToken, "no-such-violation", "REVIEWED").then().statusCode(404);
        }

        @Test
        @DisplayName("should return 400 for an unknown status")
        void shouldRejectUnknownStatus() {
            transition(officerToken, violationId, "ESCALATED").then().statusCode(400);
        }

        @Test
        @DisplayName("should return 403 when a reader tries to change a violation")
        void shouldForbidAuditorTransition() {
            transition(auditorToken, violationId, "REVIEWED").then().statusCode(403);
        }
    }
}
