package careguard;

import static careguard.support.RestFixtures.FORWARDED_FOR;
import static careguard.support.RestFixtures.PASSWORD;
import static careguard.support.RestFixtures.bearer;
import static careguard.support.RestFixtures.login;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import careguard.core.model.session.SessionClaims;
import careguard.core.service.session.SessionTokenService;

/**
 * Runs against a Redis address nothing listens on, so every store call fails.
 */
@QuarkusTest
@TestProfile(StoreOutageTest.UnreachableRedisProfile.class)
@DisplayName("Store Outage Tests")
public class StoreOutageTest {

    private static final String ORIGIN = "10.30.0.1";

    @Inject
    SessionTokenService tokenService;

    public static class UnreachableRedisProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.ofEntries(
                    Map.entry("careguard.storage.provider", "redis"),
                    Map.entry("careguard.storage.timeout", "PT1S"),
                    Map.entry("quarkus.redis.hosts", "redis://127.0.0.1:1"));
        }
    }

    @Test
    @DisplayName("should answer a login with 503 when the stores are unreachable")
    void shouldFailLoginClosed() {
        login("nurse@clinic.org", PASSWORD, ORIGIN)
                .then()
                .statusCode(503)
                .contentType("application/problem+json")
                .body("detail", equalTo("Service temporarily unavailable"));
    }

    @Test
    @DisplayName("should answer a well-signed token with 503, not 401, when the session store is unreachable")
    void shouldReportSessionStoreOutage() {
        final var now = Instant.now();
        final var token = tokenService.sign(new SessionClaims(
                "nurse@clinic.org", "nurse", Set.of(), "session-1", now, now.plus(Duration.ofHours(1))));

        given().contentType(ContentType.JSON)
                .header("Authorization", bearer(token))
                .header(FORWARDED_FOR, ORIGIN)
                .body("""
                        {"resource": "patient-records", "action": "read"}
                        """)
                .when()
                .post("/auth/authorize")
                .then()
                .statusCode(503)
                .body("detail", equalTo("Service temporarily unavailable"));
    }
}
