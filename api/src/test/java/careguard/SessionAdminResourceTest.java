package careguard;

import static careguard.support.RestFixtures.FORWARDED_FOR;
import static careguard.support.RestFixtures.bearer;
import static careguard.support.RestFixtures.nextOrigin;
import static careguard.support.RestFixtures.token;
import static careguard.support.RestFixtures.uniqueIdentity;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import careguard.core.port.out.CredentialStore;
import careguard.core.service.auth.CredentialVerifier;
import careguard.support.RestFixtures;

@QuarkusTest
@DisplayName("Session Admin Resource Tests")
public class SessionAdminResourceTest {

    @Inject
    CredentialStore credentialStore;

    @Inject
    CredentialVerifier verifier;

    private String origin;
    private String adminToken;
    private String nurse;

    @BeforeEach
    void setUp() {
        origin = nextOrigin();
        final var admin = uniqueIdentity("admin");
        RestFixtures.addAccount(credentialStore, verifier, admin, "admin", null);
        adminToken = token(admin, origin);
        nurse = uniqueIdentity("nurse");
        RestFixtures.addAccount(credentialStore, verifier, nurse, "nurse", null);
    }

    private int authorizeStatus(String token) {
        return given().contentType(ContentType.JSON)
                .header("Authorization", bearer(token))
                .header(FORWARDED_FOR, origin)
                .body("""
                        {"resource": "patient-records", "action": "read"}
                        """)
                .when()
                .post("/auth/authorize")
                .then()
                .extract()
                .statusCode();
    }

    @Test
    @DisplayName("should revoke every session of an identity")
    void shouldRevokeAllSessions() {
        final var laptop = token(nurse, origin);
        final var tablet = token(nurse, origin);

        given().header("Authorization", bearer(adminToken))
                .header(FORWARDED_FOR, origin)
                .when()
                .delete("/admin/sessions/" + nurse)
                .then()
                .statusCode(200)
                .body("identity", equalTo(nurse))
                .body("revoked", equalTo(2));

        assertEquals(401, authorizeStatus(laptop));
        assertEquals(401, authorizeStatus(tablet));
        assertEquals(200, authorizeStatus(adminToken));
    }

    @Test
    @DisplayName("should report zero for an identity without sessions")
    void shouldReportZeroWithoutSessions() {
        given().header("Authorization", bearer(adminToken))
                .header(FORWARDED_FOR, origin)
                .when()
                .delete("/admin/sessions/" + uniqueIdentity("ghost"))
                .then()
                .statusCode(200)
                .body("revoked", equalTo(0));
    }

    @Test
    @DisplayName("should return 403 for a role without session permissions")
    void shouldForbidNurse() {
        final var nurseToken = token(nurse, origin);

        given().header("Authorization", bearer(nurseToken))
                .header(FORWARDED_FOR, origin)
                .when()
                .delete("/admin/sessions/" + nurse)
                .then()
                .statusCode(403);

        assertEquals(200, authorizeStatus(nurseToken));
    }
}
