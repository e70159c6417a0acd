package careguard.support;

import static io.restassured.RestAssured.given;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import io.quarkus.arc.ClientProxy;
import io.restassured.http.ContentType;
import io.restassured.response.Response;

import careguard.adapter.out.storage.memory.InMemoryCredentialStore;
import careguard.core.model.account.Account;
import careguard.core.port.out.CredentialStore;
import careguard.core.service.auth.CredentialVerifier;

/**
 * Shared helpers for tests that drive the running application over HTTP.
 *
 * <p>The application instance is shared by every {@code @QuarkusTest}, so
 * each test works with its own identities and its own origin address to keep
 * the attempt counters of one test out of another.
 */
public final class RestFixtures {

    public static final String PASSWORD = "correct horse battery staple";
    public static final String FORWARDED_FOR = "X-Forwarded-For";

    private static final AtomicInteger ORIGINS = new AtomicInteger();

    private RestFixtures() {}

    public static String uniqueIdentity(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "@clinic.org";
    }

    public static String nextOrigin() {
        final var n = ORIGINS.incrementAndGet();
        return "10.20." + (n / 250) + "." + (n % 250 + 1);
    }

    /**
     * Add an account to the in-memory directory the test profile runs with.
     */
    public static Account addAccount(
            CredentialStore store, CredentialVerifier verifier, String identity, String role, String mfaSecret) {
        final var account =
                new Account(identity, verifier.hash(PASSWORD), role, Set.of(), 0, null, mfaSecret);
        ((InMemoryCredentialStore) ClientProxy.unwrap(store)).put(account);
        return account;
    }

    public static Response login(String identity, String secret, String origin) {
        return given().contentType(ContentType.JSON)
                .header(FORWARDED_FOR, origin)
                .body("""
                        {"identity": "%s", "secret": "%s"}
                        """.formatted(identity, secret))
                .when()
                .post("/auth/login");
    }

    public static String token(String identity, String origin) {
        return login(identity, PASSWORD, origin).then().statusCode(200).extract().path("token");
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }
}
