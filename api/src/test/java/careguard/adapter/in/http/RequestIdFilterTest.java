package careguard.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RequestIdFilter")
class RequestIdFilterTest {

    @ParameterizedTest
    @ValueSource(strings = {"abc-123", "7f3c2a9e.trace_01", "550e8400-e29b-41d4-a716-446655440000"})
    @DisplayName("should accept simple request ids")
    void shouldAcceptSimpleIds(String id) {
        assertTrue(RequestIdFilter.isAcceptable(id));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"id with spaces", "line\nbreak", "<script>", "a/b"})
    @DisplayName("should reject ids that could corrupt logs")
    void shouldRejectUnsafeIds(String id) {
        assertFalse(RequestIdFilter.isAcceptable(id));
    }

    @Test
    @DisplayName("should reject overly long ids")
    void shouldRejectLongIds() {
        assertFalse(RequestIdFilter.isAcceptable("a".repeat(65)));
        assertTrue(RequestIdFilter.isAcceptable("a".repeat(64)));
    }
}
