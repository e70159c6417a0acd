package careguard.adapter.out.storage.redis;

import java.util.ArrayList;
import java.util.List;

import io.vertx.mutiny.redis.client.Response;

/**
 * Key layout and response helpers shared by the Redis repositories.
 *
 * <p>Keys, all under the configured prefix:
 * <ul>
 *   <li>{@code account:{identity}} - account hash (user directory)</li>
 *   <li>{@code counter:{key}} - attempt counter hash {@code count}, {@code start_ms}</li>
 *   <li>{@code session:{id}} - session value</li>
 *   <li>{@code session-index:{identity}} - set of session ids</li>
 *   <li>{@code audit:{identity}} - sorted set of audit events scored by timestamp</li>
 *   <li>{@code origins:{identity}} - sorted set of origins scored by last-seen time</li>
 *   <li>{@code violation:{id}} - violation value</li>
 *   <li>{@code violations:status:{status}} - set of violation ids</li>
 *   <li>{@code violations:raised:{identity}:{type}} - sorted set of violation ids scored by timestamp</li>
 * </ul>
 */
final class RedisKeys {

    private final String prefix;

    RedisKeys(String prefix) {
        this.prefix = prefix;
    }

    String account(String identity) {
        return prefix + "account:" + identity;
    }

    String counter(String key) {
        return prefix + "counter:" + key;
    }

    String session(String id) {
        return prefix + "session:" + id;
    }

    String sessionIndex(String identity) {
        return prefix + "session-index:" + identity;
    }

    String audit(String identity) {
        return prefix + "audit:" + (identity != null ? identity : "anonymous");
    }

    String origins(String identity) {
        return prefix + "origins:" + identity;
    }

    String violation(String id) {
        return prefix + "violation:" + id;
    }

    String violationStatus(String status) {
        return prefix + "violations:status:" + status;
    }

    String violationsRaised(String identity, String type) {
        return prefix + "violations:raised:" + identity + ":" + type;
    }

    static List<String> strings(Response response) {
        final var result = new ArrayList<String>();
        if (response == null) {
            return result;
        }
        for (var i = 0; i < response.size(); i++) {
            result.add(response.get(i).toString());
        }
        return result;
    }

    static List<Long> longs(Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from Redis");
        }
        final var result = new ArrayList<Long>(response.size());
        for (var i = 0; i < response.size(); i++) {
            result.add(response.get(i).toLong());
        }
        return result;
    }
}
