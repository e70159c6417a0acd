package careguard.core.service.auth;

import java.util.Collection;

/**
 * Matches {@code resource:action} permissions with wildcard support.
 *
 * <p>A required permission is satisfied by the exact grant, by
 * {@code resource:*}, or by the global wildcard {@code *:*}.
 */
public final class PermissionMatcher {

    public static final String GLOBAL_WILDCARD = "*:*";

    private PermissionMatcher() {}

    public static String permission(String resource, String action) {
        return resource + ":" + action;
    }

    /**
     * Check whether any grant satisfies the resource and action.
     *
     * @param grants   granted permissions (may be null)
     * @param resource resource name
     * @param action   action name
     * @return true if a grant matches
     */
    public static boolean matches(Collection<String> grants, String resource, String action) {
        if (grants == null || grants.isEmpty() || resource == null || action == null) {
            return false;
        }
        return grants.contains(permission(resource, action))
                || grants.contains(permission(resource, "*"))
                || grants.contains(GLOBAL_WILDCARD);
    }
}
