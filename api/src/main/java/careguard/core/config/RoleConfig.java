package careguard.core.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;

/**
 * Role to permission mapping.
 *
 * <p>Configuration prefix: {@code careguard.authorization}
 *
 * <pre>
 * careguard.authorization.roles.doctor.permissions=patients:read,appointments:*
 * careguard.authorization.roles.admin.permissions=*:*
 * </pre>
 */
@ConfigMapping(prefix = "careguard.authorization")
public interface RoleConfig {

    /**
     * Permissions granted per role name.
     */
    Map<String, RolePermissions> roles();

    interface RolePermissions {

        List<String> permissions();
    }
}
