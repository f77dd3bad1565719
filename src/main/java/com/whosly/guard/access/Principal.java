package com.whosly.guard.access;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The authenticated caller whose SQL is being checked, as described by the
 * role-permission source.
 */
public final class Principal {

    private static final Set<String> ADMIN_ROLES = Set.of("super_admin", "admin");

    private final String id;
    private final boolean admin;
    private final Set<String> roles;
    private final Set<String> permissions;

    public Principal(String id, boolean admin, Collection<String> roles, Collection<String> permissions) {
        this.id = id;
        this.admin = admin;
        this.roles = roles == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        this.permissions = permissions == null
                ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }

    /**
     * Builds a principal from token claims; holders of {@code admin} or
     * {@code super_admin} are administrators.
     */
    public static Principal fromRoles(String id, Collection<String> roles, Collection<String> permissions) {
        boolean admin = roles != null && roles.stream().anyMatch(ADMIN_ROLES::contains);
        return new Principal(id, admin, roles, permissions);
    }

    public static Principal user(String id, Collection<String> permissions) {
        return new Principal(id, false, Collections.emptySet(), permissions);
    }

    public static Principal admin(String id) {
        return new Principal(id, true, Collections.singleton("admin"), Collections.emptySet());
    }

    public static Principal anonymous() {
        return new Principal(null, false, Collections.emptySet(), Collections.emptySet());
    }

    /**
     * @return the principal id, null when the caller is not authenticated
     */
    public String getId() {
        return id;
    }

    public boolean isAuthenticated() {
        return id != null && !id.isEmpty();
    }

    public boolean isAdmin() {
        return admin;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public Set<String> getPermissions() {
        return permissions;
    }

    @Override
    public String toString() {
        return "Principal{id=" + id + ", admin=" + admin + ", roles=" + roles + '}';
    }
}
