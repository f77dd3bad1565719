package com.whosly.guard.access;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrincipalTest {

    @Test
    void testAdminRoles() {
        assertThat(Principal.fromRoles("u1", List.of("viewer", "super_admin"), List.of()).isAdmin()).isTrue();
        assertThat(Principal.fromRoles("u1", List.of("admin"), null).isAdmin()).isTrue();
        assertThat(Principal.fromRoles("u1", List.of("analyst"), List.of("table:select")).isAdmin()).isFalse();
        assertThat(Principal.fromRoles("u1", null, null).isAdmin()).isFalse();
    }

    @Test
    void testAuthentication() {
        assertThat(Principal.user("u1", List.of()).isAuthenticated()).isTrue();
        assertThat(Principal.anonymous().isAuthenticated()).isFalse();
        assertThat(Principal.user("", List.of()).isAuthenticated()).isFalse();
    }

    @Test
    void testPermissionsAreCopied() {
        Principal principal = Principal.user("u1", List.of("table:select", "table:select", "table:view"));

        assertThat(principal.getPermissions()).containsExactly("table:select", "table:view");
        assertThat(principal.getRoles()).isEmpty();
    }
}
