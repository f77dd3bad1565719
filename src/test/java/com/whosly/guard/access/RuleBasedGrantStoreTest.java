package com.whosly.guard.access;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedGrantStoreTest {

    @Test
    void testSystemDatabasesAllowedByDefault() {
        RuleBasedGrantStore store = new RuleBasedGrantStore();

        AccessCheckResult result = store.check("u1", "system", "query_log", AccessType.READ, null);

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getReason()).isEqualTo("System database access allowed by default");
    }

    @Test
    void testSystemDatabasesCanBeRestricted() {
        RuleBasedGrantStore store = new RuleBasedGrantStore(false);

        AccessCheckResult result = store.check("u1", "system", "query_log", AccessType.READ, null);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).isEqualTo("No access rules defined");
    }

    @Test
    void testNoMatchingRuleDenies() {
        RuleBasedGrantStore store = new RuleBasedGrantStore()
                .addRule(DataAccessRule.forUser("u1", "analytics", "*", true, 0));

        assertThat(store.check("u1", "analytics", "events", AccessType.READ, null).isAllowed()).isTrue();
        AccessCheckResult other = store.check("u1", "billing", "invoices", AccessType.READ, null);
        assertThat(other.isAllowed()).isFalse();
        assertThat(other.getReason()).isEqualTo("No matching access rule");
        assertThat(store.check("u2", "analytics", "events", AccessType.READ, null).getReason())
                .isEqualTo("No access rules defined");
    }

    @Test
    void testHigherPriorityWins() {
        RuleBasedGrantStore store = new RuleBasedGrantStore()
                .addRule(DataAccessRule.forUser("u1", "analytics", "*", true, 0))
                .addRule(DataAccessRule.forUser("u1", "analytics", "salaries", false, 10));

        AccessCheckResult salaries = store.check("u1", "analytics", "salaries", AccessType.READ, null);

        assertThat(salaries.isAllowed()).isFalse();
        assertThat(salaries.getReason()).isEqualTo("Denied by rule: analytics.salaries");
        assertThat(store.check("u1", "analytics", "events", AccessType.READ, null).getReason())
                .isEqualTo("Allowed by rule: analytics.*");
    }

    @Test
    void testDenyWinsAtEqualPriority() {
        RuleBasedGrantStore store = new RuleBasedGrantStore()
                .addRule(DataAccessRule.forUser("u1", "*", "*", true, 5))
                .addRule(DataAccessRule.forUser("u1", "hr", "*", false, 5));

        assertThat(store.check("u1", "hr", "people", AccessType.READ, null).isAllowed()).isFalse();
        assertThat(store.check("u1", "sales", "leads", AccessType.READ, null).isAllowed()).isTrue();
    }

    @Test
    void testRoleRulesApplyToMembers() {
        RuleBasedGrantStore store = new RuleBasedGrantStore()
                .addRule(DataAccessRule.forRole("analyst", "sales_*", "*", true, 0))
                .assignRole("u1", "analyst");

        assertThat(store.check("u1", "sales_2024", "orders", AccessType.READ, null).isAllowed()).isTrue();
        assertThat(store.check("u2", "sales_2024", "orders", AccessType.READ, null).isAllowed()).isFalse();
    }

    @Test
    void testConnectionScopedRules() {
        RuleBasedGrantStore store = new RuleBasedGrantStore()
                .addRule(DataAccessRule.forUser("u1", "db", "*", true, 0).onConnection("c1"));

        assertThat(store.check("u1", "db", "t", AccessType.READ, "c1").isAllowed()).isTrue();
        assertThat(store.check("u1", "db", "t", AccessType.READ, null).isAllowed()).isTrue();
        assertThat(store.check("u1", "db", "t", AccessType.READ, "c2").isAllowed()).isFalse();
        assertThat(store.rulesFor("u1", "c2")).isEmpty();
    }

    @Test
    void testDatabaseOnlyCheckIgnoresTablePattern() {
        RuleBasedGrantStore store = new RuleBasedGrantStore()
                .addRule(DataAccessRule.forUser("u1", "analytics", "events", true, 0));

        assertThat(store.check("u1", "analytics", null, AccessType.READ, null).isAllowed()).isTrue();
        assertThat(store.check("u1", "analytics", "other", AccessType.READ, null).isAllowed()).isFalse();
    }
}
