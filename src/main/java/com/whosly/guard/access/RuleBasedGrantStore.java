package com.whosly.guard.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory grant store evaluating {@link DataAccessRule}s.
 * <p>
 * Rules of the user and of the user's roles apply; a rule bound to a connection
 * applies only when that connection is asked about, or when no connection is given.
 * The highest priority matching rule decides, deny before allow at equal priority.
 * No matching rule means no access. The server metadata databases are readable by
 * default unless {@code systemDatabasesAllowed} is turned off.
 */
public class RuleBasedGrantStore implements DataAccessGrantStore {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedGrantStore.class);

    public static final Set<String> SYSTEM_DATABASES = Set.of("system", "information_schema", "INFORMATION_SCHEMA");

    private static final Comparator<DataAccessRule> EVALUATION_ORDER =
            Comparator.comparingInt(DataAccessRule::getPriority).reversed()
                    .thenComparing(DataAccessRule::isAllowed);

    private final List<DataAccessRule> rules = new CopyOnWriteArrayList<>();
    private final Map<String, Set<String>> userRoles = new ConcurrentHashMap<>();
    private final boolean systemDatabasesAllowed;

    public RuleBasedGrantStore() {
        this(true);
    }

    public RuleBasedGrantStore(boolean systemDatabasesAllowed) {
        this.systemDatabasesAllowed = systemDatabasesAllowed;
    }

    public RuleBasedGrantStore addRule(DataAccessRule rule) {
        rules.add(rule);
        return this;
    }

    public RuleBasedGrantStore assignRole(String userId, String roleId) {
        userRoles.computeIfAbsent(userId, key -> ConcurrentHashMap.newKeySet()).add(roleId);
        return this;
    }

    @Override
    public AccessCheckResult check(String userId, String database, String table, AccessType accessType,
                                   String connectionId) {
        if (systemDatabasesAllowed && SYSTEM_DATABASES.contains(database)) {
            return AccessCheckResult.allow("System database access allowed by default");
        }

        List<DataAccessRule> applicable = rulesFor(userId, connectionId);
        if (applicable.isEmpty()) {
            return AccessCheckResult.deny("No access rules defined");
        }

        applicable.sort(EVALUATION_ORDER);
        for (DataAccessRule rule : applicable) {
            if (rule.matches(database, table)) {
                log.debug("Rule {} decides {}.{} for user {}", rule, database, table, userId);
                return rule.isAllowed()
                        ? AccessCheckResult.allow("Allowed by rule: " + rule.getDatabasePattern() + "." + rule.getTablePattern())
                        : AccessCheckResult.deny("Denied by rule: " + rule.getDatabasePattern() + "." + rule.getTablePattern());
            }
        }
        return AccessCheckResult.deny("No matching access rule");
    }

    List<DataAccessRule> rulesFor(String userId, String connectionId) {
        Set<String> roles = userRoles.getOrDefault(userId, Collections.emptySet());
        List<DataAccessRule> applicable = new ArrayList<>();
        for (DataAccessRule rule : rules) {
            boolean owned = userId.equals(rule.getUserId()) || (rule.getRoleId() != null && roles.contains(rule.getRoleId()));
            boolean onConnection = connectionId == null || rule.getConnectionId() == null
                    || connectionId.equals(rule.getConnectionId());
            if (owned && onConnection) {
                applicable.add(rule);
            }
        }
        return applicable;
    }
}
