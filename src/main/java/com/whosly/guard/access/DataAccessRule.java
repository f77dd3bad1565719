package com.whosly.guard.access;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A stored grant or denial binding a user or a role to databases and tables
 * matching a pattern. Patterns are {@code *}, {@code /regex/}, globs with
 * {@code *}, or exact names; all matching is case-insensitive.
 */
public final class DataAccessRule {

    private final String userId;
    private final String roleId;
    private final String connectionId;
    private final String databasePattern;
    private final String tablePattern;
    private final boolean allowed;
    private final int priority;

    private DataAccessRule(String userId, String roleId, String connectionId, String databasePattern,
                           String tablePattern, boolean allowed, int priority) {
        if (userId == null && roleId == null) {
            throw new IllegalArgumentException("Either userId or roleId must be set");
        }
        this.userId = userId;
        this.roleId = roleId;
        this.connectionId = connectionId;
        this.databasePattern = Objects.requireNonNull(databasePattern, "databasePattern");
        this.tablePattern = Objects.requireNonNull(tablePattern, "tablePattern");
        this.allowed = allowed;
        this.priority = priority;
    }

    public static DataAccessRule forUser(String userId, String databasePattern, String tablePattern,
                                         boolean allowed, int priority) {
        return new DataAccessRule(Objects.requireNonNull(userId, "userId"), null, null,
                databasePattern, tablePattern, allowed, priority);
    }

    public static DataAccessRule forRole(String roleId, String databasePattern, String tablePattern,
                                         boolean allowed, int priority) {
        return new DataAccessRule(null, Objects.requireNonNull(roleId, "roleId"), null,
                databasePattern, tablePattern, allowed, priority);
    }

    /**
     * @return a copy of this rule limited to one connection
     */
    public DataAccessRule onConnection(String connectionId) {
        return new DataAccessRule(userId, roleId, connectionId, databasePattern, tablePattern, allowed, priority);
    }

    public String getUserId() {
        return userId;
    }

    public String getRoleId() {
        return roleId;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getDatabasePattern() {
        return databasePattern;
    }

    public String getTablePattern() {
        return tablePattern;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getPriority() {
        return priority;
    }

    boolean matches(String database, String table) {
        return matchesPattern(database, databasePattern) && (table == null || matchesPattern(table, tablePattern));
    }

    static boolean matchesPattern(String value, String pattern) {
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.length() > 1 && pattern.startsWith("/") && pattern.endsWith("/")) {
            try {
                return Pattern.compile(pattern.substring(1, pattern.length() - 1), Pattern.CASE_INSENSITIVE)
                        .matcher(value).find();
            } catch (PatternSyntaxException e) {
                return false;
            }
        }
        if (pattern.contains("*")) {
            String[] parts = pattern.split("\\*", -1);
            StringBuilder regex = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    regex.append(".*");
                }
                regex.append(Pattern.quote(parts[i]));
            }
            return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE).matcher(value).matches();
        }
        return value.equalsIgnoreCase(pattern);
    }

    @Override
    public String toString() {
        return (allowed ? "allow " : "deny ") + databasePattern + "." + tablePattern
                + " (priority " + priority + (userId != null ? ", user " + userId : ", role " + roleId) + ")";
    }
}
