package com.whosly.guard.access;

import com.whosly.guard.parser.SqlParser;
import com.whosly.guard.parser.TableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Database and table level access helpers used by catalog browsing and the query
 * endpoints. Server metadata databases are hidden from non-admin listings even
 * though queries against them may be allowed.
 */
public class DataAccessService {

    private static final Logger log = LoggerFactory.getLogger(DataAccessService.class);

    public static final Set<String> SYSTEM_DATABASES = RuleBasedGrantStore.SYSTEM_DATABASES;

    private final SqlParser sqlParser;
    private final DataAccessGrantStore grantStore;

    public DataAccessService(SqlParser sqlParser, DataAccessGrantStore grantStore) {
        this.sqlParser = sqlParser;
        this.grantStore = grantStore;
    }

    /**
     * @throws IllegalStateException if a non-admin principal carries no id
     */
    public boolean checkDatabaseAccess(Principal principal, String database, String connectionId,
                                       AccessType accessType) {
        if (principal.isAdmin()) {
            return true;
        }
        String userId = requireUserId(principal, "database access checks");
        return isAllowed(grantStore.check(userId, database, null, accessType, connectionId));
    }

    /**
     * @throws IllegalStateException if a non-admin principal carries no id
     */
    public boolean checkTableAccess(Principal principal, String database, String table, String connectionId,
                                    AccessType accessType) {
        if (principal.isAdmin()) {
            return true;
        }
        String userId = requireUserId(principal, "table access checks");
        return isAllowed(grantStore.check(userId, database, table, accessType, connectionId));
    }

    public List<String> filterDatabases(Principal principal, List<String> databases, String connectionId) {
        if (principal.isAdmin()) {
            return databases;
        }
        String userId = requireUserId(principal, "database filtering");
        List<String> visible = databases.stream()
                .filter(database -> !SYSTEM_DATABASES.contains(database))
                .filter(database -> isAllowed(grantStore.check(userId, database, null, AccessType.READ, connectionId)))
                .collect(Collectors.toList());
        log.debug("User {} sees {} of {} databases", userId, visible.size(), databases.size());
        return visible;
    }

    public List<String> filterTables(Principal principal, String database, List<String> tables,
                                     String connectionId) {
        if (principal.isAdmin()) {
            return tables;
        }
        String userId = requireUserId(principal, "table filtering");
        if (SYSTEM_DATABASES.contains(database)) {
            return Collections.emptyList();
        }
        return tables.stream()
                .filter(table -> isAllowed(grantStore.check(userId, database, table, AccessType.READ, connectionId)))
                .collect(Collectors.toList());
    }

    /**
     * @return tables referenced by every statement of {@code sql}, in order
     */
    public List<TableReference> extractTablesFromQuery(String sql) {
        List<TableReference> tables = new ArrayList<>();
        for (String statement : sqlParser.splitStatements(sql)) {
            tables.addAll(sqlParser.extractTables(statement));
        }
        return tables;
    }

    /**
     * @return the most restrictive access type over all statements of {@code sql};
     * {@link AccessType#MISC} when there is no statement
     */
    public AccessType getQueryAccessType(String sql) {
        AccessType strictest = null;
        for (String statement : sqlParser.splitStatements(sql)) {
            AccessType accessType = AccessType.forOperation(sqlParser.parseStatement(statement).getOperationKind());
            if (strictest == null || accessType.ordinal() > strictest.ordinal()) {
                strictest = accessType;
            }
        }
        return strictest == null ? AccessType.MISC : strictest;
    }

    private static boolean isAllowed(AccessCheckResult result) {
        return result != null && result.isAllowed();
    }

    private static String requireUserId(Principal principal, String operation) {
        if (!principal.isAuthenticated()) {
            throw new IllegalStateException("An authenticated user is required for " + operation);
        }
        return principal.getId();
    }
}
