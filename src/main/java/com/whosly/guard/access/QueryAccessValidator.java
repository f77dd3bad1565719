package com.whosly.guard.access;

import com.whosly.guard.parser.ParsedStatement;
import com.whosly.guard.parser.SqlParser;
import com.whosly.guard.parser.TableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a principal may run a SQL batch.
 * <p>
 * Every statement of the batch is checked on its own, in order: first the role
 * permission family for its access type, then the grant store for each table it
 * touches. The first failure ends validation, so nothing is revealed about later
 * statements. Grant checks run sequentially for the same reason.
 * <p>
 * A statement without any table reference (e.g. {@code SET} or
 * {@code SHOW DATABASES}) is authorized by the role permission check alone.
 */
public class QueryAccessValidator {

    private static final Logger log = LoggerFactory.getLogger(QueryAccessValidator.class);

    private static final int PREVIEW_LENGTH = 50;

    private final SqlParser sqlParser;
    private final PermissionCatalog permissionCatalog;
    private final DataAccessGrantStore grantStore;
    private final SystemObjectReconciler reconciler;

    public QueryAccessValidator(SqlParser sqlParser, PermissionCatalog permissionCatalog,
                                DataAccessGrantStore grantStore) {
        this(sqlParser, permissionCatalog, grantStore, new SystemObjectReconciler());
    }

    public QueryAccessValidator(SqlParser sqlParser, PermissionCatalog permissionCatalog,
                                DataAccessGrantStore grantStore, SystemObjectReconciler reconciler) {
        this.sqlParser = sqlParser;
        this.permissionCatalog = permissionCatalog;
        this.grantStore = grantStore;
        this.reconciler = reconciler;
    }

    /**
     * Validate query access for a principal.
     *
     * @param principal       the caller, may be null when unauthenticated
     * @param sql             SQL text, possibly several statements separated by semicolons
     * @param defaultDatabase database for unqualified tables, may be null
     * @param connectionId    connection the query targets, may be null
     * @return the verdict; a denial names the first failing statement
     */
    public ValidationResult validateQueryAccess(Principal principal, String sql, String defaultDatabase,
                                                String connectionId) {
        if (principal != null && principal.isAdmin()) {
            return ValidationResult.allowed();
        }
        if (principal == null || !principal.isAuthenticated()) {
            return ValidationResult.denied("Authentication is required. Please log in before running queries.");
        }

        List<String> statements = sqlParser.splitStatements(sql);
        if (statements.isEmpty()) {
            return ValidationResult.denied("No valid SQL statements found");
        }

        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i);
            ValidationResult result = validateStatement(statement, i, principal, defaultDatabase, connectionId);
            if (!result.isAllowed()) {
                log.info("Denied query of user {} at statement {}: {}", principal.getId(), i, result.getReason());
                if (statements.size() > 1) {
                    return result.withReason(result.getReason() + "\nStatement: " + preview(statement) + "...");
                }
                return result;
            }
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateStatement(String statement, int index, Principal principal,
                                               String defaultDatabase, String connectionId) {
        ParsedStatement parsed = sqlParser.parseStatement(statement);
        if (parsed.isHeuristic()) {
            log.debug("Statement {} analysed heuristically: {}", index, parsed.getDiagnostics());
        }

        AccessType accessType = AccessType.forOperation(parsed.getOperationKind());
        if (!permissionCatalog.permits(principal.getPermissions(), accessType)) {
            return ValidationResult.denied(String.format("Statement %d: No permission for %s operations (%s statement)",
                    index + 1, accessType.getName(), parsed.getOperationKind().getName()), index);
        }

        List<TableReference> tables = deduplicate(parsed.getTables());
        if (tables.isEmpty()) {
            return ValidationResult.allowed();
        }

        Set<ResolvedTable> checked = new LinkedHashSet<>();
        for (TableReference reference : tables) {
            ResolvedTable target = reconciler.reconcile(reference.getDatabase(), reference.getTable(),
                    statement, defaultDatabase);
            if (!checked.add(target)) {
                continue;
            }
            AccessCheckResult result = checkGrant(principal.getId(), target, accessType, connectionId);
            if (result == null || !result.isAllowed()) {
                return ValidationResult.denied(String.format("Statement %d: Access denied to %s.%s (requires %s permission)",
                        index + 1, target.getDatabase(), target.getTable(), accessType.getName()), index);
            }
        }
        return ValidationResult.allowed();
    }

    /**
     * A failing grant store yields no answer, which callers treat as a denial.
     */
    private AccessCheckResult checkGrant(String userId, ResolvedTable target, AccessType accessType,
                                         String connectionId) {
        try {
            return grantStore.check(userId, target.getDatabase(), target.getTable(), accessType, connectionId);
        } catch (RuntimeException e) {
            log.error("Grant check failed for user {} on {} ({}), denying", userId, target, accessType.getName(), e);
            return null;
        }
    }

    /**
     * Collapses references to the same table name. A qualified reference replaces
     * unqualified ones of the same name; distinct databases are all kept.
     */
    static List<TableReference> deduplicate(Collection<TableReference> tables) {
        Map<String, List<TableReference>> byName = new LinkedHashMap<>();
        for (TableReference reference : tables) {
            List<TableReference> variants = byName.computeIfAbsent(reference.getTable(), key -> new ArrayList<>());
            if (reference.isQualified()) {
                variants.removeIf(existing -> !existing.isQualified());
                if (!variants.contains(reference)) {
                    variants.add(reference);
                }
            } else if (variants.isEmpty()) {
                variants.add(reference);
            }
        }

        List<TableReference> result = new ArrayList<>();
        byName.values().forEach(result::addAll);
        return result;
    }

    private static String preview(String statement) {
        return statement.substring(0, Math.min(PREVIEW_LENGTH, statement.length())).replaceAll("\\s+", " ");
    }
}
