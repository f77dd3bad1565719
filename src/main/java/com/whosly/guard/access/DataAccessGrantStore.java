package com.whosly.guard.access;

/**
 * Per-object grant store, the source of truth for which databases and tables a
 * principal may touch.
 */
public interface DataAccessGrantStore {

    /**
     * Check a single object.
     *
     * @param userId       the principal id, never null
     * @param database     the database name
     * @param table        the table name, or null for "any table in the database"
     * @param accessType   access the statement needs
     * @param connectionId the connection the query runs on, may be null
     * @return the decision; a null answer is treated as a denial by callers
     */
    AccessCheckResult check(String userId, String database, String table, AccessType accessType,
                            String connectionId);
}
