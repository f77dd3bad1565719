package com.whosly.guard.access;

import com.whosly.guard.parser.OperationKind;

import java.util.Locale;

/**
 * Coarse authorization category of a statement.
 */
public enum AccessType {
    READ,
    WRITE,
    ADMIN,
    /**
     * Statements with no permission family; never granted to non-admins.
     */
    MISC;

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps an operation to the access it requires. Unclassified operations map to
     * {@link #MISC}, the most restricted category, never to {@link #READ}.
     */
    public static AccessType forOperation(OperationKind kind) {
        if (kind == null) {
            return MISC;
        }
        switch (kind) {
            case SELECT:
                return READ;
            case INSERT:
            case UPDATE:
            case DELETE:
                return WRITE;
            case CREATE:
            case DROP:
            case ALTER:
            case TRUNCATE:
                return ADMIN;
            case SHOW:
            case DESCRIBE:
            case USE:
            case SET:
            case EXPLAIN:
            case EXISTS:
            case CHECK:
            case KILL:
            case UNKNOWN:
            default:
                return MISC;
        }
    }
}
