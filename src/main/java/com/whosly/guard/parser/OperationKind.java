package com.whosly.guard.parser;

import java.util.Locale;

/**
 * Kind of operation a single SQL statement performs.
 */
public enum OperationKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE,
    DROP,
    ALTER,
    TRUNCATE,
    SHOW,
    DESCRIBE,
    USE,
    SET,
    EXPLAIN,
    EXISTS,
    CHECK,
    KILL,
    UNKNOWN;

    /**
     * Lower-case name used in denial messages, e.g. {@code drop}.
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps the leading keyword of a statement to an operation kind.
     * {@code WITH} maps to {@link #SELECT}; anything not listed is {@link #UNKNOWN}.
     *
     * @param keyword the first word of the statement, any case
     * @return the matching kind, never null
     */
    public static OperationKind fromLeadingKeyword(String keyword) {
        if (keyword == null) {
            return UNKNOWN;
        }
        switch (keyword.toUpperCase(Locale.ROOT)) {
            case "SELECT":
            case "WITH":
                return SELECT;
            case "INSERT":
                return INSERT;
            case "UPDATE":
                return UPDATE;
            case "DELETE":
                return DELETE;
            case "CREATE":
                return CREATE;
            case "DROP":
                return DROP;
            case "ALTER":
                return ALTER;
            case "TRUNCATE":
                return TRUNCATE;
            case "SHOW":
                return SHOW;
            case "DESCRIBE":
            case "DESC":
                return DESCRIBE;
            case "USE":
                return USE;
            case "SET":
                return SET;
            case "EXPLAIN":
                return EXPLAIN;
            case "EXISTS":
                return EXISTS;
            case "CHECK":
                return CHECK;
            case "KILL":
                return KILL;
            default:
                return UNKNOWN;
        }
    }
}
