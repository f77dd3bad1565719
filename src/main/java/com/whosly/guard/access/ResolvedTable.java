package com.whosly.guard.access;

import java.util.Objects;

/**
 * A fully attributed {@code (database, table)} pair as checked against the grant
 * store. The table is {@link SystemObjectReconciler#WILDCARD} when unknown.
 */
public final class ResolvedTable {

    private final String database;
    private final String table;

    public ResolvedTable(String database, String table) {
        this.database = Objects.requireNonNull(database, "database");
        this.table = Objects.requireNonNull(table, "table");
    }

    public String getDatabase() {
        return database;
    }

    public String getTable() {
        return table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedTable)) {
            return false;
        }
        ResolvedTable that = (ResolvedTable) o;
        return database.equals(that.database) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(database, table);
    }

    @Override
    public String toString() {
        return database + "." + table;
    }
}
