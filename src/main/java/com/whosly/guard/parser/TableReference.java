package com.whosly.guard.parser;

import java.util.Objects;

/**
 * A table a statement reads or writes. A missing database means the table is
 * resolved against the default database at validation time.
 */
public final class TableReference {

    private final String database;
    private final String table;

    private TableReference(String database, String table) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Table name must not be empty");
        }
        this.database = (database == null || database.isEmpty()) ? null : database;
        this.table = table;
    }

    public static TableReference of(String table) {
        return new TableReference(null, table);
    }

    public static TableReference of(String database, String table) {
        return new TableReference(database, table);
    }

    /**
     * @return the explicit database qualifier, or null when unqualified
     */
    public String getDatabase() {
        return database;
    }

    public String getTable() {
        return table;
    }

    public boolean isQualified() {
        return database != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableReference)) {
            return false;
        }
        TableReference that = (TableReference) o;
        return Objects.equals(database, that.database) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(database, table);
    }

    @Override
    public String toString() {
        return database == null ? table : database + "." + table;
    }
}
