package com.whosly.guard.parser;

import com.alibaba.druid.DbType;

import java.util.Locale;

/**
 * Grammar used for the primary parse of each statement.
 */
public enum SqlDialect {
    MYSQL("MySQL", DbType.mysql),
    CLICKHOUSE("ClickHouse", DbType.clickhouse);

    private final String displayName;
    private final DbType dbType;

    SqlDialect(String displayName, DbType dbType) {
        this.displayName = displayName;
        this.dbType = dbType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public DbType getDbType() {
        return dbType;
    }

    /**
     * @param name configured dialect name, case-insensitive
     * @throws IllegalArgumentException for an unsupported dialect
     */
    public static SqlDialect fromName(String name) {
        for (SqlDialect dialect : values()) {
            if (dialect.name().equalsIgnoreCase(name) || dialect.displayName.equalsIgnoreCase(name)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unsupported SQL dialect: " + name
                + " (expected one of mysql, clickhouse)");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
