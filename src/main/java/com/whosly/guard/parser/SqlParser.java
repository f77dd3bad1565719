package com.whosly.guard.parser;

import com.alibaba.druid.sql.ast.SQLStatement;

import java.util.List;

/**
 * Interface for SQL analysis functionality.
 * 
 * This interface defines the contract for splitting SQL batches, parsing them
 * with Alibaba Druid and extracting what each statement does and touches.
 */
public interface SqlParser {

    /**
     * Parse a SQL string into Druid ASTs (Abstract Syntax Trees).
     *
     * @param sql the SQL string to parse
     * @return the parsed SQL statements
     * @throws SqlParseException if the SQL cannot be parsed
     */
    List<SQLStatement> parse(String sql) throws SqlParseException;

    /**
     * Validate the syntax of a SQL string against the configured grammar.
     *
     * @param sql the SQL string to validate
     * @return true if the SQL is valid, false otherwise
     */
    boolean validate(String sql);

    /**
     * Split a SQL string into its individual statements.
     *
     * @param sql the SQL string, possibly holding several statements
     * @return trimmed, non-empty statements in order
     */
    List<String> splitStatements(String sql);

    /**
     * Classify a single statement and extract the tables it references.
     * Falls back to pattern matching when the grammar rejects the statement.
     *
     * @param statement a single SQL statement
     * @return the analysis, never null
     */
    ParsedStatement parseStatement(String statement);

    /**
     * Extract table references from a single SQL statement.
     *
     * @param statement the SQL statement to analyze
     * @return tables referenced by the statement
     */
    List<TableReference> extractTables(String statement);
}
