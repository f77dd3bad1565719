package com.whosly.guard.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a multi-statement SQL string on {@code ;} separators that appear outside
 * quotes and comments.
 */
public class StatementSplitter {

    /**
     * @param sql raw SQL text, may be null
     * @return trimmed, non-empty statements in input order
     */
    public List<String> split(String sql) {
        if (sql == null || sql.isEmpty()) {
            return Collections.emptyList();
        }

        SqlScanner.LexicalState[] states = SqlScanner.scan(sql);
        List<String> statements = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < sql.length(); i++) {
            if (sql.charAt(i) == ';' && states[i] == SqlScanner.LexicalState.NORMAL) {
                addIfNotEmpty(statements, sql, states, start, i);
                start = i + 1;
            }
        }
        addIfNotEmpty(statements, sql, states, start, sql.length());
        return statements;
    }

    /**
     * Keeps a fragment only when it has content outside comments, so a trailing
     * {@code -- note} after the last separator does not become a statement.
     */
    private static void addIfNotEmpty(List<String> statements, String sql, SqlScanner.LexicalState[] states,
                                      int start, int end) {
        for (int i = start; i < end; i++) {
            if (!Character.isWhitespace(sql.charAt(i))
                    && states[i] != SqlScanner.LexicalState.LINE_COMMENT
                    && states[i] != SqlScanner.LexicalState.BLOCK_COMMENT) {
                statements.add(sql.substring(start, end).trim());
                return;
            }
        }
    }
}
