package com.whosly.guard.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlScannerTest {

    @Test
    void testMaskBlanksLiteralsAndComments() {
        String sql = "SELECT 'FROM x.y' AS a -- FROM z.w\nFROM t /* JOIN q */";
        String masked = SqlScanner.mask(sql);

        assertThat(masked).hasSameSizeAs(sql);
        assertThat(masked).doesNotContain("x.y", "z.w", "JOIN");
        assertThat(masked).contains("SELECT", "AS a", "\nFROM t");
    }

    @Test
    void testMaskKeepsQuotedIdentifiers() {
        String masked = SqlScanner.mask("SELECT * FROM `db`.`t` WHERE \"c\" = 'v'");

        assertThat(masked).contains("`db`.`t`", "\"c\"");
        assertThat(masked).doesNotContain("v'");
    }

    @Test
    void testScanStates() {
        SqlScanner.LexicalState[] states = SqlScanner.scan("a'b'c");

        assertThat(states[0]).isEqualTo(SqlScanner.LexicalState.NORMAL);
        assertThat(states[2]).isEqualTo(SqlScanner.LexicalState.SINGLE_QUOTED);
        assertThat(states[4]).isEqualTo(SqlScanner.LexicalState.NORMAL);
    }
}
