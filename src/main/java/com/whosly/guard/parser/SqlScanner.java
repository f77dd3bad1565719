package com.whosly.guard.parser;

/**
 * Lexical scanner that labels every character of a SQL text with the lexical
 * state it belongs to. Quote and comment delimiters carry the state of the
 * construct they open or close.
 */
public final class SqlScanner {

    public enum LexicalState {
        NORMAL,
        SINGLE_QUOTED,
        DOUBLE_QUOTED,
        BACKTICK_QUOTED,
        LINE_COMMENT,
        BLOCK_COMMENT;

        public boolean isQuoted() {
            return this == SINGLE_QUOTED || this == DOUBLE_QUOTED || this == BACKTICK_QUOTED;
        }

        char closingQuote() {
            switch (this) {
                case SINGLE_QUOTED:
                    return '\'';
                case DOUBLE_QUOTED:
                    return '"';
                case BACKTICK_QUOTED:
                    return '`';
                default:
                    throw new IllegalStateException(this + " is not a quoted state");
            }
        }
    }

    private SqlScanner() {
    }

    /**
     * @return the state of each character, indexed like {@code sql}
     */
    public static LexicalState[] scan(String sql) {
        int length = sql.length();
        LexicalState[] states = new LexicalState[length];
        LexicalState state = LexicalState.NORMAL;

        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            char next = i + 1 < length ? sql.charAt(i + 1) : '\0';

            if (state == LexicalState.NORMAL) {
                if (c == '\'') {
                    state = LexicalState.SINGLE_QUOTED;
                } else if (c == '"') {
                    state = LexicalState.DOUBLE_QUOTED;
                } else if (c == '`') {
                    state = LexicalState.BACKTICK_QUOTED;
                } else if (c == '-' && next == '-') {
                    state = LexicalState.LINE_COMMENT;
                } else if (c == '/' && next == '*') {
                    states[i] = LexicalState.BLOCK_COMMENT;
                    states[i + 1] = LexicalState.BLOCK_COMMENT;
                    state = LexicalState.BLOCK_COMMENT;
                    i += 2;
                    continue;
                }
                states[i] = state;
            } else if (state.isQuoted()) {
                states[i] = state;
                if (c == '\\' && i + 1 < length) {
                    // escaped character, whatever it is, stays inside the quote
                    states[i + 1] = state;
                    i += 2;
                    continue;
                }
                if (c == state.closingQuote()) {
                    state = LexicalState.NORMAL;
                }
            } else if (state == LexicalState.LINE_COMMENT) {
                states[i] = state;
                if (c == '\n') {
                    state = LexicalState.NORMAL;
                }
            } else {
                states[i] = state;
                if (c == '*' && next == '/') {
                    states[i + 1] = state;
                    state = LexicalState.NORMAL;
                    i += 2;
                    continue;
                }
            }
            i++;
        }
        return states;
    }

    /**
     * Blanks out string literal and comment contents, keeping identifiers and the
     * overall character positions intact. Line breaks are preserved.
     */
    public static String mask(String sql) {
        LexicalState[] states = scan(sql);
        StringBuilder masked = new StringBuilder(sql.length());
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            LexicalState state = states[i];
            boolean hidden = state == LexicalState.SINGLE_QUOTED
                    || state == LexicalState.LINE_COMMENT
                    || state == LexicalState.BLOCK_COMMENT;
            masked.append(hidden && c != '\n' ? ' ' : c);
        }
        return masked.toString();
    }
}
