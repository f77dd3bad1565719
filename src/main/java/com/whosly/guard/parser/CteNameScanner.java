package com.whosly.guard.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar-independent discovery of common table expressions, used when the
 * statement cannot be parsed. Walks {@code WITH [RECURSIVE] name [(cols)] AS (...)}
 * lists by bracket depth over text whose literals and comments are masked, and
 * remembers where each name is in scope.
 */
final class CteNameScanner {

    private static final Pattern WITH_KEYWORD = Pattern.compile("\\bWITH\\b", Pattern.CASE_INSENSITIVE);

    private static final int STATEMENT_START = -1;
    private static final int NOT_A_CLAUSE = -2;

    /**
     * One CTE declaration. Character positions refer to the scanned statement.
     */
    static final class Definition {

        private final String name;
        private final int bodyStart;
        private final int bodyEnd;
        private final int scopeEnd;
        private final boolean recursive;

        Definition(String name, int bodyStart, int bodyEnd, int scopeEnd, boolean recursive) {
            this.name = name;
            this.bodyStart = bodyStart;
            this.bodyEnd = bodyEnd;
            this.scopeEnd = scopeEnd;
            this.recursive = recursive;
        }

        String getName() {
            return name;
        }

        /**
         * A recursive CTE is visible from its own body on, any other CTE only after
         * its body, up to the end of the query that declares it.
         */
        boolean isVisibleAt(int position) {
            if (position >= scopeEnd) {
                return false;
            }
            return position >= bodyEnd || (recursive && position >= bodyStart);
        }
    }

    private CteNameScanner() {
    }

    /**
     * @param sql one statement, raw text
     * @return every CTE declared anywhere in the statement, in text order
     */
    static List<Definition> scan(String sql) {
        String masked = SqlScanner.mask(sql);
        List<Definition> definitions = new ArrayList<>();
        Matcher matcher = WITH_KEYWORD.matcher(masked);
        while (matcher.find()) {
            int opening = clauseOpening(masked, matcher.start());
            if (opening != NOT_A_CLAUSE) {
                int scopeEnd = opening == STATEMENT_START ? masked.length() : closingParen(masked, opening);
                collect(masked, matcher.end(), scopeEnd, definitions);
            }
        }
        return definitions;
    }

    /**
     * @return lower-cased names of every CTE declared anywhere in the statement
     */
    static Set<String> names(String sql) {
        Set<String> names = new LinkedHashSet<>();
        for (Definition definition : scan(sql)) {
            names.add(definition.getName());
        }
        return names;
    }

    /**
     * @return true if an unqualified {@code name} at {@code position} refers to a CTE
     */
    static boolean isCteReference(List<Definition> definitions, String name, int position) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Definition definition : definitions) {
            if (definition.getName().equals(lower) && definition.isVisibleAt(position)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Only a WITH at the start of the statement or right after an opening
     * parenthesis introduces CTEs; {@code WITH ROLLUP} and friends do not.
     *
     * @return {@link #STATEMENT_START}, the index of the opening parenthesis, or
     * {@link #NOT_A_CLAUSE}
     */
    private static int clauseOpening(String text, int withStart) {
        int i = withStart - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return STATEMENT_START;
        }
        return text.charAt(i) == '(' ? i : NOT_A_CLAUSE;
    }

    private static void collect(String text, int from, int scopeEnd, List<Definition> definitions) {
        int pos = skipWhitespace(text, from);
        boolean recursive = keywordAt(text, pos, "RECURSIVE");
        if (recursive) {
            pos = skipWhitespace(text, pos + "RECURSIVE".length());
        }

        while (pos < text.length()) {
            int nameEnd = identifierEnd(text, pos);
            if (nameEnd == pos) {
                return;
            }
            String name = stripQuotes(text.substring(pos, nameEnd));
            pos = skipWhitespace(text, nameEnd);

            // optional column list
            if (pos < text.length() && text.charAt(pos) == '(') {
                pos = skipWhitespace(text, closingParen(text, pos));
            }
            if (!keywordAt(text, pos, "AS")) {
                return;
            }
            pos = skipWhitespace(text, pos + 2);
            if (pos >= text.length() || text.charAt(pos) != '(') {
                return;
            }
            int bodyEnd = closingParen(text, pos);
            definitions.add(new Definition(name.toLowerCase(Locale.ROOT), pos, bodyEnd, scopeEnd, recursive));

            pos = skipWhitespace(text, bodyEnd);
            if (pos >= text.length() || text.charAt(pos) != ',') {
                return;
            }
            pos = skipWhitespace(text, pos + 1);
        }
    }

    /**
     * @return index just past the parenthesis matching the one at {@code open},
     * or the text length when it is never closed
     */
    private static int closingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return text.length();
    }

    private static int identifierEnd(String text, int pos) {
        if (pos >= text.length()) {
            return pos;
        }
        char first = text.charAt(pos);
        if (first == '`' || first == '"') {
            int close = text.indexOf(first, pos + 1);
            return close < 0 ? pos : close + 1;
        }
        int i = pos;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    private static boolean keywordAt(String text, int pos, String keyword) {
        int end = pos + keyword.length();
        if (end > text.length() || !text.regionMatches(true, pos, keyword, 0, keyword.length())) {
            return false;
        }
        return end == text.length() || !(Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_');
    }

    private static int skipWhitespace(String text, int pos) {
        int i = pos;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    static String stripQuotes(String identifier) {
        return identifier.replace("`", "").replace("\"", "");
    }
}
