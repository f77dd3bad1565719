package com.whosly.guard.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-matching analysis for statements the grammar parser rejects, such as
 * dialect-specific syntax. Classification is driven by the leading keyword and
 * table references come from an ordered list of clause patterns. Never throws.
 */
public class HeuristicStatementParser {

    private static final String IDENT = "([`\"]?\\w+[`\"]?)";
    private static final String QUALIFIED = IDENT + "\\." + IDENT;
    // a bare name must not be the qualifier half of db.table
    private static final String BARE = IDENT + "(?![\\w.`\"])";
    // the lookahead keeps "IF" from being read as the table name
    private static final String IF_EXISTS =
            "(?:IF\\s+(?:NOT\\s+)?EXISTS\\s+)?(?!IF\\s+(?:NOT\\s+)?EXISTS\\b)";

    private static final List<Pattern> TABLE_PATTERNS = Collections.unmodifiableList(Arrays.asList(
            clause("\\bFROM\\s+", QUALIFIED),
            clause("\\bFROM\\s+", BARE),
            clause("\\bINTO\\s+", QUALIFIED),
            clause("\\bINTO\\s+", BARE),
            clause("\\bUPDATE\\s+", QUALIFIED),
            clause("\\bUPDATE\\s+", BARE),
            clause("\\b(?:DROP|CREATE|ALTER|TRUNCATE)\\s+TABLE\\s+" + IF_EXISTS, QUALIFIED),
            clause("\\b(?:DROP|CREATE|ALTER|TRUNCATE)\\s+TABLE\\s+" + IF_EXISTS, BARE),
            clause("\\bTABLE\\s+" + IF_EXISTS, QUALIFIED),
            clause("\\bTABLE\\s+" + IF_EXISTS, BARE),
            clause("\\bJOIN\\s+", QUALIFIED),
            clause("\\bJOIN\\s+", BARE)
    ));

    private static final Pattern FROM_KEYWORD = Pattern.compile("\\bFROM\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ITEM =
            Pattern.compile("\\s*(?:" + QUALIFIED + "|" + BARE + ")", Pattern.CASE_INSENSITIVE);
    private static final Set<String> FROM_LIST_END = Set.of(
            "WHERE", "PREWHERE", "GROUP", "ORDER", "HAVING", "LIMIT", "SETTINGS", "FORMAT", "UNION",
            "EXCEPT", "INTERSECT", "WINDOW", "QUALIFY", "ARRAY", "INTO", "SELECT", "VALUES", "SET");

    private static final Pattern FIRST_WORD = Pattern.compile("^\\s*(\\w+)");
    private static final Pattern WORD = Pattern.compile("\\w+");

    private static Pattern clause(String keyword, String name) {
        return Pattern.compile(keyword + name, Pattern.CASE_INSENSITIVE);
    }

    /**
     * @param statement a single statement
     * @param failure   message of the grammar failure that led here
     */
    public ParsedStatement parse(String statement, String failure) {
        List<String> diagnostics = new ArrayList<>();
        diagnostics.add("Failed to parse statement (using fallback): " + failure);
        return ParsedStatement.heuristic(statement, classify(statement), extractTables(statement), diagnostics);
    }

    /**
     * Classifies by the first keyword outside comments. For a {@code WITH} statement
     * the first top-level SELECT, INSERT, UPDATE or DELETE after the CTE list decides.
     */
    public OperationKind classify(String statement) {
        String masked = SqlScanner.mask(statement);
        Matcher first = FIRST_WORD.matcher(masked);
        if (!first.find()) {
            return OperationKind.UNKNOWN;
        }
        String keyword = first.group(1);
        if (!"WITH".equalsIgnoreCase(keyword)) {
            return OperationKind.fromLeadingKeyword(keyword);
        }
        return classifyAfterWith(masked, first.end());
    }

    private static OperationKind classifyAfterWith(String masked, int from) {
        int depth = 0;
        int i = from;
        while (i < masked.length()) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && (Character.isLetter(c) || c == '_')) {
                Matcher word = WORD.matcher(masked);
                word.find(i);
                switch (word.group().toUpperCase(Locale.ROOT)) {
                    case "SELECT":
                        return OperationKind.SELECT;
                    case "INSERT":
                        return OperationKind.INSERT;
                    case "UPDATE":
                        return OperationKind.UPDATE;
                    case "DELETE":
                        return OperationKind.DELETE;
                    default:
                        i = word.end();
                        continue;
                }
            }
            i++;
        }
        return OperationKind.UNKNOWN;
    }

    /**
     * Every pattern match contributes one reference, except unqualified names that
     * refer to a CTE in scope at that point of the statement. The items after the
     * first of a comma-separated FROM list are matched as well.
     */
    public List<TableReference> extractTables(String statement) {
        List<CteNameScanner.Definition> ctes = CteNameScanner.scan(statement);

        List<TableReference> tables = new ArrayList<>();
        for (Pattern pattern : TABLE_PATTERNS) {
            Matcher matcher = pattern.matcher(statement);
            while (matcher.find()) {
                if (matcher.groupCount() == 2) {
                    addQualified(tables, matcher.group(1), matcher.group(2));
                } else {
                    addBare(tables, matcher.group(1), matcher.start(1), ctes);
                }
            }
        }
        collectFromListItems(statement, ctes, tables);
        return tables;
    }

    /**
     * Walks each FROM clause at its own bracket depth and reads the item after every
     * top-level comma, until a keyword that ends the clause.
     */
    private static void collectFromListItems(String statement, List<CteNameScanner.Definition> ctes,
                                             List<TableReference> tables) {
        SqlScanner.LexicalState[] states = SqlScanner.scan(statement);
        Matcher from = FROM_KEYWORD.matcher(statement);
        Matcher item = LIST_ITEM.matcher(statement);
        while (from.find()) {
            if (states[from.start()] != SqlScanner.LexicalState.NORMAL) {
                continue;
            }
            int depth = 0;
            int i = from.end();
            while (i < statement.length()) {
                char c = statement.charAt(i);
                if (states[i] != SqlScanner.LexicalState.NORMAL) {
                    i++;
                    continue;
                }
                if (c == ';' || (c == ')' && depth == 0)) {
                    break;
                }
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    item.region(i + 1, statement.length());
                    if (item.lookingAt()) {
                        if (item.group(3) != null) {
                            addBare(tables, item.group(3), item.start(3), ctes);
                        } else {
                            addQualified(tables, item.group(1), item.group(2));
                        }
                    }
                } else if (depth == 0 && isWordStart(statement, i)) {
                    int end = i;
                    while (end < statement.length()
                            && (Character.isLetterOrDigit(statement.charAt(end)) || statement.charAt(end) == '_')) {
                        end++;
                    }
                    if (FROM_LIST_END.contains(statement.substring(i, end).toUpperCase(Locale.ROOT))) {
                        break;
                    }
                    i = end;
                    continue;
                }
                i++;
            }
        }
    }

    private static boolean isWordStart(String text, int i) {
        char c = text.charAt(i);
        if (!Character.isLetter(c) && c != '_') {
            return false;
        }
        return i == 0 || !(Character.isLetterOrDigit(text.charAt(i - 1)) || text.charAt(i - 1) == '_');
    }

    private static void addQualified(List<TableReference> tables, String database, String table) {
        tables.add(TableReference.of(CteNameScanner.stripQuotes(database), CteNameScanner.stripQuotes(table)));
    }

    private static void addBare(List<TableReference> tables, String name, int position,
                                List<CteNameScanner.Definition> ctes) {
        String table = CteNameScanner.stripQuotes(name);
        if (!CteNameScanner.isCteReference(ctes, table, position)) {
            tables.add(TableReference.of(table));
        }
    }
}
