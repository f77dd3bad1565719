package com.whosly.guard.access;

import com.whosly.guard.parser.SqlScanner;
import com.whosly.guard.parser.SqlScanner.LexicalState;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Corrects the {@code (database, table)} attribution of extracted references
 * before they are checked, using the statement text as the repair source.
 * <p>
 * Repairs run in a fixed order:
 * <ol>
 *     <li>recover an explicit {@code database.table} for an unqualified name;</li>
 *     <li>recover the split when the extracted "table" is really the database;</li>
 *     <li>turn a table literally named {@code system} into {@code system.<name>};</li>
 *     <li>move well-known system tables to the {@code system} database;</li>
 *     <li>recover the table name of a {@code system} reference left without one.</li>
 * </ol>
 * The order decides ties on crafted identifiers and must not change.
 * A match counts only when its keyword is plain SQL text and each captured name
 * starts outside any literal, comment or quoted identifier, or is itself quoted.
 * Text inside a string, a comment or a quoted alias cannot steer the attribution.
 */
public class SystemObjectReconciler {

    public static final String SYSTEM_DATABASE = "system";
    public static final String FALLBACK_DATABASE = "default";
    public static final String WILDCARD = "*";

    private static final String IDENT = "([`\"]?\\w+[`\"]?)";
    // the lookahead keeps "IF" from being read as the table name
    private static final String IF_EXISTS =
            "(?:IF\\s+(?:NOT\\s+)?EXISTS\\s+)?(?!IF\\s+(?:NOT\\s+)?EXISTS\\b)";

    private static final List<Pattern> QUALIFIED_NAME_PATTERNS = List.of(
            pattern("\\b(?:DROP|CREATE|ALTER|TRUNCATE)\\s+TABLE\\s+" + IF_EXISTS + IDENT + "\\." + IDENT),
            pattern("\\b(?:FROM|JOIN|INTO|UPDATE)\\s+" + IDENT + "\\." + IDENT),
            pattern("\\bTABLE\\s+" + IF_EXISTS + IDENT + "\\." + IDENT),
            pattern("\\bSELECT\\s+.*?\\s+FROM\\s+" + IDENT + "\\." + IDENT));

    private static final Pattern SYSTEM_TABLE_PATTERN = pattern("\\bFROM\\s+system\\." + IDENT);

    /**
     * Server-internal tables that only exist in the {@code system} database.
     */
    static final Set<String> SYSTEM_TABLES = Set.of(
            // logs
            "query_log", "query_thread_log", "part_log", "metric_log", "trace_log",
            "text_log", "asynchronous_metric_log", "session_log", "zookeeper_log",
            "system_log", "crash_log", "asynchronous_insert_log", "backup_log",
            // metrics
            "metrics", "asynchronous_metrics",
            // catalog and introspection
            "processes", "mutations", "replicas", "databases", "tables", "columns",
            "functions", "dictionaries", "formats", "table_functions", "table_engines",
            "settings", "users", "roles", "quotas", "row_policies", "grants",
            "clusters", "macros", "merges", "parts", "detached_parts", "data_skipping_indices",
            "distribution_queue", "distributed_ddl_queue", "replication_queue",
            "zookeeper", "disks", "storage_policies", "merge_tree_settings",
            "build_options", "licenses", "server_settings", "time_zones");

    private static Pattern pattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * @param database        the extracted database, null when unqualified
     * @param table           the extracted table, null or {@code *} when unknown
     * @param statement       the statement the reference was extracted from
     * @param defaultDatabase the session default, may be null
     * @return the attribution to check
     */
    public ResolvedTable reconcile(String database, String table, String statement, String defaultDatabase) {
        String fallback = isBlank(defaultDatabase) ? FALLBACK_DATABASE : defaultDatabase;
        String db = isBlank(database) ? fallback : database;
        String tbl = isBlank(table) ? WILDCARD : table;
        boolean explicitDatabase = !isBlank(database);
        String source = statement == null ? "" : statement;
        String text = SqlScanner.mask(source);
        LexicalState[] states = SqlScanner.scan(source);

        if (!explicitDatabase && !WILDCARD.equals(tbl) && db.equals(fallback)) {
            ResolvedTable recovered = recoverQualifiedName(text, states, tbl);
            if (recovered == null) {
                recovered = recoverDatabaseReadAsTable(text, states, tbl);
            }
            if (recovered != null) {
                db = recovered.getDatabase();
                tbl = recovered.getTable();
                explicitDatabase = true;
            }
        }

        if (!SYSTEM_DATABASE.equals(db) && SYSTEM_DATABASE.equals(tbl)) {
            String systemTable = findSystemTable(text, states);
            if (systemTable != null) {
                db = SYSTEM_DATABASE;
                tbl = systemTable;
            }
        }

        // explicitly qualified names keep their database
        if (!explicitDatabase && !WILDCARD.equals(tbl) && !SYSTEM_DATABASE.equals(db)
                && SYSTEM_TABLES.contains(tbl.toLowerCase(Locale.ROOT))) {
            db = SYSTEM_DATABASE;
        }

        if (SYSTEM_DATABASE.equals(db) && (WILDCARD.equals(tbl) || SYSTEM_DATABASE.equals(tbl))) {
            String systemTable = findSystemTable(text, states);
            if (systemTable != null) {
                tbl = systemTable;
            }
        }

        return new ResolvedTable(db, tbl);
    }

    private static ResolvedTable recoverQualifiedName(String text, LexicalState[] states, String tbl) {
        for (Pattern pattern : QUALIFIED_NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (!isPlainMatch(matcher, states)) {
                    continue;
                }
                String extractedTable = unquote(matcher.group(2));
                if (extractedTable.equals(tbl) || WILDCARD.equals(tbl)) {
                    return new ResolvedTable(unquote(matcher.group(1)), extractedTable);
                }
            }
        }
        return null;
    }

    /**
     * Handles {@code db.table} where the extractor reported {@code db} as the table.
     */
    private static ResolvedTable recoverDatabaseReadAsTable(String text, LexicalState[] states, String tbl) {
        String quotedName = "([`\"]?" + Pattern.quote(tbl) + "[`\"]?)\\.";
        List<Pattern> patterns = List.of(
                pattern("\\b(?:FROM|JOIN|INTO|UPDATE)\\s+" + quotedName + IDENT),
                pattern("\\b(?:DROP|CREATE|ALTER|TRUNCATE)\\s+TABLE\\s+" + IF_EXISTS + quotedName + IDENT));
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (!isPlainMatch(matcher, states)) {
                    continue;
                }
                String actualDatabase = unquote(matcher.group(1));
                String actualTable = unquote(matcher.group(2));
                if (actualDatabase.equals(tbl) && !actualTable.isEmpty()) {
                    return new ResolvedTable(actualDatabase, actualTable);
                }
            }
        }
        return null;
    }

    private static String findSystemTable(String text, LexicalState[] states) {
        Matcher matcher = SYSTEM_TABLE_PATTERN.matcher(text);
        while (matcher.find()) {
            if (isPlainMatch(matcher, states)) {
                return unquote(matcher.group(1));
            }
        }
        return null;
    }

    private static boolean isPlainMatch(Matcher matcher, LexicalState[] states) {
        if (states[matcher.start()] != LexicalState.NORMAL) {
            return false;
        }
        for (int group = 1; group <= matcher.groupCount(); group++) {
            int start = matcher.start(group);
            if (start >= 0 && !startsOutsideQuotes(states, start)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the name is plain text or opens its own quoted identifier, and the
     * character before it is plain text.
     */
    private static boolean startsOutsideQuotes(LexicalState[] states, int position) {
        LexicalState state = states[position];
        if (state != LexicalState.NORMAL && !state.isQuoted()) {
            return false;
        }
        return position == 0 || states[position - 1] == LexicalState.NORMAL;
    }

    private static String unquote(String identifier) {
        return identifier.replace("`", "").replace("\"", "");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
