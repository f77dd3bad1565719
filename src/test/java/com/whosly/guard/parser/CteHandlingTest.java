package com.whosly.guard.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CTE names in scope must never be reported as tables, whichever analysis path runs.
 */
class CteHandlingTest {

    private final DruidSqlParser parser = new DruidSqlParser();

    private List<String> tableNames(String sql) {
        return parser.parseStatement(sql).getTables().stream()
                .map(TableReference::getTable)
                .collect(Collectors.toList());
    }

    @Test
    void testCteNameIsNotATable() {
        List<String> tables = tableNames("WITH cte_user AS (SELECT * FROM users) SELECT * FROM cte_user");

        assertThat(tables).containsExactly("users");
    }

    @Test
    void testMultipleCtes() {
        List<String> tables = tableNames("WITH cte1 AS (SELECT * FROM table1), cte2 AS (SELECT * FROM table2) "
                + "SELECT * FROM cte1 JOIN cte2 ON cte1.id = cte2.id");

        assertThat(tables).containsExactlyInAnyOrder("table1", "table2");
    }

    @Test
    void testCteReferencingAnotherCte() {
        List<String> tables = tableNames(
                "WITH cte1 AS (SELECT * FROM table1), cte2 AS (SELECT * FROM cte1) SELECT * FROM cte2");

        assertThat(tables).containsExactly("table1");
    }

    @Test
    void testCteInSubquery() {
        List<String> tables = tableNames("SELECT * FROM (WITH cte AS (SELECT * FROM users) SELECT * FROM cte) AS t");

        assertThat(tables).contains("users").doesNotContain("cte");
    }

    @Test
    void testJoinWithCte() {
        List<String> tables = tableNames(
                "WITH cte AS (SELECT * FROM users) SELECT * FROM cte JOIN orders ON cte.id = orders.user_id");

        assertThat(tables).containsExactlyInAnyOrder("users", "orders");
    }

    @Test
    void testCteWithColumnList() {
        List<String> tables = tableNames(
                "WITH cte(id, name) AS (SELECT user_id, user_name FROM users) SELECT * FROM cte");

        assertThat(tables).containsExactly("users");
    }

    @Test
    void testQualifiedNameMatchingCteIsKept() {
        ParsedStatement parsed = parser.parseStatement(
                "WITH secrets AS (SELECT 1 AS x) SELECT * FROM vault.secrets");

        assertThat(parsed.getTables()).containsExactly(TableReference.of("vault", "secrets"));
    }

    @Test
    void testNonRecursiveCteBodyReadsRealTable() {
        ParsedStatement parsed = parser.parseStatement("WITH secret AS (SELECT * FROM secret) SELECT * FROM secret");

        assertThat(parsed.getTables()).containsExactly(TableReference.of("secret"));
    }

    @Test
    void testRecursiveCteIsExcludedInsideItself() {
        List<String> tables = tableNames(
                "WITH RECURSIVE r AS (SELECT 1 AS n UNION ALL SELECT n + 1 FROM r WHERE n < 3) SELECT * FROM r");

        assertThat(tables).isEmpty();
    }

    @Test
    void testComplexClickHouseQuery() {
        String sql = "WITH\n"
                + "recent_queries AS (\n"
                + "    SELECT query_id, user, query_kind, query_duration_ms, memory_usage,\n"
                + "        ProfileEvents.Names AS event_names, ProfileEvents.Values AS event_values, event_time\n"
                + "    FROM system.query_log\n"
                + "    WHERE type = 'QueryFinish' AND event_time >= now() - INTERVAL 1 DAY\n"
                + "),\n"
                + "expanded_events AS (\n"
                + "    SELECT query_id, user, arrayJoin(arrayZip(event_names, event_values)) AS event_pair\n"
                + "    FROM recent_queries\n"
                + "),\n"
                + "per_query_metrics AS (\n"
                + "    SELECT query_id, any(user) AS user,\n"
                + "        sumIf(event_pair.2, event_pair.1 = 'SelectedRows') AS selected_rows\n"
                + "    FROM expanded_events\n"
                + "    GROUP BY query_id\n"
                + "),\n"
                + "user_stats AS (\n"
                + "    SELECT user, quantileExact(0.95)(duration_ms) AS p95_duration\n"
                + "    FROM per_query_metrics\n"
                + "    GROUP BY user\n"
                + "),\n"
                + "heavy_users AS (\n"
                + "    SELECT * FROM user_stats\n"
                + "    WHERE p95_duration >= (SELECT quantileExact(0.95)(p95_duration) FROM user_stats)\n"
                + "),\n"
                + "-- aggregate first\n"
                + "aggregated_stats AS (\n"
                + "    SELECT p.user, count() AS queries\n"
                + "    FROM per_query_metrics p\n"
                + "    INNER JOIN heavy_users h ON p.user = h.user\n"
                + "    GROUP BY p.user\n"
                + "    HAVING queries > 5\n"
                + ")\n"
                + "SELECT *, rank() OVER (PARTITION BY user ORDER BY queries DESC) AS duration_rank\n"
                + "FROM aggregated_stats\n"
                + "ORDER BY user";

        ParsedStatement parsed = parser.parseStatement(sql);
        List<String> tables = parsed.getTables().stream()
                .map(TableReference::getTable)
                .collect(Collectors.toList());

        assertThat(parsed.getOperationKind()).isEqualTo(OperationKind.SELECT);
        assertThat(parsed.getTables()).contains(TableReference.of("system", "query_log"));
        assertThat(tables).doesNotContain("recent_queries", "expanded_events", "per_query_metrics",
                "user_stats", "heavy_users", "aggregated_stats");
    }
}
