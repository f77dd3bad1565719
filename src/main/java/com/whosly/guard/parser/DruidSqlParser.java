package com.whosly.guard.parser;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLAlterTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLCreateTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLDropTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLExplainStatement;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLReplaceStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLTruncateStatement;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.parser.ParserException;
import com.alibaba.druid.sql.parser.SQLParserUtils;
import com.alibaba.druid.sql.parser.SQLStatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Implementation of SqlParser using Alibaba Druid.
 */
public class DruidSqlParser implements SqlParser {

    private static final Logger log = LoggerFactory.getLogger(DruidSqlParser.class);

    private final SqlDialect dialect;
    private final StatementSplitter splitter = new StatementSplitter();
    private final HeuristicStatementParser heuristicParser = new HeuristicStatementParser();

    public DruidSqlParser() {
        this(SqlDialect.MYSQL);
    }

    public DruidSqlParser(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public List<SQLStatement> parse(String sql) throws SqlParseException {
        DbType dbType = dialect.getDbType();
        try {
            SQLStatementParser parser = SQLParserUtils.createSQLStatementParser(sql, dbType);
            return parser.parseStatementList();
        } catch (ParserException e) {
            log.debug("Failed to parse SQL as {}: {}", dialect.getDisplayName(), sql, e);
            throw new SqlParseException(e.getMessage(), e);
        } catch (RuntimeException e) {
            log.debug("Parser failure on SQL: {}", sql, e);
            throw new SqlParseException("Parser failure: " + e, e);
        }
    }

    @Override
    public boolean validate(String sql) {
        try {
            return !parse(sql).isEmpty();
        } catch (SqlParseException e) {
            return false;
        }
    }

    @Override
    public List<String> splitStatements(String sql) {
        return splitter.split(sql);
    }

    @Override
    public ParsedStatement parseStatement(String statement) {
        List<SQLStatement> statements;
        try {
            statements = parse(statement);
        } catch (SqlParseException e) {
            return heuristicParser.parse(statement, e.getMessage());
        }
        if (statements.isEmpty()) {
            return heuristicParser.parse(statement, "no statement found by the grammar parser");
        }

        TableReferenceCollector collector = new TableReferenceCollector();
        try {
            for (SQLStatement sqlStatement : statements) {
                sqlStatement.accept(collector);
            }
        } catch (RuntimeException e) {
            log.debug("Failed to walk syntax tree of: {}", statement, e);
            return heuristicParser.parse(statement, "syntax tree walk failed: " + e);
        }

        List<String> diagnostics = new ArrayList<>();
        OperationKind kind;
        if (statements.size() > 1) {
            // the splitter and the grammar disagree on statement boundaries
            kind = OperationKind.UNKNOWN;
            diagnostics.add("Grammar parser found " + statements.size()
                    + " statements in a single fragment; operation treated as unknown");
        } else {
            kind = operationKindOf(statements.get(0), statement);
        }
        return ParsedStatement.grammar(statement, kind, collector.getTables(), diagnostics);
    }

    @Override
    public List<TableReference> extractTables(String statement) {
        return new ArrayList<>(parseStatement(statement).getTables());
    }

    private OperationKind operationKindOf(SQLStatement statement, String text) {
        if (statement instanceof SQLSelectStatement) {
            return OperationKind.SELECT;
        }
        if (statement instanceof SQLInsertStatement || statement instanceof SQLReplaceStatement) {
            return OperationKind.INSERT;
        }
        if (statement instanceof SQLUpdateStatement) {
            return OperationKind.UPDATE;
        }
        if (statement instanceof SQLDeleteStatement) {
            return OperationKind.DELETE;
        }
        if (statement instanceof SQLCreateTableStatement) {
            return OperationKind.CREATE;
        }
        if (statement instanceof SQLDropTableStatement) {
            return OperationKind.DROP;
        }
        if (statement instanceof SQLAlterTableStatement) {
            return OperationKind.ALTER;
        }
        if (statement instanceof SQLTruncateStatement) {
            return OperationKind.TRUNCATE;
        }
        if (statement instanceof SQLExplainStatement) {
            // MySQL parses DESC t as an explain statement
            return heuristicParser.classify(text) == OperationKind.DESCRIBE
                    ? OperationKind.DESCRIBE : OperationKind.EXPLAIN;
        }
        return operationKindOfType(statement.getClass().getSimpleName().toLowerCase(Locale.ROOT));
    }

    /**
     * Remaining statement classes are matched on their type name; SHOW comes
     * first so that {@code SHOW CREATE TABLE} is not taken for DDL.
     */
    private static OperationKind operationKindOfType(String type) {
        if (type.contains("show")) {
            return OperationKind.SHOW;
        }
        if (type.contains("create")) {
            return OperationKind.CREATE;
        }
        if (type.contains("drop")) {
            return OperationKind.DROP;
        }
        if (type.contains("alter")) {
            return OperationKind.ALTER;
        }
        if (type.contains("truncate")) {
            return OperationKind.TRUNCATE;
        }
        if (type.contains("describe") || type.contains("desc")) {
            return OperationKind.DESCRIBE;
        }
        if (type.contains("use")) {
            return OperationKind.USE;
        }
        if (type.contains("set")) {
            return OperationKind.SET;
        }
        if (type.contains("explain")) {
            return OperationKind.EXPLAIN;
        }
        if (type.contains("exists")) {
            return OperationKind.EXISTS;
        }
        if (type.contains("check")) {
            return OperationKind.CHECK;
        }
        if (type.contains("kill")) {
            return OperationKind.KILL;
        }
        return OperationKind.UNKNOWN;
    }
}
