package com.whosly.guard.parser;

import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import com.alibaba.druid.sql.dialect.mysql.visitor.MySqlASTVisitorAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a Druid syntax tree and records every table source it meets: FROM and
 * JOIN items, DML targets, DDL table names, table functions and tables of nested
 * subqueries. Unqualified names of CTEs in scope are skipped; tables inside CTE
 * bodies are kept. A table source that is neither a name nor a function call is
 * recorded by its text so that it still reaches the grant check.
 * <p>
 * Not thread-safe, create one per statement.
 */
class TableReferenceCollector extends MySqlASTVisitorAdapter {

    private static final String DUAL = "dual";

    private final List<TableReference> tables = new ArrayList<>();
    private CteScope scope = new CteScope();

    List<TableReference> getTables() {
        return tables;
    }

    @Override
    public boolean visit(SQLSelect x) {
        SQLWithSubqueryClause with = x.getWithSubQuery();
        if (with == null) {
            return true;
        }

        boolean recursive = Boolean.TRUE.equals(with.getRecursive());
        CteScope outer = scope;
        scope = outer.copy();
        try {
            for (SQLWithSubqueryClause.Entry entry : with.getEntries()) {
                String name = normalize(entry.getAlias());
                // only a recursive CTE sees itself; elsewhere its own name in the body is a real table
                if (recursive) {
                    scope.declare(name);
                }
                acceptIfPresent(entry.getSubQuery());
                scope.declare(name);
            }
            acceptIfPresent(x.getQuery());
            acceptIfPresent(x.getOrderBy());
        } finally {
            scope = outer;
        }
        return false;
    }

    @Override
    public boolean visit(SQLExprTableSource x) {
        SQLExpr expr = x.getExpr();
        String database;
        String table;
        if (expr instanceof SQLPropertyExpr) {
            SQLPropertyExpr property = (SQLPropertyExpr) expr;
            database = nameOf(property.getOwner());
            table = normalize(property.getName());
        } else if (expr instanceof SQLIdentifierExpr) {
            database = null;
            table = normalize(((SQLIdentifierExpr) expr).getName());
        } else if (expr instanceof SQLMethodInvokeExpr) {
            // remote(...), file(...), s3(...) and other table functions read data too
            SQLMethodInvokeExpr function = (SQLMethodInvokeExpr) expr;
            String name = normalize(function.getMethodName());
            if (name != null && !name.isEmpty()) {
                tables.add(TableReference.of(nameOf(function.getOwner()), name));
            }
            return true;
        } else {
            String text = expr == null ? "" : expr.toString().trim();
            if (!text.isEmpty()) {
                tables.add(TableReference.of(text));
            }
            return true;
        }

        if (table == null || table.isEmpty()) {
            return false;
        }
        if (database == null && (DUAL.equalsIgnoreCase(table) || scope.contains(table))) {
            return false;
        }
        tables.add(TableReference.of(database, table));
        return false;
    }

    private void acceptIfPresent(SQLObject node) {
        if (node != null) {
            node.accept(this);
        }
    }

    private static String nameOf(SQLExpr owner) {
        if (owner instanceof SQLIdentifierExpr) {
            return normalize(((SQLIdentifierExpr) owner).getName());
        }
        if (owner instanceof SQLPropertyExpr) {
            // catalog.database.table
            return normalize(((SQLPropertyExpr) owner).getName());
        }
        return owner == null ? null : normalize(owner.toString());
    }

    private static String normalize(String name) {
        if (name == null) {
            return null;
        }
        return CteNameScanner.stripQuotes(SQLUtils.normalize(name));
    }
}
