package com.whosly.guard.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of analysing one SQL statement.
 * <p>
 * The {@link Strategy} tells which path produced it: a full grammar parse, or the
 * heuristic pattern matcher used when the grammar rejects the text. In the latter
 * case {@link #getDiagnostics()} explains why.
 */
public final class ParsedStatement {

    public enum Strategy {
        GRAMMAR,
        HEURISTIC
    }

    private final String text;
    private final OperationKind operationKind;
    private final Set<TableReference> tables;
    private final List<String> diagnostics;
    private final Strategy strategy;

    private ParsedStatement(String text, OperationKind operationKind, Collection<TableReference> tables,
                            List<String> diagnostics, Strategy strategy) {
        this.text = Objects.requireNonNull(text, "text");
        this.operationKind = Objects.requireNonNull(operationKind, "operationKind");
        this.tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public static ParsedStatement grammar(String text, OperationKind kind, Collection<TableReference> tables,
                                          List<String> diagnostics) {
        return new ParsedStatement(text, kind, tables, diagnostics, Strategy.GRAMMAR);
    }

    public static ParsedStatement heuristic(String text, OperationKind kind, Collection<TableReference> tables,
                                            List<String> diagnostics) {
        return new ParsedStatement(text, kind, tables, diagnostics, Strategy.HEURISTIC);
    }

    public String getText() {
        return text;
    }

    public OperationKind getOperationKind() {
        return operationKind;
    }

    /**
     * @return referenced tables in discovery order, without duplicates
     */
    public Set<TableReference> getTables() {
        return tables;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public boolean isHeuristic() {
        return strategy == Strategy.HEURISTIC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedStatement)) {
            return false;
        }
        ParsedStatement that = (ParsedStatement) o;
        return text.equals(that.text)
                && operationKind == that.operationKind
                && new ArrayList<>(tables).equals(new ArrayList<>(that.tables))
                && new LinkedHashSet<>(diagnostics).equals(new LinkedHashSet<>(that.diagnostics))
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, operationKind, tables, strategy);
    }

    @Override
    public String toString() {
        return "ParsedStatement{" +
                "operationKind=" + operationKind +
                ", tables=" + tables +
                ", strategy=" + strategy +
                ", diagnostics=" + diagnostics +
                '}';
    }
}
