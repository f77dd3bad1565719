package com.whosly.guard;

import com.whosly.guard.access.AccessType;
import com.whosly.guard.parser.OperationKind;
import com.whosly.guard.parser.ParsedStatement;
import com.whosly.guard.parser.SqlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Scanner;

/**
 * Console for trying the analysis on ad-hoc SQL.
 */
@Component
public class CommandLineInterface implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    private static final String USAGE = "Commands: split <sql>, parse <sql>, access <operation>, quit";

    private final SqlParser sqlParser;

    @Autowired
    public CommandLineInterface(SqlParser sqlParser) {
        this.sqlParser = sqlParser;
    }

    @Override
    public void run(String... args) throws Exception {
        Scanner scanner = new Scanner(System.in);
        log.info("SQL Access Guard CLI");
        log.info(USAGE);

        while (true) {
            System.out.print("> ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String response = handle(scanner.nextLine());
            if (response == null) {
                log.info("Goodbye!");
                break;
            }
            log.info(response);
        }

        scanner.close();
    }

    /**
     * @return the text to print, or null when the console should stop
     */
    String handle(String line) {
        String input = line.trim();
        int space = input.indexOf(' ');
        String command = (space < 0 ? input : input.substring(0, space)).toLowerCase(Locale.ROOT);
        String argument = space < 0 ? "" : input.substring(space + 1).trim();

        switch (command) {
            case "split":
                return split(argument);
            case "parse":
                return parse(argument);
            case "access":
                return access(argument);
            case "quit":
            case "exit":
                return null;
            default:
                return "Unknown command. " + USAGE;
        }
    }

    private String split(String sql) {
        List<String> statements = sqlParser.splitStatements(sql);
        StringBuilder out = new StringBuilder(statements.size() + " statement(s)");
        for (int i = 0; i < statements.size(); i++) {
            out.append(System.lineSeparator()).append("  [").append(i).append("] ").append(statements.get(i));
        }
        return out.toString();
    }

    private String parse(String sql) {
        List<String> statements = sqlParser.splitStatements(sql);
        if (statements.isEmpty()) {
            return "No valid SQL statements found";
        }
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < statements.size(); i++) {
            ParsedStatement parsed = sqlParser.parseStatement(statements.get(i));
            if (i > 0) {
                out.append(System.lineSeparator());
            }
            out.append('[').append(i).append("] ")
                    .append(parsed.getOperationKind().getName())
                    .append(" (").append(AccessType.forOperation(parsed.getOperationKind()).getName()).append(") ")
                    .append("tables=").append(parsed.getTables());
            if (parsed.isHeuristic()) {
                out.append(" via fallback: ").append(parsed.getDiagnostics());
            }
        }
        return out.toString();
    }

    private String access(String operation) {
        OperationKind kind = OperationKind.fromLeadingKeyword(operation);
        return kind.getName() + " -> " + AccessType.forOperation(kind).getName();
    }
}
