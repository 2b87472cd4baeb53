package org.carball.abacus.query;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tidies composed SQL. Only whitespace between tokens is touched: line breaks inside quoted
 * literals and identifiers are part of the token and never split, trimmed or re-indented.
 */
public final class QueryFormatter {

    private QueryFormatter() {
        // Utility class - prevent instantiation
    }

    /**
     * Drops blank lines, trims trailing whitespace and removes the indentation shared by all lines.
     */
    public static String format(String sql) {
        List<String> lines = lines(sql).stream()
                .map(String::stripTrailing)
                .filter(line -> !line.isEmpty())
                .toList();

        int indent = lines.stream()
                .mapToInt(QueryFormatter::leadingSpaces)
                .min()
                .orElse(0);

        return lines.stream()
                .map(line -> line.substring(indent))
                .collect(Collectors.joining("\n"));
    }

    /**
     * Formats each query and joins them into one semicolon separated script.
     */
    public static String audit(List<String> queries) {
        return queries.stream()
                .map(QueryFormatter::format)
                .collect(Collectors.joining(";\n\n")) + ";";
    }

    /**
     * Re-indents every line after the first so a multi-line fragment lines up under a
     * placeholder sitting {@code spaces} columns in.
     */
    public static String nest(String sql, int spaces) {
        String pad = "\n" + " ".repeat(spaces);
        return String.join(pad, lines(sql.strip()));
    }

    /**
     * Splits on line breaks outside quoted text. Single-quoted literals accept both doubled
     * quotes and backslash escapes; quotes inside comments do not open a literal.
     */
    static List<String> lines(String sql) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        char quote = 0;
        boolean lineComment = false;
        boolean blockComment = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char next = i + 1 < sql.length() ? sql.charAt(i + 1) : 0;

            if (quote != 0) {
                line.append(c);
                if (c == '\\' && quote == '\'' && next != 0) {
                    line.append(next);
                    i++;
                } else if (c == quote) {
                    if (next == quote) {
                        line.append(next);
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }

            if (blockComment) {
                if (c == '*' && next == '/') {
                    blockComment = false;
                }
            } else if (lineComment) {
                lineComment = c != '\n';
            } else if (c == '-' && next == '-') {
                lineComment = true;
            } else if (c == '/' && next == '*') {
                blockComment = true;
                line.append(c).append(next);
                i++;
                continue;
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            }

            if (c == '\r' && next == '\n') {
                continue;
            }
            if (c == '\n') {
                lines.add(line.toString());
                line.setLength(0);
            } else {
                line.append(c);
            }
        }
        lines.add(line.toString());
        return lines;
    }

    private static int leadingSpaces(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }
}
