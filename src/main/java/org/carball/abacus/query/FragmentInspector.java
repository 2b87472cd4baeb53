package org.carball.abacus.query;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that caller-supplied dimension and segment SQL exposes the columns the composed
 * queries join on. Fragments the parser cannot read are accepted as they are.
 */
@Slf4j
public final class FragmentInspector {

    public static final Set<String> DIMENSION_COLUMNS = Set.of("user_id", "value");
    public static final Set<String> SEGMENT_COLUMNS = Set.of("user_id", "date");

    private FragmentInspector() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns false, after logging a warning, when the fragment's projection provably differs
     * from {@code expected}.
     */
    public static boolean inspect(String label, String sql, Set<String> expected) {
        Optional<List<String>> columns = outputColumns(sql);
        if (columns.isEmpty()) {
            return true;
        }
        Set<String> actual = new TreeSet<>(columns.get());
        if (columns.get().size() == expected.size() && actual.equals(new TreeSet<>(expected))) {
            return true;
        }
        log.warn("{} should select exactly {} but selects {}", label, new TreeSet<>(expected), columns.get());
        return false;
    }

    /**
     * Lower-cased output column names of a plain SELECT, empty when they cannot be determined.
     */
    static Optional<List<String>> outputColumns(String sql) {
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            log.debug("Fragment not inspected, parser rejected it: {}", e.getMessage());
            return Optional.empty();
        }
        if (!(statement instanceof PlainSelect select)) {
            return Optional.empty();
        }

        List<String> names = new ArrayList<>();
        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            if (expression instanceof AllColumns) {
                return Optional.empty();
            }
            if (item.getAlias() != null) {
                names.add(unquote(item.getAlias().getName()));
            } else if (expression instanceof Column column) {
                names.add(unquote(column.getColumnName()));
            } else {
                names.add(expression.toString().toLowerCase(Locale.ROOT));
            }
        }
        return Optional.of(names);
    }

    private static String unquote(String identifier) {
        String name = identifier;
        if (name.length() > 1 && (name.startsWith("\"") || name.startsWith("`"))) {
            name = name.substring(1, name.length() - 1);
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
