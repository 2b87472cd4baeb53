package org.carball.abacus.dialect;

import java.math.BigDecimal;

/**
 * Renders Java values as SQL literals.
 */
public final class SqlLiterals {

    private SqlLiterals() {
        // Utility class - prevent instantiation
    }

    /**
     * Standard SQL string literal, embedded quotes doubled.
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * String literal for engines where backslash is an escape character (BigQuery, ClickHouse).
     */
    public static String quoteWithBackslashEscapes(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Plain decimal notation without trailing zeros, never scientific.
     */
    public static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
