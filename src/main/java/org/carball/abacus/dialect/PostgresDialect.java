package org.carball.abacus.dialect;

public class PostgresDialect implements SqlDialect {

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public String dateDiffDays(String start, String end) {
        return "(CAST(" + end + " AS date) - CAST(" + start + " AS date))";
    }

    @Override
    public String percentileExpr(String column, double fraction) {
        return "PERCENTILE_CONT(" + SqlLiterals.number(fraction) + ") WITHIN GROUP (ORDER BY " + column + ")";
    }
}
