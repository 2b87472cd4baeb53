package org.carball.abacus.dialect;

public class SnowflakeDialect implements SqlDialect {

    @Override
    public String name() {
        return "snowflake";
    }

    @Override
    public String addInterval(String column, int days) {
        return "dateadd(day, " + days + ", " + column + ")";
    }

    @Override
    public String addHours(String column, int hours) {
        return "dateadd(hour, " + hours + ", " + column + ")";
    }

    @Override
    public String subtractMinutes(String column, int minutes) {
        return "dateadd(minute, -" + minutes + ", " + column + ")";
    }

    // RLIKE only matches the whole value
    @Override
    public String matchesRegex(String column, String pattern) {
        return "REGEXP_INSTR(" + column + ", " + SqlLiterals.quote(pattern) + ") > 0";
    }

    @Override
    public String percentileExpr(String column, double fraction) {
        return "PERCENTILE_CONT(" + SqlLiterals.number(fraction) + ") WITHIN GROUP (ORDER BY " + column + ")";
    }
}
