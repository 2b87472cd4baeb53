package org.carball.abacus.dialect;

public class RedshiftDialect implements SqlDialect {

    @Override
    public String name() {
        return "redshift";
    }

    @Override
    public String percentileExpr(String column, double fraction) {
        return "PERCENTILE_CONT(" + SqlLiterals.number(fraction) + ") WITHIN GROUP (ORDER BY " + column + ")";
    }
}
