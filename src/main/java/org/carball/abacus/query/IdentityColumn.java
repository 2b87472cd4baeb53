package org.carball.abacus.query;

/**
 * Identifier column to select plus the join needed to reach it, empty when no bridge is needed.
 */
public record IdentityColumn(String column, String join) {

    public static IdentityColumn direct(String column) {
        return new IdentityColumn(column, "");
    }

    public boolean isBridged() {
        return !join.isEmpty();
    }
}
