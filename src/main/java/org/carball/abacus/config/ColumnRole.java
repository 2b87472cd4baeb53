package org.carball.abacus.config;

import org.carball.abacus.model.definition.IdentifierType;

/**
 * Columns every logical table can configure.
 */
public enum ColumnRole {
    USER_ID,
    ANONYMOUS_ID,
    TIMESTAMP;

    public static ColumnRole forIdentifier(IdentifierType type) {
        return type == IdentifierType.USER ? USER_ID : ANONYMOUS_ID;
    }
}
