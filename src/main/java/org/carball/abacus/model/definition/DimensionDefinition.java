package org.carball.abacus.model.definition;

/**
 * A caller-supplied SQL fragment yielding {@code user_id} and {@code value} columns.
 */
public record DimensionDefinition(
        String name,
        IdentifierType userIdType,
        String sql
) {}
