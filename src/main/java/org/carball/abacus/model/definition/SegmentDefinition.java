package org.carball.abacus.model.definition;

/**
 * A caller-supplied SQL fragment yielding {@code user_id} and {@code date} columns.
 * A user belongs to the segment from that date on.
 */
public record SegmentDefinition(
        String name,
        IdentifierType userIdType,
        String sql
) {}
