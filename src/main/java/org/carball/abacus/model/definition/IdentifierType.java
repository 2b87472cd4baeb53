package org.carball.abacus.model.definition;

/**
 * Identifier space a table or fragment is natively keyed by.
 */
public enum IdentifierType {
    USER,
    ANONYMOUS
}
