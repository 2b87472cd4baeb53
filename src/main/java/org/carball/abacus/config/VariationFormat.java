package org.carball.abacus.config;

/**
 * How the assignment table stores the variation a user saw.
 */
public enum VariationFormat {
    /** Zero based position in the experiment's variation list. */
    INDEX,
    /** The variation key itself. */
    KEY;

    public static VariationFormat fromName(String name) {
        for (VariationFormat format : values()) {
            if (format.name().equalsIgnoreCase(name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown variation format: " + name + ". Expected index or key");
    }
}
