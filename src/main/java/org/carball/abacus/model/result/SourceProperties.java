package org.carball.abacus.model.result;

import java.util.List;

/**
 * Capabilities a SQL source advertises to the configuration UI.
 */
public record SourceProperties(
        boolean includeInConfig,
        List<String> readonlyFields,
        String type,
        String queryLanguage,
        boolean metricCaps
) {

    public static SourceProperties sql() {
        return new SourceProperties(true, List.of(), "database", "sql", true);
    }
}
