package org.carball.abacus.execution;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs read-only SQL against a warehouse. Rows map lower-cased column labels to the
 * textual value; SQL NULL values are absent from the map.
 */
@FunctionalInterface
public interface QueryRunner {

    CompletableFuture<List<Map<String, String>>> run(String sql);
}
