package org.carball.abacus.model.result;

import java.util.List;

/**
 * Results for one dimension value. {@code variations} is indexed by variation index.
 */
public record DimensionResult(String dimension, List<VariationResult> variations) {}
