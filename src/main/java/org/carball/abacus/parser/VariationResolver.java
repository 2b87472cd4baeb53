package org.carball.abacus.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.config.VariationFormat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps the variation text returned by the warehouse to a variation index.
 */
@Slf4j
public class VariationResolver {

    private final VariationFormat format;
    private final int variationCount;
    private final Map<String, Integer> keyToIndex = new HashMap<>();

    public VariationResolver(VariationFormat format, List<String> variations) {
        this.format = format;
        this.variationCount = variations.size();
        for (int i = 0; i < variations.size(); i++) {
            keyToIndex.putIfAbsent(variations.get(i), i);
        }
    }

    /**
     * The index in {@code [0, variationCount)}, or empty after logging a warning when the
     * value is unknown or out of range.
     */
    public OptionalInt resolve(String variation) {
        Integer index = format == VariationFormat.KEY ? keyToIndex.get(variation) : parseIndex(variation);
        if (index == null || index < 0 || index >= variationCount) {
            log.warn("Unexpected variation {}", variation);
            return OptionalInt.empty();
        }
        return OptionalInt.of(index);
    }

    /**
     * Integer text, or decimal text such as {@code 1.0} from a numeric variation column,
     * truncated to its whole part.
     */
    private static Integer parseIndex(String variation) {
        if (variation == null) {
            return null;
        }
        String text = variation.trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return parseDecimalIndex(text);
        }
    }

    private static Integer parseDecimalIndex(String text) {
        try {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? (int) value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
