package org.carball.abacus.model.query;

import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.SegmentDefinition;

import java.time.Instant;

/**
 * Population of users visiting pages matching a URL pattern within a date range.
 */
public interface PageQueryParams {

    String getName();

    Instant getFrom();

    Instant getTo();

    /**
     * Absent or {@code .*} means every page.
     */
    String getUrlRegex();

    IdentifierType getUserIdType();

    int getConversionWindowDays();

    boolean isIncludeByDate();

    SegmentDefinition getSegment();

    default boolean hasUrlFilter() {
        String regex = getUrlRegex();
        return regex != null && !regex.isBlank() && !".*".equals(regex);
    }
}
