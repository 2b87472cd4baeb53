package org.carball.abacus.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * One section of user-supplied source settings. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawTableSettings {
    private String table;
    private String timestampColumn;
    private String userIdColumn;
    private String anonymousIdColumn;

    // pageviews only
    private String urlColumn;

    // experiments only
    private String experimentIdColumn;
    private String variationColumn;
    private String variationFormat;
}
