package org.carball.abacus.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * Partial source settings as stored for a data source connection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawSourceSettings {

    @JsonProperty("default")
    private RawTableSettings defaults;

    private RawTableSettings experiments;
    private RawTableSettings users;
    private RawTableSettings pageviews;
    private RawTableSettings identifies;
}
