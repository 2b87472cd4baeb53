package org.carball.abacus.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import org.carball.abacus.model.definition.DimensionDefinition;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.SegmentDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the command line needs to run one analysis, as read from a request file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisRequest {

    // experiment analysis
    private ExperimentDefinition experiment;
    /** Negative selects the latest phase. */
    private int phase = -1;
    private List<MetricDefinition> metrics = new ArrayList<>();
    private MetricDefinition activationMetric;
    private DimensionDefinition dimension;

    // impact estimation
    private String urlRegex;
    private MetricDefinition metric;
    private SegmentDefinition segment;

    // past experiment discovery
    private Instant from;
}
