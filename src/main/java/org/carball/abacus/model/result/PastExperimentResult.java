package org.carball.abacus.model.result;

import java.util.List;

public record PastExperimentResult(List<PastExperiment> experiments) {}
