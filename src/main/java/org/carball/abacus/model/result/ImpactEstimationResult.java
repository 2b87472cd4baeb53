package org.carball.abacus.model.result;

/**
 * Daily rates over the impact estimation window.
 *
 * @param users       daily users matching the URL filter and segment
 * @param value       daily metric total for those users
 * @param metricTotal daily metric total for the entire site
 */
public record ImpactEstimationResult(String query, double users, double value, double metricTotal) {

    public static ImpactEstimationResult empty(String query) {
        return new ImpactEstimationResult(query, 0, 0, 0);
    }
}
