package org.carball.abacus.config;

/**
 * Logical tables a SQL source maps onto physical warehouse tables.
 */
public enum LogicalTable {
    DEFAULT,
    EXPERIMENTS,
    USERS,
    PAGEVIEWS,
    IDENTIFIES
}
