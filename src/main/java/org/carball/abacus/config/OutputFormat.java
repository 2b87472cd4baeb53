package org.carball.abacus.config;

public enum OutputFormat {
    JSON,
    MARKDOWN
}
