package org.carball.abacus.dialect;

import lombok.Getter;

import java.util.Map;

/**
 * Supported warehouse flavors, looked up by name.
 */
@Getter
public enum DialectType {

    REDSHIFT("redshift", "Amazon Redshift") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new RedshiftDialect();
        }
    },

    POSTGRES("postgres", "PostgreSQL") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new PostgresDialect();
        }
    },

    SNOWFLAKE("snowflake", "Snowflake") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new SnowflakeDialect();
        }
    },

    BIGQUERY("bigquery", "Google BigQuery (options: projectId, dataset)") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new BigQueryDialect(options.get("projectId"), options.get("dataset"));
        }
    },

    CLICKHOUSE("clickhouse", "ClickHouse (options: database)") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new ClickHouseDialect(options.get("database"));
        }
    },

    PRESTO("presto", "Presto, Trino or Athena (options: catalog)") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new PrestoDialect(options.get("catalog"));
        }
    },

    DUCKDB("duckdb", "DuckDB") {
        @Override
        public SqlDialect create(Map<String, String> options) {
            return new DuckDbDialect();
        }
    };

    private final String name;
    private final String description;

    DialectType(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public abstract SqlDialect create(Map<String, String> options);

    public SqlDialect create() {
        return create(Map.of());
    }

    public static DialectType fromName(String name) {
        for (DialectType type : values()) {
            if (type.name.equalsIgnoreCase(name) || ("athena".equalsIgnoreCase(name) && type == PRESTO)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dialect: " + name + ". Available dialects: " + getAvailableDialects());
    }

    public static String getAvailableDialects() {
        StringBuilder sb = new StringBuilder();
        for (DialectType type : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(type.getName());
        }
        return sb.toString();
    }
}
