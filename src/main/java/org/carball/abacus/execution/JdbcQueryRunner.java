package org.carball.abacus.execution;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs each query on its own JDBC connection, asynchronously on the supplied executor.
 */
@Slf4j
public class JdbcQueryRunner implements QueryRunner {

    /**
     * Source of a fresh connection per query. The runner closes it when done.
     */
    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }

    private final ConnectionProvider connections;
    private final Executor executor;

    public JdbcQueryRunner(String jdbcUrl, Executor executor) {
        this(() -> DriverManager.getConnection(jdbcUrl), executor);
    }

    public JdbcQueryRunner(ConnectionProvider connections, Executor executor) {
        this.connections = connections;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<Map<String, String>>> run(String sql) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return execute(sql);
            } catch (SQLException e) {
                throw new CompletionException(
                        new QueryExecutionException("Query failed: " + e.getMessage(), e));
            }
        }, executor);
    }

    private List<Map<String, String>> execute(String sql) throws SQLException {
        List<Map<String, String>> rows = new ArrayList<>();

        try (Connection conn = connections.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {

            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    String value = rs.getString(i);
                    if (value != null) {
                        row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), value);
                    }
                }
                rows.add(row);
            }
        }

        log.debug("Query returned {} rows", rows.size());
        return rows;
    }
}
