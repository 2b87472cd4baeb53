package org.carball.abacus.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Replays rows exported from a warehouse instead of connecting to one. The file holds
 * {@code {"responses": [{"match": "...", "rows": [{...}]}]}}; a query gets the rows of the
 * first response whose {@code match} text it contains, or no rows.
 */
@Slf4j
public class RowFileQueryRunner implements QueryRunner {

    private final List<Response> responses = new ArrayList<>();

    private record Response(String match, List<Map<String, String>> rows) {}

    public RowFileQueryRunner(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Row file not found: " + file);
        }
        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        JsonNode list = root.get("responses");
        if (list == null || !list.isArray()) {
            throw new IOException("Row file " + file + " has no 'responses' array");
        }
        for (JsonNode node : list) {
            responses.add(new Response(node.path("match").asText(""), parseRows(node.get("rows"))));
        }
        log.debug("Loaded {} canned responses from {}", responses.size(), file);
    }

    @Override
    public CompletableFuture<List<Map<String, String>>> run(String sql) {
        List<Map<String, String>> rows = responses.stream()
                .filter(response -> sql.contains(response.match()))
                .findFirst()
                .map(Response::rows)
                .orElse(List.of());
        log.debug("Replaying {} rows", rows.size());
        return CompletableFuture.completedFuture(rows);
    }

    private static List<Map<String, String>> parseRows(JsonNode rows) {
        List<Map<String, String>> parsed = new ArrayList<>();
        if (rows == null || !rows.isArray()) {
            return parsed;
        }
        for (JsonNode rowNode : rows) {
            Map<String, String> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = rowNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isNull()) {
                    row.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().asText());
                }
            }
            parsed.add(row);
        }
        return parsed;
    }
}
