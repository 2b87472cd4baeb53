package org.carball.abacus.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source settings and analysis requests from YAML files.
 */
@Slf4j
public class ConfigurationLoader {

    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this.yamlMapper = YAMLMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Loads settings from a file, or the built-in defaults when no file is given.
     */
    public SourceSettings loadSettings(Path file) throws IOException {
        if (file == null) {
            log.debug("No settings file given, using default source settings");
            return SourceSettings.defaultSettings();
        }
        SourceSettings settings = parseSettings(read(file, "Settings"));
        log.info("Loaded source settings from {}", file);
        return settings;
    }

    public SourceSettings parseSettings(String yaml) throws IOException {
        if (yaml == null || yaml.isBlank()) {
            return SourceSettings.defaultSettings();
        }
        RawSourceSettings raw = yamlMapper.readValue(yaml, RawSourceSettings.class);
        try {
            return SettingsResolver.resolve(raw);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid source settings: " + e.getMessage(), e);
        }
    }

    public AnalysisRequest loadRequest(Path file) throws IOException {
        AnalysisRequest request = yamlMapper.readValue(read(file, "Request"), AnalysisRequest.class);
        log.info("Loaded analysis request from {}", file);
        return request;
    }

    private static String read(Path file, String kind) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException(kind + " file not found: " + file);
        }
        return Files.readString(file);
    }
}
