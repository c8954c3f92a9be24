package com.directiveremover.cli.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes remover.json from the given path.
     *
     * @throws ConfigReadException if the file is missing or malformed, or names a blank symbol
     */
    public RemoverConfig read(Path configPath) {
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            RemoverConfig config = GSON.fromJson(reader, RemoverConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            validate(config, configPath);
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static void validate(RemoverConfig config, Path configPath) {
        if (config.getTargetSymbol() != null && config.getTargetSymbol().isBlank()) {
            throw new ConfigReadException("target_symbol must not be blank: " + configPath);
        }
        if (config.getDefines().stream().anyMatch(d -> d == null || d.isBlank())) {
            throw new ConfigReadException("defines must not contain blank symbols: " + configPath);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
