package com.sqllinter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileGivesDefaults() throws IOException {
        LinterConfig config = ConfigLoader.load(tempDir.resolve("absent.json"));

        assertEquals(Constants.DEFAULT_DIALECT, config.getDialect());
        assertEquals(Constants.DEFAULT_RULES, config.getRules());
        assertEquals(Constants.DEFAULT_CAPITALISATION_POLICY, config.getCapitalisationPolicy());
        assertEquals(Constants.MAX_PARSE_DEPTH, config.getMaxParseDepth());
        assertEquals(Constants.DEFAULT_LINT_THREADS, config.getThreads());
        assertEquals(Constants.DEFAULT_DIALECT, ConfigLoader.load(null).getDialect());
    }

    @Test
    void testPartialFileKeepsOtherDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve(Constants.CONFIG_FILE_NAME), """
                {
                  "dialect": "postgres",
                  "rules": ["L014"],
                  "capitalisationPolicy": "lower",
                  "unknownSetting": true
                }
                """);

        LinterConfig config = ConfigLoader.load(file);

        assertEquals("postgres", config.getDialect());
        assertEquals(List.of("L014"), config.getRules());
        assertEquals("lower", config.getCapitalisationPolicy());
        assertEquals(Constants.MAX_PARSE_DEPTH, config.getMaxParseDepth());
    }

    @Test
    void testLoadFromDirectoryUsesDefaultFileName() throws IOException {
        Files.writeString(tempDir.resolve(Constants.CONFIG_FILE_NAME), "{\"threads\": 3}");

        LinterConfig config = ConfigLoader.loadFromDirectory(tempDir);

        assertEquals(3, config.getThreads());
        assertEquals(Constants.DEFAULT_DIALECT, config.getDialect());
    }

    @Test
    void testMalformedFileThrows() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "{\"dialect\": ");

        IOException exception = assertThrows(IOException.class, () -> ConfigLoader.load(file));
        assertTrue(exception.getMessage().contains("broken.json"));
    }
}
