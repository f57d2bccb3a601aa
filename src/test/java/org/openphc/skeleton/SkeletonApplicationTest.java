package org.openphc.skeleton;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openphc.skeleton.config.ConfigurationLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SkeletonApplication startup.
 */
class SkeletonApplicationTest {

    @TempDir
    Path baseDirectory;

    @Test
    void shouldExitWithStatusOneAndNeverBuildApplicationOnInvalidConfiguration() throws Exception {
        Path configDirectory = Files.createDirectories(baseDirectory.resolve("config"));
        Files.writeString(configDirectory.resolve("development.json"), """
                {"port": 70000, "databaseUrl": "postgres://localhost/app", "jwtSecret": "test-secret-0123456789-0123456789-abcdef"}
                """);
        ConfigurationLoader loader = new ConfigurationLoader(baseDirectory, Map.of(), new ObjectMapper());
        AtomicBoolean built = new AtomicBoolean();

        int exitCode = SkeletonApplication.run(loader, configuration -> {
            built.set(true);
            throw new AssertionError("application must not be built");
        }, new String[0]);

        assertEquals(SkeletonApplication.EXIT_CONFIGURATION_FAILURE, exitCode);
        assertEquals(1, exitCode);
        assertFalse(built.get());
    }

    @Test
    void shouldExitWithStatusOneWhenRequiredKeysAreMissing() {
        ConfigurationLoader loader = new ConfigurationLoader(baseDirectory, Map.of(), new ObjectMapper());
        AtomicBoolean built = new AtomicBoolean();

        int exitCode = SkeletonApplication.run(loader, configuration -> {
            built.set(true);
            return null;
        }, new String[0]);

        assertEquals(1, exitCode);
        assertFalse(built.get());
    }
}
