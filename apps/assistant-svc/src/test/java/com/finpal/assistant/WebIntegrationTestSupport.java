package com.finpal.assistant;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full application with both JSON stores in a throwaway directory.
 * Subclasses share one context, so each test should work on its own phone numbers.
 */
@SpringBootTest
@AutoConfigureMockMvc
public abstract class WebIntegrationTestSupport {

    protected static final String DEMO_PHONE = "9823533097";

    private static final Path DATA_DIR = createDataDir();

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("finpal.storage.data-dir", DATA_DIR::toString);
        registry.add("finpal.storage.seed-demo-data", () -> "true");
        registry.add("finpal.security.jwt-secret", () -> "integration-test-secret-0123456789abcdef");
    }

    protected static String newPhone() {
        return "7" + ThreadLocalRandom.current().nextLong(100_000_000L, 999_999_999L);
    }

    protected static Path dataDir() {
        return DATA_DIR;
    }

    private static Path createDataDir() {
        try {
            return Files.createTempDirectory("finpal-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
