/**
 * Main application class for FindMyAisle
 *
 * Features:
 * - Loads a local .env file before Spring resolves the source API keys
 * - Reports at startup which upstream sources have credentials
 * - Entry point for Spring Boot application
 */

package net.findmyaisle;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import net.findmyaisle.service.source.PrimarySourceClient;
import net.findmyaisle.service.source.SecondarySourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FindMyAisleApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(FindMyAisleApplication.class);

    private final PrimarySourceClient primarySource;
    private final SecondarySourceClient secondarySource;

    public FindMyAisleApplication(PrimarySourceClient primarySource, SecondarySourceClient secondarySource) {
        this.primarySource = primarySource;
        this.secondarySource = secondarySource;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        disableNettyUnsafeAccess();
        SpringApplication.run(FindMyAisleApplication.class, args);
    }

    private static void disableNettyUnsafeAccess() {
        if (System.getProperty("io.netty.noUnsafe") == null) {
            System.setProperty("io.netty.noUnsafe", "true");
        }
    }

    private static void loadDotEnvFile() {
        Path envFile = Paths.get(".env");
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream is = Files.newInputStream(envFile)) {
            Properties props = new Properties();
            props.load(is);
            // Real environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!primarySource.isConfigured()) {
            log.error("[{}] No API key configured. Set PERPLEXITY_API_KEY; product searches will return 503 until then.",
                primarySource.name());
        }
        if (!secondarySource.isConfigured()) {
            log.warn("[{}] No API key configured. Set SERPER_API_KEY to enable the shopping fallback.",
                secondarySource.name());
        }
    }
}
