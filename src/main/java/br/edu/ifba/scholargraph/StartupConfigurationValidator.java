package br.edu.ifba.scholargraph;

import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.exception.ConfigurationException;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

/**
 * Validates required settings on application startup.
 *
 * <p>A missing text-analysis API key or database path aborts startup with
 * {@link ConfigurationException} before any paper is ingested.</p>
 */
@ApplicationScoped
@Startup
public class StartupConfigurationValidator {

    private static final Logger logger = LoggerFactory.getLogger(StartupConfigurationValidator.class);

    @ConfigProperty(name = "llm-chat.api-key")
    Optional<String> apiKey;

    @ConfigProperty(name = "scholargraph.storage.sqlite.path")
    Optional<String> databasePath;

    @ConfigProperty(name = "chat.model")
    Optional<String> model;

    void onStart(@Observes StartupEvent event) {
        logger.info("Validating scholar graph configuration...");
        validate();
        logger.info("Configuration valid: database {}, model {}", databasePath.get(), model.orElse("(default)"));
    }

    void validate() {
        if (apiKey.isEmpty() || apiKey.get().isBlank()) {
            throw new ConfigurationException(
                "Text-analysis API key not configured. Set 'llm-chat.api-key' (or OPENAI_API_KEY)");
        }
        if (databasePath.isEmpty() || databasePath.get().isBlank()) {
            throw new ConfigurationException(
                "Database path not configured. Set 'scholargraph.storage.sqlite.path' (or SCHOLARGRAPH_DB_PATH)");
        }
    }
}
