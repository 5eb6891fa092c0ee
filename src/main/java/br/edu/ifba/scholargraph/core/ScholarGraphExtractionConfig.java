package br.edu.ifba.scholargraph.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Extraction settings read from application.properties with the prefix
 * {@code scholargraph.extraction}.
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * scholargraph.extraction.max-text-length=15000
 * scholargraph.extraction.known-papers.prompt-limit=50
 * scholargraph.extraction.entity.temperature=0.3
 * scholargraph.extraction.validation.strict-endpoints=false
 * scholargraph.extraction.resolution.min-similarity=0.0
 * }</pre>
 */
@ConfigMapping(prefix = "scholargraph.extraction")
public interface ScholarGraphExtractionConfig {

    /**
     * Characters of full text sent to each stage before the truncation marker.
     */
    @WithName("max-text-length")
    @WithDefault("15000")
    int maxTextLength();

    KnownPapers knownPapers();

    EntityStage entity();

    RelationshipStage relationship();

    Validation validation();

    Resolution resolution();

    interface KnownPapers {

        @WithName("fetch-limit")
        @WithDefault("100")
        int fetchLimit();

        @WithName("prompt-limit")
        @WithDefault("50")
        int promptLimit();
    }

    interface EntityStage {

        @WithDefault("0.3")
        double temperature();

        @WithName("max-tokens")
        @WithDefault("4000")
        int maxTokens();
    }

    interface RelationshipStage {

        @WithDefault("0.2")
        double temperature();

        @WithName("max-tokens")
        @WithDefault("4000")
        int maxTokens();
    }

    interface Validation {

        /**
         * Require both relationship endpoints to be paper-local entities or the paper itself.
         */
        @WithName("strict-endpoints")
        @WithDefault("false")
        boolean strictEndpoints();
    }

    interface Resolution {

        @WithName("fuzzy-candidates")
        @WithDefault("5")
        int fuzzyCandidates();

        @WithName("min-similarity")
        @WithDefault("0.0")
        double minSimilarity();
    }
}
