package br.edu.ifba.scholargraph.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Batch ingestion settings, prefix {@code scholargraph.batch}.
 */
@ConfigMapping(prefix = "scholargraph.batch")
public interface BatchIngestionConfig {

    /**
     * Papers processed concurrently per chunk.
     */
    @WithDefault("5")
    int concurrency();

    /**
     * Pause between chunks in milliseconds; 0 disables it.
     */
    @WithName("chunk-delay")
    @WithDefault("2000")
    long chunkDelayMs();
}
