package br.edu.ifba.scholargraph.core;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * Maps a free-text relationship endpoint to a node id.
 * An empty result means the endpoint is unresolved.
 */
@FunctionalInterface
public interface EndpointResolver {

    CompletableFuture<Optional<String>> resolve(@NotNull String name);
}
