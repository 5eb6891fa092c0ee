package br.edu.ifba.scholargraph.storage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.scholargraph.core.Node;
import br.edu.ifba.scholargraph.core.NodeKind;

/**
 * Storage for graph nodes with convergent upsert semantics.
 *
 * <p>Nodes are identified by {@code (kind, canonical name)}. Writing the same
 * identity again never creates a second node; it merges into the existing one:</p>
 * <ul>
 *   <li>confidence becomes the maximum of the stored and incoming values</li>
 *   <li>metadata is a shallow union, incoming top-level keys overwrite stored ones</li>
 *   <li>a stored non-empty description is never replaced</li>
 * </ul>
 * <p>The merge runs atomically inside the store for each row, so concurrent
 * writers converge to the same state regardless of arrival order.</p>
 *
 * <p>All failures surface through the returned futures:
 * {@link br.edu.ifba.exception.ValidationException} for malformed input and
 * {@link br.edu.ifba.exception.PersistenceException} for storage errors.</p>
 */
public interface NodeStorage {

    /**
     * Creates or merges a node.
     *
     * @param kind node kind
     * @param name display name, must canonicalize to a non-empty string
     * @param metadata top-level keys to merge into the node metadata
     * @param source identifier of the producer (e.g. {@code EntityExtractor})
     * @param confidence confidence in {@code [0, 1]}, clamped when outside
     * @return id of the created or merged node, stable across repeated calls
     */
    default CompletableFuture<String> upsert(@NotNull NodeKind kind, @NotNull String name,
            @NotNull Map<String, Object> metadata, @Nullable String source, double confidence) {
        return upsert(new NodeUpsert(kind, name, null, metadata, source, confidence));
    }

    /**
     * Creates or merges a node, including its description.
     */
    CompletableFuture<String> upsert(@NotNull NodeUpsert node);

    /**
     * Upserts many nodes in one transaction.
     *
     * @return canonical name to node id; when two entries share a canonical name
     *         under different kinds, the later entry wins the key
     */
    CompletableFuture<Map<String, String>> batchUpsert(@NotNull List<NodeUpsert> nodes);

    /**
     * @return the node, or null if not found
     */
    CompletableFuture<Node> findById(@NotNull String id);

    /**
     * Looks a node up by kind and (raw or canonical) name.
     *
     * @return the node, or null if not found
     */
    CompletableFuture<Node> findByKindAndName(@NotNull NodeKind kind, @NotNull String name);

    /**
     * Searches nodes whose name contains the canonical form of the query and
     * ranks them by name similarity, best first.
     *
     * @param query free-text name
     * @param kind optional kind filter
     * @param limit maximum number of candidates returned
     * @return ranked candidates, empty when nothing contains the query
     */
    CompletableFuture<List<NodeMatch>> fuzzySearch(@NotNull String query, @Nullable NodeKind kind, int limit);

    CompletableFuture<Map<NodeKind, Long>> countByKind();

    /**
     * Write request for a single node.
     */
    record NodeUpsert(
            @NotNull NodeKind kind,
            @NotNull String name,
            @Nullable String description,
            @Nullable Map<String, Object> metadata,
            @Nullable String source,
            double confidence) {
    }

    /**
     * A fuzzy search candidate with its similarity score in {@code [0, 1]}.
     */
    record NodeMatch(@NotNull Node node, double score) {
    }
}
