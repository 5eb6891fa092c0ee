package br.edu.ifba.scholargraph.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.scholargraph.storage.NodeStorage;
import br.edu.ifba.scholargraph.storage.NodeStorage.NodeMatch;

/**
 * Maps relationship endpoint names to node ids.
 *
 * Resolution tiers, first hit wins:
 * 1. entities persisted for the current paper (canonical match)
 * 2. the current paper's own node (canonical title match)
 * 3. fuzzy search over the whole graph, best match above the similarity floor
 *
 * A name that misses all three is unresolved; the caller skips the edge.
 */
public class EntityResolver {

    private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

    private final NodeStorage nodeStorage;
    private final int fuzzyCandidates;
    private final double minSimilarity;

    public EntityResolver(@NotNull NodeStorage nodeStorage, int fuzzyCandidates, double minSimilarity) {
        if (fuzzyCandidates < 1) {
            throw new IllegalArgumentException("fuzzyCandidates must be at least 1");
        }
        this.nodeStorage = nodeStorage;
        this.fuzzyCandidates = fuzzyCandidates;
        this.minSimilarity = minSimilarity;
    }

    public CompletableFuture<Optional<String>> resolve(@NotNull String name, @NotNull ResolutionContext context) {
        return resolveWithTier(name, context).thenApply(resolution -> resolution.map(Resolution::nodeId));
    }

    /**
     * Same as {@link #resolve} but reports which tier matched.
     */
    public CompletableFuture<Optional<Resolution>> resolveWithTier(@NotNull String name,
            @NotNull ResolutionContext context) {
        String canonicalName = Canonicalizer.normalize(name);
        if (canonicalName.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        String localId = context.localIds().get(canonicalName);
        if (localId != null) {
            return CompletableFuture.completedFuture(Optional.of(new Resolution(localId, Tier.PAPER_LOCAL)));
        }

        if (canonicalName.equals(context.paperCanonicalName())) {
            return CompletableFuture.completedFuture(Optional.of(new Resolution(context.paperId(), Tier.SELF)));
        }

        return nodeStorage.fuzzySearch(name, null, fuzzyCandidates)
            .thenApply(matches -> {
                Optional<NodeMatch> best = matches.stream()
                    .filter(match -> match.score() >= minSimilarity)
                    .findFirst();
                if (best.isEmpty()) {
                    logger.debug("No node found for endpoint '{}' (paper {})", name, context.paperId());
                    return Optional.<Resolution>empty();
                }
                NodeMatch match = best.get();
                logger.debug("Endpoint '{}' matched node '{}' ({}) with score {}",
                    name, match.node().name(), match.node().kind().value(), String.format("%.3f", match.score()));
                return Optional.of(new Resolution(match.node().id(), Tier.FUZZY));
            });
    }

    /**
     * Binds this resolver to one paper, for {@link br.edu.ifba.scholargraph.storage.EdgeStorage#batchCreateFromExtraction}.
     */
    public EndpointResolver forPaper(@NotNull ResolutionContext context) {
        return name -> resolve(name, context);
    }

    public enum Tier {
        PAPER_LOCAL,
        SELF,
        FUZZY
    }

    public record Resolution(@NotNull String nodeId, @NotNull Tier tier) {
    }

    /**
     * Per-paper resolution state.
     *
     * @param paperId id of the paper node
     * @param paperCanonicalName canonical form of the paper title
     * @param localIds canonical name to node id, for the entities upserted for this paper
     */
    public record ResolutionContext(
        @NotNull String paperId,
        @NotNull String paperCanonicalName,
        @NotNull Map<String, String> localIds
    ) {
        public ResolutionContext {
            localIds = Map.copyOf(localIds);
        }

        public static ResolutionContext of(@NotNull Paper paper, @NotNull Map<String, String> localIds) {
            return new ResolutionContext(paper.id(), Canonicalizer.normalize(paper.title()), localIds);
        }
    }
}
