package br.edu.ifba.scholargraph.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validation stage between extraction and persistence.
 *
 * <ol>
 *   <li>Entities are deduplicated by canonical name, keeping the highest
 *       confidence (the first one wins a tie).</li>
 *   <li>A relationship is kept when at least one endpoint names a surviving
 *       entity or the paper itself. In strict mode both endpoints must.</li>
 *   <li>Confidence values are clamped to [0, 1].</li>
 * </ol>
 */
public class ExtractionValidator {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionValidator.class);

    private final boolean strictEndpoints;

    public ExtractionValidator(boolean strictEndpoints) {
        this.strictEndpoints = strictEndpoints;
    }

    public Result validate(@NotNull Paper paper, @NotNull List<ExtractedEntity> entities,
            @NotNull List<ExtractedRelationship> relationships) {
        Map<String, ExtractedEntity> byCanonicalName = new LinkedHashMap<>();
        for (ExtractedEntity entity : entities) {
            String canonicalName = entity.canonicalName();
            if (canonicalName.isEmpty()) {
                logger.debug("Dropping entity without a usable name: '{}'", entity.name());
                continue;
            }
            ExtractedEntity existing = byCanonicalName.get(canonicalName);
            if (existing == null || entity.confidence() > existing.confidence()) {
                byCanonicalName.put(canonicalName, clamped(entity));
            }
        }

        Set<String> known = new HashSet<>(byCanonicalName.keySet());
        String paperName = Canonicalizer.normalize(paper.title());
        if (!paperName.isEmpty()) {
            known.add(paperName);
        }

        List<ExtractedRelationship> kept = new ArrayList<>();
        for (ExtractedRelationship relationship : relationships) {
            boolean sourceKnown = known.contains(Canonicalizer.normalize(relationship.source()));
            boolean targetKnown = known.contains(Canonicalizer.normalize(relationship.target()));
            boolean keep = strictEndpoints ? sourceKnown && targetKnown : sourceKnown || targetKnown;
            if (keep) {
                kept.add(clamped(relationship));
            } else {
                logger.debug("Dropping relationship {} -[{}]-> {}: no known endpoint",
                    relationship.source(), relationship.kind().value(), relationship.target());
            }
        }

        Result result = new Result(List.copyOf(byCanonicalName.values()), List.copyOf(kept),
            entities.size() - byCanonicalName.size(), relationships.size() - kept.size());
        logger.debug("Validated paper {}: {} entities ({} merged), {} relationships ({} dropped)",
            paper.id(), result.entities().size(), result.entitiesMerged(),
            result.relationships().size(), result.relationshipsDropped());
        return result;
    }

    private static ExtractedEntity clamped(ExtractedEntity entity) {
        return new ExtractedEntity(entity.name(), entity.kind(), entity.description(),
            Confidence.clamp(entity.confidence()), entity.context(), entity.metadata());
    }

    private static ExtractedRelationship clamped(ExtractedRelationship relationship) {
        return new ExtractedRelationship(relationship.source(), relationship.target(), relationship.kind(),
            relationship.description(), relationship.evidence(), Confidence.clamp(relationship.confidence()),
            relationship.metadata());
    }

    /**
     * @param entitiesMerged duplicates folded into another entity, plus unusable names
     * @param relationshipsDropped relationships without a known endpoint
     */
    public record Result(
        List<ExtractedEntity> entities,
        List<ExtractedRelationship> relationships,
        int entitiesMerged,
        int relationshipsDropped
    ) {}
}
