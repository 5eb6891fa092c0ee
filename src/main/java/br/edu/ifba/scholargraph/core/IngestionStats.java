package br.edu.ifba.scholargraph.core;

import java.util.Map;

import br.edu.ifba.scholargraph.storage.PaperStorage.ProcessingStatus;

/**
 * Counts over the whole graph.
 */
public record IngestionStats(
        long papersTotal,
        Map<ProcessingStatus, Long> papersByStatus,
        Map<NodeKind, Long> nodesByKind,
        Map<EdgeKind, Long> edgesByKind) {

    public IngestionStats {
        papersByStatus = Map.copyOf(papersByStatus);
        nodesByKind = Map.copyOf(nodesByKind);
        edgesByKind = Map.copyOf(edgesByKind);
    }

    public long nodesTotal() {
        return nodesByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public long edgesTotal() {
        return edgesByKind.values().stream().mapToLong(Long::longValue).sum();
    }
}
