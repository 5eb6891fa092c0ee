package br.edu.ifba.scholargraph.core;

/**
 * Which side of an edge a node must be on when traversing.
 */
public enum EdgeDirection {
    OUTGOING,
    INCOMING,
    BOTH
}
