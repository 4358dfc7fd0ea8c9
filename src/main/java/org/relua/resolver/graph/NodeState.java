package org.relua.resolver.graph;

/**
 * Lifecycle of a module node during discovery.
 * <p>
 * {@code DISCOVERED -> READING -> (RESOLVED | UNRESOLVED | ERROR)}.
 */
public enum NodeState {
    /** Referenced by a resolved path; content not yet read. */
    DISCOVERED,
    /** Content is being read and its references extracted. */
    READING,
    /** Content read and every reference processed (some may have matched no file). */
    RESOLVED,
    /** Content read, but its references were not followed (depth limit reached). */
    UNRESOLVED,
    /** Content could not be read; outgoing edges are unknown. */
    ERROR;

    public boolean isTerminal() {
        return this == RESOLVED || this == UNRESOLVED || this == ERROR;
    }
}
