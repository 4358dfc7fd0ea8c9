package org.relua.resolver.module;

import java.util.List;

/**
 * All module references of one file, in source order.
 *
 * @param references Every {@code require} occurrence, including duplicates.
 */
public record ExtractionResult(List<ModuleReference> references) {

    public ExtractionResult {
        references = List.copyOf(references);
    }

    /**
     * Returns the statically known identifiers in source order, duplicates preserved.
     */
    public List<String> identifiers() {
        return references.stream()
                .filter(ModuleReference.Identifier.class::isInstance)
                .map(ref -> ((ModuleReference.Identifier) ref).name())
                .toList();
    }

    public long dynamicCount() {
        return references.stream().filter(ModuleReference.Dynamic.class::isInstance).count();
    }

    public long malformedCount() {
        return references.stream().filter(ModuleReference.Malformed.class::isInstance).count();
    }
}
