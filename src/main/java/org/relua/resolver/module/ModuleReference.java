package org.relua.resolver.module;

/**
 * One {@code require} occurrence found in a source file.
 */
public sealed interface ModuleReference permits ModuleReference.Identifier, ModuleReference.Dynamic, ModuleReference.Malformed {

    /** 1-based line of the {@code require} keyword. */
    int line();

    /**
     * A statically known module identifier.
     *
     * @param name The dotted module name.
     * @param line The source line.
     */
    record Identifier(String name, int line) implements ModuleReference {}

    /**
     * A reference whose argument is computed at runtime (variable, concatenation, call).
     *
     * @param line       The source line.
     * @param expression The argument text as written, shortened for reporting.
     */
    record Dynamic(int line, String expression) implements ModuleReference {}

    /**
     * A reference whose argument is broken or is a literal that is not a module name.
     *
     * @param line   The source line.
     * @param reason Human-readable description of the defect.
     */
    record Malformed(int line, String reason) implements ModuleReference {}
}
