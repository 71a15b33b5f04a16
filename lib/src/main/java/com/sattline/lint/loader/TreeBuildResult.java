package com.sattline.lint.loader;

import com.sattline.lint.loader.ast.ProgramNode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Output of {@link TreeBuilder}: the file's syntax tree plus the names it declares and references. */
public final class TreeBuildResult {
    private final ProgramNode program;
    private final Set<String> declaredNames;
    private final Set<String> referencedNames;

    public TreeBuildResult(ProgramNode program, Set<String> declaredNames, Set<String> referencedNames) {
        this.program = Objects.requireNonNull(program, "program");
        this.declaredNames = Collections.unmodifiableSet(new LinkedHashSet<>(declaredNames));
        this.referencedNames = Collections.unmodifiableSet(new LinkedHashSet<>(referencedNames));
    }

    public ProgramNode getProgram() {
        return program;
    }

    /** Datatype and module-type names defined in the file, in source order. */
    public Set<String> getDeclaredNames() {
        return declaredNames;
    }

    /**
     * Type names used by the file that are neither built in nor declared in the file itself, in order
     * of first use. Each of these is expected to be provided by another source file.
     */
    public Set<String> getReferencedNames() {
        return referencedNames;
    }
}
