package com.sattline.lint.loader.analysis;

import com.sattline.lint.loader.ast.SourceLocation;
import com.sattline.lint.loader.ast.VariableQualifier;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** One reported variable with the counts that put it in its category. */
public final class UsageEntry {
    private final String variableName;
    private final String scopeName;
    private final String declaredType;
    private final Set<VariableQualifier> qualifiers;
    private final SourceLocation location;
    private final int readCount;
    private final int writeCount;

    public UsageEntry(
            String variableName,
            String scopeName,
            String declaredType,
            Set<VariableQualifier> qualifiers,
            SourceLocation location,
            int readCount,
            int writeCount) {
        this.variableName = Objects.requireNonNull(variableName, "variableName");
        this.scopeName = Objects.requireNonNull(scopeName, "scopeName");
        this.declaredType = Objects.requireNonNull(declaredType, "declaredType");
        this.qualifiers =
                qualifiers.isEmpty()
                        ? Collections.emptySet()
                        : Collections.unmodifiableSet(EnumSet.copyOf(qualifiers));
        this.location = Objects.requireNonNull(location, "location");
        this.readCount = readCount;
        this.writeCount = writeCount;
    }

    public String getVariableName() {
        return variableName;
    }

    /** Name of the module type owning the variable, or the root name for globals. */
    public String getScopeName() {
        return scopeName;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    public Set<VariableQualifier> getQualifiers() {
        return qualifiers;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getReadCount() {
        return readCount;
    }

    public int getWriteCount() {
        return writeCount;
    }

    @Override
    public String toString() {
        return scopeName + "." + variableName + ": " + declaredType + " (reads=" + readCount
                + ", writes=" + writeCount + ") at " + location;
    }
}
