package com.sattline.lint.loader.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** Result of a variable-usage pass. Entries keep declaration order: globals first, then module types. */
public final class UsageReport {
    private final List<UsageEntry> unused;
    private final List<UsageEntry> readOnlyNotConst;
    private final List<UsageEntry> writeWithoutRead;
    private final int analyzedVariables;

    public UsageReport(
            List<UsageEntry> unused,
            List<UsageEntry> readOnlyNotConst,
            List<UsageEntry> writeWithoutRead,
            int analyzedVariables) {
        this.unused = List.copyOf(unused);
        this.readOnlyNotConst = List.copyOf(readOnlyNotConst);
        this.writeWithoutRead = List.copyOf(writeWithoutRead);
        this.analyzedVariables = analyzedVariables;
    }

    public List<UsageEntry> getUnused() {
        return unused;
    }

    public List<UsageEntry> getReadOnlyNotConst() {
        return readOnlyNotConst;
    }

    public List<UsageEntry> getWriteWithoutRead() {
        return writeWithoutRead;
    }

    public List<UsageEntry> get(UsageCategory category) {
        Objects.requireNonNull(category, "category");
        return switch (category) {
            case UNUSED -> unused;
            case READ_ONLY_NOT_CONST -> readOnlyNotConst;
            case WRITE_WITHOUT_READ -> writeWithoutRead;
        };
    }

    /** Number of declared variables that were classified, reported or not. */
    public int getAnalyzedVariables() {
        return analyzedVariables;
    }

    public boolean isClean() {
        return unused.isEmpty() && readOnlyNotConst.isEmpty() && writeWithoutRead.isEmpty();
    }

    public String summary() {
        StringBuilder out = new StringBuilder();
        out.append("Variable usage: ")
                .append(analyzedVariables)
                .append(" variables analysed, ")
                .append(unused.size() + readOnlyNotConst.size() + writeWithoutRead.size())
                .append(" reported")
                .append(System.lineSeparator());
        for (UsageCategory category : UsageCategory.values()) {
            List<UsageEntry> entries = get(category);
            out.append("  ")
                    .append(category.getLabel())
                    .append(" (")
                    .append(entries.size())
                    .append(")")
                    .append(System.lineSeparator());
            Map<String, List<UsageEntry>> byScope =
                    entries.stream()
                            .collect(
                                    Collectors.groupingBy(
                                            UsageEntry::getScopeName,
                                            LinkedHashMap::new,
                                            Collectors.toList()));
            byScope.forEach(
                    (scope, scoped) -> {
                        out.append("    ").append(scope).append(": ");
                        out.append(
                                scoped.stream()
                                        .map(UsageEntry::getVariableName)
                                        .collect(Collectors.joining(", ")));
                        out.append(System.lineSeparator());
                    });
        }
        return out.toString();
    }
}
