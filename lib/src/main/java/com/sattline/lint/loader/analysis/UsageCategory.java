package com.sattline.lint.loader.analysis;

public enum UsageCategory {
    /** Declared, never read or written. */
    UNUSED("unused"),
    /** Read but never written and not declared {@code CONST}. */
    READ_ONLY_NOT_CONST("read-only-not-const"),
    /** Written but never read. */
    WRITE_WITHOUT_READ("write-without-read");

    private final String label;

    UsageCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Category for the aggregated counts, or {@code null} when the variable is not reported. */
    static UsageCategory classify(int reads, int writes, boolean constant) {
        if (reads == 0 && writes == 0) {
            return UNUSED;
        }
        if (writes == 0) {
            return constant ? null : READ_ONLY_NOT_CONST;
        }
        if (reads == 0) {
            return WRITE_WITHOUT_READ;
        }
        return null;
    }
}
