package com.sattline.lint.loader.merge;

import java.util.List;
import java.util.Objects;

public final class MergeResult {
    private final BasePicture basePicture;
    private final List<MergeConflict> conflicts;

    public MergeResult(BasePicture basePicture, List<MergeConflict> conflicts) {
        this.basePicture = Objects.requireNonNull(basePicture, "basePicture");
        this.conflicts = List.copyOf(conflicts);
    }

    public BasePicture getBasePicture() {
        return basePicture;
    }

    /** Name collisions in the order they were met. */
    public List<MergeConflict> getConflicts() {
        return conflicts;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
