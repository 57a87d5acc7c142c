package com.purchasingpower.codegraph.resolution;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome counts of one resolver pass.
 */
@Getter
@ToString
public class ResolutionReport {

    private int resolved;
    private int unresolved;
    private int ambiguous;
    /** Targets that were already final before the pass (direct identities, external markers). */
    private int untouched;
    /** Relationships dropped because resolution made them identical to another edge of the same source. */
    private int duplicatesRemoved;

    public void recordResolved() {
        resolved++;
    }

    public void recordUnresolved() {
        unresolved++;
    }

    public void recordAmbiguous() {
        ambiguous++;
    }

    public void recordUntouched() {
        untouched++;
    }

    public void recordDuplicatesRemoved(int count) {
        duplicatesRemoved += count;
    }

    public int getPlaceholders() {
        return resolved + unresolved + ambiguous;
    }
}
