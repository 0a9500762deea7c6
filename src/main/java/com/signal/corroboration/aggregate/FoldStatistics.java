package com.signal.corroboration.aggregate;

/**
 * Counters describing what happened to the observations of one fold.
 *
 * @param excluded           observations rejected because their raw name was excluded
 * @param tooShort           observations whose canonical key was shorter than the minimum
 * @param merged             observations merged into an already existing record
 * @param excludedAfterMerge records dropped by the final exclusion check on their canonical key
 */
public record FoldStatistics(
        int excluded,
        int tooShort,
        int merged,
        int excludedAfterMerge
) {
    @Override
    public String toString() {
        return "FoldStatistics{excluded=" + excluded +
                ", tooShort=" + tooShort +
                ", merged=" + merged +
                ", excludedAfterMerge=" + excludedAfterMerge + '}';
    }
}
