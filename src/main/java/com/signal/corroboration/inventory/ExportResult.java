package com.signal.corroboration.inventory;

/**
 * Result of an inventory export.
 *
 * @param format                 format written, e.g. "csv"
 * @param totalEntities          number of entity rows written
 * @param highConfidenceEntities how many of those reached the high-confidence score
 */
public record ExportResult(
        String format,
        long totalEntities,
        long highConfidenceEntities
) {
    @Override
    public String toString() {
        return "ExportResult{format=" + format +
                ", entities=" + totalEntities +
                ", highConfidence=" + highConfidenceEntities + '}';
    }
}
