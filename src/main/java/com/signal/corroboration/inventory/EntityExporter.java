package com.signal.corroboration.inventory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;

/**
 * Writes a ranked inventory in a specific format for downstream renderers.
 */
public interface EntityExporter {

    /**
     * Writes every entity in ranking order. The writer is flushed but not closed.
     *
     * @param inventory the inventory to export
     * @param writer    the writer to write to
     * @return the export result
     * @throws IOException if writing fails
     */
    ExportResult export(RankedInventory inventory, Writer writer) throws IOException;

    /**
     * Writes UTF-8 encoded output to a stream.
     */
    ExportResult export(RankedInventory inventory, OutputStream output) throws IOException;

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
