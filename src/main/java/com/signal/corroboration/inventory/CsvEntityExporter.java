package com.signal.corroboration.inventory;

import com.signal.corroboration.core.model.EntityRecord;
import com.signal.corroboration.core.model.EvidenceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * CSV exporter. One row per entity in ranking order; multi-valued cells are joined with "; ".
 *
 * <pre>
 * rank,name,key,region,score,evidence,attributes,categories,sources,observations,confidence
 * 1,Acme Energy LLC,acme energy,UAE,2,reference; announcement,S/4HANA,Energy,Seed; Press,3,High
 * </pre>
 */
public class CsvEntityExporter implements EntityExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvEntityExporter.class);

    static final String HEADER =
            "rank,name,key,region,score,evidence,attributes,categories,sources,observations,confidence";

    @Override
    public ExportResult export(RankedInventory inventory, OutputStream output) throws IOException {
        return export(inventory, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    @Override
    public ExportResult export(RankedInventory inventory, Writer writer) throws IOException {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long total = 0;
        long high = 0;

        pw.println(HEADER);
        for (EntityRecord entity : inventory.entities()) {
            total++;
            if (entity.getCorroborationScore() >= RankedInventory.HIGH_CONFIDENCE_SCORE) {
                high++;
            }
            pw.printf("%d,%s,%s,%s,%d,%s,%s,%s,%s,%d,%s%n",
                    total,
                    csvEscape(entity.getDisplayName()),
                    csvEscape(entity.getCanonicalKey()),
                    csvEscape(entity.getRegion()),
                    entity.getCorroborationScore(),
                    csvEscape(entity.getEvidenceKinds().stream()
                            .map(EvidenceKind::getLabel)
                            .collect(Collectors.joining("; "))),
                    csvEscape(join(entity.getAttributes())),
                    csvEscape(join(entity.getCategories())),
                    csvEscape(join(entity.getSources())),
                    entity.getObservationCount(),
                    csvEscape(confidenceLabel(entity)));
        }
        pw.flush();
        if (pw.checkError()) {
            log.error("export.failed format=csv written={}", total);
            throw new IOException("Failed writing CSV export after " + total + " rows");
        }

        ExportResult result = new ExportResult(getFormat(), total, high);
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static String confidenceLabel(EntityRecord entity) {
        return entity.getBestConfidence() != null ? entity.getBestConfidence().getLabel() : "";
    }

    private static String join(Collection<String> values) {
        return String.join("; ", values);
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
