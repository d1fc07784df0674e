package org.nowstart.lotledger.service.ledger.classifier;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a broker CSV export into its header and data rows. Cells stay raw strings; meaning is assigned
 * later by {@link EventClassifier}.
 */
public class CsvExportReader {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectReader rowReader = CSV_MAPPER.readerForListOf(String.class)
            .with(CsvSchema.emptySchema())
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .with(CsvParser.Feature.TRIM_SPACES);

    public CsvExport read(byte[] content) {
        if (content == null || content.length == 0) {
            return new CsvExport(List.of(), List.of());
        }
        return read(new String(content, StandardCharsets.UTF_8));
    }

    public CsvExport read(String content) {
        if (content == null || content.isBlank()) {
            return new CsvExport(List.of(), List.of());
        }
        String text = content.charAt(0) == BYTE_ORDER_MARK ? content.substring(1) : content;

        List<List<String>> lines = new ArrayList<>();
        try (MappingIterator<List<String>> iterator = rowReader.readValues(text)) {
            while (iterator.hasNextValue()) {
                List<String> line = iterator.nextValue();
                if (!isBlank(line)) {
                    lines.add(line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read CSV export", e);
        }

        if (lines.isEmpty()) {
            return new CsvExport(List.of(), List.of());
        }
        return new CsvExport(lines.get(0), lines.subList(1, lines.size()));
    }

    private boolean isBlank(List<String> line) {
        if (line == null) {
            return true;
        }
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    public record CsvExport(
            List<String> header,
            List<List<String>> rows
    ) {

        public CsvExport {
            header = List.copyOf(header);
            rows = List.copyOf(rows);
        }
    }
}
