package dev.stepflow.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.stepflow.model.TransitionRow;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the transition table as CSV for the downstream rule engine. The
 * header is always the five columns below, and rows keep the order they
 * were given in.
 */
public final class TransitionTableWriter {

    public static final List<String> HEADER = List.of(
        "Source Node", "Destination Node", "Rule List", "Priority", "Operation / Edge Effect");

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
        .build();

    private static final CsvSchema SCHEMA = schema();

    private TransitionTableWriter() {}

    public static void write(List<TransitionRow> rows, Writer out) throws IOException {
        if (rows.isEmpty()) {
            // the schema only emits its header in front of a first record
            MAPPER.writer(SCHEMA.withoutHeader()).writeValue(out, headerRecord());
            return;
        }
        try (SequenceWriter writer = MAPPER.writer(SCHEMA).writeValues(out)) {
            writer.writeAll(rows.stream().map(TransitionTableWriter::toRecord).toList());
        }
    }

    public static void write(List<TransitionRow> rows, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(rows, out);
        }
    }

    public static String toCsv(List<TransitionRow> rows) throws IOException {
        var out = new StringWriter();
        write(rows, out);
        return out.toString();
    }

    private static Map<String, Object> toRecord(TransitionRow row) {
        var record = new LinkedHashMap<String, Object>();
        record.put(HEADER.get(0), row.sourceNode());
        record.put(HEADER.get(1), row.destinationNode());
        record.put(HEADER.get(2), row.ruleList());
        record.put(HEADER.get(3), row.priority());
        record.put(HEADER.get(4), row.operation());
        return record;
    }

    private static Map<String, Object> headerRecord() {
        var record = new LinkedHashMap<String, Object>();
        HEADER.forEach(column -> record.put(column, column));
        return record;
    }

    private static CsvSchema schema() {
        CsvSchema.Builder builder = CsvSchema.builder();
        HEADER.forEach(builder::addColumn);
        return builder.build().withHeader();
    }
}
