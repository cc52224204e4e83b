package dev.stepflow.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.stepflow.model.TransitionRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TransitionTableWriterTest {

    private static final CsvMapper CSV = new CsvMapper();

    private static List<List<String>> cells(String csv) throws IOException {
        MappingIterator<List<String>> it = CSV.readerForListOf(String.class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .readValues(csv);
        return it.readAll();
    }

    private static List<Map<String, String>> records(String csv) throws IOException {
        MappingIterator<Map<String, String>> it = CSV.readerForMapOf(String.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(csv);
        return it.readAll();
    }

    @Test
    void headerAndRowsInOrder() throws IOException {
        String csv = TransitionTableWriter.toCsv(List.of(
            TransitionRow.of("LOGIN", "DASH", "IS_VALID").withOperation("emit OK"),
            TransitionRow.of("LOGIN", "ERROR", "").withPriority(10).withOperation("log")));

        assertThat(cells(csv).get(0)).containsExactlyElementsOf(TransitionTableWriter.HEADER);

        List<Map<String, String>> records = records(csv);
        assertThat(records).hasSize(2);
        assertThat(records.get(0)).containsEntry("Source Node", "LOGIN")
            .containsEntry("Destination Node", "DASH")
            .containsEntry("Rule List", "IS_VALID")
            .containsEntry("Priority", "50")
            .containsEntry("Operation / Edge Effect", "emit OK");
        assertThat(records.get(1)).containsEntry("Destination Node", "ERROR")
            .containsEntry("Priority", "10");
        assertThat(records.get(1).get("Rule List")).isNullOrEmpty();
    }

    @Test
    void emptyTableStillHasHeader() throws IOException {
        String csv = TransitionTableWriter.toCsv(List.of());

        List<List<String>> cells = cells(csv);
        assertThat(cells).hasSize(1);
        assertThat(cells.get(0)).containsExactlyElementsOf(TransitionTableWriter.HEADER);
    }

    @Test
    void quotesValuesContainingSeparators() throws IOException {
        String csv = TransitionTableWriter.toCsv(List.of(
            TransitionRow.of("Checkout > Pay, now", "Say \"hi\"", "is valid? + has 2fa?").withOperation("x")));

        Map<String, String> record = records(csv).get(0);
        assertThat(record).containsEntry("Source Node", "Checkout > Pay, now")
            .containsEntry("Destination Node", "Say \"hi\"")
            .containsEntry("Rule List", "is valid? + has 2fa?");
    }

    @Test
    void writesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("table.csv");

        TransitionTableWriter.write(List.of(TransitionRow.terminal("DASH").withOperation("end")), file);

        String csv = Files.readString(file);
        assertThat(csv).isEqualTo(TransitionTableWriter.toCsv(List.of(TransitionRow.terminal("DASH").withOperation("end"))));
        assertThat(records(csv)).singleElement().satisfies(r -> assertThat(r).containsEntry("Source Node", "DASH"));
    }
}
