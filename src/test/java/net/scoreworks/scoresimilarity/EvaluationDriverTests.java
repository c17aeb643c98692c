package net.scoreworks.scoresimilarity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.scoreworks.scoresimilarity.comparison.ErrorKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class EvaluationDriverTests {
    EvaluationDriver driver = new EvaluationDriver(EvaluationSettings.DEFAULT);

    @TempDir
    Path directory;

    private void write(String fileName, String tokens) throws IOException {
        Files.writeString(directory.resolve(fileName), tokens, StandardCharsets.UTF_8);
    }

    private static int column(ErrorKind kind) {
        return kind.ordinal();
    }

    @Test
    public void testFixtureDirectory() throws IOException, URISyntaxException {
        Path fixtures = Paths.get(getClass().getClassLoader().getResource("fixtures").toURI());
        EvaluationTable table = driver.run(fixtures);
        List<String> names = new ArrayList<>();
        for (EvaluationTable.Row row : table.getRows())
            names.add(row.getName());
        Assertions.assertEquals(List.of("scenario", "waltz"), names);

        EvaluationTable.Row scenario = table.getRow("scenario");
        Assertions.assertEquals(0.5, scenario.get(column(ErrorKind.NOTE_SPELLING)), 1e-9);
        Assertions.assertEquals(0.5, scenario.get(column(ErrorKind.STEM_DIRECTION)), 1e-9);
        Assertions.assertEquals(0, scenario.get(column(ErrorKind.NOTE_DURATION)), 1e-9);
        int nNote = table.getColumns().indexOf("n_Note");
        Assertions.assertEquals(2, scenario.get(nNote), 1e-9);
        Assertions.assertEquals(1, scenario.get(table.getColumns().indexOf("n_Rest")), 1e-9);

        for (double value : table.getRow("waltz").getValues())
            Assertions.assertTrue(value == 0 || value == 4, "only symbol counts are set");
    }

    @Test
    public void testRawCounts() throws IOException {
        write("a.gt.txt", "R bar note_C4 len_1 note_D4 len_1");
        write("a.est.txt", "R bar note_C4 len_1 note_E4 len_1 note_D4 len_1");
        EvaluationTable table = new EvaluationDriver(EvaluationSettings.DEFAULT.withNormalize(false)).run(directory);
        Assertions.assertEquals(1, table.getRow("a").get(column(ErrorKind.NOTE_INSERTION)), 1e-9);

        EvaluationTable normalized = driver.run(directory);
        Assertions.assertEquals(0.5, normalized.getRow("a").get(column(ErrorKind.NOTE_INSERTION)), 1e-9);
    }

    @Test
    public void testBrokenPairsBecomeSentinelRows() throws IOException {
        write("good.gt.txt", "R bar note_C4 len_1");
        write("good.est.txt", "R bar note_C4 len_1");
        write("broken.gt.txt", "R bar note_C4 len_1");
        write("broken.est.txt", "R bar note_C4 flourish");
        write("orphan.est.txt", "R bar note_C4 len_1");

        EvaluationTable table = driver.run(directory);
        Assertions.assertEquals(2, table.getRows().size());
        EvaluationTable.Row broken = table.getRow("broken");
        Assertions.assertTrue(broken.isFailed());
        for (double value : broken.getValues())
            Assertions.assertEquals(-1, value, 1e-9);
        Assertions.assertFalse(table.getRow("good").isFailed());
        Assertions.assertThrows(IllegalArgumentException.class, () -> table.getRow("orphan"));

        //failed rows do not enter the summary
        Assertions.assertEquals(0, table.getSummary().get(column(ErrorKind.NOTE_DELETION)), 1e-9);
        Assertions.assertEquals(1, table.getSummary().get(table.getColumns().indexOf("n_Note")), 1e-9);
    }

    @Test
    public void testWriteJson() throws IOException {
        write("a.gt.txt", "R bar note_C4 len_1 rest len_1");
        write("a.est.txt", "R bar note_C4 len_1 rest len_2");
        write("b.gt.txt", "R bar note_C4 len_1");
        write("b.est.txt", "R bar");
        Path output = directory.resolve("result.json");
        driver.run(directory).write(output);

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        Assertions.assertEquals(18, json.get("columns").size());
        Assertions.assertEquals("Clef", json.get("columns").get(0).asText());
        Assertions.assertEquals(2, json.get("rows").size());
        JsonNode a = json.get("rows").get(0);
        Assertions.assertEquals("a", a.get("name").asText());
        Assertions.assertEquals(1.0, a.get("values").get(column(ErrorKind.REST_DURATION)).asDouble(), 1e-9);
        Assertions.assertEquals(1.0, a.get("values").get(column(ErrorKind.REST_DELETION)).asDouble(), 1e-9);
        Assertions.assertEquals(1.0, json.get("rows").get(1).get("values").get(column(ErrorKind.NOTE_DELETION)).asDouble(), 1e-9);
        Assertions.assertEquals("mean", json.get("summary").get("name").asText());
        Assertions.assertEquals(0.5, json.get("summary").get("values").get(column(ErrorKind.NOTE_DELETION)).asDouble(), 1e-9);
        Assertions.assertFalse(a.has("failed"));
    }
}
