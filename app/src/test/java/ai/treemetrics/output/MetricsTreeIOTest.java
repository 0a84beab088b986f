package ai.treemetrics.output;

import static org.junit.jupiter.api.Assertions.*;

import ai.treemetrics.MetricsAnalyzer;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.space.Space;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricsTreeIOTest {

    private static Space unit;

    @BeforeAll
    static void analyzeSample() throws Exception {
        unit = MetricsAnalyzer.analyze(
                Language.PYTHON,
                """
                def outer(x):
                    inner = lambda y: y + x
                    return inner(1)
                """,
                "sample.py");
    }

    @Test
    void jsonUsesSnakeCaseKeys() throws Exception {
        var json = MetricsTreeIO.writeAsString(MetricsTreeIO.toDto(unit), OutputFormat.JSON, false);

        assertTrue(json.contains("\"start_line\":1"), json);
        assertTrue(json.contains("\"end_line\":3"), json);
        assertTrue(json.contains("\"kind\":\"unit\""), json);
        assertTrue(json.contains("\"estimated_program_length\""), json);
        assertTrue(json.contains("\"visual_studio\""), json);
        assertFalse(json.contains("startLine"), json);
    }

    @Test
    void jsonReadsBackIntoTheSameTree() throws Exception {
        var dto = MetricsTreeIO.toDto(unit);
        var json = MetricsTreeIO.writeAsString(dto, OutputFormat.JSON, true);

        assertEquals(dto, MetricsTreeIO.readJson(json));
    }

    @Test
    void prettyPrintingOnlyAffectsJson() throws Exception {
        var dto = MetricsTreeIO.toFunctionsDto(unit);

        var compact = MetricsTreeIO.writeAsString(dto, OutputFormat.JSON, false);
        var pretty = MetricsTreeIO.writeAsString(dto, OutputFormat.JSON, true);
        assertFalse(compact.contains("\n"));
        assertTrue(pretty.contains("\n"));

        assertEquals(
                MetricsTreeIO.writeAsString(dto, OutputFormat.YAML, false),
                MetricsTreeIO.writeAsString(dto, OutputFormat.YAML, true));
    }

    @Test
    void textFormatsCarryTheSameKeys() throws Exception {
        var dto = MetricsTreeIO.toDto(unit);

        var yaml = MetricsTreeIO.writeAsString(dto, OutputFormat.YAML, false);
        assertTrue(yaml.contains("start_line: 1"), yaml);

        var toml = MetricsTreeIO.writeAsString(dto, OutputFormat.TOML, false);
        assertTrue(toml.contains("start_line = 1"), toml);
    }

    @Test
    void cborIsBinaryOnly() throws Exception {
        var dto = MetricsTreeIO.toDto(unit);
        assertThrows(
                IllegalArgumentException.class, () -> MetricsTreeIO.writeAsString(dto, OutputFormat.CBOR, false));

        var out = new ByteArrayOutputStream();
        MetricsTreeIO.write(dto, OutputFormat.CBOR, true, out);

        var tree = new ObjectMapper(new CBORFactory()).readTree(out.toByteArray());
        assertEquals("sample.py", tree.get("name").asText());
        assertEquals("unit", tree.get("kind").asText());
        assertEquals(1, tree.get("spaces").size());
    }

    @Test
    void textOutputEndsWithNewline() throws Exception {
        var out = new ByteArrayOutputStream();
        MetricsTreeIO.write(MetricsTreeIO.toFunctionsDto(unit), OutputFormat.JSON, false, out);

        assertTrue(out.toString(StandardCharsets.UTF_8).endsWith("}\n"));
    }

    @Test
    void functionSpansListFunctionsAndClosuresInSourceOrder() {
        var dto = MetricsTreeIO.toFunctionsDto(unit);

        assertEquals("sample.py", dto.path());
        assertEquals(2, dto.functions().size());
        assertEquals(new MetricsTreeIO.FunctionSpanDto("function", "outer", 1, 3), dto.functions().get(0));
        assertEquals("closure", dto.functions().get(1).kind());
        assertEquals("inner", dto.functions().get(1).name());
    }

    @Test
    void operatorListingFollowsTheSpaceTree() {
        var ops = MetricsTreeIO.toOpsDto(unit);

        assertEquals("unit", ops.kind());
        var outer = ops.spaces().get(0);
        assertEquals("outer", outer.name());
        assertTrue(outer.operators().contains("return"), outer.operators().toString());
        assertTrue(outer.operands().contains("inner"), outer.operands().toString());
    }

    @Test
    void saveCreatesParentDirectories(@TempDir Path dir) throws Exception {
        var target = dir.resolve("nested/deeper/sample.py.yaml");

        MetricsTreeIO.save(MetricsTreeIO.toDto(unit), OutputFormat.YAML, false, target);

        assertTrue(Files.isRegularFile(target));
        assertTrue(Files.readString(target).contains("name: \"sample.py\""));
    }
}
