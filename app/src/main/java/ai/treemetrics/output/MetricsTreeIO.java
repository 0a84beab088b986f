package ai.treemetrics.output;

import ai.treemetrics.analyzer.space.MetricsRecord;
import ai.treemetrics.analyzer.space.Space;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes metrics trees, operator listings and function spans. Space trees are converted to snake_case DTOs so the
 * serialized shape does not depend on the in-memory model.
 */
public final class MetricsTreeIO {
    private static final Logger logger = LogManager.getLogger(MetricsTreeIO.class);

    private static final Map<OutputFormat, ObjectMapper> MAPPERS = new EnumMap<>(OutputFormat.class);

    static {
        MAPPERS.put(OutputFormat.JSON, configure(new ObjectMapper()));
        MAPPERS.put(OutputFormat.YAML, configure(new YAMLMapper()));
        MAPPERS.put(OutputFormat.TOML, configure(new TomlMapper()));
        MAPPERS.put(OutputFormat.CBOR, configure(new ObjectMapper(new CBORFactory())));
    }

    private MetricsTreeIO() {}

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        // callers own the stream (often System.out)
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        return mapper;
    }

    /* ================= DTOs ================= */

    public record SpaceDto(
            String kind,
            String name,
            int startLine,
            int endLine,
            boolean degraded,
            MetricsRecord metrics,
            List<SpaceDto> spaces) {}

    public record OpsDto(
            String kind,
            String name,
            int startLine,
            int endLine,
            List<String> operators,
            List<String> operands,
            List<OpsDto> spaces) {}

    public record FunctionSpanDto(String kind, String name, int startLine, int endLine) {}

    public record FunctionsDto(String path, List<FunctionSpanDto> functions) {}

    /* ================= Converters ================= */

    public static SpaceDto toDto(Space space) {
        return new SpaceDto(
                space.kind().label(),
                space.name(),
                space.startLine(),
                space.endLine(),
                space.degraded(),
                space.metrics(),
                space.spaces().stream().map(MetricsTreeIO::toDto).toList());
    }

    public static OpsDto toOpsDto(Space space) {
        var raw = space.metrics().raw();
        return new OpsDto(
                space.kind().label(),
                space.name(),
                space.startLine(),
                space.endLine(),
                List.copyOf(raw.operators().keySet()),
                List.copyOf(raw.operands().keySet()),
                space.spaces().stream().map(MetricsTreeIO::toOpsDto).toList());
    }

    /** Functions and closures of a unit in source order. */
    public static FunctionsDto toFunctionsDto(Space unit) {
        var spans = unit.flatten()
                .filter(s -> s.kind().isFunctionLike())
                .map(s -> new FunctionSpanDto(s.kind().label(), s.name(), s.startLine(), s.endLine()))
                .toList();
        return new FunctionsDto(unit.name(), spans);
    }

    /* ================= Writing ================= */

    public static void write(Object dto, OutputFormat format, boolean pretty, OutputStream out) throws IOException {
        var mapper = MAPPERS.get(format);
        var writer = pretty && format == OutputFormat.JSON ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        writer.writeValue(out, dto);
        if (!format.isBinary()) {
            out.write('\n');
        }
        out.flush();
    }

    public static String writeAsString(Object dto, OutputFormat format, boolean pretty) throws IOException {
        if (format.isBinary()) {
            throw new IllegalArgumentException(format + " output is binary");
        }
        var mapper = MAPPERS.get(format);
        var writer = pretty && format == OutputFormat.JSON ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        return writer.writeValueAsString(dto);
    }

    /** Writes {@code dto} to {@code file}, creating parent directories. */
    public static void save(Object dto, OutputFormat format, boolean pretty, Path file) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var out = Files.newOutputStream(file)) {
            write(dto, format, pretty, out);
        }
        logger.debug("Wrote {} output to {}", format.extension(), file);
    }

    /** Reads a JSON metrics tree back, e.g. to compare two stored runs. */
    public static SpaceDto readJson(String json) throws IOException {
        return MAPPERS.get(OutputFormat.JSON).readValue(json, SpaceDto.class);
    }
}
