package ai.treemetrics.cli;

import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.output.MetricsTreeIO;
import java.io.IOException;
import picocli.CommandLine;

/** Prints function and closure spans, as plain text unless an output format is chosen. */
@CommandLine.Command(
        name = "functions",
        mixinStandardHelpOptions = true,
        description = "List the functions and closures of each source file with their line spans.")
public final class FunctionsCommand extends AbstractAnalysisCommand {
    @Override
    protected Object report(Space unit) {
        return MetricsTreeIO.toFunctionsDto(unit);
    }

    @Override
    protected void emit(SourceFile file, Space unit, RunConfig config) throws IOException {
        if (config.format() != null || options.outputDir != null) {
            super.emit(file, unit, config);
            return;
        }
        out().print(formatSpans(MetricsTreeIO.toFunctionsDto(unit)));
        out().flush();
    }

    static String formatSpans(MetricsTreeIO.FunctionsDto functions) {
        var sb = new StringBuilder();
        sb.append(functions.path()).append('\n');
        for (var span : functions.functions()) {
            sb.append(span.name())
                    .append(": ")
                    .append(span.startLine())
                    .append('-')
                    .append(span.endLine())
                    .append('\n');
        }
        return sb.toString();
    }
}
