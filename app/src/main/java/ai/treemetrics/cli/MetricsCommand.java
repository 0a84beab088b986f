package ai.treemetrics.cli;

import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.output.MetricsTreeIO;
import picocli.CommandLine;

@CommandLine.Command(
        name = "metrics",
        mixinStandardHelpOptions = true,
        description = "Compute the metrics tree of each source file.")
public final class MetricsCommand extends AbstractAnalysisCommand {
    @Override
    protected Object report(Space unit) {
        return MetricsTreeIO.toDto(unit);
    }
}
