package ai.treemetrics.cli;

import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.output.MetricsTreeIO;
import picocli.CommandLine;

@CommandLine.Command(
        name = "ops",
        mixinStandardHelpOptions = true,
        description = "List the distinct Halstead operators and operands of every space.")
public final class OpsCommand extends AbstractAnalysisCommand {
    @Override
    protected Object report(Space unit) {
        return MetricsTreeIO.toOpsDto(unit);
    }
}
