package ai.treemetrics.cli;

import java.util.concurrent.Callable;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

@CommandLine.Command(
        name = "treemetrics",
        mixinStandardHelpOptions = true,
        version = "treemetrics 0.1.0",
        description = "Source code metrics for Python, Go, Rust, TypeScript and TSX.",
        subcommands = {MetricsCommand.class, OpsCommand.class, FunctionsCommand.class, DiffCommand.class})
public final class TreeMetricsCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TreeMetricsCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            scope = CommandLine.ScopeType.INHERIT,
            description = "Log debug output to stderr.")
    void setVerbose(boolean verbose) {
        if (verbose) {
            Configurator.setLevel("ai.treemetrics", Level.DEBUG);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreeMetricsCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        logger.debug("No subcommand given");
        spec.commandLine().usage(System.err);
        return CommandLine.ExitCode.USAGE;
    }
}
