package ai.treemetrics.metrics;

import static ai.treemetrics.analyzer.SemanticCategory.*;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SourceContent;
import ai.treemetrics.analyzer.space.CognitiveMetrics;
import ai.treemetrics.analyzer.space.CyclomaticMetrics;
import ai.treemetrics.analyzer.space.ExitMetrics;
import ai.treemetrics.analyzer.space.MetricsRecord;
import ai.treemetrics.analyzer.space.NArgsMetrics;
import ai.treemetrics.analyzer.space.NomMetrics;
import ai.treemetrics.analyzer.space.RawCounters;
import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.analyzer.space.SpaceKind;
import ai.treemetrics.space.SpaceScope;
import ai.treemetrics.space.SpaceTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the metrics of every space of a {@link SpaceTree}. Spaces are finalized children first, so values derived
 * from other metrics or aggregated over a subtree only ever read finished records.
 */
public final class MetricEngine {

    /** A finished space and the statistics its parent folds in. */
    private record Computed(Space space, Subtree subtree) {}

    private static final class Subtree {
        final StatsAccumulator cyclomatic = new StatsAccumulator();
        final StatsAccumulator cognitive = new StatsAccumulator();
        final StatsAccumulator exits = new StatsAccumulator();
        final StatsAccumulator nargs = new StatsAccumulator();
        long functions;
        long closures;

        void merge(Subtree other) {
            cyclomatic.merge(other.cyclomatic);
            cognitive.merge(other.cognitive);
            exits.merge(other.exits);
            nargs.merge(other.nargs);
            functions += other.functions;
            closures += other.closures;
        }
    }

    private final SpaceTree tree;
    private final LanguageClassifier classifier;
    private final SourceContent content;
    private final LineClassification lines;

    private MetricEngine(SpaceTree tree) {
        this.tree = tree;
        this.classifier = tree.classifier();
        this.content = tree.source().content();
        this.lines = LineClassification.of(tree.source().root(), classifier, content);
    }

    public static Space compute(SpaceTree tree) {
        return new MetricEngine(tree).run();
    }

    private Space run() {
        // reverse of a pre-order visit puts every child before its parent
        var order = new ArrayList<SpaceScope>();
        var stack = new ArrayDeque<SpaceScope>();
        stack.push(tree.unit());
        while (!stack.isEmpty()) {
            var scope = stack.pop();
            order.add(scope);
            scope.children().forEach(stack::push);
        }

        Map<SpaceScope, Computed> done = new IdentityHashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            var scope = order.get(i);
            var children = scope.children().stream().map(done::get).toList();
            done.put(scope, computeSpace(scope, children));
        }
        return done.get(tree.unit()).space();
    }

    private Computed computeSpace(SpaceScope scope, List<Computed> children) {
        var kind = scope.kind();
        var counts = OwnCodeCounts.scan(scope.node(), classifier);

        double cyclomatic = CyclomaticMetric.compute(kind, counts);
        double cognitive = CognitiveMetric.compute(scope, classifier);
        var halstead = HalsteadMetric.compute(counts.operators(), counts.operands());
        var loc = LocMetric.compute(scope, content, lines, counts.statements());
        var abc = AbcMetric.compute(counts);
        var mi = MaintainabilityIndexMetric.compute(halstead.volume(), cyclomatic, loc);
        long exits = counts.count(EXIT_STATEMENT);
        long nargs = kind.isFunctionLike() ? NArgsMetric.count(scope.node(), classifier) : 0;

        long methods = 0;
        long publicMethods = 0;
        long publicAttributes = 0;
        double wmc = 0;
        if (kind == SpaceKind.TYPE) {
            methods = TypeMetrics.methods(scope);
            publicMethods = TypeMetrics.publicMethods(scope, classifier);
            publicAttributes = TypeMetrics.publicAttributes(scope, classifier);
            wmc = children.stream()
                    .filter(c -> c.space().kind() == SpaceKind.FUNCTION)
                    .mapToDouble(c -> c.space().metrics().cyclomatic().cyclomatic())
                    .sum();
        }

        var subtree = new Subtree();
        subtree.cyclomatic.add(cyclomatic);
        subtree.cognitive.add(cognitive);
        subtree.exits.add(exits);
        if (kind.isFunctionLike()) {
            subtree.nargs.add(nargs);
        }
        subtree.functions = kind == SpaceKind.FUNCTION ? 1 : 0;
        subtree.closures = kind == SpaceKind.CLOSURE ? 1 : 0;
        var parameterCounts = new ArrayList<Long>();
        for (var child : children) {
            subtree.merge(child.subtree());
            if (child.space().kind().isFunctionLike()) {
                parameterCounts.add(child.space().metrics().nargs().nargs());
            }
        }

        var raw = new RawCounters(
                counts.operators(),
                counts.operands(),
                counts.count(BRANCH),
                counts.count(LOOP),
                counts.count(LOGICAL_AND_OR),
                exits,
                parameterCounts,
                publicAttributes,
                methods);

        var metrics = new MetricsRecord(
                new CyclomaticMetrics(
                        cyclomatic,
                        subtree.cyclomatic.sum(),
                        subtree.cyclomatic.average(),
                        subtree.cyclomatic.min(),
                        subtree.cyclomatic.max()),
                new CognitiveMetrics(
                        cognitive,
                        subtree.cognitive.sum(),
                        subtree.cognitive.average(),
                        subtree.cognitive.min(),
                        subtree.cognitive.max()),
                halstead,
                loc,
                abc,
                mi,
                new NArgsMetrics(
                        nargs,
                        (long) subtree.nargs.sum(),
                        (long) subtree.nargs.min(),
                        (long) subtree.nargs.max(),
                        subtree.nargs.average()),
                new NomMetrics(methods, publicMethods, subtree.functions, subtree.closures),
                publicAttributes,
                wmc,
                new ExitMetrics(
                        exits, subtree.exits.sum(), subtree.exits.average(), subtree.exits.min(), subtree.exits.max()),
                raw);

        boolean isUnit = kind == SpaceKind.UNIT;
        int startLine = isUnit ? 1 : content.rowOfByte(scope.startByte()) + 1;
        int endLine = isUnit
                ? Math.max(1, content.lineCount())
                : content.lastRowOfRange(scope.startByte(), scope.endByte()) + 1;
        var space = new Space(
                kind,
                scope.name(),
                scope.startByte(),
                scope.endByte(),
                startLine,
                endLine,
                isUnit && tree.degraded(),
                metrics,
                children.stream().map(Computed::space).toList());
        return new Computed(space, subtree);
    }
}
