package ai.treemetrics.metrics;

/** Running count, sum, min and max over the spaces of a subtree. */
final class StatsAccumulator {
    private long count;
    private double sum;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    void add(double value) {
        count++;
        sum += value;
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    void merge(StatsAccumulator other) {
        if (other.count == 0) {
            return;
        }
        count += other.count;
        sum += other.sum;
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
    }

    double sum() {
        return sum;
    }

    double average() {
        return count == 0 ? 0.0 : sum / count;
    }

    double min() {
        return count == 0 ? 0.0 : min;
    }

    double max() {
        return count == 0 ? 0.0 : max;
    }
}
