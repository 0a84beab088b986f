package ai.treemetrics.metrics;

/** Arithmetic where log of zero and division by zero yield 0 instead of infinities or NaN. */
final class SafeMath {
    private SafeMath() {}

    static double log2(double x) {
        return x <= 0 ? 0.0 : Math.log(x) / Math.log(2);
    }

    static double ln(double x) {
        return x <= 0 ? 0.0 : Math.log(x);
    }

    static double div(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
