package outbreak.ml;

import java.util.Random;

/** Synthetic weekly case counts with a yearly cycle. */
final class SeasonalSeries {

    private SeasonalSeries() { }

    static long[] weekly(int weeks, long seed) {
        Random rnd = new Random(seed);
        long[] out = new long[weeks];
        for (int t = 0; t < weeks; t++) {
            double v = 20 + 10 * Math.sin(2 * Math.PI * t / 52.0) + 0.02 * t + rnd.nextGaussian() * 2;
            out[t] = Math.max(0, Math.round(v));
        }
        return out;
    }

    static double[] asDoubles(long[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i];
        return out;
    }
}
