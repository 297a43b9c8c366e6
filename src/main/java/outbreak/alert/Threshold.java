package outbreak.alert;

/** Alert cutoff {@code mean + z * stddev} derived once from a pair's full history. */
public final class Threshold {

    private final double mean;
    private final double stddev;
    private final double z;
    private final double value;

    public Threshold(double mean, double stddev, double z) {
        this.mean = mean;
        this.stddev = stddev;
        this.z = z;
        this.value = stddev == 0 ? mean : mean + z * stddev;
    }

    public double getMean() { return mean; }
    public double getStddev() { return stddev; }
    public double getZ() { return z; }
    public double getValue() { return value; }

    /** Strictly greater: a forecast equal to the threshold does not trigger. */
    public boolean isExceededBy(double forecast) {
        return forecast > value;
    }

    @Override
    public String toString() {
        return String.format("%.2f (mean %.2f + %.1f x sd %.2f)", value, mean, z, stddev);
    }
}
