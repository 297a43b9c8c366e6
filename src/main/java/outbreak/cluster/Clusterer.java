package outbreak.cluster;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.ConfigurationException;
import outbreak.InsufficientDataException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions entity profiles into k clusters.
 * <p>
 * Each disease dimension is standardized to zero mean and unit (population) variance; a
 * dimension with no variance becomes all zeros. Lloyd iterations then run from k-means++
 * seeds drawn with a fixed-seed generator, so identical input always yields the same
 * assignment. Points equidistant from two centroids go to the lower index.
 */
public class Clusterer {

    private static final Logger log = LoggerFactory.getLogger(Clusterer.class);

    private final int k;
    private final int maxIterations;
    private final long seed;

    public Clusterer(int k, int maxIterations, long seed) {
        if (k < 1) throw new ConfigurationException("cluster count must be >= 1, got " + k);
        if (maxIterations < 1) throw new ConfigurationException("maxIterations must be >= 1");
        this.k = k;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    public ClusterAssignment cluster(EntityProfile profile) {
        int n = profile.size();
        if (n == 0) throw new InsufficientDataException("no entities to cluster");
        if (n < k) {
            throw new InsufficientDataException(n + " entities cannot form " + k + " clusters");
        }

        List<String> entities = profile.entities();
        double[][] scaled = standardize(profile);
        List<ProfilePoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) points.add(new ProfilePoint(entities.get(i), scaled[i]));

        RandomGenerator random = new JDKRandomGenerator();
        random.setSeed(seed);
        KMeansPlusPlusClusterer<ProfilePoint> kmeans =
            new KMeansPlusPlusClusterer<>(k, maxIterations, new EuclideanDistance(), random);

        List<CentroidCluster<ProfilePoint>> clusters;
        try {
            clusters = kmeans.cluster(points);
        } catch (MathIllegalStateException e) {
            throw new InsufficientDataException("profiles too degenerate for " + k + " clusters: " + e.getMessage());
        }

        Map<String, Integer> labels = new HashMap<>();
        for (int id = 0; id < clusters.size(); id++) {
            for (ProfilePoint p : clusters.get(id).getPoints()) labels.put(p.entity, id);
        }
        log.info("Clustered {} entities over {} diseases into {} clusters", n, profile.dimensions(), k);
        return new ClusterAssignment(k, labels);
    }

    /** Rows follow {@link EntityProfile#entities()}, columns the disease order. */
    public static double[][] standardize(EntityProfile profile) {
        List<String> entities = profile.entities();
        int n = entities.size();
        int d = profile.dimensions();
        double[][] out = new double[n][d];
        for (int j = 0; j < d; j++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) column[i] = profile.vector(entities.get(i))[j];
            double mean = new Mean().evaluate(column);
            double sd = new StandardDeviation(false).evaluate(column);
            for (int i = 0; i < n; i++) {
                out[i][j] = sd > 0 ? (column[i] - mean) / sd : 0.0;
            }
        }
        return out;
    }

    public int getK() { return k; }

    private static final class ProfilePoint implements Clusterable {
        private final String entity;
        private final double[] point;

        ProfilePoint(String entity, double[] point) {
            this.entity = entity;
            this.point = point;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
