package outbreak.cluster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import outbreak.ConfigurationException;
import outbreak.InsufficientDataException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Profile clustering")
class ClustererTest {

    private static final double DELTA = 1e-9;

    private static EntityProfile profile(List<String> diseases, Object... entityThenVector) {
        Map<String, double[]> vectors = new LinkedHashMap<>();
        for (int i = 0; i < entityThenVector.length; i += 2) {
            vectors.put((String) entityThenVector[i], (double[]) entityThenVector[i + 1]);
        }
        return new EntityProfile(diseases, vectors);
    }

    private static EntityProfile randomProfile(int entities, long seed) {
        Random rnd = new Random(seed);
        Map<String, double[]> vectors = new LinkedHashMap<>();
        for (int i = 0; i < entities; i++) {
            vectors.put(String.format("state%02d", i),
                new double[] {rnd.nextInt(500), rnd.nextInt(50), rnd.nextInt(5)});
        }
        return new EntityProfile(List.of("malaria", "cholera", "ebola"), vectors);
    }

    @Test
    @DisplayName("Pure single-disease profiles never share a cluster")
    void testSingleDiseaseProfilesSeparated() {
        EntityProfile p = profile(List.of("cholera", "measles", "ebola"),
            "Kano", new double[] {100, 0, 0},
            "Lagos", new double[] {0, 100, 0},
            "Oyo", new double[] {50, 50, 0});

        double[][] z = Clusterer.standardize(p);
        double pure = distance(z[0], z[1]);
        assertTrue(pure > distance(z[2], z[0]) && pure > distance(z[2], z[1]));

        for (long seed = 0; seed < 20; seed++) {
            ClusterAssignment a = new Clusterer(2, 300, seed).cluster(p);
            assertNotEquals(a.clusterOf("Kano"), a.clusterOf("Lagos"), "seed " + seed);
        }
    }

    @Test
    @DisplayName("Zero-variance dimension standardizes to zero")
    void testZeroVarianceColumn() {
        EntityProfile p = profile(List.of("cholera", "ebola"),
            "Kano", new double[] {10, 4},
            "Lagos", new double[] {30, 4});

        double[][] z = Clusterer.standardize(p);

        assertEquals(-1.0, z[0][0], DELTA);
        assertEquals(1.0, z[1][0], DELTA);
        assertEquals(0.0, z[0][1], DELTA);
        assertEquals(0.0, z[1][1], DELTA);
    }

    @Test
    @DisplayName("Same profile, k and seed give the same assignment")
    void testReproducible() {
        EntityProfile p = randomProfile(37, 5);
        ClusterAssignment first = new Clusterer(3, 300, 42).cluster(p);
        ClusterAssignment second = new Clusterer(3, 300, 42).cluster(p);
        assertEquals(first.asMap(), second.asMap());
    }

    @Test
    @DisplayName("Every entity lands in exactly one cluster in [0, k)")
    void testPartitionTotality() {
        EntityProfile p = randomProfile(25, 9);
        ClusterAssignment a = new Clusterer(4, 300, 42).cluster(p);

        assertEquals(25, a.size());
        int total = 0;
        for (int id = 0; id < a.k(); id++) total += a.members(id).size();
        assertEquals(25, total);
        for (String entity : p.entities()) {
            int id = a.clusterOf(entity);
            assertTrue(id >= 0 && id < 4);
        }
    }

    @Test
    @DisplayName("Identical profiles still produce a total assignment")
    void testDuplicateProfiles() {
        EntityProfile p = profile(List.of("cholera"),
            "A", new double[] {5}, "B", new double[] {5}, "C", new double[] {5}, "D", new double[] {9});
        ClusterAssignment a = new Clusterer(2, 300, 1).cluster(p);
        assertEquals(4, a.size());
    }

    @Test
    void testFewerEntitiesThanClustersFails() {
        EntityProfile p = profile(List.of("cholera"), "Kano", new double[] {1}, "Lagos", new double[] {2});
        assertThrows(InsufficientDataException.class, () -> new Clusterer(3, 300, 42).cluster(p));
    }

    @Test
    void testInvalidClusterCount() {
        assertThrows(ConfigurationException.class, () -> new Clusterer(0, 300, 42));
    }

    @Test
    void testInputNotMutated() {
        EntityProfile p = randomProfile(10, 2);
        double[] before = p.vector("state03");
        new Clusterer(3, 300, 42).cluster(p);
        assertArrayEquals(before, p.vector("state03"), 0.0);
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += (a[i] - b[i]) * (a[i] - b[i]);
        return Math.sqrt(sum);
    }
}
