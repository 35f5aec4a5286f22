package dev.pmsignal.clustering;

import java.util.Arrays;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Seeded k-means over an embedding matrix.
 *
 * <p>Centroids are initialised with k-means++ from a {@link Random} seeded by configuration, then
 * refined by Lloyd relocation (assign to nearest centroid, move centroids to the mean) until no
 * assignment changes or the iteration cap is reached. Distance ties go to the lower group index. A
 * group that loses all its rows keeps its previous centroid. The same matrix and seed always give
 * the same partition.
 */
@Component
public class Partitioner {

  private static final Logger log = LoggerFactory.getLogger(Partitioner.class);

  private final ClusteringProperties properties;

  public Partitioner(ClusteringProperties properties) {
    this.properties = properties;
  }

  /**
   * @param matrix rows to partition (all of the same dimension)
   * @param k number of groups, in {@code [1, matrix.length]}
   */
  public Partition partition(float[][] matrix, int k) {
    if (k < 1 || k > matrix.length) {
      throw new IllegalArgumentException(
          "k must be in [1, " + matrix.length + "], got: " + k);
    }
    Random random = new Random(properties.getSeed());
    float[][] centroids = initialCentroids(matrix, k, random);
    int[] labels = new int[matrix.length];
    Arrays.fill(labels, -1);

    int iteration = 0;
    boolean changed = true;
    while (changed && iteration < properties.getMaxIterations()) {
      changed = assign(matrix, centroids, labels);
      if (changed) {
        recomputeCentroids(matrix, labels, centroids);
      }
      iteration++;
    }
    log.debug("Partitioned {} rows into {} groups in {} iterations", matrix.length, k, iteration);
    return new Partition(labels, centroids, iteration);
  }

  /** k-means++ seeding: each next centroid is drawn with probability proportional to D². */
  private static float[][] initialCentroids(float[][] matrix, int k, Random random) {
    int n = matrix.length;
    float[][] centroids = new float[k][];
    boolean[] chosen = new boolean[n];
    int first = random.nextInt(n);
    centroids[0] = matrix[first].clone();
    chosen[first] = true;

    double[] nearest = new double[n];
    for (int i = 0; i < n; i++) {
      nearest[i] = VectorMath.squaredDistance(matrix[i], centroids[0]);
    }

    for (int c = 1; c < k; c++) {
      double total = 0.0;
      for (double d : nearest) {
        total += d;
      }
      int next;
      if (total == 0.0) {
        next = firstUnchosen(chosen);
      } else {
        double target = random.nextDouble() * total;
        next = n - 1;
        double cumulative = 0.0;
        for (int i = 0; i < n; i++) {
          cumulative += nearest[i];
          if (cumulative > target) {
            next = i;
            break;
          }
        }
      }
      centroids[c] = matrix[next].clone();
      chosen[next] = true;
      for (int i = 0; i < n; i++) {
        nearest[i] = Math.min(nearest[i], VectorMath.squaredDistance(matrix[i], centroids[c]));
      }
    }
    return centroids;
  }

  private static int firstUnchosen(boolean[] chosen) {
    for (int i = 0; i < chosen.length; i++) {
      if (!chosen[i]) {
        return i;
      }
    }
    return 0;
  }

  /** Returns true if any label changed. */
  private static boolean assign(float[][] matrix, float[][] centroids, int[] labels) {
    boolean changed = false;
    for (int i = 0; i < matrix.length; i++) {
      int best = 0;
      double bestDistance = Double.MAX_VALUE;
      for (int c = 0; c < centroids.length; c++) {
        double distance = VectorMath.squaredDistance(matrix[i], centroids[c]);
        if (distance < bestDistance) {
          bestDistance = distance;
          best = c;
        }
      }
      if (labels[i] != best) {
        labels[i] = best;
        changed = true;
      }
    }
    return changed;
  }

  private static void recomputeCentroids(float[][] matrix, int[] labels, float[][] centroids) {
    int dimension = matrix[0].length;
    double[][] sums = new double[centroids.length][dimension];
    int[] counts = new int[centroids.length];
    for (int i = 0; i < matrix.length; i++) {
      int label = labels[i];
      counts[label]++;
      for (int d = 0; d < dimension; d++) {
        sums[label][d] += matrix[i][d];
      }
    }
    for (int c = 0; c < centroids.length; c++) {
      if (counts[c] == 0) {
        continue;
      }
      float[] centroid = new float[dimension];
      for (int d = 0; d < dimension; d++) {
        centroid[d] = (float) (sums[c][d] / counts[c]);
      }
      centroids[c] = centroid;
    }
  }
}
