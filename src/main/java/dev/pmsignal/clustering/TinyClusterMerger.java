package dev.pmsignal.clustering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folds undersized groups into their nearest neighbour.
 *
 * <p>The groups holding between 1 and {@code minSize - 1} members when the call starts are
 * processed once each, in ascending label order. All current members of such a group move to the
 * label whose centroid is nearest (Euclidean) among the other labels that still have members. A
 * group that becomes undersized or receives members during the pass is not revisited. Empty labels
 * are ignored.
 */
@Component
public class TinyClusterMerger {

  private static final Logger log = LoggerFactory.getLogger(TinyClusterMerger.class);

  private final ClusteringProperties properties;

  public TinyClusterMerger(ClusteringProperties properties) {
    this.properties = properties;
  }

  public int[] merge(int[] labels, float[][] centroids) {
    return merge(labels, centroids, properties.getMinClusterSize());
  }

  /**
   * @param labels group label per record, each in {@code [0, centroids.length)}
   * @param centroids centroid per label
   * @param minSize smallest group size left alone
   * @return new label array; the input is not modified
   */
  public int[] merge(int[] labels, float[][] centroids, int minSize) {
    int[] result = labels.clone();
    int[] counts = new int[centroids.length];
    for (int label : result) {
      counts[label]++;
    }

    boolean[] undersized = new boolean[centroids.length];
    for (int c = 0; c < centroids.length; c++) {
      undersized[c] = counts[c] > 0 && counts[c] < minSize;
    }

    for (int source = 0; source < centroids.length; source++) {
      if (!undersized[source] || counts[source] == 0) {
        continue;
      }
      int target = nearestPopulated(source, centroids, counts);
      if (target < 0) {
        continue;
      }
      for (int i = 0; i < result.length; i++) {
        if (result[i] == source) {
          result[i] = target;
        }
      }
      log.debug("Merged group {} ({} members) into group {}", source, counts[source], target);
      counts[target] += counts[source];
      counts[source] = 0;
    }
    return result;
  }

  private static int nearestPopulated(int source, float[][] centroids, int[] counts) {
    int best = -1;
    double bestDistance = Double.MAX_VALUE;
    for (int c = 0; c < centroids.length; c++) {
      if (c == source || counts[c] == 0) {
        continue;
      }
      double distance = VectorMath.euclidean(centroids[source], centroids[c]);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = c;
      }
    }
    return best;
  }
}
