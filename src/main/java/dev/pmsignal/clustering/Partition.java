package dev.pmsignal.clustering;

/**
 * Output of {@link Partitioner}: one label per input row and the final centroids.
 *
 * @param labels group index in {@code [0, centroids.length)} for each row
 * @param centroids one centroid per group
 * @param iterations relocation rounds performed
 */
public record Partition(int[] labels, float[][] centroids, int iterations) {

  public int groupCount() {
    return centroids.length;
  }
}
