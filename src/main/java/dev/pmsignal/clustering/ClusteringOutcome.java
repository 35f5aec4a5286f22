package dev.pmsignal.clustering;

import java.time.Duration;
import java.util.List;

/** Result of {@link ClusteringService#runClustering}. */
public sealed interface ClusteringOutcome {

  /**
   * Clustering completed. An empty list means the session had no usable feedback.
   *
   * @param clusters clusters in descending member count
   */
  record Success(List<IssueCluster> clusters) implements ClusteringOutcome {
    public Success {
      clusters = List.copyOf(clusters);
    }

    public int totalRecords() {
      return clusters.stream().mapToInt(IssueCluster::count).sum();
    }
  }

  /**
   * Every credential of the naming provider was cooling down; the caller should retry later.
   *
   * @param provider the exhausted provider
   * @param retryAfter time until the first credential becomes eligible again
   * @param message human-readable explanation
   */
  record PoolExhausted(String provider, Duration retryAfter, String message)
      implements ClusteringOutcome {}
}
