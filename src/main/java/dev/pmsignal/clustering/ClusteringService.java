package dev.pmsignal.clustering;

import dev.pmsignal.feedback.FeedbackRecord;
import dev.pmsignal.feedback.FeedbackStore;
import dev.pmsignal.feedback.SourceType;
import dev.pmsignal.keypool.ExhaustedPoolException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Groups a session's feedback into named issue clusters.
 *
 * <p>Pipeline: fetch → deduplicate → choose k → oversample minority sources → k-means → drop
 * synthetic labels → merge tiny groups → pick representatives → rank by size → name → suppress
 * duplicate names.
 *
 * <p>Ranking happens before naming, so placeholder numbers and which of two look-alike names
 * survives follow the returned order. Each run is sequential and holds no state between calls.
 */
@Service
public class ClusteringService {

  private static final Logger log = LoggerFactory.getLogger(ClusteringService.class);

  private final FeedbackStore feedbackStore;
  private final Deduplicator deduplicator;
  private final ClusterCountSelector countSelector;
  private final MinoritySourceBalancer balancer;
  private final Partitioner partitioner;
  private final TinyClusterMerger merger;
  private final RepresentativeSelector representativeSelector;
  private final ClusterNamer namer;
  private final DuplicateNameFlagger nameFlagger;

  public ClusteringService(
      FeedbackStore feedbackStore,
      Deduplicator deduplicator,
      ClusterCountSelector countSelector,
      MinoritySourceBalancer balancer,
      Partitioner partitioner,
      TinyClusterMerger merger,
      RepresentativeSelector representativeSelector,
      ClusterNamer namer,
      DuplicateNameFlagger nameFlagger) {
    this.feedbackStore = feedbackStore;
    this.deduplicator = deduplicator;
    this.countSelector = countSelector;
    this.balancer = balancer;
    this.partitioner = partitioner;
    this.merger = merger;
    this.representativeSelector = representativeSelector;
    this.namer = namer;
    this.nameFlagger = nameFlagger;
  }

  /**
   * Clusters the feedback of one session.
   *
   * @param sessionId the upload session
   * @param clusterHint optional upper bound on the number of clusters
   * @return {@link ClusteringOutcome.Success} with clusters in descending size (empty for a session
   *     without data), or {@link ClusteringOutcome.PoolExhausted} when naming could not get a
   *     credential
   */
  public ClusteringOutcome runClustering(String sessionId, @Nullable Integer clusterHint) {
    List<FeedbackRecord> fetched = feedbackStore.fetchAll(sessionId);
    List<FeedbackRecord> records = deduplicator.deduplicate(fetched);
    if (records.isEmpty()) {
      log.info("Session {} has no feedback to cluster ({} fetched)", sessionId, fetched.size());
      return new ClusteringOutcome.Success(List.of());
    }

    int n = records.size();
    int distinctFiles = (int) records.stream().map(FeedbackRecord::sourceFile).distinct().count();
    int k = countSelector.resolve(n, distinctFiles, clusterHint);

    float[][] matrix = records.stream().map(FeedbackRecord::embedding).toArray(float[][]::new);
    BalancedSample sample = balancer.balance(records, matrix);
    Partition partition = partitioner.partition(sample.matrix(), k);
    int[] labels = Arrays.copyOf(partition.labels(), sample.originalCount());
    int[] merged = merger.merge(labels, partition.centroids());

    List<ClusterGroup> groups = buildGroups(records, matrix, merged, partition.groupCount());
    groups.sort(
        Comparator.comparingInt(ClusterGroup::count)
            .reversed()
            .thenComparingInt(ClusterGroup::index));

    List<String> names;
    try {
      names =
          namer.name(
              groups.stream().map(ClusterGroup::representativeExcerpts).toList(),
              groups.stream().map(ClusterGroup::homogeneity).toList());
    } catch (ExhaustedPoolException e) {
      log.warn("Naming for session {} stopped: {}", sessionId, e.getMessage());
      return new ClusteringOutcome.PoolExhausted(e.getProvider(), e.getRetryAfter(), e.getMessage());
    }
    List<String> finalNames = nameFlagger.flag(names);

    List<IssueCluster> clusters =
        IntStream.range(0, groups.size())
            .mapToObj(i -> groups.get(i).withName(finalNames.get(i)).toIssueCluster())
            .toList();
    log.info(
        "Clustered session {}: {} fetched, {} after dedup, {} synthetic, k={}, {} clusters",
        sessionId,
        fetched.size(),
        n,
        sample.syntheticCount(),
        k,
        clusters.size());
    return new ClusteringOutcome.Success(clusters);
  }

  private List<ClusterGroup> buildGroups(
      List<FeedbackRecord> records, float[][] matrix, int[] labels, int groupCount) {
    List<ClusterGroup> groups = new ArrayList<>();
    for (int label = 0; label < groupCount; label++) {
      int current = label;
      int[] members = IntStream.range(0, labels.length).filter(i -> labels[i] == current).toArray();
      if (members.length == 0) {
        continue;
      }
      float[] centroid = VectorMath.mean(matrix, members);
      Representatives representatives =
          representativeSelector.select(
              Arrays.stream(members).boxed().toList(), matrix, records, centroid);

      Map<SourceType, Integer> histogram = new EnumMap<>(SourceType.class);
      for (SourceType type : SourceType.values()) {
        histogram.put(type, 0);
      }
      List<String> memberIds = new ArrayList<>(members.length);
      for (int member : members) {
        FeedbackRecord record = records.get(member);
        memberIds.add(record.id());
        histogram.merge(record.sourceType(), 1, Integer::sum);
      }
      groups.add(
          new ClusterGroup(
              label,
              memberIds,
              centroid,
              representatives.excerpts(),
              representatives.homogeneity(),
              histogram,
              null));
    }
    return groups;
  }
}
