package dev.pmsignal.clustering;

import dev.pmsignal.feedback.FeedbackRecord;
import dev.pmsignal.feedback.SourceType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Oversamples under-represented source types so centroid partitioning does not ignore them.
 *
 * <p>Every source type whose share of the records is below the configured threshold has each of
 * its records appended once more. Synthetic copies follow the originals, grouped by source type in
 * enum order and otherwise in input order.
 */
@Component
public class MinoritySourceBalancer {

  private static final Logger log = LoggerFactory.getLogger(MinoritySourceBalancer.class);

  private final ClusteringProperties properties;

  public MinoritySourceBalancer(ClusteringProperties properties) {
    this.properties = properties;
  }

  /**
   * @param records deduplicated records
   * @param matrix embedding row per record, same order
   */
  public BalancedSample balance(List<FeedbackRecord> records, float[][] matrix) {
    if (records.size() != matrix.length) {
      throw new IllegalArgumentException("records and matrix differ in size");
    }
    int total = records.size();
    if (total == 0) {
      return new BalancedSample(List.of(), new float[0][], 0);
    }

    Map<SourceType, List<Integer>> positionsByType = new EnumMap<>(SourceType.class);
    for (int i = 0; i < total; i++) {
      positionsByType.computeIfAbsent(records.get(i).sourceType(), t -> new ArrayList<>()).add(i);
    }

    List<FeedbackRecord> augmented = new ArrayList<>(records);
    List<float[]> rows = new ArrayList<>(List.of(matrix));
    for (Map.Entry<SourceType, List<Integer>> entry : positionsByType.entrySet()) {
      double share = (double) entry.getValue().size() / total;
      if (share >= properties.getMinorityShareThreshold()) {
        continue;
      }
      log.debug(
          "Oversampling {} {} records ({} share)",
          entry.getValue().size(),
          entry.getKey().value(),
          String.format("%.3f", share));
      for (int position : entry.getValue()) {
        augmented.add(records.get(position));
        rows.add(matrix[position]);
      }
    }
    return new BalancedSample(augmented, rows.toArray(new float[0][]), total);
  }
}
