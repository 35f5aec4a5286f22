package dev.pmsignal.clustering;

import dev.pmsignal.feedback.FeedbackRecord;
import java.util.List;

/**
 * Records and embedding rows after minority oversampling.
 *
 * <p>Positions {@code >= originalCount} in both {@code records} and {@code matrix} are synthetic
 * copies and must never be reported.
 *
 * @param records original records followed by synthetic copies
 * @param matrix one embedding row per entry of {@code records}
 * @param originalCount number of leading, non-synthetic entries
 */
public record BalancedSample(List<FeedbackRecord> records, float[][] matrix, int originalCount) {

  public BalancedSample {
    records = List.copyOf(records);
    if (matrix.length != records.size()) {
      throw new IllegalArgumentException(
          "matrix rows (" + matrix.length + ") must match records (" + records.size() + ")");
    }
    if (originalCount < 0 || originalCount > records.size()) {
      throw new IllegalArgumentException("originalCount out of range: " + originalCount);
    }
  }

  public int syntheticCount() {
    return records.size() - originalCount;
  }
}
