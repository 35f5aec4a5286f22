package dev.pmsignal.clustering;

import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Picks the number of groups from corpus size and source diversity.
 *
 * <p>The table is a heuristic: a single source file rarely sustains many distinct themes, and
 * larger corpora get more groups in coarse steps.
 */
@Component
public class ClusterCountSelector {

  /**
   * Rule table, evaluated in order: one distinct file → 3; fewer than 20 records → 3; up to 50 →
   * 5; up to 100 → 7; otherwise 10.
   */
  public int select(int recordCount, int distinctSourceFiles) {
    if (distinctSourceFiles == 1) {
      return 3;
    }
    if (recordCount < 20) {
      return 3;
    }
    if (recordCount <= 50) {
      return 5;
    }
    if (recordCount <= 100) {
      return 7;
    }
    return 10;
  }

  /**
   * Applies the caller's hint as an upper bound on {@link #select(int, int)} and clamps the result
   * to {@code [2, recordCount]}. The upper bound wins when fewer than two records exist.
   *
   * @param hint requested maximum number of groups; null or non-positive means no cap
   */
  public int resolve(int recordCount, int distinctSourceFiles, @Nullable Integer hint) {
    int k = select(recordCount, distinctSourceFiles);
    if (hint != null && hint > 0) {
      k = Math.min(k, hint);
    }
    return Math.min(Math.max(k, 2), recordCount);
  }
}
