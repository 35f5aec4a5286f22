package dev.pmsignal.clustering;

import dev.pmsignal.feedback.SourceType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A named issue cluster as returned to callers.
 *
 * @param index partition label of the cluster
 * @param count number of deduplicated feedback records in the cluster
 * @param excerpts up to three representative excerpts, each at most 100 characters
 * @param sourceHistogram member count per source type
 * @param name theme name, never blank
 */
public record IssueCluster(
    int index, int count, List<String> excerpts, Map<SourceType, Integer> sourceHistogram, String name) {

  public IssueCluster {
    excerpts = List.copyOf(excerpts);
    sourceHistogram = Collections.unmodifiableMap(new EnumMap<>(sourceHistogram));
  }
}
