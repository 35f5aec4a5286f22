package dev.pmsignal.clustering;

import dev.pmsignal.feedback.SourceType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A group built during one clustering run. Never persisted.
 *
 * @param index partition label of the group
 * @param memberRecordIds ids of the original (non-synthetic) member records
 * @param centroid mean embedding of the members
 * @param representativeExcerpts excerpts chosen by {@link RepresentativeSelector}
 * @param homogeneity homogeneity of the representative picks
 * @param sourceHistogram member count per source type, every type present
 * @param name theme name; null until named
 */
public record ClusterGroup(
    int index,
    List<String> memberRecordIds,
    float[] centroid,
    List<String> representativeExcerpts,
    Homogeneity homogeneity,
    Map<SourceType, Integer> sourceHistogram,
    @Nullable String name) {

  static final int MAX_REPORTED_EXCERPTS = 3;
  static final int MAX_REPORTED_EXCERPT_LENGTH = 100;

  public ClusterGroup {
    memberRecordIds = List.copyOf(memberRecordIds);
    representativeExcerpts = List.copyOf(representativeExcerpts);
    sourceHistogram = Collections.unmodifiableMap(new EnumMap<>(sourceHistogram));
  }

  public int count() {
    return memberRecordIds.size();
  }

  public ClusterGroup withName(String newName) {
    return new ClusterGroup(
        index,
        memberRecordIds,
        centroid,
        representativeExcerpts,
        homogeneity,
        sourceHistogram,
        newName);
  }

  /**
   * Public view of the group: at most {@value #MAX_REPORTED_EXCERPTS} excerpts of at most {@value
   * #MAX_REPORTED_EXCERPT_LENGTH} characters.
   *
   * @throws IllegalStateException if the group has not been named
   */
  public IssueCluster toIssueCluster() {
    if (name == null || name.isBlank()) {
      throw new IllegalStateException("Group " + index + " has no name");
    }
    List<String> excerpts =
        representativeExcerpts.stream()
            .limit(MAX_REPORTED_EXCERPTS)
            .map(e -> RepresentativeSelector.truncate(e, MAX_REPORTED_EXCERPT_LENGTH))
            .toList();
    return new IssueCluster(index, count(), excerpts, sourceHistogram, name);
  }
}
