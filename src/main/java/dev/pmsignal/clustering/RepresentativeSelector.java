package dev.pmsignal.clustering;

import dev.pmsignal.feedback.FeedbackRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Picks the excerpts that best represent a group and classifies it as homogeneous or mixed.
 *
 * <p>Members are ranked by cosine similarity to the group centroid (stable on ties) and the top
 * {@code representatives} are kept. When one source file accounts for at least {@code
 * homogeneous-cutoff} of those picks the group is {@link Homogeneity#HOMOGENEOUS} and its excerpts
 * are that file's first {@value #HOMOGENEOUS_EXCERPTS} picks; otherwise it is {@link
 * Homogeneity#MIXED} and every pick is an excerpt. Excerpts are cut to {@value
 * #MAX_EXCERPT_LENGTH} characters.
 */
@Component
public class RepresentativeSelector {

  static final int MAX_EXCERPT_LENGTH = 120;
  static final int HOMOGENEOUS_EXCERPTS = 3;

  private final ClusteringProperties properties;

  public RepresentativeSelector(ClusteringProperties properties) {
    this.properties = properties;
  }

  /**
   * @param memberIndices row indices of the group's members in {@code matrix} and {@code records}
   * @param matrix embedding rows
   * @param records record per row, for text and source file
   * @param centroid the group centroid
   */
  public Representatives select(
      List<Integer> memberIndices, float[][] matrix, List<FeedbackRecord> records, float[] centroid) {
    List<Integer> picks =
        memberIndices.stream()
            .sorted(
                Comparator.comparingDouble(
                        (Integer i) -> VectorMath.cosine(matrix[i], centroid))
                    .reversed())
            .limit(properties.getRepresentatives())
            .toList();

    Map<String, List<Integer>> picksByFile = new LinkedHashMap<>();
    for (int pick : picks) {
      picksByFile.computeIfAbsent(records.get(pick).sourceFile(), f -> new ArrayList<>()).add(pick);
    }

    List<Integer> dominant = null;
    for (List<Integer> filePicks : picksByFile.values()) {
      if (filePicks.size() >= properties.getHomogeneousCutoff()
          && (dominant == null || filePicks.size() > dominant.size())) {
        dominant = filePicks;
      }
    }

    if (dominant != null) {
      List<String> excerpts =
          dominant.stream()
              .limit(HOMOGENEOUS_EXCERPTS)
              .map(i -> truncate(records.get(i).text(), MAX_EXCERPT_LENGTH))
              .toList();
      return new Representatives(excerpts, Homogeneity.HOMOGENEOUS);
    }
    List<String> excerpts =
        picks.stream().map(i -> truncate(records.get(i).text(), MAX_EXCERPT_LENGTH)).toList();
    return new Representatives(excerpts, Homogeneity.MIXED);
  }

  static String truncate(String text, int maxLength) {
    return text.length() <= maxLength ? text : text.substring(0, maxLength);
  }
}
