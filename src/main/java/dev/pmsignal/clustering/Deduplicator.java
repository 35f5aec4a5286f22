package dev.pmsignal.clustering;

import dev.pmsignal.feedback.FeedbackRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Removes exact and near-duplicate feedback before clustering.
 *
 * <p>A record is dropped when either
 *
 * <ul>
 *   <li>its fingerprint (first {@value #FINGERPRINT_LENGTH} characters of the trimmed, lower-cased
 *       text) equals that of an earlier kept record, or
 *   <li>an earlier kept record from the same source file shares more than the configured share of
 *       words with it ({@code |A ∩ B| / max(|A|, |B|)} over lower-cased word sets).
 * </ul>
 *
 * <p>Only kept records are comparison targets, which makes the operation idempotent. Relative order
 * is preserved. Empty texts share the empty fingerprint, so only the first one survives.
 */
@Component
public class Deduplicator {

  static final int FINGERPRINT_LENGTH = 100;

  private final ClusteringProperties properties;

  public Deduplicator(ClusteringProperties properties) {
    this.properties = properties;
  }

  /**
   * Filters duplicates out of {@code records}.
   *
   * @param records records in fetch order
   * @return the kept records, in input order
   */
  public List<FeedbackRecord> deduplicate(List<FeedbackRecord> records) {
    double threshold = properties.getWordOverlapThreshold();
    Set<String> seenFingerprints = new HashSet<>();
    Map<String, List<Set<String>>> keptWordsByFile = new HashMap<>();
    List<FeedbackRecord> kept = new ArrayList<>();

    for (FeedbackRecord record : records) {
      String fingerprint = fingerprint(record.text());
      if (seenFingerprints.contains(fingerprint)) {
        continue;
      }
      Set<String> words = words(record.text());
      List<Set<String>> sameFile =
          keptWordsByFile.computeIfAbsent(record.sourceFile(), file -> new ArrayList<>());
      if (isNearDuplicate(words, sameFile, threshold)) {
        continue;
      }
      seenFingerprints.add(fingerprint);
      sameFile.add(words);
      kept.add(record);
    }
    return kept;
  }

  static String fingerprint(String text) {
    String normalized = text.strip().toLowerCase(Locale.ROOT);
    return normalized.length() <= FINGERPRINT_LENGTH
        ? normalized
        : normalized.substring(0, FINGERPRINT_LENGTH);
  }

  static Set<String> words(String text) {
    String normalized = text.strip().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      return Set.of();
    }
    return Arrays.stream(normalized.split("\\s+")).collect(Collectors.toSet());
  }

  static double overlap(Set<String> a, Set<String> b) {
    int larger = Math.max(a.size(), b.size());
    if (larger == 0) {
      return 0.0;
    }
    Set<String> smaller = a.size() <= b.size() ? a : b;
    Set<String> other = smaller == a ? b : a;
    long shared = smaller.stream().filter(other::contains).count();
    return (double) shared / larger;
  }

  private static boolean isNearDuplicate(
      Set<String> words, List<Set<String>> keptInFile, double threshold) {
    for (Set<String> candidate : keptInFile) {
      if (overlap(words, candidate) > threshold) {
        return true;
      }
    }
    return false;
  }
}
