package dev.pmsignal.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Suppresses near-identical generated names.
 *
 * <p>For every pair {@code i < j}, if at least {@value #MIN_SHARED_RUN} consecutive words of name
 * {@code i} each occur somewhere in name {@code j}, name {@code j} becomes an unclassified
 * placeholder. Earlier names always survive. Comparisons use the names as generated, so a name that
 * was replaced still suppresses later look-alikes.
 */
@Component
public class DuplicateNameFlagger {

  static final int MIN_SHARED_RUN = 3;

  public List<String> flag(List<String> names) {
    List<List<String>> tokens = names.stream().map(DuplicateNameFlagger::tokenize).toList();
    List<String> result = new ArrayList<>(names);
    for (int j = 1; j < names.size(); j++) {
      Set<String> later = new HashSet<>(tokens.get(j));
      for (int i = 0; i < j; i++) {
        if (longestContainedRun(tokens.get(i), later) >= MIN_SHARED_RUN) {
          result.set(j, ClusterNamer.unclassified(j));
          break;
        }
      }
    }
    return result;
  }

  /** Lower-cased words with leading and trailing punctuation removed. */
  static List<String> tokenize(String name) {
    return Arrays.stream(name.toLowerCase(Locale.ROOT).split("\\s+"))
        .map(word -> word.replaceAll("^\\p{Punct}+|\\p{Punct}+$", ""))
        .filter(word -> !word.isEmpty())
        .toList();
  }

  static int longestContainedRun(List<String> words, Set<String> other) {
    int longest = 0;
    int current = 0;
    for (String word : words) {
      current = other.contains(word) ? current + 1 : 0;
      longest = Math.max(longest, current);
    }
    return longest;
  }
}
