package dev.pmsignal.clustering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pmsignal.generation.GenerationException;
import dev.pmsignal.generation.GenerationOptions;
import dev.pmsignal.generation.KeyRotatingGenerator;
import dev.pmsignal.generation.MalformedResponseException;
import dev.pmsignal.keypool.ExhaustedPoolException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns representative excerpts into short theme names with a text-generation call.
 *
 * <p>Two attempts with structurally different prompts are made: the first asks for a theme name
 * per group and labels each group FOCUSED or MIXED; the second asks, per group, what the single
 * biggest problem is. Each attempt gets its own credential-rotation budget. A response is accepted
 * only if it contains a JSON array of at least as many non-blank strings as there are groups.
 *
 * <p>When both attempts fail every group is named {@code "Unclassified Theme {position + 1}"}.
 * Generation failures never escape this class; only {@link ExhaustedPoolException} does.
 */
@Component
public class ClusterNamer {

  private static final Logger log = LoggerFactory.getLogger(ClusterNamer.class);

  static final String SYSTEM_PROMPT =
      "You are a product analytics assistant. Respond only with valid JSON arrays of strings.";

  private final KeyRotatingGenerator generator;
  private final ClusteringProperties properties;
  private final ObjectMapper objectMapper;

  public ClusterNamer(
      KeyRotatingGenerator generator, ClusteringProperties properties, ObjectMapper objectMapper) {
    this.generator = generator;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Names every group.
   *
   * @param excerptsPerGroup representative excerpts, one list per group
   * @param homogeneityPerGroup homogeneity per group, same order
   * @return one non-blank name per group, same order
   * @throws ExhaustedPoolException if no generation credential is currently usable
   */
  public List<String> name(
      List<List<String>> excerptsPerGroup, List<Homogeneity> homogeneityPerGroup) {
    if (excerptsPerGroup.size() != homogeneityPerGroup.size()) {
      throw new IllegalArgumentException("excerpts and homogeneity lists differ in size");
    }
    int n = excerptsPerGroup.size();
    if (n == 0) {
      return List.of();
    }

    try {
      return attempt(themePrompt(excerptsPerGroup, homogeneityPerGroup), n);
    } catch (GenerationException e) {
      log.warn("Theme naming attempt failed, retrying with problem framing: {}", e.getMessage());
    }
    try {
      return attempt(problemPrompt(excerptsPerGroup), n);
    } catch (GenerationException e) {
      log.warn("Problem naming attempt failed, using placeholder names: {}", e.getMessage());
    }
    return IntStream.range(0, n).mapToObj(ClusterNamer::unclassified).toList();
  }

  /** Placeholder name for the group at {@code position} (0-based). */
  public static String unclassified(int position) {
    return "Unclassified Theme " + (position + 1);
  }

  private List<String> attempt(String prompt, int n) {
    GenerationOptions options =
        new GenerationOptions(
            SYSTEM_PROMPT, properties.getNamingMaxTokens(), properties.getNamingTemperature());
    return generator.generate(
        properties.getNamingProvider(),
        prompt,
        options,
        properties.getNamingRotations(),
        raw -> parseNames(raw, n));
  }

  static String themePrompt(List<List<String>> excerptsPerGroup, List<Homogeneity> homogeneity) {
    int n = excerptsPerGroup.size();
    StringBuilder prompt = new StringBuilder();
    prompt.append("You are analysing user feedback for a product team.\n\n");
    prompt.append("Below are ").append(n).append(" groups of related user feedback excerpts. ");
    prompt.append("FOCUSED groups come mostly from one source; ");
    prompt.append("for MIXED groups, name the theme the excerpts have in common.\n");
    prompt.append("For each group, generate a short specific issue theme name ");
    prompt.append("(3-6 words, title case).\n");
    prompt.append("Respond ONLY with a JSON array of exactly ").append(n);
    prompt.append(" strings. No explanation. No markdown.\n\n");
    for (int i = 0; i < n; i++) {
      String label = homogeneity.get(i) == Homogeneity.HOMOGENEOUS ? "FOCUSED" : "MIXED";
      prompt.append("Group ").append(i + 1).append(" (").append(label).append("):\n");
      appendExcerpts(prompt, excerptsPerGroup.get(i));
    }
    return prompt.toString();
  }

  static String problemPrompt(List<List<String>> excerptsPerGroup) {
    int n = excerptsPerGroup.size();
    StringBuilder prompt = new StringBuilder();
    prompt.append("Each numbered set of customer comments below describes one problem.\n");
    prompt.append("What is the single biggest problem users are describing in each set? ");
    prompt.append("Answer each with a 3-6 word problem title in title case.\n");
    prompt.append("Return a JSON array of exactly ").append(n);
    prompt.append(" strings, in set order, and nothing else.\n\n");
    for (int i = 0; i < n; i++) {
      prompt.append(i + 1).append(".\n");
      appendExcerpts(prompt, excerptsPerGroup.get(i));
    }
    return prompt.toString();
  }

  private static void appendExcerpts(StringBuilder prompt, List<String> excerpts) {
    for (String excerpt : excerpts) {
      prompt.append("  - ").append(excerpt.replace('\n', ' ')).append('\n');
    }
    prompt.append('\n');
  }

  /**
   * Extracts exactly {@code n} names from a raw completion.
   *
   * <p>Code-fence markers are removed and the text between the first {@code [} and the last {@code
   * ]} is parsed as a JSON array of strings.
   *
   * @throws MalformedResponseException if no such array with at least {@code n} non-blank strings
   *     exists
   */
  List<String> parseNames(String raw, int n) {
    String cleaned = raw.replace("```json", "").replace("```", "");
    int start = cleaned.indexOf('[');
    int end = cleaned.lastIndexOf(']');
    if (start < 0 || end <= start) {
      throw new MalformedResponseException("No JSON array in naming response");
    }
    JsonNode array;
    try {
      array = objectMapper.readTree(cleaned.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Naming response is not valid JSON", e);
    }
    if (array == null || !array.isArray()) {
      throw new MalformedResponseException("Naming response is not a JSON array");
    }
    List<String> names = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      if (!element.isTextual() || element.asText().isBlank()) {
        throw new MalformedResponseException("Naming response contains a non-string or blank name");
      }
      names.add(element.asText().strip());
    }
    if (names.size() < n) {
      throw new MalformedResponseException(
          "Expected " + n + " names but got " + names.size());
    }
    return List.copyOf(names.subList(0, n));
  }
}
