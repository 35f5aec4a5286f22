package dev.pmsignal.mcp;

import dev.pmsignal.query.RetrievedFeedback;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats answer sources as numbered text blocks within a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Blocks are appended in order until the next one would
 * exceed the budget. If the first block alone is over budget it is cut at the character level, so
 * at least one source is always shown.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${pmsignal.mcp.token-budget:3000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * @param sources answer sources, {@code [CHUNK 1]} first
   * @return formatted sources that fit the budget; empty for no sources
   */
  public String truncate(@Nullable List<RetrievedFeedback> sources) {
    if (sources == null || sources.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < sources.size(); i++) {
      String formatted = formatSource(i + 1, sources.get(i));
      int sourceTokens = estimateTokens(formatted);

      if (i == 0 && sourceTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + sourceTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += sourceTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatSource(int index, RetrievedFeedback source) {
    return String.format(
        Locale.ROOT,
        "[CHUNK %d] %s | %s | score %.3f\n%s\n\n",
        index,
        source.sourceType().value().toUpperCase(Locale.ROOT),
        source.sourceFile(),
        source.weightedScore(),
        source.text());
  }
}
