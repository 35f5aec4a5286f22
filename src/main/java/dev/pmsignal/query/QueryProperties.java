package dev.pmsignal.query;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for question answering, bound from {@code pmsignal.query.*}.
 *
 * <ul>
 *   <li>{@code cap-per-session} - questions allowed per session (default 4)
 *   <li>{@code default-top-k} - chunks retrieved when the caller gives no top-k (default 8)
 *   <li>{@code max-top-k} - upper bound on a caller's top-k (default 50)
 *   <li>{@code rerank-top-n} - chunks kept after cross-encoder reranking (default 5)
 *   <li>{@code provider}, {@code rotations}, {@code max-tokens}, {@code temperature} - answer
 *       generation budget
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pmsignal.query")
public class QueryProperties {

  private int capPerSession = 4;
  private int defaultTopK = 8;
  private int maxTopK = 50;
  private int rerankTopN = 5;
  private String provider = "groq";
  private int rotations = 3;
  private int maxTokens = 1024;
  private double temperature = 0.1;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (capPerSession < 1) {
      throw new IllegalStateException(
          "pmsignal.query.cap-per-session must be at least 1, got: " + capPerSession);
    }
    if (maxTopK < 1) {
      throw new IllegalStateException("pmsignal.query.max-top-k must be at least 1, got: " + maxTopK);
    }
    if (defaultTopK < 1 || defaultTopK > maxTopK) {
      throw new IllegalStateException(
          "pmsignal.query.default-top-k must be in [1, max-top-k], got: " + defaultTopK);
    }
    if (rerankTopN < 1) {
      throw new IllegalStateException(
          "pmsignal.query.rerank-top-n must be at least 1, got: " + rerankTopN);
    }
    if (provider == null || provider.isBlank()) {
      throw new IllegalStateException("pmsignal.query.provider must not be blank");
    }
    if (rotations < 1) {
      throw new IllegalStateException("pmsignal.query.rotations must be at least 1, got: " + rotations);
    }
    if (maxTokens < 1) {
      throw new IllegalStateException("pmsignal.query.max-tokens must be at least 1, got: " + maxTokens);
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalStateException(
          "pmsignal.query.temperature must be in [0.0, 2.0], got: " + temperature);
    }
  }

  public int getCapPerSession() {
    return capPerSession;
  }

  public void setCapPerSession(int capPerSession) {
    this.capPerSession = capPerSession;
  }

  public int getDefaultTopK() {
    return defaultTopK;
  }

  public void setDefaultTopK(int defaultTopK) {
    this.defaultTopK = defaultTopK;
  }

  public int getMaxTopK() {
    return maxTopK;
  }

  public void setMaxTopK(int maxTopK) {
    this.maxTopK = maxTopK;
  }

  public int getRerankTopN() {
    return rerankTopN;
  }

  public void setRerankTopN(int rerankTopN) {
    this.rerankTopN = rerankTopN;
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }

  public int getRotations() {
    return rotations;
  }

  public void setRotations(int rotations) {
    this.rotations = rotations;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }
}
