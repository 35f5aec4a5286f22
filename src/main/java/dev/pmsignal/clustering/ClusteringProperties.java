package dev.pmsignal.clustering;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised tuning for the clustering pipeline.
 *
 * <p>Properties are bound from {@code pmsignal.clustering.*} in application.yml.
 *
 * <ul>
 *   <li>{@code word-overlap-threshold} - word-set overlap above which two chunks of the same file
 *       are near-duplicates (default 0.8, in (0.0, 1.0])
 *   <li>{@code minority-share-threshold} - source-type share below which records are oversampled
 *       (default 0.10, in [0.0, 1.0))
 *   <li>{@code homogeneous-cutoff} - representative picks from one file that make a group
 *       homogeneous (default 4)
 *   <li>{@code min-cluster-size} - groups smaller than this are folded into a neighbour (default 3)
 *   <li>{@code representatives} - representative picks per group (default 5)
 *   <li>{@code seed}, {@code max-iterations} - partitioning determinism and iteration cap
 *   <li>{@code naming-rotations}, {@code naming-max-tokens}, {@code naming-temperature} - per
 *       naming attempt generation budget
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "pmsignal.clustering")
public class ClusteringProperties {

  private double wordOverlapThreshold = 0.8;
  private double minorityShareThreshold = 0.10;
  private int homogeneousCutoff = 4;
  private int minClusterSize = 3;
  private int representatives = 5;
  private long seed = 42L;
  private int maxIterations = 300;
  private String namingProvider = "groq";
  private int namingRotations = 2;
  private int namingMaxTokens = 1024;
  private double namingTemperature = 0.2;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (wordOverlapThreshold <= 0.0 || wordOverlapThreshold > 1.0) {
      throw new IllegalStateException(
          "pmsignal.clustering.word-overlap-threshold must be in (0.0, 1.0], got: "
              + wordOverlapThreshold);
    }
    if (minorityShareThreshold < 0.0 || minorityShareThreshold >= 1.0) {
      throw new IllegalStateException(
          "pmsignal.clustering.minority-share-threshold must be in [0.0, 1.0), got: "
              + minorityShareThreshold);
    }
    if (representatives < 1) {
      throw new IllegalStateException(
          "pmsignal.clustering.representatives must be at least 1, got: " + representatives);
    }
    if (homogeneousCutoff < 1 || homogeneousCutoff > representatives) {
      throw new IllegalStateException(
          "pmsignal.clustering.homogeneous-cutoff must be in [1, representatives], got: "
              + homogeneousCutoff);
    }
    if (minClusterSize < 1) {
      throw new IllegalStateException(
          "pmsignal.clustering.min-cluster-size must be at least 1, got: " + minClusterSize);
    }
    if (maxIterations < 1) {
      throw new IllegalStateException(
          "pmsignal.clustering.max-iterations must be at least 1, got: " + maxIterations);
    }
    if (namingProvider == null || namingProvider.isBlank()) {
      throw new IllegalStateException("pmsignal.clustering.naming-provider must not be blank");
    }
    if (namingRotations < 1) {
      throw new IllegalStateException(
          "pmsignal.clustering.naming-rotations must be at least 1, got: " + namingRotations);
    }
    if (namingMaxTokens < 1) {
      throw new IllegalStateException(
          "pmsignal.clustering.naming-max-tokens must be at least 1, got: " + namingMaxTokens);
    }
    if (namingTemperature < 0.0 || namingTemperature > 2.0) {
      throw new IllegalStateException(
          "pmsignal.clustering.naming-temperature must be in [0.0, 2.0], got: "
              + namingTemperature);
    }
  }

  public double getWordOverlapThreshold() {
    return wordOverlapThreshold;
  }

  public void setWordOverlapThreshold(double wordOverlapThreshold) {
    this.wordOverlapThreshold = wordOverlapThreshold;
  }

  public double getMinorityShareThreshold() {
    return minorityShareThreshold;
  }

  public void setMinorityShareThreshold(double minorityShareThreshold) {
    this.minorityShareThreshold = minorityShareThreshold;
  }

  public int getHomogeneousCutoff() {
    return homogeneousCutoff;
  }

  public void setHomogeneousCutoff(int homogeneousCutoff) {
    this.homogeneousCutoff = homogeneousCutoff;
  }

  public int getMinClusterSize() {
    return minClusterSize;
  }

  public void setMinClusterSize(int minClusterSize) {
    this.minClusterSize = minClusterSize;
  }

  public int getRepresentatives() {
    return representatives;
  }

  public void setRepresentatives(int representatives) {
    this.representatives = representatives;
  }

  public long getSeed() {
    return seed;
  }

  public void setSeed(long seed) {
    this.seed = seed;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public String getNamingProvider() {
    return namingProvider;
  }

  public void setNamingProvider(String namingProvider) {
    this.namingProvider = namingProvider;
  }

  public int getNamingRotations() {
    return namingRotations;
  }

  public void setNamingRotations(int namingRotations) {
    this.namingRotations = namingRotations;
  }

  public int getNamingMaxTokens() {
    return namingMaxTokens;
  }

  public void setNamingMaxTokens(int namingMaxTokens) {
    this.namingMaxTokens = namingMaxTokens;
  }

  public double getNamingTemperature() {
    return namingTemperature;
  }

  public void setNamingTemperature(double namingTemperature) {
    this.namingTemperature = namingTemperature;
  }
}
