package dev.pmsignal.clustering;

import java.util.List;

/**
 * Representative excerpts of a group and its homogeneity classification.
 *
 * @param excerpts excerpts in descending similarity to the centroid
 * @param homogeneity how the group should be framed to the namer
 */
public record Representatives(List<String> excerpts, Homogeneity homogeneity) {

  public Representatives {
    excerpts = List.copyOf(excerpts);
  }
}
