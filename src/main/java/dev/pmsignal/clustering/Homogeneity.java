package dev.pmsignal.clustering;

/** Whether a group's representative picks come predominantly from one source file. */
public enum Homogeneity {
  HOMOGENEOUS,
  MIXED
}
