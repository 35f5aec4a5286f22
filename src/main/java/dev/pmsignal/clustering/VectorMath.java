package dev.pmsignal.clustering;

/** Small dense-vector helpers over {@code float[]} embeddings, accumulating in double. */
final class VectorMath {

  private VectorMath() {}

  static double squaredDistance(float[] a, float[] b) {
    checkDimensions(a, b);
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double d = (double) a[i] - b[i];
      sum += d * d;
    }
    return sum;
  }

  static double euclidean(float[] a, float[] b) {
    return Math.sqrt(squaredDistance(a, b));
  }

  /** Cosine similarity; a zero vector has similarity 0 to everything. */
  static double cosine(float[] a, float[] b) {
    checkDimensions(a, b);
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Mean of the given rows of {@code matrix}; {@code rows} must not be empty. */
  static float[] mean(float[][] matrix, int[] rows) {
    if (rows.length == 0) {
      throw new IllegalArgumentException("Cannot average zero rows");
    }
    int dimension = matrix[rows[0]].length;
    double[] sum = new double[dimension];
    for (int row : rows) {
      float[] v = matrix[row];
      checkDimensions(matrix[rows[0]], v);
      for (int i = 0; i < dimension; i++) {
        sum[i] += v[i];
      }
    }
    float[] mean = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      mean[i] = (float) (sum[i] / rows.length);
    }
    return mean;
  }

  private static void checkDimensions(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
  }
}
