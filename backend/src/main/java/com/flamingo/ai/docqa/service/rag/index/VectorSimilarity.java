package com.flamingo.ai.docqa.service.rag.index;

/** Vector math used for nearest-neighbour lookup. */
public final class VectorSimilarity {

  private VectorSimilarity() {}

  /**
   * Cosine similarity of two vectors of equal length.
   *
   * @return similarity in [-1, 1]; 0 when either vector has zero norm
   * @throws IllegalArgumentException if the lengths differ
   */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    // Rounding can push identical vectors marginally past 1
    return Math.max(-1.0, Math.min(1.0, cosine));
  }
}
