package com.deskpilot.vector;

import java.util.ArrayList;
import java.util.List;

/**
 * Cosine similarity helpers working on squared norms so stored norms can be reused.
 */
final class VectorMath {

    private VectorMath() {
    }

    static double squaredNorm(float[] vector) {
        if (vector == null || vector.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (float f : vector) {
            sum += (double) f * (double) f;
        }
        return sum;
    }

    static double squaredNorm(List<Double> vector) {
        if (vector == null || vector.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : vector) {
            if (value != null) {
                sum += value * value;
            }
        }
        return sum;
    }

    /**
     * Cosine similarity, or 0 when either vector is empty, zero or of another dimension.
     */
    static double cosine(float[] query, double queryNorm, float[] candidate, double candidateNorm) {
        if (query == null || candidate == null || query.length == 0 || query.length != candidate.length) {
            return 0.0;
        }
        if (queryNorm == 0.0 || candidateNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; ++i) {
            dot += (double) query[i] * candidate[i];
        }
        return dot / (Math.sqrt(queryNorm) * Math.sqrt(candidateNorm));
    }

    static double cosine(float[] query, double queryNorm, List<Double> candidate, Double candidateNorm) {
        if (query == null || candidate == null || query.length == 0 || query.length != candidate.size()) {
            return 0.0;
        }
        double norm = candidateNorm != null ? candidateNorm : squaredNorm(candidate);
        if (queryNorm == 0.0 || norm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; ++i) {
            Double value = candidate.get(i);
            if (value != null) {
                dot += (double) query[i] * value;
            }
        }
        return dot / (Math.sqrt(queryNorm) * Math.sqrt(norm));
    }

    /**
     * Similarity as a relevance score: negative similarity carries no relevance.
     */
    static double toScore(double cosine) {
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    static List<Double> toList(float[] vector) {
        ArrayList<Double> list = new ArrayList<>(vector.length);
        for (float f : vector) {
            list.add((double) f);
        }
        return list;
    }
}
