package com.beautibuk.agent.rag;

import java.util.ArrayList;
import java.util.List;

final class VectorMath {

    private VectorMath() {
    }

    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        return (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    static void requireDimensions(float[] vector, int dimensions) {
        if (vector == null || vector.length != dimensions) {
            throw new IllegalArgumentException("Expected a vector of " + dimensions + " dimensions, got "
                    + (vector == null ? "null" : vector.length));
        }
    }

    static float[] toFloatArray(List<? extends Number> list) {
        float[] arr = new float[list.size()];
        for (int i = 0; i < list.size(); i++) arr[i] = list.get(i).floatValue();
        return arr;
    }

    static List<Double> toDoubleList(float[] arr) {
        List<Double> result = new ArrayList<>(arr.length);
        for (float v : arr) result.add((double) v);
        return result;
    }
}
