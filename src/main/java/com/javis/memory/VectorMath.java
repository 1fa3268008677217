package com.javis.memory;

import org.apache.lucene.util.VectorUtil;

public final class VectorMath {

    private VectorMath() {}

    /** Cosine similarity; 0 when either vector has zero length. */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        if (VectorUtil.dotProduct(a, a) == 0 || VectorUtil.dotProduct(b, b) == 0) return 0.0;
        return VectorUtil.cosine(a, b);
    }

    public static void normalize(float[] v) {
        double norm = 0;
        for (var x : v) norm += (double) x * x;
        if (norm == 0) return;
        var len = (float) Math.sqrt(norm);
        for (int i = 0; i < v.length; i++) v[i] /= len;
    }
}
