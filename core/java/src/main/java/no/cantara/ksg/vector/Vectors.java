package no.cantara.ksg.vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Small embedding-vector helpers. None of them throw on bad input:
 * <ul>
 *   <li>an empty or {@code null} vector is the additive identity,</li>
 *   <li>mismatched lengths return the left operand unchanged (or 0.0 similarity),</li>
 *   <li>cosine similarity against a zero vector is 0.0.</li>
 * </ul>
 */
public final class Vectors {

    private Vectors() {}

    public static boolean isEmpty(List<Double> v) {
        return v == null || v.isEmpty();
    }

    public static List<Double> add(List<Double> a, List<Double> b) {
        if (isEmpty(a)) return isEmpty(b) ? List.of() : List.copyOf(b);
        if (isEmpty(b)) return List.copyOf(a);
        if (a.size() != b.size()) return List.copyOf(a);
        List<Double> out = new ArrayList<>(a.size());
        for (int i = 0; i < a.size(); i++) {
            out.add(a.get(i) + b.get(i));
        }
        return List.copyOf(out);
    }

    public static List<Double> scale(List<Double> v, double factor) {
        if (isEmpty(v)) return List.of();
        List<Double> out = new ArrayList<>(v.size());
        for (Double x : v) {
            out.add(x * factor);
        }
        return List.copyOf(out);
    }

    /**
     * Arithmetic mean of the given vectors. Empty vectors are ignored, and so are vectors whose
     * length differs from the first non-empty one.
     */
    public static List<Double> centroid(Collection<List<Double>> vectors) {
        if (vectors == null) return List.of();
        List<Double> sum = List.of();
        int n = 0;
        for (List<Double> v : vectors) {
            if (isEmpty(v)) continue;
            if (!sum.isEmpty() && sum.size() != v.size()) continue;
            sum = add(sum, v);
            n++;
        }
        return n == 0 ? List.of() : scale(sum, 1.0 / n);
    }

    public static double cosine(List<Double> a, List<Double> b) {
        if (isEmpty(a) || isEmpty(b) || a.size() != b.size()) return 0.0;
        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Reads a vector stored in a props map. Lists loaded from YAML or JSON may hold integers;
     * anything that is not a list of numbers yields an empty vector.
     */
    public static List<Double> fromObject(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) return List.of();
        List<Double> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof Number n)) return List.of();
            out.add(n.doubleValue());
        }
        return List.copyOf(out);
    }
}
