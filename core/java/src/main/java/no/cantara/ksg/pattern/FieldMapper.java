package no.cantara.ksg.pattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps target form fields to source fields by name. Names are compared case-insensitively with
 * underscores, hyphens and whitespace removed. Equal names score 1.0; when one name contains the
 * other the score is the length ratio of the shorter to the longer. A candidate is accepted only
 * when it scores above the configured minimum.
 */
public class FieldMapper {

    /**
     * @param mapping    target field name to source field name
     * @param confidence accepted scores summed and divided by the number of target fields
     */
    public record FieldMapping(Map<String, String> mapping, double confidence) {
        public FieldMapping {
            mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
        }
    }

    private final double minScore;

    public FieldMapper(double minScore) {
        this.minScore = minScore;
    }

    public FieldMapping map(List<String> sourceFields, List<String> targetFields) {
        Map<String, String> mapping = new LinkedHashMap<>();
        double total = 0.0;
        for (String target : targetFields) {
            String best = null;
            double bestScore = 0.0;
            for (String source : sourceFields) {
                double score = score(source, target);
                if (score > bestScore) {
                    best = source;
                    bestScore = score;
                }
            }
            if (best != null && bestScore > minScore) {
                mapping.put(target, best);
                total += bestScore;
            }
        }
        return new FieldMapping(mapping, targetFields.isEmpty() ? 0.0 : total / targetFields.size());
    }

    static double score(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) return 0.0;
        if (na.equals(nb)) return 1.0;
        String shorter = na.length() <= nb.length() ? na : nb;
        String longer = na.length() <= nb.length() ? nb : na;
        return longer.contains(shorter) ? (double) shorter.length() / longer.length() : 0.0;
    }

    static String normalize(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
    }
}
