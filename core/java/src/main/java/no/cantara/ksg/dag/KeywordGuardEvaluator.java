package no.cantara.ksg.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Guard policy based on a small vocabulary. An absent guard is true, a Boolean is used as is, and
 * a string is matched case-insensitively against the true and false tokens. Any other string is
 * treated as true.
 */
public class KeywordGuardEvaluator implements GuardEvaluator {

    private static final Logger log = LoggerFactory.getLogger(KeywordGuardEvaluator.class);

    public static final Set<String> DEFAULT_TRUE_TOKENS = Set.of("true", "always", "yes");
    public static final Set<String> DEFAULT_FALSE_TOKENS = Set.of("false", "never", "no");

    private final Set<String> trueTokens;
    private final Set<String> falseTokens;

    public KeywordGuardEvaluator() {
        this(DEFAULT_TRUE_TOKENS, DEFAULT_FALSE_TOKENS);
    }

    public KeywordGuardEvaluator(Set<String> trueTokens, Set<String> falseTokens) {
        this.trueTokens = normalize(trueTokens);
        this.falseTokens = normalize(falseTokens);
    }

    @Override
    public boolean allows(Object guard, Map<String, Object> context) {
        if (guard == null) return true;
        if (guard instanceof Boolean b) return b;
        String text = guard.toString().strip().toLowerCase(Locale.ROOT);
        if (text.isEmpty() || trueTokens.contains(text)) return true;
        if (falseTokens.contains(text)) return false;
        log.debug("Unrecognized guard '{}'; treating as true", guard);
        return true;
    }

    private static Set<String> normalize(Set<String> tokens) {
        return tokens.stream()
                .map(t -> t.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
