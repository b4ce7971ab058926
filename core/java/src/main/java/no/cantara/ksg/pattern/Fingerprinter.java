package no.cantara.ksg.pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic fingerprints of HTML forms. Tokens come from the URL domain and path and from a
 * fixed set of attributes on {@code <input>} and {@code <button>} tags. No HTML parser is used;
 * tags are found with regular expressions.
 */
public final class Fingerprinter {

    private static final Logger log = LoggerFactory.getLogger(Fingerprinter.class);

    private static final Pattern ATTR = Pattern.compile("(\\w[\\w:-]*)\\s*=\\s*(['\"])(.*?)\\2", Pattern.DOTALL);
    private static final Pattern INPUT_TAG = tag("input");
    private static final Pattern BUTTON_TAG = tag("button");
    // [scheme:][//authority]path[?query][#fragment], accepting characters a URI would reject
    private static final Pattern LENIENT_URL = Pattern.compile("(?:[a-zA-Z][a-zA-Z0-9+.-]*:)?(?://([^/?#]*))?([^?#]*).*", Pattern.DOTALL);
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private static final List<String> INPUT_ATTRS = List.of("type", "name", "id", "autocomplete", "placeholder", "aria-label");
    private static final List<String> BUTTON_ATTRS = List.of("type", "name", "id", "aria-label");

    private Fingerprinter() {}

    public static FormFingerprint fingerprint(String url, String html) {
        String domain = "";
        String path = "";
        if (url != null && !url.isBlank()) {
            try {
                URI uri = new URI(url.strip());
                domain = uri.getRawAuthority() != null ? uri.getRawAuthority().toLowerCase(Locale.ROOT) : "";
                path = uri.getRawPath() != null ? uri.getRawPath().strip() : "";
            } catch (URISyntaxException e) {
                log.debug("URL '{}' is not a valid URI ({}); splitting it leniently", url, e.getReason());
                Matcher m = LENIENT_URL.matcher(url.strip());
                if (m.matches()) {
                    domain = m.group(1) != null ? m.group(1).toLowerCase(Locale.ROOT) : "";
                    path = m.group(2).strip();
                }
            }
        }

        TreeSet<String> tokens = new TreeSet<>();
        tokens.addAll(tokenize(domain));
        tokens.addAll(tokenize(path));
        collect(html, INPUT_TAG, INPUT_ATTRS, tokens);
        collect(html, BUTTON_TAG, BUTTON_ATTRS, tokens);
        return new FormFingerprint(FormFingerprint.VERSION, domain, path, List.copyOf(tokens));
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        return NON_ALNUM.splitAsStream(text.toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    private static void collect(String html, Pattern tag, List<String> attrNames, TreeSet<String> tokens) {
        if (html == null) return;
        Matcher m = tag.matcher(html);
        while (m.find()) {
            Map<String, String> attrs = attributes(m.group(1));
            for (String name : attrNames) {
                String value = attrs.get(name);
                if (value != null) tokens.addAll(tokenize(value));
            }
        }
    }

    private static Map<String, String> attributes(String tagBody) {
        Map<String, String> attrs = new HashMap<>();
        Matcher m = ATTR.matcher(tagBody);
        while (m.find()) {
            String value = m.group(3).strip();
            if (!value.isEmpty()) {
                attrs.put(m.group(1).toLowerCase(Locale.ROOT), value);
            }
        }
        return attrs;
    }

    private static Pattern tag(String name) {
        return Pattern.compile("<\\s*" + name + "\\b([^>]*)>", Pattern.CASE_INSENSITIVE);
    }
}
