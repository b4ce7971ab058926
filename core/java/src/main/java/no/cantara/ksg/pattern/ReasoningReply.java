package no.cantara.ksg.pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the JSON object embedded in a free-text reasoning reply: the text between the first
 * <code>{</code> and the last <code>}</code>.
 */
public final class ReasoningReply {

    private static final Logger log = LoggerFactory.getLogger(ReasoningReply.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ReasoningReply() {}

    /** The embedded object, or empty when the reply holds none or it does not parse. */
    public static Optional<Map<String, Object>> parse(String reply) {
        if (reply == null) return Optional.empty();
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("Reasoning reply holds no JSON object");
            return Optional.empty();
        }
        try {
            return Optional.of(JSON.readValue(reply.substring(start, end + 1), MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.debug("Reasoning reply is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
