package no.cantara.ksg.pattern;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningReplyTest {

    @Test void objectIsExtractedFromSurroundingProse() {
        Map<String, Object> reply = ReasoningReply.parse(
                "Sure! Here is the mapping:\n{\"field_mapping\": {\"cc_number\": \"card_number\"}, \"confidence\": 0.9}\nHope it helps.")
                .orElseThrow();
        assertEquals(Map.of("cc_number", "card_number"), reply.get("field_mapping"));
        assertEquals(0.9, reply.get("confidence"));
    }

    @Test void replyWithoutObjectIsEmpty() {
        assertTrue(ReasoningReply.parse("I cannot help with that").isEmpty());
        assertTrue(ReasoningReply.parse("} backwards {").isEmpty());
        assertTrue(ReasoningReply.parse(null).isEmpty());
    }

    @Test void malformedObjectIsEmpty() {
        assertTrue(ReasoningReply.parse("{field_mapping: nope,}").isEmpty());
    }
}
