package no.cantara.ksg;

/**
 * A prompt-in, text-out reasoning hook (typically an LLM). Replies are expected to embed a JSON
 * object; callers must survive replies that do not.
 */
@FunctionalInterface
public interface ReasoningFunction {

    String reason(String prompt);
}
