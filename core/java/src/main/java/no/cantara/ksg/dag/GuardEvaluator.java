package no.cantara.ksg.dag;

import java.util.Map;

/**
 * Decides whether a step's guard allows it to run. The executor consults nothing else, so the
 * guard policy can be replaced without touching scheduling.
 */
@FunctionalInterface
public interface GuardEvaluator {

    /**
     * @param guard   the step's guard: {@code null}, a Boolean, or a condition string
     * @param context the run context passed to the executor
     */
    boolean allows(Object guard, Map<String, Object> context);
}
