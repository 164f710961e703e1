package com.wavegate.core.plan;

import com.wavegate.core.model.SessionMode;

import java.util.Map;

/**
 * Everything a task executor is allowed to see.
 *
 * @param sessionId session being executed
 * @param taskName  name of the task being run
 * @param wave      wave number of the task ({@code waves + 1} for final consolidation)
 * @param mode      session depth hint
 * @param input     free-form start input of the session
 * @param context   read-only snapshot of the shared context: outputs of all earlier waves
 * @param feedback  rejection feedback when the task is being regenerated, otherwise {@code null}
 */
public record TaskInput(
    String sessionId,
    String taskName,
    int wave,
    SessionMode mode,
    Map<String, Object> input,
    Map<String, Map<String, Object>> context,
    String feedback
) {

    public boolean isRegeneration() {
        return feedback != null && !feedback.isBlank();
    }
}
