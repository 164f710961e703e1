package com.wavegate.core.plan;

import com.wavegate.core.model.ReadOnly;

import java.util.Map;

/**
 * Output of a task executor.
 *
 * @param structured structured result, stored in the shared context under the task name
 * @param narrative  human-readable summary shown to the approver
 * @param costUnits  cost reported by the executor; 0 when unknown
 */
public record TaskResult(Map<String, Object> structured, String narrative, double costUnits) {

    public TaskResult {
        structured = ReadOnly.map(structured);
        narrative = narrative == null ? "" : narrative;
    }

    public static TaskResult of(Map<String, Object> structured, String narrative) {
        return new TaskResult(structured, narrative, 0);
    }
}
