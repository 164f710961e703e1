package com.wavegate.core.model;

import java.util.Map;

/**
 * Result payload stored on a checkpoint.
 *
 * @param narrative  human-readable summary produced by the task
 * @param structured schema-less structured result, merged into the shared context
 */
public record CheckpointOutput(String narrative, Map<String, Object> structured) {

    public CheckpointOutput {
        structured = structured == null ? Map.of() : structured;
    }
}
