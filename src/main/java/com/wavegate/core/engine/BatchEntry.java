package com.wavegate.core.engine;

import java.util.Map;

/**
 * One session requested in a batch start.
 *
 * @param plan     wave plan name; {@code null} selects the default plan
 * @param mode     fast, balanced or deep; {@code null} means balanced
 * @param input    free-form start input
 * @param priority 1 (lowest) to 5 (highest); {@code null} means {@value #DEFAULT_PRIORITY}
 */
public record BatchEntry(String plan, String mode, Map<String, Object> input, Integer priority) {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;
    public static final int DEFAULT_PRIORITY = 3;

    public int effectivePriority() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }
}
