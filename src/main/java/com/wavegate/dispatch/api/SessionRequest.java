package com.wavegate.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param plan  wave plan name; nullable, defaults to the configured default plan
 * @param mode  fast, balanced or deep; nullable, defaults to balanced
 * @param input free-form input handed to every task; nullable
 */
public record SessionRequest(
    String plan,
    String mode,
    Map<String, Object> input
) {}
