package com.wavegate.dispatch.api;

import com.wavegate.core.engine.BatchEntry;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/sessions/batch.
 *
 * @param sessions sessions to start; each takes the fields of {@link SessionRequest} plus an
 *                 optional {@code priority} from 1 to 5
 */
public record BatchSessionRequest(List<Item> sessions) {

    public record Item(String plan, String mode, Map<String, Object> input, Integer priority) {

        BatchEntry toEntry() {
            return new BatchEntry(plan, mode, input, priority);
        }
    }

    List<BatchEntry> toEntries() {
        return sessions == null ? List.of() : sessions.stream().map(i -> i == null ? null : i.toEntry()).toList();
    }
}
