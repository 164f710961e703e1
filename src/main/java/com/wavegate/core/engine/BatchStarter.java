package com.wavegate.core.engine;

import com.wavegate.core.config.WavegateProperties;
import com.wavegate.core.plan.WavePlanRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Starts several sessions from one request, most important first.
 * <p>
 * Entries are ordered by priority, highest first; entries of equal priority keep their request
 * order. Every entry with priority 4 or 5 is started, at most
 * {@code wavegate.batch.medium-priority-limit} entries with priority 3 are started, and entries
 * below 3 are skipped. All entries are validated before any session is created, so a bad plan
 * or mode fails the whole batch.
 */
@Service
public class BatchStarter {

    private static final Logger log = LoggerFactory.getLogger(BatchStarter.class);

    static final int ALWAYS_START_PRIORITY = 4;

    private final SessionService sessions;
    private final WavePlanRegistry plans;
    private final WavegateProperties properties;

    public BatchStarter(SessionService sessions, WavePlanRegistry plans, WavegateProperties properties) {
        this.sessions = sessions;
        this.plans = plans;
        this.properties = properties;
    }

    /**
     * @throws IllegalArgumentException                   if the batch is empty, or an entry has an
     *                                                    unknown mode or a priority outside 1..5
     * @throws com.wavegate.core.plan.UnknownPlanException if an entry names an unknown plan
     */
    public BatchResult start(List<BatchEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one session");
        }
        entries.forEach(this::validate);

        List<BatchEntry> selected = select(entries, properties.getBatch().getMediumPriorityLimit());
        var started = new ArrayList<BatchResult.Started>(selected.size());
        for (BatchEntry entry : selected) {
            var session = sessions.start(entry.plan(), entry.mode(), entry.input());
            started.add(new BatchResult.Started(session, entry.effectivePriority()));
        }
        log.info("Batch started {} of {} submitted sessions", started.size(), entries.size());
        return new BatchResult(started, entries.size());
    }

    static List<BatchEntry> select(List<BatchEntry> entries, int mediumPriorityLimit) {
        List<BatchEntry> ordered = new ArrayList<>(entries);
        // List.sort is stable: equal priorities keep request order
        ordered.sort(Comparator.comparingInt(BatchEntry::effectivePriority).reversed());

        var selected = new ArrayList<BatchEntry>();
        int medium = 0;
        for (BatchEntry entry : ordered) {
            int priority = entry.effectivePriority();
            if (priority >= ALWAYS_START_PRIORITY) {
                selected.add(entry);
            } else if (priority == BatchEntry.DEFAULT_PRIORITY && medium < mediumPriorityLimit) {
                selected.add(entry);
                medium++;
            }
        }
        return selected;
    }

    private void validate(BatchEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Batch entries must not be null");
        }
        int priority = entry.effectivePriority();
        if (priority < BatchEntry.MIN_PRIORITY || priority > BatchEntry.MAX_PRIORITY) {
            throw new IllegalArgumentException("Invalid priority " + priority + "; expected "
                    + BatchEntry.MIN_PRIORITY + " to " + BatchEntry.MAX_PRIORITY);
        }
        plans.resolve(entry.plan());
        SessionService.parseMode(entry.mode());
    }
}
