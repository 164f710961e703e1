package com.wavegate.dispatch.cli;

import com.wavegate.core.engine.SessionService;
import com.wavegate.core.model.Session;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: wavegate history
 * <p>
 * Lists stored sessions, most recent last: Session ID | Status | Plan | Progress.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List stored sessions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final SessionService sessionService;

    public HistoryCommand(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Session> sessions = sessionService.listSessions();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        List<Session> display = sessions.size() > limit
                ? sessions.subList(sessions.size() - limit, sessions.size())
                : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-38s %-12s %-24s %s%n", "SESSION ID", "STATUS", "PLAN", "APPROVED");
        System.out.println("  " + "-".repeat(84));

        for (Session s : display) {
            System.out.printf("  %-38s %-12s %-24s %d/%d%n",
                    s.id(), s.status().wireName(), ConsoleOutput.truncate(s.plan(), 24),
                    s.approvedThrough(), s.totalCheckpoints());
        }
    }
}
