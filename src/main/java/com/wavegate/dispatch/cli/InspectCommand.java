package com.wavegate.dispatch.cli;

import com.wavegate.core.engine.SessionService;
import com.wavegate.core.gate.CheckpointNotFoundException;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.Session;
import com.wavegate.core.persistence.SessionNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: wavegate inspect &lt;session-id&gt; [--checkpoint N]
 * <p>
 * Prints the session's checkpoint table, or the full output and feedback of one checkpoint.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect the checkpoints of a session")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--checkpoint", "-c"}, description = "Show details of one checkpoint")
    private Integer checkpointNumber;

    private final SessionService sessionService;

    public InspectCommand(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Session session;
        try {
            session = sessionService.status(sessionId);
        } catch (SessionNotFoundException e) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }

        if (checkpointNumber != null) {
            printCheckpoint(session);
            return;
        }

        List<Checkpoint> checkpoints = sessionService.listCheckpoints(sessionId);
        System.out.println();
        System.out.println("SESSION " + session.id() + " (" + session.plan() + ")");
        if (checkpoints.isEmpty()) {
            ConsoleOutput.info("No checkpoints yet.");
            return;
        }
        System.out.printf("  %-4s %-24s %-5s %-18s %-4s %s%n", "#", "TASK", "WAVE", "STATUS", "REV", "NARRATIVE");
        System.out.println("  " + "-".repeat(84));
        for (Checkpoint cp : checkpoints) {
            System.out.printf("  %-4d %-24s %-5d %-18s %-4d %s%n",
                    cp.number(), cp.taskName(), cp.wave(), cp.status().wireName(), cp.revision(),
                    ConsoleOutput.truncate(cp.output().narrative(), 30));
        }
    }

    private void printCheckpoint(Session session) {
        Checkpoint cp;
        try {
            cp = sessionService.getCheckpoint(session.id(), checkpointNumber);
        } catch (CheckpointNotFoundException e) {
            ConsoleOutput.error("Checkpoint " + checkpointNumber + " not found in session " + session.id());
            return;
        }

        System.out.println();
        System.out.println("CHECKPOINT " + cp.number() + " (" + cp.taskName() + ")");
        System.out.println("──────────────────────────────────");
        System.out.println("  Wave:      " + cp.wave());
        System.out.println("  Status:    " + ConsoleOutput.checkpointStatus(cp.status()));
        System.out.println("  Revision:  " + cp.revision());
        if (cp.metadata() != null) {
            System.out.println("  Duration:  " + cp.metadata().durationSeconds() + "s");
            System.out.println("  Cost:      " + cp.metadata().costUnits());
        }
        System.out.println();
        System.out.println("  " + cp.output().narrative());

        if (!cp.feedback().isEmpty()) {
            System.out.println();
            System.out.println("  FEEDBACK:");
            for (String f : cp.feedback()) {
                System.out.println("    - " + f);
            }
        }
    }
}
