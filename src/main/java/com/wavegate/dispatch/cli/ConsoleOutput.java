package com.wavegate.dispatch.cli;

import com.wavegate.core.model.CheckpointStatus;
import com.wavegate.core.model.SessionStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Wavegate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAVEGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAVEGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(SessionStatus status) {
        switch (status) {
            case COMPLETED -> success("Status: " + status.wireName());
            case FAILED -> error("Status: " + status.wireName());
            default -> info("Status: " + status.wireName());
        }
    }

    public static String checkpointStatus(CheckpointStatus status) {
        String color = switch (status) {
            case APPROVED -> "fg(green)";
            case REJECTED -> "fg(red)";
            case AWAITING_APPROVAL -> "fg(yellow)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status.wireName() + "|@");
    }

    public static void progress(int approved, int total) {
        int width = 20;
        int filled = total == 0 ? 0 : Math.min(width, approved * width / total);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Progress: [@|fg(green) " + "#".repeat(filled) + "|@" + ".".repeat(width - filled) + "] "
                        + approved + "/" + total + " checkpoints approved"));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "wave_started", "wave_complete" -> "@|bold,fg(yellow) [WAVE]|@";
            case "agent_completed" -> "@|fg(blue) [TASK]|@";
            case "checkpoint_ready" -> "@|fg(magenta) [CHECKPOINT]|@";
            case "session_complete" -> "@|fg(green),bold [COMPLETE]|@";
            case "error" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
