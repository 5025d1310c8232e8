package com.planview.dispatch.cli;

import com.planview.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the pv CLI.
 * <p>
 * Results go to stdout, errors to stderr. Nothing here prints when the
 * command was asked to be quiet; callers check that themselves.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner(String project, String version) {
        System.out.println();
        System.out.println(ansi("@|bold 📋 " + escape(project) + " v" + escape(version) + "|@"));
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [pv]|@ ") + message);
    }

    public static void success(String message) {
        System.out.println("✅ " + message);
    }

    /** Describes an edit that a dry run did not perform. */
    public static void wouldDo(String message) {
        System.out.println(ansi("@|fg(yellow) Would:|@ ") + message);
    }

    public static void error(String message) {
        System.err.println(ansi("@|fg(red) Error:|@ ") + message);
    }

    public static void hint(String message) {
        System.err.println(message);
    }

    public static String bold(String text) {
        return ansi("@|bold " + escape(text) + "|@");
    }

    public static String dim(String text) {
        return text.isEmpty() ? text : ansi("@|faint " + escape(text) + "|@");
    }

    public static String green(String text) {
        return ansi("@|fg(green) " + escape(text) + "|@");
    }

    public static String boldCyan(String text) {
        return ansi("@|bold,fg(cyan) " + escape(text) + "|@");
    }

    public static String boldYellow(String text) {
        return ansi("@|bold,fg(yellow) " + escape(text) + "|@");
    }

    public static String statusIcon(TaskStatus status) {
        if (status == null) {
            return "❓";
        }
        return switch (status) {
            case COMPLETED -> "✅";
            case IN_PROGRESS -> "🔄";
            case PENDING -> "⏳";
            case BLOCKED -> "🛑";
            case SKIPPED -> "⏭️";
        };
    }

    /** Icons used by the upcoming-work listing. */
    public static String upcomingIcon(TaskStatus status, boolean actionable) {
        if (status == TaskStatus.IN_PROGRESS) {
            return "🔄";
        }
        if (status == TaskStatus.BLOCKED) {
            return "🚫";
        }
        return actionable ? "👉" : "⏳";
    }

    public static String percent(double value) {
        return String.format("%.0f%%", value);
    }

    /** First ten characters of an ISO timestamp, i.e. the date. */
    public static String date(String timestamp) {
        if (timestamp == null) {
            return "unknown";
        }
        return timestamp.length() > 10 ? timestamp.substring(0, 10) : timestamp;
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }

    // picocli markup treats "@|" and "|@" as delimiters
    private static String escape(String text) {
        return text == null ? "" : text.replace("@|", "@ |").replace("|@", "| @");
    }
}
