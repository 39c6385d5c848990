package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.GateView;
import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.Escalation;
import com.lodestar.core.model.InvariantViolation;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.state.PipelineState;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Lodestar CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LODESTAR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LODESTAR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void status(PipelineState state) {
        String line = "Run " + state.runId() + ": " + state.status() + " at " + state.currentPhase()
                + " (state version " + state.stateVersion() + ")";
        PipelineStatus status = state.status();
        if (status == PipelineStatus.COMPLETED) {
            success(line);
        } else if (status == PipelineStatus.FAILED || status == PipelineStatus.BLOCKED) {
            error(line);
        } else if (status == PipelineStatus.AWAITING_GATE) {
            warn(line);
        } else {
            info(line);
        }
    }

    public static void report(PhaseVerificationReport report) {
        String color = report.passed() ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [VERIFY]|@ @|" + color + " " + report.summary() + "|@"));
        for (InvariantViolation v : report.invariantsViolated()) {
            violation(v);
        }
        for (var flag : report.identityGenericized()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(yellow) ~|@ " + flag.originalFeature() + " became " + flag.genericReplacement()));
        }
        for (String warning : report.warnings()) {
            System.out.println("    - " + warning);
        }
    }

    public static void violation(InvariantViolation v) {
        String color = v.isBlocking() ? "fg(red)" : "fg(yellow)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|" + color + " " + v.severity() + "|@ " + v.invariant()
                        + (v.stage() == null ? "" : " in " + v.stage()) + ": " + v.violation()));
        if (v.suggestedFix() != null && !v.suggestedFix().isBlank()) {
            System.out.println("        fix: " + v.suggestedFix());
        }
    }

    public static void gate(GateView view) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold GATE " + view.phase() + "|@ (" + view.phase().title() + ") " + view.phaseStatus()));
        for (Map.Entry<String, String> stage : view.stageSummaries().entrySet()) {
            System.out.printf("  %-22s %s%n", stage.getKey(), truncate(stage.getValue(), 90));
        }
        System.out.println("  Diff: " + view.diff().summary());
        if (view.report() != null) {
            report(view.report());
        }
        if (!view.ambiguous().isEmpty()) {
            System.out.println();
            warn("Ambiguous invariants:");
            for (AnchorInvariant inv : view.ambiguous()) {
                System.out.println("    " + inv.property() + " = " + inv.value()
                        + (inv.ambiguity() == null ? "" : " (" + inv.ambiguity() + ")"));
                if (!inv.clarificationOptions().isEmpty()) {
                    System.out.println("        options: " + String.join(" | ", inv.clarificationOptions()));
                }
            }
        }
        if (!view.openEscalations().isEmpty()) {
            System.out.println();
            for (Escalation e : view.openEscalations()) {
                escalation(e);
            }
        }
        if (!view.notice().isBlank()) {
            error(view.notice());
        }
        if (!view.approvalBlockers().isEmpty()) {
            System.out.println();
            info("Approval is blocked until:");
            view.approvalBlockers().forEach(b -> System.out.println("    - " + b));
        }
    }

    public static void escalation(Escalation e) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red),bold [ESCALATION " + e.kind() + "]|@ "
                        + (e.stage() == null ? e.phase() : e.stage()) + ": " + e.message()));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "stage.completed", "stage.skipped" -> "@|fg(blue) [STAGE]|@";
            case "stage.failed" -> "@|fg(red) [STAGE]|@";
            case "phase.verified" -> "@|fg(yellow) [VERIFY]|@";
            case "gate.awaiting", "gate.decided" -> "@|bold,fg(yellow) [GATE]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.cancelled" -> "@|fg(red),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
