package com.lodestar.dispatch.cli;

import com.lodestar.core.Fixtures;
import com.lodestar.core.assembly.SpecificationAssembler;
import com.lodestar.core.diff.DiffEngine;
import com.lodestar.core.engine.GateView;
import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.engine.RunNotFoundException;
import com.lodestar.core.engine.TimelineEntry;
import com.lodestar.core.model.*;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.tracker.ExportedWorkItem;
import com.lodestar.core.tracker.TrackerExportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Exercises picocli directly without a Spring context: parsing, help output and
 * what each command prints for a mocked engine.
 */
class CliTest {

    private static final String RUN_ID = "LDST-2026-0001";

    private record CliResult(int exitCode, String output) {}

    private final PipelineEngine engine = mock(PipelineEngine.class);
    private final TrackerExportService exportService = mock(TrackerExportService.class);

    private static PipelineState state(PipelineStatus status, PhaseId phase, Map<String, Object> extra) {
        Map<String, Object> data = new HashMap<>();
        data.put("runId", RUN_ID);
        data.put("idea", Fixtures.IDEA);
        data.put("status", status.name());
        data.put("currentPhase", phase.name());
        data.put("stateVersion", 7);
        data.putAll(extra);
        return new PipelineState(data);
    }

    private static GateView gateView(List<AnchorInvariant> ambiguous, List<String> blockers) {
        return new GateView(RUN_ID, PhaseId.DISCOVERY, PhaseStatus.AWAITING_GATE,
                Map.of("extract_anchor", "COMPLETED: anchor with 2 invariants"),
                new DiffEngine().diff(ArtifactStore.empty()), null, List.of(), ambiguous, List.of(), "", blockers);
    }

    private static ResolvedSpecification specification() {
        ArtifactStore store = ArtifactStore.empty()
                .append(Fixtures.capability("CAP-F-001", "Invite members"))
                .append(Fixtures.decision("DEC-001", "Invite tokens", "CAP-F-001"))
                .append(Fixtures.workItem("WI-001", "Invite endpoint", List.of("DEC-001"), List.of()));
        var assembler = new SpecificationAssembler();
        return assembler.attachWorkItems(
                assembler.assembleContext(store, Fixtures.frozenAnchor(), Map.of(), Map.of()), store, List.of());
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == PlanCommand.class) return (K) new PlanCommand(engine);
                if (cls == StatusCommand.class) return (K) new StatusCommand(engine);
                if (cls == DecideCommand.class) return (K) new DecideCommand(engine);
                if (cls == ResumeCommand.class) return (K) new ResumeCommand(engine);
                if (cls == CancelCommand.class) return (K) new CancelCommand(engine);
                if (cls == ReviseCommand.class) return (K) new ReviseCommand(engine);
                if (cls == SpecCommand.class) return (K) new SpecCommand(engine, new SpecificationAssembler());
                if (cls == ExportCommand.class) return (K) new ExportCommand(engine, exportService);
                if (cls == TimelineCommand.class) return (K) new TimelineCommand(engine);
                if (cls == ServeCommand.class) return (K) new ServeCommand();
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new LodestarCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private GateDecision capturedDecision() {
        var captor = ArgumentCaptor.forClass(GateDecision.class);
        verify(engine).decide(eq(RUN_ID), captor.capture());
        return captor.getValue();
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String command : List.of("plan", "status", "decide", "resume", "cancel", "revise",
                    "spec", "export", "timeline", "serve", "help")) {
                assertTrue(result.output().contains(command), "Help should list '" + command + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Lodestar 0.1.0"));
        }

        @Test
        @DisplayName("an unknown subcommand is a usage error")
        void unknownSubcommand() {
            assertNotEquals(0, execute("launch").exitCode());
        }
    }

    // =====================================================================
    //  plan
    // =====================================================================

    @Nested
    @DisplayName("plan")
    class PlanTests {

        @Test
        @DisplayName("starts a run and shows the first gate")
        void startsRun() {
            when(engine.start(eq(Fixtures.IDEA), anyMap()))
                    .thenReturn(state(PipelineStatus.AWAITING_GATE, PhaseId.DISCOVERY, Map.of()));
            when(engine.gateView(RUN_ID)).thenReturn(gateView(List.of(), List.of()));

            CliResult result = execute("plan", Fixtures.IDEA);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Run " + RUN_ID + ": AWAITING_GATE at DISCOVERY"));
            assertTrue(result.output().contains("GATE DISCOVERY"));
            assertTrue(result.output().contains("lodestar decide " + RUN_ID + " --approve"));
        }

        @Test
        @DisplayName("--no-design-integration picks the explicit start")
        void explicitDesignIntegration() {
            when(engine.generateRunId()).thenReturn(RUN_ID);
            when(engine.start(eq(RUN_ID), eq(Fixtures.IDEA), anyMap(), eq(false)))
                    .thenReturn(state(PipelineStatus.AWAITING_GATE, PhaseId.DISCOVERY, Map.of()));
            when(engine.gateView(RUN_ID)).thenReturn(gateView(List.of(), List.of()));

            assertEquals(0, execute("plan", "--no-design-integration", Fixtures.IDEA).exitCode());

            verify(engine).start(eq(RUN_ID), eq(Fixtures.IDEA), anyMap(), eq(false));
            verify(engine, never()).start(anyString(), anyMap());
        }

        @Test
        @DisplayName("reports a failed start without a stack trace")
        void failedStart() {
            when(engine.start(anyString(), anyMap()))
                    .thenThrow(new IllegalStateException("wrapper", new RuntimeException("model unavailable")));

            CliResult result = execute("plan", Fixtures.IDEA);

            assertTrue(result.output().contains("Run failed: model unavailable"));
        }

        @Test
        @DisplayName("an unreadable legacy file stops before starting")
        void unreadableLegacy() {
            CliResult result = execute("plan", "--legacy", "architect=/nonexistent/architect.md", Fixtures.IDEA);

            assertTrue(result.output().contains("Cannot read legacy output"));
            verifyNoInteractions(engine);
        }
    }

    // =====================================================================
    //  decide
    // =====================================================================

    @Nested
    @DisplayName("decide")
    class DecideTests {

        private void stubDecide() {
            when(engine.decide(eq(RUN_ID), any()))
                    .thenReturn(state(PipelineStatus.AWAITING_GATE, PhaseId.SCOPE, Map.of()));
            when(engine.gateView(RUN_ID)).thenReturn(gateView(List.of(), List.of()));
        }

        @Test
        @DisplayName("--approve delivers an approval")
        void approve() {
            stubDecide();
            assertEquals(0, execute("decide", RUN_ID, "--approve").exitCode());
            assertEquals(GateDecisionType.APPROVE, capturedDecision().type());
        }

        @Test
        @DisplayName("--request-changes carries feedback and the target stage")
        void requestChanges() {
            stubDecide();
            execute("decide", RUN_ID, "--request-changes", "split invites from credits", "--stage", "model_capabilities");

            GateDecision decision = capturedDecision();
            assertEquals(GateDecisionType.REQUEST_CHANGES, decision.type());
            assertEquals("split invites from credits", decision.feedback());
            assertEquals("model_capabilities", decision.targetStage());
        }

        @Test
        @DisplayName("--resolve collects property selections")
        void resolve() {
            stubDecide();
            execute("decide", RUN_ID, "--resolve", "monetization=earned only");

            GateDecision decision = capturedDecision();
            assertEquals(GateDecisionType.RESOLVE_AMBIGUITY, decision.type());
            assertEquals(Map.of("monetization", "earned only"), decision.selections());
        }

        @Test
        @DisplayName("--override records the acknowledgement and invariants")
        void override() {
            stubDecide();
            execute("decide", RUN_ID, "--override", "public profiles are opt-in", "--invariant", "community_model");

            GateDecision decision = capturedDecision();
            assertEquals(GateDecisionType.OVERRIDE_VIOLATION, decision.type());
            assertEquals("public profiles are opt-in", decision.acknowledgement());
            assertEquals(List.of("community_model"), decision.invariants());
        }

        @Test
        @DisplayName("two decisions at once are rejected by the parser")
        void exclusiveDecisions() {
            assertNotEquals(0, execute("decide", RUN_ID, "--approve", "--override", "x").exitCode());
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("shows ambiguity options and approval blockers at the gate")
        void showsBlockers() {
            when(engine.decide(eq(RUN_ID), any()))
                    .thenReturn(state(PipelineStatus.AWAITING_GATE, PhaseId.DISCOVERY, Map.of()));
            when(engine.gateView(RUN_ID)).thenReturn(gateView(List.of(Fixtures.ambiguousMonetization()),
                    List.of("invariant 'monetization' is ambiguous")));

            CliResult result = execute("decide", RUN_ID, "--approve");

            assertTrue(result.output().contains("options: earned only | earned or purchased"));
            assertTrue(result.output().contains("Approval is blocked until:"));
            assertTrue(result.output().contains("invariant 'monetization' is ambiguous"));
        }

        @Test
        @DisplayName("points at the specification once the run completes")
        void completed() {
            when(engine.decide(eq(RUN_ID), any()))
                    .thenReturn(state(PipelineStatus.COMPLETED, PhaseId.PLANNING, Map.of()));

            CliResult result = execute("decide", RUN_ID, "--approve");

            assertTrue(result.output().contains("Specification ready: lodestar spec " + RUN_ID));
        }
    }

    // =====================================================================
    //  status, timeline, cancel, resume, revise
    // =====================================================================

    @Nested
    @DisplayName("Run inspection and control")
    class ControlTests {

        @Test
        @DisplayName("status without a run lists runs")
        void listsRuns() {
            when(engine.listRuns()).thenReturn(List.of(state(PipelineStatus.RUNNING, PhaseId.SCOPE, Map.of())));

            CliResult result = execute("status");

            assertTrue(result.output().contains(RUN_ID));
            assertTrue(result.output().contains("SCOPE"));
        }

        @Test
        @DisplayName("status with no runs says so")
        void noRuns() {
            when(engine.listRuns()).thenReturn(List.of());
            assertTrue(execute("status").output().contains("No runs recorded."));
        }

        @Test
        @DisplayName("status shows phase and stage progress")
        void showsProgress() {
            when(engine.state(RUN_ID)).thenReturn(state(PipelineStatus.RUNNING, PhaseId.SCOPE, Map.of(
                    "phaseStatuses", Map.of("DISCOVERY", "COMPLETE", "SCOPE", "IN_PROGRESS"),
                    "stageStatuses", Map.of("define_scope", "COMPLETED"),
                    "stageAttempts", Map.of("define_scope", 1))));

            CliResult result = execute("status", RUN_ID);

            assertTrue(result.output().contains("RUN " + RUN_ID));
            assertTrue(result.output().contains("COMPLETE"));
            assertTrue(result.output().contains("define_scope"));
        }

        @Test
        @DisplayName("status of an unknown run prints the error")
        void unknownRun() {
            when(engine.state("LDST-0000-0000")).thenThrow(new RunNotFoundException("LDST-0000-0000"));
            assertTrue(execute("status", "LDST-0000-0000").output().contains("Run not found: LDST-0000-0000"));
        }

        @Test
        @DisplayName("timeline prints one row per checkpoint")
        void timeline() {
            when(engine.timeline(RUN_ID)).thenReturn(List.of(
                    new TimelineEntry("cp-1", "enter_discovery", "extract_anchor", 1, "RUNNING", "DISCOVERY"),
                    new TimelineEntry("cp-2", "extract_anchor", "validate_idea", 2, "RUNNING", "DISCOVERY")));

            CliResult result = execute("timeline", RUN_ID);

            assertTrue(result.output().contains("enter_discovery"));
            assertTrue(result.output().contains("validate_idea"));
            assertTrue(result.output().contains("2 checkpoints recorded."));
        }

        @Test
        @DisplayName("timeline of an unknown run says no checkpoints")
        void timelineUnknown() {
            when(engine.timeline("LDST-0000-0000")).thenThrow(new RunNotFoundException("LDST-0000-0000"));
            assertTrue(execute("timeline", "LDST-0000-0000").output().contains("No checkpoints found"));
        }

        @Test
        @DisplayName("cancel prints the cancelled status")
        void cancel() {
            when(engine.cancel(RUN_ID)).thenReturn(state(PipelineStatus.CANCELLED, PhaseId.SCOPE, Map.of()));
            assertTrue(execute("cancel", RUN_ID).output().contains("CANCELLED"));
        }

        @Test
        @DisplayName("resume continues the run")
        void resume() {
            when(engine.continueRun(RUN_ID)).thenReturn(state(PipelineStatus.RUNNING, PhaseId.SCOPE, Map.of()));
            execute("resume", RUN_ID);
            verify(engine).continueRun(RUN_ID);
        }

        @Test
        @DisplayName("revise parses the phase case-insensitively")
        void revise() {
            when(engine.revise(RUN_ID, PhaseId.DESIGN, "use a queue"))
                    .thenReturn(state(PipelineStatus.RUNNING, PhaseId.DESIGN, Map.of()));

            execute("revise", RUN_ID, "Design", "--feedback", "use a queue");

            verify(engine).revise(RUN_ID, PhaseId.DESIGN, "use a queue");
        }

        @Test
        @DisplayName("revise rejects an unknown phase")
        void reviseUnknownPhase() {
            CliResult result = execute("revise", RUN_ID, "deployment");
            assertTrue(result.output().contains("Unknown phase: deployment"));
            verify(engine, never()).revise(any(), any(), any());
        }
    }

    // =====================================================================
    //  spec and export
    // =====================================================================

    @Nested
    @DisplayName("Specification output")
    class SpecTests {

        @Test
        @DisplayName("spec prints the resolved specification as JSON")
        void printsSpec() {
            when(engine.state(RUN_ID)).thenReturn(state(PipelineStatus.COMPLETED, PhaseId.PLANNING,
                    Map.of("specification", specification())));

            CliResult result = execute("spec", RUN_ID);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"WI-001\""));
            assertTrue(result.output().contains("Invite tokens"));
        }

        @Test
        @DisplayName("spec of an unfinished run explains there is none yet")
        void noSpecYet() {
            when(engine.state(RUN_ID)).thenReturn(state(PipelineStatus.AWAITING_GATE, PhaseId.SCOPE, Map.of()));
            assertTrue(execute("spec", RUN_ID).output().contains("has no specification yet (AWAITING_GATE)"));
        }

        @Test
        @DisplayName("export drafts the work items and lists them")
        void export() {
            ResolvedSpecification spec = specification();
            when(engine.state(RUN_ID)).thenReturn(state(PipelineStatus.COMPLETED, PhaseId.PLANNING,
                    Map.of("specification", spec)));
            when(exportService.export(eq(RUN_ID), any()))
                    .thenReturn(List.of(new ExportedWorkItem("WI-001", "drafts/WI-001.md", "draft")));

            CliResult result = execute("export", RUN_ID);

            assertTrue(result.output().contains("drafts/WI-001.md"));
            assertTrue(result.output().contains("1 work item drafted."));
        }
    }

    // =====================================================================
    //  DecideCommand mapping
    // =====================================================================

    @Test
    @DisplayName("an override without --invariant acknowledges every open finding")
    void overrideDefaultsToAllFindings() {
        var command = new DecideCommand(engine);
        new CommandLine(command).parseArgs(RUN_ID, "--override", "accepted");

        GateDecision decision = command.toGateDecision();

        assertEquals(GateDecisionType.OVERRIDE_VIOLATION, decision.type());
        assertTrue(decision.invariants().isEmpty());
    }
}
