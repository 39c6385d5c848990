package com.lodestar.core.state;

import com.lodestar.core.model.*;
import com.lodestar.core.store.ArtifactStore;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The single, explicitly versioned state of a planning run.
 * <p>
 * Every channel is a plain replace-on-write channel: nodes always return the whole new
 * value of whatever they change, so re-feeding a full snapshot on resume is idempotent.
 * Accessors accept both typed values and the JSON-map form read back from a JDBC
 * checkpoint.
 */
public class PipelineState extends AgentState {

    public static final int SCHEMA_VERSION = 1;

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Run identity ─────────────────────────────────────────────
        Map.entry("runId",                    Channels.base(() -> "")),
        Map.entry("idea",                     Channels.base(() -> "")),
        Map.entry("schemaVersion",            Channels.base(() -> SCHEMA_VERSION)),
        Map.entry("stateVersion",             Channels.base(() -> 0)),
        Map.entry("status",                   Channels.base(() -> PipelineStatus.RUNNING.name())),
        Map.entry("currentPhase",             Channels.base(() -> PhaseId.DISCOVERY.name())),
        Map.entry("designIntegrationEnabled", Channels.base(() -> false)),

        // ── Progress ─────────────────────────────────────────────────
        Map.entry("phaseStatuses",            Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry("stageStatuses",            Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry("stageAttempts",            Channels.base((Supplier<Map<String, Integer>>) Map::of)),
        Map.entry("correctiveAttempts",       Channels.base((Supplier<Map<String, Integer>>) Map::of)),
        Map.entry("stageFeedback",            Channels.base((Supplier<Map<String, List<String>>>) Map::of)),
        Map.entry("reopenedPhases",           Channels.base((Supplier<List<String>>) List::of)),

        // ── Content ──────────────────────────────────────────────────
        Map.entry("anchor",                   Channels.base((Reducer<ConceptAnchor>) null)),
        Map.entry("stageOutputs",             Channels.base((Supplier<Map<String, StageOutput>>) Map::of)),
        Map.entry("legacyOutputs",            Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry("artifacts",                Channels.base((Supplier<List<StructuredArtifact>>) List::of)),
        Map.entry("supersessions",            Channels.base((Supplier<List<SupersessionLink>>) List::of)),
        Map.entry("verificationReports",      Channels.base((Supplier<List<PhaseVerificationReport>>) List::of)),
        Map.entry("violationOverrides",       Channels.base((Supplier<List<ViolationOverride>>) List::of)),

        // ── Gates ────────────────────────────────────────────────────
        Map.entry("gateDecisions",            Channels.base((Supplier<List<GateDecision>>) List::of)),
        Map.entry("decisionsApplied",         Channels.base(() -> 0)),
        Map.entry("gateNotice",               Channels.base(() -> "")),
        Map.entry("decisionRoute",            Channels.base(() -> "")),
        Map.entry("openEscalations",          Channels.base((Supplier<List<Escalation>>) List::of)),
        Map.entry("escalationLog",            Channels.base((Supplier<List<Escalation>>) List::of)),

        // ── Assembly ─────────────────────────────────────────────────
        Map.entry("resolvedContext",          Channels.base((Reducer<ResolvedProjectContext>) null)),
        Map.entry("specification",            Channels.base((Reducer<ResolvedSpecification>) null)),
        Map.entry("workItemOrder",            Channels.base((Supplier<List<String>>) List::of))
    );

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Run identity ─────────────────────────────────────────────────

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String idea() {
        return this.<String>value("idea").orElse("");
    }

    public int stateVersion() {
        return intValue("stateVersion");
    }

    public PipelineStatus status() {
        return this.<String>value("status").map(PipelineStatus::valueOf).orElse(PipelineStatus.RUNNING);
    }

    public PhaseId currentPhase() {
        return this.<String>value("currentPhase").map(PhaseId::valueOf).orElse(PhaseId.DISCOVERY);
    }

    public boolean designIntegrationEnabled() {
        return this.<Boolean>value("designIntegrationEnabled").orElse(false);
    }

    // ── Progress ─────────────────────────────────────────────────────

    public Map<String, String> phaseStatuses() {
        return stringMap("phaseStatuses");
    }

    public PhaseStatus phaseStatus(PhaseId phase) {
        String raw = phaseStatuses().get(phase.name());
        return raw == null ? PhaseStatus.NOT_STARTED : PhaseStatus.valueOf(raw);
    }

    public Map<String, String> stageStatuses() {
        return stringMap("stageStatuses");
    }

    public StageStatus stageStatus(String stage) {
        String raw = stageStatuses().get(stage);
        return raw == null ? StageStatus.PENDING : StageStatus.valueOf(raw);
    }

    public Map<String, Integer> stageAttempts() {
        return intMap("stageAttempts");
    }

    public int stageAttempts(String stage) {
        return stageAttempts().getOrDefault(stage, 0);
    }

    public Map<String, Integer> correctiveAttempts() {
        return intMap("correctiveAttempts");
    }

    public int correctiveAttempts(PhaseId phase) {
        return correctiveAttempts().getOrDefault(phase.name(), 0);
    }

    @SuppressWarnings("unchecked")
    public Map<String, List<String>> stageFeedback() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        this.<Map<String, ?>>value("stageFeedback").ifPresent(raw -> raw.forEach((k, v) ->
                result.put(k, v instanceof Collection<?> c ? List.copyOf((Collection<String>) c) : List.of())));
        return result;
    }

    public List<String> feedback(String stage) {
        return stageFeedback().getOrDefault(stage, List.of());
    }

    /** Phases sent back by a human decision or a revision; they always return to their gate. */
    public List<String> reopenedPhases() {
        return list("reopenedPhases", String.class);
    }

    public boolean reopened(PhaseId phase) {
        return reopenedPhases().contains(phase.name());
    }

    // ── Content ──────────────────────────────────────────────────────

    public Optional<ConceptAnchor> anchor() {
        return this.<Object>value("anchor").map(raw -> StateJson.convert(raw, ConceptAnchor.class));
    }

    /** Stage outputs keyed by stage name, restored to their concrete variants. */
    public Map<String, StageOutput> stageOutputs() {
        Map<String, StageOutput> result = new LinkedHashMap<>();
        this.<Map<String, ?>>value("stageOutputs").ifPresent(raw -> raw.forEach((stage, v) -> {
            StageOutput output = toStageOutput(v);
            if (output != null) {
                result.put(stage, output);
            }
        }));
        return result;
    }

    public <T extends StageOutput> Optional<T> stageOutput(String stage, Class<T> type) {
        StageOutput output = stageOutputs().get(stage);
        return type.isInstance(output) ? Optional.of(type.cast(output)) : Optional.empty();
    }

    public Map<String, String> legacyOutputs() {
        return stringMap("legacyOutputs");
    }

    public List<StructuredArtifact> artifacts() {
        return list("artifacts", StructuredArtifact.class);
    }

    public List<SupersessionLink> supersessions() {
        return list("supersessions", SupersessionLink.class);
    }

    /** Rebuilds the artifact store from the persisted arena and link table. */
    public ArtifactStore store() {
        return ArtifactStore.of(artifacts(), supersessions());
    }

    public List<PhaseVerificationReport> verificationReports() {
        return list("verificationReports", PhaseVerificationReport.class);
    }

    /** The most recent report for a phase; earlier passes are kept for traceability. */
    public Optional<PhaseVerificationReport> latestReport(PhaseId phase) {
        List<PhaseVerificationReport> reports = verificationReports();
        for (int i = reports.size() - 1; i >= 0; i--) {
            if (reports.get(i).phase() == phase) {
                return Optional.of(reports.get(i));
            }
        }
        return Optional.empty();
    }

    public List<ViolationOverride> violationOverrides() {
        return list("violationOverrides", ViolationOverride.class);
    }

    // ── Gates ────────────────────────────────────────────────────────

    public List<GateDecision> gateDecisions() {
        return list("gateDecisions", GateDecision.class);
    }

    public int decisionsApplied() {
        return intValue("decisionsApplied");
    }

    /** A decision delivered to the gate but not yet applied by the graph. */
    public Optional<GateDecision> pendingDecision() {
        List<GateDecision> decisions = gateDecisions();
        int applied = decisionsApplied();
        return decisions.size() > applied ? Optional.of(decisions.get(applied)) : Optional.empty();
    }

    public String gateNotice() {
        return this.<String>value("gateNotice").orElse("");
    }

    /** The node the last applied decision routes to. */
    public String decisionRoute() {
        return this.<String>value("decisionRoute").orElse("");
    }

    public List<Escalation> openEscalations() {
        return list("openEscalations", Escalation.class);
    }

    public List<Escalation> escalationLog() {
        return list("escalationLog", Escalation.class);
    }

    // ── Assembly ─────────────────────────────────────────────────────

    public Optional<ResolvedProjectContext> resolvedContext() {
        return this.<Object>value("resolvedContext").map(raw -> StateJson.convert(raw, ResolvedProjectContext.class));
    }

    public Optional<ResolvedSpecification> specification() {
        return this.<Object>value("specification").map(raw -> StateJson.convert(raw, ResolvedSpecification.class));
    }

    public List<String> workItemOrder() {
        return list("workItemOrder", String.class);
    }

    /** Mutable copy of every channel, used to re-enter the graph on resume. */
    public Map<String, Object> snapshot() {
        return new HashMap<>(data());
    }

    // ── Helpers ──────────────────────────────────────────────────────

    static StageOutput toStageOutput(Object raw) {
        if (raw instanceof StageOutput output) {
            return output;
        }
        if (raw instanceof Map<?, ?> map && map.get("kind") instanceof String kind) {
            return StateJson.convert(map, OutputKind.valueOf(kind).outputType());
        }
        return null;
    }

    private int intValue(String key) {
        return this.<Object>value(key).map(v -> v instanceof Number n ? n.intValue() : 0).orElse(0);
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> stringMap(String key) {
        return this.<Map<String, String>>value(key).map(m -> (Map<String, String>) new LinkedHashMap<>(m)).orElseGet(LinkedHashMap::new);
    }

    private Map<String, Integer> intMap(String key) {
        Map<String, Integer> result = new LinkedHashMap<>();
        this.<Map<String, ?>>value(key).ifPresent(raw -> raw.forEach((k, v) ->
                result.put(k, v instanceof Number n ? n.intValue() : 0)));
        return result;
    }

    private <T> List<T> list(String key, Class<T> type) {
        List<T> result = new ArrayList<>();
        this.<Collection<?>>value(key).ifPresent(raw -> raw.forEach(item -> result.add(StateJson.convert(item, type))));
        return List.copyOf(result);
    }
}
