package com.lodestar.core.graph;

import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseStatus;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.nodes.*;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.workflow.PhaseDefinition;
import com.lodestar.core.workflow.PipelineDefinition;
import com.lodestar.core.workflow.StageDefinition;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRunner;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a planning
 * run, generated from the {@link PipelineDefinition}.
 * <p>
 * Topology, per phase:
 * <pre>
 *   START -> [routeStart]
 *      -> apply_decision -> [decisionRoute] (any stage, verify, gate, enter or finalize)
 *      -> enter_&lt;phase&gt; -> [routeAfterEnter]
 *         -> first stage -> ... -> [routeAfterStage] -> next stage | gate_&lt;phase&gt; | END
 *         -> verify_&lt;phase&gt; -> [routeAfterVerify]
 *            -> correct_&lt;phase&gt; -> producing stage (bounded loop)
 *            -> gate_&lt;phase&gt; -> END  (suspended until a decision arrives)
 *            -> enter_&lt;next&gt; | finalize   (phase skipped: nothing new to check)
 *      finalize -> END
 * </pre>
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private static final int MAX_ITERATIONS = 100;

    private final PipelineDefinition definition;
    private final CorrectPhaseNode correctNode;
    private final CompiledGraph<PipelineState> compiledGraph;

    public PipelineGraph(
            PipelineDefinition definition,
            List<StageHandler> handlers,
            StageRunner stageRunner,
            EnterPhaseNode enterNode,
            VerifyPhaseNode verifyNode,
            CorrectPhaseNode correctNode,
            AwaitGateNode gateNode,
            ApplyDecisionNode decisionNode,
            FinalizeNode finalizeNode,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {
        this.definition = definition;
        this.correctNode = correctNode;

        Map<String, StageHandler> handlerByStage = handlers.stream()
                .collect(Collectors.toMap(StageHandler::stage, Function.identity()));
        Set<String> allNodes = new LinkedHashSet<>();

        var graph = new StateGraph<>(PipelineState.SCHEMA, PipelineState::new);
        for (PhaseDefinition phase : definition.phases()) {
            PhaseId id = phase.id();
            graph.addNode(NodeNames.enter(id), node_async(state -> enterNode.apply(id, state)));
            allNodes.add(NodeNames.enter(id));
            for (StageDefinition stage : phase.stages()) {
                StageHandler handler = handlerByStage.get(stage.name());
                if (handler == null) {
                    throw new IllegalStateException("No handler registered for stage " + stage.name());
                }
                graph.addNode(stage.name(), node_async(state -> stageRunner.run(stage, handler, state)));
                allNodes.add(stage.name());
            }
            graph.addNode(NodeNames.verify(id), node_async(state -> verifyNode.apply(id, state)));
            graph.addNode(NodeNames.correct(id), node_async(state -> correctNode.apply(id, state)));
            graph.addNode(NodeNames.gate(id), node_async(state -> gateNode.apply(id, state)));
            allNodes.add(NodeNames.verify(id));
            allNodes.add(NodeNames.correct(id));
            allNodes.add(NodeNames.gate(id));
        }
        graph.addNode(NodeNames.DECIDE, node_async(decisionNode::apply));
        graph.addNode(NodeNames.FINALIZE, node_async(finalizeNode::apply));
        allNodes.add(NodeNames.DECIDE);
        allNodes.add(NodeNames.FINALIZE);

        Map<String, String> anyNode = targets(List.copyOf(allNodes), END);
        graph.addConditionalEdges(START, edge_async(this::routeStart), anyNode);
        graph.addConditionalEdges(NodeNames.DECIDE, edge_async(this::routeAfterDecision), anyNode);
        graph.addEdge(NodeNames.FINALIZE, END);

        for (PhaseDefinition phase : definition.phases()) {
            PhaseId id = phase.id();
            String afterPhase = afterPhase(id);
            List<StageDefinition> stages = phase.stages();

            graph.addConditionalEdges(NodeNames.enter(id),
                    edge_async(state -> routeAfterEnter(id, state)),
                    targets(stages.get(0).name(), END));
            for (int i = 0; i < stages.size(); i++) {
                String next = i + 1 < stages.size() ? stages.get(i + 1).name() : NodeNames.verify(id);
                String stageName = stages.get(i).name();
                graph.addConditionalEdges(stageName,
                        edge_async(state -> routeAfterStage(id, stageName, next, state)),
                        targets(next, NodeNames.gate(id), END));
            }
            graph.addConditionalEdges(NodeNames.verify(id),
                    edge_async(state -> routeAfterVerify(id, state)),
                    targets(NodeNames.correct(id), NodeNames.gate(id), afterPhase, END));
            graph.addConditionalEdges(NodeNames.correct(id),
                    edge_async(state -> routeAfterCorrect(id, state)),
                    targets(stages.stream().map(StageDefinition::name).toList(), NodeNames.verify(id)));
            graph.addEdge(NodeNames.gate(id), END);
        }

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph compiled without checkpoint saver (state will not be persisted)");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
        this.compiledGraph.setMaxIterations(MAX_ITERATIONS);
    }

    /**
     * A pending decision is applied first. Otherwise the run continues at the entry of
     * its current phase, at its gate when it was suspended there, or at the next phase
     * when the current one is already done.
     */
    String routeStart(PipelineState state) {
        if (state.pendingDecision().isPresent()) {
            return NodeNames.DECIDE;
        }
        if (state.status() == PipelineStatus.CANCELLED || state.status() == PipelineStatus.COMPLETED) {
            return END;
        }
        if (state.phaseStatuses().isEmpty()) {
            return NodeNames.enter(definition.first());
        }
        PhaseId phase = state.currentPhase();
        if (state.phaseStatus(phase).isDone()) {
            return afterPhase(phase);
        }
        if (state.phaseStatus(phase) == PhaseStatus.AWAITING_GATE) {
            return NodeNames.gate(phase);
        }
        return NodeNames.enter(phase);
    }

    String routeAfterDecision(PipelineState state) {
        String route = state.decisionRoute();
        return route.isBlank() ? NodeNames.gate(state.currentPhase()) : route;
    }

    String routeAfterEnter(PhaseId phase, PipelineState state) {
        if (state.status() == PipelineStatus.RUNNING && state.currentPhase() == phase) {
            return definition.phase(phase).stages().get(0).name();
        }
        return END;
    }

    /**
     * A failed or blocked stage sends the run to its phase gate; a cancelled run stops.
     */
    String routeAfterStage(PhaseId phase, String stage, String next, PipelineState state) {
        if (state.status() == PipelineStatus.CANCELLED) {
            return END;
        }
        StageStatus status = state.stageStatus(stage);
        if (status == StageStatus.FAILED || status == StageStatus.BLOCKED_ON_APPROVAL) {
            return NodeNames.gate(phase);
        }
        return next;
    }

    String routeAfterVerify(PhaseId phase, PipelineState state) {
        if (state.status() == PipelineStatus.CANCELLED) {
            return END;
        }
        if (state.phaseStatus(phase) == PhaseStatus.SKIPPED) {
            return afterPhase(phase);
        }
        PhaseDefinition phaseDefinition = definition.phase(phase);
        if (!phaseDefinition.producedOutput(state)) {
            return NodeNames.gate(phase);
        }
        boolean correct = state.latestReport(phase)
                .flatMap(report -> correctNode.correctionTarget(phaseDefinition, state, report))
                .isPresent();
        return correct ? NodeNames.correct(phase) : NodeNames.gate(phase);
    }

    String routeAfterCorrect(PhaseId phase, PipelineState state) {
        return definition.phase(phase).stages().stream()
                .filter(s -> !state.stageStatus(s.name()).isSettled())
                .map(StageDefinition::name)
                .findFirst()
                .orElse(NodeNames.verify(phase));
    }

    private String afterPhase(PhaseId phase) {
        return definition.next(phase).map(NodeNames::enter).orElse(NodeNames.FINALIZE);
    }

    private static Map<String, String> targets(String... names) {
        return targets(List.of(names));
    }

    private static Map<String, String> targets(List<String> names, String... more) {
        Set<String> all = new LinkedHashSet<>(names);
        all.addAll(List.of(more));
        Map<String, String> map = new HashMap<>();
        all.forEach(n -> map.put(n, n));
        return map;
    }

    public CompiledGraph<PipelineState> getCompiledGraph() {
        return compiledGraph;
    }
}
