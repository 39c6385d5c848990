package com.lodestar.core.workflow;

import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.model.SystemTraits;
import com.lodestar.core.model.ValidationVerdict;
import com.lodestar.core.nodes.DesignMockupGenerator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static com.lodestar.core.workflow.Stages.*;

/**
 * The declarative stage graph: phases in execution order, each with its stages in
 * order, their context inputs and their run predicates.
 */
@Component
public class PipelineDefinition {

    private final List<PhaseDefinition> phases;

    @Autowired
    public PipelineDefinition(WorkflowProperties properties, ObjectProvider<DesignMockupGenerator> mockupGenerator) {
        this(properties, mockupGenerator.getIfAvailable() != null);
    }

    public PipelineDefinition(WorkflowProperties properties, boolean mockupGeneratorAvailable) {
        StagePredicate needsPivot = (state, diff) -> state.stageOutput(VALIDATE_IDEA, ValidationVerdict.class)
                .map(ValidationVerdict::warrantsPivot)
                .orElse(false);
        StagePredicate needsDesignHandoff = (state, diff) -> mockupGeneratorAvailable
                && state.designIntegrationEnabled()
                && state.stageOutput(CLASSIFY_TRAITS, SystemTraits.class).map(SystemTraits::userInterface).orElse(false);
        StagePredicate anchorNotFrozen = (state, diff) -> state.anchor().map(a -> !a.frozen()).orElse(true);
        StagePredicate needsArchitecture = (state, diff) -> diff.needsArchitecture();
        StagePredicate needsWorkItems = (state, diff) -> state.specification().isEmpty() || diff.needsWorkItems();
        StagePredicate workItemsGenerated = (state, diff) -> state.stageStatus(GENERATE_WORK_ITEMS) == StageStatus.COMPLETED;

        this.phases = List.of(
                phase(properties, PhaseId.DISCOVERY,
                        generation(EXTRACT_ANCHOR, PhaseId.DISCOVERY, List.of(), ContextScope.NONE, anchorNotFrozen),
                        generation(VALIDATE_IDEA, PhaseId.DISCOVERY, List.of(), ContextScope.NONE, null),
                        generation(PIVOT_STRATEGY, PhaseId.DISCOVERY, List.of(VALIDATE_IDEA), ContextScope.NONE, needsPivot)),
                phase(properties, PhaseId.SCOPE,
                        generation(DEFINE_SCOPE, PhaseId.SCOPE, List.of(VALIDATE_IDEA, PIVOT_STRATEGY), ContextScope.NONE, null),
                        generation(MODEL_CAPABILITIES, PhaseId.SCOPE, List.of(DEFINE_SCOPE), ContextScope.CAPABILITIES, null),
                        generation(CLASSIFY_TRAITS, PhaseId.SCOPE, List.of(DEFINE_SCOPE), ContextScope.CAPABILITIES, null),
                        generation(DESIGN_HANDOFF, PhaseId.SCOPE, List.of(DEFINE_SCOPE, CLASSIFY_TRAITS), ContextScope.CAPABILITIES, needsDesignHandoff)),
                phase(properties, PhaseId.DESIGN,
                        generation(ARCHITECT, PhaseId.DESIGN, List.of(DEFINE_SCOPE, CLASSIFY_TRAITS, DESIGN_HANDOFF), ContextScope.ARCHITECTURE, needsArchitecture)),
                phase(properties, PhaseId.PLANNING,
                        new StageDefinition(ASSEMBLE_CONTEXT, PhaseId.PLANNING, StageKind.DETERMINISTIC, List.of(), ContextScope.NONE, null),
                        generation(GENERATE_WORK_ITEMS, PhaseId.PLANNING, List.of(), ContextScope.WORK_ITEMS, needsWorkItems),
                        new StageDefinition(ORDER_WORK_ITEMS, PhaseId.PLANNING, StageKind.DETERMINISTIC, List.of(), ContextScope.NONE, workItemsGenerated)));
    }

    public List<PhaseDefinition> phases() {
        return phases;
    }

    public PhaseDefinition phase(PhaseId id) {
        return phases.stream().filter(p -> p.id() == id).findFirst()
                .orElseThrow(() -> new NoSuchElementException("No phase " + id));
    }

    public Optional<PhaseId> next(PhaseId id) {
        for (int i = 0; i < phases.size() - 1; i++) {
            if (phases.get(i).id() == id) {
                return Optional.of(phases.get(i + 1).id());
            }
        }
        return Optional.empty();
    }

    public Optional<PhaseId> previous(PhaseId id) {
        for (int i = 1; i < phases.size(); i++) {
            if (phases.get(i).id() == id) {
                return Optional.of(phases.get(i - 1).id());
            }
        }
        return Optional.empty();
    }

    public PhaseId first() {
        return phases.get(0).id();
    }

    public StageDefinition stage(String name) {
        return phases.stream().flatMap(p -> p.stages().stream())
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No stage " + name));
    }

    public List<StageDefinition> allStages() {
        return phases.stream().flatMap(p -> p.stages().stream()).toList();
    }

    private static PhaseDefinition phase(WorkflowProperties properties, PhaseId id, StageDefinition... stages) {
        VerificationMode mode = properties.getMultiPassPhases().contains(id)
                ? VerificationMode.MULTI_PASS
                : VerificationMode.SINGLE_PASS;
        return new PhaseDefinition(id, List.of(stages), mode);
    }

    private static StageDefinition generation(String name, PhaseId phase, List<String> inputs,
                                              ContextScope scope, StagePredicate predicate) {
        return new StageDefinition(name, phase, StageKind.GENERATION, inputs, scope, predicate);
    }
}
