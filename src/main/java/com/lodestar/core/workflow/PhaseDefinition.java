package com.lodestar.core.workflow;

import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.state.PipelineState;

import java.util.List;
import java.util.Optional;

public record PhaseDefinition(PhaseId id, List<StageDefinition> stages, VerificationMode verification) {

    public PhaseDefinition {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Phase " + id + " needs at least one stage");
        }
        stages = List.copyOf(stages);
    }

    public Optional<StageDefinition> stage(String name) {
        return stages.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public int indexOf(String stageName) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).name().equals(stageName)) {
                return i;
            }
        }
        return -1;
    }

    public List<StageDefinition> generationStages() {
        return stages.stream().filter(StageDefinition::isGeneration).toList();
    }

    /** Whether any generation stage of this phase completed in the current pass. */
    public boolean producedOutput(PipelineState state) {
        return generationStages().stream().anyMatch(s -> state.stageStatus(s.name()) == StageStatus.COMPLETED);
    }

    /** Stages from {@code stageName} to the end of the phase, in order. */
    public List<StageDefinition> from(String stageName) {
        int index = indexOf(stageName);
        if (index < 0) {
            throw new IllegalArgumentException("Phase " + id + " has no stage '" + stageName + "'");
        }
        return stages.subList(index, stages.size());
    }
}
