package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Decisions and domain entities proposed by the architecture stage.
 * <p>
 * A decision draft names the capabilities it serves by ID. Entities refer to decisions
 * either by an existing {@code DEC-} ID or by the draft's local {@code key}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchitecturePlan(
        String summary,
        List<DecisionDraft> decisions,
        List<EntityDraft> entities,
        List<InvariantOverride> overrides
) implements StageOutput {

    public ArchitecturePlan {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        entities = entities == null ? List.of() : List.copyOf(entities);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.ARCHITECTURE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DecisionDraft(
            String key,
            String title,
            String choice,
            String rationale,
            String summary,
            List<String> serves,
            String supersedes
    ) implements Serializable {

        public DecisionDraft {
            serves = serves == null ? List.of() : List.copyOf(serves);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntityDraft(
            String name,
            String description,
            String summary,
            List<String> referencedBy,
            String supersedes
    ) implements Serializable {

        public EntityDraft {
            referencedBy = referencedBy == null ? List.of() : List.copyOf(referencedBy);
        }
    }
}
