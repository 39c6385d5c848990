package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Work items proposed from the resolved project context. {@code dependsOn} entries are
 * either existing {@code WI-} IDs or keys of other drafts in the same plan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkItemPlan(
        String summary,
        List<WorkItemDraft> workItems,
        List<InvariantOverride> overrides
) implements StageOutput {

    public WorkItemPlan {
        workItems = workItems == null ? List.of() : List.copyOf(workItems);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.WORK_ITEMS;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkItemDraft(
            String key,
            String title,
            String description,
            String summary,
            String layer,
            List<String> implementsIds,
            List<String> dependsOn,
            List<String> acceptanceCriteria,
            String supersedes
    ) implements Serializable {

        public WorkItemDraft {
            implementsIds = implementsIds == null ? List.of() : List.copyOf(implementsIds);
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
            acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        }
    }
}
