package com.lodestar.core.tracker;

import java.util.List;

/**
 * A work item as handed to a tracker.
 *
 * @param labels {@code implements:<ID>}, {@code layer:<layer>} and {@code run:<runId>}
 */
public record TrackerDraft(
        String runId,
        String workItemId,
        String title,
        String body,
        List<String> labels
) {

    public TrackerDraft {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
