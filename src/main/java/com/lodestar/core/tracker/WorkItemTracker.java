package com.lodestar.core.tracker;

import java.util.Optional;

/**
 * Boundary to an external work-item tracker.
 */
public interface WorkItemTracker {

    /**
     * Creates or replaces the draft for a work item.
     *
     * @return the tracker's reference for the draft
     */
    String draft(TrackerDraft draft);

    /**
     * The tracker's status for a work item of a run, or empty if it was never drafted.
     */
    Optional<String> queryStatus(String runId, String workItemId);
}
