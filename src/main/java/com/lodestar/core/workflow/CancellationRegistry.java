package com.lodestar.core.workflow;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation requests for in-flight runs. Checked by the stage runner before each
 * stage; a cancelled run stops at the next stage boundary with its state intact.
 */
@Component
public class CancellationRegistry {

    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    public void cancel(String runId) {
        cancelled.add(runId);
    }

    public boolean isCancelled(String runId) {
        return cancelled.contains(runId);
    }

    public void clear(String runId) {
        cancelled.remove(runId);
    }
}
