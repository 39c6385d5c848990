package com.lodestar.core.persistence;

import com.lodestar.core.state.PipelineState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Higher-level queries over the checkpoint store. Bridges {@link BaseCheckpointSaver},
 * which only queries by thread, and the CLI and API views that list runs and show
 * their timelines.
 */
@Service
public class CheckpointQueryService {

    private final BaseCheckpointSaver saver;
    private final Set<String> startedHere = new ConcurrentSkipListSet<>();

    public CheckpointQueryService(BaseCheckpointSaver saver) {
        this.saver = saver;
    }

    /** Remembers a run started in this process, for savers that cannot enumerate threads. */
    public void register(String runId) {
        startedHere.add(runId);
    }

    /**
     * All known run IDs. A {@link JdbcCheckpointSaver} is asked directly; for any other
     * saver the runs started by this process are returned.
     */
    public List<String> listAllThreadIds() {
        if (saver instanceof JdbcCheckpointSaver jdbc) {
            return jdbc.listAllThreadIds();
        }
        return new ArrayList<>(startedHere);
    }

    /**
     * Every checkpoint of a run, oldest first. Ordered by the state's own version
     * counter, which every transition increments.
     */
    public List<Checkpoint> listCheckpoints(String runId) {
        var config = RunnableConfig.builder().threadId(runId).build();
        List<Checkpoint> checkpoints = new ArrayList<>(saver.list(config));
        // savers list newest first; nodes that change nothing keep the version
        Collections.reverse(checkpoints);
        checkpoints.sort(Comparator.comparingInt(cp -> new PipelineState(cp.getState()).stateVersion()));
        return checkpoints;
    }

    public Optional<Checkpoint> getLatestCheckpoint(String runId) {
        var config = RunnableConfig.builder().threadId(runId).build();
        return saver.get(config);
    }

    public Optional<PipelineState> getLatestState(String runId) {
        return getLatestCheckpoint(runId).map(cp -> new PipelineState(cp.getState()));
    }
}
