package com.lodestar.core.persistence;

import com.lodestar.core.Fixtures;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseStatus;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.model.Recommendation;
import com.lodestar.core.model.RiskLevel;
import com.lodestar.core.model.ValidationVerdict;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.Stages;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Runs {@link JdbcCheckpointSaver} against an in-memory H2 database.
 */
class JdbcCheckpointSaverTest {

    private JdbcCheckpointSaver saver;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:checkpoints-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        saver = new JdbcCheckpointSaver(dataSource);
        saver.createTables();
    }

    private static RunnableConfig thread(String runId) {
        return RunnableConfig.builder().threadId(runId).build();
    }

    private static Checkpoint checkpoint(String id, String nodeId, Map<String, Object> state) {
        return Checkpoint.builder().id(id).nodeId(nodeId).nextNodeId("next").state(state).build();
    }

    @Test
    @DisplayName("the latest checkpoint is the last one written")
    void latestCheckpoint() throws Exception {
        saver.put(thread("run-1"), checkpoint("cp-1", "enter_discovery", Map.of("stateVersion", 1)));
        saver.put(thread("run-1"), checkpoint("cp-2", "extract_anchor", Map.of("stateVersion", 2)));

        Checkpoint latest = saver.get(thread("run-1")).orElseThrow();

        assertEquals("cp-2", latest.getId());
        assertEquals("extract_anchor", latest.getNodeId());
        assertEquals(2, ((Number) latest.getState().get("stateVersion")).intValue());
    }

    @Test
    @DisplayName("list returns newest first and a checkpoint can be read by ID")
    void listAndGetById() throws Exception {
        saver.put(thread("run-1"), checkpoint("cp-1", "a", Map.of()));
        saver.put(thread("run-1"), checkpoint("cp-2", "b", Map.of()));

        List<String> ids = saver.list(thread("run-1")).stream().map(Checkpoint::getId).toList();
        assertEquals(List.of("cp-2", "cp-1"), ids);

        var byId = RunnableConfig.builder().threadId("run-1").checkPointId("cp-1").build();
        assertEquals("a", saver.get(byId).orElseThrow().getNodeId());
    }

    @Test
    @DisplayName("writing an existing checkpoint ID replaces it")
    void overwritesCheckpoint() throws Exception {
        saver.put(thread("run-1"), checkpoint("cp-1", "a", Map.of("status", "RUNNING")));
        saver.put(thread("run-1"), checkpoint("cp-1", "a", Map.of("status", "CANCELLED")));

        assertEquals(1, saver.list(thread("run-1")).size());
        assertEquals("CANCELLED", saver.get(thread("run-1")).orElseThrow().getState().get("status"));
    }

    @Test
    @DisplayName("runs are kept apart and listed oldest first")
    void separatesRuns() throws Exception {
        saver.put(thread("run-b"), checkpoint("cp-1", "a", Map.of()));
        saver.put(thread("run-a"), checkpoint("cp-1", "a", Map.of()));
        saver.put(thread("run-b"), checkpoint("cp-2", "b", Map.of()));

        assertEquals(List.of("run-b", "run-a"), saver.listAllThreadIds());
        assertEquals(1, saver.list(thread("run-a")).size());
        assertTrue(saver.get(thread("run-c")).isEmpty());
    }

    @Test
    @DisplayName("release removes every checkpoint of a run")
    void releasesRun() throws Exception {
        saver.put(thread("run-1"), checkpoint("cp-1", "a", Map.of()));
        saver.put(thread("run-2"), checkpoint("cp-1", "a", Map.of()));

        BaseCheckpointSaver.Tag tag = saver.release(thread("run-1"));

        assertEquals(1, tag.checkpoints().size());
        assertTrue(saver.list(thread("run-1")).isEmpty());
        assertEquals(List.of("run-2"), saver.listAllThreadIds());
    }

    @Test
    @DisplayName("typed run state survives the JSON round trip")
    void restoresTypedState() throws Exception {
        ArtifactStore store = ArtifactStore.empty()
                .append(Fixtures.capability("CAP-F-001", "Invite members"))
                .append(Fixtures.decision("DEC-001", "Invite tokens", "CAP-F-001"));
        PipelineState base = Fixtures.state(Fixtures.frozenAnchor(), store);
        ValidationVerdict verdict = new ValidationVerdict("Viable niche", Recommendation.GO, RiskLevel.LOW,
                List.of("reciprocity"), List.of(), List.of());
        Map<String, Object> data = base.snapshot();
        data.putAll(StateUpdates.from(base)
                .stageOutput(Stages.VALIDATE_IDEA, verdict)
                .phaseStatus(PhaseId.DISCOVERY, PhaseStatus.AWAITING_GATE)
                .status(PipelineStatus.AWAITING_GATE)
                .build());

        saver.put(thread("LDST-1"), checkpoint("cp-1", "gate_discovery", data));
        PipelineState restored = new PipelineState(saver.get(thread("LDST-1")).orElseThrow().getState());

        assertEquals(Fixtures.frozenAnchor(), restored.anchor().orElseThrow());
        assertEquals(verdict, restored.stageOutput(Stages.VALIDATE_IDEA, ValidationVerdict.class).orElseThrow());
        assertEquals(PipelineStatus.AWAITING_GATE, restored.status());
        assertEquals(PhaseStatus.AWAITING_GATE, restored.phaseStatus(PhaseId.DISCOVERY));
        assertEquals(store.artifacts(), restored.store().artifacts());
        assertEquals(List.of("DEC-001"),
                restored.store().coveringDecisions("CAP-F-001").stream().map(a -> a.id()).toList());
    }

    // ===================================================================
    //  CheckpointerConfig
    // ===================================================================

    @Test
    @DisplayName("CheckpointerConfig falls back to MemorySaver without a DataSource")
    @SuppressWarnings("unchecked")
    void configFallsBackToMemory() throws Exception {
        ObjectProvider<DataSource> none = mock(ObjectProvider.class);

        BaseCheckpointSaver configured = new CheckpointerConfig().checkpointSaver(none);

        assertInstanceOf(MemorySaver.class, configured);
    }

    @Test
    @DisplayName("CheckpointerConfig creates the table when a DataSource is configured")
    @SuppressWarnings("unchecked")
    void configUsesJdbc() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:config-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(dataSource);

        BaseCheckpointSaver configured = new CheckpointerConfig().checkpointSaver(provider);

        assertInstanceOf(JdbcCheckpointSaver.class, configured);
        assertTrue(((JdbcCheckpointSaver) configured).listAllThreadIds().isEmpty());
    }
}
