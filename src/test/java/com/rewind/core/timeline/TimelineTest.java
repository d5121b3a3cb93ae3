package com.rewind.core.timeline;

import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointMetadata;
import com.rewind.core.model.CheckpointStrategy;
import com.rewind.core.model.FileRef;
import com.rewind.core.model.SessionTimeline;
import com.rewind.core.model.TimelineNode;
import com.rewind.core.persistence.TimelineRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private Timeline timeline;

    @BeforeEach
    void setUp() {
        timeline = new Timeline("s1", "proj", false, CheckpointStrategy.MANUAL);
    }

    private static Checkpoint cp(String id, String session, String parent, int second) {
        return new Checkpoint(id, session, "proj", parent, T0.plusSeconds(second), id, 0, CheckpointMetadata.empty());
    }

    @Test
    @DisplayName("starts empty with the configured defaults")
    void initialState() {
        SessionTimeline snapshot = timeline.snapshot();
        assertNull(snapshot.currentCheckpointId());
        assertEquals(0, snapshot.totalCheckpoints());
        assertFalse(snapshot.autoCheckpointEnabled());
        assertEquals(CheckpointStrategy.MANUAL, snapshot.checkpointStrategy());
        assertTrue(snapshot.roots().isEmpty());
    }

    @Test
    @DisplayName("projects a branching history as a tree ordered by creation time")
    void branchingTree() {
        timeline.register(cp("a", "s1", null, 0), List.of(new FileRef("f", "h1", 1)));
        timeline.register(cp("b", "s1", "a", 1), List.of());
        timeline.register(cp("c", "s1", "a", 2), List.of());
        timeline.moveTo("c");

        SessionTimeline snapshot = timeline.snapshot();

        assertEquals(1, snapshot.roots().size());
        TimelineNode root = snapshot.roots().get(0);
        assertEquals("a", root.checkpoint().id());
        assertEquals(List.of("h1"), root.fileSnapshotIds());
        assertEquals(List.of("b", "c"), root.children().stream().map(n -> n.checkpoint().id()).toList());
        assertEquals("c", snapshot.currentCheckpointId());
        assertEquals(3, snapshot.totalCheckpoints());
    }

    @Test
    @DisplayName("fork ancestors root the tree but do not count as own checkpoints")
    void foreignAncestors() {
        timeline.registerAncestor(cp("origin", "s0", null, 0), List.of());
        timeline.register(cp("fork", "s1", "origin", 5), List.of());

        SessionTimeline snapshot = timeline.snapshot();

        assertEquals("origin", snapshot.roots().get(0).checkpoint().id());
        assertEquals("fork", snapshot.roots().get(0).children().get(0).checkpoint().id());
        assertEquals(1, snapshot.totalCheckpoints());
        assertTrue(timeline.contains("origin"));
        assertFalse(timeline.isOwn("origin"));
        assertEquals(List.of("fork"), timeline.ownCheckpoints().stream().map(Checkpoint::id).toList());
    }

    @Test
    @DisplayName("a checkpoint whose parent was pruned becomes a root")
    void danglingParent() {
        timeline.register(cp("a", "s1", null, 0), List.of());
        timeline.register(cp("b", "s1", "a", 1), List.of());
        timeline.moveTo("a");

        timeline.remove("a");

        SessionTimeline snapshot = timeline.snapshot();
        assertEquals(List.of("b"), snapshot.roots().stream().map(n -> n.checkpoint().id()).toList());
        assertNull(snapshot.currentCheckpointId());
    }

    @Test
    @DisplayName("moveTo rejects checkpoints outside the timeline")
    void moveToUnknown() {
        assertThrows(IllegalArgumentException.class, () -> timeline.moveTo("ghost"));
    }

    @Test
    @DisplayName("apply restores settings and drops a stale pointer")
    void applyRecord() {
        timeline.register(cp("a", "s1", null, 0), List.of());

        timeline.apply(new TimelineRecord("s1", "proj", "a", true, CheckpointStrategy.SMART));
        assertEquals("a", timeline.getCurrentCheckpointId());
        assertTrue(timeline.isAutoCheckpointEnabled());
        assertEquals(CheckpointStrategy.SMART, timeline.getStrategy());

        timeline.apply(new TimelineRecord("s1", "proj", "gone", false, CheckpointStrategy.MANUAL));
        assertNull(timeline.getCurrentCheckpointId());
        assertEquals(new TimelineRecord("s1", "proj", null, false, CheckpointStrategy.MANUAL), timeline.toRecord());
    }
}
