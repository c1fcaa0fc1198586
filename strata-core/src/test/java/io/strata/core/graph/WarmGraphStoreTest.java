package io.strata.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.strata.core.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WarmGraphStoreTest {
    private static final String OWNER = "alice";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryGraphRepository repository = new InMemoryGraphRepository();
    private final WarmGraphStore store = new WarmGraphStore(repository, clock);

    @Test
    void shouldDeduplicateEntitiesByLabel() throws Exception {
        GraphNode first = store.upsertEntity(OWNER, "Lisbon", 2.0, "item-1");
        GraphNode second = store.upsertEntity(OWNER, "  lisbon ", 3.0, "item-2");

        assertThat(second.nodeId()).isEqualTo(first.nodeId());
        assertThat(second.weight()).isEqualTo(5.0);
        assertThat(second.sourceItemIds()).containsExactly("item-1", "item-2");
        assertThat(second.payload()).containsEntry("mentions", 2);
        assertThat(store.nodes(OWNER)).hasSize(1);
        assertThat(store.upsertTopic(OWNER, "Lisbon", 1.0, "item-3").nodeId()).isNotEqualTo(first.nodeId());
    }

    @Test
    void shouldRankByHopsThenWeightThenRecency() throws Exception {
        GraphNode anchor = store.upsertTopic(OWNER, "travel", 1.0, "i1");
        GraphNode light = store.upsertEntity(OWNER, "hostel", 1.0, "i2");
        clock.advance(Duration.ofMinutes(1));
        GraphNode heavy = store.upsertEntity(OWNER, "flight", 6.0, "i3");
        GraphNode far = store.upsertEntity(OWNER, "airline", 9.0, "i4");
        store.link(OWNER, anchor.nodeId(), light.nodeId(), RelationKind.RELATES_TO, 0.5);
        store.link(OWNER, heavy.nodeId(), anchor.nodeId(), RelationKind.RELATES_TO, 0.5);
        store.link(OWNER, heavy.nodeId(), far.nodeId(), RelationKind.DISCUSSED_WITH, 0.5);

        List<RankedNode> ranked = store.traverse(OWNER, "Travel", 2);

        assertThat(ranked).extracting(node -> node.node().label()).containsExactly("travel", "flight", "hostel", "airline");
        assertThat(ranked).extracting(RankedNode::hops).containsExactly(0, 1, 1, 2);
        assertThat(store.queryContext(OWNER, "travel", 1)).extracting(GraphNode::label)
            .containsExactly("travel", "flight", "hostel");
    }

    @Test
    void shouldBreakWeightTiesByMostRecentUpdate() throws Exception {
        GraphNode anchor = store.upsertTopic(OWNER, "budget", 1.0, "i1");
        GraphNode older = store.upsertEntity(OWNER, "rent", 2.0, "i2");
        clock.advance(Duration.ofMinutes(1));
        GraphNode newer = store.upsertEntity(OWNER, "groceries", 2.0, "i3");
        store.link(OWNER, anchor.nodeId(), older.nodeId(), RelationKind.RELATES_TO, 0.5);
        store.link(OWNER, anchor.nodeId(), newer.nodeId(), RelationKind.RELATES_TO, 0.5);

        assertThat(store.queryContext(OWNER, "budget", 1)).extracting(GraphNode::label)
            .containsExactly("budget", "groceries", "rent");
    }

    @Test
    void shouldAnchorOnPartialMatchOrLatestSummary() throws Exception {
        GraphNode topic = store.upsertTopic(OWNER, "quarterly planning", 1.0, "i1");
        GraphNode summary = store.upsertSummary(OWNER, "s1", "we planned the quarter", 2.0, "i1");
        store.link(OWNER, summary.nodeId(), topic.nodeId(), RelationKind.SUMMARY_OF, 0.8);

        assertThat(store.queryContext(OWNER, "planning offsite", 0)).extracting(GraphNode::nodeId)
            .containsExactly(topic.nodeId());
        assertThat(store.queryContext(OWNER, "unrelated words", 0)).extracting(GraphNode::nodeId)
            .containsExactly(summary.nodeId());
        assertThat(store.queryContext(OWNER, null, 1)).extracting(GraphNode::nodeId)
            .containsExactly(summary.nodeId(), topic.nodeId());
        assertThat(store.queryContext("nobody", "anything", 2)).isEmpty();
    }

    @Test
    void shouldFoldSessionItemsIntoOneSummary() throws Exception {
        GraphNode first = store.upsertSummary(OWNER, "s1", "first excerpt", 2.0, "i1");
        GraphNode second = store.upsertSummary(OWNER, "s1", "second excerpt", 3.0, "i2");
        GraphNode other = store.upsertSummary(OWNER, "s2", "other session", 1.0, "i3");

        assertThat(second.nodeId()).isEqualTo(first.nodeId());
        assertThat(second.payload()).containsEntry("items", 2).containsEntry("excerpt", "second excerpt");
        assertThat(second.weight()).isEqualTo(5.0);
        assertThat(other.nodeId()).isNotEqualTo(first.nodeId());
    }

    @Test
    void shouldCombineRepeatedLinkStrengths() throws Exception {
        GraphNode a = store.upsertEntity(OWNER, "a", 1.0, "i1");
        GraphNode b = store.upsertEntity(OWNER, "b", 1.0, "i1");

        store.link(OWNER, a.nodeId(), b.nodeId(), RelationKind.DISCUSSED_WITH, 0.5);
        GraphEdge edge = store.link(OWNER, a.nodeId(), b.nodeId(), RelationKind.DISCUSSED_WITH, 0.5);

        assertThat(edge.strength()).isCloseTo(0.75, within(1e-9));
        assertThat(store.edges(OWNER)).hasSize(1);
        assertThatThrownBy(() -> store.link(OWNER, a.nodeId(), a.nodeId(), RelationKind.RELATES_TO, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.link(OWNER, a.nodeId(), "ghost", RelationKind.RELATES_TO, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOrphanNodesOnlyWhenEverySourceIsPurged() throws Exception {
        store.upsertEntity(OWNER, "shared", 1.0, "i1");
        store.upsertEntity(OWNER, "shared", 1.0, "i2");
        GraphNode single = store.upsertEntity(OWNER, "single", 1.0, "i1");

        List<GraphNode> orphaned = store.markPurged(OWNER, "i1");

        assertThat(orphaned).extracting(GraphNode::nodeId).containsExactly(single.nodeId());
        assertThat(store.node(OWNER, single.nodeId())).get().extracting(GraphNode::orphaned).isEqualTo(true);
        assertThat(store.markPurged(OWNER, "i2")).extracting(GraphNode::label).containsExactly("shared");
        assertThat(store.nodes(OWNER)).hasSize(2);
    }

    @Test
    void shouldLeaveGraphUnchangedWhenMutationFails() throws Exception {
        store.upsertEntity(OWNER, "stable", 1.0, "i1");

        assertThatThrownBy(() -> store.apply(OWNER, graph -> {
            graph.upsertLabeled(NodeType.ENTITY, "half-written", 1.0, "i2");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.nodes(OWNER)).extracting(GraphNode::label).containsExactly("stable");
    }

    @Test
    void shouldLeaveGraphUnchangedWhenSaveFails() throws Exception {
        FailingRepository failing = new FailingRepository();
        WarmGraphStore failingStore = new WarmGraphStore(failing, clock);
        failingStore.upsertEntity(OWNER, "stable", 1.0, "i1");
        failing.fail = true;

        assertThatThrownBy(() -> failingStore.upsertEntity(OWNER, "lost", 1.0, "i2")).isInstanceOf(IOException.class);

        assertThat(failingStore.nodes(OWNER)).extracting(GraphNode::label).containsExactly("stable");
    }

    @Test
    void shouldReloadPersistedGraph() throws Exception {
        GraphNode node = store.createNode(OWNER, NodeType.SUMMARY, "session s1", Map.of("session_id", "s1"), 2.0);

        WarmGraphStore reloaded = new WarmGraphStore(repository, clock);

        assertThat(reloaded.node(OWNER, node.nodeId())).isPresent();
        assertThat(reloaded.owners()).containsExactly(OWNER);
    }

    private static final class FailingRepository implements GraphRepository {
        private final InMemoryGraphRepository delegate = new InMemoryGraphRepository();
        private boolean fail;

        @Override
        public Optional<WarmSnapshot> load(String ownerId) {
            return delegate.load(ownerId);
        }

        @Override
        public void save(WarmSnapshot snapshot) throws IOException {
            if (fail) {
                throw new IOException("disk full");
            }
            delegate.save(snapshot);
        }

        @Override
        public List<String> owners() {
            return delegate.owners();
        }
    }
}
