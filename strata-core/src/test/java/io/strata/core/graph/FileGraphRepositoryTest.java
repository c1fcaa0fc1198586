package io.strata.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.strata.core.memory.MemoryItem;
import io.strata.core.memory.MemoryTier;
import io.strata.core.memory.TurnContent;
import io.strata.core.memory.TurnSignals;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileGraphRepositoryTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldPersistGraphAndResidentsAcrossInstances() throws Exception {
        Path dir = tempDir.resolve("warm");
        WarmGraphStore store = new WarmGraphStore(new FileGraphRepository(dir), clock);
        MemoryItem item = new MemoryItem(
            "item-1",
            "alice",
            "s1",
            new TurnContent("Booked the flight to Lisbon", List.of("Lisbon"), List.of("travel"), new TurnSignals(8, 6, 7, 1)),
            6.4,
            clock.instant(),
            clock.instant(),
            MemoryTier.HOT,
            2
        );
        GraphNode city = store.upsertEntity("alice", "Lisbon", 6.4, "item-1");
        GraphNode topic = store.upsertTopic("alice", "travel", 6.4, "item-1");
        store.link("alice", city.nodeId(), topic.nodeId(), RelationKind.RELATES_TO, 0.64);
        store.apply("alice", graph -> {
            graph.admit(item);
            return null;
        });

        WarmGraphStore reloaded = new WarmGraphStore(new FileGraphRepository(dir), clock);

        assertThat(reloaded.nodes("alice")).extracting(GraphNode::label).containsExactly("Lisbon", "travel");
        assertThat(reloaded.node("alice", city.nodeId())).get().satisfies(node -> {
            assertThat(node.payload()).containsEntry("mentions", 1);
            assertThat(node.createdAt()).isEqualTo(clock.instant());
        });
        assertThat(reloaded.edges("alice")).singleElement().satisfies(edge ->
            assertThat(edge.relationKind()).isEqualTo(RelationKind.RELATES_TO));
        assertThat(reloaded.resident("alice", "item-1")).get().satisfies(resident -> {
            assertThat(resident.tier()).isEqualTo(MemoryTier.WARM);
            assertThat(resident.content().entities()).containsExactly("Lisbon");
            assertThat(resident.content().signals().recurrenceCount()).isEqualTo(1);
            assertThat(resident.accessCount()).isEqualTo(2);
        });
        assertThat(reloaded.residentSince("alice", "item-1")).contains(clock.instant());
    }

    @Test
    void shouldEncodeOwnerIdsIntoFileNames() throws Exception {
        FileGraphRepository repository = new FileGraphRepository(tempDir);
        repository.save(new WarmSnapshot("team/alpha beta", List.of(), List.of(), List.of(), List.of(), Map.of()));
        repository.save(new WarmSnapshot("bob", List.of(), List.of(), List.of(), List.of(), Map.of()));

        assertThat(repository.owners()).containsExactly("bob", "team/alpha beta");
        assertThat(repository.load("team/alpha beta")).isPresent();
        assertThat(repository.load("nobody")).isEmpty();
    }

    @Test
    void shouldReportUnreadableSnapshot() throws Exception {
        FileGraphRepository repository = new FileGraphRepository(tempDir);
        Files.writeString(tempDir.resolve("alice.warm.json"), "{ not json");

        assertThatThrownBy(() -> repository.load("alice"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Unreadable warm snapshot");
    }
}
