package com.example.workflowguard.versioning;

import com.example.workflowguard.MutableClock;
import com.example.workflowguard.graph.BlockType;
import com.example.workflowguard.graph.NodeType;
import com.example.workflowguard.graph.Position;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowGraphJson;
import com.example.workflowguard.graph.WorkflowNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.workflowguard.graph.TestGraphs.action;
import static com.example.workflowguard.graph.TestGraphs.edge;
import static com.example.workflowguard.graph.TestGraphs.graph;
import static com.example.workflowguard.graph.TestGraphs.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("VersionStore")
class VersionStoreTest {

    private static final String WORKFLOW = "wf-1";

    private MutableClock clock;
    private VersionStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T09:00:00Z");
        store = newStore(VersionRetention.DEFAULTS);
    }

    private VersionStore newStore(VersionRetention retention) {
        AtomicInteger ids = new AtomicInteger();
        return new VersionStore(new InMemoryVersionRepository(),
                new ContentChecksums(new WorkflowGraphJson(JsonMapper.builder().build())),
                clock, retention, () -> "v" + ids.incrementAndGet());
    }

    /** A small graph whose action label makes the content distinct. */
    private static WorkflowGraph content(String label) {
        WorkflowNode notify = WorkflowNode.of("A", BlockType.EMAIL, NodeType.ACTION, label,
                Map.of("to", "ops@example.com"), Position.of(250, 0));
        return graph(List.of(trigger("T"), notify), edge("T", "A"));
    }

    private WorkflowVersion create(String label) {
        return store.createVersion(WORKFLOW, content(label), VersionInfo.EMPTY);
    }

    @Nested
    @DisplayName("createVersion")
    class Create {

        @Test
        @DisplayName("numbers versions, activates the first and chains parents")
        void numbering() {
            WorkflowVersion first = create("one");
            WorkflowVersion second = create("two");
            WorkflowVersion third = create("three");

            assertThat(List.of(first.version(), second.version(), third.version())).containsExactly(1, 2, 3);
            assertThat(List.of(first.status(), second.status(), third.status()))
                    .containsExactly(VersionStatus.ACTIVE, VersionStatus.DRAFT, VersionStatus.DRAFT);
            assertNull(first.metadata().parentVersionId());
            assertEquals(first.id(), second.metadata().parentVersionId());
            assertEquals(second.id(), third.metadata().parentVersionId());
            assertEquals("Version 2", second.name());
            assertEquals("system", second.metadata().createdBy());
            assertEquals(clock.instant(), second.metadata().createdAt());
        }

        @Test
        @DisplayName("keeps caller-supplied details")
        void callerDetails() {
            WorkflowVersion version = store.createVersion(WORKFLOW, content("one"), VersionInfo.builder()
                    .name("Initial import")
                    .description("from the editor")
                    .createdBy("alice")
                    .generationPrompt("email me hourly")
                    .tags(List.of("generated"))
                    .build());

            assertEquals("Initial import", version.name());
            assertEquals("alice", version.metadata().createdBy());
            assertEquals("email me hourly", version.metadata().generationPrompt());
            assertTrue(version.metadata().hasTag("generated"));
            assertThat(version.checksums().full()).hasSize(64);
        }

        @Test
        @DisplayName("returns the stored version for identical content")
        void deduplicates() {
            WorkflowVersion first = create("one");
            create("two");

            WorkflowVersion again = create("one");

            assertEquals(first.id(), again.id());
            assertThat(store.getVersionHistory(WORKFLOW)).hasSize(2);
        }

        @Test
        @DisplayName("ignores config key order when comparing content")
        void deduplicatesAcrossKeyOrder() {
            Map<String, Object> ab = new LinkedHashMap<>();
            ab.put("url", "https://api.example.org");
            ab.put("method", "GET");
            Map<String, Object> ba = new LinkedHashMap<>();
            ba.put("method", "GET");
            ba.put("url", "https://api.example.org");

            WorkflowVersion first = store.createVersion(WORKFLOW, graph(List.of(
                    WorkflowNode.of("H", BlockType.HTTP_REQUEST, NodeType.ACTION, "Call", ab, Position.of(0, 0)))),
                    VersionInfo.EMPTY);
            WorkflowVersion second = store.createVersion(WORKFLOW, graph(List.of(
                    WorkflowNode.of("H", BlockType.HTTP_REQUEST, NodeType.ACTION, "Call", ba, Position.of(0, 0)))),
                    VersionInfo.EMPTY);

            assertEquals(first.id(), second.id());
        }

        @Test
        @DisplayName("keeps workflows independent")
        void perWorkflow() {
            create("one");
            WorkflowVersion other = store.createVersion("wf-2", content("one"), VersionInfo.EMPTY);

            assertEquals(1, other.version());
            assertTrue(other.isActive());
        }

        @Test
        @DisplayName("rejects a blank workflow id")
        void blankWorkflowId() {
            assertThrows(IllegalArgumentException.class,
                    () -> store.createVersion(" ", content("one"), VersionInfo.EMPTY));
        }

        @Test
        @DisplayName("never reuses a number after a delete")
        void numbersAfterDelete() {
            create("one");
            WorkflowVersion second = create("two");
            store.deleteVersion(second.id());

            WorkflowVersion next = create("three");

            assertEquals(3, next.version());
        }

        @Test
        @DisplayName("keeps the numbering high-water mark in the repository across store instances")
        void numbersSurviveStoreRestart() {
            InMemoryVersionRepository repository = new InMemoryVersionRepository();
            ContentChecksums sums = new ContentChecksums(new WorkflowGraphJson(JsonMapper.builder().build()));
            AtomicInteger ids = new AtomicInteger();
            VersionStore first = new VersionStore(repository, sums, clock, VersionRetention.DEFAULTS,
                    () -> "r" + ids.incrementAndGet());
            first.createVersion(WORKFLOW, content("one"), VersionInfo.EMPTY);
            WorkflowVersion second = first.createVersion(WORKFLOW, content("two"), VersionInfo.EMPTY);
            first.deleteVersion(second.id());

            VersionStore restarted = new VersionStore(repository, sums, clock, VersionRetention.DEFAULTS,
                    () -> "r" + ids.incrementAndGet());
            WorkflowVersion next = restarted.createVersion(WORKFLOW, content("three"), VersionInfo.EMPTY);

            assertEquals(3, next.version());
            assertEquals(3, repository.highestVersionNumber(WORKFLOW));
        }

        @Test
        @DisplayName("serializes concurrent creates into distinct numbers with one active version")
        void concurrentCreates() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Callable<WorkflowVersion>> tasks = new ArrayList<>();
                for (int i = 0; i < 32; i++) {
                    String label = "label-" + i;
                    tasks.add(() -> create(label));
                }
                List<Integer> numbers = new ArrayList<>();
                for (Future<WorkflowVersion> future : executor.invokeAll(tasks)) {
                    numbers.add(future.get().version());
                }

                assertThat(numbers).doesNotHaveDuplicates().hasSize(32);
                assertThat(store.getVersionHistory(WORKFLOW)).filteredOn(WorkflowVersion::isActive).hasSize(1);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("activation and rollback")
    class Rollback {

        @Test
        @DisplayName("activateVersion leaves exactly one active version")
        void activate() {
            WorkflowVersion first = create("one");
            WorkflowVersion second = create("two");

            store.activateVersion(WORKFLOW, second.id());

            assertEquals(second.id(), store.getActiveVersion(WORKFLOW).orElseThrow().id());
            assertEquals(VersionStatus.DRAFT, store.getVersion(first.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("activateVersion rejects unknown and foreign versions")
        void activateUnknown() {
            create("one");
            WorkflowVersion foreign = store.createVersion("wf-2", content("x"), VersionInfo.EMPTY);

            assertThrows(VersionNotFoundException.class, () -> store.activateVersion(WORKFLOW, "missing"));
            VersionNotFoundException e = assertThrows(VersionNotFoundException.class,
                    () -> store.activateVersion(WORKFLOW, foreign.id()));
            assertEquals(foreign.id(), e.getVersionId());
        }

        @Test
        @DisplayName("snapshots the active content before switching back")
        void rollbackWithBackup() {
            WorkflowVersion first = create("one");
            WorkflowVersion second = create("two");
            store.activateVersion(WORKFLOW, second.id());

            RollbackResult result = store.rollback(WORKFLOW, first.id(), RollbackOptions.builder()
                    .performedBy("bob")
                    .reason("bad deploy")
                    .createBackup(true)
                    .build());

            assertTrue(result.success());
            assertEquals(first.id(), result.rolledBackTo().id());
            assertTrue(result.rolledBackTo().isActive());
            assertThat(result.warnings()).isEmpty();

            WorkflowVersion backup = result.backupVersion().orElseThrow();
            assertEquals(3, backup.version());
            assertEquals(VersionStatus.DRAFT, backup.status());
            assertEquals("Backup before rollback to v1", backup.name());
            assertEquals(second.id(), backup.metadata().parentVersionId());
            assertEquals("bob", backup.metadata().createdBy());
            assertThat(backup.metadata().tags()).containsExactly(VersionStore.TAG_BACKUP, VersionStore.TAG_ROLLBACK);
            assertThat(backup.metadata().description()).endsWith(": bad deploy");
            assertEquals(second.checksums().full(), backup.checksums().full());
            assertEquals(second.nodes(), backup.nodes());
        }

        @Test
        @DisplayName("creates no backup unless asked")
        void rollbackWithoutBackup() {
            WorkflowVersion first = create("one");
            WorkflowVersion second = create("two");
            store.activateVersion(WORKFLOW, second.id());

            RollbackResult result = store.rollback(WORKFLOW, first.id(), null);

            assertTrue(result.backupVersion().isEmpty());
            assertThat(store.getVersionHistory(WORKFLOW)).hasSize(2);
        }

        @Test
        @DisplayName("warns when rolling back across many versions")
        void distanceWarning() {
            WorkflowVersion first = create("v1");
            WorkflowVersion last = null;
            for (int i = 2; i <= 7; i++) {
                last = create("v" + i);
            }
            store.activateVersion(WORKFLOW, last.id());

            RollbackResult result = store.rollback(WORKFLOW, first.id(), RollbackOptions.builder().build());

            assertThat(result.warnings()).containsExactly("Rolling back 6 versions may cause compatibility issues");
        }

        @Test
        @DisplayName("fails for a missing target")
        void missingTarget() {
            create("one");

            assertThrows(VersionNotFoundException.class,
                    () -> store.rollback(WORKFLOW, "missing", RollbackOptions.builder().createBackup(true).build()));
            assertThat(store.getVersionHistory(WORKFLOW)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("archive and delete")
    class Lifecycle {

        @Test
        @DisplayName("refuse to touch the active version")
        void activeIsProtected() {
            WorkflowVersion first = create("one");

            ActiveVersionModificationException archive = assertThrows(ActiveVersionModificationException.class,
                    () -> store.archiveVersion(first.id()));
            assertThrows(ActiveVersionModificationException.class, () -> store.deleteVersion(first.id()));

            assertEquals("archive", archive.getOperation());
            assertTrue(store.getVersion(first.id()).isPresent());
        }

        @Test
        @DisplayName("archive drafts and hide them from the default history")
        void archiveDraft() {
            create("one");
            WorkflowVersion second = create("two");

            store.archiveVersion(second.id());

            assertThat(store.getVersionHistory(WORKFLOW)).extracting(WorkflowVersion::version).containsExactly(1);
            assertThat(store.getVersionHistory(WORKFLOW, new HistoryQuery(true, 50, 0)))
                    .extracting(WorkflowVersion::version).containsExactly(2, 1);
        }

        @Test
        @DisplayName("retention archives old drafts once the history grows past its limit")
        void retention() {
            store = newStore(new VersionRetention(5, 2, 5));
            for (int i = 1; i <= 7; i++) {
                create("v" + i);
            }

            VersionStats stats = store.getVersionStats(WORKFLOW);

            assertEquals(7, stats.totalVersions());
            assertEquals(1, stats.activeVersion());
            assertEquals(4, stats.archivedCount());
            assertEquals(2, stats.draftCount());
            assertThat(store.getVersionHistory(WORKFLOW)).extracting(WorkflowVersion::version)
                    .containsExactly(7, 6, 1);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("history is newest first and paged")
        void paging() {
            for (int i = 1; i <= 5; i++) {
                create("v" + i);
            }

            assertThat(store.getVersionHistory(WORKFLOW, new HistoryQuery(false, 2, 1)))
                    .extracting(WorkflowVersion::version).containsExactly(4, 3);
        }

        @Test
        @DisplayName("look up versions by number, latest and active")
        void lookups() {
            WorkflowVersion first = create("one");
            create("two");

            assertEquals("two", store.getVersionByNumber(WORKFLOW, 2).orElseThrow().nodes().get(1).label());
            assertEquals(2, store.getLatestVersion(WORKFLOW).orElseThrow().version());
            assertEquals(first.id(), store.getActiveVersion(WORKFLOW).orElseThrow().id());
            assertTrue(store.getVersionByNumber(WORKFLOW, 9).isEmpty());
            assertTrue(store.getLatestVersion("unknown").isEmpty());
        }

        @Test
        @DisplayName("stats average the time between versions")
        void stats() {
            create("one");
            clock.advance(Duration.ofHours(1));
            create("two");
            clock.advance(Duration.ofHours(1));
            create("three");

            VersionStats stats = store.getVersionStats(WORKFLOW);

            assertEquals(3, stats.totalVersions());
            assertEquals(1, stats.oldestVersion());
            assertEquals(3, stats.newestVersion());
            assertEquals(1.0, stats.averageHoursBetweenVersions(), 1e-9);
        }

        @Test
        @DisplayName("stats of an unknown workflow are empty")
        void emptyStats() {
            VersionStats stats = store.getVersionStats("unknown");

            assertEquals(0, stats.totalVersions());
            assertNull(stats.activeVersion());
        }

        @Test
        @DisplayName("comparing a version with itself yields no changes")
        void compareSelf() {
            WorkflowVersion first = create("one");

            VersionDiff diff = store.compareVersions(first.id(), first.id());

            assertTrue(diff.isEmpty());
            assertFalse(diff.summary().significantChanges());
        }

        @Test
        @DisplayName("comparing reports the relabelled node")
        void compareRelabel() {
            WorkflowVersion first = create("one");
            WorkflowVersion second = create("two");

            VersionDiff diff = store.compareVersions(first.id(), second.id());

            assertThat(diff.modifiedNodes()).singleElement().satisfies(change -> {
                assertEquals("A", change.nodeId());
                assertThat(change.changedFields()).containsExactly("label");
            });
            assertThrows(VersionNotFoundException.class, () -> store.compareVersions(first.id(), "missing"));
        }

        @Test
        @DisplayName("snapshots stay immutable after the source graph changes")
        void snapshotsAreCopies() {
            List<WorkflowNode> nodes = new ArrayList<>(List.of(trigger("T"), action("A")));
            WorkflowVersion version = store.createVersion(WORKFLOW, nodes, List.of(edge("T", "A")), null);

            nodes.clear();

            assertEquals(2, store.getVersion(version.id()).orElseThrow().nodes().size());
        }

        @Test
        @DisplayName("snapshots stay immutable after nested config of the source graph changes")
        void nestedConfigIsCopied() {
            Map<String, Object> headers = new LinkedHashMap<>(Map.of("Accept", "json"));
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("url", "https://api.example.org");
            config.put("method", "GET");
            config.put("headers", headers);
            WorkflowNode http = WorkflowNode.of("H", BlockType.HTTP_REQUEST, NodeType.ACTION, "call", config,
                    Position.of(250, 0));
            WorkflowVersion version = store.createVersion(WORKFLOW, graph(List.of(trigger("T"), http), edge("T", "H")),
                    VersionInfo.EMPTY);

            headers.put("Authorization", "Bearer evil");

            WorkflowVersion stored = store.getVersion(version.id()).orElseThrow();
            assertEquals(Map.of("Accept", "json"), stored.graph().findNode("H").orElseThrow().config().get("headers"));
            assertEquals(version.checksums(), new ContentChecksums(new WorkflowGraphJson(JsonMapper.builder().build()))
                    .compute(stored.nodes(), stored.edges()));
            assertThrows(UnsupportedOperationException.class,
                    () -> ((Map<String, Object>) stored.graph().findNode("H").orElseThrow().config().get("headers")).put("x", "y"));
        }
    }
}
