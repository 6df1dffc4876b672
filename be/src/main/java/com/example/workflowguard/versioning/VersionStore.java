package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Append-only, content-addressed version history per workflow, with activation, rollback and diffing.
 * <p>
 * Mutations of one workflow (create, activate, rollback, archive, delete) are serialized by a per-workflow
 * write lock, which keeps version numbers monotonic and at most one version active. Reads take the matching
 * read lock and may run concurrently.
 * </p>
 */
@Slf4j
public class VersionStore {

    public static final String TAG_BACKUP = "backup";
    public static final String TAG_ROLLBACK = "rollback";
    static final String DEFAULT_CREATOR = "system";

    private final VersionRepository repository;
    private final ContentChecksums checksums;
    private final Clock clock;
    private final VersionRetention retention;
    private final Supplier<String> idGenerator;

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public VersionStore(VersionRepository repository, ContentChecksums checksums, Clock clock, VersionRetention retention) {
        this(repository, checksums, clock, retention, () -> UUID.randomUUID().toString());
    }

    public VersionStore(VersionRepository repository, ContentChecksums checksums, Clock clock,
                        VersionRetention retention, Supplier<String> idGenerator) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.checksums = Objects.requireNonNull(checksums, "checksums");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public WorkflowVersion createVersion(String workflowId, WorkflowGraph graph, VersionInfo info) {
        Objects.requireNonNull(graph, "graph");
        return createVersion(workflowId, graph.nodes(), graph.edges(), info);
    }

    /**
     * Snapshots the given content. If any stored version of the workflow has the same full checksum, that version
     * is returned and nothing is written. The first version of a workflow becomes active; later ones are drafts.
     */
    public WorkflowVersion createVersion(String workflowId, List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                         VersionInfo info) {
        requireId(workflowId, "workflowId");
        List<WorkflowNode> safeNodes = nodes == null ? List.of() : nodes;
        List<WorkflowEdge> safeEdges = edges == null ? List.of() : edges;
        VersionInfo details = info == null ? VersionInfo.EMPTY : info;

        Lock lock = lockFor(workflowId).writeLock();
        lock.lock();
        try {
            VersionChecksums sums = checksums.compute(safeNodes, safeEdges);
            Optional<WorkflowVersion> duplicate = repository.findByWorkflowId(workflowId).stream()
                    .filter(v -> v.checksums() != null && sums.full().equals(v.checksums().full()))
                    .findFirst();
            if (duplicate.isPresent()) {
                log.debug("Identical content already stored workflowId={} versionId={} version={}",
                        workflowId, duplicate.get().id(), duplicate.get().version());
                return duplicate.get();
            }
            return append(workflowId, safeNodes, safeEdges, details, sums);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes the given version the single active one; any previously active version becomes a draft.
     *
     * @throws VersionNotFoundException if the version does not exist in this workflow
     */
    public WorkflowVersion activateVersion(String workflowId, String versionId) {
        requireId(workflowId, "workflowId");
        Lock lock = lockFor(workflowId).writeLock();
        lock.lock();
        try {
            WorkflowVersion target = requireVersion(workflowId, versionId);
            if (target.isActive()) {
                return target;
            }
            for (WorkflowVersion version : repository.findByWorkflowId(workflowId)) {
                if (version.isActive()) {
                    repository.save(version.withStatus(VersionStatus.DRAFT));
                }
            }
            WorkflowVersion activated = target.withStatus(VersionStatus.ACTIVE);
            repository.save(activated);
            log.info("Activated version workflowId={} versionId={} version={}", workflowId, versionId, target.version());
            return activated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Activates an earlier version, optionally after snapshotting the active content as a backup version. The
     * backup is always a new record, even when identical content is already stored.
     *
     * @throws VersionNotFoundException if the target does not exist in this workflow
     */
    public RollbackResult rollback(String workflowId, String targetVersionId, RollbackOptions options) {
        requireId(workflowId, "workflowId");
        RollbackOptions opts = options == null ? RollbackOptions.builder().build() : options;
        Lock lock = lockFor(workflowId).writeLock();
        lock.lock();
        try {
            WorkflowVersion target = requireVersion(workflowId, targetVersionId);
            Optional<WorkflowVersion> current = activeVersion(workflowId);

            List<String> warnings = new ArrayList<>();
            if (current.isPresent()) {
                int distance = current.get().version() - target.version();
                if (distance > retention.rollbackWarningDistance()) {
                    warnings.add("Rolling back " + distance + " versions may cause compatibility issues");
                }
            }

            WorkflowVersion backup = null;
            if (opts.createBackup() && current.isPresent()) {
                WorkflowVersion active = current.get();
                String description = "Automatic backup created before rolling back to version " + target.version()
                        + (opts.reason() != null && !opts.reason().isBlank() ? ": " + opts.reason() : "");
                VersionInfo backupInfo = VersionInfo.builder()
                        .name("Backup before rollback to v" + target.version())
                        .description(description)
                        .createdBy(opts.performedBy())
                        .generationPrompt(active.metadata() != null ? active.metadata().generationPrompt() : null)
                        .parentVersionId(active.id())
                        .tags(List.of(TAG_BACKUP, TAG_ROLLBACK))
                        .build();
                backup = append(workflowId, active.nodes(), active.edges(), backupInfo, active.checksums());
            }

            WorkflowVersion activated = activateVersion(workflowId, target.id());
            log.info("Rolled back workflowId={} to version={} performedBy={} backup={}",
                    workflowId, target.version(), opts.performedBy(), backup != null ? backup.version() : null);
            return new RollbackResult(true, activated, backup, warnings);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws VersionNotFoundException if either version does not exist
     */
    public VersionDiff compareVersions(String fromVersionId, String toVersionId) {
        WorkflowVersion from = repository.findById(fromVersionId)
                .orElseThrow(() -> new VersionNotFoundException(null, fromVersionId));
        WorkflowVersion to = repository.findById(toVersionId)
                .orElseThrow(() -> new VersionNotFoundException(null, toVersionId));
        return VersionDiffer.compare(from, to);
    }

    /**
     * @throws ActiveVersionModificationException if the version is active
     */
    public WorkflowVersion archiveVersion(String versionId) {
        WorkflowVersion version = repository.findById(versionId)
                .orElseThrow(() -> new VersionNotFoundException(null, versionId));
        Lock lock = lockFor(version.workflowId()).writeLock();
        lock.lock();
        try {
            WorkflowVersion current = requireVersion(version.workflowId(), versionId);
            if (current.isActive()) {
                throw new ActiveVersionModificationException(versionId, "archive");
            }
            WorkflowVersion archived = current.withStatus(VersionStatus.ARCHIVED);
            repository.save(archived);
            log.info("Archived version workflowId={} version={}", archived.workflowId(), archived.version());
            return archived;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws ActiveVersionModificationException if the version is active
     */
    public void deleteVersion(String versionId) {
        WorkflowVersion version = repository.findById(versionId)
                .orElseThrow(() -> new VersionNotFoundException(null, versionId));
        Lock lock = lockFor(version.workflowId()).writeLock();
        lock.lock();
        try {
            WorkflowVersion current = requireVersion(version.workflowId(), versionId);
            if (current.isActive()) {
                throw new ActiveVersionModificationException(versionId, "delete");
            }
            repository.deleteById(versionId);
            log.info("Deleted version workflowId={} version={}", current.workflowId(), current.version());
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkflowVersion> getVersion(String versionId) {
        return repository.findById(versionId);
    }

    public Optional<WorkflowVersion> getVersionByNumber(String workflowId, int versionNumber) {
        return read(workflowId, () -> repository.findByWorkflowId(workflowId).stream()
                .filter(v -> v.version() == versionNumber)
                .findFirst());
    }

    public Optional<WorkflowVersion> getLatestVersion(String workflowId) {
        return read(workflowId, () -> latest(repository.findByWorkflowId(workflowId)));
    }

    public Optional<WorkflowVersion> getActiveVersion(String workflowId) {
        return read(workflowId, () -> activeVersion(workflowId));
    }

    public List<WorkflowVersion> getVersionHistory(String workflowId) {
        return getVersionHistory(workflowId, HistoryQuery.DEFAULTS);
    }

    /** Versions newest first, filtered and paged by the query. */
    public List<WorkflowVersion> getVersionHistory(String workflowId, HistoryQuery query) {
        HistoryQuery q = query == null ? HistoryQuery.DEFAULTS : query;
        return read(workflowId, () -> repository.findByWorkflowId(workflowId).stream()
                .sorted(Comparator.comparingInt(WorkflowVersion::version).reversed())
                .filter(v -> q.includeArchived() || v.status() != VersionStatus.ARCHIVED)
                .skip(q.offset())
                .limit(q.limit())
                .toList());
    }

    public VersionStats getVersionStats(String workflowId) {
        return read(workflowId, () -> {
            List<WorkflowVersion> versions = repository.findByWorkflowId(workflowId);
            if (versions.isEmpty()) {
                return new VersionStats(0, null, null, null, 0, 0, 0.0);
            }
            WorkflowVersion oldest = versions.get(0);
            WorkflowVersion newest = versions.get(versions.size() - 1);
            Integer active = versions.stream().filter(WorkflowVersion::isActive)
                    .map(WorkflowVersion::version).findFirst().orElse(null);
            int archived = (int) versions.stream().filter(v -> v.status() == VersionStatus.ARCHIVED).count();
            int drafts = (int) versions.stream().filter(v -> v.status() == VersionStatus.DRAFT).count();
            double averageHours = 0.0;
            if (versions.size() > 1 && oldest.metadata() != null && newest.metadata() != null
                    && oldest.metadata().createdAt() != null && newest.metadata().createdAt() != null) {
                Duration span = Duration.between(oldest.metadata().createdAt(), newest.metadata().createdAt());
                averageHours = span.toMillis() / 3_600_000.0 / (versions.size() - 1);
            }
            return new VersionStats(versions.size(), active, oldest.version(), newest.version(), archived, drafts,
                    averageHours);
        });
    }

    // Caller holds the workflow's write lock.
    private WorkflowVersion append(String workflowId, List<WorkflowNode> nodes, List<WorkflowEdge> edges,
                                   VersionInfo info, VersionChecksums sums) {
        List<WorkflowVersion> existing = repository.findByWorkflowId(workflowId);
        int storedMax = existing.stream().mapToInt(WorkflowVersion::version).max().orElse(0);
        int number = Math.max(storedMax, repository.highestVersionNumber(workflowId)) + 1;

        String parentId = info.parentVersionId() != null
                ? info.parentVersionId()
                : latest(existing).map(WorkflowVersion::id).orElse(null);
        VersionMetadata metadata = VersionMetadata.builder()
                .createdBy(info.createdBy() != null && !info.createdBy().isBlank() ? info.createdBy() : DEFAULT_CREATOR)
                .createdAt(clock.instant())
                .description(info.description())
                .generationPrompt(info.generationPrompt())
                .parentVersionId(parentId)
                .tags(info.tags())
                .build();
        VersionStatus status = existing.isEmpty() ? VersionStatus.ACTIVE : VersionStatus.DRAFT;
        String name = info.name() != null && !info.name().isBlank() ? info.name() : "Version " + number;

        WorkflowVersion version = new WorkflowVersion(idGenerator.get(), workflowId, number, name, nodes, edges,
                metadata, status, sums);
        repository.save(version);
        log.info("Created version workflowId={} version={} status={} nodes={} edges={}",
                workflowId, number, status, nodes.size(), edges.size());
        applyRetention(workflowId);
        return version;
    }

    private void applyRetention(String workflowId) {
        List<WorkflowVersion> versions = repository.findByWorkflowId(workflowId);
        if (versions.size() <= retention.maxVersions()) {
            return;
        }
        List<WorkflowVersion> stale = versions.stream()
                .filter(v -> !v.isActive())
                .sorted(Comparator.comparingInt(WorkflowVersion::version).reversed())
                .skip(retention.retainRecent())
                .filter(v -> v.status() != VersionStatus.ARCHIVED)
                .toList();
        stale.forEach(v -> repository.save(v.withStatus(VersionStatus.ARCHIVED)));
        if (!stale.isEmpty()) {
            log.info("Retention archived {} versions workflowId={}", stale.size(), workflowId);
        }
    }

    private Optional<WorkflowVersion> activeVersion(String workflowId) {
        return repository.findByWorkflowId(workflowId).stream().filter(WorkflowVersion::isActive).findFirst();
    }

    private WorkflowVersion requireVersion(String workflowId, String versionId) {
        return repository.findById(versionId)
                .filter(v -> v.workflowId().equals(workflowId))
                .orElseThrow(() -> new VersionNotFoundException(workflowId, versionId));
    }

    private static Optional<WorkflowVersion> latest(List<WorkflowVersion> versions) {
        return versions.stream().max(Comparator.comparingInt(WorkflowVersion::version));
    }

    private <T> T read(String workflowId, Supplier<T> reader) {
        requireId(workflowId, "workflowId");
        Lock lock = lockFor(workflowId).readLock();
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantReadWriteLock lockFor(String workflowId) {
        return locks.computeIfAbsent(workflowId, id -> new ReentrantReadWriteLock());
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
