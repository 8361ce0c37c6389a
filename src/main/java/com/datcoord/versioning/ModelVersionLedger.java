package com.datcoord.versioning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.core.LineageLocks;
import com.datcoord.core.LogicalClock;
import com.datcoord.governance.AuthorityPolicy;
import com.datcoord.store.ContentId;

public class ModelVersionLedger {
    private static final Logger log = LoggerFactory.getLogger(ModelVersionLedger.class);

    private final Map<Long, ModelVersion> versions = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> lineages = new ConcurrentHashMap<>();
    private final LineageLocks locks;
    private final LogicalClock clock;
    private final Object allocation = new Object();
    private long lastVersion;

    public ModelVersionLedger(LineageLocks locks, LogicalClock clock) {
        this.locks = locks;
        this.clock = clock;
    }

    public LineageLocks locks() {
        return locks;
    }

    public ModelVersion createModel(String lineage, ContentId weightsRef, Identity owner) {
        String name = requireLineage(lineage);
        return locks.withWriteLock(name, () -> {
            if (lineages.containsKey(name)) {
                throw new CoordinationException(ErrorCode.LINEAGE_EXISTS, "lineage already has versions: " + name);
            }
            ModelVersion created = append(name, weightsRef, owner);
            log.info("model.created lineage={} version={} owner={} weightsRef={}",
                    name, created.version(), owner, weightsRef);
            return created;
        });
    }

    public ModelVersion advanceVersion(String lineage, Identity caller, AuthorityPolicy policy) {
        String name = requireLineage(lineage);
        return locks.withWriteLock(name, () -> {
            ModelVersion frontier = latest(name)
                    .orElseThrow(() -> new CoordinationException(ErrorCode.MODEL_NOT_FOUND, "unknown lineage: " + name));
            if (!policy.mayFinalize(frontier, caller)) {
                throw new CoordinationException(ErrorCode.NOT_AUTHORIZED,
                        caller + " may not advance lineage " + name);
            }
            if (!frontier.finalized()) {
                throw new CoordinationException(ErrorCode.VERSION_NOT_FINALIZED,
                        "version " + frontier.version() + " of " + name + " is still open");
            }
            ModelVersion next = append(name, frontier.weightsRef(), frontier.owner());
            log.info("model.advanced lineage={} from={} to={} weightsRef={}",
                    name, frontier.version(), next.version(), next.weightsRef());
            return next;
        });
    }

    public Optional<ModelVersion> find(long version) {
        return Optional.ofNullable(versions.get(version));
    }

    public ModelVersion require(long version, ErrorCode missing) {
        ModelVersion found = versions.get(version);
        if (found == null) {
            throw new CoordinationException(missing, "unknown model version " + version);
        }
        return found;
    }

    public Optional<ModelVersion> latest(String lineage) {
        List<Long> numbers = lineages.get(lineage);
        if (numbers == null || numbers.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.get(numbers.get(numbers.size() - 1)));
    }

    public List<ModelVersion> list(String lineage) {
        List<Long> numbers = lineages.getOrDefault(lineage, List.of());
        List<ModelVersion> result = new ArrayList<>(numbers.size());
        for (Long number : numbers) {
            result.add(versions.get(number));
        }
        return List.copyOf(result);
    }

    public List<ModelVersion> all() {
        List<ModelVersion> result = new ArrayList<>(versions.values());
        result.sort(Comparator.comparingLong(ModelVersion::version));
        return List.copyOf(result);
    }

    public List<String> lineageNames() {
        List<String> names = new ArrayList<>(lineages.keySet());
        names.sort(null);
        return names;
    }

    public ModelVersion recordGradient(long version) {
        ModelVersion updated = versions.computeIfPresent(version,
                (key, current) -> current.withGradientCount(current.gradientCount() + 1));
        if (updated == null) {
            throw new CoordinationException(ErrorCode.UNKNOWN_MODEL_VERSION, "unknown model version " + version);
        }
        return updated;
    }

    /**
     * Replaces the weights of {@code version} and marks it finalized. Must run under the lineage
     * write lock.
     */
    public ModelVersion markFinalized(long version, ContentId newWeightsRef) {
        ModelVersion current = require(version, ErrorCode.MODEL_NOT_FOUND);
        if (!locks.forLineage(current.lineage()).isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("finalize of version " + version + " without the lineage write lock");
        }
        if (current.finalized()) {
            throw new CoordinationException(ErrorCode.ALREADY_FINALIZED, "version " + version + " is already finalized");
        }
        ModelVersion updated = current.finalizedWith(newWeightsRef, clock.tick());
        versions.put(version, updated);
        return updated;
    }

    public void restore(Collection<ModelVersion> persisted) {
        synchronized (allocation) {
            if (!versions.isEmpty()) {
                throw new IllegalStateException("restore requires an empty ledger");
            }
            List<ModelVersion> ordered = new ArrayList<>(persisted);
            ordered.sort(Comparator.comparingLong(ModelVersion::version));
            for (ModelVersion version : ordered) {
                versions.put(version.version(), version);
                lineages.computeIfAbsent(version.lineage(), key -> new CopyOnWriteArrayList<>()).add(version.version());
                locks.forLineage(version.lineage());
                lastVersion = Math.max(lastVersion, version.version());
                clock.advanceTo(Math.max(version.updatedAt(), version.finalizedAt()));
            }
        }
    }

    private ModelVersion append(String lineage, ContentId weightsRef, Identity owner) {
        if (weightsRef == null || owner == null) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "weightsRef and owner are required");
        }
        synchronized (allocation) {
            long number = ++lastVersion;
            ModelVersion created = ModelVersion.open(number, lineage, weightsRef, owner, clock.tick());
            versions.put(number, created);
            lineages.computeIfAbsent(lineage, key -> new CopyOnWriteArrayList<>()).add(number);
            return created;
        }
    }

    private static String requireLineage(String lineage) {
        if (lineage == null || lineage.isBlank()) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "lineage must not be blank");
        }
        return lineage.strip();
    }
}
