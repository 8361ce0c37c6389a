package com.datcoord.contributor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.core.LogicalClock;
import com.datcoord.governance.AuthorityPolicy;

public class ContributorLedger {
    private static final Logger log = LoggerFactory.getLogger(ContributorLedger.class);

    static final Comparator<Contributor> LEADERBOARD_ORDER = Comparator
            .comparingLong(Contributor::reputation).reversed()
            .thenComparingLong(Contributor::registeredAt)
            .thenComparing(Contributor::identity);

    private final Map<Identity, Contributor> contributors = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final LogicalClock clock;
    private final AuthorityPolicy policy;

    public ContributorLedger(LogicalClock clock, AuthorityPolicy policy) {
        this.clock = clock;
        this.policy = policy;
    }

    public Contributor register(Identity identity) {
        if (identity == null) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "identity is required");
        }
        lock.lock();
        try {
            Contributor existing = contributors.get(identity);
            if (existing != null) {
                return existing;
            }
            return commit(Contributor.registered(identity, clock.tick()));
        } finally {
            lock.unlock();
        }
    }

    public Contributor recordContribution(Identity admin, Identity identity, long rewardAmount) {
        requireAdmin(admin, "credit contributions");
        requireNonNegative(rewardAmount);
        lock.lock();
        try {
            Contributor current = contributors.get(identity);
            if (current == null) {
                throw new CoordinationException(ErrorCode.UNKNOWN_CONTRIBUTOR, "not registered: " + identity);
            }
            Contributor updated = commit(checked(identity, () -> current.credited(rewardAmount, clock.tick())));
            log.info("contributor.credited admin={} identity={} reward={} reputation={}",
                    admin, identity, rewardAmount, updated.reputation());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public List<Contributor> recordContributions(Collection<Identity> identities, long rewardAmount) {
        return recordContributions(identities, rewardAmount, credited -> { });
    }

    /**
     * Credits each distinct identity once, registering unknown ones. Nothing is stored unless every
     * credit is valid and {@code beforeCommit} returns normally.
     */
    public List<Contributor> recordContributions(Collection<Identity> identities, long rewardAmount,
            Consumer<List<Contributor>> beforeCommit) {
        requireNonNegative(rewardAmount);
        lock.lock();
        try {
            List<Contributor> credited = new ArrayList<>();
            for (Identity identity : new LinkedHashSet<>(identities)) {
                Contributor current = currentOrNew(identity);
                credited.add(checked(identity, () -> current.credited(rewardAmount, clock.tick())));
            }
            List<Contributor> updates = List.copyOf(credited);
            beforeCommit.accept(updates);
            updates.forEach(this::commit);
            return updates;
        } finally {
            lock.unlock();
        }
    }

    public Contributor awardReputation(Identity admin, Identity identity, long amount) {
        return awardReputation(admin, identity, amount, awarded -> { });
    }

    public Contributor awardReputation(Identity admin, Identity identity, long amount,
            Consumer<Contributor> beforeCommit) {
        requireAdmin(admin, "award reputation");
        if (identity == null) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "identity is required");
        }
        requireNonNegative(amount);
        lock.lock();
        try {
            Contributor current = currentOrNew(identity);
            Contributor updated = checked(identity, () -> current.awarded(amount));
            beforeCommit.accept(updated);
            commit(updated);
            log.info("contributor.awarded admin={} identity={} amount={} reputation={}",
                    admin, identity, amount, updated.reputation());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Contributor> lookup(Identity identity) {
        lock.lock();
        try {
            return Optional.ofNullable(contributors.get(identity));
        } finally {
            lock.unlock();
        }
    }

    public List<Contributor> leaderboard() {
        lock.lock();
        try {
            List<Contributor> ranked = new ArrayList<>(contributors.values());
            ranked.sort(LEADERBOARD_ORDER);
            return List.copyOf(ranked);
        } finally {
            lock.unlock();
        }
    }

    public List<Contributor> leaderboard(int limit) {
        if (limit <= 0) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "limit must be positive");
        }
        List<Contributor> ranked = leaderboard();
        return ranked.size() <= limit ? ranked : ranked.subList(0, limit);
    }

    public void restore(Collection<Contributor> persisted) {
        lock.lock();
        try {
            if (!contributors.isEmpty()) {
                throw new IllegalStateException("restore requires an empty ledger");
            }
            for (Contributor contributor : persisted) {
                contributors.put(contributor.identity(), contributor);
                clock.advanceTo(Math.max(contributor.registeredAt(), contributor.lastContributionAt()));
            }
        } finally {
            lock.unlock();
        }
    }

    private Contributor currentOrNew(Identity identity) {
        Contributor existing = contributors.get(identity);
        return existing != null ? existing : Contributor.registered(identity, clock.tick());
    }

    private Contributor commit(Contributor updated) {
        if (contributors.put(updated.identity(), updated) == null) {
            log.info("contributor.registered identity={}", updated.identity());
        }
        return updated;
    }

    private void requireAdmin(Identity admin, String action) {
        if (!policy.isAdmin(admin)) {
            throw new CoordinationException(ErrorCode.NOT_AUTHORIZED, admin + " may not " + action);
        }
    }

    private static Contributor checked(Identity identity, Supplier<Contributor> update) {
        try {
            return update.get();
        } catch (ArithmeticException e) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "reputation of " + identity + " would overflow");
        }
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new CoordinationException(ErrorCode.INVALID_ARGUMENT, "amount must be >= 0, got " + amount);
        }
    }
}
