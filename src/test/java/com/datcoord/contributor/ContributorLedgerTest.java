package com.datcoord.contributor;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.datcoord.core.CoordinationException;
import com.datcoord.core.ErrorCode;
import com.datcoord.core.Identity;
import com.datcoord.core.LogicalClock;
import com.datcoord.governance.OwnerAuthorityPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContributorLedgerTest {

    private static final Identity ADMIN = new Identity("admin");
    private static final Identity ALICE = new Identity("0xalice");
    private static final Identity BOB = new Identity("0xbob");
    private static final Identity CAROL = new Identity("0xcarol");

    private final ContributorLedger ledger = new ContributorLedger(new LogicalClock(), new OwnerAuthorityPolicy(ADMIN));

    @Test
    void shouldRegisterIdempotently() {
        Contributor first = ledger.register(ALICE);
        Contributor second = ledger.register(ALICE);

        assertEquals(first, second);
        assertEquals(0, first.reputation());
        assertEquals(0, first.lastContributionAt());
    }

    @Test
    void shouldRequireRegistrationForSingleContribution() {
        CoordinationException error = assertThrows(CoordinationException.class,
                () -> ledger.recordContribution(ADMIN, BOB, 10));
        assertEquals(ErrorCode.UNKNOWN_CONTRIBUTOR, error.getCode());

        ledger.register(BOB);
        Contributor credited = ledger.recordContribution(ADMIN, BOB, 10);
        assertEquals(10, credited.reputation());
        assertEquals(1, credited.contributions());
        assertTrue(credited.lastContributionAt() > credited.registeredAt());
    }

    @Test
    void shouldRejectDirectCreditFromNonAdmin() {
        ledger.register(BOB);

        CoordinationException error = assertThrows(CoordinationException.class,
                () -> ledger.recordContribution(BOB, BOB, 1_000_000));

        assertEquals(ErrorCode.NOT_AUTHORIZED, error.getCode());
        assertEquals(0, ledger.lookup(BOB).orElseThrow().reputation());
        assertEquals(0, ledger.lookup(BOB).orElseThrow().contributions());
    }

    @Test
    void shouldRejectAwardThatWouldOverflowReputation() {
        ledger.awardReputation(ADMIN, BOB, Long.MAX_VALUE);

        CoordinationException error = assertThrows(CoordinationException.class,
                () -> ledger.awardReputation(ADMIN, BOB, 1));

        assertEquals(ErrorCode.INVALID_ARGUMENT, error.getCode());
        assertEquals(Long.MAX_VALUE, ledger.lookup(BOB).orElseThrow().reputation());
    }

    @Test
    void shouldApplyNoBatchCreditWhenOneWouldOverflow() {
        ledger.awardReputation(ADMIN, BOB, Long.MAX_VALUE - 2);

        CoordinationException error = assertThrows(CoordinationException.class,
                () -> ledger.recordContributions(List.of(ALICE, BOB), 5));

        assertEquals(ErrorCode.INVALID_ARGUMENT, error.getCode());
        assertTrue(ledger.lookup(ALICE).isEmpty());
        assertEquals(Long.MAX_VALUE - 2, ledger.lookup(BOB).orElseThrow().reputation());
        assertEquals(0, ledger.lookup(BOB).orElseThrow().contributions());
    }

    @Test
    void shouldLeaveLedgerUntouchedWhenCommitHookFails() {
        assertThrows(IllegalStateException.class, () -> ledger.recordContributions(List.of(ALICE), 5,
                credited -> {
                    throw new IllegalStateException("audit unavailable");
                }));
        assertThrows(IllegalStateException.class, () -> ledger.awardReputation(ADMIN, BOB, 5,
                awarded -> {
                    throw new IllegalStateException("audit unavailable");
                }));

        assertTrue(ledger.lookup(ALICE).isEmpty());
        assertTrue(ledger.lookup(BOB).isEmpty());
    }

    @Test
    void shouldCreditEachDistinctIdentityOnceInBatch() {
        List<Contributor> credited = ledger.recordContributions(List.of(ALICE, BOB, ALICE), 5);

        assertEquals(2, credited.size());
        assertEquals(5, ledger.lookup(ALICE).orElseThrow().reputation());
        assertEquals(1, ledger.lookup(ALICE).orElseThrow().contributions());
        assertEquals(1, ledger.lookup(BOB).orElseThrow().contributions());
    }

    @Test
    void shouldOnlyLetAdminAwardNonNegativeAmounts() {
        CoordinationException notAdmin = assertThrows(CoordinationException.class,
                () -> ledger.awardReputation(ALICE, BOB, 5));
        assertEquals(ErrorCode.NOT_AUTHORIZED, notAdmin.getCode());

        CoordinationException negative = assertThrows(CoordinationException.class,
                () -> ledger.awardReputation(ADMIN, BOB, -1));
        assertEquals(ErrorCode.INVALID_ARGUMENT, negative.getCode());

        Contributor awarded = ledger.awardReputation(ADMIN, BOB, 7);
        assertEquals(7, awarded.reputation());
        assertEquals(0, awarded.contributions());
    }

    @Test
    void shouldRankByReputationThenRegistration() {
        ledger.register(CAROL);
        ledger.register(ALICE);
        ledger.register(BOB);
        ledger.awardReputation(ADMIN, BOB, 20);
        ledger.awardReputation(ADMIN, ALICE, 5);
        ledger.awardReputation(ADMIN, CAROL, 5);

        List<Identity> ranked = ledger.leaderboard().stream().map(Contributor::identity).toList();
        assertEquals(List.of(BOB, CAROL, ALICE), ranked);

        assertEquals(List.of(BOB), ledger.leaderboard(1).stream().map(Contributor::identity).toList());
        assertEquals(3, ledger.leaderboard(50).size());
        assertThrows(CoordinationException.class, () -> ledger.leaderboard(0));
    }
}
