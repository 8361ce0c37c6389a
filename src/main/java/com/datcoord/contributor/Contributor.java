package com.datcoord.contributor;

import com.datcoord.core.Identity;

public record Contributor(
        Identity identity,
        long reputation,
        long contributions,
        long lastContributionAt,
        long registeredAt) {

    static Contributor registered(Identity identity, long registeredAt) {
        return new Contributor(identity, 0L, 0L, 0L, registeredAt);
    }

    Contributor credited(long reward, long timestamp) {
        return new Contributor(identity, Math.addExact(reputation, reward), Math.addExact(contributions, 1L),
                timestamp, registeredAt);
    }

    Contributor awarded(long amount) {
        return new Contributor(identity, Math.addExact(reputation, amount), contributions, lastContributionAt,
                registeredAt);
    }
}
