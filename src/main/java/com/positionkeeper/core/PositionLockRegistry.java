package com.positionkeeper.core;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory, non-blocking ownership of positions.
 *
 * <p>Whoever mutates a position (fill processing, expiry force close, operator actions)
 * holds its key for the duration of the mutation. A second caller does not wait: the
 * reconciliation loop and the expiry sweep skip the position until their next tick,
 * operator calls are rejected and can be retried.
 */
@Component
public class PositionLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(PositionLockRegistry.class);

    private final Set<String> lockedPositions = ConcurrentHashMap.newKeySet();

    public boolean tryLock(String positionId) {
        return lockedPositions.add(positionId);
    }

    public void unlock(String positionId) {
        lockedPositions.remove(positionId);
    }

    public boolean isLocked(String positionId) {
        return lockedPositions.contains(positionId);
    }

    /**
     * Runs {@code action} while holding the position. Returns empty without running it
     * when another caller holds the position.
     */
    public <T> Optional<T> withLock(String positionId, Supplier<T> action) {
        if (!tryLock(positionId)) {
            log.debug("Position {} is locked by another mutation, skipping", positionId);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            unlock(positionId);
        }
    }
}
