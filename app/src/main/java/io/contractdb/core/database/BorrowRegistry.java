package io.contractdb.core.database;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks open handles per map name: any number of shared borrows or exactly one
 * exclusive borrow. Single-threaded bookkeeping, no locking.
 */
final class BorrowRegistry {

    private final Map<String, Integer> readers = new HashMap<>();
    private final Set<String> writers = new HashSet<>();
    private final List<Borrow> open = new ArrayList<>();

    Borrow acquireShared(String mapName) {
        if (writers.contains(mapName)) {
            throw new IllegalStateException("Map '" + mapName + "' is mutably borrowed");
        }
        readers.merge(mapName, 1, Integer::sum);
        return track(new Borrow(mapName, false));
    }

    Borrow acquireExclusive(String mapName) {
        if (writers.contains(mapName)) {
            throw new IllegalStateException("Map '" + mapName + "' is already mutably borrowed");
        }
        if (readers.containsKey(mapName)) {
            throw new IllegalStateException("Map '" + mapName + "' has " + readers.get(mapName) + " open read handle(s)");
        }
        writers.add(mapName);
        return track(new Borrow(mapName, true));
    }

    /** Fails if any handle on {@code mapName} is still open. */
    void ensureNotBorrowed(String mapName) {
        if (writers.contains(mapName) || readers.containsKey(mapName)) {
            throw new IllegalStateException("Map '" + mapName + "' cannot be replaced while borrowed");
        }
    }

    private Borrow track(Borrow borrow) {
        open.add(borrow);
        return borrow;
    }

    /** Release every open borrow; their handles become unusable. */
    int releaseAll() {
        List<Borrow> outstanding = new ArrayList<>(open);
        for (Borrow b : outstanding) {
            b.release();
        }
        return outstanding.size();
    }

    boolean isBorrowed(String mapName) {
        return writers.contains(mapName) || readers.containsKey(mapName);
    }

    /** One open borrow; releasing twice is a no-op. */
    final class Borrow {
        private final String mapName;
        private final boolean exclusive;
        private boolean released;

        private Borrow(String mapName, boolean exclusive) {
            this.mapName = mapName;
            this.exclusive = exclusive;
        }

        String mapName() {
            return mapName;
        }

        boolean isReleased() {
            return released;
        }

        void release() {
            if (released) return;
            released = true;
            open.remove(this);
            if (exclusive) {
                writers.remove(mapName);
            } else {
                readers.computeIfPresent(mapName, (k, n) -> n <= 1 ? null : n - 1);
            }
        }
    }
}
