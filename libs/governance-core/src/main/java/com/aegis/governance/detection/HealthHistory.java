package com.aegis.governance.detection;

import com.aegis.governance.model.HealthCheck;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded rolling history of health checks for one dependency. Once full, the oldest check is
 * evicted for every new one.
 */
final class HealthHistory {

    private final int capacity;
    private final Deque<HealthCheck> checks;

    HealthHistory(int capacity) {
        this.capacity = capacity;
        this.checks = new ArrayDeque<>(capacity);
    }

    synchronized void append(HealthCheck check) {
        if (checks.size() == capacity) {
            checks.removeFirst();
        }
        checks.addLast(check);
    }

    synchronized List<HealthCheck> snapshot() {
        return List.copyOf(checks);
    }

    /** Number of passing checks at the tail of the history. */
    synchronized int consecutivePasses() {
        int passes = 0;
        var it = checks.descendingIterator();
        while (it.hasNext() && it.next().isPassing()) {
            passes++;
        }
        return passes;
    }
}
