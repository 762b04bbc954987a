package com.relaygate.service.metrics;

import com.relaygate.model.CallEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size ring of the latest call events, oldest first.
 */
class RecentCalls {

    private final int capacity;
    private final ArrayDeque<CallEvent> events;

    RecentCalls(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.events = new ArrayDeque<>(this.capacity);
    }

    synchronized void add(CallEvent event) {
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    /**
     * Last {@code limit} events, newest last.
     */
    synchronized List<CallEvent> latest(int limit) {
        int skip = Math.max(0, events.size() - Math.max(0, limit));
        List<CallEvent> result = new ArrayList<>(events.size() - skip);
        int i = 0;
        for (CallEvent event : events) {
            if (i++ >= skip) {
                result.add(event);
            }
        }
        return result;
    }

    synchronized void clear() {
        events.clear();
    }

    int capacity() {
        return capacity;
    }
}
