package com.lexkb.search.recommend;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryInteractionHistory implements InteractionHistoryProvider {
    private final int maxEventsPerUser;
    private final Map<String, Deque<InteractionEvent>> events = new ConcurrentHashMap<>();

    public InMemoryInteractionHistory(int maxEventsPerUser) {
        this.maxEventsPerUser = Math.max(1, maxEventsPerUser);
    }

    public void record(InteractionEvent event) {
        if (event == null || event.userId() == null || event.docId() == null || event.type() == null) {
            return;
        }
        Deque<InteractionEvent> userEvents = events.computeIfAbsent(event.userId(), key -> new ArrayDeque<>());
        synchronized (userEvents) {
            userEvents.addLast(event);
            while (userEvents.size() > maxEventsPerUser) {
                userEvents.removeFirst();
            }
        }
    }

    @Override
    public List<InteractionEvent> recentInteractions(String userId, Instant since) {
        Deque<InteractionEvent> userEvents = userId == null ? null : events.get(userId);
        if (userEvents == null) {
            return List.of();
        }
        List<InteractionEvent> recent = new ArrayList<>();
        synchronized (userEvents) {
            for (InteractionEvent event : userEvents) {
                if (since == null || !event.occurredAt().isBefore(since)) {
                    recent.add(event);
                }
            }
        }
        return recent;
    }

    public void clear(String userId) {
        events.remove(userId);
    }
}
