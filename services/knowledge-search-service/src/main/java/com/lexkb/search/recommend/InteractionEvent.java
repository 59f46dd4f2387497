package com.lexkb.search.recommend;

import java.time.Instant;

public record InteractionEvent(String userId, String docId, InteractionType type, Instant occurredAt) {}
