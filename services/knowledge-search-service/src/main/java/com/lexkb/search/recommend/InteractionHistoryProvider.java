package com.lexkb.search.recommend;

import java.time.Instant;
import java.util.List;

public interface InteractionHistoryProvider {

    List<InteractionEvent> recentInteractions(String userId, Instant since);
}
