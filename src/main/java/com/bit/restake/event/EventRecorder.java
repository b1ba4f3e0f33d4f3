package com.bit.restake.event;

import com.bit.restake.config.RestakeConfig;
import com.bit.restake.structure.event.RestakeEvent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 事件记录：写日志，并在有界缓存中保留最近的事件供查询
 */
@Slf4j
@Component
public class EventRecorder {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 最近事件缓存：序号 -> 事件，超过容量按淘汰策略移除
     */
    private final Cache<Long, RestakeEvent> recentEvents;

    public EventRecorder(Clock clock, RestakeConfig config) {
        this.clock = clock;
        this.recentEvents = Caffeine.newBuilder()
                .maximumSize(config.getEventCacheSize())
                .recordStats()
                .build();
    }

    public RestakeEvent record(RestakeEvent event) {
        event.setSequence(sequence.incrementAndGet());
        event.setTimestamp(clock.instant().getEpochSecond());
        recentEvents.put(event.getSequence(), event);
        log.info("event#{} {} account={} asset={} amount={} shares={} requestId={}",
                event.getSequence(), event.getType(), event.getAccount(), event.getAsset(),
                event.getAmount(), event.getShares(), event.getRequestId());
        return event;
    }

    /**
     * 最近的事件，按序号倒序
     */
    public List<RestakeEvent> recent(int limit) {
        List<RestakeEvent> events = new ArrayList<>(recentEvents.asMap().values());
        events.sort(Comparator.comparingLong(RestakeEvent::getSequence).reversed());
        return events.size() > limit ? new ArrayList<>(events.subList(0, limit)) : events;
    }

    public long count() {
        return sequence.get();
    }
}
