package com.example.leads.service;

import com.example.leads.store.ChangeEvent;
import com.example.leads.store.ChangeFeed;
import com.example.leads.store.ChangeListener;
import com.example.leads.store.RecordTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.BaseStatusListener;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisChangeFeedBroker {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final ObjectMapper objectMapper;

    private TypedJsonJacksonCodec eventCodec;

    public void publishAfterCommit(ChangeEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(event);
                }
            });
            return;
        }
        publish(event);
    }

    public void publish(ChangeEvent event) {
        if (event.getOrganizationId() == null || !event.getTable().isOrganizationScoped()) {
            return;
        }
        try {
            topic(event.getTable(), event.getOrganizationId()).publish(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} change on {} for organization {}",
                    event.getType(), event.getTable(), event.getOrganizationId(), ex);
        }
    }

    public ChangeFeed subscribe(RecordTable table, String organizationId, ChangeListener listener) {
        RTopic topic = topic(table, organizationId);
        TopicFeed feed = new TopicFeed(table, organizationId, topic);
        int messageListenerId = topic.addListener(ChangeEvent.class, (channel, event) -> {
            if (feed.isActive()) {
                listener.onChange(event);
            }
        });
        int statusListenerId = topic.addListener(new BaseStatusListener() {
            @Override
            public void onUnsubscribe(String channel) {
                if (feed.markLost()) {
                    log.warn("Change feed {} for organization {} was unsubscribed", table, organizationId);
                    listener.onFeedLost(table, organizationId);
                }
            }
        });
        feed.bind(messageListenerId, statusListenerId);
        log.debug("Subscribed to {} changes of organization {}", table, organizationId);
        return feed;
    }

    private RTopic topic(RecordTable table, String organizationId) {
        return redissonClient.getTopic(keyFactory.changeTopicName(table, organizationId), eventCodec());
    }

    private TypedJsonJacksonCodec eventCodec() {
        if (eventCodec == null) {
            eventCodec = new TypedJsonJacksonCodec(ChangeEvent.class, objectMapper);
        }
        return eventCodec;
    }

    static final class TopicFeed implements ChangeFeed {

        private final RecordTable table;
        private final String organizationId;
        private final RTopic topic;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile Integer[] listenerIds = new Integer[0];

        TopicFeed(RecordTable table, String organizationId, RTopic topic) {
            this.table = table;
            this.organizationId = organizationId;
            this.topic = topic;
        }

        void bind(int messageListenerId, int statusListenerId) {
            listenerIds = new Integer[] {messageListenerId, statusListenerId};
        }

        boolean markLost() {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            topic.removeListenerAsync(listenerIds);
            return true;
        }

        @Override
        public RecordTable table() {
            return table;
        }

        @Override
        public String organizationId() {
            return organizationId;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                topic.removeListener(listenerIds);
            }
        }
    }
}
