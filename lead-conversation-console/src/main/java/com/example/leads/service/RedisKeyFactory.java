package com.example.leads.service;

import com.example.leads.config.LeadConsoleProperties;
import com.example.leads.store.RecordTable;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final LeadConsoleProperties properties;

    public RedisKeyFactory(LeadConsoleProperties properties) {
        this.properties = properties;
    }

    private String prefix() {
        return properties.getRedis().getKeyPrefix();
    }

    public String changeTopicName(RecordTable table, String organizationId) {
        return "%s:changes:%s:%s".formatted(prefix(), table.name().toLowerCase(Locale.ROOT), organizationId);
    }

    public String sessionLockKey(String sessionId) {
        return "%s:session:%s:lock".formatted(prefix(), sessionId);
    }
}
