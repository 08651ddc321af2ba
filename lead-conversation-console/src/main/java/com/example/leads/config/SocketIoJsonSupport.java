package com.example.leads.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Aligns the Socket.IO codec with the REST one, so snapshots and countdown ticks carry ISO
 * instants and durations.
 */
public class SocketIoJsonSupport extends JacksonJsonSupport {

    public SocketIoJsonSupport(ObjectMapper baseMapper) {
        super(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.setTimeZone(baseMapper.getSerializationConfig().getTimeZone());
    }
}
