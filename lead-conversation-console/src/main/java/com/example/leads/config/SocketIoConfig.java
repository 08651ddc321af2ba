package com.example.leads.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@Slf4j
@org.springframework.context.annotation.Configuration
@ConditionalOnProperty(prefix = "leads.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SocketIOServer socketIOServer(LeadConsoleProperties properties, ObjectMapper objectMapper) {
        LeadConsoleProperties.SocketIo socket = properties.getSocketio();
        log.info("Lead view socket listening on {}:{}", socket.getHost(), socket.getPort());
        return new SocketIOServer(leadViewConfiguration(socket, objectMapper));
    }

    static Configuration leadViewConfiguration(LeadConsoleProperties.SocketIo socket, ObjectMapper objectMapper) {
        Configuration configuration = new Configuration();
        configuration.setHostname(socket.getHost());
        configuration.setPort(socket.getPort());
        configuration.setOrigin(socket.getOrigin());
        configuration.setPingInterval(Math.toIntExact(socket.getPingInterval().toMillis()));
        configuration.setPingTimeout(Math.toIntExact(socket.getPingTimeout().toMillis()));
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SocketIoJsonSupport(objectMapper));
        return configuration;
    }
}
