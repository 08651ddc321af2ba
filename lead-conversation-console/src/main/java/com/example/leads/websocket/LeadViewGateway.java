package com.example.leads.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.leads.domain.LeadFilters;
import com.example.leads.dto.LeadScopePayload;
import com.example.leads.dto.SelectLeadPayload;
import com.example.leads.dto.SessionActionPayload;
import com.example.leads.dto.SocketErrorPayload;
import com.example.leads.service.CountdownTick;
import com.example.leads.service.DeletionResult;
import com.example.leads.service.LeadViewSnapshot;
import com.example.leads.service.MergeSession;
import com.example.leads.service.MergeSessionListener;
import com.example.leads.service.MergeSessionRegistry;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Binds each connected console to one {@link MergeSession}. Snapshots, countdown ticks and errors
 * are pushed to the owning client only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "leads.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LeadViewGateway {

    static final String SUBSCRIBE_EVENT = "leads:subscribe";
    static final String FILTERS_EVENT = "leads:filters";
    static final String SELECT_EVENT = "leads:select";
    static final String ESCALATE_EVENT = "leads:escalate";
    static final String RELEASE_EVENT = "leads:release";
    static final String PROLONG_EVENT = "leads:prolong";
    static final String DELETE_EVENT = "leads:delete";
    static final String SNAPSHOT_EVENT = "leads:snapshot";
    static final String COUNTDOWN_EVENT = "countdown:tick";
    static final String ERROR_EVENT = "system:error";

    private final SocketIOServer socketIOServer;
    private final MergeSessionRegistry registry;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(SUBSCRIBE_EVENT, LeadScopePayload.class, this::handleSubscribe);
        socketIOServer.addEventListener(FILTERS_EVENT, LeadFilters.class,
                (client, filters, ack) -> withSession(client, session -> session.updateFilters(filters)));
        socketIOServer.addEventListener(SELECT_EVENT, SelectLeadPayload.class,
                (client, payload, ack) -> withSession(client, session -> session.select(payload.getLeadId())));
        socketIOServer.addEventListener(ESCALATE_EVENT, SessionActionPayload.class,
                (client, payload, ack) -> withSession(client, session ->
                        acknowledge(ack, Map.of("ok", session.escalate(payload.getSessionId(), payload.getReason())))));
        socketIOServer.addEventListener(RELEASE_EVENT, SessionActionPayload.class,
                (client, payload, ack) -> withSession(client, session ->
                        acknowledge(ack, Map.of("ok", session.release(payload.getSessionId())))));
        socketIOServer.addEventListener(PROLONG_EVENT, SessionActionPayload.class,
                (client, payload, ack) -> withSession(client, session ->
                        acknowledge(ack, Map.of("ok", session.prolong(payload.getSessionId())))));
        socketIOServer.addEventListener(DELETE_EVENT, SelectLeadPayload.class, this::handleDelete);
    }

    private void handleSubscribe(SocketIOClient client, LeadScopePayload payload, AckRequest ackSender) {
        if (payload == null || !StringUtils.hasText(payload.getOrganizationId())) {
            sendError(client, new ServiceException(ErrorCode.BAD_REQUEST, "organizationId is required"));
            return;
        }
        try {
            registry.open(clientKey(client), payload.getOrganizationId(), payload.getFilters(), new ClientListener(client));
            log.info("Client {} subscribed to leads of organization {}", client.getSessionId(), payload.getOrganizationId());
        } catch (Exception ex) {
            log.error("Failed to open merge session for client {}", client.getSessionId(), ex);
            sendError(client, ex instanceof ServiceException se
                    ? se
                    : ServiceException.transientStore("Could not open lead view", ex));
        }
    }

    private void handleDelete(SocketIOClient client, SelectLeadPayload payload, AckRequest ackSender) {
        withSession(client, session -> {
            DeletionResult result = session.deleteLead(payload.getLeadId());
            acknowledge(ackSender, result);
        });
    }

    private void handleDisconnect(SocketIOClient client) {
        registry.close(clientKey(client));
        log.info("Client {} disconnected", client.getSessionId());
    }

    private void withSession(SocketIOClient client, Consumer<MergeSession> action) {
        MergeSession session = registry.find(clientKey(client)).orElse(null);
        if (session == null) {
            sendError(client, new ServiceException(ErrorCode.BAD_REQUEST, "Subscribe to an organization first"));
            return;
        }
        try {
            action.accept(session);
        } catch (ServiceException ex) {
            sendError(client, ex);
        } catch (Exception ex) {
            log.error("Failed to handle event for client {}", client.getSessionId(), ex);
            sendError(client, ServiceException.transientStore(ex.getMessage(), ex));
        }
    }

    private void acknowledge(AckRequest ackSender, Object data) {
        if (ackSender != null && ackSender.isAckRequested()) {
            ackSender.sendAckData(data);
        }
    }

    private static void sendError(SocketIOClient client, ServiceException ex) {
        client.sendEvent(ERROR_EVENT, SocketErrorPayload.builder()
                .code(ex.getErrorCode())
                .message(ex.getMessage())
                .build());
    }

    private static String clientKey(SocketIOClient client) {
        return client.getSessionId().toString();
    }

    @PreDestroy
    public void shutdown() {
        registry.closeAll();
        socketIOServer.removeAllListeners(SUBSCRIBE_EVENT);
        socketIOServer.removeAllListeners(FILTERS_EVENT);
        socketIOServer.removeAllListeners(SELECT_EVENT);
        socketIOServer.removeAllListeners(ESCALATE_EVENT);
        socketIOServer.removeAllListeners(RELEASE_EVENT);
        socketIOServer.removeAllListeners(PROLONG_EVENT);
        socketIOServer.removeAllListeners(DELETE_EVENT);
    }

    private static final class ClientListener implements MergeSessionListener {

        private final SocketIOClient client;

        private ClientListener(SocketIOClient client) {
            this.client = client;
        }

        @Override
        public void onSnapshot(LeadViewSnapshot snapshot) {
            client.sendEvent(SNAPSHOT_EVENT, snapshot);
        }

        @Override
        public void onCountdown(CountdownTick tick) {
            client.sendEvent(COUNTDOWN_EVENT, tick);
        }

        @Override
        public void onError(ServiceException error) {
            sendError(client, error);
        }
    }
}
