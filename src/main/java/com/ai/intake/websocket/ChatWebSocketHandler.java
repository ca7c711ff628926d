package com.ai.intake.websocket;

import com.ai.intake.dto.IntakeReply;
import com.ai.intake.exception.UnknownConversationException;
import com.ai.intake.service.IntakeDialogueEngine;
import com.ai.intake.service.ReplyRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat front end at {@code /ws/chat/{conversationId}}. Inbound frames are
 * {@code {"message": "..."}}; every reply is {@code {type, message, timestamp, state}}.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    static final String CONVERSATION_ID = "conversationId";
    static final String FINISHED = "finished";
    static final String DISCONNECT_REASON = "patient disconnected";

    private final IntakeDialogueEngine engine;
    private final ReplyRenderer renderer;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ChatWebSocketHandler(IntakeDialogueEngine engine, ReplyRenderer renderer, ObjectMapper mapper, Clock clock) {
        this.engine = engine;
        this.renderer = renderer;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String conversationId = conversationId(session.getUri());
        if (StringUtils.isBlank(conversationId)) {
            log.warn("Chat connection without conversation id | session={}", session.getId());
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        session.getAttributes().put(CONVERSATION_ID, conversationId);
        log.info("[{}] Chat connected | session={}", conversationId, session.getId());
        send(session, renderer.render(conversationId, engine.openConversation(conversationId)));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String conversationId = (String) session.getAttributes().get(CONVERSATION_ID);
        if (conversationId == null) return;

        String text = patientText(message.getPayload());
        if (StringUtils.isBlank(text)) return;
        log.info("[{}] Patient: {}", conversationId, text);

        IntakeReply reply = renderer.render(conversationId, engine.processMessage(conversationId, text));
        send(session, reply);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String conversationId = (String) session.getAttributes().get(CONVERSATION_ID);
        if (conversationId == null || Boolean.TRUE.equals(session.getAttributes().get(FINISHED))) return;
        log.info("[{}] Chat closed before intake finished ({})", conversationId, status);
        try {
            engine.cancel(conversationId, DISCONNECT_REASON);
        } catch (UnknownConversationException e) {
            log.info("[{}] Nothing to cancel, intake already released", conversationId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Chat transport error | session={}", session.getId(), exception);
    }

    private String patientText(String payload) {
        try {
            JsonNode root = mapper.readTree(payload);
            return root.isObject() ? root.path("message").asText("") : root.asText("");
        } catch (JsonProcessingException e) {
            // plain-text frames are accepted as the message itself
            return payload;
        }
    }

    private void send(WebSocketSession session, IntakeReply reply) throws IOException {
        if (reply.isTerminal()) {
            session.getAttributes().put(FINISHED, Boolean.TRUE);
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "ai");
        frame.put("message", reply.message());
        frame.put("timestamp", clock.instant().toString());
        frame.put("state", reply.type());
        synchronized (session) {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(frame)));
        }
        log.info("[{}] Assistant: {}", reply.conversationId(), reply.message());
    }

    static String conversationId(URI uri) {
        if (uri == null) return null;
        String path = StringUtils.removeEnd(uri.getPath(), "/");
        return StringUtils.trimToNull(StringUtils.substringAfterLast(path, "/"));
    }
}
