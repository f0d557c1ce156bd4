package io.agentmesh.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable unit of communication between agents.
 *
 * <p>{@code receiverId} is null for broadcasts. {@code correlationId} is set on replies and
 * equals the id of the request being answered. {@code timeoutMs} is optional; the bus
 * resolves a deadline when it is null.
 */
public record Message(
        String id,
        MessageType type,
        String senderId,
        String receiverId,
        String content,
        Map<String, Object> context,
        String correlationId,
        long createdAtMs,
        Long timeoutMs,
        int attempt
) {
    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("message id cannot be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("message type cannot be null: " + id);
        }
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        attempt = Math.max(1, attempt);
    }

    public static Message request(String senderId, String receiverId, String content, Map<String, Object> context) {
        return new Message(
                newId(),
                MessageType.REQUEST,
                senderId,
                receiverId,
                content,
                context,
                null,
                Instant.now().toEpochMilli(),
                null,
                1
        );
    }

    public static Message notification(String senderId, String content, Map<String, Object> context) {
        return new Message(
                newId(),
                MessageType.NOTIFICATION,
                senderId,
                null,
                content,
                context,
                null,
                Instant.now().toEpochMilli(),
                null,
                1
        );
    }

    public Message reply(MessageType replyType, String replyContent, Map<String, Object> replyContext) {
        return new Message(
                newId(),
                replyType,
                receiverId,
                senderId,
                replyContent,
                replyContext,
                id,
                Instant.now().toEpochMilli(),
                null,
                attempt
        );
    }

    public Message withTimeoutMs(long newTimeoutMs) {
        return new Message(id, type, senderId, receiverId, content, context, correlationId, createdAtMs, newTimeoutMs, attempt);
    }

    public Message withReceiver(String newReceiverId) {
        return new Message(id, type, senderId, newReceiverId, content, context, correlationId, createdAtMs, timeoutMs, attempt);
    }

    /**
     * Copy for a redelivery: same payload, fresh id so a late reply to the previous attempt
     * cannot satisfy the new one.
     */
    public Message nextAttempt(long newTimeoutMs) {
        return new Message(
                newId(),
                type,
                senderId,
                receiverId,
                content,
                context,
                correlationId,
                Instant.now().toEpochMilli(),
                newTimeoutMs,
                attempt + 1
        );
    }

    public boolean broadcast() {
        return receiverId == null;
    }

    private static String newId() {
        return "msg_" + UUID.randomUUID();
    }
}
