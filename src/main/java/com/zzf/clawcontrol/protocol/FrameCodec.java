package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Turns frames into JSON text and back. Stateless apart from the mapper.
 */
public class FrameCodec {
    private static final TypeReference<List<ThreadInfo>> THREAD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(OutboundFrame frame) throws ProtocolException {
        if (frame == null) {
            throw new ProtocolException("frame is null");
        }
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + frame.getType() + " frame", e);
        }
    }

    public InboundFrame decode(String text) throws ProtocolException {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("empty frame");
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ProtocolException("frame is not a JSON object");
        }
        ObjectNode frame = (ObjectNode) tree;
        String type = frame.path("type").asText("");
        switch (type) {
            case FrameTypes.RESPONSE:
                return toResponse(frame);
            case FrameTypes.THREAD_LIST:
                if (!frame.path("threads").isArray()) {
                    throw new ProtocolException("thread_list frame without threads array");
                }
                return convert(frame, ThreadListFrame.class);
            case FrameTypes.USER_MESSAGE:
                return convert(frame, UserMessageFrame.class);
            case FrameTypes.FILE_SYNC_PUSH:
                FileSyncPushFrame push = convert(frame, FileSyncPushFrame.class);
                if (push.getAction() == null || push.getPath() == null || push.getPath().isBlank()) {
                    throw new ProtocolException("file_sync_push frame requires action and path");
                }
                return push;
            case FrameTypes.FILE_SNAPSHOT_ACK:
                if (!frame.path("updates").isArray()) {
                    throw new ProtocolException("file_snapshot_ack frame without updates array");
                }
                return convert(frame, FileSnapshotAckFrame.class);
            default:
                throw new ProtocolException(type.isEmpty() ? "frame has no type" : "unrecognized frame type: " + type);
        }
    }

    public List<ThreadInfo> readThreads(JsonNode node) throws ProtocolException {
        if (node == null || !node.isArray()) {
            throw new ProtocolException("threads is not an array");
        }
        try {
            return mapper.convertValue(node, THREAD_LIST);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("invalid thread list", e);
        }
    }

    public ThreadInfo readThread(JsonNode node) throws ProtocolException {
        if (node == null || !node.isObject()) {
            throw new ProtocolException("thread is not an object");
        }
        try {
            return mapper.treeToValue(node, ThreadInfo.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("invalid thread", e);
        }
    }

    private ResponseFrame toResponse(ObjectNode frame) throws ProtocolException {
        String requestId = frame.path("requestId").asText("");
        if (requestId.isBlank()) {
            throw new ProtocolException("response frame without requestId");
        }
        JsonNode error = frame.get("error");
        String errorText = error == null || error.isNull() ? null : error.asText();
        return new ResponseFrame(requestId, frame.path("ok").asBoolean(false), errorText, frame);
    }

    private <T> T convert(ObjectNode frame, Class<T> type) throws ProtocolException {
        try {
            return mapper.treeToValue(frame, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("malformed " + frame.path("type").asText() + " frame", e);
        }
    }
}
