/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.frame;

import java.util.List;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.EncoderException;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import io.arasaka.truenas.internal.util.Json;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Converts between websocket text frames and {@link DdpMessage}s.
 *
 * <p>Frames arrive here already aggregated, so every text frame is one complete JSON object.
 * Frames that are not JSON objects are logged and dropped; they are never propagated up the
 * pipeline.</p>
 */
public class DdpFrameCodec extends MessageToMessageCodec<TextWebSocketFrame, DdpMessage> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DdpFrameCodec.class);

    @Override
    protected void encode(ChannelHandlerContext ctx, DdpMessage msg, List<Object> out) {
        try {
            out.add(new TextWebSocketFrame(Json.MAPPER.writeValueAsString(toJson(msg))));
        }
        catch (JsonProcessingException e) {
            throw new EncoderException("Unable to encode " + msg.kind() + " message", e);
        }
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, TextWebSocketFrame frame, List<Object> out) {
        String text = frame.text();
        DdpMessage message = decode(text);
        if (message != null) {
            out.add(message);
        }
    }

    /**
     * Decodes one frame's text.
     *
     * @return the message, or null if the text is not a JSON object
     */
    @Nullable
    public static DdpMessage decode(String text) {
        JsonNode node;
        try {
            node = Json.MAPPER.readTree(text);
        }
        catch (JsonProcessingException e) {
            LOGGER.warn("Dropping undecodable frame: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            LOGGER.warn("Dropping frame that is not a JSON object");
            return null;
        }
        return fromJson(node);
    }

    public static DdpMessage fromJson(JsonNode node) {
        String kind = node.path("msg").asText("");
        String id = textOrNull(node.get("id"));
        switch (kind) {
            case DdpMessage.CONNECTED:
                return new DdpMessage.Connected(textOrNull(node.get("session")));
            case DdpMessage.FAILED:
                return new DdpMessage.Failed(textOrNull(node.get("version")));
            case DdpMessage.RESULT:
                if (id != null) {
                    return new DdpMessage.MethodResult(id, node.get("result"));
                }
                break;
            case DdpMessage.ERROR:
                if (id != null) {
                    return new DdpMessage.MethodError(id, node.get("error"));
                }
                break;
            case DdpMessage.PING:
                return new DdpMessage.Ping(id);
            case DdpMessage.PONG:
                return new DdpMessage.Pong(id);
            case DdpMessage.CONNECT:
                return new DdpMessage.Connect(node.path("version").asText("1"), stringList(node.path("support")));
            case DdpMessage.METHOD:
                if (id != null && node.hasNonNull("method")) {
                    JsonNode params = node.get("params");
                    return new DdpMessage.MethodCall(id, node.get("method").asText(),
                            params instanceof ArrayNode array ? array : Json.MAPPER.createArrayNode());
                }
                break;
            default:
                break;
        }
        return new DdpMessage.Unrecognised(kind, node);
    }

    public static ObjectNode toJson(DdpMessage msg) {
        ObjectNode node = Json.MAPPER.createObjectNode();
        if (msg instanceof DdpMessage.MethodCall call) {
            node.put("id", call.id());
            node.put("msg", DdpMessage.METHOD);
            node.put("method", call.method());
            node.set("params", call.params());
        }
        else if (msg instanceof DdpMessage.Connect connect) {
            node.put("msg", DdpMessage.CONNECT);
            node.put("version", connect.version());
            ArrayNode support = node.putArray("support");
            connect.support().forEach(support::add);
        }
        else if (msg instanceof DdpMessage.Pong pong) {
            node.put("msg", DdpMessage.PONG);
            if (pong.id() != null) {
                node.put("id", pong.id());
            }
        }
        else if (msg instanceof DdpMessage.Ping ping) {
            node.put("msg", DdpMessage.PING);
            if (ping.id() != null) {
                node.put("id", ping.id());
            }
        }
        else if (msg instanceof DdpMessage.MethodResult result) {
            node.put("id", result.id());
            node.put("msg", DdpMessage.RESULT);
            node.set("result", result.result());
        }
        else if (msg instanceof DdpMessage.MethodError error) {
            node.put("id", error.id());
            node.put("msg", DdpMessage.ERROR);
            node.set("error", error.error());
        }
        else if (msg instanceof DdpMessage.Connected connected) {
            node.put("msg", DdpMessage.CONNECTED);
            if (connected.session() != null) {
                node.put("session", connected.session());
            }
        }
        else if (msg instanceof DdpMessage.Failed failed) {
            node.put("msg", DdpMessage.FAILED);
            if (failed.version() != null) {
                node.put("version", failed.version());
            }
        }
        else if (msg instanceof DdpMessage.Unrecognised unrecognised) {
            JsonNode frame = unrecognised.frame();
            return frame instanceof ObjectNode object ? object.deepCopy() : node;
        }
        return node;
    }

    @Nullable
    private static String textOrNull(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static List<String> stringList(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        return StreamSupport.stream(node.spliterator(), false)
                .map(JsonNode::asText)
                .toList();
    }
}
