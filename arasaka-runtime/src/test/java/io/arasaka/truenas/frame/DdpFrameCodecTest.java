/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.frame;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import io.arasaka.truenas.internal.util.Json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DdpFrameCodecTest {

    private final EmbeddedChannel channel = new EmbeddedChannel(new DdpFrameCodec());

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("connect is written as the version 1 handshake")
    void encodesConnect() throws Exception {
        assertTrue(channel.writeOutbound(DdpMessage.Connect.V1));

        JsonNode written = readOutbound();
        assertEquals(Json.MAPPER.readTree("{\"msg\":\"connect\",\"version\":\"1\",\"support\":[\"1\"]}"), written);
    }

    @Test
    void encodesMethodCall() throws Exception {
        DdpMessage.MethodCall call = new DdpMessage.MethodCall("req_1_1700000000000", "app.get_instance",
                Json.MAPPER.valueToTree(List.of("web")));

        channel.writeOutbound(call);

        JsonNode written = readOutbound();
        assertEquals("req_1_1700000000000", written.get("id").asText());
        assertEquals("method", written.get("msg").asText());
        assertEquals("app.get_instance", written.get("method").asText());
        assertEquals("web", written.get("params").get(0).asText());
    }

    @Test
    void decodesResult() {
        channel.writeInbound(new TextWebSocketFrame("{\"id\":\"req_7_1\",\"msg\":\"result\",\"result\":{\"name\":\"web\"}}"));

        DdpMessage.MethodResult result = assertInstanceOf(DdpMessage.MethodResult.class, channel.readInbound());
        assertEquals("req_7_1", result.id());
        assertEquals("web", result.result().get("name").asText());
    }

    @Test
    @DisplayName("a result without a result field carries JSON null")
    void decodesResultWithoutPayload() {
        channel.writeInbound(new TextWebSocketFrame("{\"id\":\"req_7_1\",\"msg\":\"result\"}"));

        DdpMessage.MethodResult result = assertInstanceOf(DdpMessage.MethodResult.class, channel.readInbound());
        assertTrue(result.result().isNull());
    }

    @Test
    void decodesError() {
        channel.writeInbound(new TextWebSocketFrame(
                "{\"id\":\"req_2_1\",\"msg\":\"error\",\"error\":{\"error\":2,\"reason\":\"[ENOENT] not found\"}}"));

        DdpMessage.MethodError error = assertInstanceOf(DdpMessage.MethodError.class, channel.readInbound());
        assertEquals("req_2_1", error.id());
        assertEquals("[ENOENT] not found", error.error().get("reason").asText());
    }

    @Test
    void decodesHandshakeReplies() {
        channel.writeInbound(new TextWebSocketFrame("{\"msg\":\"connected\",\"session\":\"abc\"}"));
        channel.writeInbound(new TextWebSocketFrame("{\"msg\":\"failed\",\"version\":\"2\"}"));

        DdpMessage.Connected connected = assertInstanceOf(DdpMessage.Connected.class, channel.readInbound());
        assertEquals("abc", connected.session());
        DdpMessage.Failed failed = assertInstanceOf(DdpMessage.Failed.class, channel.readInbound());
        assertEquals("2", failed.version());
    }

    @Test
    @DisplayName("collection updates and other kinds are passed on as unrecognised")
    void decodesOtherKindsAsUnrecognised() {
        channel.writeInbound(new TextWebSocketFrame("{\"msg\":\"added\",\"collection\":\"core.get_jobs\",\"id\":5}"));

        DdpMessage.Unrecognised other = assertInstanceOf(DdpMessage.Unrecognised.class, channel.readInbound());
        assertEquals("added", other.kind());
        assertEquals("core.get_jobs", other.frame().get("collection").asText());
    }

    @Test
    @DisplayName("a result without an id cannot be correlated")
    void resultWithoutIdIsUnrecognised() {
        channel.writeInbound(new TextWebSocketFrame("{\"msg\":\"result\",\"result\":true}"));

        assertInstanceOf(DdpMessage.Unrecognised.class, channel.readInbound());
    }

    @ParameterizedTest
    @ValueSource(strings = { "not json", "[1,2,3]", "\"text\"", "{\"msg\":" })
    @DisplayName("frames that are not JSON objects are dropped")
    void dropsUndecodableFrames(String text) {
        channel.writeInbound(new TextWebSocketFrame(text));

        assertNull(channel.readInbound());
        assertNull(DdpFrameCodec.decode(text));
    }

    @Test
    void pingIsAnsweredWithMatchingPong() throws Exception {
        channel.writeInbound(new TextWebSocketFrame("{\"msg\":\"ping\",\"id\":\"p1\"}"));
        DdpMessage.Ping ping = assertInstanceOf(DdpMessage.Ping.class, channel.readInbound());

        channel.writeOutbound(new DdpMessage.Pong(ping.id()));

        JsonNode written = readOutbound();
        assertEquals("pong", written.get("msg").asText());
        assertEquals("p1", written.get("id").asText());
    }

    private JsonNode readOutbound() throws Exception {
        TextWebSocketFrame frame = channel.readOutbound();
        try {
            return Json.MAPPER.readTree(frame.text());
        }
        finally {
            frame.release();
        }
    }
}
