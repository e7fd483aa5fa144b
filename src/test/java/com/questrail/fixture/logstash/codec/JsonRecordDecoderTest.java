package com.questrail.fixture.logstash.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordDecoderTest {

    private final JsonRecordDecoder decoder = new JsonRecordDecoder(StandardCharsets.UTF_8);

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void objectIsDecodedPreservingKeyOrderAndTypes() {
        Map<String, Object> record = decoder.decode(bytes(
            "{\"level\":\"ERROR\",\"message\":\"x\",\"@version\":1,\"tags\":[\"a\"],\"stack_info\":null,\"ok\":true}"));

        assertEquals(List.of("level", "message", "@version", "tags", "stack_info", "ok"), List.copyOf(record.keySet()));
        assertEquals("ERROR", record.get("level"));
        assertEquals(1, record.get("@version"));
        assertEquals(List.of("a"), record.get("tags"));
        assertNull(record.get("stack_info"));
        assertEquals(Boolean.TRUE, record.get("ok"));
    }

    @Test
    void decodedRecordIsMutable() {
        Map<String, Object> record = decoder.decode(bytes("{\"level\":\"INFO\"}"));

        record.put("extra", "value");

        assertEquals("value", record.get("extra"));
    }

    @Test
    void nonAsciiTextIsDecoded() {
        Map<String, Object> record = decoder.decode(bytes("{\"message\":\"héllo ✓\"}"));

        assertEquals("héllo ✓", record.get("message"));
    }

    @Test
    void surroundingWhitespaceIsAccepted() {
        Map<String, Object> record = decoder.decode(bytes("  {\"a\":1}\r"));

        assertEquals(1, record.get("a"));
    }

    @Test
    void invalidJsonIsRejected() {
        byte[] frame = bytes("{\"level\": ERROR}");

        ConnectionDecodeException e = assertThrows(ConnectionDecodeException.class, () -> decoder.decode(frame));

        assertArrayEquals(frame, e.frame());
        assertNotNull(e.getCause());
    }

    @Test
    void emptyFrameIsRejected() {
        assertThrows(ConnectionDecodeException.class, () -> decoder.decode(new byte[0]));
    }

    @Test
    void trailingContentIsRejected() {
        assertThrows(ConnectionDecodeException.class, () -> decoder.decode(bytes("{\"a\":1}{\"b\":2}")));
    }

    @Test
    void nonObjectValuesAreRejected() {
        assertThrows(ConnectionDecodeException.class, () -> decoder.decode(bytes("[1,2]")));
        assertThrows(ConnectionDecodeException.class, () -> decoder.decode(bytes("42")));
        assertThrows(ConnectionDecodeException.class, () -> decoder.decode(bytes("\"text\"")));
        assertThrows(ConnectionDecodeException.class, () -> decoder.decode(bytes("null")));
    }

    @Test
    void malformedUtf8IsRejected() {
        byte[] frame = {'{', '"', 'a', '"', ':', '"', (byte) 0xC3, (byte) 0x28, '"', '}'};

        ConnectionDecodeException e = assertThrows(ConnectionDecodeException.class, () -> decoder.decode(frame));

        assertTrue(e.getMessage().contains("UTF-8"), e.getMessage());
    }

    @Test
    void configuredCharsetIsUsed() {
        JsonRecordDecoder latin1 = new JsonRecordDecoder(StandardCharsets.ISO_8859_1);
        byte[] frame = {'{', '"', 'm', '"', ':', '"', (byte) 0xE9, '"', '}'};

        assertEquals("é", latin1.decode(frame).get("m"));
    }
}
