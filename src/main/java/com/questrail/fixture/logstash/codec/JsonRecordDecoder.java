package com.questrail.fixture.logstash.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.Map;
import java.util.Objects;

/**
 * JsonRecordDecoder
 * -----------------------------------------------------------------------------
 * Turns one frame into one record.
 *
 * <p>Decoding happens in two strict steps:</p>
 * <ol>
 *   <li>bytes → text, in the configured charset; malformed or unmappable input
 *       is rejected rather than replaced</li>
 *   <li>text → JSON object; trailing content after the value is rejected</li>
 * </ol>
 *
 * <p>The decoder is stateless and may be shared between connections served by
 * the same thread. {@link CharsetDecoder} instances are not thread-safe, so one
 * is created per call.</p>
 */
public final class JsonRecordDecoder
{
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final Charset charset;
    private final ObjectMapper mapper;

    public JsonRecordDecoder(Charset charset)
    {
        this(charset, new ObjectMapper());
    }

    public JsonRecordDecoder(Charset charset, ObjectMapper mapper)
    {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Decodes a single frame.
     *
     * @param frame frame bytes without delimiter
     * @return the decoded record; a mutable map preserving key order
     * @throws ConnectionDecodeException if the frame is not a JSON object in the
     *                                   configured charset
     */
    public Map<String, Object> decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        final String text;
        try {
            text = newDecoder().decode(ByteBuffer.wrap(frame)).toString();
        } catch (CharacterCodingException e) {
            throw new ConnectionDecodeException("Frame is not valid " + charset.name(), frame, e);
        }

        final JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ConnectionDecodeException("Frame is not valid JSON", frame, e);
        }

        if (node == null || !node.isObject()) {
            throw new ConnectionDecodeException(
                "Frame is not a JSON object: " + (node == null ? "<empty>" : node.getNodeType()), frame);
        }

        return mapper.convertValue(node, RECORD_TYPE);
    }

    private CharsetDecoder newDecoder()
    {
        return charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
