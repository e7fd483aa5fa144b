package com.questrail.fixture.logstash.internal.loop;

import com.questrail.fixture.logstash.codec.DelimitedFrameDecoder;
import com.questrail.fixture.logstash.codec.JsonRecordDecoder;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * JsonLinesConnection
 * -----------------------------------------------------------------------------
 * State of one accepted connection: its channel and the partial frame received
 * so far.
 *
 * <p>Instances are owned by the event loop thread. They are created on accept
 * and discarded on end of stream, decode failure or loop exit.</p>
 */
final class JsonLinesConnection
{
    /** Outcome of one readiness event. */
    enum ReadResult {
        OPEN,
        END_OF_STREAM
    }

    private final String id;
    private final SocketChannel channel;
    private final SocketAddress remoteAddress;
    private final DelimitedFrameDecoder frames;
    private final JsonRecordDecoder records;

    JsonLinesConnection(String id,
                        SocketChannel channel,
                        SocketAddress remoteAddress,
                        DelimitedFrameDecoder frames,
                        JsonRecordDecoder records)
    {
        this.id = id;
        this.channel = channel;
        this.remoteAddress = remoteAddress;
        this.frames = frames;
        this.records = records;
    }

    String id()
    {
        return id;
    }

    SocketChannel channel()
    {
        return channel;
    }

    SocketAddress remoteAddress()
    {
        return remoteAddress;
    }

    /**
     * Reads one chunk and hands every record it completes to {@code sink}, in
     * stream order.
     *
     * <p>If a frame fails to decode, the records of earlier frames in the same
     * chunk have already been handed over when the exception propagates.</p>
     *
     * @param buffer scratch buffer owned by the loop; its capacity is the chunk size
     * @throws com.questrail.fixture.logstash.codec.ConnectionDecodeException on an undecodable frame
     */
    ReadResult readChunk(ByteBuffer buffer, Consumer<Map<String, Object>> sink) throws IOException
    {
        buffer.clear();
        int read = channel.read(buffer);
        if (read < 0) {
            return ReadResult.END_OF_STREAM;
        }
        if (read == 0) {
            return ReadResult.OPEN;
        }

        buffer.flip();
        byte[] chunk = new byte[buffer.remaining()];
        buffer.get(chunk);

        List<byte[]> complete = frames.feed(chunk);
        for (byte[] frame : complete) {
            sink.accept(records.decode(frame));
        }
        return ReadResult.OPEN;
    }
}
