package com.questrail.fixture.logstash.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * DelimitedFrameDecoder
 * -----------------------------------------------------------------------------
 * Reassembles delimiter-terminated frames from a byte stream delivered in
 * arbitrary chunks.
 *
 * <p>Bytes following the last delimiter seen so far are kept as a partial
 * frame and prepended to the next chunk. The result is independent of how the
 * stream is partitioned into chunks: a frame split across any number of chunks,
 * several frames within one chunk, and a multi-byte delimiter split across
 * chunks all produce the same frames as one unsplit chunk.</p>
 *
 * <p>Frames are returned without their delimiter. Two consecutive delimiters
 * produce an empty frame.</p>
 *
 * <p>Instances hold per-stream state and are not thread-safe. One instance
 * serves exactly one connection.</p>
 */
public final class DelimitedFrameDecoder
{
    private static final int INITIAL_CAPACITY = 256;

    private final byte[] delimiter;

    private byte[] pending = new byte[INITIAL_CAPACITY];
    private int pendingLength;

    /** Positions below this index were already searched for a delimiter start. */
    private int scanFrom;

    public DelimitedFrameDecoder(byte[] delimiter)
    {
        Objects.requireNonNull(delimiter, "delimiter");
        if (delimiter.length == 0) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        this.delimiter = delimiter.clone();
    }

    /**
     * Feeds a chunk of the stream.
     *
     * @return complete frames terminated within this chunk, in stream order;
     *         empty if the chunk completed no frame
     */
    public List<byte[]> feed(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Feeds {@code length} bytes of {@code chunk} starting at {@code offset}.
     */
    public List<byte[]> feed(byte[] chunk, int offset, int length)
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.checkFromIndexSize(offset, length, chunk.length);

        append(chunk, offset, length);

        List<byte[]> frames = new ArrayList<>();
        int frameStart = 0;
        int index = indexOfDelimiter(scanFrom);
        while (index >= 0) {
            frames.add(Arrays.copyOfRange(pending, frameStart, index));
            frameStart = index + delimiter.length;
            index = indexOfDelimiter(frameStart);
        }

        compact(frameStart);
        return frames;
    }

    /**
     * @return number of buffered bytes not yet terminated by a delimiter
     */
    public int pendingBytes()
    {
        return pendingLength;
    }

    private void append(byte[] chunk, int offset, int length)
    {
        int required = pendingLength + length;
        if (required > pending.length) {
            pending = Arrays.copyOf(pending, Math.max(required, pending.length * 2));
        }
        System.arraycopy(chunk, offset, pending, pendingLength, length);
        pendingLength = required;
    }

    private int indexOfDelimiter(int from)
    {
        int last = pendingLength - delimiter.length;
        outer:
        for (int i = from; i <= last; i++) {
            for (int j = 0; j < delimiter.length; j++) {
                if (pending[i + j] != delimiter[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private void compact(int frameStart)
    {
        int remaining = pendingLength - frameStart;
        if (frameStart > 0) {
            System.arraycopy(pending, frameStart, pending, 0, remaining);
        }
        pendingLength = remaining;

        // A delimiter may start in the last (length - 1) bytes and complete in the next chunk.
        scanFrom = Math.max(0, remaining - delimiter.length + 1);
    }
}
