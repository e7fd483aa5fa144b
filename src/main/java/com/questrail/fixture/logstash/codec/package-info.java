/**
 * json_lines codec
 * =============================================================================
 *
 * <p>Byte-level rules for the Logstash {@code json_lines} wire format: a TCP
 * byte stream carrying JSON objects, one per frame, frames separated by a
 * delimiter (newline by default). There is no length prefix and no
 * acknowledgement.</p>
 *
 * <pre>
 *   bytes read from a connection
 *        → DelimitedFrameDecoder   (reassembly across partial reads)
 *            → byte[] frame
 *                → JsonRecordDecoder   (charset + JSON)
 *                    → Map&lt;String, Object&gt; record
 * </pre>
 *
 * <p>Nothing in this package performs I/O. Failures are reported as
 * {@link com.questrail.fixture.logstash.codec.ConnectionDecodeException} and
 * are scoped to the connection that produced the frame.</p>
 */
package com.questrail.fixture.logstash.codec;
