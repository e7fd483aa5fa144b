/**
 * Client-side transport for the {@code json_lines} wire format.
 *
 * <p>{@link com.questrail.fixture.logstash.transport.RecordSender} is the
 * framework-agnostic port; implementations live in sub-packages and must not
 * leak their framework types through it.</p>
 */
package com.questrail.fixture.logstash.transport;
