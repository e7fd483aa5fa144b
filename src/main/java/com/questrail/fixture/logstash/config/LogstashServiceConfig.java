package com.questrail.fixture.logstash.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Configuration of a {@code FakeLogstashService}.
 *
 * <p>Defaults follow the Logstash {@code json_lines} codec: UTF-8 JSON objects
 * separated by a newline.</p>
 *
 * @param port          port to listen on; {@code 0} lets the OS choose
 * @param delimiter     byte sequence separating frames (at least one byte)
 * @param charset       charset frames are decoded with
 * @param readChunkSize maximum number of bytes read from a connection per readiness event
 * @param wakeInterval  upper bound of a single readiness wait of the event loop
 * @param stopTimeout   how long {@code stop()} waits for the event loop to exit
 * @param localHost     host name reaching the service from the local machine
 * @param containerHost host name reaching the service from inside containers
 */
public record LogstashServiceConfig(
    int port,
    byte[] delimiter,
    Charset charset,
    int readChunkSize,
    Duration wakeInterval,
    Duration stopTimeout,
    String localHost,
    String containerHost
) {
    public static final String DEFAULT_LOCAL_HOST = "localhost";
    public static final String DEFAULT_CONTAINER_HOST = "host.docker.internal";

    public LogstashServiceConfig {
        Objects.requireNonNull(delimiter, "delimiter");
        Objects.requireNonNull(charset, "charset");
        Objects.requireNonNull(wakeInterval, "wakeInterval");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(localHost, "localHost");
        Objects.requireNonNull(containerHost, "containerHost");

        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (delimiter.length == 0) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        if (readChunkSize <= 0) {
            throw new IllegalArgumentException("readChunkSize must be positive: " + readChunkSize);
        }
        if (wakeInterval.isNegative() || wakeInterval.isZero()) {
            throw new IllegalArgumentException("wakeInterval must be positive: " + wakeInterval);
        }
        if (stopTimeout.isNegative() || stopTimeout.isZero()) {
            throw new IllegalArgumentException("stopTimeout must be positive: " + stopTimeout);
        }

        delimiter = delimiter.clone();
    }

    @Override
    public byte[] delimiter() {
        return delimiter.clone();
    }

    public static LogstashServiceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogstashServiceConfig other)) {
            return false;
        }
        return port == other.port
            && readChunkSize == other.readChunkSize
            && Arrays.equals(delimiter, other.delimiter)
            && charset.equals(other.charset)
            && wakeInterval.equals(other.wakeInterval)
            && stopTimeout.equals(other.stopTimeout)
            && localHost.equals(other.localHost)
            && containerHost.equals(other.containerHost);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(port, charset, readChunkSize, wakeInterval, stopTimeout, localHost, containerHost);
        return 31 * result + Arrays.hashCode(delimiter);
    }

    @Override
    public String toString() {
        return "LogstashServiceConfig[port=" + port
            + ", delimiter=" + Arrays.toString(delimiter)
            + ", charset=" + charset
            + ", readChunkSize=" + readChunkSize
            + ", wakeInterval=" + wakeInterval
            + ", stopTimeout=" + stopTimeout
            + ", localHost=" + localHost
            + ", containerHost=" + containerHost + "]";
    }

    public static final class Builder {
        private int port = 0;
        private byte[] delimiter = {'\n'};
        private Charset charset = StandardCharsets.UTF_8;
        private int readChunkSize = 1024;
        private Duration wakeInterval = Duration.ofSeconds(5);
        private Duration stopTimeout = Duration.ofSeconds(5);
        private String localHost = DEFAULT_LOCAL_HOST;
        private String containerHost = DEFAULT_CONTAINER_HOST;

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withDelimiter(byte[] delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder withCharset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder withReadChunkSize(int readChunkSize) {
            this.readChunkSize = readChunkSize;
            return this;
        }

        public Builder withWakeInterval(Duration wakeInterval) {
            this.wakeInterval = wakeInterval;
            return this;
        }

        public Builder withStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder withLocalHost(String localHost) {
            this.localHost = localHost;
            return this;
        }

        public Builder withContainerHost(String containerHost) {
            this.containerHost = containerHost;
            return this;
        }

        public LogstashServiceConfig build() {
            return new LogstashServiceConfig(
                port, delimiter, charset, readChunkSize, wakeInterval, stopTimeout, localHost, containerHost);
        }
    }
}
