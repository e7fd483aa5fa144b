package com.questrail.fixture.logstash.transport.netty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fixture.logstash.transport.RecordSender;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyRecordSender
 * =============================================================================
 * Netty-backed implementation of the {@link RecordSender} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>: it serializes records
 * with Jackson, appends the delimiter and writes the result to a TCP channel.
 * It never reads protocol data; a {@code json_lines} endpoint sends nothing back.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Ordering</h2>
 * Writes are submitted to the channel's event loop in call order, so frames
 * arrive in send order. {@link #close()} is queued behind pending writes.
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect()} connects the channel and blocks until it is established.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 */
public final class NettyRecordSender implements RecordSender
{
    private static final Logger log = LoggerFactory.getLogger(NettyRecordSender.class);

    private static final byte[] NEWLINE = {'\n'};

    private final InetSocketAddress remoteAddress;
    private final byte[] delimiter;
    private final ObjectMapper mapper;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile Channel channel;

    public NettyRecordSender(String host, int port)
    {
        this(new InetSocketAddress(host, port), NEWLINE, new ObjectMapper());
    }

    /**
     * @param remoteAddress endpoint to connect to
     * @param delimiter     frame delimiter the endpoint expects
     * @param mapper        serializes records
     */
    public NettyRecordSender(InetSocketAddress remoteAddress, byte[] delimiter, ObjectMapper mapper)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter").clone();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        if (this.delimiter.length == 0) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new DiscardingHandler());
    }

    @Override
    public void connect() throws IOException
    {
        if (channel != null) {
            throw new IllegalStateException("Already connected to " + remoteAddress);
        }

        ChannelFuture f = bootstrap.connect(remoteAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new IOException("Failed connecting to " + remoteAddress, f.cause());
        }
        channel = f.channel();
    }

    @Override
    public void send(Map<String, ?> record)
    {
        Objects.requireNonNull(record, "record");

        final byte[] json;
        try {
            json = mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not JSON-serializable", e);
        }

        ByteBuf frame = Unpooled.buffer(json.length + delimiter.length)
                .writeBytes(json)
                .writeBytes(delimiter);
        requireChannel().writeAndFlush(frame);
    }

    @Override
    public void sendRaw(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        requireChannel().writeAndFlush(Unpooled.wrappedBuffer(bytes.clone()));
    }

    @Override
    public void close() throws IOException
    {
        Channel ch = channel;
        channel = null;

        Throwable failure = null;
        if (ch != null) {
            ChannelFuture closed = ch.close().awaitUninterruptibly();
            failure = closed.cause();
        }

        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();

        if (failure != null) {
            throw new IOException("Failed closing connection to " + remoteAddress, failure);
        }
    }

    private Channel requireChannel()
    {
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("connect() must be called before sending");
        }
        return ch;
    }

    /**
     * DiscardingHandler
     * -------------------------------------------------------------------------
     * Releases anything the endpoint sends back and closes the channel on error.
     */
    @ChannelHandler.Sharable
    private static final class DiscardingHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ReferenceCountUtil.release(msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Closing connection to {} after transport error", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
