package com.questrail.relay.transport.datagram.netty;

import com.questrail.relay.transport.datagram.DatagramEndpoint;
import com.questrail.relay.transport.datagram.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * A pure I/O adapter. It does not decode envelopes, touch ledgers or talk to
 * a relay.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do
 * not escape this package. Inbound payloads are copied into {@code byte[]};
 * reference-counted buffers are released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds the socket asynchronously and reports the outcome to
 * the listener. {@link #stop()} closes the channel and shuts down the event
 * loop group. A channel that closes on its own is reported as down too.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                log.info("Relay datagram endpoint bound to {}", channel.localAddress());
                l.onTransportUp();
            }
            else {
                log.error("Could not bind relay datagram endpoint to {}", bindAddress, future.cause());
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        DatagramEndpointListener l = listener;

        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();

        if (l != null) {
            l.onTransportDown(null);
        }
    }

    /**
     * Queues one datagram for sending.
     *
     * @throws IllegalStateException if the endpoint is not bound
     */
    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Datagram endpoint is not bound");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.warn("Datagram to {} was not sent", remote, future.cause());
                    }
                });
    }

    /**
     * The bound local address, once {@link #start()} has succeeded.
     */
    public Optional<SocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of(ch.localAddress());
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
