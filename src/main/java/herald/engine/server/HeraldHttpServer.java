package herald.engine.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of a {@link RouterHandler}.
 */
public final class HeraldHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HeraldHttpServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final String host;
    private final int port;
    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public HeraldHttpServer(String host, int port, RouterHandler router) {
        this.host = host;
        this.port = port;
        this.router = router;
    }

    /**
     * Bind and start serving. Blocks until the port is bound.
     *
     * @throws IllegalStateException if the port cannot be bound
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("HTTP server listening on {}:{}", host, port);
        } catch (Exception e) {
            // syncUninterruptibly rethrows BindException unchecked
            shutdownGroups();
            throw new IllegalStateException("Failed to start HTTP server on " + host + ":" + port, e);
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            shutdownGroups();
            running = false;
            log.info("HTTP server stopped");
        }
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int port() {
        return port;
    }

    @Override
    public void close() {
        stop();
    }
}
