package jobrelay.relay.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jobrelay.relay.config.Dependencies;
import jobrelay.relay.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * HTTP server hosting the relay API.
 * One instance per process; holds the {@link Dependencies} it serves from.
 */
public final class RelayNettyServer {

    private static final Logger log = LoggerFactory.getLogger(RelayNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private RelayNettyServer() {
    }

    /** HTTP pipeline for the API and event streams */
    static ChannelHandler pipelineInitializer(RouterHandler router, long writeTimeoutMillis) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new WriteTimeoutHandler(writeTimeoutMillis, TimeUnit.MILLISECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(64 * 1024));
                p.addLast(router);
            }
        };
    }

    public static synchronized boolean start(RelayConfig config) {
        if (running) return true;
        try {
            dependencies = Dependencies.create(config);
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler(),
                            config.subscriberWriteTimeout().toMillis()));

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Job relay listening on {}:{}", config.serverHost(), config.serverPort());
            return true;
        } catch (Exception e) {
            log.error("Start error: {}", e.getMessage(), e);
            release();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) return;
        release();
        log.info("Job relay stopped");
    }

    private static void release() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            if (dependencies != null) {
                dependencies.close();
            }
        } finally {
            if (workerGroup != null) { workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly(); workerGroup = null; }
            if (bossGroup != null)   { bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();   bossGroup = null;   }
            dependencies = null;
            running = false;
        }
    }

    public static boolean isRunning() { return running; }

    /** Components of the running server, or null when stopped */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
