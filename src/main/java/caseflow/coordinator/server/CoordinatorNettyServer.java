package caseflow.coordinator.server;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.config.Dependencies;
import caseflow.coordinator.notify.LiveChannelAuthHandler;
import caseflow.coordinator.notify.StatusWebSocketHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server for the coordinator API and the live status channel.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int MAX_FRAME_SIZE = 64 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;
    private static boolean ownsDependencies;

    private CoordinatorNettyServer() {
    }

    /** HTTP pipeline; the WebSocket handlers are only installed when the live channel is served. */
    public static ChannelHandler pipelineInitializer(Dependencies deps) {
        RouterHandler router = deps.routerHandler();
        boolean live = deps.tokenVerifier() != null;
        LiveChannelAuthHandler auth = live ? new LiveChannelAuthHandler(WEBSOCKET_PATH, deps.tokenVerifier()) : null;
        StatusWebSocketHandler statusHandler = live
                ? new StatusWebSocketHandler(deps.subscriptions(), deps.mapper(), deps.clock())
                : null;

        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                if (live) {
                    p.addLast(auth);
                    p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, true, MAX_FRAME_SIZE,
                            false, true));
                    p.addLast(statusHandler);
                }
                p.addLast(router);
            }
        };
    }

    /**
     * Start with a fresh dependency graph built from the config.
     * The graph is closed again by {@link #stop()}.
     */
    public static synchronized boolean start(int port, CoordinatorConfig config) {
        if (running) {
            return true;
        }
        Dependencies deps = Dependencies.create(config);
        boolean started = start(port, deps);
        if (started) {
            ownsDependencies = true;
            deps.startScheduler();
        } else {
            deps.close();
        }
        return started;
    }

    /**
     * Start serving an existing dependency graph. The caller keeps ownership of it.
     */
    public static synchronized boolean start(int port, Dependencies deps) {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps));

            serverChannel = b.bind(deps.config().serverHost(), port).syncUninterruptibly().channel();
            dependencies = deps;
            ownsDependencies = false;
            running = true;
            log.info("Coordinator started on port {} (status channel: {})", port, deps.statusChannel().name());
            return true;
        } catch (Exception e) {
            log.error("Start error: {}", e.getMessage(), e);
            shutdownGroups();
            return false;
        }
    }

    public static synchronized void stop() {
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
            if (ownsDependencies && dependencies != null) {
                dependencies.close();
            }
            dependencies = null;
            ownsDependencies = false;
            running = false;
            log.info("Coordinator stopped");
        }
    }

    private static void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /**
     * @return the dependency graph being served, or null when stopped
     */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
