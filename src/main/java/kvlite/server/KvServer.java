package kvlite.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.ScheduledFuture;
import kvlite.Config;
import kvlite.commands.CommandDispatcher;
import kvlite.db.KeyValueStore;
import kvlite.network.ClientHandler;
import kvlite.network.ConnectionLimiter;
import kvlite.protocol.RespCodec;
import kvlite.protocol.netty.NettyRespDecoder;
import kvlite.protocol.netty.NettyRespEncoder;
import kvlite.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Listens on the configured address and serves every accepted connection with its own pipeline.
 * Connections share nothing but the {@link KeyValueStore}.
 */
public class KvServer {
    private final Config config;
    private final KeyValueStore store;
    private final CommandDispatcher dispatcher;
    private final RespCodec codec;
    private final AtomicLong totalCommands = new AtomicLong(0);

    private volatile ConnectionLimiter limiter;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private ScheduledFuture<?> statsTask;
    private long lastCommandCount = 0;

    public KvServer(Config config) {
        this(config, new KeyValueStore());
    }

    public KvServer(Config config, KeyValueStore store) {
        this.config = config.validate();
        this.store = store;
        this.dispatcher = new CommandDispatcher(store);
        this.codec = config.newCodec();
    }

    /**
     * Binds the listening socket. Returns once the server accepts connections.
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) throw new IllegalStateException("Server already started");

        limiter = new ConnectionLimiter(config.maxClients);
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .option(ChannelOption.SO_BACKLOG, config.acceptBacklog)
             .handler(limiter)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyRespDecoder(codec));
                     ch.pipeline().addLast(new NettyRespEncoder(codec));
                     ch.pipeline().addLast(new ClientHandler(dispatcher, totalCommands));
                 }
             });

            serverChannel = b.bind(config.host, config.port).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }

        Log.info("Ready on " + serverChannel.localAddress() + " (max clients: " + config.maxClients + ")");

        if (config.statsIntervalSeconds > 0) {
            statsTask = workerGroup.scheduleAtFixedRate(this::logStats,
                    config.statsIntervalSeconds, config.statsIntervalSeconds, TimeUnit.SECONDS);
        }
    }

    /**
     * Closes the listening socket and every open connection.
     */
    public synchronized void stop() {
        if (serverChannel == null) return;
        if (statsTask != null) {
            statsTask.cancel(false);
            statsTask = null;
        }
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownGroups();
        Log.info("Server stopped. Commands processed: " + totalCommands.get() + ", keys: " + store.size());
    }

    /**
     * Blocks until the listening socket is closed.
     */
    public void awaitTermination() throws InterruptedException {
        Channel ch;
        synchronized (this) {
            ch = serverChannel;
        }
        if (ch != null) ch.closeFuture().sync();
    }

    public synchronized int getPort() {
        if (serverChannel == null) throw new IllegalStateException("Server not started");
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public int getActiveConnections() {
        ConnectionLimiter l = limiter;
        return l == null ? 0 : l.getActiveConnections();
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }

    public KeyValueStore getStore() {
        return store;
    }

    private void logStats() {
        long currentCount = totalCommands.get();
        long ops = (currentCount - lastCommandCount) / config.statsIntervalSeconds;
        lastCommandCount = currentCount;
        int clients = getActiveConnections();
        if (ops > 0 || clients > 0) {
            Log.info(String.format("[STATS] Clients: %d | Keys: %d | OPS: %d cmd/s", clients, store.size(), ops));
        }
    }

    private void shutdownGroups() {
        // Workers first: closing children hands slot releases to the boss loop
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        bossGroup = null;
        workerGroup = null;
    }
}
