package kvlite.network;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.EventExecutor;
import kvlite.utils.Log;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of connections being served. Sits in the listening channel's pipeline, ahead of
 * the acceptor that registers child channels.
 * <p>
 * At the limit it stops reading from the listening socket, so new connection attempts wait in the
 * kernel accept queue. Channels already accepted in the same batch are parked and handed on in
 * arrival order as slots free up. No connection is refused.
 * <p>
 * All state except the active count is confined to the listening channel's event loop.
 */
public class ConnectionLimiter extends ChannelInboundHandlerAdapter {
    private final int maxClients;
    private final AtomicInteger active = new AtomicInteger();
    private final Deque<Channel> parked = new ArrayDeque<>();
    private ChannelHandlerContext ctx;

    public ConnectionLimiter(int maxClients) {
        if (maxClients < 1) throw new IllegalArgumentException("maxClients must be >= 1");
        this.maxClients = maxClients;
    }

    public int getActiveConnections() {
        return active.get();
    }

    public int getMaxClients() {
        return maxClients;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        Channel child = (Channel) msg;
        if (active.get() < maxClients && parked.isEmpty()) {
            admit(child);
        } else {
            parked.add(child);
            pauseAccepting();
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Channel child;
        while ((child = parked.poll()) != null) {
            child.close();
        }
        super.channelInactive(ctx);
    }

    private void admit(Channel child) {
        int now = active.incrementAndGet();
        child.closeFuture().addListener(f -> {
            EventExecutor executor = ctx.executor();
            if (!executor.isShuttingDown()) {
                executor.execute(this::release);
            }
        });
        ctx.fireChannelRead(child);
        if (now >= maxClients) {
            pauseAccepting();
        }
    }

    private void release() {
        active.decrementAndGet();
        while (active.get() < maxClients && !parked.isEmpty()) {
            Channel next = parked.poll();
            if (next.isOpen()) {
                admit(next);
            }
        }
        if (active.get() < maxClients && parked.isEmpty() && !ctx.channel().config().isAutoRead()) {
            Log.debug("Connection slot free (" + active.get() + "/" + maxClients + "), accepting again");
            ctx.channel().config().setAutoRead(true);
        }
    }

    private void pauseAccepting() {
        if (ctx.channel().config().isAutoRead()) {
            Log.debug("Connection limit reached (" + maxClients + "), pausing accept");
            ctx.channel().config().setAutoRead(false);
        }
    }
}
