package kvlite.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import kvlite.commands.CommandDispatcher;
import kvlite.commands.CommandException;
import kvlite.protocol.RespValue;
import kvlite.utils.Log;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves one client connection: each decoded request is dispatched and its reply written and
 * flushed before the next request is taken.
 * <p>
 * Command errors are answered with an error value and the connection stays open. Protocol errors
 * and unexpected failures close the connection without a reply; they never reach the server.
 */
public class ClientHandler extends SimpleChannelInboundHandler<RespValue> {
    private final CommandDispatcher dispatcher;
    private final AtomicLong totalCommands;
    private volatile ConnectionState state = ConnectionState.AWAITING_REQUEST;

    public ClientHandler(CommandDispatcher dispatcher, AtomicLong totalCommands) {
        this.dispatcher = dispatcher;
        this.totalCommands = totalCommands;
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (Log.isDebugEnabled()) Log.debug("Client connected: " + remoteAddress(ctx));
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state = ConnectionState.CLOSED;
        if (Log.isDebugEnabled()) Log.debug("Client disconnected: " + remoteAddress(ctx));
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespValue request) {
        if (state == ConnectionState.CLOSED) return;

        state = ConnectionState.DISPATCHING;
        totalCommands.incrementAndGet();

        RespValue response;
        try {
            response = dispatcher.dispatch(request);
        } catch (CommandException e) {
            response = RespValue.error(e.getMessage());
        }

        state = ConnectionState.SENDING_RESPONSE;
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        if (state == ConnectionState.SENDING_RESPONSE) {
            state = ConnectionState.AWAITING_REQUEST;
        }
    }

    // Stop reading while the peer is not draining its replies.
    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        ctx.channel().config().setAutoRead(ctx.channel().isWritable());
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            Log.warn("Protocol error from " + remoteAddress(ctx) + ": " + cause.getMessage() + ". Closing connection.");
        } else if (cause instanceof IOException) {
            Log.debug("I/O error on " + remoteAddress(ctx) + ": " + cause.getMessage());
        } else {
            Log.error("Unexpected error on " + remoteAddress(ctx) + ". Closing connection.", cause);
        }
        state = ConnectionState.CLOSED;
        ctx.close();
    }

    private static SocketAddress remoteAddress(ChannelHandlerContext ctx) {
        return ctx.channel().remoteAddress();
    }
}
