package kvlite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import kvlite.protocol.RespCodec;
import kvlite.protocol.UnrecognizedTypeException;

/**
 * Encodes {@link kvlite.protocol.RespValue}s onto the wire. Any other outbound message fails the
 * write with {@link UnrecognizedTypeException} instead of being passed through.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Object> {

    private final RespCodec codec;

    public NettyRespEncoder() {
        this(new RespCodec());
    }

    public NettyRespEncoder(RespCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, ByteBuf out) throws Exception {
        codec.encode(msg, out);
    }
}
