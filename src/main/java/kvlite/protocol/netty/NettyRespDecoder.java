package kvlite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import kvlite.protocol.ProtocolException;
import kvlite.protocol.RespCodec;
import kvlite.protocol.RespFrameScanner;
import kvlite.protocol.RespValue;

import java.util.List;

/**
 * Netty decoder emitting one {@link RespValue} per complete value on the wire.
 * Fragmented input is buffered until the value is whole; a {@link RespFrameScanner} remembers how
 * much of it has been checked, so each read only looks at the new bytes.
 * <p>
 * After the first {@link ProtocolException} the stream is considered desynchronized: the decoder
 * discards everything that follows and never emits another value.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final RespCodec codec;
    private final RespFrameScanner scanner;
    private boolean failed = false;

    public NettyRespDecoder() {
        this(new RespCodec());
    }

    public NettyRespDecoder(RespCodec codec) {
        this.codec = codec;
        this.scanner = new RespFrameScanner(codec);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            if (scanner.scan(in) < 0) return;
            out.add(codec.decode(in));
        } catch (ProtocolException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}
