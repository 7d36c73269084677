package kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespFrameScannerTest {

    private final RespFrameScanner scanner = new RespFrameScanner(new RespCodec());
    private final ByteBuf buf = Unpooled.buffer();

    private void append(String data) {
        buf.writeBytes(data.getBytes(StandardCharsets.UTF_8));
    }

    @AfterEach
    public void release() {
        buf.release();
    }

    @Test
    public void testResumesAfterCheckedElements() {
        append("*3\r\n$1\r\na\r\n$1\r\nb\r\n$1\r\n");

        assertEquals(-1, scanner.scan(buf));
        // Header and the first two bulk strings are done, the third waits for its payload
        assertEquals(18, scanner.scannedBytes());
        assertEquals(0, buf.readerIndex());

        append("c\r\n");
        assertEquals(25, scanner.scan(buf));
        assertEquals(0, scanner.scannedBytes());
    }

    @Test
    public void testReportsOneValueAtATime() {
        append(":1\r\n+OK\r\n");

        assertEquals(4, scanner.scan(buf));
        buf.skipBytes(4);
        assertEquals(5, scanner.scan(buf));
    }

    @Test
    public void testMapCountsKeysAndValues() {
        append("%2\r\n+a\r\n:1\r\n+b\r\n");
        assertEquals(-1, scanner.scan(buf));

        append(":2\r\n");
        assertEquals(20, scanner.scan(buf));
    }

    @Test
    public void testEmptyAndNestedAggregates() {
        append("*2\r\n*0\r\n*1\r\n%-1\r\n");

        assertEquals(buf.readableBytes(), scanner.scan(buf));
    }

    @Test
    public void testSurvivesCompaction() {
        append(":7\r\n*2\r\n:1\r\n");
        assertEquals(4, scanner.scan(buf));
        buf.skipBytes(4);

        assertEquals(-1, scanner.scan(buf));
        buf.discardReadBytes();
        append(":2\r\n");

        assertEquals(12, scanner.scan(buf));
        RespCodec codec = new RespCodec();
        assertEquals(RespValue.array(RespValue.integer(1), RespValue.integer(2)), codec.decode(buf));
    }

    @Test
    public void testRejectsWhatTheCodecRejects() {
        append("*1\r\n:12x\r\n");
        assertThrows(ProtocolException.class, () -> scanner.scan(buf));

        RespFrameScanner shallow = new RespFrameScanner(new RespCodec(1, 64, 64));
        ByteBuf nested = Unpooled.copiedBuffer("*1\r\n*1\r\n", StandardCharsets.UTF_8);
        try {
            assertThrows(ProtocolException.class, () -> shallow.scan(nested));
        } finally {
            nested.release();
        }
    }
}
