package kvlite.db;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyValueStoreTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testSetGetOverwrite() {
        KeyValueStore store = new KeyValueStore();

        assertNull(store.get(b("k")));
        store.set(b("k"), b("v1"));
        assertArrayEquals(b("v1"), store.get(b("k")));
        store.set(b("k"), b("v2"));
        assertArrayEquals(b("v2"), store.get(b("k")));
        assertEquals(1, store.size());
    }

    @Test
    public void testEmptyKeyAndValueAreLegal() {
        KeyValueStore store = new KeyValueStore();

        store.set(new byte[0], new byte[0]);
        byte[] value = store.get(new byte[0]);
        assertNotNull(value);
        assertEquals(0, value.length);
    }

    @Test
    public void testKeysAreBinary() {
        KeyValueStore store = new KeyValueStore();
        byte[] k1 = {0, (byte) 0xff, '\r', '\n'};
        byte[] k2 = {0, (byte) 0xfe, '\r', '\n'};

        store.set(k1, b("one"));
        store.set(k2, b("two"));

        assertArrayEquals(b("one"), store.get(k1.clone()));
        assertArrayEquals(b("two"), store.get(k2.clone()));
    }

    @Test
    public void testStoredValuesAreCopies() {
        KeyValueStore store = new KeyValueStore();
        byte[] key = b("k");
        byte[] value = b("abc");

        store.set(key, value);
        value[0] = 'x';
        key[0] = 'z';
        assertArrayEquals(b("abc"), store.get(b("k")));

        store.get(b("k"))[0] = 'y';
        assertArrayEquals(b("abc"), store.get(b("k")));
    }

    @Test
    public void testDelete() {
        KeyValueStore store = new KeyValueStore();
        store.set(b("k"), b("v"));

        assertTrue(store.delete(b("k")));
        assertFalse(store.delete(b("k")));
        assertNull(store.get(b("k")));
    }

    @Test
    public void testFlushReturnsCount() {
        KeyValueStore store = new KeyValueStore();
        store.set(b("a"), b("1"));
        store.set(b("b"), b("2"));

        assertEquals(2, store.flush());
        assertEquals(0, store.size());
        assertNull(store.get(b("a")));
        assertEquals(0, store.flush());
    }

    @Test
    public void testMgetPreservesOrderAndMissingKeys() {
        KeyValueStore store = new KeyValueStore();
        store.set(b("a"), b("1"));
        store.set(b("c"), b("3"));

        List<byte[]> values = store.mget(Arrays.asList(b("c"), b("b"), b("a"), b("c")));

        assertEquals(4, values.size());
        assertArrayEquals(b("3"), values.get(0));
        assertNull(values.get(1));
        assertArrayEquals(b("1"), values.get(2));
        assertArrayEquals(b("3"), values.get(3));
    }

    @Test
    public void testMsetLaterPairWins() {
        KeyValueStore store = new KeyValueStore();

        assertEquals(3, store.mset(Arrays.asList(b("a"), b("1"), b("b"), b("2"), b("a"), b("3"))));

        assertArrayEquals(b("3"), store.get(b("a")));
        assertArrayEquals(b("2"), store.get(b("b")));
        assertEquals(2, store.size());
    }

    @Test
    public void testMsetOddArgumentsRejected() {
        KeyValueStore store = new KeyValueStore();

        assertThrows(IllegalArgumentException.class, () -> store.mset(Arrays.asList(b("a"), b("1"), b("b"))));
        assertEquals(0, store.size());
    }
}
