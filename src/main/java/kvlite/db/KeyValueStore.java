package kvlite.db;

import io.netty.util.AsciiString;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The single shared key space.
 * <p>
 * One read/write lock guards the whole map: reads (GET, MGET) share the read lock, every mutation
 * holds the write lock for its full duration. Multi-key operations and FLUSH are therefore atomic
 * as a whole with respect to every other operation.
 */
public class KeyValueStore {

    private final Map<AsciiString, byte[]> store = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @return a copy of the value, or null if the key is absent
     */
    public byte[] get(byte[] key) {
        lock.readLock().lock();
        try {
            return copy(store.get(new AsciiString(key)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(byte[] key, byte[] value) {
        AsciiString k = new AsciiString(key);
        byte[] v = copy(value);
        lock.writeLock().lock();
        try {
            store.put(k, v);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true if the key was present
     */
    public boolean delete(byte[] key) {
        AsciiString k = new AsciiString(key);
        lock.writeLock().lock();
        try {
            return store.remove(k) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every key.
     *
     * @return the number of keys held before clearing
     */
    public int flush() {
        lock.writeLock().lock();
        try {
            int count = store.size();
            store.clear();
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Looks up several keys in one critical section. Missing keys yield null entries, in input order.
     */
    public List<byte[]> mget(List<byte[]> keys) {
        List<AsciiString> lookup = new ArrayList<>(keys.size());
        for (byte[] key : keys) {
            lookup.add(new AsciiString(key));
        }

        List<byte[]> results = new ArrayList<>(keys.size());
        lock.readLock().lock();
        try {
            for (AsciiString k : lookup) {
                results.add(copy(store.get(k)));
            }
        } finally {
            lock.readLock().unlock();
        }
        return results;
    }

    /**
     * Writes alternating key/value arguments in one critical section.
     *
     * @return the number of pairs written
     * @throws IllegalArgumentException if the argument count is odd
     */
    public int mset(List<byte[]> keysAndValues) {
        if (keysAndValues.size() % 2 != 0) {
            throw new IllegalArgumentException("odd number of key/value arguments");
        }

        List<AsciiString> keys = new ArrayList<>(keysAndValues.size() / 2);
        List<byte[]> values = new ArrayList<>(keysAndValues.size() / 2);
        for (int i = 0; i < keysAndValues.size(); i += 2) {
            keys.add(new AsciiString(keysAndValues.get(i)));
            values.add(copy(keysAndValues.get(i + 1)));
        }

        lock.writeLock().lock();
        try {
            for (int i = 0; i < keys.size(); i++) {
                store.put(keys.get(i), values.get(i));
            }
        } finally {
            lock.writeLock().unlock();
        }
        return keys.size();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? null : bytes.clone();
    }
}
