package io.github.synod;

import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的持久化实现，进程退出后数据丢失。
 */
public class MemoryPersistence implements Persistence {
    private final ConcurrentHashMap<ByteBuffer, byte[]> map = new ConcurrentHashMap<>();

    @Override
    public void put(byte[] key, byte[] value) {
        map.put(wrap(key), value.clone());
    }

    @Override
    public byte[] get(byte[] key) {
        byte[] value = map.get(wrap(key));
        return value == null ? null : value.clone();
    }

    @Override
    public boolean del(byte[] key) {
        return map.remove(wrap(key)) != null;
    }

    private ByteBuffer wrap(byte[] key) {
        return ByteBuffer.wrap(key.clone());
    }
}
