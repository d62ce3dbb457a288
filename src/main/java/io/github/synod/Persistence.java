package io.github.synod;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

/**
 * @author zy
 */
public interface Persistence {
    void put(byte[] key, byte[] value) throws IOException, ExecutionException;

    byte[] get(byte[] key) throws IOException, ExecutionException;

    boolean del(byte[] key) throws IOException, ExecutionException;
}
