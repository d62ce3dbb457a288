package io.github.synod;

import org.iq80.leveldb.DB;
import org.iq80.leveldb.Options;
import org.iq80.leveldb.WriteOptions;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import static org.iq80.leveldb.impl.Iq80DBFactory.factory;

/**
 * @author zy
 **/
public class LevelDB implements Persistence, Closeable {
    private final DB db;
    private final WriteOptions writeOptions = new WriteOptions().sync(true);

    public static LevelDB open(Path path) throws IOException {
        Options options = new Options();
        options.createIfMissing(true);
        DB db = factory.open(new File(path.toString()), options);
        return new LevelDB(db);
    }

    public LevelDB(DB db) {
        this.db = db;
    }

    @Override
    public void put(byte[] key, byte[] value) {
        db.put(key, value, writeOptions);
    }

    @Override
    public byte[] get(byte[] key) {
        return db.get(key);
    }

    @Override
    public boolean del(byte[] key) {
        boolean exists = db.get(key) != null;
        db.delete(key, writeOptions);
        return exists;
    }

    @Override
    public void close() throws IOException {
        db.close();
    }
}
