package io.github.synod.paxos.acceptor;

import com.google.common.base.Preconditions;
import io.github.synod.Persistence;
import io.github.synod.paxos.ProposalNumber;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.ExecutionException;

/**
 * 本节点的接受者，持有(np, na, va)三元组。
 * 所有请求在同一把锁内串行处理，状态先写入持久化再修改内存，最后返回结果。
 *
 * @author zy
 */
public class LocalAcceptor implements Acceptor {
    private static final Logger logger = LoggerFactory.getLogger(LocalAcceptor.class);

    @Getter
    private final int nodeId;
    private final Persistence persistence;
    private final byte[] key;
    private ProposalNumber np = ProposalNumber.NONE;
    private ProposalNumber na = ProposalNumber.NONE;
    private byte[] va;

    @Builder
    private LocalAcceptor(int nodeId, @NonNull Persistence persistence) throws IOException, ExecutionException {
        this.nodeId = nodeId;
        this.persistence = persistence;
        this.key = (nodeId + "acceptor").getBytes(StandardCharsets.UTF_8);
        regain();
    }

    @Override
    public synchronized Prepare prepare(@NonNull ProposalNumber n) throws IOException, ExecutionException {
        if (n.isHigherThan(np)) {
            persistence(n, na, va);
            np = n;
            logger.debug("acceptor {} promised {}, accepted {}", nodeId, n, na);
            return Prepare.ok(n, na, va);
        }
        logger.debug("acceptor {} rejected prepare {}, already promised {}", nodeId, n, np);
        return Prepare.reject(n, np);
    }

    @Override
    public synchronized Accept accept(@NonNull ProposalNumber n, @NonNull byte[] value) throws IOException, ExecutionException {
        if (n.compareTo(np) >= 0) {
            byte[] v = value.clone();
            persistence(n, n, v);
            np = n;
            na = n;
            va = v;
            logger.debug("acceptor {} accepted {}", nodeId, n);
            return Accept.ok(n, v);
        }
        logger.debug("acceptor {} rejected accept {}, already promised {}", nodeId, n, np);
        return Accept.reject(n, np);
    }

    public synchronized ProposalNumber getNp() {
        return np;
    }

    public synchronized ProposalNumber getNa() {
        return na;
    }

    public synchronized byte[] getVa() {
        return va == null ? null : va.clone();
    }

    private void persistence(ProposalNumber np, ProposalNumber na, byte[] va) throws IOException, ExecutionException {
        int length = ProposalNumber.BYTES * 2 + (va == null ? 0 : va.length);
        ByteBuffer buffer = ByteBuffer.allocate(length)
                .put(np.toBytes())
                .put(na.toBytes());
        if (va != null) {
            buffer.put(va);
        }
        persistence.put(key, buffer.array());
    }

    private void regain() throws IOException, ExecutionException {
        byte[] bytes = persistence.get(key);
        if (bytes == null) {
            return;
        }
        Preconditions.checkState(bytes.length >= ProposalNumber.BYTES * 2,
                "corrupted state of acceptor %s: %s bytes", nodeId, bytes.length);
        np = ProposalNumber.fromBytes(bytes, 0);
        na = ProposalNumber.fromBytes(bytes, ProposalNumber.BYTES);
        va = na.isNone() ? null : Arrays.copyOfRange(bytes, ProposalNumber.BYTES * 2, bytes.length);
        logger.info("acceptor {} regained state, promised {}, accepted {}", nodeId, np, na);
    }

    @Override
    public String toString() {
        return "LocalAcceptor(" + nodeId + ")";
    }
}
