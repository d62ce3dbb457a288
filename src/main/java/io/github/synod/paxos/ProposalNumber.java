package io.github.synod.paxos;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.nio.ByteBuffer;

/**
 * 提案编号：(counter, nodeId)，先比较counter，相同时比较nodeId。
 * 不同节点生成的编号永远不会相等。
 *
 * @author zy
 */
@EqualsAndHashCode
public final class ProposalNumber implements Comparable<ProposalNumber>, Serializable {
    static final long serialVersionUID = 42L;

    public static final int BYTES = Longs.BYTES + Ints.BYTES;

    /**
     * 比任何节点生成的编号都小。
     */
    public static final ProposalNumber NONE = new ProposalNumber(-1, -1);

    @Getter
    private final long counter;
    @Getter
    private final int nodeId;

    private ProposalNumber(long counter, int nodeId) {
        this.counter = counter;
        this.nodeId = nodeId;
    }

    public static ProposalNumber of(long counter, int nodeId) {
        Preconditions.checkArgument(counter > 0, "counter must be positive: %s", counter);
        Preconditions.checkArgument(nodeId >= 0, "nodeId must not be negative: %s", nodeId);
        return new ProposalNumber(counter, nodeId);
    }

    public boolean isNone() {
        return this.equals(NONE);
    }

    public boolean isHigherThan(ProposalNumber other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(ProposalNumber o) {
        int c = Long.compare(counter, o.counter);
        if (c != 0) {
            return c;
        }
        return Integer.compare(nodeId, o.nodeId);
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES).putLong(counter).putInt(nodeId).array();
    }

    public static ProposalNumber fromBytes(byte[] bytes, int offset) {
        Preconditions.checkArgument(bytes.length - offset >= BYTES, "not enough bytes for a proposal number");
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, BYTES);
        long counter = buffer.getLong();
        int nodeId = buffer.getInt();
        if (counter == NONE.counter && nodeId == NONE.nodeId) {
            return NONE;
        }
        return of(counter, nodeId);
    }

    @Override
    public String toString() {
        return isNone() ? "none" : counter + "." + nodeId;
    }
}
