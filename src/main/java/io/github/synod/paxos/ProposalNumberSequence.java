package io.github.synod.paxos;

import io.github.synod.Sequence;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个节点的提案编号序列，counter从1开始单调递增，nodeId用于区分不同节点。
 */
public class ProposalNumberSequence implements Sequence<ProposalNumber> {
    @Getter
    private final int nodeId;
    private final AtomicLong counter = new AtomicLong();

    public ProposalNumberSequence(int nodeId) {
        this.nodeId = nodeId;
    }

    @Override
    public ProposalNumber next() {
        return ProposalNumber.of(counter.incrementAndGet(), nodeId);
    }

    @Override
    public void set(ProposalNumber n) {
        if (n.isNone()) {
            return;
        }
        counter.accumulateAndGet(n.getCounter(), Math::max);
    }

    @Override
    public ProposalNumber current() {
        long c = counter.get();
        return c == 0 ? ProposalNumber.NONE : ProposalNumber.of(c, nodeId);
    }
}
