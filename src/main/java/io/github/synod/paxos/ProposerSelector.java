package io.github.synod.paxos;

import com.google.common.base.Preconditions;
import lombok.NonNull;

import java.util.List;
import java.util.Random;

/**
 * 选择每一轮由哪个acceptor节点担任proposer。
 */
@FunctionalInterface
public interface ProposerSelector {
    int select(List<Integer> nodeIds, int round);

    static ProposerSelector fixed(int nodeId) {
        return (nodeIds, round) -> {
            Preconditions.checkArgument(nodeIds.contains(nodeId), "node %s can't propose", nodeId);
            return nodeId;
        };
    }

    static ProposerSelector roundRobin() {
        return (nodeIds, round) -> nodeIds.get(Math.floorMod(round, nodeIds.size()));
    }

    static ProposerSelector random(@NonNull Random random) {
        return (nodeIds, round) -> nodeIds.get(random.nextInt(nodeIds.size()));
    }
}
