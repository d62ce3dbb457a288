package io.github.synod.paxos;

import io.github.synod.Sequence;
import io.github.synod.paxos.acceptor.LocalAcceptor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 可以作为acceptor的节点：通过{@link LocalAcceptor}应答prepare/accept，
 * 被选为proposer时用自己的{@link Sequence}生成提案编号。
 */
@ToString(of = "nodeId")
public class Node {
    @Getter
    private final int nodeId;
    @Getter
    private final LocalAcceptor acceptor;
    @Getter
    private final Sequence<ProposalNumber> sequence;

    Node(int nodeId, @NonNull LocalAcceptor acceptor, @NonNull Sequence<ProposalNumber> sequence) {
        this.nodeId = nodeId;
        this.acceptor = acceptor;
        this.sequence = sequence;
    }
}
