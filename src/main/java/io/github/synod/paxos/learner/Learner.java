package io.github.synod.paxos.learner;

import io.github.synod.paxos.ProposalNumber;

/**
 * @author zy
 */
public interface Learner {
    void learn(ProposalNumber n, byte[] value) throws Exception;
}
