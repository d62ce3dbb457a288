package io.github.synod.paxos.learner;

import io.github.synod.paxos.Decision;
import io.github.synod.paxos.ProposalNumber;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 记录最新的决议。编号不大于已记录编号的通知会被忽略，重复或乱序的消息不会让决议回退。
 */
public class LocalLearner implements Learner {
    private static final Logger logger = LoggerFactory.getLogger(LocalLearner.class);

    @Getter
    private final int nodeId;
    private Decision decision;

    public LocalLearner(int nodeId) {
        this.nodeId = nodeId;
    }

    @Override
    public synchronized void learn(@NonNull ProposalNumber n, @NonNull byte[] value) {
        if (decision != null && !n.isHigherThan(decision.getN())) {
            logger.debug("learner {} ignored {}, already learned {}", nodeId, n, decision.getN());
            return;
        }
        decision = new Decision(n, value);
        logger.info("learner {} learned {}", nodeId, n);
    }

    public synchronized Optional<Decision> decision() {
        return Optional.ofNullable(decision);
    }

    @Override
    public String toString() {
        return "LocalLearner(" + nodeId + ")";
    }
}
