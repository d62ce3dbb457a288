package io.github.synod.paxos.proposer;

import io.github.synod.paxos.ProposalNumber;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 一轮提案的结果：已提交的值，或者重试次数用完仍未获得多数票。
 */
@ToString
@EqualsAndHashCode
public abstract class Outcome {
    public enum Phase {
        PREPARE,
        ACCEPT
    }

    @Getter
    private final ProposalNumber n;
    @Getter
    private final int attempts;

    private Outcome(ProposalNumber n, int attempts) {
        this.n = n;
        this.attempts = attempts;
    }

    public abstract boolean isCommitted();

    public static Committed committed(ProposalNumber n, byte[] value, int attempts) {
        return new Committed(n, value, attempts);
    }

    public static QuorumFailed quorumFailed(Phase phase, ProposalNumber n, int attempts) {
        return new QuorumFailed(phase, n, attempts);
    }

    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Committed extends Outcome {
        private final byte[] value;

        private Committed(ProposalNumber n, byte[] value, int attempts) {
            super(n, attempts);
            this.value = value.clone();
        }

        public byte[] getValue() {
            return value.clone();
        }

        @Override
        public boolean isCommitted() {
            return true;
        }
    }

    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class QuorumFailed extends Outcome {
        @Getter
        private final Phase phase;

        private QuorumFailed(Phase phase, ProposalNumber n, int attempts) {
            super(n, attempts);
            this.phase = phase;
        }

        @Override
        public boolean isCommitted() {
            return false;
        }
    }
}
