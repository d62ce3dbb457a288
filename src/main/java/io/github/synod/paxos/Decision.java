package io.github.synod.paxos;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 被多数acceptor接受的值，以及提交它的提案编号。
 */
@ToString
@EqualsAndHashCode
public class Decision {
    @Getter
    private final ProposalNumber n;
    private final byte[] value;

    public Decision(@NonNull ProposalNumber n, @NonNull byte[] value) {
        this.n = n;
        this.value = value.clone();
    }

    public byte[] getValue() {
        return value.clone();
    }
}
