package io.github.synod.paxos.acceptor;

import io.github.synod.paxos.ProposalNumber;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@ToString
public class Accept {
    @Getter
    private final boolean ok;
    @Getter
    private final ProposalNumber n;
    private final byte[] value;
    @Getter
    private final ProposalNumber promised;

    private Accept(boolean ok, ProposalNumber n, byte[] value, ProposalNumber promised) {
        this.ok = ok;
        this.n = n;
        this.value = value;
        this.promised = promised;
    }

    public static Accept ok(@NonNull ProposalNumber n, @NonNull byte[] value) {
        return new Accept(true, n, value.clone(), n);
    }

    public static Accept reject(@NonNull ProposalNumber n, @NonNull ProposalNumber promised) {
        return new Accept(false, n, null, promised);
    }

    public byte[] getValue() {
        return value == null ? null : value.clone();
    }
}
