package io.github.synod.paxos.acceptor;

import io.github.synod.paxos.ProposalNumber;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * prepare请求的应答。承诺时带上已接受的(na, va)，尚未接受过时为{@link ProposalNumber#NONE}和null；
 * 拒绝时带上acceptor已承诺的编号。
 */
@ToString
public class Prepare {
    @Getter
    private final boolean ok;
    @Getter
    private final ProposalNumber n;
    @Getter
    private final ProposalNumber na;
    private final byte[] va;
    @Getter
    private final ProposalNumber promised;

    private Prepare(boolean ok, ProposalNumber n, ProposalNumber na, byte[] va, ProposalNumber promised) {
        this.ok = ok;
        this.n = n;
        this.na = na;
        this.va = va;
        this.promised = promised;
    }

    public static Prepare ok(@NonNull ProposalNumber n, @NonNull ProposalNumber na, byte[] va) {
        return new Prepare(true, n, na, va == null ? null : va.clone(), n);
    }

    public static Prepare reject(@NonNull ProposalNumber n, @NonNull ProposalNumber promised) {
        return new Prepare(false, n, ProposalNumber.NONE, null, promised);
    }

    public boolean hasAccepted() {
        return ok && !na.isNone();
    }

    public byte[] getVa() {
        return va == null ? null : va.clone();
    }
}
