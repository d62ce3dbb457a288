package io.github.synod.paxos.acceptor;

import io.github.synod.paxos.ProposalNumber;

/**
 * 接受者。拒绝是正常的返回值而不是异常；抛出的异常只表示调用本身失败（网络、存储等）。
 *
 * @author zy
 */
public interface Acceptor {
    Prepare prepare(ProposalNumber n) throws Exception;

    Accept accept(ProposalNumber n, byte[] value) throws Exception;
}
