package io.github.synod.paxos.proposer;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 收集一轮请求的应答。收到quorum个成功应答，或者所有节点都已应答时，等待结束。
 */
class Responses<R> {
    private static final Logger logger = LoggerFactory.getLogger(Responses.class);

    private final int total;
    private final int quorum;
    private final List<R> oks = new ArrayList<>();
    private final List<R> rejects = new ArrayList<>();
    private final CountDownLatch enough = new CountDownLatch(1);
    private int replied;

    Responses(int total, int quorum) {
        Preconditions.checkArgument(total > 0, "nothing to wait for");
        Preconditions.checkArgument(quorum > 0 && quorum <= total, "quorum %s out of range for %s", quorum, total);
        this.total = total;
        this.quorum = quorum;
    }

    synchronized void ok(R response) {
        oks.add(response);
        countReply();
    }

    synchronized void reject(R response) {
        rejects.add(response);
        countReply();
    }

    synchronized void failed() {
        countReply();
    }

    private void countReply() {
        replied++;
        if (oks.size() >= quorum || replied >= total) {
            enough.countDown();
        }
    }

    /**
     * 超时后仍未到达的应答视为没有应答。
     */
    void await(long timeoutMillis) throws InterruptedException {
        if (!enough.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
            logger.warn("{} of {} responses arrived within {}ms", replied(), total, timeoutMillis);
        }
    }

    synchronized int replied() {
        return replied;
    }

    synchronized boolean reached() {
        return oks.size() >= quorum;
    }

    synchronized List<R> oks() {
        return ImmutableList.copyOf(oks);
    }

    synchronized List<R> rejects() {
        return ImmutableList.copyOf(rejects);
    }
}
