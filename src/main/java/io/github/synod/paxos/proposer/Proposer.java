package io.github.synod.paxos.proposer;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.synod.Sequence;
import io.github.synod.paxos.ProposalNumber;
import io.github.synod.paxos.acceptor.Accept;
import io.github.synod.paxos.acceptor.Acceptor;
import io.github.synod.paxos.acceptor.Prepare;
import io.github.synod.paxos.learner.Learner;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 提案者：prepare → 选值 → accept → 通知learner。
 * prepare或accept未获得多数票时，随机等待后用更大的编号重试，超过maxAttempts次后放弃。
 *
 * @author zy
 */
public class Proposer {
    private static final Logger logger = LoggerFactory.getLogger(Proposer.class);

    @Getter
    private final int nodeId;
    private final List<Acceptor> acceptors;
    private final List<Learner> learners;
    private final Sequence<ProposalNumber> sequence;
    private final ExecutorService executorService;
    @Getter
    private final int quorum;
    private final int maxAttempts;
    private final long maxBackoffMillis;
    private final long responseTimeoutMillis;

    @Builder
    private Proposer(int nodeId,
                     @NonNull List<? extends Acceptor> acceptors,
                     @NonNull List<? extends Learner> learners,
                     @NonNull Sequence<ProposalNumber> sequence,
                     @NonNull ExecutorService executorService,
                     int maxAttempts,
                     long maxBackoffMillis,
                     long responseTimeoutMillis) {
        Preconditions.checkArgument(!acceptors.isEmpty(), "no acceptors");
        Preconditions.checkArgument(maxAttempts > 0, "maxAttempts must be positive: %s", maxAttempts);
        Preconditions.checkArgument(maxBackoffMillis >= 0, "maxBackoffMillis must not be negative: %s", maxBackoffMillis);
        Preconditions.checkArgument(responseTimeoutMillis > 0, "responseTimeoutMillis must be positive: %s",
                responseTimeoutMillis);
        this.nodeId = nodeId;
        this.acceptors = ImmutableList.copyOf(acceptors);
        this.learners = ImmutableList.copyOf(learners);
        this.sequence = sequence;
        this.executorService = executorService;
        this.quorum = quorum(acceptors.size());
        this.maxAttempts = maxAttempts;
        this.maxBackoffMillis = maxBackoffMillis;
        this.responseTimeoutMillis = responseTimeoutMillis;
    }

    public static int quorum(int size) {
        Preconditions.checkArgument(size > 0, "size must be positive: %s", size);
        return size / 2 + 1;
    }

    public Outcome propose(@NonNull byte[] candidate) {
        ProposalNumber n = ProposalNumber.NONE;
        Outcome.Phase phase = Outcome.Phase.PREPARE;
        int attempt = 0;
        try {
            while (attempt < maxAttempts) {
                attempt++;
                n = sequence.next();
                phase = Outcome.Phase.PREPARE;
                Optional<byte[]> value = prepare(n, candidate);
                if (value.isPresent()) {
                    phase = Outcome.Phase.ACCEPT;
                    if (accept(n, value.get())) {
                        logger.info("node {} committed proposal {} after {} attempt(s)", nodeId, n, attempt);
                        learn(n, value.get());
                        return Outcome.committed(n, value.get(), attempt);
                    }
                    logger.debug("accept {} rejected by quorum.", n);
                } else {
                    logger.debug("prepare {} rejected by quorum.", n);
                }
                if (attempt < maxAttempts) {
                    backoff();
                }
            }
        } catch (InterruptedException e) {
            logger.warn("node {} interrupted while proposing {}", nodeId, n);
            Thread.currentThread().interrupt();
            return Outcome.quorumFailed(phase, n, attempt);
        }
        logger.error("node {} gave up after {} attempts, last proposal {} failed in {}", nodeId, attempt, n, phase);
        return Outcome.quorumFailed(phase, n, attempt);
    }

    /**
     * 用编号n执行prepare阶段。
     *
     * @return 本轮必须提交的值：承诺的acceptor中已接受的编号最大的值，都没有接受过时为candidate；
     * 未获得多数承诺时为空
     */
    Optional<byte[]> prepare(ProposalNumber n, byte[] candidate) throws InterruptedException {
        Responses<Prepare> responses = new Responses<>(acceptors.size(), quorum);
        for (Acceptor acceptor : acceptors) {
            executorService.execute(() -> {
                try {
                    Prepare prepare = acceptor.prepare(n);
                    checkPrepare(acceptor, prepare, n);
                    if (prepare.isOk()) {
                        responses.ok(prepare);
                    } else {
                        responses.reject(prepare);
                    }
                } catch (Exception e) {
                    logger.warn("prepare {} on {} failed", n, acceptor, e);
                    responses.failed();
                }
            });
        }
        responses.await(responseTimeoutMillis);

        for (Prepare reject : responses.rejects()) {
            sequence.set(reject.getPromised());
        }
        if (!responses.reached()) {
            return Optional.empty();
        }

        Prepare highest = null;
        for (Prepare promise : responses.oks()) {
            if (!promise.hasAccepted()) {
                continue;
            }
            if (highest == null || promise.getNa().isHigherThan(highest.getNa())) {
                highest = promise;
            }
        }
        if (highest == null) {
            return Optional.of(candidate);
        }
        Preconditions.checkState(highest.getVa() != null, "promise for %s carries %s without a value", n,
                highest.getNa());
        logger.debug("proposal {} takes over the value accepted under {}", n, highest.getNa());
        return Optional.of(highest.getVa());
    }

    private void checkPrepare(Acceptor acceptor, Prepare prepare, ProposalNumber n) {
        Preconditions.checkState(Objects.equals(prepare.getN(), n),
                "%s prepare请求返回序号为%s，期望是%s", acceptor, prepare.getN(), n);
    }

    boolean accept(ProposalNumber n, byte[] value) throws InterruptedException {
        Responses<Accept> responses = new Responses<>(acceptors.size(), quorum);
        for (Acceptor acceptor : acceptors) {
            executorService.execute(() -> {
                try {
                    Accept accept = acceptor.accept(n, value);
                    checkAccept(acceptor, accept, n);
                    if (accept.isOk()) {
                        responses.ok(accept);
                    } else {
                        responses.reject(accept);
                    }
                } catch (Exception e) {
                    logger.warn("accept {} on {} failed", n, acceptor, e);
                    responses.failed();
                }
            });
        }
        responses.await(responseTimeoutMillis);

        for (Accept reject : responses.rejects()) {
            sequence.set(reject.getPromised());
        }
        return responses.reached();
    }

    private void checkAccept(Acceptor acceptor, Accept accept, ProposalNumber n) {
        Preconditions.checkState(Objects.equals(accept.getN(), n),
                "%s 返回的提案编号为%s，期望是%s", acceptor, accept.getN(), n);
    }

    void learn(ProposalNumber n, byte[] value) throws InterruptedException {
        if (learners.isEmpty()) {
            return;
        }
        Responses<Learner> responses = new Responses<>(learners.size(), learners.size());
        for (Learner learner : learners) {
            executorService.execute(() -> {
                try {
                    learner.learn(n, value);
                    responses.ok(learner);
                } catch (Exception e) {
                    logger.warn("learn {} on {} failed", n, learner, e);
                    responses.failed();
                }
            });
        }
        responses.await(responseTimeoutMillis);
    }

    private void backoff() throws InterruptedException {
        if (maxBackoffMillis == 0) {
            return;
        }
        Thread.sleep(ThreadLocalRandom.current().nextLong(maxBackoffMillis));
    }
}
