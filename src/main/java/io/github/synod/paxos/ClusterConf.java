package io.github.synod.paxos;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.ExecutorService;

/**
 * @author zy
 */
@Builder
@ToString
public class ClusterConf {
    public static final int DEFAULT_MAX_ATTEMPTS = 7;
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 300;
    public static final long DEFAULT_RESPONSE_TIMEOUT_MILLIS = 1000;

    /**
     * 每轮最多尝试prepare/accept的次数，超过后返回QuorumFailed。
     */
    @Builder.Default
    @Getter
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Builder.Default
    @Getter
    private long maxBackoffMillis = DEFAULT_MAX_BACKOFF_MILLIS;

    @Builder.Default
    @Getter
    private long responseTimeoutMillis = DEFAULT_RESPONSE_TIMEOUT_MILLIS;

    /**
     * 向acceptor和learner发送请求的线程池，为空时由集群自己创建。整轮提案在集群内部的线程池上执行。
     */
    @Getter
    private ExecutorService executorService;

    @Builder.Default
    @Getter
    private ProposerSelector proposerSelector = ProposerSelector.roundRobin();

    public static ClusterConf fromSystemProperties() {
        return ClusterConf.builder()
                .maxAttempts(Integer.getInteger("synod.maxAttempts", DEFAULT_MAX_ATTEMPTS))
                .maxBackoffMillis(Long.getLong("synod.maxBackoffMillis", DEFAULT_MAX_BACKOFF_MILLIS))
                .responseTimeoutMillis(Long.getLong("synod.responseTimeoutMillis", DEFAULT_RESPONSE_TIMEOUT_MILLIS))
                .build();
    }
}
