package io.github.synod.paxos;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.synod.MemoryPersistence;
import io.github.synod.Persistence;
import io.github.synod.paxos.acceptor.LocalAcceptor;
import io.github.synod.paxos.learner.LocalLearner;
import io.github.synod.paxos.proposer.Outcome;
import io.github.synod.paxos.proposer.Proposer;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 固定成员的集群：节点1..numAcceptors既是acceptor也可以作为proposer，
 * 之后的numLearners个节点只作为learner。
 * 集群只负责选择proposer并驱动一轮提案，从不直接修改节点的状态。
 *
 * @author zy
 */
public class Cluster {
    private static final Logger logger = LoggerFactory.getLogger(Cluster.class);

    @Getter
    private final List<Node> nodes;
    @Getter
    private final List<LocalLearner> learners;
    private final Map<Integer, Node> nodesById;
    private final List<Integer> nodeIds;
    private final List<LocalAcceptor> acceptors;
    @Getter
    private final ClusterConf conf;
    private final Persistence persistence;
    private final ExecutorService executorService;
    private final boolean ownExecutor;
    private final ExecutorService roundExecutor;
    private final AtomicInteger rounds = new AtomicInteger();
    private volatile boolean closed = false;

    @Builder
    private Cluster(int numAcceptors, int numLearners, ClusterConf conf, Persistence persistence)
            throws IOException, ExecutionException {
        Preconditions.checkArgument(numAcceptors > 0, "numAcceptors must be positive: %s", numAcceptors);
        Preconditions.checkArgument(numLearners >= 0, "numLearners must not be negative: %s", numLearners);
        this.conf = conf == null ? ClusterConf.builder().build() : conf;
        this.persistence = persistence == null ? new MemoryPersistence() : persistence;
        this.ownExecutor = this.conf.getExecutorService() == null;
        this.executorService = ownExecutor ? cachedPool("synod-%d") : this.conf.getExecutorService();
        // 整轮提案阻塞等待应答，不能与发往acceptor的请求共用一个线程池
        this.roundExecutor = cachedPool("synod-round-%d");

        ImmutableList.Builder<Node> nodes = ImmutableList.builder();
        for (int id = 1; id <= numAcceptors; id++) {
            LocalAcceptor acceptor = LocalAcceptor.builder().nodeId(id).persistence(this.persistence).build();
            nodes.add(new Node(id, acceptor, new ProposalNumberSequence(id)));
        }
        this.nodes = nodes.build();

        ImmutableList.Builder<LocalLearner> learners = ImmutableList.builder();
        for (int id = numAcceptors + 1; id <= numAcceptors + numLearners; id++) {
            learners.add(new LocalLearner(id));
        }
        this.learners = learners.build();

        ImmutableMap.Builder<Integer, Node> byId = ImmutableMap.builder();
        ImmutableList.Builder<Integer> ids = ImmutableList.builder();
        ImmutableList.Builder<LocalAcceptor> acceptors = ImmutableList.builder();
        for (Node node : this.nodes) {
            byId.put(node.getNodeId(), node);
            ids.add(node.getNodeId());
            acceptors.add(node.getAcceptor());
        }
        this.nodesById = byId.build();
        this.nodeIds = ids.build();
        this.acceptors = acceptors.build();
        logger.info("cluster created with {} acceptors and {} learners, quorum {}", numAcceptors, numLearners, quorum());
    }

    private static ExecutorService cachedPool(String nameFormat) {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat(nameFormat)
                .setDaemon(true)
                .build());
    }

    public static Cluster newCluster(int numAcceptors, int numLearners) throws IOException, ExecutionException {
        return Cluster.builder().numAcceptors(numAcceptors).numLearners(numLearners).build();
    }

    public static int quorum(int totalNodes) {
        return Proposer.quorum(totalNodes);
    }

    public int quorum() {
        return quorum(nodes.size());
    }

    /**
     * 由配置的{@link ProposerSelector}选出proposer，执行一轮提案。
     */
    public Outcome runRound(@NonNull byte[] candidate) {
        int proposerId = conf.getProposerSelector().select(nodeIds, rounds.get());
        return runRound(proposerId, candidate);
    }

    public Outcome runRound(int proposerId, @NonNull byte[] candidate) {
        Preconditions.checkState(!closed, "cluster already shut down");
        Node node = proposer(proposerId);
        int round = rounds.incrementAndGet();
        logger.info("round {} proposed by node {}", round, proposerId);
        Proposer proposer = Proposer.builder()
                .nodeId(node.getNodeId())
                .acceptors(acceptors)
                .learners(learners)
                .sequence(node.getSequence())
                .executorService(executorService)
                .maxAttempts(conf.getMaxAttempts())
                .maxBackoffMillis(conf.getMaxBackoffMillis())
                .responseTimeoutMillis(conf.getResponseTimeoutMillis())
                .build();
        Outcome outcome = proposer.propose(candidate);
        logger.info("round {} finished: {}", round, outcome);
        return outcome;
    }

    public CompletableFuture<Outcome> submitRound(int proposerId, @NonNull byte[] candidate) {
        Preconditions.checkState(!closed, "cluster already shut down");
        proposer(proposerId);
        return CompletableFuture.supplyAsync(() -> runRound(proposerId, candidate), roundExecutor);
    }

    /**
     * @return 所有learner已知的、提案编号最大的决议
     */
    public Optional<Decision> decision() {
        return learners.stream()
                .map(LocalLearner::decision)
                .flatMap(Optional::stream)
                .max(Comparator.comparing(Decision::getN));
    }

    public Node node(int nodeId) {
        Node node = nodesById.get(nodeId);
        Preconditions.checkArgument(node != null, "unknown node %s", nodeId);
        return node;
    }

    public LocalLearner learner(int nodeId) {
        return learners.stream()
                .filter(l -> l.getNodeId() == nodeId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("node " + nodeId + " is not a learner"));
    }

    private Node proposer(int proposerId) {
        Preconditions.checkArgument(learners.stream().noneMatch(l -> l.getNodeId() == proposerId),
                "node %s is a learner and can't propose", proposerId);
        return node(proposerId);
    }

    public void shutdown() throws IOException {
        closed = true;
        MoreExecutors.shutdownAndAwaitTermination(roundExecutor, 5, TimeUnit.SECONDS);
        if (ownExecutor) {
            MoreExecutors.shutdownAndAwaitTermination(executorService, 5, TimeUnit.SECONDS);
        }
        if (persistence instanceof Closeable) {
            ((Closeable) persistence).close();
        }
        logger.info("cluster shut down after {} rounds", rounds.get());
    }
}
