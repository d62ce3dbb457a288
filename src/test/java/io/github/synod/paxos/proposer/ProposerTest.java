package io.github.synod.paxos.proposer;

import io.github.synod.paxos.ProposalNumber;
import io.github.synod.paxos.ProposalNumberSequence;
import io.github.synod.paxos.acceptor.Accept;
import io.github.synod.paxos.acceptor.Acceptor;
import io.github.synod.paxos.acceptor.Prepare;
import io.github.synod.paxos.learner.Learner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ProposerTest {
    private Proposer proposer;
    private List<Acceptor> all = new ArrayList<>();
    private Acceptor acc1 = mock(Acceptor.class);
    private Acceptor acc2 = mock(Acceptor.class);
    private Acceptor acc3 = mock(Acceptor.class);
    private Acceptor acc4 = mock(Acceptor.class);
    private Acceptor local = mock(Acceptor.class);
    private Learner learner = mock(Learner.class);
    private ProposalNumberSequence sequence = new ProposalNumberSequence(1);
    private ExecutorService executorService = Executors.newCachedThreadPool();
    private CountDownLatch hang = new CountDownLatch(1);
    private byte[] proposal = "proposal".getBytes();

    @BeforeEach
    void setUp() {
        all.add(acc1);
        all.add(acc2);
        all.add(acc3);
        all.add(acc4);
        all.add(local);
        proposer = proposer(3);
    }

    @AfterEach
    void tearDown() {
        hang.countDown();
        executorService.shutdownNow();
    }

    private Proposer proposer(int maxAttempts) {
        return Proposer.builder()
                .nodeId(1)
                .acceptors(all)
                .learners(Collections.singletonList(learner))
                .sequence(sequence)
                .executorService(executorService)
                .maxAttempts(maxAttempts)
                .maxBackoffMillis(10)
                .responseTimeoutMillis(200)
                .build();
    }

    private void promise(Acceptor acceptor) throws Exception {
        when(acceptor.prepare(any())).thenAnswer((ctx) -> {
            ProposalNumber n = ctx.getArgument(0);
            return Prepare.ok(n, ProposalNumber.NONE, null);
        });
    }

    private void promise(Acceptor acceptor, ProposalNumber na, byte[] va) throws Exception {
        when(acceptor.prepare(any())).thenAnswer((ctx) -> {
            ProposalNumber n = ctx.getArgument(0);
            return Prepare.ok(n, na, va);
        });
    }

    private void rejectPrepare(Acceptor acceptor, ProposalNumber promised) throws Exception {
        when(acceptor.prepare(any())).thenAnswer((ctx) -> Prepare.reject(ctx.getArgument(0), promised));
    }

    private void ack(Acceptor acceptor) throws Exception {
        when(acceptor.accept(any(), any())).thenAnswer((ctx) -> Accept.ok(ctx.getArgument(0), ctx.getArgument(1)));
    }

    private void rejectAccept(Acceptor acceptor, ProposalNumber promised) throws Exception {
        when(acceptor.accept(any(), any())).thenAnswer((ctx) -> Accept.reject(ctx.getArgument(0), promised));
    }

    private void hangPrepare(Acceptor acceptor) throws Exception {
        when(acceptor.prepare(any())).thenAnswer((ctx) -> {
            hang.await();
            return Prepare.ok(ctx.getArgument(0), ProposalNumber.NONE, null);
        });
    }

    @Test
    void quorum() {
        assertEquals(1, Proposer.quorum(1));
        assertEquals(2, Proposer.quorum(2));
        assertEquals(2, Proposer.quorum(3));
        assertEquals(3, Proposer.quorum(4));
        assertEquals(3, Proposer.quorum(5));
        assertEquals(4, Proposer.quorum(7));
        assertEquals(51, Proposer.quorum(100));
        assertThrows(IllegalArgumentException.class, () -> Proposer.quorum(0));
        assertEquals(3, proposer.getQuorum());
    }

    @Test
    void propose() throws Exception {
        for (Acceptor acc : all) {
            promise(acc);
            ack(acc);
        }

        Outcome outcome = proposer.propose(proposal);

        assertTrue(outcome.isCommitted());
        assertEquals(ProposalNumber.of(1, 1), outcome.getN());
        assertEquals(1, outcome.getAttempts());
        assertArrayEquals(proposal, ((Outcome.Committed) outcome).getValue());
        for (Acceptor acceptor : all) {
            verify(acceptor, timeout(1000).times(1)).prepare(ProposalNumber.of(1, 1));
        }
        verify(learner).learn(eq(ProposalNumber.of(1, 1)), eq(proposal));
    }

    @Test
    void prepareRejectedByMajority() throws Exception {
        ProposalNumber promised = ProposalNumber.of(7, 2);
        rejectPrepare(acc1, promised);
        rejectPrepare(acc2, promised);
        rejectPrepare(acc3, promised);
        promise(acc4);
        promise(local);

        assertFalse(proposer.prepare(sequence.next(), proposal).isPresent());
        assertTrue(sequence.next().isHigherThan(promised));
    }

    @Test
    void prepareRejectedBySomeone() throws Exception {
        rejectPrepare(acc1, ProposalNumber.of(1, 2));
        rejectPrepare(acc2, ProposalNumber.of(1, 2));
        promise(acc3);
        promise(acc4);
        promise(local);

        Optional<byte[]> value = proposer.prepare(sequence.next(), proposal);
        assertTrue(value.isPresent());
        assertArrayEquals(proposal, value.get());
    }

    @Test
    void prepareReturnedWithAcceptedValue() throws Exception {
        sequence.set(ProposalNumber.of(4, 1));
        ProposalNumber n = sequence.next();
        rejectPrepare(acc1, ProposalNumber.of(6, 2));
        rejectPrepare(acc2, ProposalNumber.of(6, 2));
        promise(acc3, ProposalNumber.of(2, 3), "older proposal".getBytes());
        promise(acc4);
        byte[] va = "another proposal".getBytes();
        promise(local, ProposalNumber.of(3, 2), va);

        Optional<byte[]> value = proposer.prepare(n, proposal);
        assertTrue(value.isPresent());
        assertArrayEquals(va, value.get());
    }

    @Test
    void proposeCommitsPreviouslyAcceptedValue() throws Exception {
        byte[] va = "chosen".getBytes();
        for (Acceptor acc : all) {
            promise(acc, ProposalNumber.of(1, 5), va);
            ack(acc);
        }

        Outcome outcome = proposer.propose(proposal);

        assertTrue(outcome.isCommitted());
        assertArrayEquals(va, ((Outcome.Committed) outcome).getValue());
        verify(acc1, timeout(1000)).accept(any(), eq(va));
        verify(acc1, never()).accept(any(), eq(proposal));
    }

    @Test
    void acceptRejectedByMajority() throws Exception {
        ProposalNumber n = sequence.next();
        rejectAccept(acc1, ProposalNumber.of(9, 3));
        rejectAccept(acc2, ProposalNumber.of(9, 3));
        rejectAccept(acc3, ProposalNumber.of(9, 3));
        ack(acc4);
        ack(local);

        assertFalse(proposer.accept(n, proposal));
        assertEquals(ProposalNumber.of(10, 1), sequence.next());
    }

    @Test
    void acceptRejectedBySomeone() throws Exception {
        ProposalNumber n = sequence.next();
        rejectAccept(acc1, ProposalNumber.of(9, 3));
        rejectAccept(acc2, ProposalNumber.of(9, 3));
        ack(acc3);
        ack(acc4);
        ack(local);

        assertTrue(proposer.accept(n, proposal));
    }

    @Test
    void retryWithHigherNumber() throws Exception {
        ProposalNumber promised = ProposalNumber.of(10, 4);
        for (Acceptor acc : all) {
            when(acc.prepare(any())).thenAnswer((ctx) -> {
                ProposalNumber n = ctx.getArgument(0);
                if (n.isHigherThan(promised)) {
                    return Prepare.ok(n, ProposalNumber.NONE, null);
                }
                return Prepare.reject(n, promised);
            });
            ack(acc);
        }

        Outcome outcome = proposer.propose(proposal);

        assertTrue(outcome.isCommitted());
        assertEquals(2, outcome.getAttempts());
        assertEquals(ProposalNumber.of(11, 1), outcome.getN());
    }

    @Test
    void giveUpAfterMaxAttempts() throws Exception {
        for (Acceptor acc : all) {
            rejectPrepare(acc, ProposalNumber.of(100, 2));
        }

        Outcome outcome = proposer.propose(proposal);

        assertFalse(outcome.isCommitted());
        assertEquals(Outcome.Phase.PREPARE, ((Outcome.QuorumFailed) outcome).getPhase());
        assertEquals(3, outcome.getAttempts());
        for (Acceptor acc : all) {
            verify(acc, timeout(1000).times(3)).prepare(any());
            verify(acc, never()).accept(any(), any());
        }
        verify(learner, never()).learn(any(), any());
    }

    @Test
    void giveUpInAcceptPhase() throws Exception {
        for (Acceptor acc : all) {
            promise(acc);
            rejectAccept(acc, ProposalNumber.of(100, 2));
        }

        Outcome outcome = proposer(2).propose(proposal);

        assertFalse(outcome.isCommitted());
        assertEquals(Outcome.Phase.ACCEPT, ((Outcome.QuorumFailed) outcome).getPhase());
        assertEquals(2, outcome.getAttempts());
    }

    @Test
    void toleratesSilentAcceptors() throws Exception {
        hangPrepare(acc1);
        hangPrepare(acc2);
        promise(acc3);
        promise(acc4);
        promise(local);
        for (Acceptor acc : all) {
            ack(acc);
        }

        Outcome outcome = proposer.propose(proposal);

        assertTrue(outcome.isCommitted());
        assertEquals(1, outcome.getAttempts());
    }

    @Test
    void toleratesFailingAcceptors() throws Exception {
        when(acc1.prepare(any())).thenThrow(new IOException("connection refused"));
        when(acc2.prepare(any())).thenAnswer((ctx) -> Prepare.ok(ProposalNumber.of(99, 9), ProposalNumber.NONE, null));
        promise(acc3);
        promise(acc4);
        promise(local);
        for (Acceptor acc : all) {
            ack(acc);
        }

        assertTrue(proposer.propose(proposal).isCommitted());
    }

    @Test
    void noQuorumWhenMajoritySilent() throws Exception {
        hangPrepare(acc1);
        hangPrepare(acc2);
        hangPrepare(acc3);
        promise(acc4);
        promise(local);

        Outcome outcome = proposer(1).propose(proposal);

        assertFalse(outcome.isCommitted());
        assertEquals(Outcome.Phase.PREPARE, ((Outcome.QuorumFailed) outcome).getPhase());
        verify(acc4, never()).accept(any(), any());
    }

    @Test
    void learnerFailureDoesNotUndoCommit() throws Exception {
        for (Acceptor acc : all) {
            promise(acc);
            ack(acc);
        }
        doThrow(new IOException("learner down")).when(learner).learn(any(), any());

        assertTrue(proposer.propose(proposal).isCommitted());
    }

    @Test
    void invalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> Proposer.builder()
                .acceptors(Collections.emptyList())
                .learners(Collections.emptyList())
                .sequence(sequence)
                .executorService(executorService)
                .maxAttempts(1)
                .responseTimeoutMillis(100)
                .build());
        assertThrows(IllegalArgumentException.class, () -> Proposer.builder()
                .acceptors(all)
                .learners(Collections.emptyList())
                .sequence(sequence)
                .executorService(executorService)
                .maxAttempts(0)
                .responseTimeoutMillis(100)
                .build());
    }
}
