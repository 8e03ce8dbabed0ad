package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.config.GlobalRetryConfig;
import com.purchasingpower.docqa.configuration.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Orders the commits of concurrent question runs within one conversation.
 *
 * A run takes a ticket when it starts. Retrieval and generation run freely in
 * parallel; only the final commit waits until every earlier ticket of the same
 * conversation is finished, so messages land in arrival order. Conversations
 * never wait on each other.
 *
 * The wait is never shorter than one run's provider retry budget, so an earlier
 * run that is slow but still retrying cannot time out the runs queued behind it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationSequencer {

    private final AppProperties appProperties;
    private final GlobalRetryConfig retryConfig;

    private final Lock lock = new ReentrantLock();
    private final Condition turnAdvanced = lock.newCondition();
    private final Map<String, Lane> lanes = new HashMap<>();

    /**
     * Take the next ticket of a conversation. Must be closed in a finally block.
     */
    public Ticket issue(String conversationId) {
        lock.lock();
        try {
            Lane lane = lanes.computeIfAbsent(conversationId, id -> new Lane());
            return new Ticket(conversationId, lane.nextTicket++);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until all earlier tickets are finished, run the action, then finish this ticket.
     *
     * @throws IllegalStateException if earlier runs do not finish within the commit timeout
     */
    public <T> T runInTurn(Ticket ticket, Supplier<T> action) {
        try {
            awaitTurn(ticket);
            return action.get();
        } finally {
            ticket.close();
        }
    }

    /**
     * Effective commit wait: the configured timeout, raised to one run's provider retry budget.
     */
    public long commitWaitMs() {
        return Math.max(appProperties.getConcurrency().getCommitWaitTimeoutMs(), retryConfig.runBudgetMs());
    }

    private void awaitTurn(Ticket ticket) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(commitWaitMs());
        lock.lock();
        try {
            Lane lane = lanes.get(ticket.conversationId);
            while (lane != null && lane.serving != ticket.number) {
                if (remaining <= 0) {
                    throw new IllegalStateException("Timed out waiting for earlier answers in conversation "
                            + ticket.conversationId);
                }
                remaining = turnAdvanced.awaitNanos(remaining);
                lane = lanes.get(ticket.conversationId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to commit in conversation "
                    + ticket.conversationId, e);
        } finally {
            lock.unlock();
        }
    }

    private void finish(Ticket ticket) {
        lock.lock();
        try {
            Lane lane = lanes.get(ticket.conversationId);
            if (lane == null) {
                return;
            }
            lane.finished.add(ticket.number);
            while (lane.finished.remove(lane.serving)) {
                lane.serving++;
            }
            if (lane.serving == lane.nextTicket) {
                lanes.remove(ticket.conversationId);
            }
            turnAdvanced.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of conversations with unfinished runs.
     */
    public int activeConversations() {
        lock.lock();
        try {
            return lanes.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class Lane {
        private long nextTicket;
        private long serving;
        private final Set<Long> finished = new HashSet<>();
    }

    /**
     * Place of one run in its conversation's commit order.
     */
    public final class Ticket implements AutoCloseable {

        private final String conversationId;
        private final long number;
        private boolean closed;

        private Ticket(String conversationId, long number) {
            this.conversationId = conversationId;
            this.number = number;
        }

        public long getNumber() {
            return number;
        }

        @Override
        public void close() {
            synchronized (this) {
                if (closed) {
                    return;
                }
                closed = true;
            }
            finish(this);
        }
    }
}
