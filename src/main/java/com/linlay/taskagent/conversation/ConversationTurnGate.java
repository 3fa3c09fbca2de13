package com.linlay.taskagent.conversation;

import com.linlay.taskagent.config.TaskChatProperties;
import com.linlay.taskagent.service.TurnCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serializes chat turns per conversation.
 * <p>
 * Each conversation id maps to a fair binary semaphore that is created on first use and dropped
 * once no turn holds or waits for it. Turns on different conversations never contend.
 */
@Component
public class ConversationTurnGate {

    private static final Logger log = LoggerFactory.getLogger(ConversationTurnGate.class);

    private final Map<String, GateEntry> gatesByConversationId = new ConcurrentHashMap<>();
    private final long waitTimeoutMs;

    @Autowired
    public ConversationTurnGate(TaskChatProperties properties) {
        this(properties.getLockTimeoutMs());
    }

    public ConversationTurnGate(long waitTimeoutMs) {
        this.waitTimeoutMs = Math.max(0L, waitTimeoutMs);
    }

    /**
     * Blocks for at most the configured wait timeout.
     *
     * @throws ConversationBusyException when another turn keeps the conversation for longer
     * @throws TurnCancelledException    when the waiting thread is interrupted
     */
    public TurnPermit acquire(String conversationId) {
        GateEntry entry = gatesByConversationId.compute(conversationId, (key, existing) -> {
            GateEntry gate = existing == null ? new GateEntry() : existing;
            gate.references++;
            return gate;
        });

        boolean acquired = false;
        try {
            acquired = entry.semaphore.tryAcquire(waitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Turn gate wait interrupted conversation={}", conversationId);
            throw new TurnCancelledException(conversationId, 0);
        } finally {
            if (!acquired) {
                dereference(conversationId);
            }
        }
        if (!acquired) {
            log.warn("Turn gate busy conversation={}, waited {} ms", conversationId, waitTimeoutMs);
            throw new ConversationBusyException(conversationId, waitTimeoutMs);
        }
        return new TurnPermit(conversationId, entry);
    }

    int trackedConversations() {
        return gatesByConversationId.size();
    }

    private void dereference(String conversationId) {
        gatesByConversationId.computeIfPresent(conversationId, (key, gate) -> {
            gate.references--;
            return gate.references <= 0 ? null : gate;
        });
    }

    private static final class GateEntry {
        private final Semaphore semaphore = new Semaphore(1, true);
        private int references;
    }

    public final class TurnPermit implements AutoCloseable {

        private final String conversationId;
        private final GateEntry entry;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private TurnPermit(String conversationId, GateEntry entry) {
            this.conversationId = conversationId;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            entry.semaphore.release();
            dereference(conversationId);
        }
    }
}
