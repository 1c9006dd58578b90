package com.containermgmt.streamagent.session;

import com.containermgmt.streamagent.codec.EventCodec;
import com.containermgmt.streamagent.dto.Batch;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Tracks batches that were received but not settled yet, and writes the ack
 * for a batch once, after its transaction has committed.
 *
 * Batches that are never applied are settled without an ack; the gateway
 * redelivers them when its own ack timeout expires.
 */
@Slf4j
public class AckProtocolHandler {

    private final EventCodec codec;
    private final Consumer<String> outbound;

    /** ack token -> number of deliveries of that batch still unsettled */
    private final Map<String, Integer> pending = new HashMap<>();
    private long acked;
    private long abandoned;

    public AckProtocolHandler(EventCodec codec, Consumer<String> outbound) {
        this.codec = codec;
        this.outbound = outbound;
    }

    public synchronized void register(Batch batch) {
        int deliveries = pending.merge(batch.ackToken(), 1, Integer::sum);
        if (deliveries > 1) {
            log.debug("Batch {} delivered again while still pending (ack_token={}, deliveries={})",
                    batch.batchId(), batch.ackToken(), deliveries);
        }
    }

    /**
     * Emits the ack for a committed batch.
     *
     * @throws IllegalStateException if the batch was not pending
     * @throws com.containermgmt.streamagent.exception.ConnectionException if the ack
     *         could not be written; the batch stays applied and will be redelivered
     */
    public void onBatchApplied(Batch batch) {
        String frame = codec.encodeAck(batch.ackToken());
        synchronized (this) {
            if (!settle(batch)) {
                throw new IllegalStateException("Batch " + batch.batchId() + " is not pending ack");
            }
        }
        outbound.accept(frame);
        synchronized (this) {
            acked++;
        }
        log.trace(" -- Acked batch {} (ack_token={})", batch.batchId(), batch.ackToken());
    }

    /** Settles a batch that will not be acked. */
    public synchronized void onBatchAbandoned(Batch batch) {
        if (settle(batch)) {
            abandoned++;
            log.debug("Batch {} left un-acked for redelivery", batch.batchId());
        }
    }

    public synchronized int pendingCount() {
        return pending.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized boolean isPending(String ackToken) {
        return pending.containsKey(ackToken);
    }

    public synchronized long ackedCount() {
        return acked;
    }

    public synchronized long abandonedCount() {
        return abandoned;
    }

    private boolean settle(Batch batch) {
        Integer deliveries = pending.get(batch.ackToken());
        if (deliveries == null) {
            return false;
        }
        if (deliveries > 1) {
            pending.put(batch.ackToken(), deliveries - 1);
        } else {
            pending.remove(batch.ackToken());
        }
        return true;
    }
}
