package org.imppg.engine.service;

import org.imppg.engine.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Ordered event stream from a worker thread to the owner.
 *
 * <p>Workers {@link #publish} from their own thread; listeners are only ever called from the consuming
 * side, in one of two ways:</p>
 * <ul>
 *   <li><b>Pumped:</b> the owner calls {@link #dispatchPending()} from its idle loop, or
 *       {@link #dispatchUntil} to block until a specific event arrives</li>
 *   <li><b>Executor:</b> every publish schedules a drain on the owner's serial executor</li>
 * </ul>
 * Events of one run are delivered in production order. Envelopes carry their run id since events of a
 * finished run may still be queued when the next run starts.
 */
public class ProgressChannel {
    private static final Logger logger = LoggerFactory.getLogger(ProgressChannel.class);

    /** Event tagged with the run that produced it. */
    public record Envelope(long runId, ProgressEvent event) { }

    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor ownerExecutor;

    /** Creates a pumped channel. */
    public ProgressChannel() {
        this(null);
    }

    /**
     * @param ownerExecutor serial executor delivering events, or null if the owner pumps the channel itself
     */
    public ProgressChannel(Executor ownerExecutor) {
        this.ownerExecutor = ownerExecutor;
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    /**
     * Queues an event. Called by the worker; never blocks.
     */
    public void publish(long runId, ProgressEvent event) {
        queue.add(new Envelope(runId, event));
        if (ownerExecutor != null) {
            ownerExecutor.execute(this::dispatchPending);
        }
    }

    /**
     * Delivers all queued events to the listeners.
     *
     * @return number of events delivered
     */
    public synchronized int dispatchPending() {
        int delivered = 0;
        Envelope envelope;
        while ((envelope = queue.poll()) != null) {
            deliver(envelope);
            delivered++;
        }
        return delivered;
    }

    /**
     * Delivers events as they arrive until one matching {@code stop} has been delivered.
     *
     * @return true if a matching event was delivered, false on timeout
     * @throws InterruptedException if interrupted while waiting for the next event
     */
    public synchronized boolean dispatchUntil(Predicate<Envelope> stop, long timeout, TimeUnit unit)
            throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            long remaining = deadline - System.nanoTime();
            Envelope envelope = queue.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            if (envelope == null) {
                return false;
            }
            deliver(envelope);
            if (stop.test(envelope)) {
                return true;
            }
        }
    }

    /** Number of queued, not yet delivered events. */
    public int pendingCount() {
        return queue.size();
    }

    private void deliver(Envelope envelope) {
        logger.trace("Run {}: {}", envelope.runId(), envelope.event());
        for (ProgressListener listener : listeners) {
            listener.onProgress(envelope.runId(), envelope.event());
        }
    }
}
