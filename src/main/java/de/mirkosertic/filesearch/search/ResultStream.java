package de.mirkosertic.filesearch.search;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded channel from the per-drive scans of one search to its consumer.
 *
 * <p>Producers block while the channel is full. A producer that could not hand over a batch for longer
 * than the abandon timeout treats the consumer as gone and cancels the session. Closing the stream
 * cancels the session as well. Once the session is cancelled, queued batches are discarded.</p>
 *
 * <p>{@link #nextBatch()} returns {@code null} after the last batch; {@link #completion()} then
 * carries the totals and per-drive status.</p>
 */
public final class ResultStream implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResultStream.class);

    private static final long POLL_SLICE_MS = 50;
    private static final Object END = new Object();

    private final SearchSession session;
    private final BlockingQueue<Object> channel;
    private final long abandonTimeoutMs;
    private volatile @Nullable SearchCompletion completion;
    private volatile boolean closed;
    private boolean drained;

    ResultStream(final SearchSession session, final int capacity, final long abandonTimeoutMs) {
        this.session = session;
        this.channel = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.abandonTimeoutMs = abandonTimeoutMs;
    }

    public SearchSession session() {
        return session;
    }

    /**
     * Hands a batch to the consumer, waiting while the channel is full.
     *
     * @return false if the batch was not delivered and the producer should stop
     */
    boolean offer(final ResultBatch batch) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + abandonTimeoutMs;
        while (!closed && !session.isCancelled()) {
            if (channel.offer(batch, POLL_SLICE_MS, TimeUnit.MILLISECONDS)) {
                session.recordBatch(batch.size());
                return true;
            }
            if (System.currentTimeMillis() >= deadline) {
                logger.debug("Consumer of session {} did not take a batch for {}ms, cancelling", session.id(),
                        abandonTimeoutMs);
                session.cancel();
                return false;
            }
        }
        return false;
    }

    /**
     * Marks the end of the stream. Never blocks: if the channel is full the consumer finds the
     * completion once it has drained the remaining batches.
     */
    void complete(final SearchCompletion searchCompletion) {
        this.completion = searchCompletion;
        channel.offer(END);
    }

    /**
     * Next batch, blocking until one is available.
     *
     * @return the batch, or {@code null} when the stream is exhausted, closed or superseded
     */
    public @Nullable ResultBatch nextBatch() throws InterruptedException {
        while (!drained) {
            if (closed) {
                return null;
            }
            final Object item = channel.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
            if (item == END) {
                drained = true;
            } else if (item instanceof ResultBatch batch) {
                if (!session.isCancelled()) {
                    return batch;
                }
            } else if (item == null && completion != null && channel.isEmpty()) {
                drained = true;
            }
        }
        return null;
    }

    /**
     * Waits for the end of the search, discarding batches not yet consumed.
     */
    public SearchCompletion completion() throws InterruptedException {
        while (true) {
            final SearchCompletion result = completion;
            if (result != null) {
                channel.clear();
                drained = true;
                return result;
            }
            channel.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Drains all remaining batches and returns their hits in arrival order.
     */
    public List<SearchHit> collectAll() throws InterruptedException {
        final List<SearchHit> hits = new ArrayList<>();
        ResultBatch batch;
        while ((batch = nextBatch()) != null) {
            hits.addAll(batch.hits());
        }
        return hits;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops consuming; cancels the session so producers stop after their current batch.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            session.cancel();
            channel.clear();
        }
    }
}
