package org.imppg.engine.utilities;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot holder whose value is only reachable through a {@link Guard} holding the cell's lock.
 *
 * <p>Besides mutual exclusion the cell offers a "cleared" signal: whenever a guard is closed while
 * the slot is empty, all threads waiting in {@link #lockWhenEmpty()} or {@link #awaitEmpty} are
 * woken. Waiters park on the condition instead of polling.</p>
 *
 * <pre>{@code
 * try (ExclusiveCell.Guard<WorkerHandle> g = cell.lock()) {
 *     if (g.get() == myHandle) {
 *         g.set(null);
 *     }
 * }
 * }</pre>
 *
 * @param <T> type of the held value
 */
public final class ExclusiveCell<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition cleared = lock.newCondition();
    private T value;

    public ExclusiveCell() {
        this(null);
    }

    public ExclusiveCell(T initial) {
        this.value = initial;
    }

    /**
     * Acquires the lock and returns a guard giving access to the value. Closing the guard releases the lock.
     */
    public Guard<T> lock() {
        lock.lock();
        return new Guard<>(this);
    }

    /**
     * Blocks until the slot is empty, then returns a guard with the lock held, so the caller can fill the
     * slot without another thread slipping in between.
     *
     * @throws InterruptedException if interrupted while waiting; the lock is not held in that case
     */
    public Guard<T> lockWhenEmpty() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (value != null) {
                cleared.await();
            }
        } catch (InterruptedException e) {
            lock.unlock();
            throw e;
        }
        return new Guard<>(this);
    }

    /**
     * Waits until the slot is empty.
     *
     * @return true if the slot was empty before the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitEmpty(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (value != null) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = cleared.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Scoped exclusive access to the cell's value. Not thread-safe; use only on the thread that obtained it.
     */
    public static final class Guard<T> implements AutoCloseable {

        private final ExclusiveCell<T> cell;
        private boolean closed;

        private Guard(ExclusiveCell<T> cell) {
            this.cell = cell;
        }

        public T get() {
            checkOpen();
            return cell.value;
        }

        public void set(T newValue) {
            checkOpen();
            cell.value = newValue;
        }

        public boolean isEmpty() {
            return get() == null;
        }

        private void checkOpen() {
            if (closed) {
                throw new IllegalStateException("Guard already released");
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (cell.value == null) {
                cell.cleared.signalAll();
            }
            cell.lock.unlock();
        }
    }
}
