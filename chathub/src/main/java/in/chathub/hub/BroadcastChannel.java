package in.chathub.hub;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded single-sender, multi-receiver ring buffer.
 *
 * - {@link #send} never blocks on receivers; when the ring is full the oldest slot is overwritten.
 * - Every receiver keeps its own read sequence, so receivers are independent of each other.
 * - A receiver that was overtaken gets a {@link LaggedException} with the number of missed
 *   events and then continues from the oldest event still in the ring.
 *
 * Receivers only see events sent after they subscribed.
 */
public final class BroadcastChannel<T> {

    private final Object[] slots;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final AtomicInteger receivers = new AtomicInteger(0);

    // Sequence number of the next event to be written. Guarded by lock.
    private long tail = 0;

    public BroadcastChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
        this.slots = new Object[capacity];
    }

    /**
     * Append an event, overwriting the oldest one if the ring is full.
     *
     * @return number of receivers subscribed at the time of the send
     */
    public int send(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot send null");
        }
        lock.lock();
        try {
            slots[(int) (tail % capacity)] = value;
            tail++;
            available.signalAll();
        } finally {
            lock.unlock();
        }
        return receivers.get();
    }

    /**
     * Open a new receive handle positioned after the last sent event.
     */
    public Receiver subscribe() {
        lock.lock();
        try {
            receivers.incrementAndGet();
            return new Receiver(tail);
        } finally {
            lock.unlock();
        }
    }

    public int receiverCount() {
        return receivers.get();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Total number of events ever sent on this channel.
     */
    public long sentCount() {
        lock.lock();
        try {
            return tail;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Independent read cursor over the channel. Not thread-safe; owned by one consumer.
     */
    public final class Receiver implements AutoCloseable {
        private long next;
        private boolean closed = false;

        private Receiver(long start) {
            this.next = start;
        }

        /**
         * Wait up to {@code timeout} for the next event.
         *
         * @return the next event, or null on timeout
         * @throws LaggedException      if events were overwritten before this receiver read them
         * @throws InterruptedException if the waiting thread is interrupted
         */
        @SuppressWarnings("unchecked")
        public T poll(Duration timeout) throws InterruptedException {
            if (closed) {
                throw new IllegalStateException("Receiver is closed");
            }
            long remaining = timeout.toNanos();
            lock.lockInterruptibly();
            try {
                while (next == tail) {
                    if (remaining <= 0) {
                        return null;
                    }
                    remaining = available.awaitNanos(remaining);
                }

                long oldest = tail - capacity;
                if (next < oldest) {
                    long missed = oldest - next;
                    next = oldest;
                    throw new LaggedException(missed);
                }

                T value = (T) slots[(int) (next % capacity)];
                next++;
                return value;
            } finally {
                lock.unlock();
            }
        }

        /**
         * Non-blocking variant of {@link #poll(Duration)}.
         */
        public T tryPoll() {
            try {
                return poll(Duration.ZERO);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }

        /**
         * Events sent but not yet read by this receiver (including ones already overwritten).
         */
        public long pending() {
            lock.lock();
            try {
                return tail - next;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                receivers.decrementAndGet();
            }
        }
    }

    @Override
    public String toString() {
        return "BroadcastChannel{capacity=" + capacity + ", receivers=" + receivers.get() + "}";
    }
}
