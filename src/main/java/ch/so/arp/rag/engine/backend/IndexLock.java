package ch.so.arp.rag.engine.backend;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Concurrency policy a backend asks the engine to apply around compound
 * operations. Reads may run concurrently; writes are serialized against reads
 * and other writes.
 */
public interface IndexLock {

    <T> T read(Supplier<T> action);

    <T> T write(Supplier<T> action);

    /**
     * Lock for backends that delegate concurrency control to an external
     * service.
     */
    static IndexLock none() {
        return NoLock.INSTANCE;
    }

    static IndexLock readWrite() {
        return new ReadWrite(new ReentrantReadWriteLock());
    }

    enum NoLock implements IndexLock {
        INSTANCE;

        @Override
        public <T> T read(Supplier<T> action) {
            return action.get();
        }

        @Override
        public <T> T write(Supplier<T> action) {
            return action.get();
        }
    }

    final class ReadWrite implements IndexLock {

        private final ReentrantReadWriteLock lock;

        ReadWrite(ReentrantReadWriteLock lock) {
            this.lock = lock;
        }

        @Override
        public <T> T read(Supplier<T> action) {
            lock.readLock().lock();
            try {
                return action.get();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public <T> T write(Supplier<T> action) {
            lock.writeLock().lock();
            try {
                return action.get();
            } finally {
                lock.writeLock().unlock();
            }
        }
    }
}
