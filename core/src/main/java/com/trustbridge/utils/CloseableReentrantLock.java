package com.trustbridge.utils;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link ReentrantLock} that can be held with try-with-resources:
 * <pre>
 * try (var ignored = lock.lockAsResource()) {
 *     ...
 * }
 * </pre>
 * Implementation idea from <a href="https://stackoverflow.com/a/46248923">https://stackoverflow.com/a/46248923</a>
 */
public class CloseableReentrantLock extends ReentrantLock {

    public ResourceLock lockAsResource() {
        lock();
        return this::unlock;
    }

    public interface ResourceLock extends AutoCloseable {
        @Override
        void close();
    }
}
