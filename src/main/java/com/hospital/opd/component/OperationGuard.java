package com.hospital.opd.component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a registered in-flight operation; closing it frees the key.
 */
public final class OperationGuard implements AutoCloseable {

    private final OperationRegistry registry;
    private final String key;
    private final AtomicBoolean released = new AtomicBoolean();

    OperationGuard(OperationRegistry registry, String key) {
        this.registry = registry;
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            registry.release(key);
        }
    }
}
