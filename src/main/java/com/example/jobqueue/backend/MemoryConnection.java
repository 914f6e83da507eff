package com.example.jobqueue.backend;

/**
 * Placeholder connection for the in-process backend. Nothing is persisted.
 */
public class MemoryConnection implements BackendConnection {

    @Override
    public BackendType getType() {
        return BackendType.MEMORY;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
