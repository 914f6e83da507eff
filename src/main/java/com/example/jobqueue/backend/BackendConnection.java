package com.example.jobqueue.backend;

/**
 * Live connection to one backend kind, owned by the {@link BackendConnector}.
 * Implementations are safe to share across worker slots.
 */
public interface BackendConnection extends AutoCloseable {

    BackendType getType();

    @Override
    void close();
}
