package com.example.jobqueue.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Concurrency model of a worker pool.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutorKind {

    /**
     * Pooled threads inside this JVM.
     */
    THREAD("threadpool"),

    /**
     * Child JVMs talking line-delimited JSON over stdin/stdout.
     */
    PROCESS("processpool"),

    /**
     * Cooperative lease loops on a single Reactor thread.
     */
    FIBER("async");

    private final String alias;

    public static ExecutorKind fromValue(String value) {
        for (var kind : values()) {
            if (kind.name().equalsIgnoreCase(value) || kind.alias.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown executor kind: " + value);
    }
}
