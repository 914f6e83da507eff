package com.example.jobqueue.worker.process;

import com.example.jobqueue.retry.BackoffCalculator;
import com.example.jobqueue.retry.RetryExecutor;
import com.example.jobqueue.store.JsonCodec;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of a child worker process. Stdout carries the protocol only;
 * everything else, logs included, goes to stderr.
 */
public final class WorkerProcessMain {

    private WorkerProcessMain() {
    }

    public static void main(String[] args) throws IOException {
        var protocolOut = new FileOutputStream(FileDescriptor.out);
        System.setOut(new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8));

        var handler = new WorkerProcessHandler(new JsonCodec(), new RetryExecutor(new BackoffCalculator()));
        try (var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
             var out = new OutputStreamWriter(protocolOut, StandardCharsets.UTF_8)) {
            handler.serve(in, out);
        }
    }
}
