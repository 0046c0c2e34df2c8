package com.example.ratecontrol.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands violations to a delegate sink on a separate executor.
 * <p>
 * {@link #report} returns as soon as the task is queued and never throws: a slow, failing or saturated
 * audit backend only costs a local log line, never the gating decision.
 */
public class AsyncAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(AsyncAuditSink.class);

    private final AuditSink delegate;
    private final Executor executor;

    public AsyncAuditSink(AuditSink delegate, Executor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public void report(ViolationRecord violation) {
        try {
            executor.execute(() -> deliver(violation));
        } catch (RejectedExecutionException ex) {
            log.warn("Audit executor rejected rate-limit violation for {}", violation.getIdentifier(), ex);
        }
    }

    private void deliver(ViolationRecord violation) {
        try {
            delegate.report(violation);
        } catch (RuntimeException ex) {
            log.warn("Failed to record rate-limit violation for {}", violation.getIdentifier(), ex);
        }
    }
}
