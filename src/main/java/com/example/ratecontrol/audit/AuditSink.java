package com.example.ratecontrol.audit;

/**
 * Receives rate-limit violations for auditing.
 */
public interface AuditSink {

    void report(ViolationRecord violation);
}
