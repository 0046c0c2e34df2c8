package com.example.ratecontrol.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Writes each violation as one key=value line to the {@value #AUDIT_LOGGER} logger, which can be
 * routed to its own appender. Control characters and double quotes in client-supplied fields are
 * replaced with {@code _}.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String AUDIT_LOGGER = "audit.rate-limit";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\p{Cntrl}\"]");

    private final Logger auditLog = LoggerFactory.getLogger(AUDIT_LOGGER);

    @Override
    public void report(ViolationRecord violation) {
        auditLog.warn("action=rate_limit_exceeded identifier={} strategy={} limit={} windowMs={} currentCount={} "
                        + "ip={} method={} path={} userAgent=\"{}\" origin={} referer={} occurredAt={}",
                violation.getIdentifier(),
                violation.getStrategy(),
                violation.getLimit(),
                violation.getWindowMs(),
                violation.getCurrentCount(),
                clean(violation.getNetworkAddress()),
                violation.getMethod(),
                clean(violation.getPath()),
                clean(violation.getUserAgent()),
                clean(violation.getOrigin()),
                clean(violation.getReferer()),
                violation.getOccurredAt());
    }

    private static String clean(String value) {
        return value == null ? null : UNSAFE_CHARS.matcher(value).replaceAll("_");
    }
}
