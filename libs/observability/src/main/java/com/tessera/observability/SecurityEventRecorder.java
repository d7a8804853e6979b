package com.tessera.observability;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Records security events as an audit log line plus a counter.
 * <p>
 * Audit lines go to the dedicated {@value #AUDIT_LOGGER} logger at WARN so they can be routed
 * separately. The correlation, user and tenant IDs come from MDC and are not repeated in the
 * message. Counters are named {@value #METRIC_NAME} and tagged with {@code event}.
 */
public class SecurityEventRecorder {

    public static final String AUDIT_LOGGER = "tessera.security.events";
    public static final String METRIC_NAME = "tessera.security.events";

    private static final Logger AUDIT = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final Map<SecurityEventType, Counter> counters = new EnumMap<>(SecurityEventType.class);

    public SecurityEventRecorder(MetricFactory metrics) {
        for (SecurityEventType type : SecurityEventType.values()) {
            counters.put(type, metrics.counter(METRIC_NAME, "Security events by type", "event", type.tag()));
        }
    }

    /**
     * Records one event.
     *
     * @param type what happened
     * @param detail short free-text detail; must not contain anything the caller may not see
     */
    public void record(SecurityEventType type, String detail) {
        counters.get(type).increment();
        AUDIT.warn("security_event={} detail=\"{}\"", type.tag(), detail);
    }

    /** Returns how many events of a type have been recorded since start. */
    public double count(SecurityEventType type) {
        return counters.get(type).count();
    }
}
