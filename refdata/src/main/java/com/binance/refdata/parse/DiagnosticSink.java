package com.binance.refdata.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the recoverable diagnostics of one parse session and logs them.
 *
 * {@link #warnOnce(String)} suppresses a message whose exact text was already
 * emitted through it, until {@link #reset()} is called. Everything that was
 * logged is also kept in emission order for inspection.
 */
public class DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticSink.class);

    private final Set<String>  warnedOnce = new HashSet<>();
    private final List<String> emitted    = new ArrayList<>();

    public void warnOnce(String message) {
        if (warnedOnce.add(message)) {
            warn(message);
        }
    }

    public void warn(String message) {
        emitted.add(message);
        log.warn("refdata.diagnostic message=\"{}\"", message);
    }

    public void info(String message) {
        emitted.add(message);
        log.info("refdata.diagnostic message=\"{}\"", message);
    }

    public List<String> emitted() {
        return List.copyOf(emitted);
    }

    public long count(String message) {
        return emitted.stream().filter(message::equals).count();
    }

    public void reset() {
        warnedOnce.clear();
        emitted.clear();
    }
}
