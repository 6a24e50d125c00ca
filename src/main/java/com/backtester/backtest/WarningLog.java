package com.backtester.backtest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Warnings accumulated during one backtest. Passed explicitly to everything that may
 * degrade the run instead of aborting it. Safe for concurrent appends (data loading
 * happens in parallel).
 */
public class WarningLog {

    private static final Logger log = LoggerFactory.getLogger(WarningLog.class);

    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    public void add(String warning) {
        log.warn(warning);
        warnings.add(warning);
    }

    public List<String> asList() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }
}
