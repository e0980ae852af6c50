package com.factorbot.runner;

import com.factorbot.model.AtomicObservation;

import java.sql.SQLException;
import java.util.List;

/**
 * Optional persistence of normalized atomics before they are transformed.
 */
@FunctionalInterface
public interface AtomicSink {
    int ingest(List<AtomicObservation> observations) throws SQLException;
}
