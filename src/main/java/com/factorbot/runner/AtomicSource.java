package com.factorbot.runner;

import com.factorbot.model.AtomicObservation;
import com.factorbot.model.RunContext;

import java.sql.SQLException;
import java.util.List;

/**
 * Supplies canonical atomics for a run, for example reloaded from the store.
 */
@FunctionalInterface
public interface AtomicSource {
    List<AtomicObservation> load(RunContext context) throws SQLException;
}
