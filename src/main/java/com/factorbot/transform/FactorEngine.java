package com.factorbot.transform;

import com.factorbot.align.EntityTimeline;
import com.factorbot.config.EngineSettings;
import com.factorbot.factor.FactorRule;
import com.factorbot.factor.FactorRuleRegistry;
import com.factorbot.factor.RuleEnvironment;
import com.factorbot.model.AtomicObservation;
import com.factorbot.model.FactorObservation;
import com.factorbot.model.RunContext;
import com.factorbot.quality.CrossSectionalCapper;
import com.factorbot.quality.QualityTally;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fans entities out to a bounded worker pool, collects their candidate rows,
 * then applies the cross-sectional caps once every entity has finished.
 *
 * <p>An exception inside one entity task is recorded against that entity and
 * does not stop the others.</p>
 */
public final class FactorEngine {
    private static final Logger LOG = LogManager.getLogger(FactorEngine.class);

    private static final Comparator<FactorObservation> ROW_ORDER = Comparator
            .comparing((FactorObservation row) -> row.entityId)
            .thenComparing(row -> row.observationDate)
            .thenComparing(row -> row.factorName);

    private final FactorRuleRegistry registry;
    private final EngineSettings settings;
    private final EntityFactorTransformer transformer;
    private final CrossSectionalCapper capper;

    public FactorEngine(FactorRuleRegistry registry, EngineSettings settings) {
        this.registry = registry;
        this.settings = settings;
        this.transformer = new EntityFactorTransformer(registry, RuleEnvironment.from(settings), settings.includeRunDate);
        this.capper = new CrossSectionalCapper(settings.capPercentile, settings.capMinSample, settings.capFixed);
    }

    public EngineResult run(RunContext context, List<AtomicObservation> atomics) throws InterruptedException {
        Map<String, List<AtomicObservation>> byEntity = groupByEntity(context, atomics);
        int total = byEntity.size();
        QualityTally tally = new QualityTally();
        Map<String, String> failures = new TreeMap<>();
        List<FactorObservation> candidates = new ArrayList<>();
        if (total == 0) {
            LOG.info("stage=transform entities=0 rows=0");
            return new EngineResult(candidates, tally, failures, 0);
        }

        int threads = Math.max(1, Math.min(settings.threads, total));
        long startedNanos = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CompletionService<EntityResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<EntityResult>, String> submitted = new HashMap<>();
        for (Map.Entry<String, List<AtomicObservation>> entry : byEntity.entrySet()) {
            Future<EntityResult> future = completion.submit(new EntityTask(entry.getKey(), entry.getValue(), context));
            submitted.put(future, entry.getKey());
        }

        try {
            for (int i = 0; i < total; i++) {
                Future<EntityResult> future = completion.take();
                String entityId = submitted.get(future);
                EntityResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("stage=transform entity={} failed: {}", entityId, cause.toString(), cause);
                    result = EntityResult.failed(entityId, describe(cause));
                }
                if (result.isFailed()) {
                    failures.put(result.entityId, result.error);
                    continue;
                }
                candidates.addAll(result.rows);
                tally.merge(result.tally);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }

        List<FactorObservation> rows = candidates;
        for (FactorRule rule : registry.rules()) {
            if (!rule.crossSectionalCap()) {
                continue;
            }
            CrossSectionalCapper.CapResult capped = capper.apply(rule.factorName(), rows);
            rows = new ArrayList<>(capped.rows);
            for (FactorObservation row : capped.capped) {
                tally.recordCapped(row);
            }
        }
        rows.sort(ROW_ORDER);

        long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000L;
        LOG.info("stage=transform entities={} failed={} evaluated={} kept={} dropped={} capped={} threads={} elapsed_ms={}",
                total, failures.size(), tally.evaluated(), tally.kept(), tally.dropped(), tally.cappedCount(), threads, elapsedMs);
        return new EngineResult(rows, tally, failures, total);
    }

    private static Map<String, List<AtomicObservation>> groupByEntity(RunContext context, List<AtomicObservation> atomics) {
        Map<String, List<AtomicObservation>> out = new TreeMap<>();
        if (atomics == null) {
            return out;
        }
        for (AtomicObservation observation : atomics) {
            if (observation == null || !context.inUniverse(observation.entityId)) {
                continue;
            }
            out.computeIfAbsent(observation.entityId, ignored -> new ArrayList<>()).add(observation);
        }
        return out;
    }

    private final class EntityTask implements Callable<EntityResult> {
        private final String entityId;
        private final List<AtomicObservation> observations;
        private final RunContext context;

        private EntityTask(String entityId, List<AtomicObservation> observations, RunContext context) {
            this.entityId = entityId;
            this.observations = observations;
            this.context = context;
        }

        @Override
        public EntityResult call() {
            LocalDate dataStart = context.dataStart(settings.dataPaddingDays);
            List<AtomicObservation> scoped = new ArrayList<>(observations.size());
            for (AtomicObservation observation : observations) {
                if (!observation.referenceDate().isBefore(dataStart)) {
                    scoped.add(observation);
                }
            }
            try {
                return transformer.transform(EntityTimeline.of(entityId, scoped), context);
            } catch (RuntimeException e) {
                LOG.warn("stage=transform entity={} failed: {}", entityId, e.toString(), e);
                return EntityResult.failed(entityId, describe(e));
            }
        }
    }

    private static String describe(Throwable cause) {
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
