package luxgrowth.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates a grid of ARIMA orders against one regressor set.
 * <p>
 * Each candidate is fitted and diagnosed on its own worker thread. Inputs are immutable and
 * shared; every candidate yields a tagged success or failure, and the outcomes are merged in
 * grid order so rankings do not depend on scheduling. A failing candidate never stops the others.
 */
public class ModelSearch {

    private static final Logger LOG = LoggerFactory.getLogger(ModelSearch.class);

    private final ArimaxEstimator estimator;
    private final DiagnosticSuite diagnostics;
    private final int threads;

    public ModelSearch(ArimaxEstimator estimator, DiagnosticSuite diagnostics, int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be positive: " + threads);
        this.estimator = estimator;
        this.diagnostics = diagnostics;
        this.threads = threads;
    }

    public ModelSearch() {
        this(new ArimaxEstimator(), new DiagnosticSuite(), Runtime.getRuntime().availableProcessors());
    }

    public static ModelSearch from(ForecastSettings settings) {
        return new ModelSearch(ArimaxEstimator.from(settings), DiagnosticSuite.from(settings), settings.getThreads());
    }

    /**
     * @throws ModelingException {@link ErrorKind#DIMENSION_MISMATCH} if the regressors lack rows for the series years
     */
    public SearchResult search(SeriesStore series, RegressorSet regressors, List<ModelOrder> grid) {
        return run(series, regressors, grid, -1L);
    }

    /**
     * Like {@link #search(SeriesStore, RegressorSet, List)}, but candidates still running at the
     * deadline are cancelled and recorded as failures; finished candidates are kept.
     */
    public SearchResult search(SeriesStore series, RegressorSet regressors, List<ModelOrder> grid,
                               long timeout, TimeUnit unit) {
        if (timeout < 0) throw new IllegalArgumentException("timeout must be non-negative: " + timeout);
        return run(series, regressors, grid, unit.toNanos(timeout));
    }

    /** Fit and diagnose one order; never throws for per-candidate failures. */
    public CandidateOutcome evaluate(SeriesStore series, RegressorSet regressors, ModelOrder order, int gridIndex) {
        try {
            FittedModel model = estimator.fit(series, order, regressors);
            DiagnosticVerdict verdict = diagnostics.evaluate(model);
            return new CandidateFit(gridIndex, model, verdict);
        } catch (ModelingException e) {
            LOG.warn("Order {} on '{}' failed: {}", order, regressors.name(), e.toString());
            return new CandidateFailure(order, gridIndex, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Order {} on '{}' failed unexpectedly", order, regressors.name(), e);
            return new CandidateFailure(order, gridIndex, ErrorKind.ESTIMATION_FAILURE, String.valueOf(e));
        }
    }

    private SearchResult run(SeriesStore series, RegressorSet regressors, List<ModelOrder> grid, long timeoutNanos) {
        regressors.alignTo(series.years());
        LOG.info("Searching {} orders against regressor set '{}' {}", grid.size(), regressors.name(), regressors.labels());
        if (grid.isEmpty()) {
            return new SearchResult(regressors.name(), new ArrayList<>());
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, grid.size()), new WorkerFactory());
        List<CandidateOutcome> outcomes = new ArrayList<>(grid.size());
        try {
            List<Future<CandidateOutcome>> futures = new ArrayList<>(grid.size());
            for (int i = 0; i < grid.size(); i++) {
                final int index = i;
                final ModelOrder order = grid.get(i);
                Callable<CandidateOutcome> task = () -> evaluate(series, regressors, order, index);
                futures.add(pool.submit(task));
            }
            long deadline = System.nanoTime() + timeoutNanos;
            boolean stopped = false;
            for (int i = 0; i < futures.size(); i++) {
                Future<CandidateOutcome> future = futures.get(i);
                ModelOrder order = grid.get(i);
                if (stopped) {
                    outcomes.add(completedOrCancelled(future, order, i, "search interrupted"));
                    continue;
                }
                try {
                    if (timeoutNanos < 0) {
                        outcomes.add(future.get());
                    } else {
                        outcomes.add(future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
                    }
                } catch (TimeoutException e) {
                    future.cancel(true);
                    outcomes.add(new CandidateFailure(order, i, ErrorKind.ESTIMATION_FAILURE, "timed out"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopped = true;
                    outcomes.add(completedOrCancelled(future, order, i, "search interrupted"));
                } catch (CancellationException e) {
                    outcomes.add(new CandidateFailure(order, i, ErrorKind.ESTIMATION_FAILURE, "cancelled"));
                } catch (ExecutionException e) {
                    outcomes.add(new CandidateFailure(order, i, ErrorKind.ESTIMATION_FAILURE, String.valueOf(e.getCause())));
                }
            }
        } finally {
            pool.shutdownNow();
        }

        SearchResult result = new SearchResult(regressors.name(), outcomes);
        LOG.info("{}", result);
        if (!result.hasValidCandidate()) {
            LOG.info("No order passed all diagnostics for '{}'", regressors.name());
        }
        return result;
    }

    private static CandidateOutcome completedOrCancelled(Future<CandidateOutcome> future, ModelOrder order,
                                                         int index, String reason) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get(0L, TimeUnit.NANOSECONDS);
            } catch (InterruptedException | ExecutionException | TimeoutException e) {
                return new CandidateFailure(order, index, ErrorKind.ESTIMATION_FAILURE, reason + ": " + e);
            }
        }
        future.cancel(true);
        return new CandidateFailure(order, index, ErrorKind.ESTIMATION_FAILURE, reason);
    }

    private static final class WorkerFactory implements ThreadFactory {

        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "model-search-" + pool + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
