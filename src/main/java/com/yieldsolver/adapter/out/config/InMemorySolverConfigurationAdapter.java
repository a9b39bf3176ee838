package com.yieldsolver.adapter.out.config;

import com.yieldsolver.application.port.out.SolverConfigurationRepository;
import com.yieldsolver.domain.model.IterationMode;
import com.yieldsolver.domain.solver.NewtonSolver;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of SolverConfigurationRepository
 * Values are read once from the "solver" and "batch" sections of application.yml;
 * anything missing falls back to the built-in defaults
 */
@Slf4j
public class InMemorySolverConfigurationAdapter implements SolverConfigurationRepository {

    static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    private final double defaultGuess;
    private final double defaultTolerance;
    private final IterationMode iterationMode;
    private final int maxBatchSize;

    public InMemorySolverConfigurationAdapter() {
        this(new JsonObject());
    }

    public InMemorySolverConfigurationAdapter(JsonObject config) {
        JsonObject solver = config.getJsonObject("solver", new JsonObject());
        JsonObject batch = config.getJsonObject("batch", new JsonObject());

        this.defaultGuess = solver.getDouble("default-guess", NewtonSolver.DEFAULT_GUESS);
        this.defaultTolerance = solver.getDouble("default-tolerance", NewtonSolver.DEFAULT_TOLERANCE);
        this.iterationMode = IterationMode.fromValue(
                solver.getString("iteration-mode", IterationMode.EARLY_EXIT.getValue()));
        this.maxBatchSize = batch.getInteger("max-series", DEFAULT_MAX_BATCH_SIZE);

        if (!(defaultTolerance > 0.0)) {
            throw new IllegalArgumentException("solver.default-tolerance must be positive: " + defaultTolerance);
        }
        if (defaultGuess <= -1.0) {
            throw new IllegalArgumentException("solver.default-guess must be greater than -1: " + defaultGuess);
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("batch.max-series must be at least 1: " + maxBatchSize);
        }

        log.info("Solver configuration: guess={}, tolerance={}, mode={}, maxBatchSize={}",
                defaultGuess, defaultTolerance, iterationMode, maxBatchSize);
    }

    @Override
    public double getDefaultGuess() {
        return defaultGuess;
    }

    @Override
    public double getDefaultTolerance() {
        return defaultTolerance;
    }

    @Override
    public IterationMode getIterationMode() {
        return iterationMode;
    }

    @Override
    public int getMaxBatchSize() {
        return maxBatchSize;
    }
}
