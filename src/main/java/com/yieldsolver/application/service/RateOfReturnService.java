package com.yieldsolver.application.service;

import com.yieldsolver.application.port.in.RateOfReturnUseCase;
import com.yieldsolver.application.port.out.SolverConfigurationRepository;
import com.yieldsolver.domain.model.CashflowSeries;
import com.yieldsolver.domain.model.SolverResult;
import com.yieldsolver.domain.solver.NewtonSolver;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Use case implementation for IRR / XIRR solving
 * Validates request shape, resolves solver defaults, then runs the Newton solver
 */
@Slf4j
@RequiredArgsConstructor
public class RateOfReturnService implements RateOfReturnUseCase {

    private final Vertx vertx;
    private final NewtonSolver solver;
    private final CashflowRequestValidator validator;
    private final SolverConfigurationRepository configurationRepository;

    @Override
    public Future<SolverResult> irr(IrrCommand command) {
        log.info("Solving IRR for {} cashflows", sizeOf(command.cashflows()));

        try {
            validator.validate(command).throwIfInvalid();

            SolverResult result = solve(CashflowSeries.periodic(command.cashflows()),
                    command.guess(), command.tolerance());
            logResult("IRR", result);
            return Future.succeededFuture(result);
        } catch (IllegalArgumentException e) {
            log.warn("IRR request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<SolverResult> xirr(XirrCommand command) {
        log.info("Solving XIRR for {} dated cashflows", sizeOf(command.cashflows()));

        try {
            validator.validate(command).throwIfInvalid();

            List<LocalDate> dates = command.dates().stream()
                    .map(LocalDate::parse)
                    .collect(Collectors.toList());
            SolverResult result = solve(CashflowSeries.dated(command.cashflows(), dates),
                    command.guess(), command.tolerance());
            logResult("XIRR", result);
            return Future.succeededFuture(result);
        } catch (IllegalArgumentException e) {
            log.warn("XIRR request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<List<SolverResult>> batchIrr(BatchIrrCommand command) {
        log.info("Solving IRR batch of {} series", sizeOf(command.series()));

        try {
            validator.validate(command, configurationRepository.getMaxBatchSize()).throwIfInvalid();
        } catch (IllegalArgumentException e) {
            log.warn("IRR batch rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }

        // Series are independent - solve them unordered on the worker pool
        List<Future<SolverResult>> futures = new ArrayList<>(command.series().size());
        for (List<Double> amounts : command.series()) {
            futures.add(vertx.executeBlocking(
                    () -> solve(CashflowSeries.periodic(amounts), command.guess(), command.tolerance()),
                    false));
        }

        return Future.all(futures)
                .map(composite -> futures.stream()
                        .map(Future::result)
                        .collect(Collectors.toList()))
                .onSuccess(results -> log.info("IRR batch solved: {}/{} converged",
                        results.stream().filter(SolverResult::converged).count(), results.size()))
                .onFailure(error -> log.error("IRR batch failed", error));
    }

    private SolverResult solve(CashflowSeries series, Double guess, Double tolerance) {
        double startRate = guess != null ? guess : configurationRepository.getDefaultGuess();
        double tol = tolerance != null ? tolerance : configurationRepository.getDefaultTolerance();
        return solver.solve(series, startRate, tol, configurationRepository.getIterationMode());
    }

    private void logResult(String kind, SolverResult result) {
        if (result.converged()) {
            log.debug("{} converged to {} after {} iterations", kind, result.rate(), result.iterationsRun());
        } else {
            log.debug("{} did not converge after {} iterations", kind, result.iterationsRun());
        }
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
