package com.yieldsolver.application.service;

import com.yieldsolver.application.port.in.LoanCalculationUseCase;
import com.yieldsolver.domain.formula.AmortizationEngine;
import com.yieldsolver.domain.formula.TimeValueFormulas;
import com.yieldsolver.domain.model.AmortizationRow;
import com.yieldsolver.domain.model.PaymentTiming;
import com.yieldsolver.domain.model.TimeValueFunction;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Use case implementation for TVM functions and amortization schedules
 */
@Slf4j
@RequiredArgsConstructor
public class LoanCalculationService implements LoanCalculationUseCase {

    private final CashflowRequestValidator validator;

    @Override
    public Future<Double> evaluate(TimeValueCommand command) {
        try {
            validator.validate(command).throwIfInvalid();

            TimeValueFunction function = TimeValueFunction.fromValue(command.function());
            PaymentTiming when = timing(command.when());
            double fv = orZero(command.fv());

            double value = switch (function) {
                case FV -> TimeValueFormulas.fv(command.rate(), command.nper(), command.pmt(), command.pv(), when);
                case PV -> TimeValueFormulas.pv(command.rate(), command.nper(), command.pmt(), fv, when);
                case PMT -> TimeValueFormulas.pmt(command.rate(), command.nper(), command.pv(), fv, when);
                case NPER -> TimeValueFormulas.nper(command.rate(), command.pmt(), command.pv(), fv, when);
                case IPMT -> TimeValueFormulas.ipmt(command.rate(), command.per(), command.nper(), command.pv(), fv, when);
                case PPMT -> TimeValueFormulas.ppmt(command.rate(), command.per(), command.nper(), command.pv(), fv, when);
            };

            log.debug("{} = {}", function.getValue(), value);
            return Future.succeededFuture(value);
        } catch (IllegalArgumentException e) {
            log.warn("TVM request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<List<AmortizationRow>> amortize(AmortizationCommand command) {
        log.info("Building amortization schedule: rate={}, nper={}, pv={}",
                command.rate(), command.nper(), command.pv());

        try {
            validator.validate(command).throwIfInvalid();

            List<AmortizationRow> rows = AmortizationEngine.schedule(
                    command.rate(), command.nper(), command.pv(), orZero(command.fv()), timing(command.when()));
            return Future.succeededFuture(rows);
        } catch (IllegalArgumentException e) {
            log.warn("Amortization request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }

    private static PaymentTiming timing(String when) {
        return when == null ? PaymentTiming.END : PaymentTiming.fromValue(when);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
