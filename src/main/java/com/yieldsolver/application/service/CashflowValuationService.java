package com.yieldsolver.application.service;

import com.yieldsolver.application.port.in.CashflowValuationUseCase;
import com.yieldsolver.domain.formula.DiscountedCashflowFormulas;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Use case implementation for NPV / XNPV / MIRR
 */
@Slf4j
@RequiredArgsConstructor
public class CashflowValuationService implements CashflowValuationUseCase {

    private final CashflowRequestValidator validator;

    @Override
    public Future<Double> npv(NpvCommand command) {
        try {
            validator.validate(command).throwIfInvalid();
            double value = DiscountedCashflowFormulas.npv(command.rate(), command.cashflows());
            log.debug("NPV at rate {} = {}", command.rate(), value);
            return Future.succeededFuture(value);
        } catch (IllegalArgumentException e) {
            log.warn("NPV request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<Double> xnpv(XnpvCommand command) {
        try {
            validator.validate(command).throwIfInvalid();
            List<LocalDate> dates = command.dates().stream()
                    .map(LocalDate::parse)
                    .collect(Collectors.toList());
            double value = DiscountedCashflowFormulas.xnpv(command.rate(), command.cashflows(), dates);
            log.debug("XNPV at rate {} = {}", command.rate(), value);
            return Future.succeededFuture(value);
        } catch (IllegalArgumentException e) {
            log.warn("XNPV request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<Double> mirr(MirrCommand command) {
        try {
            validator.validate(command).throwIfInvalid();
            double value = DiscountedCashflowFormulas.mirr(
                    command.cashflows(), command.financeRate(), command.reinvestRate());
            log.debug("MIRR (finance {}, reinvest {}) = {}", command.financeRate(), command.reinvestRate(), value);
            return Future.succeededFuture(value);
        } catch (IllegalArgumentException e) {
            log.warn("MIRR request rejected: {}", e.getMessage());
            return Future.failedFuture(e);
        }
    }
}
