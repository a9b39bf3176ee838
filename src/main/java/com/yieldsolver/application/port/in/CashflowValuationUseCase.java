package com.yieldsolver.application.port.in;

import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for discounting a cash-flow series at a known rate
 */
public interface CashflowValuationUseCase {

    Future<Double> npv(NpvCommand command);

    Future<Double> xnpv(XnpvCommand command);

    /**
     * Modified IRR with separate finance and reinvestment rates
     */
    Future<Double> mirr(MirrCommand command);

    record NpvCommand(Double rate, List<Double> cashflows) {}

    record XnpvCommand(Double rate, List<Double> cashflows, List<String> dates) {}

    record MirrCommand(List<Double> cashflows, Double financeRate, Double reinvestRate) {}
}
