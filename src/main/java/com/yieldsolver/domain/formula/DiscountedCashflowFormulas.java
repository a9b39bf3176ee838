package com.yieldsolver.domain.formula;

import com.yieldsolver.domain.exception.InvalidInputException;
import com.yieldsolver.domain.model.CashFlow;
import com.yieldsolver.domain.model.CashflowSeries;

import java.time.LocalDate;
import java.util.List;

/**
 * NPV, XNPV and MIRR over a cash-flow series.
 * Unlike the solver's residual there is no guard on {@code 1 + rate <= 0}: integer
 * exponents of a negative base are well defined, only fractional ones give NaN.
 */
public final class DiscountedCashflowFormulas {

    private DiscountedCashflowFormulas() {
    }

    /**
     * SUM( cf[t] / (1+rate)^t ) for t = 0 .. N-1
     */
    public static double npv(double rate, List<Double> cashflows) {
        return discountedSum(rate, CashflowSeries.periodic(cashflows));
    }

    /**
     * SUM( cf[i] / (1+rate)^((date[i] - min(date)) / 365) )
     */
    public static double xnpv(double rate, List<Double> cashflows, List<LocalDate> dates) {
        return discountedSum(rate, CashflowSeries.dated(cashflows, dates));
    }

    private static double discountedSum(double rate, CashflowSeries series) {
        double base = 1.0 + rate;
        double sum = 0.0;
        for (CashFlow flow : series.flows()) {
            sum += flow.amount() / Math.pow(base, flow.timeOffset());
        }
        return sum;
    }

    /**
     * Modified IRR: positive flows compounded at {@code reinvestRate}, negative flows
     * discounted at {@code financeRate}.
     * <pre>
     *   MIRR = (NPV(pos, reinvest) / |NPV(neg, finance)|)^(1/(n-1)) * (1+reinvest) - 1
     * </pre>
     * NaN when the series has no positive or no negative flow.
     */
    public static double mirr(List<Double> cashflows, double financeRate, double reinvestRate) {
        if (cashflows == null || cashflows.size() < 2) {
            throw new InvalidInputException("mirr needs at least 2 cashflows");
        }

        int n = cashflows.size();
        double positive = 0.0;
        double negative = 0.0;
        for (int t = 0; t < n; t++) {
            Double value = cashflows.get(t);
            if (value == null) {
                throw new InvalidInputException("cashflow at index " + t + " is null");
            }
            if (value > 0) {
                positive += value / Math.pow(1 + reinvestRate, t);
            } else if (value < 0) {
                negative += value / Math.pow(1 + financeRate, t);
            }
        }
        if (positive == 0.0 || negative == 0.0) {
            return Double.NaN;
        }
        return Math.pow(positive / Math.abs(negative), 1.0 / (n - 1)) * (1 + reinvestRate) - 1;
    }
}
