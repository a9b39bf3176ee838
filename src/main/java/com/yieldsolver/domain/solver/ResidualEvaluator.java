package com.yieldsolver.domain.solver;

import com.yieldsolver.domain.model.CashFlow;
import com.yieldsolver.domain.model.CashflowSeries;
import com.yieldsolver.domain.model.SolverState;

/**
 * Evaluates the discounted-sum residual and its derivative at a trial rate.
 * <pre>
 *   f(r)  = SUM( cf[i] / (1+r)^t[i] )
 *   f'(r) = SUM( -t[i] * cf[i] / (1+r)^(t[i]+1) )
 * </pre>
 * Both sums come out of a single pass over the series.
 */
public class ResidualEvaluator {

    /**
     * @return state at {@code rate}; residual and derivative are NaN when {@code 1 + rate <= 0}
     */
    public SolverState evaluate(double rate, CashflowSeries series) {
        double base = 1.0 + rate;
        if (Double.isNaN(rate) || base <= 0.0) {
            return new SolverState(rate, Double.NaN, Double.NaN);
        }

        double f = 0.0;
        double fp = 0.0;
        for (CashFlow flow : series.flows()) {
            double t = flow.timeOffset();
            double discount = Math.pow(base, t);
            f += flow.amount() / discount;
            fp += -t * flow.amount() / (discount * base);
        }
        return new SolverState(rate, f, fp);
    }
}
