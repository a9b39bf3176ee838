package com.yieldsolver.domain.formula;

import com.yieldsolver.domain.exception.InvalidInputException;
import com.yieldsolver.domain.model.AmortizationRow;
import com.yieldsolver.domain.model.PaymentTiming;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-period loan schedule driven by a forward balance recurrence.
 *
 * <p>End-of-period payments:
 * <pre>
 *   interest[k]  = balance[k-1] * rate
 *   balance[k]   = balance[k-1] * (1 + rate) + pmt
 * </pre>
 * Beginning-of-period payments settle the interest accrued over the previous period,
 * so the first payment is pure principal:
 * <pre>
 *   interest[k]  = balance[k-1] * rate / (1 + rate)     (0 for k = 1)
 *   balance[k]   = (balance[k-1] + pmt) * (1 + rate)
 * </pre>
 * Payment, interest and principal are reported as positive magnitudes for a loan
 * ({@code pv > 0}); the closing balance ends at {@code -fv}.
 */
public final class AmortizationEngine {

    private static final int CENTS = 2;

    private AmortizationEngine() {
    }

    public static List<AmortizationRow> schedule(double rate, int nper, double pv) {
        return schedule(rate, nper, pv, 0.0, PaymentTiming.END);
    }

    public static List<AmortizationRow> schedule(double rate, int nper, double pv, double fv, PaymentTiming when) {
        if (nper < 1) {
            throw new InvalidInputException("nper must be at least 1: " + nper);
        }

        double payment = TimeValueFormulas.pmt(rate, nper, pv, fv, when);
        double balance = pv;
        double cumulativeInterest = 0.0;
        double cumulativePrincipal = 0.0;

        List<AmortizationRow> rows = new ArrayList<>(nper);
        for (int period = 1; period <= nper; period++) {
            double interest;
            if (when == PaymentTiming.BEGIN) {
                interest = period == 1 ? 0.0 : balance * rate / (1 + rate);
                balance = (balance + payment) * (1 + rate);
            } else {
                interest = balance * rate;
                balance = balance * (1 + rate) + payment;
            }
            double principal = Math.abs(payment) - interest;
            cumulativeInterest += interest;
            cumulativePrincipal += principal;

            rows.add(AmortizationRow.builder()
                    .period(period)
                    .payment(round(Math.abs(payment)))
                    .interest(round(interest))
                    .principal(round(principal))
                    .cumulativeInterest(round(cumulativeInterest))
                    .cumulativePrincipal(round(cumulativePrincipal))
                    .remainingBalance(round(balance))
                    .build());
        }
        return rows;
    }

    private static double round(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(CENTS, RoundingMode.HALF_UP).doubleValue();
    }
}
