package com.yieldsolver.domain.formula;

import com.yieldsolver.domain.exception.InvalidInputException;
import com.yieldsolver.domain.model.PaymentTiming;

/**
 * Closed-form time-value-of-money functions.
 *
 * <p>Spreadsheet sign convention: money paid out is negative, money received is positive.
 * All functions solve
 * <pre>
 *   fv + pv*(1+r)^n + pmt*(1+r*w)/r*((1+r)^n - 1) = 0
 * </pre>
 * for one of its variables, where {@code w} is 0 for end-of-period and 1 for
 * beginning-of-period payments. A zero rate falls back to the linear form.
 */
public final class TimeValueFormulas {

    private TimeValueFormulas() {
    }

    public static double fv(double rate, double nper, double pmt, double pv) {
        return fv(rate, nper, pmt, pv, PaymentTiming.END);
    }

    public static double fv(double rate, double nper, double pmt, double pv, PaymentTiming when) {
        if (rate == 0.0) {
            return -(pv + pmt * nper);
        }
        double growth = Math.pow(1 + rate, nper);
        return -pv * growth - pmt * (1 + rate * when.getValue()) / rate * (growth - 1);
    }

    public static double pv(double rate, double nper, double pmt) {
        return pv(rate, nper, pmt, 0.0, PaymentTiming.END);
    }

    public static double pv(double rate, double nper, double pmt, double fv, PaymentTiming when) {
        if (rate == 0.0) {
            return -(fv + pmt * nper);
        }
        double growth = Math.pow(1 + rate, nper);
        return -(fv + pmt * (1 + rate * when.getValue()) / rate * (growth - 1)) / growth;
    }

    public static double pmt(double rate, double nper, double pv) {
        return pmt(rate, nper, pv, 0.0, PaymentTiming.END);
    }

    public static double pmt(double rate, double nper, double pv, double fv, PaymentTiming when) {
        if (rate == 0.0) {
            return -(fv + pv) / nper;
        }
        double growth = Math.pow(1 + rate, nper);
        return -(fv + pv * growth) / ((1 + rate * when.getValue()) * (growth - 1) / rate);
    }

    public static double nper(double rate, double pmt, double pv) {
        return nper(rate, pmt, pv, 0.0, PaymentTiming.END);
    }

    /**
     * Number of periods, solved through logarithms. NaN when the payment can never
     * amortize the balance.
     */
    public static double nper(double rate, double pmt, double pv, double fv, PaymentTiming when) {
        if (rate == 0.0) {
            return -(fv + pv) / pmt;
        }
        double adjusted = pmt * (1 + rate * when.getValue()) / rate;
        return Math.log((adjusted - fv) / (adjusted + pv)) / Math.log(1 + rate);
    }

    public static double ipmt(double rate, int per, double nper, double pv) {
        return ipmt(rate, per, nper, pv, 0.0, PaymentTiming.END);
    }

    /**
     * Interest portion of payment {@code per} (1-based): the future value of the loan after
     * {@code per - 1} payments times the rate, so it carries the sign of the payment.
     * A beginning-of-period first payment carries no interest; later ones are discounted
     * by one period.
     */
    public static double ipmt(double rate, int per, double nper, double pv, double fv, PaymentTiming when) {
        if (per < 1) {
            throw new InvalidInputException("per must be at least 1: " + per);
        }
        if (when == PaymentTiming.BEGIN && per == 1) {
            return 0.0;
        }
        double payment = pmt(rate, nper, pv, fv, when);
        double interest = fv(rate, per - 1, payment, pv, when) * rate;
        if (when == PaymentTiming.BEGIN) {
            interest = interest / (1 + rate);
        }
        return interest;
    }

    public static double ppmt(double rate, int per, double nper, double pv) {
        return ppmt(rate, per, nper, pv, 0.0, PaymentTiming.END);
    }

    public static double ppmt(double rate, int per, double nper, double pv, double fv, PaymentTiming when) {
        return pmt(rate, nper, pv, fv, when) - ipmt(rate, per, nper, pv, fv, when);
    }
}
