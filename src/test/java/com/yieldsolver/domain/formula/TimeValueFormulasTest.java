package com.yieldsolver.domain.formula;

import com.yieldsolver.domain.exception.InvalidInputException;
import com.yieldsolver.domain.model.PaymentTiming;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimeValueFormulas
 */
class TimeValueFormulasTest {

    @Test
    void testFutureValueOfMonthlySavings() {
        assertEquals(15692.92889, TimeValueFormulas.fv(0.05 / 12, 120, -100, -100), 1e-4);
    }

    @Test
    void testPresentValueRecoversDeposit() {
        double pv = TimeValueFormulas.pv(0.05 / 12, 120, -100, 15692.93, PaymentTiming.END);

        assertEquals(-100.00067, pv, 1e-4);
    }

    @Test
    void testMortgagePayment() {
        assertEquals(-1854.02472, TimeValueFormulas.pmt(0.075 / 12, 12 * 15, 200000), 1e-4);
    }

    @Test
    void testNumberOfPeriods() {
        assertEquals(64.07335, TimeValueFormulas.nper(0.07 / 12, -150, 8000), 1e-4);
    }

    @Test
    void testInterestAndPrincipalPortions() {
        double interest = TimeValueFormulas.ipmt(0.0824 / 12, 1, 12, 2500);
        double principal = TimeValueFormulas.ppmt(0.0824 / 12, 1, 12, 2500);

        assertEquals(-17.16667, interest, 1e-4);
        assertEquals(-200.58192, principal, 1e-4);
        assertEquals(TimeValueFormulas.pmt(0.0824 / 12, 12, 2500), interest + principal, 1e-9);
    }

    @Test
    void testZeroRateUsesLinearForm() {
        assertEquals(2000.0, TimeValueFormulas.fv(0.0, 10, -100, -1000), 1e-12);
        assertEquals(-100.0, TimeValueFormulas.pmt(0.0, 10, 1000), 1e-12);
        assertEquals(10.0, TimeValueFormulas.nper(0.0, -100, 1000), 1e-12);
        assertEquals(-1000.0, TimeValueFormulas.pv(0.0, 10, 100), 1e-12);
    }

    @Test
    void testBeginningOfPeriodPayments() {
        double payment = TimeValueFormulas.pmt(0.01, 12, 1000, 0.0, PaymentTiming.BEGIN);

        assertEquals(-87.9691, payment, 1e-4);
        assertEquals(0.0, TimeValueFormulas.ipmt(0.01, 1, 12, 1000, 0.0, PaymentTiming.BEGIN));
        assertEquals(-9.1203, TimeValueFormulas.ipmt(0.01, 2, 12, 1000, 0.0, PaymentTiming.BEGIN), 1e-4);
        assertEquals(payment, TimeValueFormulas.ppmt(0.01, 1, 12, 1000, 0.0, PaymentTiming.BEGIN), 1e-12);
    }

    @Test
    void testPaymentAndPresentValueAreInverse() {
        double rate = 0.004;
        double payment = TimeValueFormulas.pmt(rate, 36, 15000, 2000, PaymentTiming.END);

        assertEquals(15000.0, TimeValueFormulas.pv(rate, 36, payment, 2000, PaymentTiming.END), 1e-6);
        assertEquals(36.0, TimeValueFormulas.nper(rate, payment, 15000, 2000, PaymentTiming.END), 1e-9);
    }

    @Test
    void testPaymentThatNeverAmortizesIsNaN() {
        // Interest alone is 10 per period
        assertTrue(Double.isNaN(TimeValueFormulas.nper(0.01, -5, 1000)));
    }

    @Test
    void testPeriodBelowOneRejected() {
        assertThrows(InvalidInputException.class, () -> TimeValueFormulas.ipmt(0.01, 0, 12, 1000));
        assertThrows(InvalidInputException.class, () -> TimeValueFormulas.ppmt(0.01, -1, 12, 1000));
    }
}
