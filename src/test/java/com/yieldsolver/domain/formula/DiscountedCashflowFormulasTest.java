package com.yieldsolver.domain.formula;

import com.yieldsolver.domain.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DiscountedCashflowFormulas
 */
class DiscountedCashflowFormulasTest {

    @Test
    void testNpv() {
        double npv = DiscountedCashflowFormulas.npv(0.08, List.of(-40000.0, 5000.0, 8000.0, 12000.0, 30000.0));

        assertEquals(3065.2226681795, npv, 1e-6);
    }

    @Test
    void testNpvAtZeroRateIsPlainSum() {
        assertEquals(10.0, DiscountedCashflowFormulas.npv(0.0, List.of(-100.0, 30.0, 80.0)), 1e-12);
    }

    @Test
    void testNpvDefinedAtAndBelowMinusOne() {
        assertEquals(0.0, DiscountedCashflowFormulas.npv(-2.0, List.of(1.0, 1.0)), 1e-12);
        assertEquals(196.0, DiscountedCashflowFormulas.npv(-1.5, List.of(-100.0, 0.0, 74.0)), 1e-9);
        assertEquals(5.0, DiscountedCashflowFormulas.npv(-1.0, List.of(5.0)), 1e-12);
    }

    @Test
    void testXnpvBelowMinusOne() {
        // 365 days is a whole year, so the negative base is raised to an integer power
        double whole = DiscountedCashflowFormulas.xnpv(-2.0, List.of(1.0, 1.0),
                List.of(LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1)));
        double fractional = DiscountedCashflowFormulas.xnpv(-2.0, List.of(1.0, 1.0),
                List.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 7, 1)));

        assertEquals(0.0, whole, 1e-12);
        assertTrue(Double.isNaN(fractional));
    }

    @Test
    void testXnpvWithSingleDateEqualsSum() {
        LocalDate day = LocalDate.of(2024, 6, 30);

        double xnpv = DiscountedCashflowFormulas.xnpv(0.2, List.of(-50.0, 20.0), List.of(day, day));

        assertEquals(-30.0, xnpv, 1e-12);
    }

    @Test
    void testXnpvDiscountsOneYearByFullRate() {
        double xnpv = DiscountedCashflowFormulas.xnpv(0.1, List.of(-100.0, 110.0),
                List.of(LocalDate.of(2021, 1, 1), LocalDate.of(2022, 1, 1)));

        assertEquals(0.0, xnpv, 1e-9);
    }

    @Test
    void testXnpvRejectsMismatchedLengths() {
        assertThrows(InvalidInputException.class, () -> DiscountedCashflowFormulas.xnpv(0.1,
                List.of(-100.0, 110.0), List.of(LocalDate.of(2021, 1, 1))));
    }

    @Test
    void testMirr() {
        double mirr = DiscountedCashflowFormulas.mirr(List.of(-100.0, 50.0, -60.0, 70.0), 0.10, 0.12);

        assertEquals(-0.0390936659, mirr, 1e-9);
    }

    @Test
    void testMirrWithoutBothSignsIsNaN() {
        assertTrue(Double.isNaN(DiscountedCashflowFormulas.mirr(List.of(100.0, 50.0), 0.1, 0.1)));
        assertTrue(Double.isNaN(DiscountedCashflowFormulas.mirr(List.of(-100.0, -50.0), 0.1, 0.1)));
    }

    @Test
    void testMirrRejectsShortOrNullInput() {
        assertThrows(InvalidInputException.class,
                () -> DiscountedCashflowFormulas.mirr(List.of(-100.0), 0.1, 0.1));
        assertThrows(InvalidInputException.class,
                () -> DiscountedCashflowFormulas.mirr(Arrays.asList(-100.0, null, 50.0), 0.1, 0.1));
    }
}
