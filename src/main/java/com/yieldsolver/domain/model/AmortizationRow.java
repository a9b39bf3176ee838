package com.yieldsolver.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One period of an amortization schedule - amounts rounded to cents
 */
@Value
@Builder
public class AmortizationRow {
    int period;
    double payment;
    double interest;
    double principal;
    double cumulativeInterest;
    double cumulativePrincipal;
    double remainingBalance;
}
