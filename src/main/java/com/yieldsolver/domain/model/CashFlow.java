package com.yieldsolver.domain.model;

/**
 * A single cash flow positioned on the discounting time axis.
 * Negative amount = outflow, positive amount = inflow.
 *
 * @param amount     signed cash amount
 * @param timeOffset years (XIRR) or periods (IRR) from the reference point, never negative
 */
public record CashFlow(double amount, double timeOffset) {
}
