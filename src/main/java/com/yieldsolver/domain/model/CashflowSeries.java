package com.yieldsolver.domain.model;

import com.yieldsolver.domain.exception.InvalidInputException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered cash flows normalized to (amount, time offset) pairs.
 * Built once per solve and immutable afterwards.
 */
public final class CashflowSeries {

    /** Actual/365 day-count basis */
    public static final double DAYS_PER_YEAR = 365.0;

    private final List<CashFlow> flows;

    private CashflowSeries(List<CashFlow> flows) {
        this.flows = Collections.unmodifiableList(flows);
    }

    /**
     * Evenly spaced flows: offset of entry i is the period index i (index 0 = now).
     */
    public static CashflowSeries periodic(List<Double> amounts) {
        requireAmounts(amounts);

        List<CashFlow> flows = new ArrayList<>(amounts.size());
        for (int i = 0; i < amounts.size(); i++) {
            flows.add(new CashFlow(requireAmount(amounts.get(i), i), i));
        }
        return new CashflowSeries(flows);
    }

    public static CashflowSeries periodic(double... amounts) {
        List<Double> boxed = new ArrayList<>(amounts.length);
        for (double amount : amounts) {
            boxed.add(amount);
        }
        return periodic(boxed);
    }

    /**
     * Date-stamped flows on an Actual/365 basis. The reference date is the earliest
     * date in the set, wherever it sits in the input.
     */
    public static CashflowSeries dated(List<Double> amounts, List<LocalDate> dates) {
        requireAmounts(amounts);
        if (dates == null) {
            throw new InvalidInputException("dates are required");
        }
        if (amounts.size() != dates.size()) {
            throw new InvalidInputException(String.format(
                    "cashflows and dates must have the same length (%d != %d)", amounts.size(), dates.size()));
        }

        LocalDate reference = null;
        for (int i = 0; i < dates.size(); i++) {
            LocalDate date = dates.get(i);
            if (date == null) {
                throw new InvalidInputException("date at index " + i + " is null");
            }
            if (reference == null || date.isBefore(reference)) {
                reference = date;
            }
        }

        List<CashFlow> flows = new ArrayList<>(amounts.size());
        for (int i = 0; i < amounts.size(); i++) {
            long days = ChronoUnit.DAYS.between(reference, dates.get(i));
            flows.add(new CashFlow(requireAmount(amounts.get(i), i), days / DAYS_PER_YEAR));
        }
        return new CashflowSeries(flows);
    }

    public List<CashFlow> flows() {
        return flows;
    }

    public int size() {
        return flows.size();
    }

    private static void requireAmounts(List<Double> amounts) {
        if (amounts == null || amounts.isEmpty()) {
            throw new InvalidInputException("cashflows must not be empty");
        }
    }

    private static double requireAmount(Double amount, int index) {
        if (amount == null) {
            throw new InvalidInputException("cashflow at index " + index + " is null");
        }
        return amount;
    }

    @Override
    public String toString() {
        return "CashflowSeries" + flows;
    }
}
