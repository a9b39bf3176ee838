package com.yieldsolver.application.service;

import com.yieldsolver.application.port.in.CashflowValuationUseCase.MirrCommand;
import com.yieldsolver.application.port.in.CashflowValuationUseCase.NpvCommand;
import com.yieldsolver.application.port.in.CashflowValuationUseCase.XnpvCommand;
import com.yieldsolver.application.port.in.LoanCalculationUseCase.AmortizationCommand;
import com.yieldsolver.application.port.in.LoanCalculationUseCase.TimeValueCommand;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.BatchIrrCommand;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.IrrCommand;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.XirrCommand;
import com.yieldsolver.domain.model.PaymentTiming;
import com.yieldsolver.domain.model.TimeValueFunction;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates the shape of incoming calculation requests.
 * Collects every problem instead of stopping at the first one.
 */
public class CashflowRequestValidator {

    static final int MAX_CASHFLOWS = 10_000;
    static final int MAX_AMORTIZATION_PERIODS = 1_200;

    public ValidationResult validate(IrrCommand command) {
        List<String> errors = new ArrayList<>();

        validateCashflows("cashflows", command.cashflows(), errors);
        validateSolverOverrides(command.guess(), command.tolerance(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(XirrCommand command) {
        List<String> errors = new ArrayList<>();

        validateCashflows("cashflows", command.cashflows(), errors);
        validateDates(command.dates(), command.cashflows(), errors);
        validateSolverOverrides(command.guess(), command.tolerance(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(BatchIrrCommand command, int maxBatchSize) {
        List<String> errors = new ArrayList<>();

        if (command.series() == null || command.series().isEmpty()) {
            errors.add("series is required");
        } else {
            if (command.series().size() > maxBatchSize) {
                errors.add("series exceeds maximum batch size of " + maxBatchSize);
            }
            for (int i = 0; i < command.series().size(); i++) {
                validateCashflows("series[" + i + "]", command.series().get(i), errors);
            }
        }
        validateSolverOverrides(command.guess(), command.tolerance(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(NpvCommand command) {
        List<String> errors = new ArrayList<>();

        validateRate("rate", command.rate(), errors);
        validateCashflows("cashflows", command.cashflows(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(XnpvCommand command) {
        List<String> errors = new ArrayList<>();

        validateRate("rate", command.rate(), errors);
        validateCashflows("cashflows", command.cashflows(), errors);
        validateDates(command.dates(), command.cashflows(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(MirrCommand command) {
        List<String> errors = new ArrayList<>();

        validateCashflows("cashflows", command.cashflows(), errors);
        if (command.cashflows() != null && command.cashflows().size() == 1) {
            errors.add("cashflows must contain at least 2 entries");
        }
        validateRate("financeRate", command.financeRate(), errors);
        validateRate("reinvestRate", command.reinvestRate(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(TimeValueCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.function())) {
            errors.add("function is required");
            return ValidationResult.of(errors);
        }
        if (!TimeValueFunction.isValid(command.function())) {
            errors.add("function must be one of: fv, pv, pmt, nper, ipmt, ppmt");
            return ValidationResult.of(errors);
        }

        TimeValueFunction function = TimeValueFunction.fromValue(command.function());
        validateRate("rate", command.rate(), errors);
        switch (function) {
            case FV -> {
                requireFinite("nper", command.nper(), errors);
                requireFinite("pmt", command.pmt(), errors);
                requireFinite("pv", command.pv(), errors);
            }
            case PV -> {
                requireFinite("nper", command.nper(), errors);
                requireFinite("pmt", command.pmt(), errors);
            }
            case PMT -> {
                requireFinite("nper", command.nper(), errors);
                requireFinite("pv", command.pv(), errors);
                if (command.nper() != null && command.nper() == 0.0) {
                    errors.add("nper must not be zero");
                }
            }
            case NPER -> {
                requireFinite("pmt", command.pmt(), errors);
                requireFinite("pv", command.pv(), errors);
            }
            case IPMT, PPMT -> {
                requireFinite("nper", command.nper(), errors);
                requireFinite("pv", command.pv(), errors);
                if (command.per() == null) {
                    errors.add("per is required");
                } else if (command.per() < 1) {
                    errors.add("per must be at least 1");
                } else if (command.nper() != null && command.per() > command.nper()) {
                    errors.add("per must not exceed nper");
                }
            }
        }
        optionalFinite("fv", command.fv(), errors);
        validateTiming(command.when(), errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(AmortizationCommand command) {
        List<String> errors = new ArrayList<>();

        validateRate("rate", command.rate(), errors);
        if (command.nper() == null) {
            errors.add("nper is required");
        } else if (command.nper() < 1) {
            errors.add("nper must be at least 1");
        } else if (command.nper() > MAX_AMORTIZATION_PERIODS) {
            errors.add("nper exceeds maximum of " + MAX_AMORTIZATION_PERIODS + " periods");
        }
        requireFinite("pv", command.pv(), errors);
        optionalFinite("fv", command.fv(), errors);
        validateTiming(command.when(), errors);

        return ValidationResult.of(errors);
    }

    private void validateCashflows(String field, List<Double> cashflows, List<String> errors) {
        if (cashflows == null || cashflows.isEmpty()) {
            errors.add(field + " is required");
            return;
        }
        if (cashflows.size() > MAX_CASHFLOWS) {
            errors.add(field + " exceeds maximum of " + MAX_CASHFLOWS + " entries");
        }
        for (int i = 0; i < cashflows.size(); i++) {
            Double amount = cashflows.get(i);
            if (amount == null || !Double.isFinite(amount)) {
                errors.add(field + "[" + i + "] must be a finite number");
            }
        }
    }

    private void validateDates(List<String> dates, List<Double> cashflows, List<String> errors) {
        if (dates == null || dates.isEmpty()) {
            errors.add("dates is required");
            return;
        }
        if (cashflows != null && cashflows.size() != dates.size()) {
            errors.add("cashflows and dates must have the same length");
        }
        for (int i = 0; i < dates.size(); i++) {
            String date = dates.get(i);
            if (isBlank(date)) {
                errors.add("dates[" + i + "] is required");
                continue;
            }
            try {
                LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
            } catch (DateTimeParseException e) {
                errors.add("dates[" + i + "] must be in ISO format (YYYY-MM-DD)");
            }
        }
    }

    private void validateSolverOverrides(Double guess, Double tolerance, List<String> errors) {
        if (guess != null && !Double.isFinite(guess)) {
            errors.add("guess must be a finite number");
        }
        if (tolerance != null && !(tolerance > 0.0 && Double.isFinite(tolerance))) {
            errors.add("tolerance must be a positive number");
        }
    }

    private void validateRate(String field, Double rate, List<String> errors) {
        requireFinite(field, rate, errors);
    }

    private void validateTiming(String when, List<String> errors) {
        if (when != null && !PaymentTiming.isValid(when)) {
            errors.add("when must be one of: end, begin, 0, 1");
        }
    }

    private void requireFinite(String field, Double value, List<String> errors) {
        if (value == null) {
            errors.add(field + " is required");
        } else if (!Double.isFinite(value)) {
            errors.add(field + " must be a finite number");
        }
    }

    private void optionalFinite(String field, Double value, List<String> errors) {
        if (value != null && !Double.isFinite(value)) {
            errors.add(field + " must be a finite number");
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
