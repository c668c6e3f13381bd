package com.example.calculator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Calculator that keeps a history of every operation it completes.
 *
 * <p>Failed operations throw {@link CalculatorException} and are never recorded.
 * Instances are not thread-safe.
 */
public class Calculator {

    private final List<CalculationResult> history = new ArrayList<>();
    private final Clock clock;

    public Calculator() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the timestamps stamped on history records
     */
    public Calculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public double add(double a, double b) {
        return record(Operation.ADD, a + b, a, b);
    }

    public double subtract(double a, double b) {
        return record(Operation.SUBTRACT, a - b, a, b);
    }

    public double multiply(double a, double b) {
        return record(Operation.MULTIPLY, a * b, a, b);
    }

    public double divide(double a, double b) {
        // -0.0 == 0.0, so both zeros are rejected
        if (b == 0.0) {
            throw CalculatorException.divisionByZero();
        }
        return record(Operation.DIVIDE, a / b, a, b);
    }

    public double power(double base, double exponent) {
        return record(Operation.POWER, Math.pow(base, exponent), base, exponent);
    }

    public double sqrt(double x) {
        if (x < 0.0) {
            throw CalculatorException.negativeSquareRoot();
        }
        return record(Operation.SQRT, Math.sqrt(x), x);
    }

    /**
     * Perform an operation by name, e.g. {@code apply("power", 2, 8)}.
     *
     * @throws CalculatorException with kind INVALID_OPERATION if the name is unknown
     *         or the number of operands does not match the operation
     */
    public double apply(String operation, double... operands) {
        Operation op = Operation.fromName(operation);
        if (operands.length != op.getArity()) {
            throw CalculatorException.invalidOperation(operation);
        }
        switch (op) {
            case ADD:
                return add(operands[0], operands[1]);
            case SUBTRACT:
                return subtract(operands[0], operands[1]);
            case MULTIPLY:
                return multiply(operands[0], operands[1]);
            case DIVIDE:
                return divide(operands[0], operands[1]);
            case POWER:
                return power(operands[0], operands[1]);
            case SQRT:
                return sqrt(operands[0]);
            default:
                throw CalculatorException.invalidOperation(operation);
        }
    }

    /**
     * @return an unmodifiable snapshot of the history, oldest first
     */
    public List<CalculationResult> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public void clearHistory() {
        history.clear();
    }

    public int historyCount() {
        return history.size();
    }

    private double record(Operation op, double result, double... operands) {
        history.add(new CalculationResult(result, op.getName(), operands, clock.instant()));
        return result;
    }
}
