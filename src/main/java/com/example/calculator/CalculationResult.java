package com.example.calculator;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable record of one completed calculator operation.
 */
public final class CalculationResult {
    private final double result;
    private final String operation;
    private final double[] operands;
    private final Instant timestamp;

    CalculationResult(double result, String operation, double[] operands, Instant timestamp) {
        this.result = result;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.operands = Objects.requireNonNull(operands, "operands").clone();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public double getResult() {
        return result;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return a copy of the operands, in the order they were passed
     */
    public double[] getOperands() {
        return operands.clone();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CalculationResult)) {
            return false;
        }
        CalculationResult other = (CalculationResult) o;
        return Double.compare(result, other.result) == 0
            && operation.equals(other.operation)
            && Arrays.equals(operands, other.operands)
            && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        int hash = Objects.hash(result, operation, timestamp);
        return 31 * hash + Arrays.hashCode(operands);
    }

    @Override
    public String toString() {
        return operation + Arrays.toString(operands) + " = " + result + " @ " + timestamp;
    }
}
