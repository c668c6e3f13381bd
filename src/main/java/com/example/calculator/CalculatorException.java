package com.example.calculator;

/**
 * Thrown when a calculator operation cannot produce a result.
 * The calculator's history is left untouched when this is thrown.
 */
public class CalculatorException extends IllegalArgumentException {

    /**
     * The kinds of failure a calculator operation can report.
     */
    public enum ErrorKind {
        DIVISION_BY_ZERO,
        INVALID_OPERATION,
        NEGATIVE_SQUARE_ROOT
    }

    private final ErrorKind kind;
    private final String operation;

    private CalculatorException(ErrorKind kind, String operation, String message) {
        super(message);
        this.kind = kind;
        this.operation = operation;
    }

    public static CalculatorException divisionByZero() {
        return new CalculatorException(ErrorKind.DIVISION_BY_ZERO, Operation.DIVIDE.getName(), "Division by zero");
    }

    public static CalculatorException invalidOperation(String operation) {
        return new CalculatorException(ErrorKind.INVALID_OPERATION, operation, "Invalid operation: " + operation);
    }

    public static CalculatorException negativeSquareRoot() {
        return new CalculatorException(ErrorKind.NEGATIVE_SQUARE_ROOT, Operation.SQRT.getName(),
            "Cannot take square root of negative number");
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the name of the operation that failed, as given by the caller
     */
    public String getOperation() {
        return operation;
    }
}
