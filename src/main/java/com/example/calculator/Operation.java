package com.example.calculator;

/**
 * Operations the calculator knows how to perform and record.
 */
public enum Operation {
    ADD("add", 2),
    SUBTRACT("subtract", 2),
    MULTIPLY("multiply", 2),
    DIVIDE("divide", 2),
    POWER("power", 2),
    SQRT("sqrt", 1);

    private final String name;
    private final int arity;

    Operation(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    /**
     * @return the lower-case name used in history records
     */
    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Look up an operation by its history name.
     *
     * @throws CalculatorException with kind INVALID_OPERATION if no operation has that name
     */
    public static Operation fromName(String name) {
        for (Operation op : values()) {
            if (op.name.equals(name)) {
                return op;
            }
        }
        throw CalculatorException.invalidOperation(name);
    }
}
