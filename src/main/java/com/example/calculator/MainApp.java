package com.example.calculator;

/**
 * Demo driver showing the calculator and its history.
 */
public class MainApp {
    public static void main(String[] args) {
        Calculator calc = new Calculator();

        System.out.println("=== Calculator Demo ===");
        System.out.println("2 + 3 = " + calc.add(2, 3));
        System.out.println("10 - 4 = " + calc.subtract(10, 4));
        System.out.println("5 * 6 = " + calc.multiply(5, 6));
        System.out.println("10 / 2 = " + calc.divide(10, 2));
        System.out.println("2^8 = " + calc.power(2, 8));
        System.out.println("sqrt(16) = " + calc.sqrt(16));

        try {
            System.out.println("1 / 0 = " + calc.divide(1, 0));
        } catch (CalculatorException e) {
            System.out.println("Error: " + e.getMessage());
        }

        try {
            System.out.println("sqrt(-1) = " + calc.sqrt(-1));
        } catch (CalculatorException e) {
            System.out.println("Error: " + e.getMessage());
        }

        System.out.println("\nHistory count: " + calc.historyCount());
        System.out.println(HistoryJson.toJson(calc.getHistory()));

        calc.clearHistory();
        System.out.println("History count after clear: " + calc.historyCount());
    }
}
