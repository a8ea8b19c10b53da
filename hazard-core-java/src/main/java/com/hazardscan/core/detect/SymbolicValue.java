package com.hazardscan.core.detect;

/**
 * Value carried by a wire during symbolic hazard simulation: a fixed logic level, the
 * variable under analysis, or its complement.
 */
public sealed interface SymbolicValue
        permits SymbolicValue.Constant, SymbolicValue.Literal, SymbolicValue.NegatedLiteral {

    SymbolicValue negate();

    static Constant constant(int value) {
        return value == 0 ? Constant.ZERO : Constant.ONE;
    }

    record Constant(int value) implements SymbolicValue {
        public static final Constant ZERO = new Constant(0);
        public static final Constant ONE = new Constant(1);

        public Constant {
            if (value != 0 && value != 1) {
                throw new IllegalArgumentException("Constant must be 0 or 1, got " + value);
            }
        }

        @Override
        public SymbolicValue negate() { return constant(1 - value); }

        @Override
        public String toString() { return String.valueOf(value); }
    }

    record Literal(String variableId, String variableName) implements SymbolicValue {
        @Override
        public SymbolicValue negate() { return new NegatedLiteral(variableId, variableName); }

        @Override
        public String toString() { return "X(" + variableName + ")"; }
    }

    record NegatedLiteral(String variableId, String variableName) implements SymbolicValue {
        @Override
        public SymbolicValue negate() { return new Literal(variableId, variableName); }

        @Override
        public String toString() { return "~X(" + variableName + ")"; }
    }
}
