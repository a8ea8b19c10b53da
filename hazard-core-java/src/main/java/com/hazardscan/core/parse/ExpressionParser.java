package com.hazardscan.core.parse;

import com.hazardscan.core.circuit.Circuit;
import com.hazardscan.core.circuit.GateKind;

import java.util.*;

/**
 * Builds a circuit from an infix boolean expression such as {@code "A AND (B OR NOT C)"}.
 *
 * Operators, highest precedence first: {@code NOT}/{@code !} (3), {@code AND}/{@code &} (2),
 * {@code OR}/{@code |} (1); parentheses group. Keywords are case-insensitive. Every distinct
 * operand becomes a primary input (id lower-cased, display name upper-cased, initial value 0)
 * and the expression value drives a single output {@code out1} named {@code Y}.
 *
 * Not thread-safe: gate numbering is per parse call, but the instance holds the counter.
 */
public class ExpressionParser {

    public static final String CIRCUIT_NAME = "parsed_circuit";
    public static final String OUTPUT_ID = "out1";
    public static final String OUTPUT_NAME = "Y";

    static final double NOT_DELAY = 1.0;
    static final double BINARY_DELAY = 2.0;
    static final double WIRE_DELAY = 0.1;

    private int gateCounter;

    /**
     * @throws ParseException if the expression is empty or malformed
     */
    public Circuit parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ParseException("Expression must not be empty");
        }
        gateCounter = 0;

        List<String> tokens = tokenize(expression);
        checkSyntax(tokens);

        Circuit.Builder builder = Circuit.builder(CIRCUIT_NAME);
        for (String token : tokens) {
            if (isOperand(token) && !builder.hasInput(token.toLowerCase(Locale.ROOT))) {
                builder.addInput(token.toLowerCase(Locale.ROOT), token, 0);
            }
        }

        String result = buildGates(builder, tokens);
        builder.addOutput(OUTPUT_ID, OUTPUT_NAME, result);
        return builder.build();
    }

    /**
     * Upper-cases the expression, maps the AND/OR/NOT keywords to {@code & | !} and splits it
     * into operator and operand tokens.
     */
    public static List<String> tokenize(String expression) {
        String expr = expression.toUpperCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < expr.length(); i++) {
            char ch = expr.charAt(i);
            if (isOperatorChar(ch)) {
                flushWord(current, tokens);
                tokens.add(String.valueOf(ch));
            } else if (Character.isWhitespace(ch)) {
                flushWord(current, tokens);
            } else {
                current.append(ch);
            }
        }
        flushWord(current, tokens);
        return tokens;
    }

    private static void flushWord(StringBuilder current, List<String> tokens) {
        if (current.length() == 0) return;
        String word = current.toString();
        switch (word) {
            case "AND" -> tokens.add("&");
            case "OR"  -> tokens.add("|");
            case "NOT" -> tokens.add("!");
            default    -> tokens.add(word);
        }
        current.setLength(0);
    }

    // -----------------------------------------------------------------------
    // Syntax check
    // -----------------------------------------------------------------------

    // Alternation check: an operand (or a parenthesised group) must follow every binary
    // operator, NOT and "(", and only a binary operator or ")" may follow an operand.
    private static void checkSyntax(List<String> tokens) {
        boolean expectOperand = true;
        int depth = 0;

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (expectOperand) {
                if (token.equals("!") || token.equals("(")) {
                    if (token.equals("(")) depth++;
                } else if (isOperand(token)) {
                    expectOperand = false;
                } else if (token.equals(")")) {
                    throw new ParseException("Unexpected ')' at token " + (i + 1)
                            + (i > 0 && tokens.get(i - 1).equals("(") ? " (empty parentheses)" : ""));
                } else if (isBinary(token)) {
                    throw new ParseException("Operator '" + display(token) + "' at token " + (i + 1)
                            + " is missing its left operand");
                } else {
                    throw new ParseException("Invalid operand '" + token + "'");
                }
            } else {
                if (isBinary(token)) {
                    expectOperand = true;
                } else if (token.equals(")")) {
                    if (depth == 0) throw new ParseException("Unbalanced ')' at token " + (i + 1));
                    depth--;
                } else if (isOperand(token)) {
                    throw new ParseException("Missing operator before '" + token + "'");
                } else if (token.equals("!") || token.equals("(")) {
                    throw new ParseException("Missing operator before '" + display(token) + "'");
                } else {
                    throw new ParseException("Invalid operand '" + token + "'");
                }
            }
        }

        if (expectOperand) {
            throw new ParseException("Expression ends with a dangling operator");
        }
        if (depth != 0) {
            throw new ParseException("Unbalanced '(': " + depth + " not closed");
        }
    }

    // -----------------------------------------------------------------------
    // Shunting-yard gate construction
    // -----------------------------------------------------------------------

    private String buildGates(Circuit.Builder builder, List<String> tokens) {
        Deque<String> values = new ArrayDeque<>();
        Deque<String> operators = new ArrayDeque<>();

        for (String token : tokens) {
            switch (token) {
                case "&", "|" -> {
                    while (!operators.isEmpty() && !operators.peek().equals("(")
                            && precedence(operators.peek()) >= precedence(token)) {
                        createGate(builder, operators.pop(), values);
                    }
                    operators.push(token);
                }
                case "!", "(" -> operators.push(token);
                case ")" -> {
                    while (!operators.peek().equals("(")) {
                        createGate(builder, operators.pop(), values);
                    }
                    operators.pop();
                }
                default -> values.push(token.toLowerCase(Locale.ROOT));
            }
        }

        while (!operators.isEmpty()) {
            createGate(builder, operators.pop(), values);
        }
        if (values.size() != 1) {
            throw new ParseException("Malformed expression: " + values.size() + " values left after parsing");
        }
        return values.pop();
    }

    private void createGate(Circuit.Builder builder, String operator, Deque<String> values) {
        String gateId;
        do {
            gateId = "g" + (++gateCounter);
        } while (builder.hasInput(gateId));
        if (operator.equals("!")) {
            if (values.isEmpty()) throw new ParseException("NOT is missing its operand");
            String input = values.pop();
            builder.addGate(gateId, GateKind.NOT, NOT_DELAY, input);
            builder.addConnection(input, gateId, WIRE_DELAY);
        } else {
            if (values.size() < 2) {
                throw new ParseException("Operator '" + display(operator) + "' is missing an operand");
            }
            String second = values.pop();
            String first = values.pop();
            GateKind kind = operator.equals("&") ? GateKind.AND : GateKind.OR;
            builder.addGate(gateId, kind, BINARY_DELAY, first, second);
            builder.addConnection(first, gateId, WIRE_DELAY);
            builder.addConnection(second, gateId, WIRE_DELAY);
        }
        values.push(gateId);
    }

    static int precedence(String operator) {
        return switch (operator) {
            case "!" -> 3;
            case "&" -> 2;
            case "|" -> 1;
            default  -> 0;
        };
    }

    private static boolean isOperatorChar(char ch) {
        return ch == '&' || ch == '|' || ch == '!' || ch == '(' || ch == ')';
    }

    private static boolean isBinary(String token) {
        return token.equals("&") || token.equals("|");
    }

    static boolean isOperand(String token) {
        if (token.isEmpty() || !Character.isLetter(token.charAt(0))) return false;
        for (int i = 1; i < token.length(); i++) {
            char ch = token.charAt(i);
            if (!Character.isLetterOrDigit(ch) && ch != '_') return false;
        }
        return true;
    }

    private static String display(String token) {
        return switch (token) {
            case "&" -> "AND";
            case "|" -> "OR";
            case "!" -> "NOT";
            default  -> token;
        };
    }

    public static class ParseException extends RuntimeException {
        public ParseException(String message) { super(message); }
    }
}
