/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.symmath.parse;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Variable;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parser for infix notation.
 * <p>
 * Grammar, loosest binding first:
 * <pre>
 *  Sum:      Product (('+' | '-') Product)*
 *  Product:  Prefix (('*' | '/') Prefix)*
 *  Prefix:   '-' Prefix | Power
 *  Power:    Atom ('^' Prefix)?
 *  Atom:     Number | Identifier | Function Atom | 'e^' Prefix | '(' Sum ')'
 *  Function: 'exp' | 'ln' | 'log' | 'sin' | 'cos' | 'tan'
 * </pre>
 * {@code ^} is right associative and binds tighter than unary minus, so {@code -x^2} is {@code -(x^2)}.
 * The tree is built with the combinators of {@link Expression}, so parsing the output of
 * {@link Expression#toString()} gives back an equal expression.
 */
public final class Infix {
    private final String input;
    private int position;

    private final Deque<Operator> operators = new ArrayDeque<>();
    private final Deque<Expression> operands = new ArrayDeque<>();

    private Infix(String input) {
        this.input = input;
    }

    /**
     * @throws ParseException if the input is not a well-formed expression
     */
    public static Expression parse(String input) {
        checkNotNull(input, "input");
        return new Infix(input).parse();
    }

    private Expression parse() {
        boolean expectOperand = true;
        skipWhitespace();
        while (position < input.length()) {
            int start = position;
            char c = input.charAt(position);
            if (Character.isDigit(c) || c == '.') {
                requireOperand(expectOperand, start);
                operands.push(Constant.of(readNumber()));
                expectOperand = false;
            } else if (Character.isLetter(c) || c == '_') {
                requireOperand(expectOperand, start);
                String identifier = readIdentifier();
                Operator function = Operator.function(identifier);
                if (identifier.equals("e") && peek() == '^') {
                    position++;
                    operators.push(Operator.E_POWER);
                } else if (function != null) {
                    operators.push(function);
                } else {
                    operands.push(identifier(identifier));
                    expectOperand = false;
                }
            } else if (c == '(') {
                requireOperand(expectOperand, start);
                position++;
                operators.push(Operator.PARENTHESIS);
            } else if (c == ')') {
                if (expectOperand) {
                    throw new ParseException("Missing operand before ')'", start);
                }
                position++;
                while (!operators.isEmpty() && operators.peek() != Operator.PARENTHESIS) {
                    reduce();
                }
                if (operators.isEmpty()) {
                    throw new ParseException("Unbalanced ')'", start);
                }
                operators.pop();
            } else if (expectOperand && (c == '-' || c == '+')) {
                position++;
                if (c == '-') {
                    operators.push(Operator.NEGATE);
                }
            } else {
                Operator operator = Operator.binary(c);
                if (operator == null) {
                    throw new ParseException("Unexpected character '" + c + "'", start);
                }
                if (expectOperand) {
                    throw new ParseException("Missing operand before '" + c + "'", start);
                }
                position++;
                while (!operators.isEmpty() && operators.peek().reducesBefore(operator)) {
                    reduce();
                }
                operators.push(operator);
                expectOperand = true;
            }
            skipWhitespace();
        }
        if (expectOperand) {
            throw new ParseException(input.isBlank() ? "Empty expression" : "Missing operand", position);
        }
        while (!operators.isEmpty()) {
            if (operators.peek() == Operator.PARENTHESIS) {
                throw new ParseException("Unbalanced '('", position);
            }
            reduce();
        }
        return operands.pop();
    }

    private void reduce() {
        Operator operator = operators.pop();
        if (operator.isPrefix()) {
            operands.push(operator.apply(operands.pop(), null));
        } else {
            Expression right = operands.pop();
            Expression left = operands.pop();
            operands.push(operator.apply(left, right));
        }
    }

    private void requireOperand(boolean expectOperand, int start) {
        if (!expectOperand) {
            throw new ParseException("Missing operator", start);
        }
    }

    private double readNumber() {
        int start = position;
        while (position < input.length() && (Character.isDigit(peek()) || peek() == '.')) {
            position++;
        }
        if (position < input.length() && (peek() == 'e' || peek() == 'E')) {
            int mark = position;
            position++;
            if (position < input.length() && (peek() == '+' || peek() == '-')) {
                position++;
            }
            if (position < input.length() && Character.isDigit(peek())) {
                while (position < input.length() && Character.isDigit(peek())) {
                    position++;
                }
            } else {
                position = mark;
            }
        }
        String text = input.substring(start, position);
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number '" + text + "'", start);
        }
    }

    private String readIdentifier() {
        int start = position;
        while (position < input.length() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            position++;
        }
        return input.substring(start, position);
    }

    private static Expression identifier(String name) {
        switch (name) {
            case "NaN":
                return Constant.of(Double.NaN);
            case "Infinity":
                return Constant.of(Double.POSITIVE_INFINITY);
            default:
                return Variable.of(name);
        }
    }

    private char peek() {
        return position < input.length() ? input.charAt(position) : '\0';
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private enum Operator {
        ADD(2, false, true),
        SUBTRACT(2, false, true),
        MULTIPLY(3, false, true),
        DIVIDE(3, false, true),
        NEGATE(4, true, false),
        POWER(5, false, false),
        E_POWER(5, true, false),
        EXP(6, true, false),
        LOG(6, true, false),
        SIN(6, true, false),
        COS(6, true, false),
        TAN(6, true, false),
        PARENTHESIS(0, false, false);

        private final int precedence;
        private final boolean prefix;
        private final boolean leftAssociative;

        Operator(int precedence, boolean prefix, boolean leftAssociative) {
            this.precedence = precedence;
            this.prefix = prefix;
            this.leftAssociative = leftAssociative;
        }

        static Operator binary(char symbol) {
            switch (symbol) {
                case '+':
                    return ADD;
                case '-':
                    return SUBTRACT;
                case '*':
                    return MULTIPLY;
                case '/':
                    return DIVIDE;
                case '^':
                    return POWER;
                default:
                    return null;
            }
        }

        static Operator function(String name) {
            switch (name) {
                case "exp":
                    return EXP;
                case "ln":
                case "log":
                    return LOG;
                case "sin":
                    return SIN;
                case "cos":
                    return COS;
                case "tan":
                    return TAN;
                default:
                    return null;
            }
        }

        boolean isPrefix() {
            return prefix;
        }

        /**
         * Whether this operator, on top of the stack, has to be applied before {@code incoming} is pushed.
         */
        boolean reducesBefore(Operator incoming) {
            if (this == PARENTHESIS) {
                return false;
            }
            return precedence > incoming.precedence
                    || (precedence == incoming.precedence && incoming.leftAssociative);
        }

        Expression apply(Expression left, Expression right) {
            switch (this) {
                case ADD:
                    return left.add(right);
                case SUBTRACT:
                    return left.subtract(right);
                case MULTIPLY:
                    return left.multiply(right);
                case DIVIDE:
                    return left.divide(right);
                case POWER:
                    return left.pow(right);
                case NEGATE:
                    return left.negate();
                case E_POWER:
                case EXP:
                    return left.exp();
                case LOG:
                    return left.log();
                case SIN:
                    return left.sin();
                case COS:
                    return left.cos();
                case TAN:
                    return left.tan();
                default:
                    throw new IllegalStateException("Cannot apply " + this);
            }
        }
    }
}
