package com.plcopen.generator.codegen.translate;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.plcopen.generator.codegen.model.input.BinaryExpression;
import com.plcopen.generator.codegen.model.input.Expression;
import com.plcopen.generator.codegen.model.input.LiteralExpression;
import com.plcopen.generator.codegen.model.input.Operator;
import com.plcopen.generator.codegen.model.input.UnaryExpression;

import lombok.experimental.UtilityClass;

/**
 * Reads literal text out of initializer expressions.
 */
@UtilityClass
public class ExpressionValues {

    /** Optional sign, optional {@code TYPE#} prefix, optional {@code base#} prefix, digits. */
    private static final Pattern INTEGER_LITERAL =
            Pattern.compile("([+-]?)(?:[A-Za-z_][A-Za-z0-9_]*#)?([+-]?)(?:(2|8|10|16)#)?([0-9A-Fa-f]+)");

    /**
     * Text of a literal, or of a negated literal ({@code -5}). Anything else has no literal value.
     */
    public static Optional<String> literal(Expression expression) {
        if (expression instanceof LiteralExpression literal) {
            return Optional.of(literal.getValue());
        }
        if (expression instanceof UnaryExpression unary
                && unary.getOperator() == Operator.MINUS
                && unary.getValue() instanceof LiteralExpression literal) {
            return Optional.of(negate(literal.getValue()));
        }
        return Optional.empty();
    }

    /**
     * Value of an enumeration member's right-hand side: a literal, a negated literal, or
     * the literal at the tail of a binary expression. The value is returned as decimal text,
     * so {@code 16#10} and {@code INT#2#1_0000} both read as {@code 16}. Literals that are
     * not integers have no value.
     */
    public static Optional<String> enumValue(Expression expression) {
        Optional<String> direct = literal(expression);
        if (direct.isPresent()) {
            return direct.flatMap(ExpressionValues::decimal);
        }
        if (expression instanceof BinaryExpression binary) {
            return enumValue(binary.getRight());
        }
        return Optional.empty();
    }

    /**
     * Decimal text of an IEC integer literal, e.g. {@code -16#FF}, {@code DINT#42} or
     * {@code 1_000}. Empty when the text is not an integer that fits a {@code long}.
     */
    public static Optional<String> decimal(String literal) {
        Matcher matcher = INTEGER_LITERAL.matcher(literal.trim().replace("_", ""));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        boolean negative = matcher.group(1).equals("-") ^ matcher.group(2).equals("-");
        int radix = matcher.group(3) == null ? 10 : Integer.parseInt(matcher.group(3));
        try {
            long value = Long.parseLong((negative ? "-" : "") + matcher.group(4), radix);
            return Optional.of(Long.toString(value));
        } catch (NumberFormatException e) {
            // hex digits without a base prefix, or out of range
            return Optional.empty();
        }
    }

    private static String negate(String value) {
        String trimmed = value.trim();
        return trimmed.startsWith("-") ? trimmed.substring(1) : "-" + trimmed;
    }
}
