package com.connector.expression;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Abstract syntax tree of an embedded expression.
 */
public interface Expr {

    record Literal(JsonNode value) implements Expr {
    }

    record ArrayLiteral(List<Expr> elements) implements Expr {
    }

    /**
     * A top-level scope variable such as {@code parameters} or {@code body}.
     */
    record Variable(String name) implements Expr {
    }

    /**
     * {@code target.name}; on arrays a non-numeric name projects over the elements.
     */
    record Member(Expr target, String name) implements Expr {
    }

    /**
     * {@code target[index]}.
     */
    record Index(Expr target, Expr index) implements Expr {
    }

    record Unary(String operator, Expr operand) implements Expr {
    }

    record Binary(String operator, Expr left, Expr right) implements Expr {
    }

    record Call(String name, List<Expr> arguments) implements Expr {
    }
}
