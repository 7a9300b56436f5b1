package com.connector.expression;

import com.connector.exception.EvaluationException;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the contents of a {@code {{ }}} block.
 * <pre>
 * expression     := or
 * or             := and ( "||" and )*
 * and            := equality ( "&amp;&amp;" equality )*
 * equality       := comparison ( ( "=" | "==" | "!=" ) comparison )*
 * comparison     := additive ( ( "&lt;" | "&lt;=" | "&gt;" | "&gt;=" ) additive )*
 * additive       := multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative := unary ( ( "*" | "/" | "%" ) unary )*
 * unary          := ( "!" | "-" ) unary | postfix
 * postfix        := primary ( "." ( IDENTIFIER | NUMBER ) | "[" expression "]" )*
 * primary        := NUMBER | STRING | true | false | null | IDENTIFIER [ "(" arguments ")" ]
 *                 | "(" expression ")" | "[" [ expression ( "," expression )* ] "]"
 * arguments      := [ expression ( ( ";" | "," ) expression )* ]
 * </pre>
 */
public final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int current;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    public static Expr parse(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        if (parser.peek().type() == Token.Type.EOF) {
            throw new EvaluationException("Empty expression", source);
        }
        Expr expr = parser.expression();
        if (parser.peek().type() != Token.Type.EOF) {
            throw parser.error("Unexpected token '" + parser.peek().text() + "'");
        }
        return expr;
    }

    private Expr expression() {
        return or();
    }

    private Expr or() {
        Expr left = and();
        while (matchOperator("||")) {
            left = new Expr.Binary("||", left, and());
        }
        return left;
    }

    private Expr and() {
        Expr left = equality();
        while (matchOperator("&&")) {
            left = new Expr.Binary("&&", left, equality());
        }
        return left;
    }

    private Expr equality() {
        Expr left = comparison();
        while (true) {
            if (matchOperator("=") || matchOperator("==")) {
                left = new Expr.Binary("=", left, comparison());
            } else if (matchOperator("!=")) {
                left = new Expr.Binary("!=", left, comparison());
            } else {
                return left;
            }
        }
    }

    private Expr comparison() {
        Expr left = additive();
        while (peek().type() == Token.Type.OPERATOR && List.of("<", "<=", ">", ">=").contains(peek().text())) {
            String operator = advance().text();
            left = new Expr.Binary(operator, left, additive());
        }
        return left;
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String operator = advance().text();
            left = new Expr.Binary(operator, left, multiplicative());
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
            String operator = advance().text();
            left = new Expr.Binary(operator, left, unary());
        }
        return left;
    }

    private Expr unary() {
        if (matchOperator("!")) {
            return new Expr.Unary("!", unary());
        }
        if (matchOperator("-")) {
            return new Expr.Unary("-", unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (matchOperator(".")) {
                Token name = advance();
                if (name.type() != Token.Type.IDENTIFIER && name.type() != Token.Type.NUMBER) {
                    throw error("Expected a property name after '.'");
                }
                expr = new Expr.Member(expr, name.text());
            } else if (matchOperator("[")) {
                Expr index = expression();
                expect("]");
                expr = new Expr.Index(expr, index);
            } else {
                return expr;
            }
        }
    }

    private Expr primary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new Expr.Literal(ValueCoercion.number(new BigDecimal(token.text())));
            case STRING:
                return new Expr.Literal(TextNode.valueOf(token.text()));
            case IDENTIFIER:
                return identifier(token);
            case OPERATOR:
                if (token.isOperator("(")) {
                    Expr inner = expression();
                    expect(")");
                    return inner;
                }
                if (token.isOperator("[")) {
                    return arrayLiteral();
                }
                break;
            default:
                break;
        }
        current--;
        throw error(token.type() == Token.Type.EOF ? "Unexpected end of expression" : "Unexpected token '" + token.text() + "'");
    }

    private Expr identifier(Token token) {
        switch (token.text()) {
            case "true":
                return new Expr.Literal(BooleanNode.TRUE);
            case "false":
                return new Expr.Literal(BooleanNode.FALSE);
            case "null":
                return new Expr.Literal(NullNode.getInstance());
            default:
                break;
        }
        if (matchOperator("(")) {
            List<Expr> arguments = new ArrayList<>();
            if (!matchOperator(")")) {
                do {
                    arguments.add(expression());
                } while (matchOperator(";") || matchOperator(","));
                expect(")");
            }
            return new Expr.Call(token.text(), arguments);
        }
        return new Expr.Variable(token.text());
    }

    private Expr arrayLiteral() {
        List<Expr> elements = new ArrayList<>();
        if (!matchOperator("]")) {
            do {
                elements.add(expression());
            } while (matchOperator(",") || matchOperator(";"));
            expect("]");
        }
        return new Expr.ArrayLiteral(elements);
    }

    private boolean matchOperator(String operator) {
        if (peek().isOperator(operator)) {
            current++;
            return true;
        }
        return false;
    }

    private void expect(String operator) {
        if (!matchOperator(operator)) {
            throw error("Expected '" + operator + "'");
        }
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != Token.Type.EOF) {
            current++;
        }
        return token;
    }

    private EvaluationException error(String message) {
        return new EvaluationException(message + " at position " + peek().position(), source);
    }
}
