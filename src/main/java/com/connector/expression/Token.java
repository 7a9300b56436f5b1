package com.connector.expression;

record Token(Type type, String text, int position) {

    enum Type {
        NUMBER,
        STRING,
        IDENTIFIER,
        OPERATOR,
        EOF
    }

    boolean is(Type expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    boolean isOperator(String operator) {
        return is(Type.OPERATOR, operator);
    }
}
