package com.connector.expression;

import com.connector.exception.EvaluationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into tokens. Identifiers may be quoted with backticks to allow arbitrary characters
 * (e.g. {@code body.`first-name`}); strings use single or double quotes with backslash escapes.
 */
final class Lexer {

    private static final List<String> OPERATORS = List.of(
            "==", "!=", "<=", ">=", "&&", "||",
            "=", "<", ">", "!", "+", "-", "*", "/", "%", ".", ",", ";", "(", ")", "[", "]");

    private final String source;
    private int position;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", position));
                return tokens;
            }
            char c = source.charAt(position);
            if (Character.isDigit(c)) {
                tokens.add(readNumber());
            } else if (c == '\'' || c == '"') {
                tokens.add(readString(c));
            } else if (c == '`') {
                tokens.add(readQuotedIdentifier());
            } else if (Character.isLetter(c) || c == '_' || c == '$') {
                tokens.add(readIdentifier());
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private Token readNumber() {
        int start = position;
        while (position < source.length() && Character.isDigit(source.charAt(position))) {
            position++;
        }
        // a fraction needs a digit after the dot, so "items.0.name" stays a path
        if (position + 1 < source.length() && source.charAt(position) == '.'
                && Character.isDigit(source.charAt(position + 1)) && !followsDot(start)) {
            position++;
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, position), start);
    }

    private boolean followsDot(int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(source.charAt(i))) {
            i--;
        }
        return i >= 0 && source.charAt(i) == '.';
    }

    private Token readString(char quote) {
        int start = position++;
        StringBuilder sb = new StringBuilder();
        while (position < source.length()) {
            char c = source.charAt(position++);
            if (c == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (c == '\\' && position < source.length()) {
                char escaped = source.charAt(position++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        throw new EvaluationException("Unterminated string literal at position " + start, source);
    }

    private Token readQuotedIdentifier() {
        int start = position++;
        int end = source.indexOf('`', position);
        if (end < 0) {
            throw new EvaluationException("Unterminated quoted identifier at position " + start, source);
        }
        String name = source.substring(position, end);
        position = end + 1;
        return new Token(Token.Type.IDENTIFIER, name, start);
    }

    private Token readIdentifier() {
        int start = position;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$') {
                position++;
            } else {
                break;
            }
        }
        return new Token(Token.Type.IDENTIFIER, source.substring(start, position), start);
    }

    private Token readOperator() {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                int start = position;
                position += operator.length();
                return new Token(Token.Type.OPERATOR, operator, start);
            }
        }
        throw new EvaluationException("Unexpected character '" + source.charAt(position) + "' at position " + position, source);
    }
}
