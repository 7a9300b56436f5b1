package com.connector.expression;

import com.connector.exception.EvaluationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed template string: literal text interleaved with {@code {{ }}} expressions.
 */
public final class Template {

    public static final String SPLICE_KEY = "{{...}}";

    private final String source;
    private final List<Segment> segments;

    private Template(String source, List<Segment> segments) {
        this.source = source;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * One piece of a template; exactly one of {@code text} and {@code expression} is set.
     */
    public record Segment(String text, Expr expression, String expressionSource) {

        public boolean isLiteral() {
            return expression == null;
        }
    }

    public static boolean containsMarkers(String text) {
        return text != null && text.contains("{{");
    }

    public static boolean isSpliceKey(String key) {
        return key != null && SPLICE_KEY.equals(key.trim());
    }

    public static Template parse(String source) {
        List<Segment> segments = new ArrayList<>();
        int position = 0;
        while (position < source.length()) {
            int open = source.indexOf("{{", position);
            if (open < 0) {
                segments.add(new Segment(source.substring(position), null, null));
                break;
            }
            if (open > position) {
                segments.add(new Segment(source.substring(position, open), null, null));
            }
            int close = findClose(source, open + 2);
            String inner = source.substring(open + 2, close).trim();
            segments.add(new Segment(null, ExpressionParser.parse(inner), inner));
            position = close + 2;
        }
        return new Template(source, segments);
    }

    private static int findClose(String source, int from) {
        char quote = 0;
        for (int i = from; i < source.length() - 1; i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == '}' && source.charAt(i + 1) == '}') {
                return i;
            }
        }
        throw new EvaluationException("Unterminated '{{' in template", source);
    }

    public String getSource() {
        return source;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    /**
     * A template consisting of exactly one expression evaluates to that expression's typed value rather
     * than to text.
     */
    public boolean isSingleExpression() {
        return segments.size() == 1 && !segments.get(0).isLiteral();
    }
}
