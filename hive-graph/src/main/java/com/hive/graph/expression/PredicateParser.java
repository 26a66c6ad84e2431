package com.hive.graph.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive-descent parser for the predicate language used on edges and in conditional rules.
 * <pre>
 * or    := and (('||' | 'or') and)*
 * and   := not (('&amp;&amp;' | 'and') not)*
 * not   := ('!' | 'not') not | cmp
 * cmp   := term (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') term)?
 * term  := number | string | true | false | null | path | '(' or ')'
 * path  := ident ('.' ident | '.' index)*
 * </pre>
 * Parsed expressions are immutable and thread-safe.
 */
public final class PredicateParser {

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private PredicateParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    /**
     * Parses {@code expression}.
     *
     * @throws PredicateSyntaxException when the expression is blank or malformed
     */
    public static PredicateExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new PredicateSyntaxException(String.valueOf(expression), 0, "Empty expression");
        }
        PredicateParser parser = new PredicateParser(expression);
        PredicateExpression result = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.type != TokenType.EOF) {
            throw parser.error(trailing, "Unexpected '" + trailing.text + "'");
        }
        return result;
    }

    private PredicateExpression parseOr() {
        PredicateExpression left = parseAnd();
        while (peek().isOperator("||") || peek().isKeyword("or")) {
            pos++;
            PredicateExpression l = left;
            PredicateExpression r = parseAnd();
            left = scope -> Truthiness.isTruthy(l.evaluate(scope)) || Truthiness.isTruthy(r.evaluate(scope));
        }
        return left;
    }

    private PredicateExpression parseAnd() {
        PredicateExpression left = parseNot();
        while (peek().isOperator("&&") || peek().isKeyword("and")) {
            pos++;
            PredicateExpression l = left;
            PredicateExpression r = parseNot();
            left = scope -> Truthiness.isTruthy(l.evaluate(scope)) && Truthiness.isTruthy(r.evaluate(scope));
        }
        return left;
    }

    private PredicateExpression parseNot() {
        if (peek().isOperator("!") || peek().isKeyword("not")) {
            pos++;
            PredicateExpression inner = parseNot();
            return scope -> !Truthiness.isTruthy(inner.evaluate(scope));
        }
        return parseComparison();
    }

    private PredicateExpression parseComparison() {
        PredicateExpression left = parseTerm();
        Token t = peek();
        if (t.type == TokenType.OPERATOR && Comparison.isComparison(t.text)) {
            pos++;
            PredicateExpression right = parseTerm();
            String op = t.text;
            return scope -> Comparison.apply(op, left.evaluate(scope), right.evaluate(scope));
        }
        return left;
    }

    private PredicateExpression parseTerm() {
        Token t = next();
        switch (t.type) {
            case NUMBER -> {
                BigDecimal value = new BigDecimal(t.text);
                return scope -> value;
            }
            case STRING -> {
                String value = t.text;
                return scope -> value;
            }
            case LPAREN -> {
                PredicateExpression inner = parseOr();
                Token close = next();
                if (close.type != TokenType.RPAREN) throw error(close, "Expected ')'");
                return inner;
            }
            case IDENT -> {
                switch (t.text) {
                    case "true":
                        return scope -> Boolean.TRUE;
                    case "false":
                        return scope -> Boolean.FALSE;
                    case "null":
                        return scope -> null;
                    case "and", "or", "not":
                        throw error(t, "Unexpected keyword '" + t.text + "'");
                    default:
                        return parsePath(t.text);
                }
            }
            default -> throw error(t, t.type == TokenType.EOF ? "Unexpected end of expression" : "Unexpected '" + t.text + "'");
        }
    }

    private PredicateExpression parsePath(String head) {
        List<String> segments = new ArrayList<>();
        segments.add(head);
        while (peek().type == TokenType.DOT) {
            pos++;
            Token seg = next();
            if (seg.type != TokenType.IDENT && seg.type != TokenType.INDEX) {
                throw error(seg, "Expected path segment after '.'");
            }
            segments.add(seg.text);
        }
        List<String> path = List.copyOf(segments);
        return scope -> resolve(scope, path);
    }

    /** Resolves a dotted path through nested maps and lists; missing segments yield null. */
    static Object resolve(Map<String, ?> scope, List<String> path) {
        if (scope == null) return null;
        Object current = scope.get(path.get(0));
        for (int i = 1; i < path.size() && current != null; i++) {
            String seg = path.get(i);
            if (current instanceof Map<?, ?> m) {
                current = m.get(seg);
            } else if (current instanceof List<?> list && isIndex(seg)) {
                int idx = Integer.parseInt(seg);
                current = idx < list.size() ? list.get(idx) : null;
            } else {
                current = null;
            }
        }
        return current;
    }

    private static boolean isIndex(String seg) {
        if (seg.isEmpty() || seg.length() > 9) return false;
        for (int i = 0; i < seg.length(); i++) {
            if (!Character.isDigit(seg.charAt(i))) return false;
        }
        return true;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type != TokenType.EOF) pos++;
        return t;
    }

    private PredicateSyntaxException error(Token t, String message) {
        return new PredicateSyntaxException(source, t.position, message);
    }

    private static List<Token> tokenize(String s) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            boolean afterDot = !out.isEmpty() && out.get(out.size() - 1).type == TokenType.DOT;
            if (afterDot && Character.isDigit(c)) {
                while (i < n && Character.isDigit(s.charAt(i))) i++;
                out.add(new Token(TokenType.INDEX, s.substring(start, i), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < n && Character.isDigit(s.charAt(i + 1)))) {
                i++;
                while (i < n && Character.isDigit(s.charAt(i))) i++;
                if (i + 1 < n && s.charAt(i) == '.' && Character.isDigit(s.charAt(i + 1))) {
                    i++;
                    while (i < n && Character.isDigit(s.charAt(i))) i++;
                }
                out.add(new Token(TokenType.NUMBER, s.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < n && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_' || s.charAt(i) == '-')) i++;
                out.add(new Token(TokenType.IDENT, s.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char d = s.charAt(i);
                    if (d == '\\' && i + 1 < n) {
                        sb.append(s.charAt(i + 1));
                        i += 2;
                    } else if (d == c) {
                        i++;
                        closed = true;
                        break;
                    } else {
                        sb.append(d);
                        i++;
                    }
                }
                if (!closed) throw new PredicateSyntaxException(s, start, "Unterminated string");
                out.add(new Token(TokenType.STRING, sb.toString(), start));
            } else if (c == '(') {
                out.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (c == ')') {
                out.add(new Token(TokenType.RPAREN, ")", i++));
            } else if (c == '.') {
                out.add(new Token(TokenType.DOT, ".", i++));
            } else {
                String two = i + 1 < n ? s.substring(i, i + 2) : "";
                switch (two) {
                    case "==", "!=", "<=", ">=", "&&", "||" -> {
                        out.add(new Token(TokenType.OPERATOR, two, i));
                        i += 2;
                    }
                    default -> {
                        if (c == '<' || c == '>' || c == '!') {
                            out.add(new Token(TokenType.OPERATOR, String.valueOf(c), i++));
                        } else {
                            throw new PredicateSyntaxException(s, i, "Unexpected character '" + c + "'");
                        }
                    }
                }
            }
        }
        out.add(new Token(TokenType.EOF, "", n));
        return out;
    }

    private enum TokenType { NUMBER, STRING, IDENT, INDEX, OPERATOR, LPAREN, RPAREN, DOT, EOF }

    private record Token(TokenType type, String text, int position) {
        boolean isOperator(String op) {
            return type == TokenType.OPERATOR && text.equals(op);
        }

        boolean isKeyword(String kw) {
            return type == TokenType.IDENT && text.equals(kw);
        }
    }

    /** Comparison semantics: numbers numerically, everything else by string form. */
    static final class Comparison {

        private Comparison() {
        }

        static boolean isComparison(String op) {
            return switch (op) {
                case "==", "!=", "<", "<=", ">", ">=" -> true;
                default -> false;
            };
        }

        static Boolean apply(String op, Object left, Object right) {
            if (op.equals("==")) return equal(left, right);
            if (op.equals("!=")) return !equal(left, right);
            if (left == null || right == null) return false;
            int cmp;
            if (left instanceof Number l && right instanceof Number r) {
                if (!Truthiness.isFinite(l) || !Truthiness.isFinite(r)) {
                    return compareDoubles(op, l.doubleValue(), r.doubleValue());
                }
                cmp = Truthiness.toBigDecimal(l).compareTo(Truthiness.toBigDecimal(r));
            } else {
                cmp = String.valueOf(left).compareTo(String.valueOf(right));
            }
            return switch (op) {
                case "<" -> cmp < 0;
                case "<=" -> cmp <= 0;
                case ">" -> cmp > 0;
                default -> cmp >= 0;
            };
        }

        // IEEE semantics: NaN matches no comparison, infinities order past every finite value
        private static boolean compareDoubles(String op, double l, double r) {
            return switch (op) {
                case "<" -> l < r;
                case "<=" -> l <= r;
                case ">" -> l > r;
                default -> l >= r;
            };
        }

        private static boolean equal(Object left, Object right) {
            if (left == null || right == null) return left == right;
            if (left instanceof Number l && right instanceof Number r) {
                if (!Truthiness.isFinite(l) || !Truthiness.isFinite(r)) return l.doubleValue() == r.doubleValue();
                return Truthiness.toBigDecimal(l).compareTo(Truthiness.toBigDecimal(r)) == 0;
            }
            return Objects.equals(String.valueOf(left), String.valueOf(right));
        }
    }
}
