package com.vidnyan.ecv.domain.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for the edit-check condition language.
 * <pre>
 * expr      := IF orExpr THEN expr [ELSE expr] | orExpr
 * orExpr    := andExpr (OR andExpr)*
 * andExpr   := notExpr (AND notExpr)*
 * notExpr   := NOT notExpr | '(' expr ')' | predicate
 * predicate := operand [ op operand | [NOT] IN (literal, ...) | [NOT] BETWEEN operand AND operand
 *                      | IS [NOT] NULL ]
 * </pre>
 * Keywords are case-insensitive. A bare field reference is read as {@code field = TRUE}.
 * Stateless and thread-safe.
 */
public class ConditionParser {

    private static final Set<String> KEYWORDS = Set.of(
            "AND", "OR", "NOT", "IF", "THEN", "ELSE", "IN", "BETWEEN", "IS", "NULL", "TRUE", "FALSE");

    /**
     * Parse or return empty when the text is blank or not in the grammar.
     */
    public Optional<Condition> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parseStrict(text));
        } catch (ConditionParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Parse or throw {@link ConditionParseException}.
     */
    public Condition parseStrict(String text) {
        if (text == null || text.isBlank()) {
            throw new ConditionParseException("Empty condition", 0);
        }
        Cursor cursor = new Cursor(tokenize(text));
        Condition condition = cursor.expression();
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected '" + cursor.peek().text() + "'");
        }
        return condition;
    }

    // ---------------------------------------------------------------- tokens

    enum TokenType { FIELD, NUMBER, STRING, KEYWORD, OPERATOR, LPAREN, RPAREN, COMMA, MINUS }

    record Token(TokenType type, String text, int position) {
        boolean isKeyword(String keyword) {
            return type == TokenType.KEYWORD && text.equals(keyword);
        }
    }

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i++));
            } else if (c == '-') {
                tokens.add(new Token(TokenType.MINUS, "-", i++));
            } else if (c == '\'' || c == '"') {
                i = readString(text, i, c, tokens);
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < text.length()
                    && Character.isDigit(text.charAt(i + 1)))) {
                int start = i;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length()
                        && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '.')) {
                    i++;
                }
                String word = text.substring(start, i);
                String upper = word.toUpperCase(Locale.ROOT);
                if (KEYWORDS.contains(upper)) {
                    tokens.add(new Token(TokenType.KEYWORD, upper, start));
                } else if (word.indexOf('.') > 0 && !word.endsWith(".")) {
                    tokens.add(new Token(TokenType.FIELD, word, start));
                } else {
                    throw new ConditionParseException("Unqualified field reference '" + word + "'", start);
                }
            } else if ("<>=!".indexOf(c) >= 0) {
                int start = i;
                String two = i + 1 < text.length() ? text.substring(i, i + 2) : "";
                String symbol = switch (two) {
                    case "<=", ">=", "!=", "<>", "==" -> two;
                    default -> String.valueOf(c);
                };
                if (symbol.equals("!")) {
                    throw new ConditionParseException("Unexpected '!'", start);
                }
                i += symbol.length();
                tokens.add(new Token(TokenType.OPERATOR, symbol, start));
            } else {
                throw new ConditionParseException("Unexpected character '" + c + "'", i);
            }
        }
        return tokens;
    }

    private static int readString(String text, int start, char quote, List<Token> tokens) {
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    value.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return i + 1;
            }
            value.append(c);
            i++;
        }
        throw new ConditionParseException("Unterminated string literal", start);
    }

    // ---------------------------------------------------------------- grammar

    private static final class Cursor {
        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token peek() {
            return atEnd() ? null : tokens.get(index);
        }

        Token next() {
            if (atEnd()) {
                throw error("Unexpected end of condition");
            }
            return tokens.get(index++);
        }

        boolean acceptKeyword(String keyword) {
            if (!atEnd() && peek().isKeyword(keyword)) {
                index++;
                return true;
            }
            return false;
        }

        boolean acceptKeywords(String first, String second) {
            if (index + 1 < tokens.size()
                    && tokens.get(index).isKeyword(first) && tokens.get(index + 1).isKeyword(second)) {
                index += 2;
                return true;
            }
            return false;
        }

        void expectKeyword(String keyword) {
            if (!acceptKeyword(keyword)) {
                throw error("Expected " + keyword);
            }
        }

        void expect(TokenType type) {
            Token token = next();
            if (token.type() != type) {
                throw new ConditionParseException("Expected " + type + " but found '" + token.text() + "'",
                        token.position());
            }
        }

        ConditionParseException error(String message) {
            int position = atEnd()
                    ? (tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position())
                    : peek().position();
            return new ConditionParseException(message, position);
        }

        Condition expression() {
            if (acceptKeyword("IF")) {
                Condition test = orExpression();
                expectKeyword("THEN");
                Condition then = expression();
                Condition otherwise = acceptKeyword("ELSE") ? expression() : null;
                return new Condition.IfThenElse(test, then, otherwise);
            }
            return orExpression();
        }

        Condition orExpression() {
            List<Condition> parts = new ArrayList<>();
            parts.add(andExpression());
            while (acceptKeyword("OR")) {
                parts.add(andExpression());
            }
            return parts.size() == 1 ? parts.get(0) : new Condition.Or(parts);
        }

        Condition andExpression() {
            List<Condition> parts = new ArrayList<>();
            parts.add(notExpression());
            while (acceptKeyword("AND")) {
                parts.add(notExpression());
            }
            return parts.size() == 1 ? parts.get(0) : new Condition.And(parts);
        }

        Condition notExpression() {
            if (acceptKeyword("NOT")) {
                return new Condition.Not(notExpression());
            }
            if (!atEnd() && peek().type() == TokenType.LPAREN) {
                index++;
                Condition inner = expression();
                expect(TokenType.RPAREN);
                return inner;
            }
            return predicate();
        }

        Condition predicate() {
            Operand left = operand();

            if (!atEnd() && peek().type() == TokenType.OPERATOR) {
                Token op = next();
                ComparisonOperator operator = ComparisonOperator.fromSymbol(op.text())
                        .orElseThrow(() -> new ConditionParseException("Unknown operator " + op.text(), op.position()));
                Operand right = operand();
                if (right instanceof Literal l && l.isNull() && operator.isOrdering()) {
                    throw new ConditionParseException("NULL only supports = and !=", op.position());
                }
                return new Condition.Comparison(left, operator, right);
            }
            if (acceptKeywords("NOT", "IN")) {
                return new Condition.Not(inList(left));
            }
            if (acceptKeyword("IN")) {
                return inList(left);
            }
            if (acceptKeywords("NOT", "BETWEEN")) {
                return new Condition.Not(between(left));
            }
            if (acceptKeyword("BETWEEN")) {
                return between(left);
            }
            if (acceptKeyword("IS")) {
                boolean negated = acceptKeyword("NOT");
                expectKeyword("NULL");
                return new Condition.Comparison(left, negated ? ComparisonOperator.NE : ComparisonOperator.EQ,
                        Literal.NULL);
            }
            if (left instanceof FieldRef) {
                return new Condition.Comparison(left, ComparisonOperator.EQ, Literal.bool(true));
            }
            throw error("Expected a comparison after " + left);
        }

        Condition inList(Operand left) {
            expect(TokenType.LPAREN);
            List<Condition> options = new ArrayList<>();
            options.add(new Condition.Comparison(left, ComparisonOperator.EQ, operand()));
            while (!atEnd() && peek().type() == TokenType.COMMA) {
                index++;
                options.add(new Condition.Comparison(left, ComparisonOperator.EQ, operand()));
            }
            expect(TokenType.RPAREN);
            return options.size() == 1 ? options.get(0) : new Condition.Or(options);
        }

        Condition between(Operand subject) {
            Operand low = operand();
            expectKeyword("AND");
            Operand high = operand();
            return new Condition.And(List.of(
                    new Condition.Comparison(subject, ComparisonOperator.GE, low),
                    new Condition.Comparison(subject, ComparisonOperator.LE, high)));
        }

        Operand operand() {
            Token token = next();
            return switch (token.type()) {
                case FIELD -> FieldRef.parse(token.text());
                case NUMBER -> Literal.number(number(token));
                case STRING -> Literal.string(token.text());
                case MINUS -> {
                    Token digits = next();
                    if (digits.type() != TokenType.NUMBER) {
                        throw new ConditionParseException("Expected number after '-'", digits.position());
                    }
                    yield Literal.number(number(digits).negate());
                }
                case KEYWORD -> switch (token.text()) {
                    case "TRUE" -> Literal.bool(true);
                    case "FALSE" -> Literal.bool(false);
                    case "NULL" -> Literal.NULL;
                    default -> throw new ConditionParseException("Unexpected keyword " + token.text(),
                            token.position());
                };
                default -> throw new ConditionParseException("Unexpected '" + token.text() + "'", token.position());
            };
        }

        private static BigDecimal number(Token token) {
            try {
                return new BigDecimal(token.text());
            } catch (NumberFormatException e) {
                throw new ConditionParseException("Malformed number '" + token.text() + "'", token.position());
            }
        }
    }
}
