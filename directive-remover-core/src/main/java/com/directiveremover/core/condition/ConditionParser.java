package com.directiveremover.core.condition;

/**
 * Recursive-descent parser for preprocessor conditions.
 *
 * <pre>
 *   or      := and ('||' and)*
 *   and     := eq ('&amp;&amp;' eq)*
 *   eq      := unary (('==' | '!=') unary)*
 *   unary   := '!' unary | primary
 *   primary := '(' or ')' | identifier
 * </pre>
 *
 * Instances are single-use: one parser per condition string.
 */
public class ConditionParser {

    private final String text;
    private int pos;

    private ConditionParser(String text) {
        this.text = text;
    }

    public static Condition parse(String conditionText) throws ConditionParseException {
        ConditionParser parser = new ConditionParser(conditionText);
        parser.skipWhitespace();
        if (parser.atEnd()) {
            throw new ConditionParseException("Expected expression", 0);
        }
        Condition result = parser.parseOr();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new ConditionParseException(
                "Unexpected '" + parser.text.charAt(parser.pos) + "'", parser.pos);
        }
        return result;
    }

    private Condition parseOr() throws ConditionParseException {
        Condition left = parseAnd();
        while (consume("||")) {
            left = new Condition.Or(left, parseAnd());
        }
        return left;
    }

    private Condition parseAnd() throws ConditionParseException {
        Condition left = parseEquality();
        while (consume("&&")) {
            left = new Condition.And(left, parseEquality());
        }
        return left;
    }

    private Condition parseEquality() throws ConditionParseException {
        Condition left = parseUnary();
        while (true) {
            if (consume("==")) {
                left = new Condition.Comparison(left, parseUnary(), false);
            } else if (consume("!=")) {
                left = new Condition.Comparison(left, parseUnary(), true);
            } else {
                return left;
            }
        }
    }

    private Condition parseUnary() throws ConditionParseException {
        skipWhitespace();
        // "!=" never starts an operand, so a lone '!' here is always negation
        if (peek() == '!') {
            pos++;
            return new Condition.Not(parseUnary());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() throws ConditionParseException {
        skipWhitespace();
        if (atEnd()) {
            throw new ConditionParseException("Expected expression", pos);
        }
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            Condition inner = parseOr();
            if (!consume(")")) {
                throw new ConditionParseException("')' expected", pos);
            }
            return new Condition.Paren(inner);
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            return new Condition.Identifier(text.substring(start, pos));
        }
        throw new ConditionParseException("Unexpected '" + c + "'", pos);
    }

    private boolean consume(String token) {
        skipWhitespace();
        if (text.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private char peek() {
        return atEnd() ? '\0' : text.charAt(pos);
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
