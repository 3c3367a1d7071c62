package nl.bytesoflife.wirebom.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes KiCad s-expression text into {@link SNode} trees.
 * Malformed structure (unbalanced parentheses, unterminated strings, stray text
 * between top-level lists) raises {@link ParseException}.
 */
public class SExpressionParser {

    private String input;
    private int pos;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        List<SNode> nodes = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespace();
            if (pos >= input.length()) break;
            char c = input.charAt(pos);
            if (c == '(') {
                nodes.add(parseList());
            } else if (c == ')') {
                throw new ParseException("Unbalanced ')' at position " + pos, pos);
            } else {
                throw new ParseException("Unexpected text outside of a list at position " + pos, pos);
            }
        }
        return nodes;
    }

    private SNode.SList parseList() {
        int start = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
        throw new ParseException("Unexpected end of input, list opened at position " + start + " is never closed", pos);
    }

    private SNode.SAtom parseQuotedString() {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString());
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                char escaped = input.charAt(pos);
                sb.append(escaped == 'n' ? '\n' : escaped);
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw new ParseException("Unterminated quoted string starting at position " + start, pos);
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw new ParseException("Expected atom at position " + pos, pos);
        }
        return new SNode.SAtom(input.substring(start, pos));
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw new ParseException("Expected '" + expected + "' at position " + pos, pos);
        }
        pos++;
    }

    public static class ParseException extends RuntimeException {
        private final int position;

        public ParseException(String message, int position) {
            super(message);
            this.position = position;
        }

        public ParseException(String message, Throwable cause) {
            super(message, cause);
            this.position = -1;
        }

        public int getPosition() {
            return position;
        }
    }
}
