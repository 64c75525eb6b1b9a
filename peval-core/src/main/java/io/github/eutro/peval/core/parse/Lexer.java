package io.github.eutro.peval.core.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into {@link Token}s, producing {@link Token.Type#INDENT INDENT} and
 * {@link Token.Type#DEDENT DEDENT} tokens from leading whitespace.
 * <p>
 * Newlines inside brackets, and after a backslash, do not end a logical line.
 */
public class Lexer {
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=",
            "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "@", "=",
    };

    private final String src;
    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;
    private int depth = 0;
    private final List<Integer> indents = new ArrayList<>();
    private final List<Token> tokens = new ArrayList<>();

    private Lexer(String src) {
        this.src = src;
        indents.add(0);
    }

    /**
     * Tokenize some source text.
     *
     * @param src The source.
     * @return The tokens, ending in {@link Token.Type#EOF}.
     * @throws ParseException If the source contains an invalid token or inconsistent indentation.
     */
    public static List<Token> tokenize(String src) {
        Lexer lexer = new Lexer(src);
        lexer.run();
        return lexer.tokens;
    }

    private ParseException error(String message) {
        return new ParseException(message, line, pos - lineStart + 1);
    }

    private void add(Token.Type type, String text, Object value, int start) {
        tokens.add(new Token(type, text, value, line, start - lineStart + 1));
    }

    private boolean atLogicalLineStart() {
        if (tokens.isEmpty()) return true;
        Token.Type last = tokens.get(tokens.size() - 1).type;
        return last == Token.Type.NEWLINE || last == Token.Type.INDENT || last == Token.Type.DEDENT;
    }

    private void run() {
        boolean lineStartPending = true;
        while (pos < src.length()) {
            if (lineStartPending) {
                if (readIndentation()) continue;
                lineStartPending = false;
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                if (depth == 0 && !atLogicalLineStart()) {
                    add(Token.Type.NEWLINE, "\n", null, pos);
                }
                newline();
                lineStartPending = depth == 0;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos++;
                    newline();
                } else if (pos + 2 < src.length() && src.charAt(pos + 1) == '\r' && src.charAt(pos + 2) == '\n') {
                    pos += 2;
                    newline();
                } else {
                    throw error("unexpected character after line continuation");
                }
            } else if (Character.isDigit(c) || c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(false);
            } else if ((c == 'r' || c == 'R') && pos + 1 < src.length()
                    && (src.charAt(pos + 1) == '"' || src.charAt(pos + 1) == '\'')) {
                pos++;
                readString(true);
            } else if (Character.isJavaIdentifierStart(c) && c != '$') {
                int start = pos;
                while (pos < src.length() && Character.isJavaIdentifierPart(src.charAt(pos)) && src.charAt(pos) != '$') {
                    pos++;
                }
                String name = src.substring(start, pos);
                add(Token.Type.NAME, name, null, start);
            } else {
                readOperator();
            }
        }
        if (!atLogicalLineStart()) {
            add(Token.Type.NEWLINE, "\n", null, pos);
        }
        for (int i = indents.size() - 1; i > 0; i--) {
            add(Token.Type.DEDENT, "", null, pos);
        }
        add(Token.Type.EOF, "", null, pos);
    }

    private void newline() {
        pos++;
        line++;
        lineStart = pos;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') pos++;
    }

    /**
     * Read the indentation of a line, emitting indent and dedent tokens.
     *
     * @return Whether the line was blank (or only a comment), and has been skipped.
     */
    private boolean readIndentation() {
        int width = 0;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c != '\r' && c != '\f') {
                break;
            }
            pos++;
        }
        if (pos >= src.length()) return true;
        char c = src.charAt(pos);
        if (c == '\n') {
            newline();
            return true;
        }
        if (c == '#') {
            skipComment();
            if (pos < src.length()) newline();
            return true;
        }
        int current = indents.get(indents.size() - 1);
        if (width > current) {
            indents.add(width);
            add(Token.Type.INDENT, "", null, pos);
        } else {
            while (width < indents.get(indents.size() - 1)) {
                indents.remove(indents.size() - 1);
                add(Token.Type.DEDENT, "", null, pos);
            }
            if (width != indents.get(indents.size() - 1)) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return false;
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                switch (op) {
                    case "(":
                    case "[":
                    case "{":
                        depth++;
                        break;
                    case ")":
                    case "]":
                    case "}":
                        if (depth == 0) throw error("unmatched '" + op + "'");
                        depth--;
                        break;
                }
                add(Token.Type.OP, op, null, pos);
                pos += op.length();
                return;
            }
        }
        throw error("unexpected character '" + src.charAt(pos) + "'");
    }

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length()) {
            char base = Character.toLowerCase(src.charAt(pos + 1));
            int radix = base == 'x' ? 16 : base == 'o' ? 8 : base == 'b' ? 2 : 0;
            if (radix != 0) {
                pos += 2;
                int digitsStart = pos;
                while (pos < src.length() && (Character.digit(src.charAt(pos), radix) >= 0 || src.charAt(pos) == '_')) {
                    pos++;
                }
                String digits = src.substring(digitsStart, pos).replace("_", "");
                if (digits.isEmpty()) throw error("invalid integer literal");
                add(Token.Type.NUMBER, src.substring(start, pos), parseLong(digits, radix), start);
                return;
            }
        }
        boolean isFloat = false;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        if (pos < src.length() && src.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                isFloat = true;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
            } else {
                pos = save;
            }
        }
        String text = src.substring(start, pos);
        String clean = text.replace("_", "");
        Object value;
        if (isFloat) {
            value = Double.parseDouble(clean);
        } else {
            value = parseLong(clean, 10);
        }
        add(Token.Type.NUMBER, text, value, start);
    }

    private Long parseLong(String digits, int radix) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw error("integer literal too large: " + digits);
        }
    }

    private void readString(boolean raw) {
        int start = raw ? pos - 1 : pos;
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(new String(new char[]{quote, quote, quote}), pos);
        pos += triple ? 3 : 1;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) throw error("unterminated string literal");
            char c = src.charAt(pos);
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (src.startsWith(new String(new char[]{quote, quote, quote}), pos)) {
                    pos += 3;
                    break;
                }
                sb.append(c);
                pos++;
            } else if (c == '\n') {
                if (!triple) throw error("unterminated string literal");
                sb.append(c);
                newline();
            } else if (c == '\\') {
                if (pos + 1 >= src.length()) throw error("unterminated string literal");
                char next = src.charAt(pos + 1);
                if (raw) {
                    sb.append(c).append(next);
                    if (next == '\n') {
                        pos++;
                        newline();
                    } else {
                        pos += 2;
                    }
                    continue;
                }
                pos += 2;
                switch (next) {
                    case '\n':
                        line++;
                        lineStart = pos;
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case '0':
                        sb.append('\0');
                        break;
                    case '\\':
                    case '\'':
                    case '"':
                        sb.append(next);
                        break;
                    case 'x':
                        sb.append((char) readHex(2));
                        break;
                    case 'u':
                        sb.append((char) readHex(4));
                        break;
                    default:
                        sb.append('\\').append(next);
                }
            } else {
                sb.append(c);
                pos++;
            }
        }
        add(Token.Type.STRING, src.substring(start, pos), sb.toString(), start);
    }

    private int readHex(int digits) {
        if (pos + digits > src.length()) throw error("truncated escape sequence");
        try {
            int value = Integer.parseInt(src.substring(pos, pos + digits), 16);
            pos += digits;
            return value;
        } catch (NumberFormatException e) {
            throw error("invalid escape sequence");
        }
    }
}
