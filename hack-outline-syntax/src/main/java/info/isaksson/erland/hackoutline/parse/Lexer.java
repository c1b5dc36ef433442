package info.isaksson.erland.hackoutline.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Hack/PHP source into tokens.
 *
 * <p>The lexer never fails: unterminated strings and comments run to the end of the input and
 * unknown characters become single-character {@link TokenType#PUNCT} tokens. Comments and whitespace
 * are dropped, as is a leading {@code <?hh}/{@code <?php} open tag (and a {@code #!} line before it).</p>
 */
public final class Lexer {

    private static final String[] MULTI_CHAR_PUNCT = {"?->", "...", "::", "->", "=>"};

    private final String src;
    private final int length;
    private int i;

    private Lexer(String src) {
        this.src = src == null ? "" : src;
        this.length = this.src.length();
    }

    public static List<Token> tokenize(String content) {
        return new Lexer(content).run();
    }

    private List<Token> run() {
        List<Token> out = new ArrayList<>();
        skipHeader();
        while (true) {
            skipTrivia();
            if (i >= length) break;
            out.add(nextToken());
        }
        out.add(new Token(TokenType.EOF, "", length, length));
        return out;
    }

    private void skipHeader() {
        if (src.startsWith("#!")) {
            while (i < length && src.charAt(i) != '\n') i++;
            if (i < length) i++;
        }
        if (src.startsWith("<?hh", i)) {
            i += 4;
        } else if (src.regionMatches(true, i, "<?php", 0, 5)) {
            i += 5;
        }
    }

    private void skipTrivia() {
        while (i < length) {
            char c = src.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#' || (c == '/' && peekChar(1) == '/')) {
                while (i < length && src.charAt(i) != '\n') i++;
            } else if (c == '/' && peekChar(1) == '*') {
                int close = src.indexOf("*/", i + 2);
                i = close < 0 ? length : close + 2;
            } else {
                return;
            }
        }
    }

    private Token nextToken() {
        int start = i;
        char c = src.charAt(i);

        if (c == '$' && isNameStart(peekChar(1))) {
            i++;
            consumeNameChars();
            return token(TokenType.VARIABLE, start);
        }
        if (isNameStart(c) || (c == '\\' && isNameStart(peekChar(1)))) {
            boolean qualified = false;
            if (c == '\\') {
                qualified = true;
                i++;
            }
            consumeNameChars();
            while (i < length && src.charAt(i) == '\\' && isNameStart(peekChar(1))) {
                qualified = true;
                i++;
                consumeNameChars();
            }
            return token(qualified ? TokenType.QUALIFIED_NAME : TokenType.IDENTIFIER, start);
        }
        if (Character.isDigit(c)) {
            while (i < length && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_'
                    || (src.charAt(i) == '.' && Character.isDigit(peekChar(1))))) {
                i++;
            }
            return token(TokenType.NUMBER, start);
        }
        if (c == '\'' || c == '"' || c == '`') {
            consumeQuoted(c);
            return token(TokenType.STRING, start);
        }
        if (src.startsWith("<<<", i) && looksLikeHeredoc()) {
            consumeHeredoc();
            return token(TokenType.STRING, start);
        }
        for (String p : MULTI_CHAR_PUNCT) {
            if (src.startsWith(p, i)) {
                i += p.length();
                return token(TokenType.PUNCT, start);
            }
        }
        i++;
        return token(TokenType.PUNCT, start);
    }

    private Token token(TokenType type, int start) {
        return new Token(type, src.substring(start, i), start, i);
    }

    private void consumeNameChars() {
        while (i < length && isNamePart(src.charAt(i))) i++;
    }

    private void consumeQuoted(char quote) {
        i++;
        while (i < length) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                i++;
                return;
            } else {
                i++;
            }
        }
        i = length;
    }

    private boolean looksLikeHeredoc() {
        int j = i + 3;
        while (j < length && (src.charAt(j) == ' ' || src.charAt(j) == '\t')) j++;
        if (j < length && (src.charAt(j) == '\'' || src.charAt(j) == '"')) j++;
        return j < length && isNameStart(src.charAt(j));
    }

    private void consumeHeredoc() {
        i += 3;
        while (i < length && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) i++;
        if (src.charAt(i) == '\'' || src.charAt(i) == '"') i++;
        int labelStart = i;
        consumeNameChars();
        String label = src.substring(labelStart, i);
        // Skip to the end of the opening line, then look for a line starting with the label.
        while (i < length && src.charAt(i) != '\n') i++;
        while (i < length) {
            i++; // past '\n'
            int lineStart = i;
            while (i < length && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) i++;
            if (src.startsWith(label, i) && !isNamePart(charAt(i + label.length()))) {
                i += label.length();
                return;
            }
            i = lineStart;
            while (i < length && src.charAt(i) != '\n') i++;
        }
        i = length;
    }

    private char peekChar(int ahead) {
        return charAt(i + ahead);
    }

    private char charAt(int idx) {
        return idx < length ? src.charAt(idx) : '\0';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }
}
