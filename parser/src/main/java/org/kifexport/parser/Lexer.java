package org.kifexport.parser;

import java.util.Locale;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Splits SUO-KIF source text into tokens. Comments (from {@code ;} to the end
 * of the line) and whitespace are dropped.
 */
public final class Lexer {
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");
    /**
     * Punctuation allowed inside words, on top of letters and digits.
     */
    private static final CharMatcher WORD_PUNCTUATION = CharMatcher.anyOf("_-.:+*/<=>!$%&#'~^");

    private final String text;
    private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

    private Lexer(String text) {
        this.text = text;
    }

    /**
     * Tokenize the whole text.
     *
     * @throws LexException on an unterminated string or a character no token
     *      can contain
     */
    public static ImmutableList<Token> tokenize(String text) {
        return new Lexer(text).run();
    }

    private ImmutableList<Token> run() {
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == ';') {
                pos = endOfLine(pos);
            } else if (c == '(') {
                pos = emit(TokenKind.LPAREN, pos, pos + 1);
            } else if (c == ')') {
                pos = emit(TokenKind.RPAREN, pos, pos + 1);
            } else if (c == '"') {
                pos = emit(TokenKind.STRING, pos, endOfString(pos));
            } else if (c == '?' || c == '@') {
                int end = endOfWord(pos + 1);
                if (end == pos + 1) {
                    throw new LexException("Variable sigil '" + c + "' without a name", text, pos);
                }
                pos = emit(TokenKind.VARIABLE, pos, end);
            } else if (isWordChar(c)) {
                int end = endOfWord(pos);
                pos = emit(classify(text.substring(pos, end)), pos, end);
            } else {
                throw new LexException(String.format(Locale.ROOT, "Unexpected character '%s' (U+%04X)",
                        Character.isISOControl(c) ? "?" : String.valueOf(c), (int) c), text, pos);
            }
        }
        return tokens.build();
    }

    private int emit(TokenKind kind, int start, int end) {
        tokens.add(new Token(kind, text.substring(start, end), start));
        return end;
    }

    private static TokenKind classify(String word) {
        if (NUMBER.matcher(word).matches()) {
            return TokenKind.NUMBER;
        }
        return TokenKind.keyword(word).orElse(TokenKind.WORD);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || WORD_PUNCTUATION.matches(c);
    }

    private int endOfWord(int pos) {
        int end = pos;
        while (end < text.length() && isWordChar(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private int endOfLine(int pos) {
        int newline = text.indexOf('\n', pos);
        return newline < 0 ? text.length() : newline + 1;
    }

    /**
     * Offset one past the closing quote of the string opened at {@code start}.
     * Backslash escapes the next character.
     */
    private int endOfString(int start) {
        int pos = start + 1;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '"') {
                return pos + 1;
            } else {
                pos++;
            }
        }
        throw new LexException("Unterminated string", text, start);
    }
}
