package org.kifexport.parser;

import lombok.Value;

@Value
public class Token {
    TokenKind kind;
    /**
     * The exact source lexeme.
     */
    String text;
    /**
     * Character offset of the first character of the lexeme.
     */
    int offset;

    /**
     * Offset one past the last character of the lexeme.
     */
    public int getEnd() {
        return offset + text.length();
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + offset;
    }
}
