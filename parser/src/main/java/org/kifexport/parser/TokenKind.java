package org.kifexport.parser;

import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * Lexical classes of SUO-KIF. The enum names double as the terminal
 * categories of the grammar.
 */
public enum TokenKind {
    LPAREN,
    RPAREN,
    /** A symbolic atom: constant, relation or function name. */
    WORD,
    /** A word prefixed with the {@code ?} or {@code @} (row variable) sigil. */
    VARIABLE,
    /** A double quoted string, quotes included. */
    STRING,
    NUMBER,
    AND,
    OR,
    NOT,
    FORALL,
    EXISTS,
    /** {@code =>}. */
    IMPLIES,
    /** {@code <=>}. */
    IFF;

    private static final Map<String, TokenKind> KEYWORDS = ImmutableMap.<String, TokenKind>builder()
            .put("and", AND)
            .put("or", OR)
            .put("not", NOT)
            .put("forall", FORALL)
            .put("exists", EXISTS)
            .put("=>", IMPLIES)
            .put("<=>", IFF)
            .build();

    /**
     * The keyword kind spelled by this word, if any.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
