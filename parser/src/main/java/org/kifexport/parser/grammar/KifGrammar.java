package org.kifexport.parser.grammar;

import static org.kifexport.parser.TokenKind.AND;
import static org.kifexport.parser.TokenKind.EXISTS;
import static org.kifexport.parser.TokenKind.FORALL;
import static org.kifexport.parser.TokenKind.IFF;
import static org.kifexport.parser.TokenKind.IMPLIES;
import static org.kifexport.parser.TokenKind.LPAREN;
import static org.kifexport.parser.TokenKind.NOT;
import static org.kifexport.parser.TokenKind.NUMBER;
import static org.kifexport.parser.TokenKind.OR;
import static org.kifexport.parser.TokenKind.RPAREN;
import static org.kifexport.parser.TokenKind.STRING;
import static org.kifexport.parser.TokenKind.VARIABLE;
import static org.kifexport.parser.TokenKind.WORD;

import java.util.Arrays;

import org.kifexport.parser.TokenKind;

import com.google.common.collect.ImmutableList;

/**
 * The SUO-KIF grammar. It is ambiguous on purpose: a parenthesized relation
 * instance is a {@link #TERM} directly (function term) and through
 * {@link #FORMULA} (embedded sentence). Lists are left recursive.
 */
public final class KifGrammar {
    public static final String DOCUMENT = "Document";
    public static final String FORMULA = "Formula";
    public static final String RELATION_INSTANCE = "RelationInstance";
    public static final String ARGUMENTS = "Arguments";
    public static final String TERM = "Term";
    public static final String CONJUNCTION = "Conjunction";
    public static final String DISJUNCTION = "Disjunction";
    public static final String FORMULAS = "Formulas";
    public static final String NEGATION = "Negation";
    public static final String IMPLICATION = "Implication";
    public static final String EQUIVALENCE = "Equivalence";
    public static final String UNIVERSAL = "Universal";
    public static final String EXISTENTIAL = "Existential";
    public static final String VARIABLE_LIST = "VariableList";
    public static final String VARIABLES = "Variables";

    private static final Grammar GRAMMAR = Grammar.builder(
                Arrays.stream(TokenKind.values()).map(TokenKind::name).collect(ImmutableList.toImmutableList()))
            .rule(DOCUMENT, FORMULA)
            .rule(DOCUMENT, DOCUMENT, FORMULA)
            .rule(FORMULA, RELATION_INSTANCE)
            .rule(FORMULA, CONJUNCTION)
            .rule(FORMULA, DISJUNCTION)
            .rule(FORMULA, NEGATION)
            .rule(FORMULA, IMPLICATION)
            .rule(FORMULA, EQUIVALENCE)
            .rule(FORMULA, UNIVERSAL)
            .rule(FORMULA, EXISTENTIAL)
            .rule(RELATION_INSTANCE, t(LPAREN), t(WORD), ARGUMENTS, t(RPAREN))
            .rule(RELATION_INSTANCE, t(LPAREN), t(VARIABLE), ARGUMENTS, t(RPAREN))
            .rule(ARGUMENTS, TERM)
            .rule(ARGUMENTS, ARGUMENTS, TERM)
            .rule(TERM, t(WORD))
            .rule(TERM, t(VARIABLE))
            .rule(TERM, t(STRING))
            .rule(TERM, t(NUMBER))
            .rule(TERM, RELATION_INSTANCE)
            .rule(TERM, FORMULA)
            .rule(CONJUNCTION, t(LPAREN), t(AND), FORMULAS, t(RPAREN))
            .rule(DISJUNCTION, t(LPAREN), t(OR), FORMULAS, t(RPAREN))
            .rule(FORMULAS, FORMULA)
            .rule(FORMULAS, FORMULAS, FORMULA)
            .rule(NEGATION, t(LPAREN), t(NOT), FORMULA, t(RPAREN))
            .rule(IMPLICATION, t(LPAREN), t(IMPLIES), FORMULA, FORMULA, t(RPAREN))
            .rule(EQUIVALENCE, t(LPAREN), t(IFF), FORMULA, FORMULA, t(RPAREN))
            .rule(UNIVERSAL, t(LPAREN), t(FORALL), VARIABLE_LIST, FORMULA, t(RPAREN))
            .rule(EXISTENTIAL, t(LPAREN), t(EXISTS), VARIABLE_LIST, FORMULA, t(RPAREN))
            .rule(VARIABLE_LIST, t(LPAREN), VARIABLES, t(RPAREN))
            .rule(VARIABLES, t(VARIABLE))
            .rule(VARIABLES, VARIABLES, t(VARIABLE))
            .build();

    private KifGrammar() {
        // Uncallable utility constructor
    }

    public static Grammar grammar() {
        return GRAMMAR;
    }

    private static String t(TokenKind kind) {
        return kind.name();
    }
}
