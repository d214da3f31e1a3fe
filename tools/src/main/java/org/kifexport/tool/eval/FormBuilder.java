package org.kifexport.tool.eval;

import static org.kifexport.parser.grammar.KifGrammar.ARGUMENTS;
import static org.kifexport.parser.grammar.KifGrammar.CONJUNCTION;
import static org.kifexport.parser.grammar.KifGrammar.DISJUNCTION;
import static org.kifexport.parser.grammar.KifGrammar.EQUIVALENCE;
import static org.kifexport.parser.grammar.KifGrammar.EXISTENTIAL;
import static org.kifexport.parser.grammar.KifGrammar.FORMULA;
import static org.kifexport.parser.grammar.KifGrammar.FORMULAS;
import static org.kifexport.parser.grammar.KifGrammar.IMPLICATION;
import static org.kifexport.parser.grammar.KifGrammar.NEGATION;
import static org.kifexport.parser.grammar.KifGrammar.RELATION_INSTANCE;
import static org.kifexport.parser.grammar.KifGrammar.TERM;
import static org.kifexport.parser.grammar.KifGrammar.UNIVERSAL;
import static org.kifexport.parser.grammar.KifGrammar.VARIABLES;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.kifexport.parser.Constituent;
import org.kifexport.parser.ParseForest;
import org.kifexport.parser.Token;

import com.google.common.collect.ImmutableMap;

/**
 * Converts a constituent of the canonical parse into a {@link KifForm}. Unit
 * wrappers ({@code Formula}, {@code Term}) and left recursive lists are
 * flattened away. The conversion runs on an explicit stack.
 */
final class FormBuilder {
    private static final Map<String, KifForm.Kind> COMPOUND_KINDS = ImmutableMap.<String, KifForm.Kind>builder()
            .put(RELATION_INSTANCE, KifForm.Kind.RELATION)
            .put(CONJUNCTION, KifForm.Kind.AND)
            .put(DISJUNCTION, KifForm.Kind.OR)
            .put(NEGATION, KifForm.Kind.NOT)
            .put(IMPLICATION, KifForm.Kind.IMPLIES)
            .put(EQUIVALENCE, KifForm.Kind.IFF)
            .put(UNIVERSAL, KifForm.Kind.FORALL)
            .put(EXISTENTIAL, KifForm.Kind.EXISTS)
            .build();

    private final ParseForest forest;

    FormBuilder(ParseForest forest) {
        this.forest = forest;
    }

    /**
     * Build the form of a top level expression.
     *
     * @throws SemanticException if the constituent is not a formula
     */
    KifForm build(Constituent top) {
        Constituent start = unwrap(top);
        if (start.isTerminal()) {
            Token token = start.getToken();
            throw new SemanticException("A bare " + token.getKind().name().toLowerCase(Locale.ROOT)
                    + " is not a formula: " + token.getText(), token.getOffset());
        }
        if (!COMPOUND_KINDS.containsKey(start.getCategory())) {
            throw new SemanticException("A " + start.getCategory() + " is not a formula", forest.offset(start));
        }
        Map<Integer, KifForm> built = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.parts == null) {
                frame.parts = parts(frame.constituent);
                for (int i = frame.parts.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(frame.parts.get(i)));
                }
                continue;
            }
            stack.pop();
            List<KifForm> children = new ArrayList<>(frame.parts.size());
            for (Constituent part : frame.parts) {
                children.add(built.remove(part.getId()));
            }
            built.put(frame.constituent.getId(), make(frame.constituent, children));
        }
        return built.get(start.getId());
    }

    private KifForm make(Constituent constituent, List<KifForm> children) {
        if (constituent.isTerminal()) {
            Token token = constituent.getToken();
            return KifForm.atom(atomKind(token), token.getText(), token.getOffset());
        }
        KifForm.Kind kind = COMPOUND_KINDS.get(constituent.getCategory());
        if (kind == null) {
            throw new SemanticException("Unexpected " + constituent.getCategory() + " inside a formula",
                    forest.offset(constituent));
        }
        return KifForm.compound(kind, children, forest.offset(constituent));
    }

    private static KifForm.Kind atomKind(Token token) {
        switch (token.getKind()) {
            case WORD:
                return KifForm.Kind.WORD;
            case VARIABLE:
                return KifForm.Kind.VARIABLE;
            case STRING:
                return KifForm.Kind.STRING;
            case NUMBER:
                return KifForm.Kind.NUMBER;
            default:
                throw new SemanticException("Unexpected " + token.getKind() + " token " + token.getText(), token.getOffset());
        }
    }

    /**
     * The constituents whose forms are the children of the form of
     * {@code constituent}, in order.
     */
    private List<Constituent> parts(Constituent constituent) {
        if (constituent.isTerminal()) {
            return Collections.emptyList();
        }
        List<Constituent> children = forest.children(constituent);
        List<Constituent> parts = new ArrayList<>();
        switch (constituent.getCategory()) {
            case RELATION_INSTANCE:
                parts.add(children.get(1));
                parts.addAll(listItems(children.get(2), ARGUMENTS));
                break;
            case CONJUNCTION:
            case DISJUNCTION:
                parts.addAll(listItems(children.get(2), FORMULAS));
                break;
            case NEGATION:
                parts.add(children.get(2));
                break;
            case IMPLICATION:
            case EQUIVALENCE:
                parts.add(children.get(2));
                parts.add(children.get(3));
                break;
            case UNIVERSAL:
            case EXISTENTIAL:
                // VariableList := LPAREN Variables RPAREN
                parts.addAll(listItems(forest.children(children.get(2)).get(1), VARIABLES));
                parts.add(children.get(3));
                break;
            default:
                throw new SemanticException("Unexpected " + constituent.getCategory() + " inside a formula",
                        forest.offset(constituent));
        }
        parts.replaceAll(this::unwrap);
        return parts;
    }

    /**
     * Items of a left recursive list {@code L := X | L X}, in order.
     */
    private List<Constituent> listItems(Constituent list, String category) {
        List<Constituent> items = new ArrayList<>();
        Constituent current = list;
        while (current.getCategory().equals(category)) {
            List<Constituent> children = forest.children(current);
            if (children.size() == 1) {
                current = children.get(0);
                break;
            }
            items.add(children.get(1));
            current = children.get(0);
        }
        items.add(current);
        Collections.reverse(items);
        return items;
    }

    private Constituent unwrap(Constituent constituent) {
        Constituent current = constituent;
        while (current.getCategory().equals(FORMULA) || current.getCategory().equals(TERM)) {
            current = forest.children(current).get(0);
        }
        return current;
    }

    private static final class Frame {
        private final Constituent constituent;
        private List<Constituent> parts;

        Frame(Constituent constituent) {
            this.constituent = constituent;
        }
    }
}
