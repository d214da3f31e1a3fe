package org.kifexport.tool.eval;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Immutable syntax tree of one SUO-KIF form, built from the canonical parse.
 * Every form has a canonical text, which names the concept it evaluates to.
 * <p>
 * Children by kind: a relation has its head followed by its arguments, a
 * connective has its operands, a quantifier has its variables followed by
 * its body. Atoms have none. Forms use identity equality.
 */
public final class KifForm {
    /**
     * Shape of a form.
     */
    public enum Kind {
        WORD(null),
        VARIABLE(null),
        STRING(null),
        NUMBER(null),
        RELATION(null),
        AND("and"),
        OR("or"),
        NOT("not"),
        IMPLIES("=>"),
        IFF("<=>"),
        FORALL("forall"),
        EXISTS("exists");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public boolean isAtom() {
            return ordinal() <= NUMBER.ordinal();
        }

        public boolean isQuantifier() {
            return this == FORALL || this == EXISTS;
        }

        /**
         * The operator spelling of connectives and quantifiers.
         */
        public String keyword() {
            return keyword;
        }
    }

    private static final int MESSAGE_LENGTH = 80;

    private final Kind kind;
    private final int offset;
    private final ImmutableList<KifForm> children;
    private final boolean ground;
    /**
     * Lexeme of an atom. For a compound form, its canonical text once asked
     * for, null before.
     */
    @Nullable
    private String text;

    private KifForm(Kind kind, @Nullable String text, int offset, ImmutableList<KifForm> children, boolean ground) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
        this.children = children;
        this.ground = ground;
    }

    public static KifForm atom(Kind kind, String text, int offset) {
        checkArgument(kind.isAtom(), "%s is not an atom kind", kind);
        return new KifForm(kind, text, offset, ImmutableList.of(), kind != Kind.VARIABLE);
    }

    public static KifForm compound(Kind kind, List<KifForm> children, int offset) {
        checkArgument(!kind.isAtom(), "%s is an atom kind", kind);
        checkArgument(!children.isEmpty(), "%s needs children", kind);
        ImmutableList<KifForm> copy = ImmutableList.copyOf(children);
        boolean ground = !kind.isQuantifier();
        for (KifForm child : copy) {
            ground &= child.ground;
        }
        return new KifForm(kind, null, offset, copy, ground);
    }

    /**
     * Write the canonical text of this form, stopping once more than
     * {@code limit} characters are written. Runs on an explicit stack of
     * forms and literal fragments.
     */
    private String render(int limit) {
        StringBuilder b = new StringBuilder();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty() && b.length() <= limit) {
            Object next = stack.pop();
            if (next instanceof String) {
                b.append((String) next);
                continue;
            }
            KifForm form = (KifForm) next;
            if (form.text != null) {
                b.append(form.text);
                continue;
            }
            List<Object> parts = form.parts();
            for (int i = parts.size() - 1; i >= 0; i--) {
                stack.push(parts.get(i));
            }
        }
        return b.toString();
    }

    /**
     * Children of a compound form interleaved with the fragments of its
     * canonical text.
     */
    private List<Object> parts() {
        List<Object> parts = new ArrayList<>(children.size() * 2 + 3);
        List<KifForm> spaced = children;
        if (kind == Kind.RELATION) {
            parts.add("(");
        } else if (kind.isQuantifier()) {
            parts.add("(" + kind.keyword() + " (");
            spaced = children.subList(0, children.size() - 1);
        } else {
            parts.add("(" + kind.keyword() + " ");
        }
        for (int i = 0; i < spaced.size(); i++) {
            if (i > 0) {
                parts.add(" ");
            }
            parts.add(spaced.get(i));
        }
        if (kind.isQuantifier()) {
            parts.add(") ");
            parts.add(children.get(children.size() - 1));
        }
        parts.add(")");
        return parts;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Canonical text: the lexeme of an atom, the whitespace normalized source
     * of a compound form. The text of a compound form embeds the text of all
     * its descendants so it is only built when asked for.
     */
    public String getText() {
        if (text == null) {
            text = render(Integer.MAX_VALUE);
        }
        return text;
    }

    /**
     * Character offset of the form in the source.
     */
    public int getOffset() {
        return offset;
    }

    public List<KifForm> getChildren() {
        return children;
    }

    public KifForm child(int index) {
        return children.get(index);
    }

    /**
     * Whether the form contains no variable.
     */
    public boolean isGround() {
        return ground;
    }

    public boolean isAtom() {
        return kind.isAtom();
    }

    /**
     * The head of a relation.
     */
    public KifForm head() {
        checkArgument(kind == Kind.RELATION, "%s has no head", this);
        return children.get(0);
    }

    /**
     * Arguments of a relation, without the head.
     */
    public List<KifForm> arguments() {
        checkArgument(kind == Kind.RELATION, "%s has no arguments", this);
        return children.subList(1, children.size());
    }

    /**
     * Body of a quantifier.
     */
    public KifForm body() {
        checkArgument(kind.isQuantifier(), "%s is not quantified", this);
        return children.get(children.size() - 1);
    }

    /**
     * The canonical text, abbreviated for messages.
     */
    @Override
    public String toString() {
        return StringUtils.abbreviate(text == null ? render(MESSAGE_LENGTH) : text, MESSAGE_LENGTH);
    }
}
