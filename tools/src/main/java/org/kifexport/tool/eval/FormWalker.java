package org.kifexport.tool.eval;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import javax.annotation.Nullable;

/**
 * Post order traversal of a {@link KifForm} tree driven by an explicit stack,
 * so the depth of a form is only bounded by memory. A context flows from
 * parents to children.
 */
public final class FormWalker {

    /**
     * Computes the context of a child from its parent.
     *
     * @param <C> context type
     */
    @FunctionalInterface
    public interface ChildContext<C> {
        /**
         * @return the context of {@code parent.child(index)}, or null to skip
         *      that child and everything below it
         */
        @Nullable
        C of(KifForm parent, C parentContext, int index);
    }

    /**
     * Receives each form after all of its children.
     *
     * @param <C> context type
     * @param <E> exception thrown by the visitor
     */
    @FunctionalInterface
    public interface Visitor<C, E extends Exception> {
        void visit(KifForm form, C context) throws E;
    }

    private FormWalker() {
        // Uncallable utility constructor
    }

    /**
     * Visit {@code root} and its descendants, children left to right before
     * their parent.
     */
    public static <C, E extends Exception> void postOrder(KifForm root, C rootContext,
            ChildContext<C> childContext, Visitor<C, E> visitor) throws E {
        Deque<Frame<C>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, rootContext));
        while (!stack.isEmpty()) {
            Frame<C> frame = stack.peek();
            if (frame.expanded || frame.form.isAtom()) {
                stack.pop();
                visitor.visit(frame.form, frame.context);
                continue;
            }
            frame.expanded = true;
            List<KifForm> children = frame.form.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                C context = childContext.of(frame.form, frame.context, i);
                if (context != null) {
                    stack.push(new Frame<>(children.get(i), context));
                }
            }
        }
    }

    private static final class Frame<C> {
        private final KifForm form;
        private final C context;
        private boolean expanded;

        Frame(KifForm form, C context) {
            this.form = form;
            this.context = context;
        }
    }
}
