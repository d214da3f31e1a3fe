package org.kifexport.parser;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * A labeled parse of the token range {@code [start, end)}. Constituents live
 * in a {@link ParseForest} arena and refer to their children by arena id.
 * Constituents are packed: one instance per category and range, keeping the
 * first derivation found and counting the others.
 */
public final class Constituent {
    private final int id;
    private final String category;
    private final int start;
    private final int end;
    private final ImmutableList<Integer> children;
    @Nullable
    private final Token token;
    private int derivations = 1;

    Constituent(int id, String category, int start, int end, List<Integer> children, @Nullable Token token) {
        this.id = id;
        this.category = category;
        this.start = start;
        this.end = end;
        this.children = ImmutableList.copyOf(children);
        this.token = token;
    }

    public int getId() {
        return id;
    }

    public String getCategory() {
        return category;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int width() {
        return end - start;
    }

    /**
     * Arena ids of the children of the first derivation.
     */
    public List<Integer> getChildren() {
        return children;
    }

    /**
     * The token of a terminal constituent, null for composed ones.
     */
    @Nullable
    public Token getToken() {
        return token;
    }

    public boolean isTerminal() {
        return token != null;
    }

    public int getDerivations() {
        return derivations;
    }

    public boolean isAmbiguous() {
        return derivations > 1;
    }

    void addDerivation() {
        derivations++;
    }

    @Override
    public String toString() {
        return category + "[" + start + ", " + end + ")";
    }
}
