package org.kifexport.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nullable;

import org.kifexport.parser.grammar.Grammar;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import lombok.Value;

/**
 * Every constituent a parse found, stored in a flat arena and indexed by
 * {@code (start, category)}. Arena ids {@code 0..n-1} are the terminals of the
 * {@code n} tokens, composed constituents follow in discovery order.
 */
public final class ParseForest {
    private final String source;
    private final ImmutableList<Token> tokens;
    private final Grammar grammar;
    private final List<Constituent> arena = new ArrayList<>();
    private final Map<CategorySpan, Constituent> packed = new HashMap<>();
    private final ListMultimap<Integer, Constituent> byStart = ArrayListMultimap.create();
    private int restarts;

    ParseForest(String source, List<Token> tokens, Grammar grammar) {
        this.source = source;
        this.tokens = ImmutableList.copyOf(tokens);
        this.grammar = grammar;
        for (int i = 0; i < this.tokens.size(); i++) {
            Token token = this.tokens.get(i);
            add(token.getKind().name(), i, i + 1, ImmutableList.of(), token);
        }
    }

    /**
     * Record a derivation of {@code category} over {@code [start, end)}.
     *
     * @return the new constituent, or null if one already covered that
     *      category and range, in which case its derivation count grows
     */
    @Nullable
    Constituent pack(String category, int start, int end, List<Integer> children) {
        Constituent existing = packed.get(new CategorySpan(category, start, end));
        if (existing != null) {
            existing.addDerivation();
            return null;
        }
        return add(category, start, end, children, null);
    }

    private Constituent add(String category, int start, int end, List<Integer> children, @Nullable Token token) {
        Constituent constituent = new Constituent(arena.size(), category, start, end, children, token);
        arena.add(constituent);
        packed.put(new CategorySpan(category, start, end), constituent);
        byStart.put(start, constituent);
        return constituent;
    }

    void countRestart() {
        restarts++;
    }

    public Constituent get(int id) {
        return arena.get(id);
    }

    /**
     * The terminal constituent of the token at {@code index}.
     */
    public Constituent terminal(int index) {
        return arena.get(index);
    }

    public List<Constituent> children(Constituent constituent) {
        List<Integer> ids = constituent.getChildren();
        List<Constituent> children = new ArrayList<>(ids.size());
        for (int id : ids) {
            children.add(arena.get(id));
        }
        return children;
    }

    public int size() {
        return arena.size();
    }

    /**
     * All constituents in discovery order.
     */
    public List<Constituent> constituents() {
        return Collections.unmodifiableList(arena);
    }

    public List<Constituent> startingAt(int start, String category) {
        List<Constituent> result = new ArrayList<>();
        for (Constituent constituent : byStart.get(start)) {
            if (constituent.getCategory().equals(category)) {
                result.add(constituent);
            }
        }
        return result;
    }

    public Optional<Constituent> find(String category, int start, int end) {
        return Optional.ofNullable(packed.get(new CategorySpan(category, start, end)));
    }

    /**
     * Whether a constituent of any category spans exactly {@code [start, end)}.
     */
    public boolean isCovered(int start, int end) {
        for (Constituent constituent : byStart.get(start)) {
            if (constituent.getEnd() == end) {
                return true;
            }
        }
        return false;
    }

    public long ambiguousCount() {
        return arena.stream().filter(Constituent::isAmbiguous).count();
    }

    /**
     * How many times the parser had to restart after an unparseable token.
     */
    public int getRestarts() {
        return restarts;
    }

    public String getSource() {
        return source;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public int tokenCount() {
        return tokens.size();
    }

    public Grammar getGrammar() {
        return grammar;
    }

    /**
     * Character offset where the constituent starts.
     */
    public int offset(Constituent constituent) {
        return tokens.get(constituent.getStart()).getOffset();
    }

    /**
     * The exact source text the constituent was parsed from.
     */
    public String text(Constituent constituent) {
        if (constituent.width() == 0) {
            return "";
        }
        return source.substring(offset(constituent), tokens.get(constituent.getEnd() - 1).getEnd());
    }

    @Value
    private static class CategorySpan {
        String category;
        int start;
        int end;
    }
}
