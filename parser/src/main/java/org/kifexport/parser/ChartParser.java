package org.kifexport.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.kifexport.parser.grammar.Grammar;
import org.kifexport.parser.grammar.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.primitives.Ints;

import lombok.Value;

/**
 * Earley style chart parser producing a {@link ParseForest}.
 * <p>
 * The chart has one column per token boundary. Each column is processed with
 * a work list, never by recursion, so nesting depth is only bounded by
 * memory. A category is predicted at most once per column, which memoizes
 * the work per {@code (start, category)}. Completed constituents are packed
 * per category and range, so an ambiguous grammar costs one constituent per
 * range and not one per derivation.
 * <p>
 * When a token can't extend any item the next column is empty. The start
 * category is then predicted afresh at that column so that the rest of the
 * document still reaches the forest; the resolver reports the partial
 * coverage.
 */
public class ChartParser {
    private static final Logger log = LoggerFactory.getLogger(ChartParser.class);

    private final Grammar grammar;

    public ChartParser(Grammar grammar) {
        this.grammar = grammar;
    }

    /**
     * Parse the tokens of {@code source}.
     *
     * @throws ParseException if a parenthesis is unmatched or if a matched
     *      pair of parentheses has no parse of any category
     */
    public ParseForest parse(String source, List<Token> tokens) {
        List<int[]> pairs = matchParentheses(source, tokens);
        ParseForest forest = new ParseForest(source, tokens, grammar);
        int n = tokens.size();
        Column[] columns = new Column[n + 1];
        for (int k = 0; k <= n; k++) {
            columns[k] = new Column();
        }
        for (int k = 0; k <= n; k++) {
            Column column = columns[k];
            if (k < n && column.items.isEmpty()) {
                if (k > 0) {
                    forest.countRestart();
                    log.debug("No parse continues through {}, restarting", tokens.get(k - 1));
                }
                predict(grammar.startCategory(), k, column);
            }
            process(k, columns, forest);
            if (k < n) {
                scan(k, tokens.get(k), columns, forest);
            }
        }
        checkPairsCovered(source, tokens, pairs, forest);
        log.debug("Parsed {} tokens into {} constituents ({} ambiguous, {} restarts)",
                n, forest.size(), forest.ambiguousCount(), forest.getRestarts());
        return forest;
    }

    private void process(int k, Column[] columns, ParseForest forest) {
        Column column = columns[k];
        // items is appended to while we walk it
        for (int i = 0; i < column.items.size(); i++) {
            Item item = column.items.get(i);
            if (item.isComplete()) {
                complete(item, k, columns, forest);
            } else if (!grammar.isTerminal(item.next())) {
                predict(item.next(), k, column);
            }
        }
    }

    private void predict(String category, int k, Column column) {
        if (!column.predicted.add(category)) {
            return;
        }
        for (Rule rule : grammar.rulesFor(category)) {
            column.add(new Item(rule, 0, k, new int[0]));
        }
    }

    private void complete(Item item, int k, Column[] columns, ParseForest forest) {
        String category = item.rule.getCategory();
        Constituent constituent = forest.pack(category, item.origin, k, Ints.asList(item.children));
        if (constituent == null) {
            // Another derivation of a known constituent: its parents already exist.
            return;
        }
        // No rule is empty, so origin < k and the origin column is final.
        for (Item waiting : columns[item.origin].waiting.get(category)) {
            columns[k].add(waiting.advance(constituent.getId()));
        }
    }

    private static void scan(int k, Token token, Column[] columns, ParseForest forest) {
        int terminal = forest.terminal(k).getId();
        for (Item waiting : columns[k].waiting.get(token.getKind().name())) {
            columns[k + 1].add(waiting.advance(terminal));
        }
    }

    /**
     * Match parentheses, failing on the first unmatched one.
     *
     * @return token index pairs {@code {open, close}}, inner pairs first
     */
    private static List<int[]> matchParentheses(String source, List<Token> tokens) {
        List<int[]> pairs = new ArrayList<>();
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).getKind();
            if (kind == TokenKind.LPAREN) {
                open.push(i);
            } else if (kind == TokenKind.RPAREN) {
                if (open.isEmpty()) {
                    throw new ParseException("Unmatched closing parenthesis", source, tokens.get(i).getOffset());
                }
                pairs.add(new int[] {open.pop(), i});
            }
        }
        if (!open.isEmpty()) {
            throw new ParseException("Unmatched opening parenthesis", source, tokens.get(open.peek()).getOffset());
        }
        pairs.sort(Comparator.comparingInt(pair -> pair[1]));
        return pairs;
    }

    private static void checkPairsCovered(String source, List<Token> tokens, List<int[]> pairs, ParseForest forest) {
        for (int[] pair : pairs) {
            if (!forest.isCovered(pair[0], pair[1] + 1)) {
                Token open = tokens.get(pair[0]);
                String form = SourceLocation.snippet(source, open.getOffset(), tokens.get(pair[1]).getEnd());
                throw new ParseException("No parse for the form " + form, source, open.getOffset());
            }
        }
    }

    /**
     * Items of one chart column, indexed by the symbol they wait for.
     */
    private static final class Column {
        private final List<Item> items = new ArrayList<>();
        private final Set<ItemKey> seen = new HashSet<>();
        private final ListMultimap<String, Item> waiting = ArrayListMultimap.create();
        private final Set<String> predicted = new HashSet<>();

        void add(Item item) {
            if (!seen.add(new ItemKey(item.rule.getIndex(), item.dot, item.origin))) {
                return;
            }
            items.add(item);
            if (!item.isComplete()) {
                waiting.put(item.next(), item);
            }
        }
    }

    /**
     * A rule with a dot after the symbols matched so far, started at column
     * {@code origin}, with the arena ids of the matched children.
     */
    private static final class Item {
        private final Rule rule;
        private final int dot;
        private final int origin;
        private final int[] children;

        Item(Rule rule, int dot, int origin, int[] children) {
            this.rule = rule;
            this.dot = dot;
            this.origin = origin;
            this.children = children;
        }

        boolean isComplete() {
            return dot == rule.length();
        }

        String next() {
            return rule.symbol(dot);
        }

        Item advance(int child) {
            int[] advanced = Arrays.copyOf(children, children.length + 1);
            advanced[children.length] = child;
            return new Item(rule, dot + 1, origin, advanced);
        }
    }

    @Value
    private static class ItemKey {
        int rule;
        int dot;
        int origin;
    }
}
