package org.kifexport.parser.grammar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;

/**
 * A context free grammar declared as data. The first declared category is the
 * start category. Categories are ranked by declaration order, terminals rank
 * after every category.
 */
public final class Grammar {
    private final ImmutableList<String> categories;
    private final ImmutableSet<String> terminals;
    private final ImmutableList<Rule> rules;
    private final ImmutableListMultimap<String, Rule> rulesByCategory;
    private final ImmutableMap<String, Integer> ranks;

    private Grammar(List<String> categories, Collection<String> terminals, List<Rule> rules) {
        this.categories = ImmutableList.copyOf(categories);
        this.terminals = ImmutableSet.copyOf(terminals);
        this.rules = ImmutableList.copyOf(rules);
        this.rulesByCategory = rules.stream().collect(ImmutableListMultimap.toImmutableListMultimap(Rule::getCategory, r -> r));
        ImmutableMap.Builder<String, Integer> rankBuilder = ImmutableMap.builder();
        int rank = 0;
        for (String category : categories) {
            rankBuilder.put(category, rank++);
        }
        for (String terminal : terminals) {
            rankBuilder.put(terminal, rank++);
        }
        this.ranks = rankBuilder.build();
    }

    public static Builder builder(Collection<String> terminals) {
        return new Builder(terminals);
    }

    public String startCategory() {
        return categories.get(0);
    }

    public boolean isTerminal(String symbol) {
        return terminals.contains(symbol);
    }

    public List<Rule> rulesFor(String category) {
        return rulesByCategory.get(category);
    }

    public List<Rule> rules() {
        return rules;
    }

    public List<String> categories() {
        return categories;
    }

    /**
     * Declaration rank of a category or terminal, used to order ties.
     */
    public int rank(String symbol) {
        Integer rank = ranks.get(symbol);
        checkArgument(rank != null, "Unknown symbol: %s", symbol);
        return rank;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        for (Rule rule : rules) {
            b.append(rule).append('\n');
        }
        return b.toString();
    }

    public static final class Builder {
        private final Set<String> terminals;
        private final Set<String> categories = new LinkedHashSet<>();
        private final List<Rule> rules = new ArrayList<>();

        Builder(Collection<String> terminals) {
            this.terminals = ImmutableSet.copyOf(terminals);
        }

        /**
         * Add the production {@code category := symbols...}.
         */
        public Builder rule(String category, String... symbols) {
            checkArgument(!terminals.contains(category), "Terminal %s can't be a rule category", category);
            checkArgument(symbols.length > 0, "Empty rule for %s", category);
            categories.add(category);
            rules.add(new Rule(rules.size(), category, Arrays.asList(symbols)));
            return this;
        }

        /**
         * Build the grammar.
         *
         * @throws IllegalArgumentException if a rule refers to an undefined
         *      category or if unit productions form a cycle
         */
        public Grammar build() {
            checkState(!rules.isEmpty(), "A grammar needs at least one rule");
            for (Rule rule : rules) {
                for (String symbol : rule.getSymbols()) {
                    if (!terminals.contains(symbol) && !categories.contains(symbol)) {
                        throw new IllegalArgumentException("Undefined symbol " + symbol + " in rule " + rule);
                    }
                }
            }
            checkNoUnitCycles();
            return new Grammar(new ArrayList<>(categories), terminals, rules);
        }

        /**
         * Unit cycles (A := B, B := A) would let a packed constituent derive
         * itself. Peels off categories whose unit productions only lead to
         * already peeled ones; whatever remains is on a cycle.
         */
        private void checkNoUnitCycles() {
            ListMultimap<String, String> unitParents = ArrayListMultimap.create();
            Map<String, Integer> unitChildren = new HashMap<>();
            for (String category : categories) {
                unitChildren.put(category, 0);
            }
            for (Rule rule : rules) {
                String symbol = rule.symbol(0);
                if (rule.isUnit() && categories.contains(symbol)) {
                    unitParents.put(symbol, rule.getCategory());
                    unitChildren.merge(rule.getCategory(), 1, Integer::sum);
                }
            }
            Deque<String> leaves = new ArrayDeque<>();
            unitChildren.forEach((category, count) -> {
                if (count == 0) {
                    leaves.add(category);
                }
            });
            int peeled = 0;
            while (!leaves.isEmpty()) {
                String leaf = leaves.poll();
                peeled++;
                for (String parent : unitParents.get(leaf)) {
                    if (unitChildren.merge(parent, -1, Integer::sum) == 0) {
                        leaves.add(parent);
                    }
                }
            }
            if (peeled < categories.size()) {
                Set<String> cyclic = new TreeSet<>();
                unitChildren.forEach((category, count) -> {
                    if (count > 0) {
                        cyclic.add(category);
                    }
                });
                throw new IllegalArgumentException("Unit productions form a cycle through " + cyclic);
            }
        }
    }
}
