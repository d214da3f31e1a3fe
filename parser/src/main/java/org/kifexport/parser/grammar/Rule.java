package org.kifexport.parser.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

import lombok.Value;

/**
 * One production: a category and the ordered sequence of categories or
 * terminals it is composed of.
 */
@Value
public class Rule {
    /**
     * Position of the rule in its grammar, unique within the grammar.
     */
    int index;
    String category;
    ImmutableList<String> symbols;

    Rule(int index, String category, List<String> symbols) {
        this.index = index;
        this.category = category;
        this.symbols = ImmutableList.copyOf(symbols);
    }

    public String symbol(int position) {
        return symbols.get(position);
    }

    public int length() {
        return symbols.size();
    }

    /**
     * Whether this rule just renames a single symbol.
     */
    public boolean isUnit() {
        return symbols.size() == 1;
    }

    @Override
    public String toString() {
        return category + " := " + String.join(" ", symbols);
    }
}
