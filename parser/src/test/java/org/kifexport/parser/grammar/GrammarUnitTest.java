package org.kifexport.parser.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.Test;

/**
 * Tests Grammar.
 */
public class GrammarUnitTest {

    @Test
    public void firstCategoryStarts() {
        Grammar grammar = Grammar.builder(Arrays.asList("a", "b"))
                .rule("S", "A", "b")
                .rule("A", "a")
                .build();
        assertThat(grammar.startCategory()).isEqualTo("S");
        assertThat(grammar.categories()).containsExactly("S", "A");
        assertThat(grammar.rulesFor("A")).extracting(Rule::toString).containsExactly("A := a");
        assertThat(grammar.isTerminal("a")).isTrue();
        assertThat(grammar.isTerminal("A")).isFalse();
    }

    @Test
    public void categoriesRankBeforeTerminals() {
        Grammar grammar = Grammar.builder(Arrays.asList("a"))
                .rule("S", "A")
                .rule("A", "a")
                .build();
        assertThat(grammar.rank("S")).isLessThan(grammar.rank("A"));
        assertThat(grammar.rank("A")).isLessThan(grammar.rank("a"));
        assertThatThrownBy(() -> grammar.rank("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void undefinedSymbol() {
        assertThatThrownBy(() -> Grammar.builder(Arrays.asList("a")).rule("S", "A", "a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Undefined symbol A");
    }

    @Test
    public void emptyRule() {
        assertThatThrownBy(() -> Grammar.builder(Arrays.asList("a")).rule("S"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Empty rule");
    }

    @Test
    public void terminalCategory() {
        assertThatThrownBy(() -> Grammar.builder(Arrays.asList("a")).rule("a", "a"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void unitCycle() {
        assertThatThrownBy(() -> Grammar.builder(Arrays.asList("a"))
                    .rule("S", "A", "a")
                    .rule("A", "B")
                    .rule("B", "A")
                    .rule("B", "a")
                    .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cycle through [A, B]");
    }

    @Test
    public void recursionThroughLongerRulesIsFine() {
        Grammar grammar = Grammar.builder(Arrays.asList("a"))
                .rule("S", "S", "a")
                .rule("S", "a")
                .build();
        assertThat(grammar.rules()).hasSize(2);
    }

    @Test
    public void kifGrammarIsValid() {
        Grammar grammar = KifGrammar.grammar();
        assertThat(grammar.startCategory()).isEqualTo(KifGrammar.DOCUMENT);
        assertThat(grammar.rulesFor(KifGrammar.TERM)).hasSize(6);
        assertThat(grammar.rulesFor(KifGrammar.FORMULA)).hasSize(8);
        assertThat(grammar.rank(KifGrammar.DOCUMENT)).isLessThan(grammar.rank(KifGrammar.FORMULA));
        assertThat(grammar.rank(KifGrammar.FORMULA)).isLessThan(grammar.rank(KifGrammar.TERM));
    }
}
