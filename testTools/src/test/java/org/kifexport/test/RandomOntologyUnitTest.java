package org.kifexport.test;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.Rule;
import org.junit.Test;

public class RandomOntologyUnitTest {

    @Rule
    public final RandomOntology random = new RandomOntology();

    @Test
    public void betweenIsInclusive() {
        for (int i = 0; i < 100; i++) {
            assertThat(random.between(3, 5)).isBetween(3, 5);
        }
        assertThat(random.between(7, 7)).isEqualTo(7);
    }

    @Test
    public void factsAreDistinct() {
        List<String> facts = random.instanceFacts(50, 4);
        assertThat(facts).hasSize(50).doesNotHaveDuplicates();
        assertThat(facts).allMatch(f -> f.matches("\\(instance Individual\\d+ Class[0-3]\\)"));
    }

    @Test
    public void rulesPointUpwards() {
        List<String> rules = random.instanceRules(6);
        assertThat(rules).hasSize(5);
        for (String rule : rules) {
            String[] classes = rule.replaceAll("[^0-9 ]", "").trim().split(" +");
            assertThat(Integer.parseInt(classes[1])).isGreaterThan(Integer.parseInt(classes[0]));
        }
    }

    @Test
    public void documentPutsOneFormulaPerLine() {
        assertThat(RandomOntology.document(List.of("(a b c)", "(d e f)"))).isEqualTo("(a b c)\n(d e f)\n");
    }
}
