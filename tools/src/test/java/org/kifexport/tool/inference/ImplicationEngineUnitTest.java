package org.kifexport.tool.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.kifexport.common.Diagnostic.Kind.INFERENCE_NON_TERMINATION;
import static org.kifexport.tool.OntologyLoader.triples;
import static org.kifexport.tool.OntologyLoader.values;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.kifexport.common.Diagnostics;
import org.kifexport.test.KifSamples;
import org.kifexport.test.RandomOntology;
import org.kifexport.tool.OntologyLoader;
import org.kifexport.tool.ontology.OntologyStore;

import com.google.common.collect.Lists;

public class ImplicationEngineUnitTest {
    @Rule
    public final RandomOntology random = new RandomOntology();

    private final OntologyStore store = new OntologyStore();
    private final Diagnostics diagnostics = new Diagnostics();

    @Test
    public void dogsAreMammals() {
        load(KifSamples.DOGS_ARE_MAMMALS);
        assertThat(saturate()).isEqualTo(1);
        assertThat(values(store, "Fido", "instance")).containsExactly("Dog", "Mammal");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    public void rulesDoNotCreateConcepts() {
        load(KifSamples.DOGS_ARE_MAMMALS);
        int concepts = store.size();
        saturate();
        assertThat(store.size()).isEqualTo(concepts);
    }

    @Test
    public void noRules() {
        load(KifSamples.FIDO_IS_A_DOG);
        assertThat(saturate()).isZero();
        assertThat(triples(store)).containsExactly("Fido instance Dog");
    }

    @Test
    public void chains() {
        load("(=> (instance ?X Mammal) (instance ?X Animal))\n"
                + "(=> (instance ?X Dog) (instance ?X Mammal))\n"
                + "(instance Fido Dog)");
        assertThat(saturate()).isEqualTo(2);
        assertThat(values(store, "Fido", "instance")).containsExactly("Dog", "Mammal", "Animal");
    }

    @Test
    public void saturatingTwiceAddsNothing() {
        load(KifSamples.DOGS_ARE_MAMMALS);
        saturate();
        Set<String> closure = triples(store);
        assertThat(saturate()).isZero();
        assertThat(triples(store)).isEqualTo(closure);
    }

    @Test
    public void joins() {
        load("(=> (and (parent ?X ?Y) (parent ?Y ?Z)) (grandparent ?X ?Z))\n"
                + "(parent Abe Homer)\n(parent Homer Bart)\n(parent Homer Lisa)\n(parent Clancy Marge)");
        assertThat(saturate()).isEqualTo(2);
        assertThat(values(store, "Abe", "grandparent")).containsExactly("Bart", "Lisa");
        assertThat(store.find("Clancy").get().values(store.find("grandparent").get())).isEmpty();
    }

    @Test
    public void repeatedVariablesMustBindTheSameConcept() {
        load("(=> (likes ?X ?X) (attribute ?X Vain))\n(likes Narcissus Narcissus)\n(likes Echo Narcissus)");
        saturate();
        assertThat(values(store, "Narcissus", "attribute")).containsExactly("Vain");
        assertThat(store.find("Echo").get().values(store.find("attribute").get())).isEmpty();
    }

    @Test
    public void variableLabels() {
        load("(=> (and (subrelation ?R ?S) (?R ?X ?Y)) (?S ?X ?Y))\n"
                + "(subrelation mother parent)\n(mother Marge Bart)");
        saturate();
        assertThat(values(store, "Marge", "parent")).containsExactly("Bart");
    }

    @Test
    public void disjunctivePremises() {
        load("(=> (or (instance ?X Dog) (instance ?X Cat)) (instance ?X Pet))\n"
                + "(instance Fido Dog)\n(instance Tom Cat)\n(instance Nemo Fish)");
        saturate();
        assertThat(values(store, "Fido", "instance")).contains("Pet");
        assertThat(values(store, "Tom", "instance")).contains("Pet");
        assertThat(values(store, "Nemo", "instance")).containsExactly("Fish");
    }

    @Test
    public void symmetricConclusions() {
        load("(=> (parent ?X ?Y) (relative ?X ?Y))\n(parent Homer Bart)");
        saturate();
        assertThat(triples(store)).contains("Homer relative Bart", "Bart relative Homer");
    }

    @Test
    public void equivalences() {
        load("(<=> (instance ?X Bachelor) (and (instance ?X Man) (attribute ?X Unmarried)))\n"
                + "(instance Barney Bachelor)\n(instance Homer Man)\n(attribute Lenny Unmarried)\n(instance Lenny Man)");
        saturate();
        assertThat(values(store, "Barney", "instance")).containsExactly("Bachelor", "Man");
        assertThat(values(store, "Barney", "attribute")).containsExactly("Unmarried");
        assertThat(values(store, "Lenny", "instance")).containsExactly("Man", "Bachelor");
        assertThat(values(store, "Homer", "instance")).containsExactly("Man");
    }

    @Test
    public void passBoundKeepsWhatWasDerived() {
        // Each pass only climbs one level when the rules come in this order.
        load("(=> (instance ?X Class2) (instance ?X Class3))\n"
                + "(=> (instance ?X Class1) (instance ?X Class2))\n"
                + "(=> (instance ?X Class0) (instance ?X Class1))\n"
                + "(instance Fido Class0)");
        assertThat(new ImplicationEngine(2).saturate(store, diagnostics)).isEqualTo(2);
        assertThat(values(store, "Fido", "instance")).containsExactly("Class0", "Class1", "Class2");
        assertThat(diagnostics.ofKind(INFERENCE_NON_TERMINATION)).hasSize(1);
    }

    @Test
    public void fixedPointNeedsAQuietPass() {
        load(KifSamples.DOGS_ARE_MAMMALS);
        assertThat(new ImplicationEngine(1).saturate(store, diagnostics)).isEqualTo(1);
        assertThat(diagnostics.ofKind(INFERENCE_NON_TERMINATION)).hasSize(1);

        Diagnostics again = new Diagnostics();
        assertThat(new ImplicationEngine(1).saturate(store, again)).isZero();
        assertThat(again.isEmpty()).isTrue();
    }

    @Test
    public void maxPassesMustBePositive() {
        assertThatThrownBy(() -> new ImplicationEngine(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void closureDoesNotDependOnOrder() {
        int classes = random.between(2, 12);
        List<String> formulas = new ArrayList<>(random.instanceRules(classes));
        formulas.addAll(random.instanceFacts(random.between(1, 40), classes));

        Set<String> forward = closure(formulas);
        Set<String> backward = closure(Lists.reverse(formulas));
        assertThat(backward).containsExactlyInAnyOrderElementsOf(forward);
    }

    @Test
    public void closureIsMonotone() {
        int classes = random.between(2, 12);
        List<String> rules = random.instanceRules(classes);
        List<String> facts = random.instanceFacts(random.between(2, 40), classes);
        List<String> some = new ArrayList<>(rules);
        some.addAll(facts.subList(0, facts.size() / 2));
        List<String> all = new ArrayList<>(rules);
        all.addAll(facts);

        assertThat(closure(all)).containsAll(closure(some));
    }

    @Test
    public void closureClimbsToTheRoots() {
        int classes = random.between(2, 12);
        load(RandomOntology.document(random.instanceRules(classes)) + "(instance Fido Class0)");
        saturate();
        // The last class is the only one with no parent, every chain ends there.
        assertThat(values(store, "Fido", "instance")).startsWith("Class0").endsWith("Class" + (classes - 1));
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    private Set<String> closure(List<String> formulas) {
        OntologyStore closed = new OntologyStore();
        Diagnostics ignored = new Diagnostics();
        OntologyLoader.load(RandomOntology.document(formulas), closed, ignored);
        new ImplicationEngine().saturate(closed, ignored);
        assertThat(ignored.isEmpty()).isTrue();
        return triples(closed);
    }

    private void load(String text) {
        OntologyLoader.load(text, store, diagnostics);
    }

    private int saturate() {
        return new ImplicationEngine().saturate(store, diagnostics);
    }
}
