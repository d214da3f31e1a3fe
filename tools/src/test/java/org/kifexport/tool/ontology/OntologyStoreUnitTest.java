package org.kifexport.tool.ontology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.kifexport.test.RandomOntology;

/**
 * Tests OntologyStore.
 */
public class OntologyStoreUnitTest {
    @Rule
    public final RandomOntology random = new RandomOntology();

    private final OntologyStore store = new OntologyStore();

    @Test
    public void internsByName() {
        Concept dog = store.createOrGet("Dog");
        assertThat(store.createOrGet("Dog")).isSameAs(dog);
        assertThat(store.createOrGet("  Dog\n")).isSameAs(dog);
        assertThat(store.createOrGet("dog")).isNotSameAs(dog);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    public void randomNamesAreInternedOnce() {
        Map<String, Concept> first = new HashMap<>();
        for (int i = 0; i < 500; i++) {
            String name = "Concept" + random.between(0, 50);
            Concept concept = store.createOrGet(name);
            assertThat(first.computeIfAbsent(name, n -> concept)).isSameAs(concept);
        }
        assertThat(store.size()).isEqualTo(first.size());
    }

    @Test
    public void normalizesWhitespace() {
        assertThat(store.createOrGet(" (p   a\n\tb) ").getName()).isEqualTo("(p a b)");
        assertThat(store.find("(p a b)")).isPresent();
        assertThat(store.find("(p a c)")).isEmpty();
    }

    @Test
    public void stringsKeepTheirWhitespace() {
        assertThat(OntologyStore.normalize(" \"a  dog,\n  \\\" x \\\"\"  ")).isEqualTo("\"a  dog,\n  \\\" x \\\"\"");
        assertThat(OntologyStore.normalize("(documentation  Dog\n\"a  b\"   )")).isEqualTo("(documentation Dog \"a  b\" )");
        assertThat(store.createOrGet("\"a  b\"")).isNotSameAs(store.createOrGet("\"a b\""));
    }

    @Test
    public void blankNamesAreRejected() {
        assertThatThrownBy(() -> store.createOrGet(" \n ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void keepsCreationOrder() {
        store.createOrGet("b");
        store.createOrGet("a");
        store.createOrGet("b");
        store.createOrGet("c");
        assertThat(store.concepts()).extracting(Concept::getName).containsExactly("b", "a", "c");
    }

    @Test
    public void attributesAreDeduplicated() {
        Concept fido = store.createOrGet("Fido");
        Concept instance = store.createOrGet("instance");
        Concept dog = store.createOrGet("Dog");
        assertThat(store.addAttribute(fido, instance, dog)).isTrue();
        assertThat(store.addAttribute(fido, instance, dog)).isFalse();
        assertThat(store.attributeCount()).isEqualTo(1);
        assertThat(fido.values(instance)).containsExactly(dog);
        assertThat(dog.values(instance)).isEmpty();
    }

    @Test
    public void valuesKeepInsertionOrder() {
        Concept paris = store.createOrGet("Paris");
        Concept between = store.createOrGet("between");
        Concept lyon = store.createOrGet("Lyon");
        Concept marseille = store.createOrGet("Marseille");
        store.addAttribute(paris, between, marseille);
        store.addAttribute(paris, between, lyon);
        assertThat(paris.values(between)).containsExactly(marseille, lyon);
        assertThat(paris.attributeCount()).isEqualTo(2);
    }

    @Test
    public void indexesSubjectsByLabel() {
        Concept instance = store.createOrGet("instance");
        Concept dog = store.createOrGet("Dog");
        Concept rex = store.createOrGet("Rex");
        Concept fido = store.createOrGet("Fido");
        store.addAttribute(rex, instance, dog);
        store.addAttribute(fido, instance, dog);
        store.addAttribute(rex, instance, store.createOrGet("Pet"));
        assertThat(store.subjectsWith(instance)).containsExactly(rex, fido);
        assertThat(store.subjectsWith(dog)).isEmpty();
        assertThat(store.labels()).containsExactly(instance);
    }

    @Test
    public void relationsFollowCreationOrder() {
        Concept instance = store.createOrGet("instance");
        Concept fido = store.createOrGet("Fido");
        Concept dog = store.createOrGet("Dog");
        Concept rex = store.createOrGet("Rex");
        store.addAttribute(rex, instance, dog);
        store.addAttribute(fido, instance, dog);
        assertThat(store.relations()).containsExactly(
                new Relation(fido, instance, dog),
                new Relation(rex, instance, dog));
    }

    @Test
    public void foreignConceptsAreRejected() {
        Concept foreign = new OntologyStore().createOrGet("Fido");
        Concept local = store.createOrGet("instance");
        assertThatThrownBy(() -> store.addAttribute(foreign, local, local))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("another store");
    }

    @Test
    public void attributeViewsAreReadOnly() {
        Concept fido = store.createOrGet("Fido");
        Concept instance = store.createOrGet("instance");
        store.addAttribute(fido, instance, store.createOrGet("Dog"));
        assertThatThrownBy(() -> fido.getAttributes().get(instance).add(instance))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> fido.values(instance).clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> store.concepts().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
