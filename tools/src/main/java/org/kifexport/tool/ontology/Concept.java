package org.kifexport.tool.ontology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Maps;

/**
 * A named node of the ontology. Concepts are only created by
 * {@link OntologyStore#createOrGet(String)} which guarantees one instance per
 * name, so equality is identity.
 * <p>
 * Attributes map a label concept to the ordered values recorded under it.
 */
public final class Concept {
    private final String name;
    private final Map<Concept, List<Concept>> attributes = new LinkedHashMap<>();

    Concept(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Read only view of the attributes, labels and values in insertion order.
     */
    public Map<Concept, List<Concept>> getAttributes() {
        return Maps.transformValues(Collections.unmodifiableMap(attributes), Collections::unmodifiableList);
    }

    /**
     * Values recorded under {@code label}, empty if none.
     */
    public List<Concept> values(Concept label) {
        List<Concept> values = attributes.get(label);
        if (values == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Number of (label, value) pairs.
     */
    public int attributeCount() {
        int count = 0;
        for (List<Concept> values : attributes.values()) {
            count += values.size();
        }
        return count;
    }

    /**
     * Record {@code value} under {@code label}.
     *
     * @return false if it was already there
     */
    boolean add(Concept label, Concept value) {
        List<Concept> values = attributes.computeIfAbsent(label, l -> new ArrayList<>());
        if (values.contains(value)) {
            return false;
        }
        values.add(value);
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}
