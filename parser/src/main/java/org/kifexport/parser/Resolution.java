package org.kifexport.parser;

import java.util.Optional;

import javax.annotation.Nullable;

import lombok.Value;

/**
 * The canonical parse root picked from a forest.
 */
@Value
public class Resolution {
    /**
     * Null when the forest is empty (no tokens).
     */
    @Nullable
    Constituent root;
    int tokenCount;
    /**
     * Same width constituents starting elsewhere than the root.
     */
    int competitors;

    public Optional<Constituent> root() {
        return Optional.ofNullable(root);
    }

    /**
     * Whether the root leaves some tokens uncovered.
     */
    public boolean isPartial() {
        int covered = root == null ? 0 : root.width();
        return covered != tokenCount;
    }
}
