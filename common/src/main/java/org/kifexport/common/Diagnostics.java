package org.kifexport.common;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

import org.slf4j.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Collects the diagnostics of one run in the order they were raised.
 */
@NotThreadSafe
public class Diagnostics {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Diagnostic report(Diagnostic.Kind kind, String message) {
        return report(kind, Diagnostic.NO_OFFSET, message);
    }

    public Diagnostic report(Diagnostic.Kind kind, int offset, String message) {
        Diagnostic diagnostic = new Diagnostic(checkNotNull(kind), checkNotNull(message), offset);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public List<Diagnostic> list() {
        return ImmutableList.copyOf(diagnostics);
    }

    public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
        return diagnostics.stream()
                .filter(d -> d.getKind() == kind)
                .collect(ImmutableList.toImmutableList());
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }

    /**
     * Log every diagnostic, errors at error level and the rest as warnings.
     */
    public static void logAll(Iterable<Diagnostic> diagnostics, Logger log) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind().isError()) {
                log.error("{}", diagnostic);
            } else {
                log.warn("{}", diagnostic);
            }
        }
    }
}
