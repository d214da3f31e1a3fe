package org.kifexport.parser;

import static org.kifexport.common.Diagnostic.Kind.AMBIGUOUS_ROOT;
import static org.kifexport.common.Diagnostic.Kind.PARTIAL_PARSE;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.kifexport.common.Diagnostics;
import org.kifexport.parser.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the canonical root of a forest: the widest constituent, ties going to
 * the first one in document order (leftmost start, then grammar declaration
 * order of the category, then discovery order). This greedy longest span
 * choice always terminates and is reproducible but does not guarantee a full
 * parse; partial coverage and competing roots are reported as diagnostics.
 */
public class AmbiguityResolver {
    private static final Logger log = LoggerFactory.getLogger(AmbiguityResolver.class);

    public Resolution resolve(ParseForest forest, Diagnostics diagnostics) {
        Comparator<Constituent> documentOrder = documentOrder(forest.getGrammar());
        Constituent best = null;
        for (Constituent candidate : forest.constituents()) {
            if (best == null || candidate.width() > best.width()
                    || candidate.width() == best.width() && documentOrder.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        int tokenCount = forest.tokenCount();
        if (best == null) {
            return new Resolution(null, tokenCount, 0);
        }
        int competitors = 0;
        for (Constituent candidate : forest.constituents()) {
            if (candidate.width() == best.width() && candidate.getStart() != best.getStart()) {
                competitors++;
            }
        }
        Resolution resolution = new Resolution(best, tokenCount, competitors);
        if (competitors > 0) {
            diagnostics.report(AMBIGUOUS_ROOT, forest.offset(best), String.format(Locale.ROOT,
                    "%d other constituents also span %d tokens, keeping %s", competitors, best.width(), best));
        }
        if (resolution.isPartial()) {
            List<Token> tokens = forest.getTokens();
            int firstUncovered = best.getStart() > 0 ? 0 : best.getEnd();
            diagnostics.report(PARTIAL_PARSE, tokens.get(firstUncovered).getOffset(), String.format(Locale.ROOT,
                    "Canonical root %s covers tokens [%d, %d) of %d", best.getCategory(), best.getStart(), best.getEnd(), tokenCount));
        }
        log.debug("Canonical root is {} ({} ambiguous constituents in the forest)", best, forest.ambiguousCount());
        return resolution;
    }

    private static Comparator<Constituent> documentOrder(Grammar grammar) {
        return Comparator.comparingInt(Constituent::getStart)
                .thenComparingInt(c -> grammar.rank(c.getCategory()))
                .thenComparingInt(Constituent::getId);
    }
}
