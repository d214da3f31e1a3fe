package org.kifexport.test;

import com.google.common.base.Strings;

/**
 * SUO-KIF documents used across the test suites.
 */
public final class KifSamples {
    /** A single ground fact. */
    public static final String FIDO_IS_A_DOG = "(instance Fido Dog)";

    /** One rule followed by the fact that triggers it. */
    public static final String DOGS_ARE_MAMMALS = "(=> (instance ?X Dog) (instance ?X Mammal))\n"
            + "(instance Fido Dog)\n";

    /** The closing parenthesis is missing. */
    public static final String UNCLOSED = "(instance Fido Dog";

    public static final String EMPTY = "";

    /** A commented document with a rule nested under a quantifier. */
    public static final String COMMENTED_RULE = "\n"
            + "    ;; Just a test\n"
            + "    (=>\n"
            + "        (subclass Human Animal)\n"
            + "        (\n"
            + "            forall (?X)\n"
            + "            (=>\n"
            + "                (instance ?X Human)\n"
            + "                (instance ?X Animal)\n"
            + "            )\n"
            + "        )\n"
            + "    )\n";

    private KifSamples() {
        // Uncallable utility constructor
    }

    /**
     * A fact wrapped in {@code depth} negations, so its parse tree is at
     * least {@code depth} levels deep.
     */
    public static String nestedNegations(int depth) {
        return Strings.repeat("(not ", depth) + "(attribute Fido Hungry)" + Strings.repeat(")", depth);
    }

    /**
     * {@code count} distinct ground facts, one per line. The left recursive
     * document list makes the parse tree {@code count} levels deep.
     */
    public static String manyFacts(int count) {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < count; i++) {
            b.append("(instance Individual").append(i).append(" Class").append(i % 10).append(")\n");
        }
        return b.toString();
    }
}
