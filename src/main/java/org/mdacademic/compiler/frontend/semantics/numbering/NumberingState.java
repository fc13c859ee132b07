package org.mdacademic.compiler.frontend.semantics.numbering;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * The counters of one numbering pass. A fresh state is created per document, so numbering is a pure
 * function of the block sequence.
 */
public final class NumberingState {

    private final int[] sections = new int[6];
    private final Map<NumberingCounter, Integer> counters = new EnumMap<>(NumberingCounter.class);
    private boolean appendix;

    /**
     * Advances the section counter of a level and resets all deeper levels.
     * @param level The heading level, 1 to 6.
     * @return The dotted section number, e.g. "2.1"; top-level appendix sections use letters.
     */
    public String nextSection(int level) {
        sections[level - 1]++;
        for (int i = level; i < sections.length; i++) {
            sections[i] = 0;
        }
        StringJoiner number = new StringJoiner(".");
        for (int i = 0; i < level; i++) {
            number.add(i == 0 && appendix ? letters(sections[0]) : Integer.toString(sections[i]));
        }
        return number.toString();
    }

    /**
     * @param counter The counter to advance.
     * @return The new value, starting at 1.
     */
    public int next(NumberingCounter counter) {
        return counters.merge(counter, 1, Integer::sum);
    }

    /**
     * Switches top-level sections to letters and restarts section numbering.
     */
    public void enterAppendix() {
        appendix = true;
        Arrays.fill(sections, 0);
    }

    /**
     * @return Whether an appendix marker has been passed.
     */
    public boolean inAppendix() {
        return appendix;
    }

    static String letters(int n) {
        StringBuilder out = new StringBuilder();
        int value = n;
        while (value > 0) {
            value--;
            out.insert(0, (char) ('A' + value % 26));
            value /= 26;
        }
        return out.toString();
    }
}
