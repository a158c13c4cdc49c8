package org.javai.formula.apply;

import org.javai.formula.CategoricalTerm;
import org.javai.formula.InteractionTerm;
import org.javai.formula.Term;
import org.javai.formula.Terms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides, term by term in formula order, whether a categorical variable can use
 * its reduced-rank coding or must be promoted to full rank.
 *
 * <p>A categorical variable in a term is redundant when its alias, the term with
 * that variable dropped, has already been seen: the columns of the alias then
 * span what the variable's base level would add. The alias of a main effect is
 * the intercept. A non-redundant variable is promoted to full-rank coding, and its
 * alias counts as seen from then on, since the promoted columns span it.
 *
 * <p>One tracker serves one pass over one formula side; it is not thread-safe.
 */
public final class RedundancyTracker {

    private static final Logger logger = LoggerFactory.getLogger(RedundancyTracker.class);

    private final List<Set<String>> seen = new ArrayList<>();

    /**
     * Records a term as present in the formula.
     */
    public void markSeen(Term term) {
        markSeen(Terms.symbols(term));
    }

    void markSeen(Set<String> symbols) {
        seen.add(Set.copyOf(symbols));
    }

    public boolean isSeen(Set<String> symbols) {
        return seen.contains(symbols);
    }

    /**
     * Codes a categorical variable occurring in {@code context}, which is either the
     * variable itself (a main effect) or an interaction containing it.
     *
     * @return the variable, promoted to full rank if it is not redundant
     */
    public CategoricalTerm resolve(CategoricalTerm term, Term context) {
        Set<String> alias = alias(context, term);
        if (isSeen(alias)) {
            logger.debug("{} in {}: alias {} already present, keeping reduced rank", term, context, alias);
            return term;
        }
        markSeen(alias);
        CategoricalTerm promoted = term.promoted();
        logger.debug("{} in {}: alias {} absent, promoting to {}", term, context, alias, promoted);
        return promoted;
    }

    /**
     * Symbols of the term left when {@code term} is dropped from {@code context}.
     */
    static Set<String> alias(Term context, Term term) {
        Set<String> dropped = Terms.symbols(term);
        if (Terms.symbols(context).equals(dropped)) {
            return Set.of(Terms.INTERCEPT_SYMBOL);
        }
        Set<String> alias = new LinkedHashSet<>();
        if (context instanceof InteractionTerm interaction) {
            for (Term other : interaction.terms()) {
                Set<String> symbols = Terms.symbols(other);
                if (!symbols.equals(dropped)) {
                    alias.addAll(symbols);
                }
            }
        }
        return Set.copyOf(alias);
    }

    /**
     * Symbol sets seen so far, in order.
     */
    List<Set<String>> seen() {
        return List.copyOf(seen);
    }
}
