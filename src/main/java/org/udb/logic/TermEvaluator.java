package org.udb.logic;

import org.udb.term.SatisfiedResult;
import org.udb.term.Term;

/**
 * Callback che risolve il valore di un singolo termine nello stato di conoscenza corrente.
 */
@FunctionalInterface
public interface TermEvaluator {

    SatisfiedResult evaluate(Term term);
}
