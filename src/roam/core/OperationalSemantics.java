// This file is part of the ROAM Reducer.
//
// The ROAM Reducer is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The ROAM Reducer is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the ROAM Reducer. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package roam.core;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import roam.core.Matcher.Redex;
import roam.core.Syntax.Term;

/**
 * Encodes the small-step operational semantics of ROAM. Each step locates a
 * redex (see {@link Matcher}) and rewrites the term around it, producing a new
 * term. Terms are never modified in place: the ambients along the path to the
 * redex are rebuilt, whilst all other subterms are shared with the original.
 * A term without any redex is in normal form, and there is no other terminal
 * state.
 *
 * @author David J. Pearce
 *
 */
public class OperationalSemantics {
	private static final Logger LOGGER = LogManager.getLogger(OperationalSemantics.class);

	private final Matcher matcher = new Matcher();
	private final Strategy strategy;

	public OperationalSemantics() {
		this(Strategy.LEFTMOST);
	}

	public OperationalSemantics(Strategy strategy) {
		this.strategy = strategy;
	}

	public Strategy getStrategy() {
		return strategy;
	}

	/**
	 * Callback for observing individual rewrites as they happen.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Listener {
		public void reduced(long step, Redex redex, Term before, Term after);
	}

	/**
	 * Reduce a term to normal form. This may not terminate for terms which admit
	 * infinite reduction sequences.
	 *
	 * @param term
	 * @return
	 */
	public Term execute(Term term) {
		return execute(term, 0, null);
	}

	/**
	 * Reduce a term for at most a given number of steps. The caller can determine
	 * whether normal form was reached using {@link #isNormalForm(Term)}.
	 *
	 * @param term
	 * @param maxSteps
	 *            Maximum number of steps to take, where zero (or less) means no
	 *            limit.
	 * @return
	 */
	public Term execute(Term term, long maxSteps) {
		return execute(term, maxSteps, null);
	}

	/**
	 * Reduce a term for at most a given number of steps, reporting each step to
	 * a given listener.
	 *
	 * @param term
	 * @param maxSteps
	 *            Maximum number of steps to take, where zero (or less) means no
	 *            limit.
	 * @param listener
	 *            Listener to report steps to, or <code>null</code>.
	 * @return
	 */
	public Term execute(Term term, long maxSteps, Listener listener) {
		long count = 0;
		while (maxSteps <= 0 || count < maxSteps) {
			Redex redex = select(term);
			if (redex == null) {
				LOGGER.debug("normal form after {} step(s)", count);
				return term;
			}
			Term next = apply(term, redex);
			count = count + 1;
			if (listener != null) {
				listener.reduced(count, redex, term, next);
			}
			term = next;
		}
		LOGGER.debug("stopped after {} step(s)", count);
		return term;
	}

	/**
	 * Perform exactly one reduction step.
	 *
	 * @param term
	 * @return The reduced term, or <code>null</code> if the term is in normal
	 *         form.
	 */
	public Term step(Term term) {
		Redex redex = select(term);
		return redex == null ? null : apply(term, redex);
	}

	/**
	 * Check whether no reduction rule applies anywhere within a given term.
	 *
	 * @param term
	 * @return
	 */
	public boolean isNormalForm(Term term) {
		return matcher.find(term) == null;
	}

	/**
	 * Choose the redex to reduce next according to the strategy in use.
	 *
	 * @param term
	 * @return The chosen redex, or <code>null</code> if there are none.
	 */
	public Redex select(Term term) {
		if (strategy == Strategy.LEFTMOST) {
			return matcher.find(term);
		}
		List<Redex> redexes = matcher.findAll(term);
		return redexes.isEmpty() ? null : strategy.select(redexes);
	}

	/**
	 * Apply a given redex to a given term.
	 *
	 * @param term
	 * @param redex
	 *            A redex previously found in this term.
	 * @return
	 * @throws IllegalArgumentException
	 *             if the redex does not describe a reducible position of the term.
	 */
	public Term apply(Term term, Redex redex) {
		Term result = apply(term, redex, 0);
		LOGGER.debug("{} ===> {}", term, result);
		return result;
	}

	private Term apply(Term process, Redex redex, int level) {
		if (level == redex.depth()) {
			switch (redex.kind()) {
			case ENTRY:
				return reduceEntry(process, redex);
			case EXIT:
				return reduceExit(process, redex);
			default:
				return reduceOpen(process, redex);
			}
		}
		// Descend through the enclosing ambient
		List<Term> components = Congruence.components(process);
		Term.Named a = named(components, redex.scope(level), redex);
		Term body = apply(a.body(), redex, level + 1);
		components.set(redex.scope(level), Congruence.ambient(a.name(), body));
		return Congruence.compose(components);
	}

	/**
	 * Rule R-Entry.
	 *
	 * <pre>
	 * a[in b.P | Q] | b[in_ a.R | S]  ==>  b[R | S | a[P | Q]]
	 * </pre>
	 */
	protected Term reduceEntry(Term scope, Redex redex) {
		List<Term> components = Congruence.components(scope);
		Term.Named a = named(components, redex.actor(), redex);
		Term.Named b = named(components, redex.subject(), redex);
		check(redex.actor() != redex.subject() && b.name().equals(redex.getCapability().target()), redex);
		// Consume the capability of the moving ambient
		List<Term> as = consume(a, redex.capability(), redex.getCapability(), redex);
		Term.Named na = Congruence.ambient(a.name(), Congruence.compose(as));
		// Consume the co-capability of the ambient being entered, and move in
		List<Term> bs = consume(b, redex.coCapability(), redex.getCoCapability(), redex);
		bs.add(na);
		components.set(redex.subject(), Congruence.ambient(b.name(), Congruence.compose(bs)));
		components.remove(redex.actor());
		return Congruence.compose(components);
	}

	/**
	 * Rule R-Exit.
	 *
	 * <pre>
	 * b[a[out b.P | Q] | out_ a.R | S]  ==>  a[P | Q] | b[R | S]
	 * </pre>
	 */
	protected Term reduceExit(Term scope, Redex redex) {
		List<Term> components = Congruence.components(scope);
		Term.Named b = named(components, redex.subject(), redex);
		check(b.name().equals(redex.getCapability().target()), redex);
		// Consume the co-capability of the ambient being exited
		List<Term> bs = consume(b, redex.coCapability(), redex.getCoCapability(), redex);
		Term.Named a = named(bs, redex.actor(), redex);
		// Consume the capability of the moving ambient, and move out
		List<Term> as = consume(a, redex.capability(), redex.getCapability(), redex);
		bs.remove(redex.actor());
		components.set(redex.subject(), Congruence.ambient(b.name(), Congruence.compose(bs)));
		components.add(redex.subject(), Congruence.ambient(a.name(), Congruence.compose(as)));
		return Congruence.compose(components);
	}

	/**
	 * Rule R-Open.
	 *
	 * <pre>
	 * open b.P | b[open_ x.Q | R]  ==>  P | Q | R
	 * </pre>
	 */
	protected Term reduceOpen(Term scope, Redex redex) {
		List<Term> components = Congruence.components(scope);
		Term holder = component(components, redex.actor(), redex);
		check(redex.getCapability().equals(Congruence.head(holder)), redex);
		Term.Named b = named(components, redex.subject(), redex);
		check(b.name().equals(redex.getCapability().target()), redex);
		List<Term> bs = consume(b, redex.coCapability(), redex.getCoCapability(), redex);
		// Dissolve the ambient into the enclosing scope
		ArrayList<Term> result = new ArrayList<>();
		for (int i = 0; i != components.size(); ++i) {
			if (i == redex.actor()) {
				result.add(Congruence.consume(holder));
			} else if (i == redex.subject()) {
				result.addAll(bs);
			} else {
				result.add(components.get(i));
			}
		}
		return Congruence.compose(result);
	}

	/**
	 * Consume the head of a given component within the body of a named ambient,
	 * checking it matches what is expected. The resulting list of components may
	 * contain <code>null</code> where nothing remains of the component.
	 */
	private static List<Term> consume(Term.Named a, int index, Term expected, Redex redex) {
		List<Term> components = Congruence.components(a.body());
		Term c = component(components, index, redex);
		check(expected.equals(Congruence.head(c)), redex);
		components.set(index, Congruence.consume(c));
		return components;
	}

	private static Term.Named named(List<Term> components, int index, Redex redex) {
		Term t = component(components, index, redex);
		if (t instanceof Term.Named) {
			return (Term.Named) t;
		}
		throw new IllegalArgumentException("invalid redex: " + redex);
	}

	private static Term component(List<Term> components, int index, Redex redex) {
		check(index >= 0 && index < components.size(), redex);
		return components.get(index);
	}

	private static void check(boolean condition, Redex redex) {
		if (!condition) {
			throw new IllegalArgumentException("invalid redex: " + redex);
		}
	}
}
