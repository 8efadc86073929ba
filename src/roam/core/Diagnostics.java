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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import roam.core.Syntax.Term;
import roam.util.Pair;

/**
 * Inspects terms for signs that reduction has got stuck, for example because a
 * capability targets an ambient which does not exist. Such terms are still in
 * normal form as far as the reduction engine is concerned; this class only
 * reports on them.
 *
 * @author David J. Pearce
 *
 */
public class Diagnostics {

	/**
	 * Find all capabilities at the head of some component whose target names no
	 * ambient anywhere within the given term. Such capabilities can never be
	 * consumed.
	 *
	 * @param term
	 * @return Each capability paired with the name of its enclosing ambient
	 *         (<code>null</code> at the outermost level).
	 */
	public static List<Pair<String, Term.Capability>> unresolved(Term term) {
		HashSet<String> names = new HashSet<>();
		names(term, names);
		ArrayList<Pair<String, Term.Capability>> result = new ArrayList<>();
		for (Pair<String, Term> p : pending(term)) {
			if (p.second() instanceof Term.Capability) {
				Term.Capability c = (Term.Capability) p.second();
				if (!names.contains(c.target())) {
					result.add(new Pair<>(p.first(), c));
				}
			}
		}
		return result;
	}

	/**
	 * Find all capabilities and co-capabilities which are at the head of some
	 * component, in pre-order.
	 *
	 * @param term
	 * @return Each head paired with the name of its enclosing ambient
	 *         (<code>null</code> at the outermost level).
	 */
	public static List<Pair<String, Term>> pending(Term term) {
		ArrayList<Pair<String, Term>> result = new ArrayList<>();
		pending(term, null, result);
		return result;
	}

	/**
	 * Check whether a given term is in normal form, yet still holds capabilities
	 * waiting to be exercised. Pending co-capabilities alone do not count, since
	 * an ambient offering authorisations is a valid final state.
	 *
	 * @param term
	 * @return
	 */
	public static boolean isStuck(Term term) {
		if (new Matcher().find(term) != null) {
			return false;
		}
		for (Pair<String, Term> p : pending(term)) {
			if (p.second() instanceof Term.Capability) {
				return true;
			}
		}
		return false;
	}

	private static void pending(Term process, String enclosing, List<Pair<String, Term>> result) {
		List<Term> components = Congruence.components(process);
		for (Term c : components) {
			Term head = Congruence.head(c);
			if (head != null) {
				result.add(new Pair<>(enclosing, head));
			}
		}
		for (Term c : components) {
			if (c instanceof Term.Named) {
				Term.Named a = (Term.Named) c;
				pending(a.body(), a.name(), result);
			}
		}
	}

	/**
	 * Collect the names of all ambients within a term, however deeply nested
	 * (including those guarded by capabilities).
	 */
	private static void names(Term t, Set<String> names) {
		switch (t.getOpcode()) {
		case Syntax.TERM_bare:
			names.add(((Term.Bare) t).name());
			break;
		case Syntax.TERM_ambient: {
			Term.Ambient a = (Term.Ambient) t;
			names.add(a.name());
			names(a.body(), names);
			break;
		}
		case Syntax.TERM_parallel:
		case Syntax.TERM_serial: {
			for (Term c : ((Term.Composition) t).toList()) {
				names(c, names);
			}
			break;
		}
		case Syntax.TERM_group:
			names(((Term.Group) t).operand(), names);
			break;
		default:
			// capabilities contain no ambients
			break;
		}
	}
}
