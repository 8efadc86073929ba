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
import java.util.Collections;
import java.util.List;

import roam.core.Syntax.Term;
import roam.io.Printer;
import roam.util.Pair;

/**
 * Encodes the structural congruence of ROAM terms. That is, the rules which
 * determine when two terms of different shape denote the same process:
 *
 * <ul>
 * <li>Parallel composition is associative and commutative, with the empty
 * composition as its identity.</li>
 * <li>Sequential composition is associative; an empty sequence is the
 * identity and a singleton sequence is its element.</li>
 * <li>Groups are transparent.</li>
 * <li>An ambient with an empty body is a bare ambient.</li>
 * </ul>
 *
 * Rather than rewriting a term into one normal shape, the matcher views each
 * process as a flat list of <i>components</i> (the branches of its parallel
 * composition), and the reduction engine rebuilds processes from such lists.
 * The original order of components is always preserved.
 *
 * @author David J. Pearce
 *
 */
public class Congruence {

	/**
	 * Flatten a process into the list of its parallel components. Nested parallel
	 * compositions and groups are spliced in place, sequences are flattened, and
	 * identities are dropped. Every component returned is either a named ambient,
	 * a capability leaf, or a sequence of two or more elements.
	 *
	 * @param process
	 * @return
	 */
	public static List<Term> components(Term process) {
		ArrayList<Term> out = new ArrayList<>();
		components(process, out);
		return out;
	}

	private static void components(Term t, List<Term> out) {
		if (t == null) {
			return;
		}
		switch (t.getOpcode()) {
		case Syntax.TERM_parallel: {
			for (Term c : ((Term.Parallel) t).toList()) {
				components(c, out);
			}
			break;
		}
		case Syntax.TERM_group:
			components(((Term.Group) t).operand(), out);
			break;
		case Syntax.TERM_serial: {
			Term.Serial s = (Term.Serial) t;
			List<Term> seq = sequence(s);
			if (seq.size() == 1) {
				components(seq.get(0), out);
			} else if (seq.size() > 1) {
				out.add(sameElements(s, seq) ? s : new Term.Serial(seq.toArray(new Term[seq.size()]), s.attributes()));
			}
			break;
		}
		default:
			out.add(t);
		}
	}

	/**
	 * Flatten the elements of a sequence. Nested sequences are inlined, groups
	 * around anything other than a parallel composition are removed, and empty
	 * compositions are dropped. A parallel composition of two or more branches
	 * remains as a group, since it cannot be inlined.
	 *
	 * @param s
	 * @return
	 */
	public static List<Term> sequence(Term.Serial s) {
		ArrayList<Term> out = new ArrayList<>();
		for (Term e : s.toList()) {
			appendSequence(e, out);
		}
		return out;
	}

	private static void appendSequence(Term e, List<Term> out) {
		Term s = strip(e);
		if (s instanceof Term.Serial) {
			Term.Serial serial = (Term.Serial) s;
			for (Term c : serial.toList()) {
				appendSequence(c, out);
			}
		} else if (s instanceof Term.Parallel) {
			if (!((Term.Parallel) s).isEmpty()) {
				if (e instanceof Term.Group && ((Term.Group) e).operand() == s) {
					out.add(e);
				} else {
					out.add(new Term.Group(s));
				}
			}
		} else {
			out.add(s);
		}
	}

	/**
	 * Remove any groups and singleton parallel compositions surrounding a term.
	 *
	 * @param t
	 * @return
	 */
	private static Term strip(Term t) {
		while (true) {
			if (t instanceof Term.Group) {
				t = ((Term.Group) t).operand();
			} else if (t instanceof Term.Parallel && ((Term.Parallel) t).size() == 1) {
				t = ((Term.Parallel) t).get(0);
			} else {
				return t;
			}
		}
	}

	private static boolean sameElements(Term.Serial s, List<Term> seq) {
		if (s.size() != seq.size()) {
			return false;
		}
		for (int i = 0; i != seq.size(); ++i) {
			if (s.get(i) != seq.get(i)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Determine the head of a given component, which is the capability or
	 * co-capability able to interact next. A named ambient, or a sequence headed
	 * by anything other than a capability, has no head.
	 *
	 * @param component
	 * @return The head, or <code>null</code> if there is none.
	 */
	public static Term head(Term component) {
		if (isCapability(component)) {
			return component;
		} else if (component instanceof Term.Serial) {
			List<Term> seq = sequence((Term.Serial) component);
			if (!seq.isEmpty() && isCapability(seq.get(0))) {
				return seq.get(0);
			}
		}
		return null;
	}

	/**
	 * Determine what remains of a component once its head has been consumed.
	 *
	 * @param component
	 * @return The remainder, or <code>null</code> if nothing remains.
	 */
	public static Term consume(Term component) {
		if (isCapability(component)) {
			return null;
		} else if (component instanceof Term.Serial) {
			List<Term> seq = sequence((Term.Serial) component);
			if (!seq.isEmpty() && isCapability(seq.get(0))) {
				List<Term> rest = seq.subList(1, seq.size());
				switch (rest.size()) {
				case 0:
					return null;
				case 1:
					return rest.get(0);
				default:
					return Term.Serial.construct(rest);
				}
			}
		}
		throw new IllegalArgumentException("component has no head to consume: " + component);
	}

	/**
	 * Rebuild a process from a list of components. Missing (i.e.
	 * <code>null</code>) components and identities are elided, nested
	 * compositions are spliced and a single remaining component stands alone.
	 *
	 * @param components
	 * @return
	 */
	public static Term compose(List<Term> components) {
		ArrayList<Term> flat = new ArrayList<>();
		for (Term c : components) {
			components(c, flat);
		}
		switch (flat.size()) {
		case 0:
			return Term.Parallel.EMPTY;
		case 1:
			return flat.get(0);
		default:
			return Term.Parallel.construct(flat);
		}
	}

	/**
	 * Rebuild an ambient with a given name and body, pruning an empty body to a
	 * bare ambient.
	 *
	 * @param name
	 * @param body
	 * @return
	 */
	public static Term.Named ambient(String name, Term body) {
		if (body instanceof Term.Parallel && ((Term.Parallel) body).isEmpty()) {
			return new Term.Bare(name);
		} else {
			return new Term.Ambient(name, body);
		}
	}

	/**
	 * Check whether a given term is the identity process.
	 *
	 * @param t
	 * @return
	 */
	public static boolean isEmpty(Term t) {
		return components(t).isEmpty();
	}

	public static boolean isCapability(Term t) {
		return t instanceof Term.Capability || t instanceof Term.CoCapability;
	}

	/**
	 * Determine whether two terms are structurally congruent.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static boolean equivalent(Term lhs, Term rhs) {
		return canonicalise(lhs).equals(canonicalise(rhs));
	}

	/**
	 * Construct the canonical representative of a term's congruence class. Here,
	 * components are flattened and sorted by their serialised text, sequences are
	 * flattened and empty ambients are bare. Two terms are congruent if and only
	 * if their canonical representatives are equal.
	 *
	 * @param t
	 * @return
	 */
	public static Term canonicalise(Term t) {
		switch (t.getOpcode()) {
		case Syntax.TERM_bare:
			return new Term.Bare(((Term.Bare) t).name());
		case Syntax.TERM_ambient: {
			Term.Ambient a = (Term.Ambient) t;
			return ambient(a.name(), canonicalise(a.body()));
		}
		case Syntax.TERM_parallel:
		case Syntax.TERM_serial:
		case Syntax.TERM_group: {
			ArrayList<Pair<String, Term>> items = new ArrayList<>();
			for (Term c : components(t)) {
				for (Term d : components(canonicaliseComponent(c))) {
					items.add(new Pair<>(Printer.serialize(d), d));
				}
			}
			Collections.sort(items, (x, y) -> x.first().compareTo(y.first()));
			ArrayList<Term> sorted = new ArrayList<>();
			for (Pair<String, Term> p : items) {
				sorted.add(p.second());
			}
			return compose(sorted);
		}
		default:
			// capabilities are already canonical
			return t;
		}
	}

	private static Term canonicaliseComponent(Term c) {
		if (c instanceof Term.Serial) {
			ArrayList<Term> out = new ArrayList<>();
			for (Term e : sequence((Term.Serial) c)) {
				Term ce = canonicalise(e instanceof Term.Group ? ((Term.Group) e).operand() : e);
				appendSequence(ce, out);
			}
			switch (out.size()) {
			case 0:
				return Term.Parallel.EMPTY;
			case 1:
				return out.get(0);
			default:
				return Term.Serial.construct(out);
			}
		}
		return canonicalise(c);
	}
}
