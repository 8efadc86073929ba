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
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import roam.core.Syntax.Term;

/**
 * Responsible for locating redexes within a term. A redex is a place where a
 * capability and a compatible co-capability are both at the head of their
 * respective components, and the ambients involved are positioned as required
 * by one of the three reduction rules:
 *
 * <pre>
 * (Entry)        a[in b.P | Q] | b[in_ a.R | S]  ==>  b[R | S | a[P | Q]]
 * (Exit)         b[a[out b.P | Q] | out_ a.R | S]  ==>  a[P | Q] | b[R | S]
 * (Dissolution)  open b.P | b[open_ x.Q | R]  ==>  P | Q | R
 * </pre>
 *
 * In each case the co-capability may instead carry the wildcard. For
 * dissolution, the authorisation <code>x</code> must admit the name of the
 * ambient enclosing the scope in which the dissolution takes place.
 *
 * Scopes are searched in pre-order (a scope before the scopes nested within
 * it), and components within a scope from left to right. Ambient names are not
 * assumed to be unique: every same-named sibling is considered.
 *
 * @author David J. Pearce
 *
 */
public class Matcher {

	/**
	 * Find the first redex in a given term.
	 *
	 * @param term
	 * @return The first redex, or <code>null</code> if the term is in normal form.
	 */
	public Redex find(Term term) {
		ArrayList<Redex> matches = new ArrayList<>();
		search(term, null, new int[0], matches, true);
		return matches.isEmpty() ? null : matches.get(0);
	}

	/**
	 * Find all redexes in a given term, in traversal order.
	 *
	 * @param term
	 * @return
	 */
	public List<Redex> findAll(Term term) {
		ArrayList<Redex> matches = new ArrayList<>();
		search(term, null, new int[0], matches, false);
		return matches;
	}

	/**
	 * Search a given process (and all processes nested within it) for redexes.
	 *
	 * @param process
	 *            The process being searched
	 * @param requester
	 *            The name of the ambient whose body is this process, or
	 *            <code>null</code> at the outermost level.
	 * @param path
	 *            Component indices leading from the outermost process to this one.
	 * @param matches
	 *            List of matches found so far.
	 * @param first
	 *            Stop as soon as one scope yields a match.
	 * @return True if searching should stop.
	 */
	private boolean search(Term process, String requester, int[] path, List<Redex> matches, boolean first) {
		List<Term> scope = Congruence.components(process);
		for (int i = 0; i != scope.size(); ++i) {
			Term c = scope.get(i);
			if (c instanceof Term.Named) {
				matchEntry(scope, i, path, matches);
				matchExit(scope, i, path, matches);
			} else {
				matchOpen(scope, i, requester, path, matches);
			}
		}
		if (first && !matches.isEmpty()) {
			return true;
		}
		// Now search nested scopes
		for (int i = 0; i != scope.size(); ++i) {
			Term c = scope.get(i);
			if (c instanceof Term.Named) {
				Term.Named a = (Term.Named) c;
				if (search(a.body(), a.name(), append(path, i), matches, first)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Match all entries where the ambient at position <code>i</code> moves into
	 * a sibling.
	 */
	private void matchEntry(List<Term> scope, int i, int[] path, List<Redex> matches) {
		Term.Named a = (Term.Named) scope.get(i);
		List<Term> as = Congruence.components(a.body());
		for (int p = 0; p != as.size(); ++p) {
			Term head = Congruence.head(as.get(p));
			if (head instanceof Term.In) {
				Term.In cap = (Term.In) head;
				for (int j = 0; j != scope.size(); ++j) {
					Term sibling = scope.get(j);
					if (j != i && sibling instanceof Term.Named && ((Term.Named) sibling).name().equals(cap.target())) {
						List<Term> bs = Congruence.components(((Term.Named) sibling).body());
						for (int q = 0; q != bs.size(); ++q) {
							Term co = Congruence.head(bs.get(q));
							if (co instanceof Term.CoIn && ((Term.CoIn) co).admits(a.name())) {
								matches.add(new Redex(Redex.Kind.ENTRY, path, i, p, j, q, a.name(), cap,
										(Term.CoIn) co));
							}
						}
					}
				}
			}
		}
	}

	/**
	 * Match all exits where a child of the ambient at position <code>i</code>
	 * moves out into this scope.
	 */
	private void matchExit(List<Term> scope, int i, int[] path, List<Redex> matches) {
		Term.Named b = (Term.Named) scope.get(i);
		List<Term> bs = Congruence.components(b.body());
		for (int c = 0; c != bs.size(); ++c) {
			if (bs.get(c) instanceof Term.Named) {
				Term.Named a = (Term.Named) bs.get(c);
				List<Term> as = Congruence.components(a.body());
				for (int p = 0; p != as.size(); ++p) {
					Term head = Congruence.head(as.get(p));
					if (head instanceof Term.Out && ((Term.Out) head).target().equals(b.name())) {
						for (int q = 0; q != bs.size(); ++q) {
							Term co = Congruence.head(bs.get(q));
							if (co instanceof Term.CoOut && ((Term.CoOut) co).admits(a.name())) {
								matches.add(new Redex(Redex.Kind.EXIT, path, c, p, i, q, a.name(), (Term.Out) head,
										(Term.CoOut) co));
							}
						}
					}
				}
			}
		}
	}

	/**
	 * Match all dissolutions requested by the component at position
	 * <code>h</code>.
	 */
	private void matchOpen(List<Term> scope, int h, String requester, int[] path, List<Redex> matches) {
		Term head = Congruence.head(scope.get(h));
		if (head instanceof Term.Open) {
			Term.Open cap = (Term.Open) head;
			for (int j = 0; j != scope.size(); ++j) {
				Term sibling = scope.get(j);
				if (sibling instanceof Term.Named && ((Term.Named) sibling).name().equals(cap.target())) {
					List<Term> bs = Congruence.components(((Term.Named) sibling).body());
					for (int q = 0; q != bs.size(); ++q) {
						Term co = Congruence.head(bs.get(q));
						if (co instanceof Term.CoOpen && ((Term.CoOpen) co).admits(requester)) {
							matches.add(
									new Redex(Redex.Kind.OPEN, path, h, -1, j, q, requester, cap, (Term.CoOpen) co));
						}
					}
				}
			}
		}
	}

	private static int[] append(int[] path, int i) {
		int[] npath = Arrays.copyOf(path, path.length + 1);
		npath[path.length] = i;
		return npath;
	}

	/**
	 * Identifies a single redex within a term. The <i>scope</i> is the process in
	 * which the rule applies, identified by a path of component indices from the
	 * outermost process (each step descending into the body of a named ambient).
	 * Within the scope:
	 *
	 * <ul>
	 * <li><b>Entry</b>. The <i>actor</i> is the moving ambient, and
	 * <i>capability</i> the index of its <code>in</code> component. The
	 * <i>subject</i> is the ambient being entered, and <i>coCapability</i> the
	 * index of its <code>in_</code> component.</li>
	 * <li><b>Exit</b>. The <i>subject</i> is the ambient being exited, and
	 * <i>coCapability</i> the index of its <code>out_</code> component. The
	 * <i>actor</i> is the index of the moving ambient within the subject's body,
	 * and <i>capability</i> the index of its <code>out</code> component.</li>
	 * <li><b>Dissolution</b>. The <i>actor</i> is the component holding the
	 * <code>open</code> capability (and <i>capability</i> is unused). The
	 * <i>subject</i> is the ambient being dissolved, and <i>coCapability</i> the
	 * index of its <code>open_</code> component.</li>
	 * </ul>
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Redex {
		public enum Kind {
			ENTRY, EXIT, OPEN
		}

		private final Kind kind;
		private final int[] scope;
		private final int actor;
		private final int capability;
		private final int subject;
		private final int coCapability;
		private final String requester;
		private final Term.Capability cap;
		private final Term.CoCapability co;

		public Redex(Kind kind, int[] scope, int actor, int capability, int subject, int coCapability,
				String requester, Term.Capability cap, Term.CoCapability co) {
			this.kind = kind;
			this.scope = scope.clone();
			this.actor = actor;
			this.capability = capability;
			this.subject = subject;
			this.coCapability = coCapability;
			this.requester = requester;
			this.cap = cap;
			this.co = co;
		}

		public Kind kind() {
			return kind;
		}

		public int[] scope() {
			return scope.clone();
		}

		/**
		 * Get the number of ambients enclosing the scope of this redex.
		 *
		 * @return
		 */
		public int depth() {
			return scope.length;
		}

		public int scope(int i) {
			return scope[i];
		}

		public int actor() {
			return actor;
		}

		public int capability() {
			return capability;
		}

		public int subject() {
			return subject;
		}

		public int coCapability() {
			return coCapability;
		}

		/**
		 * Get the name of the ambient requesting this action. For entry and exit this
		 * is the moving ambient; for dissolution it is the ambient enclosing the
		 * scope, or <code>null</code> at the outermost level.
		 *
		 * @return
		 */
		public String requester() {
			return requester;
		}

		/**
		 * Get the capability consumed by this redex.
		 *
		 * @return
		 */
		public Term.Capability getCapability() {
			return cap;
		}

		/**
		 * Get the co-capability consumed by this redex.
		 *
		 * @return
		 */
		public Term.CoCapability getCoCapability() {
			return co;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Redex) {
				Redex r = (Redex) o;
				return r.kind == kind && Arrays.equals(r.scope, scope) && r.actor == actor
						&& r.capability == capability && r.subject == subject && r.coCapability == coCapability;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return kind.hashCode() ^ Arrays.hashCode(scope) ^ (actor << 16) ^ (subject << 8) ^ capability
					^ coCapability;
		}

		@Override
		public String toString() {
			String who = requester == null ? "" : requester + " ";
			return kind.name().toLowerCase(Locale.ROOT) + ": " + who + cap + " / " + co + " @" + Arrays.toString(scope);
		}
	}
}
