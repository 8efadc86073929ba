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

import java.util.Arrays;
import java.util.List;

import roam.io.Printer;
import roam.util.SyntacticElement;

/**
 * The abstract syntax of ROAM programs. A term is either an ambient (possibly
 * without a body), a parallel or serial composition, an explicit grouping, or
 * one of the six capability and co-capability leaves.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_bare = 0;
	public final static int TERM_ambient = 1;
	public final static int TERM_parallel = 2;
	public final static int TERM_serial = 3;
	public final static int TERM_group = 4;
	public final static int TERM_in = 5;
	public final static int TERM_out = 6;
	public final static int TERM_open = 7;
	public final static int TERM_coin = 8;
	public final static int TERM_coout = 9;
	public final static int TERM_coopen = 10;

	/**
	 * The authorisation which admits any requester. This is never a legal ambient
	 * name.
	 */
	public final static String WILDCARD = "*";

	/**
	 * Check whether a given string is a legal ambient name, i.e. a non-empty
	 * sequence drawn from <code>[a-zA-Z_-]</code>.
	 *
	 * @param name
	 * @return
	 */
	public static boolean isName(String name) {
		if (name == null || name.isEmpty()) {
			return false;
		}
		for (int i = 0; i != name.length(); ++i) {
			if (!isNameChar(name.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	public static boolean isNameChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '-';
	}

	private static String checkName(String name) {
		if (!isName(name)) {
			throw new IllegalArgumentException("invalid ambient name: " + name);
		}
		return name;
	}

	public interface Term extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract term to be implemented by all other terms.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm extends SyntacticElement.Impl implements Term {
			private final int opcode;

			public AbstractTerm(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public String toString() {
				return Printer.toDisplay(this);
			}
		}

		/**
		 * A marker interface to indicate terms which are named ambients, whether or
		 * not they have a body.
		 *
		 * @author David J. Pearce
		 *
		 */
		public interface Named extends Term {
			/**
			 * Get the name of this ambient.
			 *
			 * @return
			 */
			public String name();

			/**
			 * Get the body of this ambient, which is the empty composition for a bare
			 * ambient.
			 *
			 * @return
			 */
			public Term body();
		}

		/**
		 * Represents an ambient with an empty body, written either <code>a</code> or
		 * <code>a[]</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Bare extends AbstractTerm implements Named {
			private final String name;

			public Bare(String name, Attribute... attributes) {
				super(TERM_bare, attributes);
				this.name = checkName(name);
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term body() {
				return Parallel.EMPTY;
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bare && ((Bare) o).name.equals(name);
			}
		}

		/**
		 * Represents a named ambient enclosing some process, such as the following:
		 *
		 * <pre>
		 * a[in b | c[]]
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Ambient extends AbstractTerm implements Named {
			private final String name;
			private final Term body;

			public Ambient(String name, Term body, Attribute... attributes) {
				super(TERM_ambient, attributes);
				if (body == null) {
					throw new IllegalArgumentException("ambient body cannot be null");
				}
				this.name = checkName(name);
				this.body = body;
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public Term body() {
				return body;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ body.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Ambient) {
					Ambient a = (Ambient) o;
					return a.name.equals(name) && a.body.equals(body);
				}
				return false;
			}
		}

		/**
		 * Common base for compositions of zero or more terms.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class Composition extends AbstractTerm {
			protected final Term[] terms;

			public Composition(int opcode, Term[] terms, Attribute... attributes) {
				super(opcode, attributes);
				for (int i = 0; i != terms.length; ++i) {
					if (terms[i] == null) {
						throw new IllegalArgumentException("composition cannot contain null");
					}
				}
				this.terms = terms.clone();
			}

			public int size() {
				return terms.length;
			}

			public Term get(int i) {
				return terms[i];
			}

			public List<Term> toList() {
				return Arrays.asList(terms.clone());
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ Arrays.hashCode(terms);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Composition) {
					Composition c = (Composition) o;
					return c.getOpcode() == getOpcode() && Arrays.equals(c.terms, terms);
				}
				return false;
			}
		}

		/**
		 * Represents the parallel composition of zero or more terms, such as
		 * <code>a[] | b[]</code>. The empty composition is the identity process.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Parallel extends Composition {
			public static final Parallel EMPTY = new Parallel();

			public Parallel(Term[] terms, Attribute... attributes) {
				super(TERM_parallel, terms, attributes);
			}

			public Parallel(Term... terms) {
				super(TERM_parallel, terms);
			}

			public static Parallel construct(List<Term> terms) {
				return new Parallel(terms.toArray(new Term[terms.size()]));
			}

			/**
			 * Check whether this is the identity process.
			 *
			 * @return
			 */
			public boolean isEmpty() {
				return terms.length == 0;
			}
		}

		/**
		 * Represents the sequential composition of terms, such as
		 * <code>in_ a.open a</code>. Only the first element of a sequence is able to
		 * interact.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Serial extends Composition {

			public Serial(Term[] terms, Attribute... attributes) {
				super(TERM_serial, terms, attributes);
			}

			public Serial(Term... terms) {
				super(TERM_serial, terms);
			}

			public static Serial construct(List<Term> terms) {
				return new Serial(terms.toArray(new Term[terms.size()]));
			}
		}

		/**
		 * Represents an explicitly parenthesised term, such as
		 * <code>(b[] | c[])</code> in <code>open_.(b[] | c[])</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Group extends AbstractTerm {
			private final Term operand;

			public Group(Term operand, Attribute... attributes) {
				super(TERM_group, attributes);
				if (operand == null) {
					throw new IllegalArgumentException("group operand cannot be null");
				}
				this.operand = operand;
			}

			public Term operand() {
				return operand;
			}

			@Override
			public int hashCode() {
				return 31 * operand.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Group && ((Group) o).operand.equals(operand);
			}
		}

		/**
		 * An action held by an ambient which wishes to act upon a given (target)
		 * ambient.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class Capability extends AbstractTerm {
			private final String target;

			public Capability(int opcode, String target, Attribute... attributes) {
				super(opcode, attributes);
				this.target = checkName(target);
			}

			/**
			 * Get the name of the ambient this capability acts upon.
			 *
			 * @return
			 */
			public String target() {
				return target;
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ target.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Capability) {
					Capability c = (Capability) o;
					return c.getOpcode() == getOpcode() && c.target.equals(target);
				}
				return false;
			}
		}

		/**
		 * Represents an entry capability <code>in b</code>.
		 */
		public class In extends Capability {
			public In(String target, Attribute... attributes) {
				super(TERM_in, target, attributes);
			}
		}

		/**
		 * Represents an exit capability <code>out b</code>.
		 */
		public class Out extends Capability {
			public Out(String target, Attribute... attributes) {
				super(TERM_out, target, attributes);
			}
		}

		/**
		 * Represents a dissolution capability <code>open b</code>.
		 */
		public class Open extends Capability {
			public Open(String target, Attribute... attributes) {
				super(TERM_open, target, attributes);
			}
		}

		/**
		 * An authorisation held by an ambient, permitting a given requester (or any
		 * requester for the wildcard) to perform the matching action upon it.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class CoCapability extends AbstractTerm {
			private final String authorisation;

			public CoCapability(int opcode, String authorisation, Attribute... attributes) {
				super(opcode, attributes);
				if (!WILDCARD.equals(authorisation)) {
					checkName(authorisation);
				}
				this.authorisation = authorisation;
			}

			/**
			 * Get the name of the ambient authorised by this co-capability, or
			 * {@link Syntax#WILDCARD}.
			 *
			 * @return
			 */
			public String authorisation() {
				return authorisation;
			}

			public boolean isWildcard() {
				return authorisation.equals(WILDCARD);
			}

			/**
			 * Check whether a requester with a given name is authorised. A
			 * <code>null</code> requester (i.e. one which is not enclosed by any
			 * ambient) is only admitted by the wildcard.
			 *
			 * @param requester
			 * @return
			 */
			public boolean admits(String requester) {
				return isWildcard() || authorisation.equals(requester);
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ authorisation.hashCode();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof CoCapability) {
					CoCapability c = (CoCapability) o;
					return c.getOpcode() == getOpcode() && c.authorisation.equals(authorisation);
				}
				return false;
			}
		}

		/**
		 * Represents an entry co-capability <code>in_ a</code>.
		 */
		public class CoIn extends CoCapability {
			public CoIn(String authorisation, Attribute... attributes) {
				super(TERM_coin, authorisation, attributes);
			}
		}

		/**
		 * Represents an exit co-capability <code>out_ a</code>.
		 */
		public class CoOut extends CoCapability {
			public CoOut(String authorisation, Attribute... attributes) {
				super(TERM_coout, authorisation, attributes);
			}
		}

		/**
		 * Represents a dissolution co-capability <code>open_ a</code>.
		 */
		public class CoOpen extends CoCapability {
			public CoOpen(String authorisation, Attribute... attributes) {
				super(TERM_coopen, authorisation, attributes);
			}
		}
	}
}
