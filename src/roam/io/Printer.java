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
package roam.io;

import roam.core.Syntax;
import roam.core.Syntax.Term;

/**
 * Responsible for turning a term back into ROAM source text. Two forms are
 * supported: the <i>display</i> form, which separates parallel branches with
 * spaces for readability (e.g. <code>a[in b] | b[in_ a]</code>), and the
 * <i>serialised</i> form which contains no optional whitespace at all (e.g.
 * <code>a[in b]|b[in_ a]</code>). Both are deterministic for a given term and
 * both can be read back by the {@link Parser}.
 *
 * @author David J. Pearce
 *
 */
public class Printer {
	private static final Printer DISPLAY = new Printer(" | ");
	private static final Printer COMPACT = new Printer("|");

	/**
	 * Separator used between parallel branches
	 */
	private final String bar;

	private Printer(String bar) {
		this.bar = bar;
	}

	/**
	 * Render a term in human-readable form matching the surface grammar.
	 *
	 * @param term
	 * @return
	 */
	public static String toDisplay(Term term) {
		return DISPLAY.print(term);
	}

	/**
	 * Render a term in its compact canonical textual form. The same concrete term
	 * always produces the same text, though congruent terms with different shapes
	 * need not.
	 *
	 * @param term
	 * @return
	 */
	public static String serialize(Term term) {
		return COMPACT.print(term);
	}

	public String print(Term term) {
		StringBuilder out = new StringBuilder();
		print(term, true, out);
		return out.toString();
	}

	/**
	 * Print a given term into a buffer.
	 *
	 * @param term
	 * @param outermost
	 *            Indicates whether the term is a complete process (e.g. an
	 *            ambient body) rather than part of a composition.
	 * @param out
	 */
	private void print(Term term, boolean outermost, StringBuilder out) {
		switch (term.getOpcode()) {
		case Syntax.TERM_bare: {
			Term.Bare b = (Term.Bare) term;
			out.append(b.name()).append("[]");
			break;
		}
		case Syntax.TERM_ambient: {
			Term.Ambient a = (Term.Ambient) term;
			out.append(a.name()).append('[');
			print(a.body(), true, out);
			out.append(']');
			break;
		}
		case Syntax.TERM_parallel: {
			Term.Parallel p = (Term.Parallel) term;
			if (p.isEmpty() && !outermost) {
				out.append("()");
			}
			for (int i = 0; i != p.size(); ++i) {
				if (i != 0) {
					out.append(bar);
				}
				print(p.get(i), false, out);
			}
			break;
		}
		case Syntax.TERM_serial: {
			Term.Serial s = (Term.Serial) term;
			if (s.size() == 0 && !outermost) {
				out.append("()");
			}
			for (int i = 0; i != s.size(); ++i) {
				if (i != 0) {
					out.append('.');
				}
				Term e = s.get(i);
				// Compositions nested within a sequence must retain their brackets
				if (e instanceof Term.Composition) {
					out.append('(');
					print(e, true, out);
					out.append(')');
				} else {
					print(e, false, out);
				}
			}
			break;
		}
		case Syntax.TERM_group: {
			Term.Group g = (Term.Group) term;
			out.append('(');
			print(g.operand(), true, out);
			out.append(')');
			break;
		}
		case Syntax.TERM_in:
			out.append("in ").append(((Term.Capability) term).target());
			break;
		case Syntax.TERM_out:
			out.append("out ").append(((Term.Capability) term).target());
			break;
		case Syntax.TERM_open:
			out.append("open ").append(((Term.Capability) term).target());
			break;
		case Syntax.TERM_coin:
			printCoCapability("in_", (Term.CoCapability) term, out);
			break;
		case Syntax.TERM_coout:
			printCoCapability("out_", (Term.CoCapability) term, out);
			break;
		case Syntax.TERM_coopen:
			printCoCapability("open_", (Term.CoCapability) term, out);
			break;
		default:
			throw new IllegalArgumentException("invalid term encountered: " + term.getClass().getName());
		}
	}

	private static void printCoCapability(String keyword, Term.CoCapability c, StringBuilder out) {
		out.append(keyword);
		// The wildcard is written as the bare keyword
		if (!c.isWildcard()) {
			out.append(' ').append(c.authorisation());
		}
	}
}
