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
package roam.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static roam.testing.ParserTests.amb;
import static roam.testing.ParserTests.bare;
import static roam.testing.ParserTests.par;
import static roam.testing.ParserTests.ser;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import roam.core.Congruence;
import roam.core.Syntax.Term;
import roam.io.Parser;
import roam.io.Printer;

public class CongruenceTests {

	@Test
	public void test_0x0001() {
		// parallel composition is commutative
		checkEquivalent("a[] | b[]", "b[] | a[]");
		checkEquivalent("a[in b] | b[in_ a] | c[]", "c[] | b[in_ a] | a[in b]");
	}

	@Test
	public void test_0x0002() {
		// parallel composition is associative
		checkEquivalent("(a[] | b[]) | c[]", "a[] | (b[] | c[])");
		checkEquivalent("x[(a[] | b[]) | c[]]", "x[c[] | b[] | a[]]");
	}

	@Test
	public void test_0x0003() {
		// groups are transparent
		checkEquivalent("(a[])", "a[]");
		checkEquivalent("x[(in y)]", "x[in y]");
		checkEquivalent("in a.(in b.in c)", "(in a.in b).in c");
	}

	@Test
	public void test_0x0004() {
		// empty ambients are bare
		checkEquivalent("a[()]", "a");
		checkEquivalent("a[] | ()", "a[]");
	}

	@Test
	public void test_0x0005() {
		checkNotEquivalent("a[] | a[]", "a[]");
		checkNotEquivalent("in a.in b", "in b.in a");
		checkNotEquivalent("a[b[]]", "b[a[]]");
		checkNotEquivalent("a[in_]", "a[in_ a]");
		checkNotEquivalent("open_.(a[] | b[])", "open_ | a[] | b[]");
	}

	@Test
	public void test_0x0006() {
		// nested bodies are compared up to congruence as well
		checkEquivalent("d[c[a[] | b[]]]", "d[c[b[] | a[]]]");
		checkEquivalent("d[c[in_ x.open x | b[] | a[]]]", "d[c[a[] | (in_ x.open x | b[])]]");
	}

	@Test
	public void test_0x0010() {
		List<Term> cs = Congruence.components(Parser.parse("a[] | (b[] | (in c)) | open d.open_"));
		assertEquals(Arrays.asList(bare("a"), bare("b"), new Term.In("c"),
				ser(new Term.Open("d"), new Term.CoOpen("*"))), cs);
	}

	@Test
	public void test_0x0011() {
		assertTrue(Congruence.components(Term.Parallel.EMPTY).isEmpty());
		assertTrue(Congruence.components(Parser.parse("(()) | ()")).isEmpty());
		assertTrue(Congruence.isEmpty(Parser.parse("(())")));
		assertFalse(Congruence.isEmpty(Parser.parse("a")));
	}

	@Test
	public void test_0x0012() {
		// sequences are flattened
		List<Term> cs = Congruence.components(Parser.parse("in a.(in b.(open c))"));
		assertEquals(1, cs.size());
		assertEquals(ser(new Term.In("a"), new Term.In("b"), new Term.Open("c")), cs.get(0));
		// singleton sequences are their element
		assertEquals(Arrays.asList(new Term.In("a")), Congruence.components(ser(new Term.In("a"))));
		// a multi-branch parallel within a sequence is kept as a group
		Term t = Parser.parse("open_.(a[] | b[])");
		assertEquals(Arrays.asList(t), Congruence.components(t));
	}

	@Test
	public void test_0x0020() {
		Term seq = Parser.parse("in_ a.open a.open_");
		assertEquals(new Term.CoIn("a"), Congruence.head(seq));
		Term rest = Congruence.consume(seq);
		assertEquals(ser(new Term.Open("a"), new Term.CoOpen("*")), rest);
		assertEquals(new Term.Open("a"), Congruence.head(rest));
		rest = Congruence.consume(rest);
		assertEquals(new Term.CoOpen("*"), rest);
		assertEquals(new Term.CoOpen("*"), Congruence.head(rest));
		assertNull(Congruence.consume(rest));
	}

	@Test
	public void test_0x0021() {
		// ambients and sequences headed by ambients cannot interact
		assertNull(Congruence.head(bare("a")));
		assertNull(Congruence.head(Parser.parse("a[in b]")));
		assertNull(Congruence.head(Parser.parse("a[].in b")));
		assertThrows(IllegalArgumentException.class, () -> Congruence.consume(bare("a")));
	}

	@Test
	public void test_0x0022() {
		// a consumed head exposes a parallel composition
		Term rest = Congruence.consume(Parser.parse("open_.(a[] | b[])"));
		assertEquals(Arrays.asList(bare("a"), bare("b")), Congruence.components(rest));
	}

	@Test
	public void test_0x0030() {
		Term a = bare("a");
		assertSame(Term.Parallel.EMPTY, Congruence.compose(Arrays.asList()));
		assertSame(Term.Parallel.EMPTY, Congruence.compose(Arrays.asList(null, null)));
		assertSame(a, Congruence.compose(Arrays.asList(null, a)));
		assertEquals(par(a, bare("b")), Congruence.compose(Arrays.asList(a, null, par(bare("b")))));
	}

	@Test
	public void test_0x0031() {
		assertEquals(bare("a"), Congruence.ambient("a", Term.Parallel.EMPTY));
		assertEquals(amb("a", bare("b")), Congruence.ambient("a", bare("b")));
	}

	@Test
	public void test_0x0040() {
		// canonical forms are independent of order and grouping
		Term c1 = Congruence.canonicalise(Parser.parse("z[in a | b[]] | (y[] | x[out_])"));
		Term c2 = Congruence.canonicalise(Parser.parse("x[out_] | y[] | z[b[] | in a]"));
		assertEquals(c1, c2);
		assertEquals(Printer.serialize(c1), Printer.serialize(c2));
	}

	public static void checkEquivalent(String lhs, String rhs) {
		Term l = Parser.parse(lhs);
		Term r = Parser.parse(rhs);
		assertTrue(Congruence.equivalent(l, r), lhs + " should be congruent to " + rhs);
		assertTrue(Congruence.equivalent(r, l), rhs + " should be congruent to " + lhs);
	}

	public static void checkNotEquivalent(String lhs, String rhs) {
		Term l = Parser.parse(lhs);
		Term r = Parser.parse(rhs);
		assertFalse(Congruence.equivalent(l, r), lhs + " should not be congruent to " + rhs);
	}
}
