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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import org.junit.jupiter.api.Test;

import roam.core.Syntax;
import roam.core.Syntax.Term;
import roam.io.Parser;
import roam.util.ParseError;
import roam.util.SyntacticElement.Attribute;

/**
 * Test cases for parsing ROAM programs, including the programs used to encode
 * functions, arguments, calls and returns.
 *
 * @author David J. Pearce
 *
 */
public class ParserTests {
	private static final String W = Syntax.WILDCARD;

	// ==============================================================
	// Ambients
	// ==============================================================

	@Test
	public void test_0x0001() {
		check("a[]", bare("a"));
		check("hello[]", bare("hello"));
		check("a", bare("a"));
	}

	@Test
	public void test_0x0002() {
		check("a[] | b[]", par(bare("a"), bare("b")));
	}

	@Test
	public void test_0x0003() {
		check("a[ b[] ] | c[]", par(amb("a", bare("b")), bare("c")));
	}

	@Test
	public void test_0x0004() {
		check("a[b[c[d[]]]]", amb("a", amb("b", amb("c", bare("d")))));
	}

	@Test
	public void test_0x0005() {
		// duplicate names are permitted
		check("a[] | a[] | a[]", par(bare("a"), bare("a"), bare("a")));
	}

	@Test
	public void test_0x0006() {
		check("", Term.Parallel.EMPTY);
		check("  // nothing here", Term.Parallel.EMPTY);
	}

	// ==============================================================
	// Capabilities
	// ==============================================================

	@Test
	public void test_0x0010() {
		check("a[b[open_|c[]]|open b]", amb("a", par(amb("b", par(new Term.CoOpen(W), bare("c"))), new Term.Open("b"))));
	}

	@Test
	public void test_0x0011() {
		check("a[in b] | b[in_ a]", par(amb("a", new Term.In("b")), amb("b", new Term.CoIn("a"))));
	}

	@Test
	public void test_0x0012() {
		check("b[a[out b]|out_ a]", amb("b", par(amb("a", new Term.Out("b")), new Term.CoOut("a"))));
	}

	@Test
	public void test_0x0013() {
		check("a[in c] | b[in c] | c[in_ a.in_ b.in d] | d[in_ c]",
				par(amb("a", new Term.In("c")), amb("b", new Term.In("c")),
						amb("c", ser(new Term.CoIn("a"), new Term.CoIn("b"), new Term.In("d"))),
						amb("d", new Term.CoIn("c"))));
	}

	@Test
	public void test_0x0014() {
		check("a[in b.in_ |b[]]", amb("a", par(ser(new Term.In("b"), new Term.CoIn(W)), bare("b"))));
	}

	@Test
	public void test_0x0015() {
		// explicit and implicit wildcards are the same
		Term t1 = Parser.parse("a[in_ * | out_ * | open_ *]");
		Term t2 = Parser.parse("a[in_ | out_ | open_]");
		assertEquals(t1, t2);
		assertTrue(((Term.CoCapability) ((Term.Parallel) ((Term.Ambient) t1).body()).get(0)).isWildcard());
	}

	@Test
	public void test_0x0016() {
		// a co-capability keyword followed by a name always takes it
		check("in_ a.open_ b", ser(new Term.CoIn("a"), new Term.CoOpen("b")));
		check("in_.open_", ser(new Term.CoIn(W), new Term.CoOpen(W)));
	}

	// ==============================================================
	// Functions, arguments, calls and returns
	// ==============================================================

	@Test
	public void test_0x0020() {
		check("func[in_ x.open x.open_]", amb("func", ser(new Term.CoIn("x"), new Term.Open("x"), new Term.CoOpen(W))));
	}

	@Test
	public void test_0x0021() {
		check("func[in_ x.open x.open_] | x[in func.open_|result[]] |open func",
				par(amb("func", ser(new Term.CoIn("x"), new Term.Open("x"), new Term.CoOpen(W))),
						amb("x", par(ser(new Term.In("func"), new Term.CoOpen(W)), bare("result"))),
						new Term.Open("func")));
	}

	@Test
	public void test_0x0022() {
		check("arg[in_ x.open x.in y.open_] | y[in_ arg.open arg.in func.open_]",
				par(amb("arg", ser(new Term.CoIn("x"), new Term.Open("x"), new Term.In("y"), new Term.CoOpen(W))),
						amb("y", ser(new Term.CoIn("arg"), new Term.Open("arg"), new Term.In("func"),
								new Term.CoOpen(W)))));
	}

	@Test
	public void test_0x0023() {
		String input = "arg[in_ x.open x.in y.open_] | x[in arg.open_|input[]] |\n"
				+ "y[in_ arg.open arg.in func.open_] |\n" + "func[in_ y.open y.open_]\n";
		check(input,
				par(amb("arg", ser(new Term.CoIn("x"), new Term.Open("x"), new Term.In("y"), new Term.CoOpen(W))),
						amb("x", par(ser(new Term.In("arg"), new Term.CoOpen(W)), bare("input"))),
						amb("y", ser(new Term.CoIn("arg"), new Term.Open("arg"), new Term.In("func"),
								new Term.CoOpen(W))),
						amb("func", ser(new Term.CoIn("y"), new Term.Open("y"), new Term.CoOpen(W)))));
	}

	@Test
	public void test_0x0024() {
		String input = "message[\n" + "  in func.open_|\n" + "  func[\n" + "    x[in_ arg.open arg.in message.open_]|\n"
				+ "    message[in_ x.open x]|\n" + "    in_ arg.open_\n" + "  ]\n" + "] |\n" + "func[\n"
				+ "  in_ message.open message.open func.open_|\n" + "  arg[\n" + "    in func.in x.open_|\n"
				+ "    string[hello[]]\n" + "  ]\n" + "]|\n" + "open func\n";
		check(input, par(
				amb("message", par(ser(new Term.In("func"), new Term.CoOpen(W)),
						amb("func", par(
								amb("x", ser(new Term.CoIn("arg"), new Term.Open("arg"), new Term.In("message"),
										new Term.CoOpen(W))),
								amb("message", ser(new Term.CoIn("x"), new Term.Open("x"))),
								ser(new Term.CoIn("arg"), new Term.CoOpen(W)))))),
				amb("func", par(
						ser(new Term.CoIn("message"), new Term.Open("message"), new Term.Open("func"),
								new Term.CoOpen(W)),
						amb("arg", par(ser(new Term.In("func"), new Term.In("x"), new Term.CoOpen(W)),
								amb("string", bare("hello")))))),
				new Term.Open("func")));
	}

	@Test
	public void test_0x0025() {
		check("call[out x.in y.open_]", amb("call", ser(new Term.Out("x"), new Term.In("y"), new Term.CoOpen(W))));
		check("x[call[out x.in y.open_|payload[]] | out_ call] |\ny[in_ call.open call]",
				par(amb("x", par(amb("call", par(ser(new Term.Out("x"), new Term.In("y"), new Term.CoOpen(W)),
						bare("payload"))), new Term.CoOut("call"))),
						amb("y", ser(new Term.CoIn("call"), new Term.Open("call")))));
	}

	@Test
	public void test_0x0026() {
		check("return[open_.in x]", amb("return", ser(new Term.CoOpen(W), new Term.In("x"))));
		String input = "x[\n" + "    call[out x.in y.open_|return[open_.in x]]|\n" + "    out_ call.in_ y\n" + "] |\n"
				+ "y[in_ call.open call.open return]\n";
		check(input, par(
				amb("x", par(
						amb("call", par(ser(new Term.Out("x"), new Term.In("y"), new Term.CoOpen(W)),
								amb("return", ser(new Term.CoOpen(W), new Term.In("x"))))),
						ser(new Term.CoOut("call"), new Term.CoIn("y")))),
				amb("y", ser(new Term.CoIn("call"), new Term.Open("call"), new Term.Open("return")))));
	}

	@Test
	public void test_0x0027() {
		String input = "string_concat[\n" + "  in_ call.open call.(\n" + "    func[\n" + "      left[\n"
				+ "        in_ arg.open arg.in string.in concat\n" + "      ]|\n" + "      right[\n"
				+ "        in_ arg.open arg.in string.in concat\n" + "      ]|\n" + "      string[\n"
				+ "        concat[in_ left|in_ right]|\n" + "        in_ left|in_ right\n" + "      ]|\n"
				+ "      open_\n" + "    ]|\n" + "    open return.open_\n" + "  )\n" + "]";
		Term side = ser(new Term.CoIn("arg"), new Term.Open("arg"), new Term.In("string"), new Term.In("concat"));
		check(input, amb("string_concat", ser(new Term.CoIn("call"), new Term.Open("call"), new Term.Group(par(
				amb("func", par(amb("left", side), amb("right", side),
						amb("string", par(amb("concat", par(new Term.CoIn("left"), new Term.CoIn("right"))),
								new Term.CoIn("left"), new Term.CoIn("right"))),
						new Term.CoOpen(W))),
				ser(new Term.Open("return"), new Term.CoOpen(W)))))));
	}

	@Test
	public void test_0x0028() {
		Term monad = amb("string",
				amb("concat", par(amb("left", amb("string", bare("a"))), amb("right", amb("string", bare("b"))))));
		check("string[\n  concat[\n    left[string[a[]]]|\n    right[string[b[]]]\n  ]\n]\n", monad);
		String input = "string[\n" + "  concat[\n" + "    left[\n" + "      string[\n" + "        concat[\n"
				+ "          left[string[a[]]]|\n" + "          right[string[b[]]]\n" + "        ]\n" + "      ]\n"
				+ "    ]|\n" + "    right[string[c[]]]\n" + "  ]\n" + "]\n";
		check(input, amb("string", amb("concat", par(amb("left", monad), amb("right", amb("string", bare("c")))))));
	}

	@Test
	public void test_0x0029() {
		check("identity[\n  int[\n    length[string[hello[]]]\n  ]\n]\n",
				amb("identity", amb("int", amb("length", amb("string", bare("hello"))))));
	}

	// ==============================================================
	// Source attributes
	// ==============================================================

	@Test
	public void test_0x0030() {
		Term t = Parser.parse("a[in b] | c");
		Attribute.Source outer = t.attribute(Attribute.Source.class);
		assertNotNull(outer);
		assertEquals(0, outer.start);
		assertEquals(10, outer.end);
		Term.Ambient a = (Term.Ambient) ((Term.Parallel) t).get(0);
		assertEquals(0, a.attribute(Attribute.Source.class).start);
		assertEquals(6, a.attribute(Attribute.Source.class).end);
		Term in = a.body();
		assertEquals(2, in.attribute(Attribute.Source.class).start);
		assertEquals(5, in.attribute(Attribute.Source.class).end);
	}

	@Test
	public void test_0x0031() {
		// attributes are ignored by equality
		Term t = Parser.parse("a[in b]");
		assertEquals(amb("a", new Term.In("b")), t);
		assertEquals(0, new Term.In("b").attributes().length);
		assertFalse(t.attributes().length == 0);
	}

	// ==============================================================
	// Errors
	// ==============================================================

	@Test
	public void test_0x0040() {
		// unmatched '['
		checkInvalid("a[b[]", 5, true);
	}

	@Test
	public void test_0x0041() {
		// unmatched ']'
		checkInvalid("a[]]", 3, false);
		checkInvalid("a[] | b[]] | c[]", 9, false);
	}

	@Test
	public void test_0x0042() {
		// unmatched '(' and ')'
		checkInvalid("(a[] | b[]", 10, true);
		checkInvalid("a[]) | b[]", 3, false);
	}

	@Test
	public void test_0x0043() {
		// missing target
		checkInvalid("in", 2, true);
		checkInvalid("a[in]", 4, false);
		checkInvalid("a[open | b[]]", 7, false);
		checkInvalid("out *", 4, false);
	}

	@Test
	public void test_0x0044() {
		// unrecognised characters
		checkInvalid("a[in b] & b[]", 8, false);
		checkInvalid("a[in b2]", 6, false);
	}

	@Test
	public void test_0x0045() {
		// missing operands
		checkInvalid("a[] |", 5, true);
		checkInvalid("a[] | | b[]", 6, false);
		checkInvalid("in_ a.", 6, true);
		checkInvalid("a[] b[]", 4, false);
		checkInvalid("*", 0, false);
	}

	@Test
	public void test_0x0046() {
		ParseError e = checkInvalid("a[\n  b[in]\n]", 9, false);
		assertEquals("line 2: " + e.getMessage() + "\n  b[in]\n      ^\n", e.toSourceError());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	public static void check(String input, Term expected) {
		try {
			Term actual = Parser.parse(input);
			if (!expected.equals(actual)) {
				fail("expected: " + expected + ", got: " + actual);
			}
			if (expected == Term.Parallel.EMPTY) {
				assertSame(Term.Parallel.EMPTY, actual);
			}
		} catch (ParseError e) {
			e.outputSourceError(System.err);
			fail(e);
		}
	}

	public static ParseError checkInvalid(String input, int position, boolean endOfInput) {
		try {
			Parser.parse(input);
			fail("test shouldn't have parsed");
			return null;
		} catch (ParseError e) {
			assertEquals(position, e.position(), "incorrect error position: " + e.getMessage());
			assertEquals(endOfInput, e.atEndOfInput());
			assertNotNull(e.expected());
			return e;
		}
	}

	public static Term bare(String name) {
		return new Term.Bare(name);
	}

	public static Term amb(String name, Term body) {
		return new Term.Ambient(name, body);
	}

	public static Term par(Term... terms) {
		return new Term.Parallel(terms);
	}

	public static Term ser(Term... terms) {
		return new Term.Serial(terms);
	}
}
