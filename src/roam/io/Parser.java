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

import java.util.ArrayList;
import java.util.List;

import roam.core.Syntax;
import roam.core.Syntax.Term;
import roam.io.Lexer.Bar;
import roam.io.Lexer.Dot;
import roam.io.Lexer.Identifier;
import roam.io.Lexer.Keyword;
import roam.io.Lexer.LeftBrace;
import roam.io.Lexer.LeftSquare;
import roam.io.Lexer.RightBrace;
import roam.io.Lexer.RightSquare;
import roam.io.Lexer.Star;
import roam.io.Lexer.Token;
import roam.util.ParseError;
import roam.util.SyntacticElement.Attribute;

/**
 * Responsible for turning a sequence of tokens into a term. Parallel
 * composition binds loosest, then sequencing, with bracketed ambients and
 * parenthesised groups binding tightest. Compositions with a single element
 * are collapsed to that element.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private static final String ATOM = "an ambient, capability or '('";

	private final String source;
	private final ArrayList<Token> tokens;
	private int index;

	public Parser(String source, List<Token> tokens) {
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Lex and parse a complete program from a given source string.
	 *
	 * @param source
	 * @return
	 * @throws ParseError
	 *             if the source is malformed.
	 */
	public static Term parse(String source) {
		List<Token> tokens = Lexer.of(source).scan();
		return new Parser(source, tokens).parseProgram();
	}

	/**
	 * Parse a complete program, of the form:
	 *
	 * <pre>
	 * Program ::= Parallel
	 * </pre>
	 *
	 * All tokens must be consumed.
	 *
	 * @return
	 */
	public Term parseProgram() {
		Term t = parseParallel();
		if (index < tokens.size()) {
			Token lookahead = tokens.get(index);
			syntaxError("unmatched '" + lookahead.text + "'", "'|' or end-of-input", lookahead);
		}
		return t;
	}

	/**
	 * Parse a parallel composition of zero or more branches, of the form:
	 *
	 * <pre>
	 * Parallel ::= [ Serial ( '|' Serial )* ]
	 * </pre>
	 *
	 * @return
	 */
	public Term parseParallel() {
		int start = index;
		ArrayList<Term> terms = new ArrayList<>();
		if (!atProcessEnd()) {
			terms.add(parseSerial());
			while (index < tokens.size() && tokens.get(index) instanceof Bar) {
				match("|");
				terms.add(parseSerial());
			}
		}
		switch (terms.size()) {
		case 0:
			return Term.Parallel.EMPTY;
		case 1:
			return terms.get(0);
		default:
			return new Term.Parallel(terms.toArray(new Term[terms.size()]), sourceAttr(start, index - 1));
		}
	}

	/**
	 * Parse a sequential composition of one or more atoms, of the form:
	 *
	 * <pre>
	 * Serial ::= Atom ( '.' Atom )*
	 * </pre>
	 *
	 * @return
	 */
	public Term parseSerial() {
		int start = index;
		ArrayList<Term> terms = new ArrayList<>();
		terms.add(parseAtom());
		while (index < tokens.size() && tokens.get(index) instanceof Dot) {
			match(".");
			terms.add(parseAtom());
		}
		if (terms.size() == 1) {
			return terms.get(0);
		} else {
			return new Term.Serial(terms.toArray(new Term[terms.size()]), sourceAttr(start, index - 1));
		}
	}

	/**
	 * Parse an atom, which is either an ambient, a capability, a co-capability or
	 * a parenthesised group.
	 *
	 * @return
	 */
	public Term parseAtom() {
		checkNotEof(ATOM);
		Token lookahead = tokens.get(index);
		//
		if (lookahead instanceof Identifier) {
			return parseAmbient();
		} else if (lookahead instanceof Keyword) {
			return parseCapability();
		} else if (lookahead instanceof LeftBrace) {
			return parseGroup();
		} else {
			syntaxError("expecting " + ATOM + ", found '" + lookahead.text + "'", ATOM, lookahead);
			return null; // unreachable
		}
	}

	/**
	 * Parse an ambient, of the form:
	 *
	 * <pre>
	 * Ambient ::= Ident [ '[' Parallel ']' ]
	 * </pre>
	 *
	 * An ambient without brackets, or with an empty body, is bare.
	 *
	 * @return
	 */
	public Term parseAmbient() {
		int start = index;
		Identifier name = matchIdentifier();
		if (index < tokens.size() && tokens.get(index) instanceof LeftSquare) {
			match("[");
			Term body = parseParallel();
			match("]");
			if (isEmpty(body)) {
				return new Term.Bare(name.text, sourceAttr(start, index - 1));
			} else {
				return new Term.Ambient(name.text, body, sourceAttr(start, index - 1));
			}
		} else {
			return new Term.Bare(name.text, sourceAttr(start, index - 1));
		}
	}

	/**
	 * Parse a capability or co-capability, of the form:
	 *
	 * <pre>
	 * Capability ::= ( 'in' | 'out' | 'open' ) Ident
	 *              | ( 'in_' | 'out_' | 'open_' ) [ Ident | '*' ]
	 * </pre>
	 *
	 * A co-capability without an authorisation admits any requester.
	 *
	 * @return
	 */
	public Term parseCapability() {
		int start = index;
		Keyword keyword = (Keyword) tokens.get(index++);
		Attribute.Source attr;
		if (keyword.isCoCapability()) {
			String authorisation = Syntax.WILDCARD;
			if (index < tokens.size() && tokens.get(index) instanceof Identifier) {
				authorisation = tokens.get(index++).text;
			} else if (index < tokens.size() && tokens.get(index) instanceof Star) {
				index++;
			}
			attr = sourceAttr(start, index - 1);
			switch (keyword.text) {
			case "in_":
				return new Term.CoIn(authorisation, attr);
			case "out_":
				return new Term.CoOut(authorisation, attr);
			default:
				return new Term.CoOpen(authorisation, attr);
			}
		} else {
			String expected = "an ambient name after '" + keyword.text + "'";
			checkNotEof(expected);
			Token t = tokens.get(index);
			if (!(t instanceof Identifier)) {
				syntaxError("missing target for '" + keyword.text + "', found '" + t.text + "'", expected, t);
			}
			index = index + 1;
			attr = sourceAttr(start, index - 1);
			switch (keyword.text) {
			case "in":
				return new Term.In(t.text, attr);
			case "out":
				return new Term.Out(t.text, attr);
			default:
				return new Term.Open(t.text, attr);
			}
		}
	}

	/**
	 * Parse a parenthesised group, of the form:
	 *
	 * <pre>
	 * Group ::= '(' Parallel ')'
	 * </pre>
	 *
	 * @return
	 */
	public Term.Group parseGroup() {
		int start = index;
		match("(");
		Term operand = parseParallel();
		match(")");
		return new Term.Group(operand, sourceAttr(start, index - 1));
	}

	/**
	 * Check whether the next token ends the current process (i.e. we have reached
	 * a closing bracket or the end of input).
	 *
	 * @return
	 */
	private boolean atProcessEnd() {
		if (index >= tokens.size()) {
			return true;
		}
		Token t = tokens.get(index);
		return t instanceof RightSquare || t instanceof RightBrace;
	}

	private static boolean isEmpty(Term t) {
		return t instanceof Term.Parallel && ((Term.Parallel) t).isEmpty();
	}

	private void checkNotEof(String expected) {
		if (index >= tokens.size()) {
			int end = source.length();
			throw new ParseError("unexpected end-of-input, expecting " + expected, expected, source, end, end);
		}
		return;
	}

	private Token match(String op) {
		checkNotEof("'" + op + "'");
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", "'" + op + "'", t);
		}
		index = index + 1;
		return t;
	}

	private Identifier matchIdentifier() {
		checkNotEof("an ambient name");
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("ambient name expected", "an ambient name", t);
		return null; // unreachable.
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, String expected, Token t) {
		throw new ParseError(msg, expected, source, t.start, t.end());
	}
}
