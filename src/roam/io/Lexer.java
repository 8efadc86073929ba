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

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import roam.core.Syntax;
import roam.util.ParseError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 * Ambient names are sequences drawn from <code>[a-zA-Z_-]</code>; the six
 * capability keywords are recognised amongst them. The protocol primitives
 * (<code>func</code>, <code>call</code>, <code>arg</code> and
 * <code>return</code>) have no special lexical status.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {

	private final StringBuilder input;
	private int pos;

	public Lexer(String filename) throws IOException {
		this(new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8));
	}

	public Lexer(InputStream instream) throws IOException {
		this(new InputStreamReader(instream, StandardCharsets.UTF_8));
	}

	public Lexer(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		int n;
		while ((n = in.read(buffer)) != -1) {
			text.append(buffer, 0, n);
		}
		input = text;
	}

	/**
	 * Construct a lexer directly from a source string.
	 *
	 * @param source
	 * @return
	 */
	public static Lexer of(String source) {
		try {
			return new Lexer(new StringReader(source));
		} catch (IOException e) {
			// reading from a string cannot fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Get the complete text read by this lexer. Token positions are offsets into
	 * this text.
	 *
	 * @return
	 */
	public String text() {
		return input.toString();
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '/' && (pos + 1) < input.length() && input.charAt(pos + 1) == '/') {
				scanLineComment();
			} else if (c == '/' && (pos + 1) < input.length() && input.charAt(pos + 1) == '*') {
				scanBlockComment();
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (Syntax.isNameChar(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("unrecognised character '" + c + "'");
			}
		}

		return tokens;
	}

	static final char[] opStarts = { '[', ']', '(', ')', '|', '.', '*' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	public Token scanOperator() {
		char c = input.charAt(pos);

		if (c == '[') {
			return new LeftSquare(pos++);
		} else if (c == ']') {
			return new RightSquare(pos++);
		} else if (c == '(') {
			return new LeftBrace(pos++);
		} else if (c == ')') {
			return new RightBrace(pos++);
		} else if (c == '|') {
			return new Bar(pos++);
		} else if (c == '.') {
			return new Dot(pos++);
		} else if (c == '*') {
			return new Star(pos++);
		}

		syntaxError("unknown operator encountered: " + c);
		return null;
	}

	public static final String[] keywords = { "in", "in_", "out", "out_", "open", "open_" };

	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && Syntax.isNameChar(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	public void scanBlockComment() {
		pos += 2;
		while ((pos + 1) < input.length() && (input.charAt(pos) != '*' || input.charAt(pos + 1) != '/')) {
			pos++;
		}
		if ((pos + 1) >= input.length()) {
			throw new ParseError("unterminated block comment", "'*/'", input.toString(), input.length(),
					input.length());
		}
		pos += 2;
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a parse error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new ParseError(msg, "an ambient name, capability or one of '[', ']', '(', ')', '|', '.'",
				input.toString(), pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Represents an ambient name. That is, a sequence of one or more letters,
	 * underscores or hyphens which is not a keyword.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents one of the capability or co-capability keywords.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}

		/**
		 * Check whether this keyword introduces a co-capability (and hence has an
		 * optional authorisation).
		 *
		 * @return
		 */
		public boolean isCoCapability() {
			return text.endsWith("_");
		}
	}

	public static class LeftSquare extends Token {
		public LeftSquare(int pos) {
			super("[", pos);
		}
	}

	public static class RightSquare extends Token {
		public RightSquare(int pos) {
			super("]", pos);
		}
	}

	public static class LeftBrace extends Token {

		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {

		public RightBrace(int pos) {
			super(")", pos);
		}
	}

	public static class Bar extends Token {
		public Bar(int pos) {
			super("|", pos);
		}
	}

	public static class Dot extends Token {
		public Dot(int pos) {
			super(".", pos);
		}
	}

	public static class Star extends Token {
		public Star(int pos) {
			super("*", pos);
		}
	}
}
