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
package roam.util;

import java.io.PrintStream;

/**
 * This exception is thrown when the lexer or parser encounters malformed ROAM
 * source text. It identifies the character offset at which the problem was
 * detected together with a description of what was expected there. When input
 * runs out prematurely (e.g. an unmatched <code>[</code>) the position is the
 * length of the source, i.e. end-of-input.
 *
 * @author David Pearce
 */
public class ParseError extends RuntimeException {

	private final String msg;
	private final String expected;
	private final String src;
	private final int start;
	private final int end;

	/**
	 * Identify a parse error at a particular point in the source.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param expected
	 *            Description of what was expected at this point.
	 * @param src
	 *            The program source this error is referring to.
	 * @param start
	 *            Offset of the first character of the offending location.
	 * @param end
	 *            Offset of the last character of the offending location.
	 */
	public ParseError(String msg, String expected, String src, int start, int end) {
		this.msg = msg;
		this.expected = expected;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		if (msg != null) {
			return msg;
		} else {
			return "";
		}
	}

	/**
	 * Description of what the parser expected to find.
	 *
	 * @return
	 */
	public String expected() {
		return expected;
	}

	/**
	 * Get offset of first character of offending location. This is the
	 * <i>position</i> of the error.
	 *
	 * @return
	 */
	public int position() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Determine whether this error was raised because the input ended
	 * prematurely.
	 *
	 * @return
	 */
	public boolean atEndOfInput() {
		return src != null && start >= src.length();
	}

	/**
	 * Output the parse error to a given output stream, highlighting the
	 * offending part of the source line.
	 */
	public void outputSourceError(PrintStream output) {
		output.print(toSourceError());
	}

	/**
	 * Construct a report of this error, consisting of the line number and message
	 * followed by the offending source line, with the offending part underlined.
	 *
	 * @return
	 */
	public String toSourceError() {
		StringBuilder output = new StringBuilder();
		if (src == null) {
			output.append("parse error: ").append(getMessage()).append('\n');
			return output.toString();
		}
		int line = 0;
		int lineStart = 0;
		int lineEnd = 0;

		while (lineEnd < src.length() && lineEnd <= start) {
			lineStart = lineEnd;
			lineEnd = parseLine(src, lineEnd);
			line = line + 1;
		}
		line = Math.max(line, 1);
		lineEnd = Math.min(lineEnd, src.length());

		output.append("line ").append(line).append(": ").append(getMessage()).append('\n');
		for (int i = lineStart; i < lineEnd; ++i) {
			output.append(src.charAt(i));
		}
		// the last line of the source may have no trailing new-line
		if (output.charAt(output.length() - 1) != '\n') {
			output.append('\n');
		}
		for (int i = lineStart; i < start && i < src.length(); ++i) {
			if (src.charAt(i) == '\t') {
				output.append('\t');
			} else {
				output.append(' ');
			}
		}
		for (int i = start; i <= Math.max(start, end); ++i) {
			output.append('^');
		}
		output.append('\n');
		return output.toString();
	}

	private static int parseLine(String text, int index) {
		while (index < text.length() && text.charAt(index) != '\n') {
			index++;
		}
		return index + 1;
	}

	public static final long serialVersionUID = 1l;
}
