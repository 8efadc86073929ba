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

/**
 * A Syntactic Element represents any part of a ROAM program which may carry
 * additional information beyond its shape. At present this is only the span
 * of source text a term was parsed from, which the parser attaches so that
 * tools can point back into the original program. Terms constructed by the
 * reduction engine carry no attributes.
 *
 * @author David Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type, or <code>null</code> if
	 * there is none.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	public class Impl implements SyntacticElement {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes == null || attributes.length == 0 ? NONE : attributes.clone();
		}

		@Override
		public Attribute[] attributes() {
			return attributes.clone();
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 *
	 * @author djp
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the (inclusive) range of character offsets within the source
		 * text that a syntactic element was parsed from.
		 */
		public static class Source implements Attribute {

			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}
