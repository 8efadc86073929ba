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

import java.util.List;
import java.util.Locale;
import java.util.Random;

import roam.core.Matcher.Redex;

/**
 * Determines which of several enabled redexes is reduced next. Redexes are
 * always presented in traversal order, so the leftmost redex is the first one.
 *
 * @author David J. Pearce
 *
 */
public interface Strategy {

	/**
	 * Select one redex from a non-empty list of candidates.
	 *
	 * @param redexes
	 * @return
	 */
	public Redex select(List<Redex> redexes);

	/**
	 * Always choose the first redex encountered.
	 */
	public static final Strategy LEFTMOST = new Strategy() {
		@Override
		public Redex select(List<Redex> redexes) {
			return redexes.get(0);
		}

		@Override
		public String toString() {
			return "leftmost";
		}
	};

	/**
	 * Always choose the last redex encountered.
	 */
	public static final Strategy RIGHTMOST = new Strategy() {
		@Override
		public Redex select(List<Redex> redexes) {
			return redexes.get(redexes.size() - 1);
		}

		@Override
		public String toString() {
			return "rightmost";
		}
	};

	/**
	 * Choose uniformly at random, using a generator seeded so that runs are
	 * reproducible. The returned strategy is stateful and should not be shared
	 * between threads.
	 *
	 * @param seed
	 * @return
	 */
	public static Strategy random(long seed) {
		final Random random = new Random(seed);
		return new Strategy() {
			@Override
			public Redex select(List<Redex> redexes) {
				return redexes.get(random.nextInt(redexes.size()));
			}

			@Override
			public String toString() {
				return "random(" + seed + ")";
			}
		};
	}

	/**
	 * Look up a strategy by name, which is one of <code>leftmost</code>,
	 * <code>rightmost</code> or <code>random</code> (case insensitive).
	 *
	 * @param name
	 * @param seed
	 *            Seed used by the random strategy.
	 * @return
	 */
	public static Strategy of(String name, long seed) {
		switch (name.toLowerCase(Locale.ROOT)) {
		case "leftmost":
			return LEFTMOST;
		case "rightmost":
			return RIGHTMOST;
		case "random":
			return random(seed);
		default:
			throw new IllegalArgumentException("unknown strategy: " + name);
		}
	}
}
