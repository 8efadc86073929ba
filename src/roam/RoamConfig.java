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
package roam;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default settings for the reducer. Each is read once, when this class is
 * loaded, from a system property or (failing that) an environment variable.
 * Options given on the command line take precedence over these.
 *
 * @author David J. Pearce
 *
 */
public final class RoamConfig {
	private static final Logger LOGGER = LogManager.getLogger(RoamConfig.class);

	private RoamConfig() {
	}

	/**
	 * Default step budget for a single program, where zero means no limit.
	 * Property <code>roam.maxSteps</code>, environment variable
	 * <code>ROAM_MAX_STEPS</code>.
	 */
	public static final long MAX_STEPS = getLong("roam.maxSteps", "ROAM_MAX_STEPS", 0);

	/**
	 * Default redex choice strategy, one of <code>leftmost</code>,
	 * <code>rightmost</code> or <code>random</code>. Property
	 * <code>roam.strategy</code>, environment variable <code>ROAM_STRATEGY</code>.
	 */
	public static final String STRATEGY = get("roam.strategy", "ROAM_STRATEGY", "leftmost");

	/**
	 * Seed for the random strategy. Property <code>roam.seed</code>, environment
	 * variable <code>ROAM_SEED</code>.
	 */
	public static final long SEED = getLong("roam.seed", "ROAM_SEED", 0);

	/**
	 * Number of threads used when reducing several programs. Property
	 * <code>roam.threads</code>, environment variable <code>ROAM_THREADS</code>.
	 */
	public static final int THREADS = getInt("roam.threads", "ROAM_THREADS",
			Runtime.getRuntime().availableProcessors(), 1);

	/**
	 * Read a setting from a system property, falling back to an environment
	 * variable and then a default value.
	 */
	static String get(String property, String env, String defaultValue) {
		String value = System.getProperty(property);
		if (value == null) {
			value = System.getenv(env);
		}
		return value != null ? value : defaultValue;
	}

	static long getLong(String property, String env, long defaultValue) {
		String value = get(property, env, null);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			LOGGER.warn("ignoring invalid value for {}: {}", property, value);
			return defaultValue;
		}
	}

	/**
	 * Read an integer setting which must be at least a given minimum. A value
	 * outside that range is ignored in favour of the default.
	 */
	public static int getInt(String property, String env, int defaultValue, int min) {
		long value = getLong(property, env, defaultValue);
		if (value < min || value > Integer.MAX_VALUE) {
			LOGGER.warn("ignoring out of range value for {}: {}", property, value);
			return defaultValue;
		}
		return (int) value;
	}
}
