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
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import roam.RoamConfig;

public class ConfigTests {
	private static final String PROPERTY = "roam.testing.threads";
	private static final String ENV = "ROAM_TESTING_THREADS";

	@Test
	public void test_0x0001() {
		check(null, 7);
		check("4", 4);
		check(" 12 ", 12);
	}

	@Test
	public void test_0x0002() {
		// out of range values fall back to the default rather than wrapping
		check("4294967297", 7);
		check("2147483648", 7);
		check("0", 7);
		check("-3", 7);
		check("many", 7);
	}

	@Test
	public void test_0x0003() {
		assertTrue(RoamConfig.THREADS >= 1);
	}

	private static void check(String value, int expected) {
		if (value == null) {
			System.clearProperty(PROPERTY);
		} else {
			System.setProperty(PROPERTY, value);
		}
		try {
			assertEquals(expected, RoamConfig.getInt(PROPERTY, ENV, 7, 1));
		} finally {
			System.clearProperty(PROPERTY);
		}
	}
}
