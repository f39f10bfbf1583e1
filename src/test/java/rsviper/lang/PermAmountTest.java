// Copyright 2024 The Rust2Viper Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package rsviper.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class PermAmountTest {

	@Test
	public void amountsAreKeptInLowestTerms() {
		PermAmount p = PermAmount.of(2, 4);
		assertEquals(PermAmount.HALF, p);
		assertEquals(1, p.getNumerator());
		assertEquals(2, p.getDenominator());
		assertEquals(PermAmount.NONE, PermAmount.of(0, 7));
	}

	@Test
	public void halvesAddBackToWrite() {
		PermAmount h = PermAmount.WRITE.half();
		assertEquals("1/2", h.toString());
		assertEquals(PermAmount.WRITE, h.add(h));
		PermAmount q = h.half();
		assertEquals(PermAmount.of(3, 4), h.add(q));
		assertEquals(PermAmount.WRITE, h.add(q).add(q));
	}

	@Test
	public void subtractionMustNotGoNegative() {
		assertEquals(PermAmount.HALF, PermAmount.WRITE.subtract(PermAmount.HALF));
		assertEquals(PermAmount.NONE, PermAmount.HALF.subtract(PermAmount.HALF));
		assertThrows(IllegalArgumentException.class, () -> PermAmount.HALF.subtract(PermAmount.WRITE));
	}

	@Test
	public void invalidAmountsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> PermAmount.of(1, 0));
		assertThrows(IllegalArgumentException.class, () -> PermAmount.of(-1, 2));
	}

	@Test
	public void ordering() {
		assertTrue(PermAmount.NONE.compareTo(PermAmount.HALF) < 0);
		assertTrue(PermAmount.WRITE.compareTo(PermAmount.HALF) > 0);
		assertEquals(PermAmount.of(1, 3), PermAmount.min(PermAmount.of(1, 3), PermAmount.HALF));
		assertEquals("write", PermAmount.WRITE.toString());
		assertEquals("none", PermAmount.NONE.toString());
	}
}
