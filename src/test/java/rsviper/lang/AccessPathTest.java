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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class AccessPathTest {
	private static final AccessPath X = AccessPath.root("_1");
	private static final AccessPath X_REF = X.append("val_ref");
	private static final AccessPath X_REF_INT = X_REF.append("val_int");

	@Test
	public void rendering() {
		assertEquals("_1", X.toString());
		assertEquals("_1.val_ref.val_int", X_REF_INT.toString());
		assertEquals(2, X_REF_INT.size());
		assertEquals("val_int", X_REF_INT.getLastField());
		assertNull(X.getLastField());
	}

	@Test
	public void prefixes() {
		assertTrue(X_REF_INT.hasPrefix(X));
		assertTrue(X_REF_INT.hasPrefix(X_REF_INT));
		assertFalse(X.hasPrefix(X_REF));
		assertFalse(X_REF.hasPrefix(AccessPath.root("_2")));
		assertEquals(X_REF, X_REF_INT.getParent());
		assertNull(X.getParent());
		assertEquals(Arrays.asList("val_ref", "val_int"), X_REF_INT.suffixAfter(X));
	}

	@Test
	public void replacingPrefixMovesSubtree() {
		AccessPath y = AccessPath.root("_4");
		assertEquals("_4.val_int", X_REF_INT.replacePrefix(X_REF, y).toString());
		assertThrows(IllegalArgumentException.class, () -> X.replacePrefix(X_REF, y));
	}

	@Test
	public void parentsSortBeforeChildren() {
		assertTrue(X.compareTo(X_REF) < 0);
		assertTrue(X_REF.compareTo(X_REF_INT) < 0);
		assertTrue(X_REF_INT.compareTo(AccessPath.root("_2")) < 0);
	}
}
