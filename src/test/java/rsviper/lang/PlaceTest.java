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
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class PlaceTest {

	@Test
	public void projectionsRenderInOrder() {
		Place p = Place.local(1).deref().field("x").index(3);
		assertEquals("(*_1).x[_3]", p.toString());
		assertEquals(1, p.getLocal());
		assertEquals(3, p.getProjections().size());
		assertTrue(p.isIndexed());
		assertFalse(p.isLocal());
	}

	@Test
	public void parentDropsLastProjection() {
		Place p = Place.local(2).field("f").deref();
		assertEquals(Place.local(2).field("f"), p.getParent());
		assertEquals(Place.Projection.Kind.DEREF, p.getLast().getKind());
		assertTrue(Place.local(2).isLocal());
	}
}
