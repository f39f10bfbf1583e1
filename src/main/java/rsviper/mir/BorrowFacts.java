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
package rsviper.mir;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * The region-end facts computed by the host's borrow checker. A borrow listed
 * at a location expires immediately before the statement (or terminator) at
 * that location executes. When a borrow's region ends at different points on
 * diverging paths, the host lists every such point, and these are used as
 * given. A borrow with no listed end lives until the function returns.
 *
 * @author The Rust2Viper Project Developers
 */
public final class BorrowFacts {
	public static final BorrowFacts EMPTY = new BorrowFacts(ImmutableSortedMap.of());

	private final ImmutableSortedMap<Location, ImmutableList<Integer>> regionEnds;

	private BorrowFacts(ImmutableSortedMap<Location, ImmutableList<Integer>> regionEnds) {
		this.regionEnds = regionEnds;
	}

	/**
	 * Get the borrows whose regions end immediately before a given location.
	 *
	 * @param location
	 * @return
	 */
	public List<Integer> getRegionEnds(Location location) {
		ImmutableList<Integer> r = regionEnds.get(location);
		return r == null ? ImmutableList.of() : r;
	}

	public Map<Location, ImmutableList<Integer>> getAll() {
		return regionEnds;
	}

	public static class Builder {
		private final TreeMap<Location, ImmutableList.Builder<Integer>> ends = new TreeMap<>();

		public Builder endAt(Location location, int borrow) {
			ends.computeIfAbsent(location, l -> ImmutableList.builder()).add(borrow);
			return this;
		}

		public BorrowFacts build() {
			ImmutableSortedMap.Builder<Location, ImmutableList<Integer>> r = ImmutableSortedMap.naturalOrder();
			for (Map.Entry<Location, ImmutableList.Builder<Integer>> e : ends.entrySet()) {
				r.put(e.getKey(), e.getValue().build());
			}
			return new BorrowFacts(r.build());
		}
	}
}
