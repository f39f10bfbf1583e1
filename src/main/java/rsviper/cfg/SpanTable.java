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
package rsviper.cfg;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import rsviper.lang.Span;

/**
 * Source positions of the blocks and goals of a normalized body.
 *
 * @author The Rust2Viper Project Developers
 */
public final class SpanTable {
	private final Span fallback;
	private final ImmutableSortedMap<Integer, Span> blocks;
	private final ImmutableList<Goal> goals;

	public SpanTable(Span fallback, Map<Integer, Span> blocks, List<Goal> goals) {
		this.fallback = fallback;
		this.blocks = ImmutableSortedMap.copyOf(blocks);
		this.goals = ImmutableList.copyOf(goals);
	}

	/**
	 * Get the position of a block. Blocks with no known position report the
	 * position of their function.
	 *
	 * @param block
	 * @return
	 */
	public Span getBlockSpan(int block) {
		Span s = blocks.get(block);
		return s == null || s.equals(Span.UNKNOWN) ? fallback : s;
	}

	/**
	 * Get every goal of the body, in encoding order.
	 *
	 * @return
	 */
	public List<Goal> getGoals() {
		return goals;
	}
}
