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

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * A natural loop, identified by its head block. The head dominates every
 * block of the loop, and every back edge of the loop leads from one of its
 * latches to the head.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Loop {
	private final int head;
	private final ImmutableSortedSet<Integer> blocks;
	private final ImmutableList<Integer> latches;

	public Loop(int head, Collection<Integer> blocks, Collection<Integer> latches) {
		this.head = head;
		this.blocks = ImmutableSortedSet.copyOf(blocks);
		this.latches = ImmutableList.copyOf(ImmutableSortedSet.copyOf(latches));
	}

	public int getHead() {
		return head;
	}

	/**
	 * Get every block in this loop, including the head.
	 *
	 * @return
	 */
	public SortedSet<Integer> getBlocks() {
		return blocks;
	}

	public List<Integer> getLatches() {
		return latches;
	}

	public boolean contains(int block) {
		return blocks.contains(block);
	}

	@Override
	public String toString() {
		return "loop@bb" + head + blocks;
	}
}
