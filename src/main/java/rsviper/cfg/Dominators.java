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

import java.util.Arrays;
import java.util.List;

/**
 * The dominator tree of a control-flow graph, computed with the iterative
 * algorithm of Cooper, Harvey and Kennedy ("A Simple, Fast Dominance
 * Algorithm", 2001). Blocks are identified by their arena index.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Dominators {
	private static final int UNDEFINED = -1;

	private final int entry;
	/**
	 * Immediate dominator of each block, or <code>UNDEFINED</code> for blocks
	 * which are not reachable. The entry is its own immediate dominator.
	 */
	private final int[] idoms;

	private Dominators(int entry, int[] idoms) {
		this.entry = entry;
		this.idoms = idoms;
	}

	/**
	 * Compute the dominators for a graph.
	 *
	 * @param size
	 *            Size of the block arena.
	 * @param reversePostOrder
	 *            The reachable blocks in reverse post-order, starting from the
	 *            entry.
	 * @param predecessors
	 *            Predecessor lists indexed by block.
	 * @return
	 */
	public static Dominators compute(int size, List<Integer> reversePostOrder, List<? extends List<Integer>> predecessors) {
		int[] order = new int[size];
		Arrays.fill(order, UNDEFINED);
		for (int i = 0; i != reversePostOrder.size(); ++i) {
			order[reversePostOrder.get(i)] = i;
		}
		int[] idoms = new int[size];
		Arrays.fill(idoms, UNDEFINED);
		int entry = reversePostOrder.get(0);
		idoms[entry] = entry;
		boolean changed = true;
		while (changed) {
			changed = false;
			for (int i = 1; i < reversePostOrder.size(); ++i) {
				int b = reversePostOrder.get(i);
				int idom = UNDEFINED;
				for (int p : predecessors.get(b)) {
					if (idoms[p] == UNDEFINED) {
						// not processed yet
						continue;
					} else if (idom == UNDEFINED) {
						idom = p;
					} else {
						idom = intersect(p, idom, idoms, order);
					}
				}
				if (idoms[b] != idom) {
					idoms[b] = idom;
					changed = true;
				}
			}
		}
		return new Dominators(entry, idoms);
	}

	private static int intersect(int b1, int b2, int[] idoms, int[] order) {
		while (b1 != b2) {
			while (order[b1] > order[b2]) {
				b1 = idoms[b1];
			}
			while (order[b2] > order[b1]) {
				b2 = idoms[b2];
			}
		}
		return b1;
	}

	/**
	 * Get the immediate dominator of a block.
	 *
	 * @param block
	 * @return The immediate dominator, or <code>-1</code> for the entry block
	 *         and for unreachable blocks.
	 */
	public int getImmediateDominator(int block) {
		return block == entry ? UNDEFINED : idoms[block];
	}

	/**
	 * Check whether every path from the entry to <code>b</code> passes through
	 * <code>a</code>. Every block dominates itself.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public boolean dominates(int a, int b) {
		if (idoms[b] == UNDEFINED || idoms[a] == UNDEFINED) {
			return false;
		}
		while (b != a) {
			if (b == entry) {
				return false;
			}
			b = idoms[b];
		}
		return true;
	}
}
