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

/**
 * A program point: the statement at a given index within a block. An index
 * equal to the number of statements in the block denotes its terminator.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Location implements Comparable<Location> {
	private final int block;
	private final int statement;

	public Location(int block, int statement) {
		this.block = block;
		this.statement = statement;
	}

	public int getBlock() {
		return block;
	}

	public int getStatement() {
		return statement;
	}

	@Override
	public int compareTo(Location o) {
		int c = Integer.compare(block, o.block);
		return c != 0 ? c : Integer.compare(statement, o.statement);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Location) {
			Location l = (Location) o;
			return block == l.block && statement == l.statement;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return block * 31 + statement;
	}

	@Override
	public String toString() {
		return "bb" + block + "[" + statement + "]";
	}
}
