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

public enum BinOp {
	ADD("add", false),
	SUB("subtract", false),
	MUL("multiply", false),
	DIV("divide", false),
	REM("calculate the remainder", false),
	EQ("compare", true),
	NE("compare", true),
	LT("compare", true),
	LE("compare", true),
	GT("compare", true),
	GE("compare", true),
	BIT_AND("and", false),
	BIT_OR("or", false);

	private final String verb;
	private final boolean comparison;

	private BinOp(String verb, boolean comparison) {
		this.verb = verb;
		this.comparison = comparison;
	}

	public boolean isComparison() {
		return comparison;
	}

	/**
	 * Check whether this operation can overflow when applied to integers.
	 *
	 * @return
	 */
	public boolean isArithmetic() {
		return this == ADD || this == SUB || this == MUL || this == DIV || this == REM;
	}

	/**
	 * The message reported when a checked instance of this operation
	 * overflows, following the wording of the host compiler.
	 *
	 * @return
	 */
	public String getOverflowMessage() {
		if (this == DIV) {
			return "attempt to divide with overflow";
		}
		return "attempt to " + verb + " with overflow";
	}
}
