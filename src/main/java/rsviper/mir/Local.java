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

import java.util.Objects;

import rsviper.lang.Ty;

/**
 * A local variable of a function body. Local <code>0</code> holds the return
 * value, locals <code>1..n</code> are the formal parameters, and the rest are
 * user variables and compiler temporaries. Only user variables and formals
 * carry a source name.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Local {
	private final int index;
	private final String name;
	private final Ty type;

	public Local(int index, String name, Ty type) {
		this.index = index;
		this.name = name;
		this.type = Objects.requireNonNull(type);
	}

	public int getIndex() {
		return index;
	}

	/**
	 * Get the source-level name of this local, or <code>null</code> for a
	 * temporary.
	 *
	 * @return
	 */
	public String getName() {
		return name;
	}

	public Ty getType() {
		return type;
	}

	/**
	 * The name of the variable which represents this local in the generated
	 * program.
	 *
	 * @return
	 */
	public String getVariable() {
		return "_" + index;
	}

	@Override
	public String toString() {
		return (name == null ? "_" + index : name + "@_" + index) + ": " + type;
	}
}
