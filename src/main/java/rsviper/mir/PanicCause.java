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
 * Identifies the source construct which produced a panic terminator.
 *
 * @author The Rust2Viper Project Developers
 */
public enum PanicCause {
	/**
	 * An explicit <code>panic!(..)</code>.
	 */
	PANIC("statement might panic"),
	/**
	 * A failed <code>assert!(..)</code>.
	 */
	ASSERT("the asserted expression might not hold"),
	/**
	 * An <code>unreachable!(..)</code>.
	 */
	UNREACHABLE("unreachable!(..) statement might be reachable"),
	/**
	 * An <code>unimplemented!(..)</code>.
	 */
	UNIMPLEMENTED("unimplemented!(..) statement might be reachable"),
	UNKNOWN("statement might panic");

	private final String message;

	private PanicCause(String message) {
		this.message = message;
	}

	public String getMessage() {
		return message;
	}
}
