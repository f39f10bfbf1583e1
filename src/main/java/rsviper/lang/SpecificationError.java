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

/**
 * Signals a user error within a specification clause. The verification of the
 * owning function is abandoned, but all other functions proceed.
 *
 * @author The Rust2Viper Project Developers
 */
public class SpecificationError extends VerifierException {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		UNRESOLVED_REFERENCE,
		TYPE_MISMATCH
	}

	private final Kind kind;

	public SpecificationError(Kind kind, String message, Span span) {
		super(message, span);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}
}
