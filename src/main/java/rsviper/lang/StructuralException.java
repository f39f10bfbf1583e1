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
 * Signals that the input handed over by the host compiler breaks one of its
 * guarantees (e.g. a malformed loop, a missing block, or a permission
 * environment which would hold more than full access to a location). Such
 * problems are internal errors: they abort the encoding of the affected
 * function and are never reported as verification failures.
 *
 * @author The Rust2Viper Project Developers
 */
public class StructuralException extends VerifierException {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		MALFORMED_LOOP,
		MISSING_BLOCK,
		MISSING_CALLEE,
		CONSERVATION,
		INVALID_INPUT
	}

	private final Kind kind;

	public StructuralException(Kind kind, String message, Span span) {
		super(message, span);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}
}
