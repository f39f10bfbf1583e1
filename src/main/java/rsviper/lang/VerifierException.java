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
 * The root of all exceptions raised whilst encoding or verifying a program.
 * Each exception may identify the source region responsible for the problem,
 * so that it can be reported as a diagnostic against that region.
 *
 * @author The Rust2Viper Project Developers
 */
public class VerifierException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	/**
	 * The source region associated with this exception (which may be
	 * <code>null</code>).
	 */
	private final Span span;

	public VerifierException(String message, Span span) {
		super(message);
		this.span = span;
	}

	public VerifierException(String message, Span span, Throwable cause) {
		super(message, cause);
		this.span = span;
	}

	/**
	 * Get the source region associated with this exception, or
	 * <code>null</code> if none is known.
	 *
	 * @return
	 */
	public Span getSpan() {
		return span;
	}
}
