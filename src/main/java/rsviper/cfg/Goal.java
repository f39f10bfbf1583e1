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

import java.util.Objects;

import rsviper.lang.Span;
import rsviper.mir.AssertKind;
import rsviper.mir.PanicCause;

/**
 * A program point which must be shown unreachable (or a condition which must
 * be shown to hold there). Every goal becomes exactly one registered proof
 * obligation in the encoded procedure.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Goal {

	public enum Kind {
		PANIC,
		ABORT,
		UNREACHABLE,
		ASSERTION,
		OVERFLOW
	}

	private final Kind kind;
	private final PanicCause cause;
	private final AssertKind assertKind;
	private final String description;
	private final Span span;

	private Goal(Kind kind, PanicCause cause, AssertKind assertKind, String description, Span span) {
		this.kind = kind;
		this.cause = cause;
		this.assertKind = assertKind;
		this.description = Objects.requireNonNull(description);
		this.span = span == null ? Span.UNKNOWN : span;
	}

	public static Goal PANIC(PanicCause cause, Span span) {
		return new Goal(Kind.PANIC, cause, null, cause.getMessage(), span);
	}

	public static Goal ABORT(Span span) {
		return new Goal(Kind.ABORT, null, null, "statement might abort", span);
	}

	public static Goal UNREACHABLE(Span span) {
		return new Goal(Kind.UNREACHABLE, null, null, "unreachable code might be reachable", span);
	}

	/**
	 * A compiler-inserted runtime check, such as a bounds check or a division
	 * by zero check.
	 */
	public static Goal ASSERTION(AssertKind kind, String message, Span span) {
		Kind k = kind == AssertKind.OVERFLOW ? Kind.OVERFLOW : Kind.ASSERTION;
		return new Goal(k, null, kind, "assertion might fail with \"" + message + "\"", span);
	}

	/**
	 * An arithmetic operation whose result must lie within the bounds of its
	 * integer type.
	 */
	public static Goal OVERFLOW(String message, Span span) {
		return new Goal(Kind.OVERFLOW, null, AssertKind.OVERFLOW, "assertion might fail with \"" + message + "\"",
				span);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Get the construct which produced a panic goal.
	 *
	 * @return The cause, or <code>null</code> if this is not a panic goal.
	 */
	public PanicCause getCause() {
		return cause;
	}

	public AssertKind getAssertKind() {
		return assertKind;
	}

	/**
	 * Get the message reported when this goal cannot be proved.
	 *
	 * @return
	 */
	public String getDescription() {
		return description;
	}

	public Span getSpan() {
		return span;
	}

	@Override
	public String toString() {
		return kind + "(" + description + ")@" + span;
	}
}
