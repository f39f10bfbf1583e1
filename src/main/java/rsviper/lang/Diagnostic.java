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

import java.util.Objects;

/**
 * A message for the user, attached to a source region.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Diagnostic implements Comparable<Diagnostic> {

	public enum Severity {
		ERROR,
		WARNING
	}

	public enum Category {
		VERIFICATION,
		SPECIFICATION,
		INTERNAL
	}

	private final String function;
	private final Span span;
	private final Severity severity;
	private final Category category;
	private final String message;

	public Diagnostic(String function, Span span, Severity severity, Category category, String message) {
		this.function = Objects.requireNonNull(function);
		this.span = span == null ? Span.UNKNOWN : span;
		this.severity = Objects.requireNonNull(severity);
		this.category = Objects.requireNonNull(category);
		this.message = Objects.requireNonNull(message);
	}

	public String getFunction() {
		return function;
	}

	public Span getSpan() {
		return span;
	}

	public Severity getSeverity() {
		return severity;
	}

	public Category getCategory() {
		return category;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public int compareTo(Diagnostic o) {
		int c = function.compareTo(o.function);
		if (c == 0) {
			c = span.compareTo(o.span);
		}
		if (c == 0) {
			c = message.compareTo(o.message);
		}
		return c;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Diagnostic) {
			Diagnostic d = (Diagnostic) o;
			return function.equals(d.function) && span.equals(d.span) && severity == d.severity
					&& category == d.category && message.equals(d.message);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, span, severity, message);
	}

	@Override
	public String toString() {
		return span + ": " + severity.name().toLowerCase() + ": " + message;
	}
}
