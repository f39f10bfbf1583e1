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
package rsviper.encoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import rsviper.lang.Span;

/**
 * A proof obligation registered by the encoder. Each obligation is attached
 * to exactly one statement of the generated program (an assertion or an
 * exhale), so that an error reported against that statement can be traced
 * back to the source construct it checks.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Obligation implements Comparable<Obligation> {

	public enum Kind {
		PRECONDITION,
		POSTCONDITION,
		LOOP_INVARIANT_ENTRY,
		LOOP_INVARIANT_PRESERVATION,
		PANIC_FREEDOM,
		ASSERTION,
		OVERFLOW,
		/**
		 * The permissions needed to move, borrow or return a value.
		 */
		PERMISSION
	}

	private final int id;
	private final String function;
	private final Kind kind;
	private final Span span;
	private final String description;

	public Obligation(int id, String function, Kind kind, Span span, String description) {
		this.id = id;
		this.function = Objects.requireNonNull(function);
		this.kind = Objects.requireNonNull(kind);
		this.span = span == null ? Span.UNKNOWN : span;
		this.description = Objects.requireNonNull(description);
	}

	public int getId() {
		return id;
	}

	public String getFunction() {
		return function;
	}

	public Kind getKind() {
		return kind;
	}

	public Span getSpan() {
		return span;
	}

	/**
	 * The message reported when this obligation cannot be discharged.
	 *
	 * @return
	 */
	public String getDescription() {
		return description;
	}

	public String getName() {
		return function + "#" + id;
	}

	@Override
	public int compareTo(Obligation o) {
		int c = function.compareTo(o.function);
		return c != 0 ? c : Integer.compare(id, o.id);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Obligation) {
			Obligation b = (Obligation) o;
			return id == b.id && function.equals(b.function) && kind == b.kind && span.equals(b.span)
					&& description.equals(b.description);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, function, kind);
	}

	@Override
	public String toString() {
		return getName() + ":" + kind + "@" + span;
	}

	/**
	 * Allocates the obligations of a single function, numbering them in the
	 * order they are created.
	 */
	public static final class Registry {
		private final String function;
		private final ArrayList<Obligation> obligations = new ArrayList<>();

		public Registry(String function) {
			this.function = function;
		}

		public Obligation register(Kind kind, Span span, String description) {
			Obligation o = new Obligation(obligations.size(), function, kind, span, description);
			obligations.add(o);
			return o;
		}

		public List<Obligation> getObligations() {
			return Collections.unmodifiableList(obligations);
		}
	}
}
