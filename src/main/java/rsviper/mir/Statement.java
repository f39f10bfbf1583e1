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

import rsviper.lang.Place;
import rsviper.lang.Span;

/**
 * A statement within a basic block of the host's control-flow graph.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class Statement {

	public enum Kind {
		ASSIGN,
		STORAGE_LIVE,
		STORAGE_DEAD,
		NOP
	}

	private final Span span;

	private Statement(Span span) {
		this.span = span == null ? Span.UNKNOWN : span;
	}

	public abstract Kind getKind();

	public Span getSpan() {
		return span;
	}

	public static Assign ASSIGN(Place place, Rvalue rvalue, Span span) {
		return new Assign(place, rvalue, span);
	}

	public static StorageLive STORAGE_LIVE(int local, Span span) {
		return new StorageLive(local, span);
	}

	public static StorageDead STORAGE_DEAD(int local, Span span) {
		return new StorageDead(local, span);
	}

	public static Nop NOP(Span span) {
		return new Nop(span);
	}

	public static final class Assign extends Statement {
		private final Place place;
		private final Rvalue rvalue;

		private Assign(Place place, Rvalue rvalue, Span span) {
			super(span);
			this.place = Objects.requireNonNull(place);
			this.rvalue = Objects.requireNonNull(rvalue);
		}

		@Override
		public Kind getKind() {
			return Kind.ASSIGN;
		}

		public Place getPlace() {
			return place;
		}

		public Rvalue getRvalue() {
			return rvalue;
		}

		@Override
		public String toString() {
			return place + " = " + rvalue;
		}
	}

	public static final class StorageLive extends Statement {
		private final int local;

		private StorageLive(int local, Span span) {
			super(span);
			this.local = local;
		}

		@Override
		public Kind getKind() {
			return Kind.STORAGE_LIVE;
		}

		public int getLocal() {
			return local;
		}

		@Override
		public String toString() {
			return "StorageLive(_" + local + ")";
		}
	}

	public static final class StorageDead extends Statement {
		private final int local;

		private StorageDead(int local, Span span) {
			super(span);
			this.local = local;
		}

		@Override
		public Kind getKind() {
			return Kind.STORAGE_DEAD;
		}

		public int getLocal() {
			return local;
		}

		@Override
		public String toString() {
			return "StorageDead(_" + local + ")";
		}
	}

	public static final class Nop extends Statement {
		private Nop(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.NOP;
		}

		@Override
		public String toString() {
			return "nop";
		}
	}
}
