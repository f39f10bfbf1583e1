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

import java.math.BigInteger;
import java.util.Objects;

import rsviper.lang.Place;
import rsviper.lang.Ty;

/**
 * An argument to an rvalue, a call or a terminator: either a read of a place
 * (copying or moving it) or a constant.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class Operand {

	public enum Kind {
		COPY,
		MOVE,
		CONSTANT
	}

	private Operand() {
	}

	public abstract Kind getKind();

	/**
	 * Get the place being read, or <code>null</code> for a constant.
	 *
	 * @return
	 */
	public Place getPlace() {
		return null;
	}

	public static Copy COPY(Place place) {
		return new Copy(place);
	}

	public static Move MOVE(Place place) {
		return new Move(place);
	}

	public static Constant INT(Ty type, long value) {
		return new Constant(type, BigInteger.valueOf(value));
	}

	public static Constant INT(Ty type, BigInteger value) {
		return new Constant(type, value);
	}

	public static Constant BOOL(boolean value) {
		return new Constant(Ty.BOOL, value);
	}

	public static final class Copy extends Operand {
		private final Place place;

		private Copy(Place place) {
			this.place = Objects.requireNonNull(place);
		}

		@Override
		public Kind getKind() {
			return Kind.COPY;
		}

		@Override
		public Place getPlace() {
			return place;
		}

		@Override
		public String toString() {
			return "copy " + place;
		}
	}

	public static final class Move extends Operand {
		private final Place place;

		private Move(Place place) {
			this.place = Objects.requireNonNull(place);
		}

		@Override
		public Kind getKind() {
			return Kind.MOVE;
		}

		@Override
		public Place getPlace() {
			return place;
		}

		@Override
		public String toString() {
			return "move " + place;
		}
	}

	/**
	 * A constant of integer or boolean type.
	 */
	public static final class Constant extends Operand {
		private final Ty type;
		private final Object value;

		private Constant(Ty type, Object value) {
			this.type = Objects.requireNonNull(type);
			this.value = Objects.requireNonNull(value);
		}

		@Override
		public Kind getKind() {
			return Kind.CONSTANT;
		}

		public Ty getType() {
			return type;
		}

		/**
		 * Get the value of this constant, which is either a
		 * <code>BigInteger</code> or a <code>Boolean</code>.
		 *
		 * @return
		 */
		public Object getValue() {
			return value;
		}

		@Override
		public String toString() {
			return "const " + value;
		}
	}
}
