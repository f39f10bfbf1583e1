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

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import rsviper.lang.Borrow;
import rsviper.lang.Place;
import rsviper.lang.Ty;

/**
 * The right-hand side of an assignment.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class Rvalue {

	public enum Kind {
		USE,
		BINARY,
		UNARY,
		REF,
		AGGREGATE,
		LEN
	}

	private Rvalue() {
	}

	public abstract Kind getKind();

	public static Use USE(Operand operand) {
		return new Use(operand);
	}

	public static Binary BINARY(BinOp op, Operand lhs, Operand rhs) {
		return new Binary(op, lhs, rhs, false);
	}

	/**
	 * Construct an arithmetic operation which the host compiler marked as
	 * overflow-checked.
	 */
	public static Binary CHECKED(BinOp op, Operand lhs, Operand rhs) {
		return new Binary(op, lhs, rhs, true);
	}

	public static Unary UNARY(UnOp op, Operand operand) {
		return new Unary(op, operand);
	}

	public static Ref SHARED_REF(int borrow, Place place) {
		return new Ref(borrow, Borrow.Kind.SHARED, place);
	}

	public static Ref MUT_REF(int borrow, Place place) {
		return new Ref(borrow, Borrow.Kind.MUTABLE, place);
	}

	public static Aggregate AGGREGATE(Ty type, Operand... operands) {
		return new Aggregate(type, ImmutableList.copyOf(operands));
	}

	public static Len LEN(Place place) {
		return new Len(place);
	}

	public static final class Use extends Rvalue {
		private final Operand operand;

		private Use(Operand operand) {
			this.operand = Objects.requireNonNull(operand);
		}

		@Override
		public Kind getKind() {
			return Kind.USE;
		}

		public Operand getOperand() {
			return operand;
		}

		@Override
		public String toString() {
			return operand.toString();
		}
	}

	public static final class Binary extends Rvalue {
		private final BinOp op;
		private final Operand lhs;
		private final Operand rhs;
		private final boolean checked;

		private Binary(BinOp op, Operand lhs, Operand rhs, boolean checked) {
			this.op = Objects.requireNonNull(op);
			this.lhs = Objects.requireNonNull(lhs);
			this.rhs = Objects.requireNonNull(rhs);
			this.checked = checked;
		}

		@Override
		public Kind getKind() {
			return Kind.BINARY;
		}

		public BinOp getOp() {
			return op;
		}

		public Operand getLeftHandSide() {
			return lhs;
		}

		public Operand getRightHandSide() {
			return rhs;
		}

		public boolean isChecked() {
			return checked;
		}

		@Override
		public String toString() {
			return (checked ? "Checked" : "") + op + "(" + lhs + ", " + rhs + ")";
		}
	}

	public static final class Unary extends Rvalue {
		private final UnOp op;
		private final Operand operand;

		private Unary(UnOp op, Operand operand) {
			this.op = Objects.requireNonNull(op);
			this.operand = Objects.requireNonNull(operand);
		}

		@Override
		public Kind getKind() {
			return Kind.UNARY;
		}

		public UnOp getOp() {
			return op;
		}

		public Operand getOperand() {
			return operand;
		}

		@Override
		public String toString() {
			return op + "(" + operand + ")";
		}
	}

	/**
	 * Creates a borrow of a place. The borrow identifier is the one used by the
	 * host's region-end facts.
	 */
	public static final class Ref extends Rvalue {
		private final int borrow;
		private final Borrow.Kind kind;
		private final Place place;

		private Ref(int borrow, Borrow.Kind kind, Place place) {
			this.borrow = borrow;
			this.kind = Objects.requireNonNull(kind);
			this.place = Objects.requireNonNull(place);
		}

		@Override
		public Kind getKind() {
			return Kind.REF;
		}

		public int getBorrow() {
			return borrow;
		}

		public Borrow.Kind getBorrowKind() {
			return kind;
		}

		public Place getPlace() {
			return place;
		}

		@Override
		public String toString() {
			return (kind == Borrow.Kind.SHARED ? "&" : "&mut ") + place;
		}
	}

	/**
	 * Builds a tuple, structure or array from its components, given in field
	 * order.
	 */
	public static final class Aggregate extends Rvalue {
		private final Ty type;
		private final ImmutableList<Operand> operands;

		private Aggregate(Ty type, ImmutableList<Operand> operands) {
			this.type = Objects.requireNonNull(type);
			this.operands = operands;
		}

		@Override
		public Kind getKind() {
			return Kind.AGGREGATE;
		}

		public Ty getType() {
			return type;
		}

		public List<Operand> getOperands() {
			return operands;
		}

		@Override
		public String toString() {
			return type + operands.toString();
		}
	}

	public static final class Len extends Rvalue {
		private final Place place;

		private Len(Place place) {
			this.place = Objects.requireNonNull(place);
		}

		@Override
		public Kind getKind() {
			return Kind.LEN;
		}

		public Place getPlace() {
			return place;
		}

		@Override
		public String toString() {
			return "Len(" + place + ")";
		}
	}
}
