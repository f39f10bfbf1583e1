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
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import rsviper.lang.Place;
import rsviper.lang.Span;

/**
 * The final instruction of a basic block, which determines where control goes
 * next.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class Terminator {

	public enum Kind {
		GOTO,
		SWITCH_INT,
		CALL,
		RETURN,
		PANIC,
		ABORT,
		UNREACHABLE,
		ASSERT,
		DROP
	}

	private final Span span;

	private Terminator(Span span) {
		this.span = span == null ? Span.UNKNOWN : span;
	}

	public abstract Kind getKind();

	/**
	 * Get the blocks which control may reach directly after this terminator.
	 *
	 * @return
	 */
	public abstract List<Integer> getSuccessors();

	public Span getSpan() {
		return span;
	}

	public static Goto GOTO(int target, Span span) {
		return new Goto(target, span);
	}

	/**
	 * Branch on a boolean, sending control to <code>ifTrue</code> when it holds
	 * and <code>ifFalse</code> otherwise.
	 */
	public static SwitchInt IF(Operand condition, int ifTrue, int ifFalse, Span span) {
		return new SwitchInt(condition, ImmutableList.of(BigInteger.ZERO), ImmutableList.of(ifFalse), ifTrue, span);
	}

	public static SwitchInt SWITCH(Operand discriminant, List<BigInteger> values, List<Integer> targets,
			int otherwise, Span span) {
		return new SwitchInt(discriminant, ImmutableList.copyOf(values), ImmutableList.copyOf(targets), otherwise,
				span);
	}

	public static Call CALL(String callee, List<Operand> arguments, Place destination, Integer target, Span span) {
		return new Call(callee, ImmutableList.copyOf(arguments), destination, target, span);
	}

	public static Return RETURN(Span span) {
		return new Return(span);
	}

	public static Panic PANIC(PanicCause cause, Span span) {
		return new Panic(cause, span);
	}

	public static Abort ABORT(Span span) {
		return new Abort(span);
	}

	public static Unreachable UNREACHABLE(Span span) {
		return new Unreachable(span);
	}

	public static Assert ASSERT(Operand condition, boolean expected, AssertKind kind, String message, int target,
			Span span) {
		return new Assert(condition, expected, kind, message, target, span);
	}

	public static Drop DROP(Place place, int target, Span span) {
		return new Drop(place, target, span);
	}

	public static final class Goto extends Terminator {
		private final int target;

		private Goto(int target, Span span) {
			super(span);
			this.target = target;
		}

		@Override
		public Kind getKind() {
			return Kind.GOTO;
		}

		public int getTarget() {
			return target;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of(target);
		}

		@Override
		public String toString() {
			return "goto bb" + target;
		}
	}

	/**
	 * A multi-way branch. Control goes to <code>targets[i]</code> when the
	 * discriminant equals <code>values[i]</code>, and to
	 * <code>otherwise</code> when it matches none of them. Booleans are
	 * compared as <code>0</code> (false) and <code>1</code> (true).
	 */
	public static final class SwitchInt extends Terminator {
		private final Operand discriminant;
		private final ImmutableList<BigInteger> values;
		private final ImmutableList<Integer> targets;
		private final int otherwise;

		private SwitchInt(Operand discriminant, ImmutableList<BigInteger> values, ImmutableList<Integer> targets,
				int otherwise, Span span) {
			super(span);
			if (values.size() != targets.size()) {
				throw new IllegalArgumentException("mismatched switch values and targets");
			}
			this.discriminant = Objects.requireNonNull(discriminant);
			this.values = values;
			this.targets = targets;
			this.otherwise = otherwise;
		}

		@Override
		public Kind getKind() {
			return Kind.SWITCH_INT;
		}

		public Operand getDiscriminant() {
			return discriminant;
		}

		public List<BigInteger> getValues() {
			return values;
		}

		public List<Integer> getTargets() {
			return targets;
		}

		public int getOtherwise() {
			return otherwise;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.<Integer>builder().addAll(targets).add(otherwise).build();
		}

		@Override
		public String toString() {
			return "switchInt(" + discriminant + ") " + values + " -> " + targets + " otherwise bb" + otherwise;
		}
	}

	/**
	 * A call to another function. A <code>null</code> target means the call
	 * never returns.
	 */
	public static final class Call extends Terminator {
		private final String callee;
		private final ImmutableList<Operand> arguments;
		private final Place destination;
		private final Integer target;

		private Call(String callee, ImmutableList<Operand> arguments, Place destination, Integer target, Span span) {
			super(span);
			this.callee = Objects.requireNonNull(callee);
			this.arguments = arguments;
			this.destination = Objects.requireNonNull(destination);
			this.target = target;
		}

		@Override
		public Kind getKind() {
			return Kind.CALL;
		}

		public String getCallee() {
			return callee;
		}

		public List<Operand> getArguments() {
			return arguments;
		}

		public Place getDestination() {
			return destination;
		}

		public Integer getTarget() {
			return target;
		}

		@Override
		public List<Integer> getSuccessors() {
			return target == null ? ImmutableList.of() : ImmutableList.of(target);
		}

		@Override
		public String toString() {
			return destination + " = " + callee + arguments + (target == null ? "" : " -> bb" + target);
		}
	}

	public static final class Return extends Terminator {
		private Return(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.RETURN;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of();
		}

		@Override
		public String toString() {
			return "return";
		}
	}

	public static final class Panic extends Terminator {
		private final PanicCause cause;

		private Panic(PanicCause cause, Span span) {
			super(span);
			this.cause = Objects.requireNonNull(cause);
		}

		@Override
		public Kind getKind() {
			return Kind.PANIC;
		}

		public PanicCause getCause() {
			return cause;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of();
		}

		@Override
		public String toString() {
			return "panic(" + cause + ")";
		}
	}

	public static final class Abort extends Terminator {
		private Abort(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.ABORT;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of();
		}

		@Override
		public String toString() {
			return "abort";
		}
	}

	public static final class Unreachable extends Terminator {
		private Unreachable(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.UNREACHABLE;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of();
		}

		@Override
		public String toString() {
			return "unreachable";
		}
	}

	/**
	 * Continues to <code>target</code> when the condition equals the expected
	 * value, and panics otherwise.
	 */
	public static final class Assert extends Terminator {
		private final Operand condition;
		private final boolean expected;
		private final AssertKind kind;
		private final String message;
		private final int target;

		private Assert(Operand condition, boolean expected, AssertKind kind, String message, int target, Span span) {
			super(span);
			this.condition = Objects.requireNonNull(condition);
			this.expected = expected;
			this.kind = Objects.requireNonNull(kind);
			this.message = Objects.requireNonNull(message);
			this.target = target;
		}

		@Override
		public Kind getKind() {
			return Kind.ASSERT;
		}

		public Operand getCondition() {
			return condition;
		}

		public boolean getExpected() {
			return expected;
		}

		public AssertKind getAssertKind() {
			return kind;
		}

		public String getMessage() {
			return message;
		}

		public int getTarget() {
			return target;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of(target);
		}

		@Override
		public String toString() {
			return "assert(" + (expected ? "" : "!") + condition + ", \"" + message + "\") -> bb" + target;
		}
	}

	public static final class Drop extends Terminator {
		private final Place place;
		private final int target;

		private Drop(Place place, int target, Span span) {
			super(span);
			this.place = Objects.requireNonNull(place);
			this.target = target;
		}

		@Override
		public Kind getKind() {
			return Kind.DROP;
		}

		public Place getPlace() {
			return place;
		}

		public int getTarget() {
			return target;
		}

		@Override
		public List<Integer> getSuccessors() {
			return ImmutableList.of(target);
		}

		@Override
		public String toString() {
			return "drop(" + place + ") -> bb" + target;
		}
	}
}
