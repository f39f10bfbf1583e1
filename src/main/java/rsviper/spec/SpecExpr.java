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
package rsviper.spec;

import java.math.BigInteger;
import java.util.Objects;

import rsviper.lang.Span;

/**
 * An unresolved specification expression, as handed over by the
 * specification front end. Names are plain strings at this point; they are
 * bound to locals, the return value or snapshots by the
 * {@link SpecificationResolver}.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class SpecExpr {

	public enum Kind {
		BOOL,
		INT,
		VAR,
		RESULT,
		OLD,
		DEREF,
		FIELD,
		INDEX,
		LEN,
		SUM,
		UNARY,
		BINARY,
		CONDITIONAL,
		QUANTIFIER
	}

	public enum UnaryOp {
		NOT("!"),
		NEG("-");

		private final String symbol;

		private UnaryOp(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	public enum BinaryOp {
		ADD("+"),
		SUB("-"),
		MUL("*"),
		DIV("/"),
		REM("%"),
		EQ("=="),
		NE("!="),
		LT("<"),
		LE("<="),
		GT(">"),
		GE(">="),
		AND("&&"),
		OR("||"),
		IMPLIES("==>"),
		IFF("<==>");

		private final String symbol;

		private BinaryOp(String symbol) {
			this.symbol = symbol;
		}

		public boolean isArithmetic() {
			return this == ADD || this == SUB || this == MUL || this == DIV || this == REM;
		}

		public boolean isOrdering() {
			return this == LT || this == LE || this == GT || this == GE;
		}

		public boolean isEquality() {
			return this == EQ || this == NE;
		}

		public boolean isLogical() {
			return this == AND || this == OR || this == IMPLIES || this == IFF;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	private final Span span;

	private SpecExpr(Span span) {
		this.span = span == null ? Span.UNKNOWN : span;
	}

	public abstract Kind getKind();

	public Span getSpan() {
		return span;
	}

	/**
	 * Get a copy of this expression located at a given source position.
	 *
	 * @param span
	 * @return
	 */
	public abstract SpecExpr at(Span span);

	// =========================================================================
	// Constructors
	// =========================================================================

	public static Bool BOOL(boolean value) {
		return new Bool(value, null);
	}

	public static Int INT(long value) {
		return new Int(BigInteger.valueOf(value), null);
	}

	public static Int INT(BigInteger value) {
		return new Int(value, null);
	}

	public static Var VAR(String name) {
		return new Var(name, null);
	}

	public static Result RESULT() {
		return new Result(null);
	}

	public static Old OLD(SpecExpr operand) {
		return new Old(operand, null);
	}

	public static Deref DEREF(SpecExpr operand) {
		return new Deref(operand, null);
	}

	public static Field FIELD(SpecExpr source, String name) {
		return new Field(source, name, null);
	}

	public static Index INDEX(SpecExpr source, SpecExpr index) {
		return new Index(source, index, null);
	}

	public static Len LEN(SpecExpr operand) {
		return new Len(operand, null);
	}

	public static Sum SUM(SpecExpr source, SpecExpr from, SpecExpr to) {
		return new Sum(source, from, to, null);
	}

	public static Unary NOT(SpecExpr operand) {
		return new Unary(UnaryOp.NOT, operand, null);
	}

	public static Unary NEG(SpecExpr operand) {
		return new Unary(UnaryOp.NEG, operand, null);
	}

	public static Binary BINARY(BinaryOp op, SpecExpr lhs, SpecExpr rhs) {
		return new Binary(op, lhs, rhs, null);
	}

	public static Binary ADD(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.ADD, lhs, rhs);
	}

	public static Binary SUB(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.SUB, lhs, rhs);
	}

	public static Binary MUL(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.MUL, lhs, rhs);
	}

	public static Binary EQ(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.EQ, lhs, rhs);
	}

	public static Binary NE(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.NE, lhs, rhs);
	}

	public static Binary LT(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.LT, lhs, rhs);
	}

	public static Binary LE(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.LE, lhs, rhs);
	}

	public static Binary GT(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.GT, lhs, rhs);
	}

	public static Binary GE(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.GE, lhs, rhs);
	}

	public static Binary AND(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.AND, lhs, rhs);
	}

	public static Binary OR(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.OR, lhs, rhs);
	}

	public static Binary IMPLIES(SpecExpr lhs, SpecExpr rhs) {
		return BINARY(BinaryOp.IMPLIES, lhs, rhs);
	}

	public static Conditional IF(SpecExpr condition, SpecExpr trueBranch, SpecExpr falseBranch) {
		return new Conditional(condition, trueBranch, falseBranch, null);
	}

	public static Quantifier FORALL(String variable, SpecExpr body) {
		return new Quantifier(true, variable, body, null);
	}

	public static Quantifier EXISTS(String variable, SpecExpr body) {
		return new Quantifier(false, variable, body, null);
	}

	// =========================================================================
	// Cases
	// =========================================================================

	public static final class Bool extends SpecExpr {
		private final boolean value;

		private Bool(boolean value, Span span) {
			super(span);
			this.value = value;
		}

		@Override
		public Kind getKind() {
			return Kind.BOOL;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public Bool at(Span span) {
			return new Bool(value, span);
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}

	public static final class Int extends SpecExpr {
		private final BigInteger value;

		private Int(BigInteger value, Span span) {
			super(span);
			this.value = Objects.requireNonNull(value);
		}

		@Override
		public Kind getKind() {
			return Kind.INT;
		}

		public BigInteger getValue() {
			return value;
		}

		@Override
		public Int at(Span span) {
			return new Int(value, span);
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	/**
	 * A variable, which is either a parameter, a local variable of the body or
	 * a quantified variable.
	 */
	public static final class Var extends SpecExpr {
		private final String name;

		private Var(String name, Span span) {
			super(span);
			this.name = Objects.requireNonNull(name);
		}

		@Override
		public Kind getKind() {
			return Kind.VAR;
		}

		public String getName() {
			return name;
		}

		@Override
		public Var at(Span span) {
			return new Var(name, span);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static final class Result extends SpecExpr {
		private Result(Span span) {
			super(span);
		}

		@Override
		public Kind getKind() {
			return Kind.RESULT;
		}

		@Override
		public Result at(Span span) {
			return new Result(span);
		}

		@Override
		public String toString() {
			return "result";
		}
	}

	public static final class Old extends SpecExpr {
		private final SpecExpr operand;

		private Old(SpecExpr operand, Span span) {
			super(span);
			this.operand = Objects.requireNonNull(operand);
		}

		@Override
		public Kind getKind() {
			return Kind.OLD;
		}

		public SpecExpr getOperand() {
			return operand;
		}

		@Override
		public Old at(Span span) {
			return new Old(operand, span);
		}

		@Override
		public String toString() {
			return "old(" + operand + ")";
		}
	}

	public static final class Deref extends SpecExpr {
		private final SpecExpr operand;

		private Deref(SpecExpr operand, Span span) {
			super(span);
			this.operand = Objects.requireNonNull(operand);
		}

		@Override
		public Kind getKind() {
			return Kind.DEREF;
		}

		public SpecExpr getOperand() {
			return operand;
		}

		@Override
		public Deref at(Span span) {
			return new Deref(operand, span);
		}

		@Override
		public String toString() {
			return "*" + operand;
		}
	}

	/**
	 * A struct field or tuple element selection. Tuple elements are named by
	 * their position, i.e. <code>"0"</code>, <code>"1"</code> and so on.
	 */
	public static final class Field extends SpecExpr {
		private final SpecExpr source;
		private final String name;

		private Field(SpecExpr source, String name, Span span) {
			super(span);
			this.source = Objects.requireNonNull(source);
			this.name = Objects.requireNonNull(name);
		}

		@Override
		public Kind getKind() {
			return Kind.FIELD;
		}

		public SpecExpr getSource() {
			return source;
		}

		public String getName() {
			return name;
		}

		@Override
		public Field at(Span span) {
			return new Field(source, name, span);
		}

		@Override
		public String toString() {
			return source + "." + name;
		}
	}

	public static final class Index extends SpecExpr {
		private final SpecExpr source;
		private final SpecExpr index;

		private Index(SpecExpr source, SpecExpr index, Span span) {
			super(span);
			this.source = Objects.requireNonNull(source);
			this.index = Objects.requireNonNull(index);
		}

		@Override
		public Kind getKind() {
			return Kind.INDEX;
		}

		public SpecExpr getSource() {
			return source;
		}

		public SpecExpr getIndex() {
			return index;
		}

		@Override
		public Index at(Span span) {
			return new Index(source, index, span);
		}

		@Override
		public String toString() {
			return source + "[" + index + "]";
		}
	}

	public static final class Len extends SpecExpr {
		private final SpecExpr operand;

		private Len(SpecExpr operand, Span span) {
			super(span);
			this.operand = Objects.requireNonNull(operand);
		}

		@Override
		public Kind getKind() {
			return Kind.LEN;
		}

		public SpecExpr getOperand() {
			return operand;
		}

		@Override
		public Len at(Span span) {
			return new Len(operand, span);
		}

		@Override
		public String toString() {
			return "len(" + operand + ")";
		}
	}

	/**
	 * The sum of the elements of a sequence in the half-open range
	 * <code>[from, to)</code>.
	 */
	public static final class Sum extends SpecExpr {
		private final SpecExpr source;
		private final SpecExpr from;
		private final SpecExpr to;

		private Sum(SpecExpr source, SpecExpr from, SpecExpr to, Span span) {
			super(span);
			this.source = Objects.requireNonNull(source);
			this.from = Objects.requireNonNull(from);
			this.to = Objects.requireNonNull(to);
		}

		@Override
		public Kind getKind() {
			return Kind.SUM;
		}

		public SpecExpr getSource() {
			return source;
		}

		public SpecExpr getFrom() {
			return from;
		}

		public SpecExpr getTo() {
			return to;
		}

		@Override
		public Sum at(Span span) {
			return new Sum(source, from, to, span);
		}

		@Override
		public String toString() {
			return "sum(" + source + ", " + from + ", " + to + ")";
		}
	}

	public static final class Unary extends SpecExpr {
		private final UnaryOp op;
		private final SpecExpr operand;

		private Unary(UnaryOp op, SpecExpr operand, Span span) {
			super(span);
			this.op = op;
			this.operand = Objects.requireNonNull(operand);
		}

		@Override
		public Kind getKind() {
			return Kind.UNARY;
		}

		public UnaryOp getOp() {
			return op;
		}

		public SpecExpr getOperand() {
			return operand;
		}

		@Override
		public Unary at(Span span) {
			return new Unary(op, operand, span);
		}

		@Override
		public String toString() {
			return op + "(" + operand + ")";
		}
	}

	public static final class Binary extends SpecExpr {
		private final BinaryOp op;
		private final SpecExpr lhs;
		private final SpecExpr rhs;

		private Binary(BinaryOp op, SpecExpr lhs, SpecExpr rhs, Span span) {
			super(span);
			this.op = op;
			this.lhs = Objects.requireNonNull(lhs);
			this.rhs = Objects.requireNonNull(rhs);
		}

		@Override
		public Kind getKind() {
			return Kind.BINARY;
		}

		public BinaryOp getOp() {
			return op;
		}

		public SpecExpr getLeftHandSide() {
			return lhs;
		}

		public SpecExpr getRightHandSide() {
			return rhs;
		}

		@Override
		public Binary at(Span span) {
			return new Binary(op, lhs, rhs, span);
		}

		@Override
		public String toString() {
			return "(" + lhs + " " + op + " " + rhs + ")";
		}
	}

	public static final class Conditional extends SpecExpr {
		private final SpecExpr condition;
		private final SpecExpr trueBranch;
		private final SpecExpr falseBranch;

		private Conditional(SpecExpr condition, SpecExpr trueBranch, SpecExpr falseBranch, Span span) {
			super(span);
			this.condition = Objects.requireNonNull(condition);
			this.trueBranch = Objects.requireNonNull(trueBranch);
			this.falseBranch = Objects.requireNonNull(falseBranch);
		}

		@Override
		public Kind getKind() {
			return Kind.CONDITIONAL;
		}

		public SpecExpr getCondition() {
			return condition;
		}

		public SpecExpr getTrueBranch() {
			return trueBranch;
		}

		public SpecExpr getFalseBranch() {
			return falseBranch;
		}

		@Override
		public Conditional at(Span span) {
			return new Conditional(condition, trueBranch, falseBranch, span);
		}

		@Override
		public String toString() {
			return "(" + condition + " ? " + trueBranch + " : " + falseBranch + ")";
		}
	}

	/**
	 * A quantifier over a single unbounded integer variable.
	 */
	public static final class Quantifier extends SpecExpr {
		private final boolean universal;
		private final String variable;
		private final SpecExpr body;

		private Quantifier(boolean universal, String variable, SpecExpr body, Span span) {
			super(span);
			this.universal = universal;
			this.variable = Objects.requireNonNull(variable);
			this.body = Objects.requireNonNull(body);
		}

		@Override
		public Kind getKind() {
			return Kind.QUANTIFIER;
		}

		public boolean isUniversal() {
			return universal;
		}

		public String getVariable() {
			return variable;
		}

		public SpecExpr getBody() {
			return body;
		}

		@Override
		public Quantifier at(Span span) {
			return new Quantifier(universal, variable, body, span);
		}

		@Override
		public String toString() {
			return "(" + (universal ? "forall " : "exists ") + variable + ": int :: " + body + ")";
		}
	}
}
