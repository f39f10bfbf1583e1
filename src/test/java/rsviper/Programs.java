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
package rsviper;

import static rsviper.mir.Operand.*;

import java.util.Arrays;
import java.util.Collections;

import rsviper.lang.IntKind;
import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.Ty;
import rsviper.mir.AssertKind;
import rsviper.mir.BinOp;
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.Rvalue;
import rsviper.mir.Terminator;
import rsviper.spec.FunctionSpec;
import rsviper.spec.SpecExpr;

/**
 * Small functions in the form produced by the host compiler, shared between
 * tests.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Programs {
	public static final Ty I32 = Ty.INT(IntKind.I32);
	public static final Ty USIZE = Ty.INT(IntKind.USIZE);

	/**
	 * A list node whose tail is boxed.
	 */
	public static final Ty.Adt NODE = Ty.RECURSIVE("Node",
			self -> new Ty.Adt.Field[] { Ty.FIELD("val", I32), Ty.FIELD("next", Ty.BOX(self)) });

	/**
	 * The block which heads the loop of {@link #sum()}.
	 */
	public static final int SUM_HEAD = 1;

	private Programs() {
	}

	public static Span at(String file, int line) {
		return new Span(file, line, 5);
	}

	/**
	 * <pre>
	 * fn divide(a: i32, b: i32) -> i32 { a / b }
	 * </pre>
	 */
	public static Body divide() {
		return divide("divide");
	}

	public static Body divide(String name) {
		return divide(name, 0);
	}

	/**
	 * <pre>
	 * fn set_head(n: &mut Node) { (*n).val = 3; }
	 * </pre>
	 *
	 * With {@code second} set, the value stored is that of the next node.
	 */
	public static Body setHead(boolean second) {
		FunctionSig sig = new FunctionSig(second ? "set_second" : "set_head", Collections.singletonList("n"),
				Collections.<Ty>singletonList(Ty.MUTREF(NODE)), Ty.UNIT, at("node.rs", 1));
		Body.Builder b = new Body.Builder(sig);
		Place node = Place.local(1).deref();
		if (second) {
			node = node.field("next").deref();
		}
		int bb0 = b.block();
		b.assign(bb0, node.field("val"), Rvalue.USE(INT(I32, 3)), at("node.rs", 2));
		b.terminate(bb0, Terminator.RETURN(at("node.rs", 3)));
		return b.build();
	}

	/**
	 * {@link #divide()} placed further down its file.
	 *
	 * @param name
	 * @param offset
	 *            Number of lines before the function.
	 */
	public static Body divide(String name, int offset) {
		FunctionSig sig = new FunctionSig(name, Arrays.asList("a", "b"), Arrays.asList(I32, I32), I32,
				at("divide.rs", 1 + offset));
		Body.Builder b = new Body.Builder(sig);
		int nonzero = b.temp(Ty.BOOL);
		int bb0 = b.block();
		int bb1 = b.block();
		b.assign(bb0, Place.local(nonzero), Rvalue.BINARY(BinOp.NE, COPY(Place.local(2)), INT(I32, 0)),
				at("divide.rs", 2 + offset));
		b.terminate(bb0, Terminator.ASSERT(MOVE(Place.local(nonzero)), true, AssertKind.DIVISION_BY_ZERO,
				"attempt to divide by zero", bb1, at("divide.rs", 2 + offset)));
		b.assign(bb1, Place.local(0), Rvalue.BINARY(BinOp.DIV, COPY(Place.local(1)), COPY(Place.local(2))),
				at("divide.rs", 2 + offset));
		b.terminate(bb1, Terminator.RETURN(at("divide.rs", 3 + offset)));
		return b.build();
	}

	public static FunctionSpec divideSpec(boolean guarded) {
		FunctionSpec.Builder spec = FunctionSpec.builder();
		if (guarded) {
			spec.requires(SpecExpr.NE(SpecExpr.VAR("b"), SpecExpr.INT(0)).at(at("divide.rs", 1)));
		}
		return spec.build();
	}

	/**
	 * <pre>
	 * fn half(x: i32) -> i32 { divide(x, d) }
	 * </pre>
	 */
	public static Body half(long divisor) {
		FunctionSig sig = new FunctionSig("half", Collections.singletonList("x"), Collections.singletonList(I32),
				I32, at("half.rs", 1));
		Body.Builder b = new Body.Builder(sig);
		int bb0 = b.block();
		int bb1 = b.block();
		b.terminate(bb0, Terminator.CALL("divide", Arrays.asList(COPY(Place.local(1)), INT(I32, divisor)),
				Place.local(0), bb1, at("half.rs", 2)));
		b.terminate(bb1, Terminator.RETURN(at("half.rs", 3)));
		return b.build();
	}

	/**
	 * <pre>
	 * fn sum(s: &amp;[i32]) -> i32 {
	 *   let mut i = 0;
	 *   let mut total = 0;
	 *   while i &lt; s.len() {
	 *     total = total + s[i];
	 *     i = i + 1;
	 *   }
	 *   total
	 * }
	 * </pre>
	 */
	public static Body sum() {
		FunctionSig sig = new FunctionSig("sum", Collections.singletonList("s"),
				Collections.<Ty>singletonList(Ty.REF(Ty.SLICE(I32))), I32, at("sum.rs", 1));
		Body.Builder b = new Body.Builder(sig);
		int i = b.local("i", USIZE);
		int total = b.local("total", I32);
		int len = b.temp(USIZE);
		int cond = b.temp(Ty.BOOL);
		int element = b.temp(I32);
		int bb0 = b.block();
		int bb1 = b.block();
		int bb2 = b.block();
		int bb3 = b.block();
		int bb4 = b.block();
		Place s = Place.local(1).deref();
		// bb0: initialise
		b.storageLive(bb0, i, at("sum.rs", 2));
		b.assign(bb0, Place.local(i), Rvalue.USE(INT(USIZE, 0)), at("sum.rs", 2));
		b.storageLive(bb0, total, at("sum.rs", 3));
		b.assign(bb0, Place.local(total), Rvalue.USE(INT(I32, 0)), at("sum.rs", 3));
		b.terminate(bb0, Terminator.GOTO(bb1, at("sum.rs", 4)));
		// bb1: loop head
		b.assign(bb1, Place.local(len), Rvalue.LEN(s), at("sum.rs", 4));
		b.assign(bb1, Place.local(cond), Rvalue.BINARY(BinOp.LT, COPY(Place.local(i)), COPY(Place.local(len))),
				at("sum.rs", 4));
		b.terminate(bb1, Terminator.IF(COPY(Place.local(cond)), bb2, bb3, at("sum.rs", 4)));
		// bb2: bounds check
		b.terminate(bb2, Terminator.ASSERT(COPY(Place.local(cond)), true, AssertKind.BOUNDS_CHECK,
				"index out of bounds", bb4, at("sum.rs", 5)));
		// bb4: loop body
		b.assign(bb4, Place.local(element), Rvalue.USE(COPY(s.index(i))), at("sum.rs", 5));
		b.assign(bb4, Place.local(total),
				Rvalue.BINARY(BinOp.ADD, COPY(Place.local(total)), MOVE(Place.local(element))), at("sum.rs", 5));
		b.assign(bb4, Place.local(i), Rvalue.BINARY(BinOp.ADD, COPY(Place.local(i)), INT(USIZE, 1)),
				at("sum.rs", 6));
		b.terminate(bb4, Terminator.GOTO(bb1, at("sum.rs", 7)));
		// bb3: exit
		b.assign(bb3, Place.local(0), Rvalue.USE(COPY(Place.local(total))), at("sum.rs", 8));
		b.terminate(bb3, Terminator.RETURN(at("sum.rs", 9)));
		return b.build();
	}

	public static FunctionSpec sumSpec(boolean withInvariant) {
		FunctionSpec.Builder spec = FunctionSpec.builder();
		spec.ensures(SpecExpr.EQ(SpecExpr.RESULT(),
				SpecExpr.SUM(SpecExpr.VAR("s"), SpecExpr.INT(0), SpecExpr.LEN(SpecExpr.VAR("s")))).at(at("sum.rs", 1)));
		if (withInvariant) {
			SpecExpr i = SpecExpr.VAR("i");
			SpecExpr bounded = SpecExpr.AND(SpecExpr.LE(SpecExpr.INT(0), i), SpecExpr.LE(i, SpecExpr.LEN(SpecExpr.VAR("s"))));
			spec.invariant(SUM_HEAD, bounded.at(at("sum.rs", 4)));
			SpecExpr partial = SpecExpr.EQ(SpecExpr.VAR("total"), SpecExpr.SUM(SpecExpr.VAR("s"), SpecExpr.INT(0), i));
			spec.invariant(SUM_HEAD, partial.at(at("sum.rs", 4)));
		}
		return spec.build();
	}
}
