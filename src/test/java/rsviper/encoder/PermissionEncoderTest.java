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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static rsviper.mir.Operand.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.cfg.CfgNormalizer;
import rsviper.cfg.NormalizedCfg;
import rsviper.core.ViperFile;
import rsviper.io.ViperFilePrinter;
import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.Ty;
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.Rvalue;
import rsviper.mir.Terminator;
import rsviper.spec.FunctionSpec;
import rsviper.spec.SpecificationResolver;

/**
 * Checks the amounts of permission exhaled and inhaled as values are moved
 * and borrowed, and as borrows end.
 */
public class PermissionEncoderTest {
	private final SpecificationResolver resolver = new SpecificationResolver();

	private static Span line(int n) {
		return Programs.at("borrows.rs", n);
	}

	private EncodedProcedure encode(Body body, Map<String, ProcedureContract> contracts) {
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(body);
		return new ProcedureEncoder(false, contracts).encode(cfg, resolver.resolve(FunctionSpec.EMPTY, cfg));
	}

	private EncodedProcedure encode(Body body) {
		return encode(body, Collections.emptyMap());
	}

	private static String print(EncodedProcedure p) {
		return ViperFilePrinter.toString(new ViperFile(Arrays.<ViperFile.Decl>asList(p.getMethod())));
	}

	private static int occurrences(String text, String s) {
		int n = 0;
		for (int i = text.indexOf(s); i >= 0; i = text.indexOf(s, i + 1)) {
			n = n + 1;
		}
		return n;
	}

	private static void assertInOrder(String text, String... parts) {
		int from = 0;
		for (String s : parts) {
			int i = text.indexOf(s, from);
			assertTrue(i >= 0, "expected \"" + s + "\" after offset " + from + " in\n" + text);
			from = i + s.length();
		}
	}

	private static boolean describes(EncodedProcedure p, Obligation.Kind kind, String prefix) {
		for (Obligation o : p.getObligations()) {
			if (o.getKind() == kind && o.getDescription().startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	private static FunctionSig unit(String name, Ty... params) {
		String[] names = new String[params.length];
		for (int i = 0; i != params.length; ++i) {
			names[i] = "p" + i;
		}
		return new FunctionSig(name, Arrays.asList(names), Arrays.asList(params), Ty.UNIT, line(1));
	}

	@Test
	public void moveTransfersWholeStructure() {
		Ty pair = Ty.TUPLE(Programs.I32, Programs.I32);
		Body.Builder b = new Body.Builder(new FunctionSig("swap", Collections.singletonList("p"),
				Collections.singletonList(pair), pair, line(1)));
		int bb0 = b.block();
		b.assign(bb0, Place.local(0), Rvalue.USE(MOVE(Place.local(1))), line(2));
		b.terminate(bb0, Terminator.RETURN(line(3)));
		EncodedProcedure p = encode(b.build());
		String text = print(p);
		assertInOrder(text,
				"inhale acc(_0.tuple_0, write) && acc(_0.tuple_0.val_int, write) && acc(_0.tuple_1, write) && acc(_0.tuple_1.val_int, write)",
				"_0.tuple_0.val_int := _1.tuple_0.val_int",
				"_0.tuple_1.val_int := _1.tuple_1.val_int",
				"exhale acc(_1.tuple_1.val_int, write) && acc(_1.tuple_1, write) && acc(_1.tuple_0.val_int, write) && acc(_1.tuple_0, write)");
		assertTrue(describes(p, Obligation.Kind.PERMISSION, "move of _1"), p.getObligations().toString());
	}

	@Test
	public void sharedBorrowLendsHalfUntilItEnds() {
		Body.Builder b = new Body.Builder(unit("share"));
		int x = b.local("x", Programs.I32);
		int r = b.local("r", Ty.REF(Programs.I32));
		int bb0 = b.block();
		b.assign(bb0, Place.local(x), Rvalue.USE(INT(Programs.I32, 1)), line(2));
		b.assign(bb0, Place.local(r), Rvalue.SHARED_REF(0, Place.local(x)), line(3));
		b.endBorrow(bb0, 0);
		b.terminate(bb0, Terminator.RETURN(line(4)));
		EncodedProcedure p = encode(b.build());
		String text = print(p);
		assertInOrder(text,
				"inhale acc(_1.val_int, write)",
				"_1.val_int := 1",
				"inhale acc(_2.val_ref, write)",
				"_2.val_ref := _1",
				"exhale acc(_1.val_int, 1/2)",
				"inhale acc(_2.val_ref.val_int, 1/2)",
				"exhale acc(_2.val_ref.val_int, 1/2)",
				"inhale acc(_1.val_int, 1/2)");
		assertFalse(text.contains("label l$"), text);
		assertTrue(describes(p, Obligation.Kind.PERMISSION, "borrow of _1 might lack permission"));
		assertTrue(describes(p, Obligation.Kind.PERMISSION, "borrow of _1 might not be returned"));
	}

	@Test
	public void mutableBorrowLendsWriteAndReturnsValue() {
		Body.Builder b = new Body.Builder(unit("lend"));
		int x = b.local("x", Programs.I32);
		int m = b.local("m", Ty.MUTREF(Programs.I32));
		int bb0 = b.block();
		b.assign(bb0, Place.local(x), Rvalue.USE(INT(Programs.I32, 1)), line(2));
		b.assign(bb0, Place.local(m), Rvalue.MUT_REF(0, Place.local(x)), line(3));
		b.assign(bb0, Place.local(m).deref(), Rvalue.USE(INT(Programs.I32, 3)), line(4));
		b.endBorrow(bb0, 0);
		b.terminate(bb0, Terminator.RETURN(line(5)));
		EncodedProcedure p = encode(b.build());
		String text = print(p);
		assertInOrder(text,
				"label l$0",
				"exhale acc(_1.val_int, write)",
				"inhale acc(_2.val_ref.val_int, write) && ",
				"_2.val_ref.val_int == old[l$0](_1.val_int)",
				"_2.val_ref.val_int := 3",
				"label l$1",
				"exhale acc(_2.val_ref.val_int, write)",
				"inhale acc(_1.val_int, write) && ",
				"_1.val_int == old[l$1](_2.val_ref.val_int)");
		// The write through the reference uses what the borrow lent
		assertEquals(1, occurrences(text, "inhale acc(_2.val_ref.val_int, write)"), text);
		assertFalse(describes(p, Obligation.Kind.PERMISSION, "write through"));
	}

	@Test
	public void writeThroughSharedReferenceIsChecked() {
		Body.Builder b = new Body.Builder(unit("poke", Ty.REF(Programs.I32)));
		int bb0 = b.block();
		b.assign(bb0, Place.local(1).deref(), Rvalue.USE(INT(Programs.I32, 3)), line(2));
		b.terminate(bb0, Terminator.RETURN(line(3)));
		EncodedProcedure p = encode(b.build());
		String text = print(p);
		assertInOrder(text,
				"inhale acc(_1.val_ref, write) && acc(_1.val_ref.val_int, 1/2)",
				"assert acc(_1.val_ref.val_int, write)",
				"_1.val_ref.val_int := 3");
		assertFalse(text.contains("inhale acc(_1.val_ref.val_int, write)"), text);
		assertTrue(describes(p, Obligation.Kind.PERMISSION, "write through (*_1) might lack permission"),
				p.getObligations().toString());
	}

	@Test
	public void mutableArgumentIsLentToCallee() {
		FunctionSig inc = new FunctionSig("inc", Collections.singletonList("p"),
				Collections.<Ty>singletonList(Ty.MUTREF(Programs.I32)), Ty.UNIT, line(10));
		Map<String, ProcedureContract> contracts = new HashMap<>();
		contracts.put("inc", new ProcedureContract(inc, resolver.resolveContract(FunctionSpec.EMPTY, inc)));
		Body.Builder b = new Body.Builder(unit("caller"));
		int x = b.local("x", Programs.I32);
		int m = b.local("m", Ty.MUTREF(Programs.I32));
		int bb0 = b.block();
		int bb1 = b.block();
		b.assign(bb0, Place.local(x), Rvalue.USE(INT(Programs.I32, 1)), line(2));
		b.assign(bb0, Place.local(m), Rvalue.MUT_REF(0, Place.local(x)), line(3));
		b.terminate(bb0, Terminator.CALL("inc", Collections.singletonList(MOVE(Place.local(m))), Place.local(0), bb1,
				line(3)));
		b.endBorrow(bb1, 0);
		b.terminate(bb1, Terminator.RETURN(line(4)));
		EncodedProcedure p = encode(b.build(), contracts);
		String text = print(p);
		assertInOrder(text,
				"label call$bb0",
				"exhale acc(_2.val_ref.val_int, write)",
				"inhale acc(_2.val_ref.val_int, write)",
				"exhale acc(_2.val_ref.val_int, write)",
				"inhale acc(_1.val_int, write) && ");
		assertTrue(describes(p, Obligation.Kind.PRECONDITION, "insufficient permission to call inc"));
	}

	/**
	 * <pre>
	 * let mut x = 1;
	 * let r = &amp;x;
	 * if c {
	 *   // r ends
	 * }
	 * let m = &amp;mut x;
	 * *m = 3;
	 * </pre>
	 */
	@Test
	public void borrowLiveOnOneEdgeEndsBeforeJoin() {
		Body.Builder b = new Body.Builder(unit("join", Ty.BOOL));
		int x = b.local("x", Programs.I32);
		int r = b.local("r", Ty.REF(Programs.I32));
		int m = b.local("m", Ty.MUTREF(Programs.I32));
		int bb0 = b.block();
		int bb1 = b.block();
		int bb2 = b.block();
		int bb3 = b.block();
		b.assign(bb0, Place.local(x), Rvalue.USE(INT(Programs.I32, 1)), line(2));
		b.assign(bb0, Place.local(r), Rvalue.SHARED_REF(0, Place.local(x)), line(3));
		b.terminate(bb0, Terminator.IF(COPY(Place.local(1)), bb1, bb2, line(4)));
		b.endBorrow(bb1, 0);
		b.terminate(bb1, Terminator.GOTO(bb3, line(4)));
		b.terminate(bb2, Terminator.GOTO(bb3, line(4)));
		b.assign(bb3, Place.local(m), Rvalue.MUT_REF(1, Place.local(x)), line(5));
		b.assign(bb3, Place.local(m).deref(), Rvalue.USE(INT(Programs.I32, 3)), line(6));
		b.terminate(bb3, Terminator.RETURN(line(7)));
		EncodedProcedure p = encode(b.build());
		String text = print(p);
		assertEquals(1, occurrences(text, "exhale acc(_2.val_int, 1/2)"), text);
		// Once where the region ends, and once on the edge which skips that
		assertEquals(2, occurrences(text, "exhale acc(_3.val_ref.val_int, 1/2)"), text);
		assertEquals(2, occurrences(text, "inhale acc(_2.val_int, 1/2)"), text);
		// The full amount is lent after the join
		assertInOrder(text,
				"label bb3",
				"exhale acc(_2.val_int, write)",
				"inhale acc(_4.val_ref.val_int, write) && ",
				"_4.val_ref.val_int := 3");
		assertEquals(1, occurrences(text, "inhale acc(_4.val_ref.val_int, write)"), text);
		assertFalse(describes(p, Obligation.Kind.PERMISSION, "write through"));
	}

	@Test
	public void recursiveStructureIsUnfoldedAroundWrite() {
		EncodedProcedure p = encode(Programs.setHead(false));
		String text = print(p);
		assertInOrder(text,
				"acc(adt$Node(_1.val_ref), write)",
				"unfold acc(adt$Node(_1.val_ref), write)",
				"_1.val_ref.f$Node$val.val_int := 3",
				"fold acc(adt$Node(_1.val_ref), write)");
		assertEquals(1, occurrences(text, "unfold "), text);
		assertFalse(describes(p, Obligation.Kind.PERMISSION, "write through"));
		assertTrue(p.getPredicates().get("adt$Node") != null, p.getPredicates().toString());
	}

	@Test
	public void nestedStructureIsUnfoldedLevelByLevel() {
		EncodedProcedure p = encode(Programs.setHead(true));
		String text = print(p);
		assertInOrder(text,
				"unfold acc(adt$Node(_1.val_ref), write)",
				"unfold acc(adt$Node(_1.val_ref.f$Node$next.val_ref), write)",
				"_1.val_ref.f$Node$next.val_ref.f$Node$val.val_int := 3",
				"fold acc(adt$Node(_1.val_ref.f$Node$next.val_ref), write)",
				"fold acc(adt$Node(_1.val_ref), write)");
		assertFalse(describes(p, Obligation.Kind.PERMISSION, "write through"));
	}
}
