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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.cfg.CfgNormalizer;
import rsviper.cfg.NormalizedCfg;
import rsviper.core.ViperFile;
import rsviper.io.ViperFilePrinter;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;
import rsviper.lang.Ty;
import rsviper.lang.UnsupportedException;
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.Terminator;
import rsviper.spec.FunctionSpec;
import rsviper.spec.SpecificationResolver;

public class ProcedureEncoderTest {
	private final SpecificationResolver resolver = new SpecificationResolver();

	private EncodedProcedure encode(Body body, FunctionSpec spec, Map<String, ProcedureContract> contracts) {
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(body);
		return new ProcedureEncoder(false, contracts).encode(cfg, resolver.resolve(spec, cfg));
	}

	private EncodedProcedure encode(Body body, FunctionSpec spec) {
		return encode(body, spec, Collections.emptyMap());
	}

	private static String print(EncodedProcedure p) {
		return ViperFilePrinter.toString(new ViperFile(Arrays.<ViperFile.Decl>asList(p.getMethod())));
	}

	private static int count(EncodedProcedure p, Obligation.Kind kind) {
		int n = 0;
		for (Obligation o : p.getObligations()) {
			if (o.getKind() == kind) {
				n = n + 1;
			}
		}
		return n;
	}

	private static Obligation first(EncodedProcedure p, Obligation.Kind kind) {
		for (Obligation o : p.getObligations()) {
			if (o.getKind() == kind) {
				return o;
			}
		}
		throw new AssertionError("no " + kind + " obligation in " + p.getObligations());
	}

	private Map<String, ProcedureContract> divideContract() {
		FunctionSig sig = Programs.divide().getSignature();
		Map<String, ProcedureContract> contracts = new HashMap<>();
		contracts.put("divide", new ProcedureContract(sig, resolver.resolveContract(Programs.divideSpec(true), sig)));
		return contracts;
	}

	@Test
	public void divisionIsGuardedByRuntimeCheck() {
		EncodedProcedure p = encode(Programs.divide(), Programs.divideSpec(false));
		assertEquals("divide", p.getName());
		assertEquals("m$divide", p.getMethod().getName());
		Obligation o = first(p, Obligation.Kind.PANIC_FREEDOM);
		assertEquals("assertion might fail with \"attempt to divide by zero\"", o.getDescription());
		assertEquals(2, o.getSpan().getLine());
		assertEquals(1, count(p, Obligation.Kind.PANIC_FREEDOM));
		String text = print(p);
		assertTrue(text.contains("method m$divide()"), text);
		assertTrue(text.contains("assert _3.val_bool"), text);
		assertTrue(text.contains("div$trunc(_1.val_int, _2.val_int)"), text);
		assertTrue(text.contains("arg$b := _2.val_int"), text);
		assertTrue(text.contains("label " + ProcedureEncoder.END), text);
		assertTrue(p.getIntKinds().isEmpty());
	}

	@Test
	public void preconditionIsInhaled() {
		String text = print(encode(Programs.divide(), Programs.divideSpec(true)));
		assertTrue(text.contains("inhale _2.val_int != 0"), text);
	}

	@Test
	public void obligationsAreNumberedInOrder() {
		List<Obligation> obligations = encode(Programs.sum(), Programs.sumSpec(true)).getObligations();
		for (int i = 0; i != obligations.size(); ++i) {
			assertEquals(i, obligations.get(i).getId());
			assertEquals("sum", obligations.get(i).getFunction());
		}
	}

	@Test
	public void loopInvariantIsCheckedOnEntryAndPreserved() {
		EncodedProcedure p = encode(Programs.sum(), Programs.sumSpec(true));
		assertEquals(2, count(p, Obligation.Kind.LOOP_INVARIANT_ENTRY));
		assertEquals(2, count(p, Obligation.Kind.LOOP_INVARIANT_PRESERVATION));
		assertEquals("postcondition might not hold.", first(p, Obligation.Kind.POSTCONDITION).getDescription());
		assertEquals("assertion might fail with \"index out of bounds\"",
				first(p, Obligation.Kind.PANIC_FREEDOM).getDescription());
		String text = print(p);
		assertTrue(text.contains("seq_sum("), text);
		assertTrue(text.contains("label bb1"), text);
	}

	@Test
	public void loopWithoutInvariantHasNoInvariantObligations() {
		EncodedProcedure p = encode(Programs.sum(), Programs.sumSpec(false));
		assertEquals(0, count(p, Obligation.Kind.LOOP_INVARIANT_ENTRY));
		assertEquals(0, count(p, Obligation.Kind.LOOP_INVARIANT_PRESERVATION));
	}

	@Test
	public void callAssertsCalleePrecondition() {
		EncodedProcedure p = encode(Programs.half(2), FunctionSpec.EMPTY, divideContract());
		Obligation o = first(p, Obligation.Kind.PRECONDITION);
		assertEquals("precondition of divide might not hold.", o.getDescription());
		assertEquals(2, o.getSpan().getLine());
		String text = print(p);
		assertTrue(text.contains("label call$bb0"), text);
		assertTrue(text.contains("assert 2 != 0"), text);
	}

	@Test
	public void callToUnknownFunctionIsRejected() {
		StructuralException e = assertThrows(StructuralException.class,
				() -> encode(Programs.half(2), FunctionSpec.EMPTY));
		assertEquals(StructuralException.Kind.MISSING_CALLEE, e.getKind());
	}

	@Test
	public void referenceResultIsUnsupported() {
		Ty ref = Ty.REF(Programs.I32);
		Span span = new Span("id.rs", 1, 1);
		Body.Builder b = new Body.Builder(new FunctionSig("id", Collections.singletonList("x"),
				Collections.singletonList(ref), ref, span));
		int bb0 = b.block();
		b.terminate(bb0, Terminator.RETURN(span));
		assertThrows(UnsupportedException.class, () -> encode(b.build(), FunctionSpec.EMPTY));
	}

	@Test
	public void encodingIsDeterministic() {
		assertEquals(print(encode(Programs.sum(), Programs.sumSpec(true))),
				print(encode(Programs.sum(), Programs.sumSpec(true))));
	}
}
