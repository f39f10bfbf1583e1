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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static rsviper.spec.SpecExpr.*;

import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.cfg.CfgNormalizer;
import rsviper.cfg.NormalizedCfg;
import rsviper.lang.Span;
import rsviper.lang.SpecificationError;

public class SpecificationResolverTest {
	private static final Span SPAN = new Span("spec.rs", 4, 9);

	private final SpecificationResolver resolver = new SpecificationResolver();

	private static NormalizedCfg divide() {
		return new CfgNormalizer(false).normalize(Programs.divide());
	}

	private SpecificationError reject(FunctionSpec spec) {
		return assertThrows(SpecificationError.class, () -> resolver.resolve(spec, divide()));
	}

	@Test
	public void preconditionOverParameters() {
		ResolvedSpec r = resolver.resolve(Programs.divideSpec(true), divide());
		assertEquals(1, r.getRequires().size());
		assertEquals(0, r.getEnsures().size());
		assertEquals(1, r.getRequires().get(0).getSpan().getLine());
	}

	@Test
	public void loopInvariantsAreAttachedToTheirHead() {
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(Programs.sum());
		ResolvedSpec r = resolver.resolve(Programs.sumSpec(true), cfg);
		assertEquals(2, r.getInvariant(Programs.SUM_HEAD).size());
		assertEquals(1, r.getEnsures().size());
	}

	@Test
	public void parameterIsReadOnEntryInPostcondition() {
		FunctionSpec spec = FunctionSpec.builder().ensures(EQ(RESULT(), ADD(VAR("a"), OLD(VAR("a"))))).build();
		ResolvedSpec r = resolver.resolve(spec, divide());
		assertEquals(1, r.getSnapshots().size());
	}

	@Test
	public void unknownNameIsRejected() {
		SpecificationError e = reject(FunctionSpec.builder().requires(GT(VAR("c").at(SPAN), INT(0))).build());
		assertEquals(SpecificationError.Kind.UNRESOLVED_REFERENCE, e.getKind());
		assertEquals(SPAN, e.getSpan());
	}

	@Test
	public void resultOutsidePostconditionIsRejected() {
		SpecificationError e = reject(FunctionSpec.builder().requires(GT(RESULT(), INT(0))).build());
		assertEquals(SpecificationError.Kind.UNRESOLVED_REFERENCE, e.getKind());
	}

	@Test
	public void nonBooleanClauseIsRejected() {
		SpecificationError e = reject(FunctionSpec.builder().requires(VAR("b")).build());
		assertEquals(SpecificationError.Kind.TYPE_MISMATCH, e.getKind());
	}

	@Test
	public void mixedOperandsAreRejected() {
		SpecificationError e = reject(FunctionSpec.builder().requires(AND(VAR("a"), BOOL(true))).build());
		assertEquals(SpecificationError.Kind.TYPE_MISMATCH, e.getKind());
	}

	@Test
	public void invariantOutsideLoopIsRejected() {
		SpecificationError e = reject(FunctionSpec.builder().invariant(0, BOOL(true).at(SPAN)).build());
		assertEquals(SpecificationError.Kind.UNRESOLVED_REFERENCE, e.getKind());
	}

	@Test
	public void quantifiedVariableInsideOldIsRejected() {
		SpecExpr body = IMPLIES(GT(VAR("k"), INT(0)), GT(OLD(VAR("k")), INT(0)));
		SpecificationError e = reject(FunctionSpec.builder().ensures(FORALL("k", body)).build());
		assertEquals(SpecificationError.Kind.UNRESOLVED_REFERENCE, e.getKind());
	}

	@Test
	public void contractCannotMentionLoops() {
		FunctionSpec spec = FunctionSpec.builder().invariant(1, BOOL(true)).build();
		assertThrows(SpecificationError.class,
				() -> resolver.resolveContract(spec, Programs.divide().getSignature()));
	}
}
