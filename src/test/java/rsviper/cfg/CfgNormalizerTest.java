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
package rsviper.cfg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static rsviper.mir.Operand.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;
import rsviper.lang.Ty;
import rsviper.mir.AssertKind;
import rsviper.mir.BinOp;
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.PanicCause;
import rsviper.mir.Rvalue;
import rsviper.mir.Statement;
import rsviper.mir.Terminator;

public class CfgNormalizerTest {
	private static final Span SPAN = new Span("test.rs", 1, 1);

	private static Body.Builder function(String name) {
		return new Body.Builder(new FunctionSig(name, Collections.singletonList("x"),
				Collections.singletonList(Programs.I32), Programs.I32, SPAN));
	}

	@Test
	public void chainsCollapseIntoOneBlock() {
		Body.Builder b = function("chain");
		int bb0 = b.block();
		int bb1 = b.block();
		int bb2 = b.block();
		b.assign(bb0, Place.local(0), Rvalue.USE(COPY(Place.local(1))), SPAN);
		b.terminate(bb0, Terminator.GOTO(bb1, SPAN));
		b.add(bb1, Statement.NOP(SPAN));
		b.terminate(bb1, Terminator.GOTO(bb2, SPAN));
		b.terminate(bb2, Terminator.RETURN(SPAN));
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(b.build());
		assertEquals(Arrays.asList(0), cfg.getReversePostOrder());
		NormalizedCfg.Block entry = cfg.getBlock(0);
		assertEquals(1, entry.getStatements().size());
		assertEquals(NormalizedCfg.Stmt.Kind.ASSIGN, entry.getStatements().get(0).getKind());
		assertEquals(NormalizedCfg.Terminator.Kind.RETURN, entry.getTerminator().getKind());
		assertFalse(cfg.contains(1));
		assertFalse(cfg.contains(2));
		assertTrue(cfg.getLoops().isEmpty());
	}

	@Test
	public void unreachableBlocksArePruned() {
		Body.Builder b = function("dead");
		int bb0 = b.block();
		int bb1 = b.block();
		b.terminate(bb0, Terminator.RETURN(SPAN));
		b.terminate(bb1, Terminator.PANIC(PanicCause.PANIC, SPAN));
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(b.build());
		assertFalse(cfg.contains(bb1));
		assertTrue(cfg.getSpans().getGoals().isEmpty());
	}

	@Test
	public void loopIsFoundWithItsLatch() {
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(Programs.sum());
		assertEquals(1, cfg.getLoops().size());
		Loop loop = cfg.getLoop(Programs.SUM_HEAD);
		assertEquals(Arrays.asList(4), loop.getLatches());
		assertEquals(Arrays.asList(1, 2, 4), Arrays.asList(loop.getBlocks().toArray()));
		assertTrue(cfg.isBackEdge(4, 1));
		assertEquals(Arrays.asList(0), cfg.getForwardPredecessors(1));
		assertTrue(cfg.getDominators().dominates(1, 4));
		assertEquals(0, (int) cfg.getReversePostOrder().get(0));
		assertEquals(1, (int) cfg.getReversePostOrder().get(1));
	}

	@Test
	public void goalsAreCollectedFromRuntimeChecks() {
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(Programs.sum());
		List<Goal> goals = cfg.getSpans().getGoals();
		assertEquals(1, goals.size());
		assertEquals(Goal.Kind.ASSERTION, goals.get(0).getKind());
		assertEquals(AssertKind.BOUNDS_CHECK, goals.get(0).getAssertKind());
		assertEquals("assertion might fail with \"index out of bounds\"", goals.get(0).getDescription());
		assertEquals(5, goals.get(0).getSpan().getLine());
	}

	@Test
	public void panicsBecomeGoals() {
		Body.Builder b = function("boom");
		int bb0 = b.block();
		int bb1 = b.block();
		int bb2 = b.block();
		b.terminate(bb0, Terminator.IF(BOOL(true), bb1, bb2, SPAN));
		b.terminate(bb1, Terminator.PANIC(PanicCause.ASSERT, SPAN));
		b.terminate(bb2, Terminator.UNREACHABLE(SPAN));
		List<Goal> goals = new CfgNormalizer(false).normalize(b.build()).getSpans().getGoals();
		assertEquals(2, goals.size());
		assertEquals("the asserted expression might not hold", goals.get(0).getDescription());
		assertEquals("unreachable code might be reachable", goals.get(1).getDescription());
	}

	@Test
	public void overflowChecksFollowConfiguration() {
		Body.Builder b = function("inc");
		int bb0 = b.block();
		int bb1 = b.block();
		int bb2 = b.block();
		b.assign(bb0, Place.local(0), Rvalue.CHECKED(BinOp.ADD, COPY(Place.local(1)), INT(Programs.I32, 1)), SPAN);
		b.terminate(bb0, Terminator.ASSERT(BOOL(false), false, AssertKind.OVERFLOW, "attempt to add with overflow",
				bb1, SPAN));
		b.assign(bb1, Place.local(0), Rvalue.USE(COPY(Place.local(1))), SPAN);
		b.terminate(bb1, Terminator.GOTO(bb2, SPAN));
		b.terminate(bb2, Terminator.RETURN(SPAN));
		Body body = b.build();
		NormalizedCfg unchecked = new CfgNormalizer(false).normalize(body);
		assertTrue(unchecked.getSpans().getGoals().isEmpty());
		// Without the assertion, the whole function is a single block
		assertEquals(Arrays.asList(0), unchecked.getReversePostOrder());
		NormalizedCfg checked = new CfgNormalizer(true).normalize(body);
		List<Goal> goals = checked.getSpans().getGoals();
		assertEquals(2, goals.size());
		for (Goal g : goals) {
			assertEquals(Goal.Kind.OVERFLOW, g.getKind());
			assertEquals("assertion might fail with \"attempt to add with overflow\"", g.getDescription());
		}
		assertEquals(NormalizedCfg.Stmt.Kind.OVERFLOW_GOAL, checked.getBlock(0).getStatements().get(0).getKind());
	}

	@Test
	public void regionEndsBecomeExpiries() {
		Body.Builder b = function("expiry");
		int r = b.local("r", Ty.REF(Programs.I32));
		int bb0 = b.block();
		b.assign(bb0, Place.local(r), Rvalue.SHARED_REF(7, Place.local(1)), SPAN);
		b.endBorrow(bb0, 7);
		b.terminate(bb0, Terminator.RETURN(SPAN));
		List<NormalizedCfg.Stmt> stmts = new CfgNormalizer(false).normalize(b.build()).getBlock(0).getStatements();
		assertEquals(2, stmts.size());
		NormalizedCfg.Stmt.ExpireBorrows e = (NormalizedCfg.Stmt.ExpireBorrows) stmts.get(1);
		assertEquals(Arrays.asList(7), e.getBorrows());
	}

	@Test
	public void dropContinuesToItsTarget() {
		Body.Builder b = function("drop");
		int bb0 = b.block();
		int bb1 = b.block();
		b.terminate(bb0, Terminator.DROP(Place.local(1), bb1, SPAN));
		b.terminate(bb1, Terminator.RETURN(SPAN));
		NormalizedCfg cfg = new CfgNormalizer(false).normalize(b.build());
		NormalizedCfg.Block entry = cfg.getBlock(0);
		assertEquals(NormalizedCfg.Stmt.Kind.DROP, entry.getStatements().get(0).getKind());
		assertEquals(NormalizedCfg.Terminator.Kind.RETURN, entry.getTerminator().getKind());
	}

	@Test
	public void irreducibleLoopIsRejected() {
		Body.Builder b = function("irreducible");
		int bb0 = b.block();
		int bb1 = b.block();
		int bb2 = b.block();
		b.terminate(bb0, Terminator.IF(COPY(Place.local(1)), bb1, bb2, SPAN));
		b.assign(bb1, Place.local(0), Rvalue.USE(INT(Programs.I32, 1)), SPAN);
		b.terminate(bb1, Terminator.GOTO(bb2, SPAN));
		b.assign(bb2, Place.local(0), Rvalue.USE(INT(Programs.I32, 2)), SPAN);
		b.terminate(bb2, Terminator.GOTO(bb1, SPAN));
		StructuralException e = assertThrows(StructuralException.class,
				() -> new CfgNormalizer(false).normalize(b.build()));
		assertEquals(StructuralException.Kind.MALFORMED_LOOP, e.getKind());
	}

	@Test
	public void jumpToMissingBlockIsRejected() {
		Body.Builder b = function("missing");
		int bb0 = b.block();
		b.terminate(bb0, Terminator.GOTO(5, SPAN));
		StructuralException e = assertThrows(StructuralException.class,
				() -> new CfgNormalizer(false).normalize(b.build()));
		assertEquals(StructuralException.Kind.MISSING_BLOCK, e.getKind());
	}

	@Test
	public void emptyBodyIsRejected() {
		Body empty = function("empty").build();
		StructuralException e = assertThrows(StructuralException.class, () -> new CfgNormalizer(false).normalize(empty));
		assertEquals(StructuralException.Kind.INVALID_INPUT, e.getKind());
	}
}
