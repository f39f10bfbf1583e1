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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import rsviper.cfg.NormalizedCfg.Block;
import rsviper.cfg.NormalizedCfg.Edge;
import rsviper.cfg.NormalizedCfg.Stmt;
import rsviper.cfg.NormalizedCfg.Terminator;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;
import rsviper.lang.Ty;
import rsviper.mir.BasicBlock;
import rsviper.mir.Body;
import rsviper.mir.BorrowFacts;
import rsviper.mir.Location;
import rsviper.mir.Rvalue;
import rsviper.mir.Statement;

/**
 * Turns a host body into a {@link NormalizedCfg}. This makes every goal and
 * region end explicit, bypasses and merges trivial blocks, and identifies
 * the loop structure. Bodies whose loops are not reducible are rejected.
 *
 * @author The Rust2Viper Project Developers
 */
public class CfgNormalizer {
	private static final Logger logger = LoggerFactory.getLogger(CfgNormalizer.class);

	/**
	 * Determines whether overflow goals are generated for checked arithmetic,
	 * and whether host overflow assertions are kept.
	 */
	private final boolean checkOverflow;

	public CfgNormalizer(boolean checkOverflow) {
		this.checkOverflow = checkOverflow;
	}

	public NormalizedCfg normalize(Body body) {
		int n = body.getBlocks().size();
		if (n == 0) {
			throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
					"body of " + body.getName() + " has no blocks", body.getSignature().getSpan());
		}
		checkBorrowFacts(body);
		ArrayList<Block> arena = new ArrayList<>();
		for (BasicBlock bb : body.getBlocks()) {
			arena.add(lower(body, bb));
		}
		checkTargets(body, arena);
		prune(arena);
		bypassEmptyBlocks(arena, findBackEdges(arena));
		prune(arena);
		mergeChains(arena, findBackEdges(arena));
		prune(arena);
		// Compute final structure
		List<ImmutableList<Integer>> preds = predecessors(arena);
		Set<Edge> backEdges = findBackEdges(arena);
		List<Integer> rpo = reversePostOrder(arena, backEdges);
		Dominators doms = Dominators.compute(arena.size(), rpo, preds);
		ImmutableSortedMap<Integer, Loop> loops = findLoops(body, arena, preds, backEdges, doms);
		SpanTable spans = buildSpanTable(body, arena, rpo);
		logger.debug("normalized {}: {} blocks, {} loops", body.getName(), rpo.size(), loops.size());
		return new NormalizedCfg(body, arena, rpo, preds, backEdges, doms, loops, spans);
	}

	// =========================================================================
	// Lowering
	// =========================================================================

	private Block lower(Body body, BasicBlock bb) {
		BorrowFacts facts = body.getBorrowFacts();
		ArrayList<Stmt> stmts = new ArrayList<>();
		List<Statement> statements = bb.getStatements();
		for (int i = 0; i != statements.size(); ++i) {
			Statement s = statements.get(i);
			expire(facts, new Location(bb.getId(), i), s.getSpan(), stmts);
			lower(body, s, stmts);
		}
		rsviper.mir.Terminator t = bb.getTerminator();
		expire(facts, new Location(bb.getId(), statements.size()), t.getSpan(), stmts);
		return new Block(bb.getId(), stmts, lower(t, stmts));
	}

	private void expire(BorrowFacts facts, Location location, Span span, List<Stmt> stmts) {
		List<Integer> ends = facts.getRegionEnds(location);
		if (!ends.isEmpty()) {
			stmts.add(new Stmt.ExpireBorrows(ends, span));
		}
	}

	private void lower(Body body, Statement s, List<Stmt> stmts) {
		switch (s.getKind()) {
		case ASSIGN: {
			Statement.Assign a = (Statement.Assign) s;
			Rvalue rv = a.getRvalue();
			if (checkOverflow && rv instanceof Rvalue.Binary) {
				Rvalue.Binary b = (Rvalue.Binary) rv;
				Ty type = body.typeOf(a.getPlace());
				if (b.isChecked() && b.getOp().isArithmetic() && type instanceof Ty.Int) {
					Goal goal = Goal.OVERFLOW(b.getOp().getOverflowMessage(), s.getSpan());
					stmts.add(new Stmt.OverflowGoal(goal, b, ((Ty.Int) type).getIntKind()));
				}
			}
			stmts.add(new Stmt.Assign(a.getPlace(), rv, s.getSpan()));
			break;
		}
		case STORAGE_LIVE:
			stmts.add(new Stmt.StorageLive(((Statement.StorageLive) s).getLocal(), s.getSpan()));
			break;
		case STORAGE_DEAD:
			stmts.add(new Stmt.StorageDead(((Statement.StorageDead) s).getLocal(), s.getSpan()));
			break;
		case NOP:
			break;
		}
	}

	private Terminator lower(rsviper.mir.Terminator t, List<Stmt> stmts) {
		Span span = t.getSpan();
		switch (t.getKind()) {
		case GOTO:
			return new Terminator.Goto(((rsviper.mir.Terminator.Goto) t).getTarget(), span);
		case SWITCH_INT: {
			rsviper.mir.Terminator.SwitchInt s = (rsviper.mir.Terminator.SwitchInt) t;
			ArrayList<Terminator.Case> cases = new ArrayList<>();
			for (int i = 0; i != s.getValues().size(); ++i) {
				cases.add(new Terminator.Case(s.getValues().get(i), s.getTargets().get(i)));
			}
			return new Terminator.Branch(s.getDiscriminant(), cases, s.getOtherwise(), span);
		}
		case CALL: {
			rsviper.mir.Terminator.Call c = (rsviper.mir.Terminator.Call) t;
			return new Terminator.Call(c.getCallee(), c.getArguments(), c.getDestination(), c.getTarget(), span);
		}
		case RETURN:
			return new Terminator.Return(span);
		case PANIC:
			return new Terminator.PanicGoal(Goal.PANIC(((rsviper.mir.Terminator.Panic) t).getCause(), span));
		case ABORT:
			return new Terminator.PanicGoal(Goal.ABORT(span));
		case UNREACHABLE:
			return new Terminator.PanicGoal(Goal.UNREACHABLE(span));
		case ASSERT: {
			rsviper.mir.Terminator.Assert a = (rsviper.mir.Terminator.Assert) t;
			if (!checkOverflow && a.getAssertKind() == rsviper.mir.AssertKind.OVERFLOW) {
				return new Terminator.Goto(a.getTarget(), span);
			}
			Goal goal = Goal.ASSERTION(a.getAssertKind(), a.getMessage(), span);
			return new Terminator.AssertGoal(goal, a.getCondition(), a.getExpected(), a.getTarget());
		}
		case DROP: {
			rsviper.mir.Terminator.Drop d = (rsviper.mir.Terminator.Drop) t;
			stmts.add(new Stmt.Drop(d.getPlace(), span));
			return new Terminator.Goto(d.getTarget(), span);
		}
		default:
			throw new IllegalArgumentException("unknown terminator: " + t);
		}
	}

	private void checkBorrowFacts(Body body) {
		for (Location l : body.getBorrowFacts().getAll().keySet()) {
			BasicBlock bb = body.getBlock(l.getBlock());
			if (l.getStatement() < 0 || l.getStatement() > bb.getStatements().size()) {
				throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
						"region end at invalid location " + l + " in " + body.getName(), body.getSignature().getSpan());
			}
		}
	}

	private void checkTargets(Body body, List<Block> arena) {
		for (Block b : arena) {
			for (int s : b.getTerminator().getSuccessors()) {
				if (s < 0 || s >= arena.size()) {
					throw new StructuralException(StructuralException.Kind.MISSING_BLOCK,
							"bb" + b.getId() + " of " + body.getName() + " jumps to missing block bb" + s,
							b.getTerminator().getSpan());
				}
			}
		}
	}

	// =========================================================================
	// Simplification
	// =========================================================================

	/**
	 * Remove every block which cannot be reached from the entry.
	 */
	private static void prune(List<Block> arena) {
		boolean[] reached = new boolean[arena.size()];
		ArrayDeque<Integer> worklist = new ArrayDeque<>();
		worklist.push(0);
		reached[0] = true;
		while (!worklist.isEmpty()) {
			Block b = arena.get(worklist.pop());
			for (int s : b.getTerminator().getSuccessors()) {
				if (!reached[s]) {
					reached[s] = true;
					worklist.push(s);
				}
			}
		}
		for (int i = 0; i != arena.size(); ++i) {
			if (!reached[i]) {
				arena.set(i, null);
			}
		}
	}

	/**
	 * Send every jump to an empty block which only jumps on straight to the
	 * block it jumps to. The entry and loop heads are never bypassed, and
	 * neither is a block whose own jump closes a loop.
	 */
	private static void bypassEmptyBlocks(List<Block> arena, Set<Edge> backEdges) {
		Set<Integer> heads = new HashSet<>();
		for (Edge e : backEdges) {
			heads.add(e.getTo());
		}
		for (int i = 1; i < arena.size(); ++i) {
			Block b = arena.get(i);
			if (b == null || !b.getStatements().isEmpty() || !(b.getTerminator() instanceof Terminator.Goto)
					|| heads.contains(i)) {
				continue;
			}
			int target = ((Terminator.Goto) b.getTerminator()).getTarget();
			if (target == i || backEdges.contains(new Edge(i, target))) {
				continue;
			}
			for (int j = 0; j != arena.size(); ++j) {
				Block p = arena.get(j);
				if (p != null && j != i && p.getTerminator().getSuccessors().contains(i)) {
					arena.set(j, new Block(j, p.getStatements(), p.getTerminator().retarget(i, target)));
				}
			}
		}
	}

	/**
	 * Append every block which is the sole successor of a goto from its sole
	 * predecessor to that predecessor. Loop heads are never merged.
	 */
	private static void mergeChains(List<Block> arena, Set<Edge> backEdges) {
		Set<Integer> heads = new HashSet<>();
		for (Edge e : backEdges) {
			heads.add(e.getTo());
		}
		boolean changed = true;
		while (changed) {
			changed = false;
			List<ImmutableList<Integer>> preds = predecessors(arena);
			for (int i = 0; i != arena.size(); ++i) {
				Block b = arena.get(i);
				if (b == null || !(b.getTerminator() instanceof Terminator.Goto)) {
					continue;
				}
				int target = ((Terminator.Goto) b.getTerminator()).getTarget();
				if (target == 0 || target == i || heads.contains(target) || preds.get(target).size() != 1) {
					continue;
				}
				Block c = arena.get(target);
				ArrayList<Stmt> stmts = new ArrayList<>(b.getStatements());
				stmts.addAll(c.getStatements());
				arena.set(i, new Block(i, stmts, c.getTerminator()));
				arena.set(target, null);
				changed = true;
				break;
			}
		}
	}

	// =========================================================================
	// Structure
	// =========================================================================

	private static List<ImmutableList<Integer>> predecessors(List<Block> arena) {
		ArrayList<List<Integer>> preds = new ArrayList<>();
		for (int i = 0; i != arena.size(); ++i) {
			preds.add(new ArrayList<>());
		}
		for (Block b : arena) {
			if (b != null) {
				for (int s : new TreeSet<>(b.getTerminator().getSuccessors())) {
					preds.get(s).add(b.getId());
				}
			}
		}
		ArrayList<ImmutableList<Integer>> r = new ArrayList<>();
		for (List<Integer> p : preds) {
			r.add(ImmutableList.copyOf(p));
		}
		return r;
	}

	/**
	 * Identify the retreating edges of a depth-first traversal from the
	 * entry. Successors are visited in terminator order, so the result is
	 * deterministic.
	 */
	private static Set<Edge> findBackEdges(List<Block> arena) {
		HashSet<Edge> r = new HashSet<>();
		// 0 = unvisited, 1 = on stack, 2 = finished
		int[] state = new int[arena.size()];
		ArrayDeque<int[]> stack = new ArrayDeque<>();
		stack.push(new int[] { 0, 0 });
		state[0] = 1;
		while (!stack.isEmpty()) {
			int[] top = stack.peek();
			List<Integer> succs = arena.get(top[0]).getTerminator().getSuccessors();
			if (top[1] < succs.size()) {
				int s = succs.get(top[1]++);
				if (state[s] == 0) {
					state[s] = 1;
					stack.push(new int[] { s, 0 });
				} else if (state[s] == 1) {
					r.add(new Edge(top[0], s));
				}
			} else {
				state[top[0]] = 2;
				stack.pop();
			}
		}
		return r;
	}

	private static List<Integer> reversePostOrder(List<Block> arena, Set<Edge> backEdges) {
		ArrayList<Integer> postorder = new ArrayList<>();
		boolean[] visited = new boolean[arena.size()];
		ArrayDeque<int[]> stack = new ArrayDeque<>();
		stack.push(new int[] { 0, 0 });
		visited[0] = true;
		while (!stack.isEmpty()) {
			int[] top = stack.peek();
			List<Integer> succs = arena.get(top[0]).getTerminator().getSuccessors();
			if (top[1] < succs.size()) {
				int s = succs.get(top[1]++);
				if (!visited[s] && !backEdges.contains(new Edge(top[0], s))) {
					visited[s] = true;
					stack.push(new int[] { s, 0 });
				}
			} else {
				postorder.add(top[0]);
				stack.pop();
			}
		}
		Collections.reverse(postorder);
		return postorder;
	}

	private static ImmutableSortedMap<Integer, Loop> findLoops(Body body, List<Block> arena,
			List<ImmutableList<Integer>> preds, Set<Edge> backEdges, Dominators doms) {
		TreeMap<Integer, List<Integer>> latches = new TreeMap<>();
		for (Edge e : backEdges) {
			if (!doms.dominates(e.getTo(), e.getFrom())) {
				throw new StructuralException(StructuralException.Kind.MALFORMED_LOOP,
						"irreducible control flow in " + body.getName() + ": " + e + " does not close a loop",
						arena.get(e.getFrom()).getTerminator().getSpan());
			}
			latches.computeIfAbsent(e.getTo(), k -> new ArrayList<>()).add(e.getFrom());
		}
		ImmutableSortedMap.Builder<Integer, Loop> r = ImmutableSortedMap.naturalOrder();
		for (Map.Entry<Integer, List<Integer>> e : latches.entrySet()) {
			int head = e.getKey();
			TreeSet<Integer> blocks = new TreeSet<>();
			blocks.add(head);
			ArrayDeque<Integer> worklist = new ArrayDeque<>();
			for (int latch : e.getValue()) {
				if (blocks.add(latch)) {
					worklist.push(latch);
				}
			}
			while (!worklist.isEmpty()) {
				for (int p : preds.get(worklist.pop())) {
					if (blocks.add(p)) {
						worklist.push(p);
					}
				}
			}
			r.put(head, new Loop(head, blocks, e.getValue()));
		}
		return r.build();
	}

	private static SpanTable buildSpanTable(Body body, List<Block> arena, List<Integer> rpo) {
		TreeMap<Integer, Span> spans = new TreeMap<>();
		ArrayList<Goal> goals = new ArrayList<>();
		for (int id : rpo) {
			Block b = arena.get(id);
			spans.put(id, b.getSpan());
			for (Stmt s : b.getStatements()) {
				if (s instanceof Stmt.OverflowGoal) {
					goals.add(((Stmt.OverflowGoal) s).getGoal());
				}
			}
			Terminator t = b.getTerminator();
			if (t instanceof Terminator.AssertGoal) {
				goals.add(((Terminator.AssertGoal) t).getGoal());
			} else if (t instanceof Terminator.PanicGoal) {
				goals.add(((Terminator.PanicGoal) t).getGoal());
			}
		}
		return new SpanTable(body.getSignature().getSpan(), spans, goals);
	}
}
