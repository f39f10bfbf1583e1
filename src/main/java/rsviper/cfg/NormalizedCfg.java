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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;

import rsviper.lang.IntKind;
import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;
import rsviper.mir.Body;
import rsviper.mir.Operand;
import rsviper.mir.Rvalue;

/**
 * A function body after normalisation. Blocks live in an arena indexed by
 * their host block id; blocks which were merged away or are unreachable leave
 * a <code>null</code> slot behind. Every panic, abort, unreachable and runtime
 * check is an explicit goal, region ends are explicit statements, and the
 * loop structure (back edges, dominators and natural loops) is computed once
 * and cached here.
 *
 * @author The Rust2Viper Project Developers
 */
public final class NormalizedCfg {
	private final Body body;
	private final List<Block> blocks;
	private final ImmutableList<Integer> reversePostOrder;
	private final ImmutableList<ImmutableList<Integer>> predecessors;
	private final ImmutableSet<Edge> backEdges;
	private final Dominators dominators;
	private final ImmutableSortedMap<Integer, Loop> loops;
	private final SpanTable spans;

	NormalizedCfg(Body body, List<Block> blocks, List<Integer> reversePostOrder,
			List<ImmutableList<Integer>> predecessors, Collection<Edge> backEdges, Dominators dominators,
			ImmutableSortedMap<Integer, Loop> loops, SpanTable spans) {
		this.body = body;
		this.blocks = new ArrayList<>(blocks);
		this.reversePostOrder = ImmutableList.copyOf(reversePostOrder);
		this.predecessors = ImmutableList.copyOf(predecessors);
		this.backEdges = ImmutableSet.copyOf(backEdges);
		this.dominators = dominators;
		this.loops = loops;
		this.spans = spans;
	}

	public Body getBody() {
		return body;
	}

	public int getEntry() {
		return 0;
	}

	/**
	 * Get the size of the block arena, including removed slots.
	 *
	 * @return
	 */
	public int size() {
		return blocks.size();
	}

	public Block getBlock(int id) {
		Block b = id >= 0 && id < blocks.size() ? blocks.get(id) : null;
		if (b == null) {
			throw new StructuralException(StructuralException.Kind.MISSING_BLOCK,
					"missing block bb" + id + " in " + body.getName(), body.getSignature().getSpan());
		}
		return b;
	}

	public boolean contains(int id) {
		return id >= 0 && id < blocks.size() && blocks.get(id) != null;
	}

	/**
	 * Get the surviving blocks in reverse post-order, ignoring back edges. This
	 * is the order in which blocks are encoded, and guarantees that every
	 * forward predecessor of a block comes before it.
	 *
	 * @return
	 */
	public List<Integer> getReversePostOrder() {
		return reversePostOrder;
	}

	public List<Integer> getPredecessors(int id) {
		return predecessors.get(id);
	}

	/**
	 * Get the predecessors of a block which reach it along a forward edge.
	 *
	 * @param id
	 * @return
	 */
	public List<Integer> getForwardPredecessors(int id) {
		ArrayList<Integer> r = new ArrayList<>();
		for (Integer p : predecessors.get(id)) {
			if (!isBackEdge(p, id)) {
				r.add(p);
			}
		}
		return r;
	}

	public boolean isBackEdge(int from, int to) {
		return backEdges.contains(new Edge(from, to));
	}

	public Collection<Edge> getBackEdges() {
		return backEdges;
	}

	public Dominators getDominators() {
		return dominators;
	}

	public Collection<Loop> getLoops() {
		return loops.values();
	}

	/**
	 * Get the loop headed by a given block.
	 *
	 * @param head
	 * @return The loop, or <code>null</code> if the block is not a loop head.
	 */
	public Loop getLoop(int head) {
		return loops.get(head);
	}

	public boolean isLoopHead(int id) {
		return loops.containsKey(id);
	}

	public SpanTable getSpans() {
		return spans;
	}

	// =========================================================================
	// Blocks
	// =========================================================================

	public static final class Block {
		private final int id;
		private final ImmutableList<Stmt> statements;
		private final Terminator terminator;

		public Block(int id, List<Stmt> statements, Terminator terminator) {
			this.id = id;
			this.statements = ImmutableList.copyOf(statements);
			this.terminator = Objects.requireNonNull(terminator);
		}

		public int getId() {
			return id;
		}

		public List<Stmt> getStatements() {
			return statements;
		}

		public Terminator getTerminator() {
			return terminator;
		}

		/**
		 * Get the first known source position within this block.
		 *
		 * @return
		 */
		public Span getSpan() {
			for (Stmt s : statements) {
				if (!s.getSpan().equals(Span.UNKNOWN)) {
					return s.getSpan();
				}
			}
			return terminator.getSpan();
		}

		@Override
		public String toString() {
			return "bb" + id + statements + " " + terminator;
		}
	}

	public static final class Edge {
		private final int from;
		private final int to;

		public Edge(int from, int to) {
			this.from = from;
			this.to = to;
		}

		public int getFrom() {
			return from;
		}

		public int getTo() {
			return to;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Edge) {
				Edge e = (Edge) o;
				return from == e.from && to == e.to;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return from * 31 + to;
		}

		@Override
		public String toString() {
			return "bb" + from + "->bb" + to;
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public static abstract class Stmt {
		public enum Kind {
			ASSIGN,
			STORAGE_LIVE,
			STORAGE_DEAD,
			EXPIRE_BORROWS,
			OVERFLOW_GOAL,
			DROP
		}

		private final Span span;

		private Stmt(Span span) {
			this.span = span == null ? Span.UNKNOWN : span;
		}

		public abstract Kind getKind();

		public Span getSpan() {
			return span;
		}

		public static final class Assign extends Stmt {
			private final Place place;
			private final Rvalue rvalue;

			public Assign(Place place, Rvalue rvalue, Span span) {
				super(span);
				this.place = Objects.requireNonNull(place);
				this.rvalue = Objects.requireNonNull(rvalue);
			}

			@Override
			public Kind getKind() {
				return Kind.ASSIGN;
			}

			public Place getPlace() {
				return place;
			}

			public Rvalue getRvalue() {
				return rvalue;
			}

			@Override
			public String toString() {
				return place + " = " + rvalue;
			}
		}

		public static final class StorageLive extends Stmt {
			private final int local;

			public StorageLive(int local, Span span) {
				super(span);
				this.local = local;
			}

			@Override
			public Kind getKind() {
				return Kind.STORAGE_LIVE;
			}

			public int getLocal() {
				return local;
			}

			@Override
			public String toString() {
				return "StorageLive(_" + local + ")";
			}
		}

		public static final class StorageDead extends Stmt {
			private final int local;

			public StorageDead(int local, Span span) {
				super(span);
				this.local = local;
			}

			@Override
			public Kind getKind() {
				return Kind.STORAGE_DEAD;
			}

			public int getLocal() {
				return local;
			}

			@Override
			public String toString() {
				return "StorageDead(_" + local + ")";
			}
		}

		/**
		 * Marks the end of the regions of one or more borrows, as computed by the
		 * host's borrow checker.
		 */
		public static final class ExpireBorrows extends Stmt {
			private final ImmutableList<Integer> borrows;

			public ExpireBorrows(List<Integer> borrows, Span span) {
				super(span);
				this.borrows = ImmutableList.copyOf(borrows);
			}

			@Override
			public Kind getKind() {
				return Kind.EXPIRE_BORROWS;
			}

			public List<Integer> getBorrows() {
				return borrows;
			}

			@Override
			public String toString() {
				return "expire" + borrows;
			}
		}

		/**
		 * Requires the mathematical result of an arithmetic operation to fit
		 * the integer type it is computed in.
		 */
		public static final class OverflowGoal extends Stmt {
			private final Goal goal;
			private final Rvalue.Binary operation;
			private final IntKind type;

			public OverflowGoal(Goal goal, Rvalue.Binary operation, IntKind type) {
				super(goal.getSpan());
				this.goal = goal;
				this.operation = operation;
				this.type = type;
			}

			@Override
			public Kind getKind() {
				return Kind.OVERFLOW_GOAL;
			}

			public Goal getGoal() {
				return goal;
			}

			public Rvalue.Binary getOperation() {
				return operation;
			}

			public IntKind getType() {
				return type;
			}

			@Override
			public String toString() {
				return "overflow(" + operation + ": " + type + ")";
			}
		}

		public static final class Drop extends Stmt {
			private final Place place;

			public Drop(Place place, Span span) {
				super(span);
				this.place = Objects.requireNonNull(place);
			}

			@Override
			public Kind getKind() {
				return Kind.DROP;
			}

			public Place getPlace() {
				return place;
			}

			@Override
			public String toString() {
				return "drop(" + place + ")";
			}
		}
	}

	// =========================================================================
	// Terminators
	// =========================================================================

	public static abstract class Terminator {
		public enum Kind {
			GOTO,
			BRANCH,
			CALL,
			RETURN,
			ASSERT_GOAL,
			PANIC_GOAL
		}

		private final Span span;

		private Terminator(Span span) {
			this.span = span == null ? Span.UNKNOWN : span;
		}

		public abstract Kind getKind();

		public abstract List<Integer> getSuccessors();

		/**
		 * Construct a copy of this terminator with every edge to one block sent
		 * to another instead.
		 *
		 * @param from
		 * @param to
		 * @return
		 */
		public abstract Terminator retarget(int from, int to);

		public Span getSpan() {
			return span;
		}

		private static int swap(int target, int from, int to) {
			return target == from ? to : target;
		}

		public static final class Goto extends Terminator {
			private final int target;

			public Goto(int target, Span span) {
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
			public Terminator retarget(int from, int to) {
				return new Goto(swap(target, from, to), getSpan());
			}

			@Override
			public String toString() {
				return "goto bb" + target;
			}
		}

		/**
		 * A multi-way branch over an integer or boolean discriminant, as a list
		 * of cases tried in order followed by a default target.
		 */
		public static final class Branch extends Terminator {
			private final Operand discriminant;
			private final ImmutableList<Case> cases;
			private final int otherwise;

			public Branch(Operand discriminant, List<Case> cases, int otherwise, Span span) {
				super(span);
				this.discriminant = Objects.requireNonNull(discriminant);
				this.cases = ImmutableList.copyOf(cases);
				this.otherwise = otherwise;
			}

			@Override
			public Kind getKind() {
				return Kind.BRANCH;
			}

			public Operand getDiscriminant() {
				return discriminant;
			}

			public List<Case> getCases() {
				return cases;
			}

			public int getOtherwise() {
				return otherwise;
			}

			@Override
			public List<Integer> getSuccessors() {
				ImmutableList.Builder<Integer> r = ImmutableList.builder();
				for (Case c : cases) {
					r.add(c.getTarget());
				}
				return r.add(otherwise).build();
			}

			@Override
			public Terminator retarget(int from, int to) {
				ArrayList<Case> ncases = new ArrayList<>();
				for (Case c : cases) {
					ncases.add(new Case(c.getValue(), swap(c.getTarget(), from, to)));
				}
				return new Branch(discriminant, ncases, swap(otherwise, from, to), getSpan());
			}

			@Override
			public String toString() {
				return "branch(" + discriminant + ") " + cases + " otherwise bb" + otherwise;
			}
		}

		public static final class Case {
			private final BigInteger value;
			private final int target;

			public Case(BigInteger value, int target) {
				this.value = value;
				this.target = target;
			}

			public BigInteger getValue() {
				return value;
			}

			public int getTarget() {
				return target;
			}

			@Override
			public String toString() {
				return value + " => bb" + target;
			}
		}

		public static final class Call extends Terminator {
			private final String callee;
			private final ImmutableList<Operand> arguments;
			private final Place destination;
			private final Integer target;

			public Call(String callee, List<Operand> arguments, Place destination, Integer target, Span span) {
				super(span);
				this.callee = callee;
				this.arguments = ImmutableList.copyOf(arguments);
				this.destination = destination;
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

			/**
			 * Get the block control continues in once the call returns.
			 *
			 * @return The target, or <code>null</code> if the call never returns.
			 */
			public Integer getTarget() {
				return target;
			}

			@Override
			public List<Integer> getSuccessors() {
				return target == null ? ImmutableList.of() : ImmutableList.of(target);
			}

			@Override
			public Terminator retarget(int from, int to) {
				Integer ntarget = target == null ? null : swap(target, from, to);
				return new Call(callee, arguments, destination, ntarget, getSpan());
			}

			@Override
			public String toString() {
				return destination + " = " + callee + arguments + (target == null ? "" : " -> bb" + target);
			}
		}

		public static final class Return extends Terminator {
			public Return(Span span) {
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
			public Terminator retarget(int from, int to) {
				return this;
			}

			@Override
			public String toString() {
				return "return";
			}
		}

		/**
		 * Requires the condition to equal the expected value before continuing
		 * to the target.
		 */
		public static final class AssertGoal extends Terminator {
			private final Goal goal;
			private final Operand condition;
			private final boolean expected;
			private final int target;

			public AssertGoal(Goal goal, Operand condition, boolean expected, int target) {
				super(goal.getSpan());
				this.goal = goal;
				this.condition = Objects.requireNonNull(condition);
				this.expected = expected;
				this.target = target;
			}

			@Override
			public Kind getKind() {
				return Kind.ASSERT_GOAL;
			}

			public Goal getGoal() {
				return goal;
			}

			public Operand getCondition() {
				return condition;
			}

			public boolean getExpected() {
				return expected;
			}

			public int getTarget() {
				return target;
			}

			@Override
			public List<Integer> getSuccessors() {
				return ImmutableList.of(target);
			}

			@Override
			public Terminator retarget(int from, int to) {
				return new AssertGoal(goal, condition, expected, swap(target, from, to));
			}

			@Override
			public String toString() {
				return "assert(" + (expected ? "" : "!") + condition + ") -> bb" + target;
			}
		}

		/**
		 * A program point which must be unreachable.
		 */
		public static final class PanicGoal extends Terminator {
			private final Goal goal;

			public PanicGoal(Goal goal) {
				super(goal.getSpan());
				this.goal = goal;
			}

			@Override
			public Kind getKind() {
				return Kind.PANIC_GOAL;
			}

			public Goal getGoal() {
				return goal;
			}

			@Override
			public List<Integer> getSuccessors() {
				return ImmutableList.of();
			}

			@Override
			public Terminator retarget(int from, int to) {
				return this;
			}

			@Override
			public String toString() {
				return "assert false: " + goal;
			}
		}
	}
}
