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

import static rsviper.core.ViperFile.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import rsviper.cfg.Goal;
import rsviper.cfg.Loop;
import rsviper.cfg.NormalizedCfg;
import rsviper.core.ViperFile.Decl;
import rsviper.core.ViperFile.Expr;
import rsviper.core.ViperFile.Stmt;
import rsviper.core.ViperFile.Type;
import rsviper.lang.AccessPath;
import rsviper.lang.Borrow;
import rsviper.lang.PermAmount;
import rsviper.lang.Permission;
import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;
import rsviper.lang.Ty;
import rsviper.lang.UnsupportedException;
import rsviper.mir.AssertKind;
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.Local;
import rsviper.mir.Operand;
import rsviper.mir.PanicCause;
import rsviper.mir.Rvalue;
import rsviper.spec.ResolvedExpr;
import rsviper.spec.ResolvedSpec;

/**
 * Encodes a single function as a Viper method which checks it. The method
 * takes no arguments: the precondition is inhaled at the start, and every
 * postcondition, loop invariant and runtime check is an assertion (or an
 * exhale) carrying the obligation it discharges. Blocks are laid out in
 * reverse postorder, so every jump is forwards; a back edge ends its path
 * once the loop invariant has been re-established.
 *
 * @author The Rust2Viper Project Developers
 */
public class ProcedureEncoder {
	private static final Logger logger = LoggerFactory.getLogger(ProcedureEncoder.class);

	public static final String END = "end";

	private final boolean checkOverflow;
	private final Map<String, ProcedureContract> contracts;

	/**
	 * Construct an encoder.
	 *
	 * @param checkOverflow
	 *            Whether arithmetic must stay within the bounds of its type.
	 * @param contracts
	 *            The contracts of every function which may be called.
	 */
	public ProcedureEncoder(boolean checkOverflow, Map<String, ProcedureContract> contracts) {
		this.checkOverflow = checkOverflow;
		this.contracts = contracts;
	}

	public static String methodName(String function) {
		return "m$" + function.replaceAll("[^A-Za-z0-9_$]", "_");
	}

	public EncodedProcedure encode(NormalizedCfg cfg, ResolvedSpec spec) {
		return new Procedure(cfg, spec).encode();
	}

	/**
	 * The state of encoding a single function.
	 */
	private class Procedure {
		private final NormalizedCfg cfg;
		private final Body body;
		private final FunctionSig signature;
		private final ResolvedSpec spec;
		private final TypeEncoder types;
		private final ValueEncoder values;
		private final Obligation.Registry obligations;
		private final PermissionEncoder permissions;
		private final HashMap<Integer, PermissionEnvironment> entries = new HashMap<>();
		private final HashMap<Integer, PermissionEnvironment> exits = new HashMap<>();
		private final HashMap<Integer, List<Stmt>> code = new HashMap<>();

		public Procedure(NormalizedCfg cfg, ResolvedSpec spec) {
			this.cfg = cfg;
			this.body = cfg.getBody();
			this.signature = body.getSignature();
			this.spec = spec;
			this.types = new TypeEncoder(checkOverflow, signature.getSpan());
			this.values = new ValueEncoder(body, types);
			this.obligations = new Obligation.Registry(body.getName());
			this.permissions = new PermissionEncoder(types, values, obligations);
		}

		public EncodedProcedure encode() {
			ArrayList<Stmt> out = new ArrayList<>();
			declarations(out);
			PermissionEnvironment initial = new PermissionEnvironment();
			precondition(initial, out);
			for (int id : cfg.getReversePostOrder()) {
				block(id, initial);
			}
			for (int id : cfg.getReversePostOrder()) {
				out.add(LABEL(label(id)));
				out.addAll(code.get(id));
				Stmt exit = exit(id);
				if (exit != null) {
					out.add(exit);
				}
			}
			out.add(LABEL(END));
			Decl.Method method = new Decl.Method(methodName(body.getName()), Collections.emptyList(),
					Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), SEQUENCE(out));
			logger.debug("encoded {} with {} obligations", body.getName(), obligations.getObligations().size());
			// Bodies of predicates may use further fields
			SortedMap<String, Expr> predicates = types.getPredicates();
			return new EncodedProcedure(body.getName(), signature.getSpan(), method, obligations.getObligations(),
					types.getFields(), predicates, types.getTags(), types.getIntKinds());
		}

		// =====================================================================
		// Entry
		// =====================================================================

		private void declarations(List<Stmt> out) {
			ArrayList<Expr.Logical> tags = new ArrayList<>();
			for (Local l : body.getLocals()) {
				out.add(VAR(l.getVariable(), Type.Ref));
				tags.add(EQ(INVOKE("type_of", VAR(l.getVariable())), INVOKE(types.tagOf(l.getType()))));
			}
			for (ResolvedExpr.Snapshot s : spec.getSnapshots()) {
				out.add(VAR(s.getName(), types.valueType(s.getCategory())));
			}
			for (int k = 1; k <= signature.getArity(); ++k) {
				String field = TypeEncoder.valueField(body.getLocal(k).getType());
				if (field != null) {
					out.add(VAR(ghost(k), TypeEncoder.fieldType(field)));
				}
			}
			out.add(INHALE(AND(tags)));
		}

		private void precondition(PermissionEnvironment env, List<Stmt> out) {
			ArrayList<Permission> formals = new ArrayList<>();
			for (int k = 1; k <= signature.getArity(); ++k) {
				Local l = body.getLocal(k);
				formals.addAll(types.tree(l.getType(), AccessPath.root(l.getVariable()), PermAmount.WRITE, true));
			}
			permissions.inhale(env, formals, types.bounds(formals), signature.getSpan(), out);
			for (ResolvedSpec.Clause c : spec.getRequires()) {
				out.add(INHALE(values.condition(c.getExpr(), ValueEncoder.Bindings.NONE)));
			}
			for (int k = 1; k <= signature.getArity(); ++k) {
				Local l = body.getLocal(k);
				String field = TypeEncoder.valueField(l.getType());
				if (field != null) {
					out.add(ASSIGN(VAR(ghost(k)), FIELD(VAR(l.getVariable()), types.useField(field))));
				}
			}
			for (ResolvedExpr.Snapshot s : spec.getSnapshots()) {
				out.add(ASSIGN(VAR(s.getName()), values.encode(s.getValue(), ValueEncoder.Bindings.NONE)));
			}
		}

		/**
		 * The variable recording the initial value of a parameter, which makes
		 * counterexamples readable.
		 */
		private String ghost(int k) {
			return "arg$" + signature.getParameterNames().get(k - 1).replaceAll("[^A-Za-z0-9_$]", "_");
		}

		// =====================================================================
		// Blocks
		// =====================================================================

		private void block(int id, PermissionEnvironment initial) {
			NormalizedCfg.Block block = cfg.getBlock(id);
			PermissionEnvironment env;
			if (id == cfg.getEntry()) {
				env = initial.copy();
			} else {
				ArrayList<PermissionEnvironment> incoming = new ArrayList<>();
				for (int p : cfg.getForwardPredecessors(id)) {
					incoming.add(exits.get(p));
				}
				env = incoming.isEmpty() ? new PermissionEnvironment()
						: PermissionEnvironment.join(incoming, cfg.getSpans().getBlockSpan(id));
			}
			entries.put(id, env.copy());
			ArrayList<Stmt> out = new ArrayList<>();
			if (cfg.isLoopHead(id)) {
				loopHead(cfg.getLoop(id), env, out);
			}
			for (NormalizedCfg.Stmt s : block.getStatements()) {
				statement(env, s, out);
			}
			terminator(id, block.getTerminator(), env, out);
			exits.put(id, env);
			code.put(id, out);
		}

		private void loopHead(Loop loop, PermissionEnvironment env, List<Stmt> out) {
			List<ResolvedSpec.Clause> invariant = spec.getInvariant(loop.getHead());
			for (ResolvedSpec.Clause c : invariant) {
				Obligation o = obligations.register(Obligation.Kind.LOOP_INVARIANT_ENTRY, c.getSpan(),
						"loop invariant might not hold in the first loop iteration.");
				out.add(ASSERT(values.condition(c.getExpr(), ValueEncoder.Bindings.NONE), ATTRIBUTE(o)));
			}
			permissions.havoc(env, written(loop), cfg.getSpans().getBlockSpan(loop.getHead()), out);
			for (ResolvedSpec.Clause c : invariant) {
				out.add(INHALE(values.condition(c.getExpr(), ValueEncoder.Bindings.NONE)));
			}
		}

		/**
		 * Determine the paths beneath which a loop may change anything.
		 */
		private Set<AccessPath> written(Loop loop) {
			LinkedHashSet<AccessPath> r = new LinkedHashSet<>();
			for (int id : loop.getBlocks()) {
				NormalizedCfg.Block block = cfg.getBlock(id);
				for (NormalizedCfg.Stmt s : block.getStatements()) {
					switch (s.getKind()) {
					case ASSIGN: {
						NormalizedCfg.Stmt.Assign a = (NormalizedCfg.Stmt.Assign) s;
						r.add(written(a.getPlace(), s.getSpan()));
						Rvalue rv = a.getRvalue();
						if (rv instanceof Rvalue.Use) {
							moved(((Rvalue.Use) rv).getOperand(), s.getSpan(), r);
						} else if (rv instanceof Rvalue.Aggregate) {
							for (Operand o : ((Rvalue.Aggregate) rv).getOperands()) {
								moved(o, s.getSpan(), r);
							}
						} else if (rv instanceof Rvalue.Ref && ((Rvalue.Ref) rv).getBorrowKind() == Borrow.Kind.MUTABLE) {
							r.add(written(((Rvalue.Ref) rv).getPlace(), s.getSpan()));
						}
						break;
					}
					case STORAGE_DEAD:
						r.add(written(Place.local(((NormalizedCfg.Stmt.StorageDead) s).getLocal()), s.getSpan()));
						break;
					case DROP:
						r.add(written(((NormalizedCfg.Stmt.Drop) s).getPlace(), s.getSpan()));
						break;
					default:
						break;
					}
				}
				if (block.getTerminator() instanceof NormalizedCfg.Terminator.Call) {
					NormalizedCfg.Terminator.Call c = (NormalizedCfg.Terminator.Call) block.getTerminator();
					if (c.getDestination() != null) {
						r.add(written(c.getDestination(), c.getSpan()));
					}
					for (Operand o : c.getArguments()) {
						if (o.getKind() != Operand.Kind.CONSTANT && values.typeOf(o).isReference()) {
							r.add(written(o.getPlace(), c.getSpan()));
						} else {
							moved(o, c.getSpan(), r);
						}
					}
				}
			}
			return r;
		}

		private void moved(Operand o, Span span, Set<AccessPath> r) {
			if (o.getKind() == Operand.Kind.MOVE) {
				r.add(written(o.getPlace(), span));
			}
		}

		private AccessPath written(Place place, Span span) {
			while (place.isIndexed()) {
				place = place.getParent();
			}
			return values.path(place, span);
		}

		// =====================================================================
		// Statements
		// =====================================================================

		private void statement(PermissionEnvironment env, NormalizedCfg.Stmt s, List<Stmt> out) {
			Span span = s.getSpan();
			for (Place p : places(s)) {
				permissions.unfold(env, p, span, out);
			}
			encode(env, s, out);
			permissions.fold(env, span, out);
		}

		/**
		 * Determine the places a statement reads or writes.
		 */
		private List<Place> places(NormalizedCfg.Stmt s) {
			ArrayList<Place> r = new ArrayList<>();
			switch (s.getKind()) {
			case ASSIGN: {
				NormalizedCfg.Stmt.Assign a = (NormalizedCfg.Stmt.Assign) s;
				r.add(a.getPlace());
				places(a.getRvalue(), r);
				break;
			}
			case OVERFLOW_GOAL:
				places(((NormalizedCfg.Stmt.OverflowGoal) s).getOperation(), r);
				break;
			case DROP:
				r.add(((NormalizedCfg.Stmt.Drop) s).getPlace());
				break;
			default:
				break;
			}
			return r;
		}

		private void places(Rvalue rv, List<Place> r) {
			switch (rv.getKind()) {
			case USE:
				places(((Rvalue.Use) rv).getOperand(), r);
				break;
			case BINARY:
				places(((Rvalue.Binary) rv).getLeftHandSide(), r);
				places(((Rvalue.Binary) rv).getRightHandSide(), r);
				break;
			case UNARY:
				places(((Rvalue.Unary) rv).getOperand(), r);
				break;
			case REF:
				r.add(((Rvalue.Ref) rv).getPlace());
				break;
			case AGGREGATE:
				for (Operand o : ((Rvalue.Aggregate) rv).getOperands()) {
					places(o, r);
				}
				break;
			case LEN:
				r.add(((Rvalue.Len) rv).getPlace());
				break;
			}
		}

		private void places(Operand o, List<Place> r) {
			if (o.getPlace() != null) {
				r.add(o.getPlace());
			}
		}

		private void encode(PermissionEnvironment env, NormalizedCfg.Stmt s, List<Stmt> out) {
			Span span = s.getSpan();
			switch (s.getKind()) {
			case ASSIGN:
				permissions.assign(env, (NormalizedCfg.Stmt.Assign) s, out);
				break;
			case STORAGE_LIVE:
				break;
			case STORAGE_DEAD:
				permissions.drop(env, Place.local(((NormalizedCfg.Stmt.StorageDead) s).getLocal()), span, out);
				break;
			case EXPIRE_BORROWS:
				for (int id : ((NormalizedCfg.Stmt.ExpireBorrows) s).getBorrows()) {
					permissions.expire(env, id, span, out);
				}
				break;
			case OVERFLOW_GOAL: {
				NormalizedCfg.Stmt.OverflowGoal g = (NormalizedCfg.Stmt.OverflowGoal) s;
				Expr value = values.binary(g.getOperation(), span);
				out.add(ASSERT(types.inBounds(g.getType(), value), ATTRIBUTE(goal(g.getGoal()))));
				break;
			}
			case DROP:
				permissions.drop(env, ((NormalizedCfg.Stmt.Drop) s).getPlace(), span, out);
				break;
			}
		}

		/**
		 * Register the obligation that a goal is never reached. User assertions
		 * are distinguished from the runtime checks inserted by the compiler,
		 * which only guard against panics.
		 */
		private Obligation goal(Goal g) {
			Obligation.Kind kind;
			switch (g.getKind()) {
			case ASSERTION:
				kind = g.getAssertKind() == AssertKind.CUSTOM ? Obligation.Kind.ASSERTION
						: Obligation.Kind.PANIC_FREEDOM;
				break;
			case PANIC:
				kind = g.getCause() == PanicCause.ASSERT ? Obligation.Kind.ASSERTION : Obligation.Kind.PANIC_FREEDOM;
				break;
			case OVERFLOW:
				kind = Obligation.Kind.OVERFLOW;
				break;
			default:
				kind = Obligation.Kind.PANIC_FREEDOM;
				break;
			}
			return obligations.register(kind, g.getSpan(), g.getDescription());
		}

		// =====================================================================
		// Terminators
		// =====================================================================

		private void terminator(int id, NormalizedCfg.Terminator t, PermissionEnvironment env, List<Stmt> out) {
			switch (t.getKind()) {
			case CALL: {
				NormalizedCfg.Terminator.Call c = (NormalizedCfg.Terminator.Call) t;
				ProcedureContract callee = contracts.get(c.getCallee());
				if (callee == null) {
					throw new StructuralException(StructuralException.Kind.MISSING_CALLEE,
							"call to unknown function " + c.getCallee(), c.getSpan());
				}
				ArrayList<Place> places = new ArrayList<>();
				for (Operand o : c.getArguments()) {
					places(o, places);
				}
				if (c.getDestination() != null) {
					places.add(c.getDestination());
				}
				for (Place p : places) {
					permissions.unfold(env, p, c.getSpan(), out);
				}
				permissions.call(env, c, callee, "call$" + label(id), out);
				permissions.fold(env, c.getSpan(), out);
				break;
			}
			case BRANCH: {
				NormalizedCfg.Terminator.Branch b = (NormalizedCfg.Terminator.Branch) t;
				ArrayList<Place> places = new ArrayList<>();
				places(b.getDiscriminant(), places);
				for (Place p : places) {
					permissions.unfold(env, p, t.getSpan(), out);
				}
				break;
			}
			case ASSERT_GOAL: {
				NormalizedCfg.Terminator.AssertGoal a = (NormalizedCfg.Terminator.AssertGoal) t;
				ArrayList<Place> places = new ArrayList<>();
				places(a.getCondition(), places);
				for (Place p : places) {
					permissions.unfold(env, p, a.getGoal().getSpan(), out);
				}
				Expr.Logical cond = ValueEncoder.logical(values.operand(a.getCondition(), a.getGoal().getSpan()));
				out.add(ASSERT(a.getExpected() ? cond : NOT(cond), ATTRIBUTE(goal(a.getGoal()))));
				break;
			}
			case PANIC_GOAL: {
				NormalizedCfg.Terminator.PanicGoal p = (NormalizedCfg.Terminator.PanicGoal) t;
				out.add(ASSERT(CONST(false), ATTRIBUTE(goal(p.getGoal()))));
				out.add(INHALE(CONST(false)));
				break;
			}
			case RETURN:
				returns(env, t.getSpan(), out);
				break;
			default:
				break;
			}
		}

		private void returns(PermissionEnvironment env, Span span, List<Stmt> out) {
			for (Borrow b : Lists.reverse(new ArrayList<>(env.getBorrows()))) {
				if (env.getBorrow(b.getId()) != null) {
					permissions.expire(env, b.getId(), span, out);
				}
			}
			for (ResolvedSpec.Clause c : spec.getEnsures()) {
				Obligation o = obligations.register(Obligation.Kind.POSTCONDITION, c.getSpan(),
						"postcondition might not hold.");
				out.add(ASSERT(values.condition(c.getExpr(), ValueEncoder.Bindings.NONE), ATTRIBUTE(o)));
			}
			ArrayList<Permission> owed = new ArrayList<>();
			Ty rt = signature.getReturnType();
			if (rt.getKind() == Ty.Kind.REF) {
				throw new UnsupportedException("functions returning references are not supported", signature.getSpan());
			}
			owed.addAll(types.tree(rt, AccessPath.root(body.getLocal(0).getVariable()), PermAmount.WRITE, true));
			for (int k = 1; k <= signature.getArity(); ++k) {
				Local l = body.getLocal(k);
				if (l.getType().getKind() == Ty.Kind.REF && ((Ty.Ref) l.getType()).isMutable()) {
					Ty target = ((Ty.Ref) l.getType()).getTarget();
					AccessPath root = AccessPath.root(l.getVariable()).append(TypeEncoder.VAL_REF);
					owed.addAll(types.tree(target, root, PermAmount.WRITE, true));
				}
			}
			if (!owed.isEmpty()) {
				Obligation o = obligations.register(Obligation.Kind.POSTCONDITION, span,
						"function might not return the permissions its caller expects");
				permissions.exhale(env, owed, o, out);
			}
			out.add(GOTO(END));
		}

		// =====================================================================
		// Jumps
		// =====================================================================

		private Stmt exit(int id) {
			NormalizedCfg.Terminator t = cfg.getBlock(id).getTerminator();
			Span span = t.getSpan();
			switch (t.getKind()) {
			case GOTO:
				return jump(id, ((NormalizedCfg.Terminator.Goto) t).getTarget(), span);
			case BRANCH: {
				NormalizedCfg.Terminator.Branch b = (NormalizedCfg.Terminator.Branch) t;
				Expr d = values.operand(b.getDiscriminant(), span);
				boolean bool = values.typeOf(b.getDiscriminant()).getKind() == Ty.Kind.BOOL;
				Stmt r = jump(id, b.getOtherwise(), span);
				for (NormalizedCfg.Terminator.Case c : Lists.reverse(b.getCases())) {
					Expr.Logical cond;
					if (bool) {
						cond = c.getValue().signum() == 0 ? NOT(ValueEncoder.logical(d)) : ValueEncoder.logical(d);
					} else {
						cond = EQ(d, CONST(c.getValue()));
					}
					r = IFELSE(cond, jump(id, c.getTarget(), span), r);
				}
				return r;
			}
			case CALL: {
				Integer target = ((NormalizedCfg.Terminator.Call) t).getTarget();
				// A call which never returns ends the path
				return target == null ? INHALE(CONST(false)) : jump(id, target, span);
			}
			case ASSERT_GOAL:
				return jump(id, ((NormalizedCfg.Terminator.AssertGoal) t).getTarget(), span);
			default:
				return null;
			}
		}

		private Stmt jump(int from, int to, Span span) {
			ArrayList<Stmt> r = new ArrayList<>();
			PermissionEnvironment env = exits.get(from).copy();
			boolean back = cfg.isBackEdge(from, to);
			permissions.reconcile(env, entries.get(to), back, span, r);
			if (back) {
				for (ResolvedSpec.Clause c : spec.getInvariant(to)) {
					Obligation o = obligations.register(Obligation.Kind.LOOP_INVARIANT_PRESERVATION, c.getSpan(),
							"loop invariant might not hold after a loop iteration.");
					r.add(ASSERT(values.condition(c.getExpr(), ValueEncoder.Bindings.NONE), ATTRIBUTE(o)));
				}
				r.add(INHALE(CONST(false)));
			} else {
				r.add(GOTO(label(to)));
			}
			return r.size() == 1 ? r.get(0) : SEQUENCE(r);
		}

		private String label(int id) {
			return "bb" + id;
		}
	}
}
