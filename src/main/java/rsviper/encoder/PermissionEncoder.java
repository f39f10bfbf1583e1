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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import rsviper.cfg.NormalizedCfg;
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
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.Operand;
import rsviper.mir.Rvalue;
import rsviper.spec.ResolvedSpec;

/**
 * Generates the statements which move permissions around as a function
 * executes, keeping a {@link PermissionEnvironment} in step with them.
 * Permissions are only ever transferred: whatever is inhaled somewhere was
 * exhaled elsewhere, except where a value is created afresh.
 *
 * @author The Rust2Viper Project Developers
 */
public class PermissionEncoder {
	private static final Logger logger = LoggerFactory.getLogger(PermissionEncoder.class);

	private final Body body;
	private final TypeEncoder types;
	private final ValueEncoder values;
	private final Obligation.Registry obligations;
	private int labels;

	public PermissionEncoder(TypeEncoder types, ValueEncoder values, Obligation.Registry obligations) {
		this.body = values.getBody();
		this.types = types;
		this.values = values;
		this.obligations = obligations;
	}

	public String freshLabel() {
		return "l$" + (labels++);
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public void assign(PermissionEnvironment env, NormalizedCfg.Stmt.Assign s, List<Stmt> out) {
		Place d = s.getPlace();
		Rvalue rv = s.getRvalue();
		Span span = s.getSpan();
		Ty type = body.typeOf(d);
		switch (rv.getKind()) {
		case USE:
			use(env, d, type, ((Rvalue.Use) rv).getOperand(), span, out);
			break;
		case BINARY: {
			Rvalue.Binary b = (Rvalue.Binary) rv;
			if (b.isChecked() && type.getKind() == Ty.Kind.TUPLE) {
				checked(env, d, (Ty.Tuple) type, b, span, out);
			} else {
				store(env, d, type, values.binary(b, span), span, out);
			}
			break;
		}
		case UNARY:
			store(env, d, type, values.unary((Rvalue.Unary) rv, span), span, out);
			break;
		case REF:
			borrow(env, d, (Rvalue.Ref) rv, span, out);
			break;
		case AGGREGATE:
			aggregate(env, d, type, (Rvalue.Aggregate) rv, span, out);
			break;
		case LEN:
			store(env, d, type, SEQ_LENGTH(values.sequence(((Rvalue.Len) rv).getPlace(), span)), span, out);
			break;
		}
		env.checkConservation(span);
	}

	/**
	 * Release everything held by a place which is no longer needed, such as a
	 * dropped value or a local whose storage has ended.
	 *
	 * @param env
	 * @param place
	 * @param span
	 * @param out
	 */
	public void drop(PermissionEnvironment env, Place place, Span span, List<Stmt> out) {
		if (place.isIndexed()) {
			// Elements of integer arrays hold nothing of their own
			return;
		}
		release(env, values.path(place, span), span, out);
	}

	/**
	 * Store a scalar value into a place.
	 */
	private void store(PermissionEnvironment env, Place d, Ty type, Expr value, Span span, List<Stmt> out) {
		if (d.isIndexed()) {
			Place.Projection last = d.getLast();
			if (last.getKind() != Place.Projection.Kind.INDEX) {
				throw new UnsupportedException("only elements of integer arrays can be assigned: " + d, span);
			}
			Expr.FieldAccess seq = values.sequence(d.getParent(), span);
			Expr index = values.value(Place.local(last.getIndexLocal()), span);
			out.add(ASSIGN(seq, SEQ_UPDATE(seq, index, value)));
			return;
		}
		prepare(env, d, type, span, out);
		String field = TypeEncoder.valueField(type);
		if (field == null) {
			throw new UnsupportedException("cannot store a value of type " + type, span);
		}
		out.add(ASSIGN(FIELD(values.location(d, span), types.useField(field)), value));
	}

	/**
	 * Make sure a place has a full permission to the structure of its value
	 * before it is overwritten, reusing the existing structure if it is held
	 * and nothing hangs off it.
	 */
	private void prepare(PermissionEnvironment env, Place d, Ty type, Span span, List<Stmt> out) {
		AccessPath path = values.path(d, span);
		if (!TypeEncoder.hasTargets(type) && isHeld(env, types.tree(type, path, PermAmount.WRITE, false))) {
			return;
		}
		renew(env, d, type, span, out);
	}

	/**
	 * Replace whatever a place holds by a fresh structure for a value of a
	 * given type. Behind a reference nothing can be created, so the
	 * structure must already be held in full, which is checked instead.
	 */
	private void renew(PermissionEnvironment env, Place d, Ty type, Span span, List<Stmt> out) {
		AccessPath path = values.path(d, span);
		List<Permission> own = types.tree(type, path, PermAmount.WRITE, false);
		if (d.isDereferenced() && !isHeld(env, own)) {
			ArrayList<Expr.Logical> parts = new ArrayList<>();
			for (Permission p : own) {
				parts.add(TypeEncoder.access(p));
			}
			Obligation o = permission(span, "write through " + d + " might lack permission");
			out.add(ASSERT(AND(parts), ATTRIBUTE(o)));
			return;
		}
		release(env, path, span, out);
		inhale(env, own, Collections.emptyList(), span, out);
	}

	private static boolean isHeld(PermissionEnvironment env, List<Permission> permissions) {
		for (Permission p : permissions) {
			if (env.amountOf(p.getPath()).compareTo(p.getAmount()) < 0) {
				return false;
			}
		}
		return true;
	}

	private void checked(PermissionEnvironment env, Place d, Ty.Tuple type, Rvalue.Binary b, Span span,
			List<Stmt> out) {
		if (type.size() != 2 || !type.getElements().get(0).isInt()) {
			throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
					"checked operation must produce a pair, not " + type, span);
		}
		Ty.Int element = (Ty.Int) type.getElements().get(0);
		prepare(env, d, type, span, out);
		Expr value = values.binary(b, span);
		Expr base = values.location(d, span);
		Expr.FieldAccess result = FIELD(FIELD(base, types.fieldOf(type, "0")), TypeEncoder.VAL_INT);
		Expr.FieldAccess flag = FIELD(FIELD(base, types.fieldOf(type, "1")), TypeEncoder.VAL_BOOL);
		out.add(ASSIGN(result, value));
		if (types.isCheckingOverflow()) {
			out.add(ASSIGN(flag, NOT(types.inBounds(element.getIntKind(), value))));
		} else {
			out.add(ASSIGN(flag, CONST(false)));
		}
	}

	private void use(PermissionEnvironment env, Place d, Ty type, Operand o, Span span, List<Stmt> out) {
		if (o instanceof Operand.Constant) {
			store(env, d, type, values.operand(o, span), span, out);
		} else if (TypeEncoder.isScalar(type)) {
			store(env, d, type, values.value(o.getPlace(), span), span, out);
		} else {
			move(env, d, type, o.getPlace(), o.getKind() == Operand.Kind.COPY, span, out);
		}
	}

	private void aggregate(PermissionEnvironment env, Place d, Ty type, Rvalue.Aggregate agg, Span span,
			List<Stmt> out) {
		List<Operand> operands = agg.getOperands();
		if (type.getKind() == Ty.Kind.ARRAY) {
			ArrayList<Expr> elements = new ArrayList<>();
			for (Operand o : operands) {
				elements.add(values.operand(o, span));
			}
			store(env, d, type, SEQ(Type.Int, elements), span, out);
			return;
		}
		prepare(env, d, type, span, out);
		for (int i = 0; i != operands.size(); ++i) {
			String name;
			Ty ft;
			if (type.getKind() == Ty.Kind.TUPLE) {
				name = Integer.toString(i);
				ft = ((Ty.Tuple) type).getElements().get(i);
			} else if (type.getKind() == Ty.Kind.ADT) {
				Ty.Adt.Field f = ((Ty.Adt) type).getFields().get(i);
				name = f.getName();
				ft = f.getType();
			} else {
				throw new UnsupportedException("cannot construct a value of type " + type, span);
			}
			use(env, d.field(name), ft, operands.get(i), span, out);
		}
	}

	// =========================================================================
	// Moves and borrows
	// =========================================================================

	/**
	 * Move (or copy) a value which is not a scalar from one place to another.
	 * The destination gets a fresh structure holding the same scalars, and
	 * takes over everything the source's references point to. A copy can only
	 * contain shared references, whose targets are then shared between source
	 * and destination.
	 */
	private void move(PermissionEnvironment env, Place d, Ty type, Place p, boolean copy, Span span,
			List<Stmt> out) {
		AccessPath src = values.path(p, span);
		AccessPath dst = values.path(d, span);
		if (src.equals(dst)) {
			return;
		} else if (src.hasPrefix(dst) || dst.hasPrefix(src)) {
			throw new UnsupportedException("cannot move " + p + " into " + d + ", which overlaps it", span);
		}
		renew(env, d, type, span, out);
		for (Permission leaf : types.tree(type, src, PermAmount.WRITE, false)) {
			if (!leaf.isPredicate() && isValueField(leaf.getPath().getLastField())) {
				AccessPath to = leaf.getPath().replacePrefix(src, dst);
				out.add(ASSIGN((Expr.FieldAccess) TypeEncoder.location(to), TypeEncoder.location(leaf.getPath())));
			}
		}
		for (AccessPath t : types.targetRoots(type, src)) {
			AccessPath to = t.replacePrefix(src, dst);
			if (copy) {
				share(env, t, to, p, span, out);
			} else {
				transfer(env, env.under(t, true), t, to, span, "move of " + p, out);
				env.rehome(t, to, false);
			}
		}
		if (!copy) {
			exhale(env, env.under(src, true), permission(span, "move of " + p + " might lack permission"), out);
		}
	}

	private static boolean isValueField(String field) {
		return TypeEncoder.VAL_INT.equals(field) || TypeEncoder.VAL_BOOL.equals(field)
				|| TypeEncoder.VAL_REF.equals(field) || TypeEncoder.VAL_SEQ.equals(field);
	}

	private void borrow(PermissionEnvironment env, Place d, Rvalue.Ref r, Span span, List<Stmt> out) {
		Place p = r.getPlace();
		AccessPath origin = values.path(p, span);
		AccessPath dst = values.path(d, span);
		renew(env, d, body.typeOf(d), span, out);
		out.add(ASSIGN(FIELD(values.location(d, span), types.useField(TypeEncoder.VAL_REF)), values.location(p, span)));
		AccessPath holder = dst.append(TypeEncoder.VAL_REF);
		List<Permission> held = env.under(origin, true);
		Borrow parent = env.holderOf(origin);
		List<Permission> transferred;
		if (r.getBorrowKind() == Borrow.Kind.SHARED) {
			transferred = halve(held);
			exhale(env, transferred, permission(span, "borrow of " + p + " might lack permission"), out);
			inhale(env, rebase(transferred, origin, holder), Collections.emptyList(), span, out);
		} else {
			transferred = held;
			transfer(env, held, origin, holder, span, "mutable borrow of " + p, out);
			env.rehome(origin, holder, true);
		}
		env.addBorrow(new Borrow(r.getBorrow(), r.getBorrowKind(), p, origin, holder, transferred),
				parent == null ? null : parent.getId());
		logger.trace("borrow {} created at {}", r.getBorrow(), span);
	}

	/**
	 * Give half of everything held beneath one path to another path, as when
	 * a shared reference is copied.
	 */
	private void share(PermissionEnvironment env, AccessPath from, AccessPath to, Place origin, Span span,
			List<Stmt> out) {
		List<Permission> halves = halve(env.under(from, true));
		if (halves.isEmpty()) {
			return;
		}
		Borrow parent = env.holderOf(from);
		exhale(env, halves, permission(span, "copy of " + origin + " might lack permission"), out);
		inhale(env, rebase(halves, from, to), Collections.emptyList(), span, out);
		Borrow b = new Borrow(env.nextDerivedId(), Borrow.Kind.SHARED, origin, from, to, halves);
		env.addBorrow(b, parent == null ? null : parent.getId());
	}

	/**
	 * Transfer permissions from beneath one path to beneath another, together
	 * with the values they protect.
	 */
	private void transfer(PermissionEnvironment env, List<Permission> held, AccessPath from, AccessPath to,
			Span span, String what, List<Stmt> out) {
		if (held.isEmpty()) {
			return;
		}
		String label = freshLabel();
		out.add(LABEL(label));
		exhale(env, held, permission(span, what + " might lack permission"), out);
		ArrayList<Expr.Logical> facts = new ArrayList<>();
		for (Permission p : held) {
			if (!p.isPredicate()) {
				AccessPath q = p.getPath().replacePrefix(from, to);
				facts.add(EQ(TypeEncoder.location(q), OLD(label, TypeEncoder.location(p.getPath()))));
			}
		}
		inhale(env, rebase(held, from, to), facts, span, out);
	}

	/**
	 * End a live borrow, returning what it holds to the place it was taken
	 * from. Borrows derived from it end first.
	 *
	 * @param env
	 * @param id
	 * @param span
	 * @param out
	 */
	public void expire(PermissionEnvironment env, int id, Span span, List<Stmt> out) {
		Borrow b = env.getBorrow(id);
		if (b == null) {
			logger.debug("borrow {} is not live at {}", id, span);
			return;
		}
		for (int d : env.getDerived(id)) {
			expire(env, d, span, out);
		}
		boolean mutable = b.getKind() == Borrow.Kind.MUTABLE;
		ArrayList<Permission> held = new ArrayList<>();
		ArrayList<Expr.Logical> facts = new ArrayList<>();
		String label = mutable ? freshLabel() : null;
		for (Permission p : b.getHeld()) {
			PermAmount a = PermAmount.min(p.getAmount(), env.amountOf(p.getPath()));
			if (!a.isNone()) {
				held.add(p.withAmount(a));
				if (mutable && !p.isPredicate()) {
					AccessPath o = p.getPath().replacePrefix(b.getHolder(), b.getOriginPath());
					facts.add(EQ(TypeEncoder.location(o), OLD(label, TypeEncoder.location(p.getPath()))));
				}
			}
		}
		if (label != null) {
			out.add(LABEL(label));
		}
		exhale(env, held, permission(span, "borrow of " + b.getOrigin() + " might not be returned"), out);
		env.removeBorrow(id);
		for (Permission p : b.getHeld()) {
			types.rebase(p.getPath(), p.getPath().replacePrefix(b.getHolder(), b.getOriginPath()));
		}
		inhale(env, b.getTransferred(), facts, span, out);
		if (mutable) {
			env.rehome(b.getHolder(), b.getOriginPath(), true);
		}
		logger.trace("borrow {} expired at {}", id, span);
	}

	/**
	 * Give up everything held beneath a path. Any borrow whose holder lies
	 * beneath it must have ended, since its holder is being discarded.
	 */
	private void release(PermissionEnvironment env, AccessPath path, Span span, List<Stmt> out) {
		for (Borrow b : Lists.reverse(new ArrayList<>(env.getBorrows()))) {
			if (b.getHolder().hasPrefix(path) && env.getBorrow(b.getId()) != null) {
				expire(env, b.getId(), span, out);
			}
		}
		exhale(env, env.under(path, true), null, out);
	}

	// =========================================================================
	// Predicates
	// =========================================================================

	/**
	 * Unfold every predicate instance which a place is reached through, from
	 * the outermost inwards. An instance which is not held has already been
	 * unfolded, or has been lent out.
	 *
	 * @param env
	 * @param place
	 * @param span
	 * @param out
	 */
	public void unfold(PermissionEnvironment env, Place place, Span span, List<Stmt> out) {
		Place current = Place.local(place.getLocal());
		for (Place.Projection p : place.getProjections()) {
			switch (p.getKind()) {
			case DEREF: {
				Ty type = body.typeOf(current);
				Ty target = type.getKind() == Ty.Kind.BOX ? ((Ty.Box) type).getTarget()
						: type.getKind() == Ty.Kind.REF ? ((Ty.Ref) type).getTarget() : null;
				if (target != null && TypeEncoder.isFolded(target)) {
					AccessPath object = values.path(current, span).append(TypeEncoder.VAL_REF);
					String name = types.predicateOf((Ty.Adt) target);
					Permission instance = env.get(object.append(name));
					if (instance != null) {
						env.remove(instance);
						for (Permission q : types.unfold(instance)) {
							env.add(q, span);
						}
						env.markUnfolded(instance);
						out.add(UNFOLD((Expr.PredicateAccessPredicate) TypeEncoder.access(instance)));
					}
				}
				current = current.deref();
				break;
			}
			case FIELD:
				current = current.field(p.getName());
				break;
			default:
				// Elements of integer arrays are not objects
				return;
			}
		}
	}

	/**
	 * Fold back every unfolded predicate instance whose body is held in full
	 * again, innermost first.
	 *
	 * @param env
	 * @param span
	 * @param out
	 */
	public void fold(PermissionEnvironment env, Span span, List<Stmt> out) {
		for (Permission instance : Lists.reverse(env.getUnfolded())) {
			List<Permission> parts = types.unfold(instance);
			if (!isHeld(env, parts)) {
				logger.trace("cannot fold {} at {}", instance, span);
				continue;
			}
			for (Permission q : parts) {
				env.remove(q);
			}
			env.add(instance, span);
			env.markFolded(instance);
			out.add(FOLD((Expr.PredicateAccessPredicate) TypeEncoder.access(instance)));
		}
	}

	// =========================================================================
	// Calls
	// =========================================================================

	/**
	 * Encode a call to a function whose body is checked separately. The
	 * caller asserts the callee's precondition and gives up the permissions
	 * it needs, then receives the permissions of the result (and back the
	 * targets of any mutable references it passed) and assumes the
	 * postcondition.
	 *
	 * @param env
	 * @param call
	 * @param callee
	 * @param label
	 *            Label marking the state before the call.
	 * @param out
	 */
	public void call(PermissionEnvironment env, NormalizedCfg.Terminator.Call call, ProcedureContract callee,
			String label, List<Stmt> out) {
		Span span = call.getSpan();
		FunctionSig sig = callee.getSignature();
		ResolvedSpec spec = callee.getSpec();
		List<Operand> args = call.getArguments();
		if (args.size() != sig.getArity()) {
			throw new StructuralException(StructuralException.Kind.INVALID_INPUT, "call to " + sig.getName()
					+ " has " + args.size() + " arguments, but expected " + sig.getArity(), span);
		}
		out.add(LABEL(label));
		HashMap<Integer, Expr> locations = new HashMap<>();
		HashMap<Integer, Expr> vals = new HashMap<>();
		for (int i = 0; i != args.size(); ++i) {
			Operand a = args.get(i);
			if (a instanceof Operand.Constant || a.getPlace().isIndexed()) {
				vals.put(i + 1, values.operand(a, span));
			} else {
				locations.put(i + 1, values.location(a.getPlace(), span));
			}
		}
		Place dest = call.getDestination();
		if (dest != null && dest.isIndexed()) {
			throw new UnsupportedException("cannot store the result of a call into an array element", span);
		}
		if (dest != null) {
			locations.put(0, values.location(dest, span));
		}
		ValueEncoder.Bindings bindings = values.bindCall(spec.getSnapshots(), label, locations, vals);
		for (ResolvedSpec.Clause c : spec.getRequires()) {
			Obligation o = obligations.register(Obligation.Kind.PRECONDITION, span,
					"precondition of " + sig.getName() + " might not hold.");
			out.add(ASSERT(values.condition(c.getExpr(), bindings), ATTRIBUTE(o)));
		}
		// Determine the permissions the callee needs
		ArrayList<Permission> given = new ArrayList<>();
		ArrayList<Permission> lent = new ArrayList<>();
		ArrayList<Expr.Logical> readable = new ArrayList<>();
		for (int i = 0; i != args.size(); ++i) {
			Operand a = args.get(i);
			Ty formal = sig.getParameterTypes().get(i);
			if (a instanceof Operand.Constant || a.getPlace().isIndexed() || TypeEncoder.isScalar(formal)) {
				continue;
			}
			AccessPath path = values.path(a.getPlace(), span);
			if (formal.getKind() == Ty.Kind.REF && ((Ty.Ref) formal).isMutable()) {
				lent.addAll(env.under(path.append(TypeEncoder.VAL_REF), true));
			} else if (formal.getKind() == Ty.Kind.REF) {
				for (Permission p : env.under(path.append(TypeEncoder.VAL_REF), true)) {
					if (!p.isPredicate()) {
						readable.add(GT(PERM((Expr.FieldAccess) TypeEncoder.location(p.getPath())), NONE()));
					}
				}
			} else if (a.getKind() == Operand.Kind.MOVE) {
				given.addAll(env.under(path, true));
			}
		}
		if (!readable.isEmpty()) {
			Obligation o = obligations.register(Obligation.Kind.PRECONDITION, span,
					"insufficient permission to call " + sig.getName());
			out.add(ASSERT(AND(readable), ATTRIBUTE(o)));
		}
		ArrayList<Permission> needed = new ArrayList<>(given);
		needed.addAll(lent);
		if (!needed.isEmpty()) {
			Obligation o = obligations.register(Obligation.Kind.PRECONDITION, span,
					"insufficient permission to call " + sig.getName());
			exhale(env, needed, o, out);
		}
		if (sig.isDiverging() || call.getTarget() == null) {
			out.add(INHALE(CONST(false)));
			return;
		}
		ArrayList<Permission> received = new ArrayList<>(lent);
		if (dest != null) {
			Ty rt = sig.getReturnType();
			if (rt.getKind() == Ty.Kind.REF) {
				throw new UnsupportedException("calls to functions returning references are not supported", span);
			}
			AccessPath path = values.path(dest, span);
			release(env, path, span, out);
			received.addAll(types.tree(rt, path, PermAmount.WRITE, true));
		}
		inhale(env, received, types.bounds(received), span, out);
		for (ResolvedSpec.Clause c : spec.getEnsures()) {
			out.add(INHALE(values.condition(c.getExpr(), bindings)));
		}
		env.checkConservation(span);
	}

	// =========================================================================
	// Control flow
	// =========================================================================

	/**
	 * Reconcile the permissions held at the end of one block with those
	 * expected at the start of a successor. Borrows which are not live at the
	 * successor end, and anything held in excess is given up. Along a back
	 * edge, anything missing is a failure to restore what the loop started
	 * with.
	 *
	 * @param from
	 *            The environment at the end of the source block, which is
	 *            updated.
	 * @param to
	 * @param backEdge
	 * @param span
	 * @param out
	 */
	public void reconcile(PermissionEnvironment from, PermissionEnvironment to, boolean backEdge, Span span,
			List<Stmt> out) {
		for (Borrow b : Lists.reverse(new ArrayList<>(from.getBorrows()))) {
			if (from.getBorrow(b.getId()) != null && !b.equals(to.getBorrow(b.getId()))) {
				expire(from, b.getId(), span, out);
			}
		}
		ArrayList<Permission> excess = new ArrayList<>();
		for (Permission p : from.getPermissions()) {
			PermAmount t = to.amountOf(p.getPath());
			if (p.getAmount().compareTo(t) > 0) {
				excess.add(p.withAmount(p.getAmount().subtract(t)));
			}
		}
		exhale(from, excess, null, out);
		if (backEdge) {
			ArrayList<Expr.Logical> missing = new ArrayList<>();
			for (Permission q : to.getPermissions()) {
				PermAmount f = from.amountOf(q.getPath());
				if (f.compareTo(q.getAmount()) < 0) {
					missing.add(TypeEncoder.access(q.withAmount(q.getAmount().subtract(f))));
				}
			}
			if (!missing.isEmpty()) {
				Obligation o = permission(span, "loop body might not restore the permissions it started with");
				out.add(EXHALE(AND(Lists.reverse(missing)), ATTRIBUTE(o)));
			}
		}
	}

	/**
	 * Forget the values beneath some paths, keeping the permissions.
	 *
	 * @param env
	 * @param written
	 * @param span
	 * @param out
	 */
	public void havoc(PermissionEnvironment env, Collection<AccessPath> written, Span span, List<Stmt> out) {
		ArrayList<Permission> targets = new ArrayList<>();
		for (Permission p : env.getPermissions()) {
			for (AccessPath w : written) {
				if (p.getPath().hasPrefix(w) && !p.getPath().equals(w)) {
					targets.add(p);
					break;
				}
			}
		}
		if (targets.isEmpty()) {
			return;
		}
		exhale(env, targets, null, out);
		inhale(env, targets, types.bounds(targets), span, out);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Inhale some permissions, parents first, followed by some facts.
	 *
	 * @param env
	 * @param permissions
	 * @param facts
	 * @param span
	 * @param out
	 */
	public void inhale(PermissionEnvironment env, List<Permission> permissions, List<Expr.Logical> facts, Span span,
			List<Stmt> out) {
		if (permissions.isEmpty() && facts.isEmpty()) {
			return;
		}
		ArrayList<Permission> sorted = new ArrayList<>(permissions);
		Collections.sort(sorted);
		ArrayList<Expr.Logical> parts = new ArrayList<>();
		for (Permission p : sorted) {
			env.add(p, span);
			parts.add(TypeEncoder.access(p));
		}
		parts.addAll(facts);
		out.add(INHALE(AND(parts)));
	}

	/**
	 * Exhale some permissions, children first.
	 *
	 * @param env
	 * @param permissions
	 * @param obligation
	 *            Obligation discharged by the exhale, or <code>null</code>
	 *            if it cannot fail.
	 * @param out
	 */
	public void exhale(PermissionEnvironment env, List<Permission> permissions, Obligation obligation,
			List<Stmt> out) {
		if (permissions.isEmpty()) {
			return;
		}
		ArrayList<Permission> sorted = new ArrayList<>(permissions);
		Collections.sort(sorted, Collections.reverseOrder());
		ArrayList<Expr.Logical> parts = new ArrayList<>();
		for (Permission p : sorted) {
			env.remove(p);
			parts.add(TypeEncoder.access(p));
		}
		if (obligation == null) {
			out.add(EXHALE(AND(parts)));
		} else {
			out.add(EXHALE(AND(parts), ATTRIBUTE(obligation)));
		}
	}

	private Obligation permission(Span span, String description) {
		return obligations.register(Obligation.Kind.PERMISSION, span, description);
	}

	private List<Permission> rebase(List<Permission> permissions, AccessPath from, AccessPath to) {
		ArrayList<Permission> r = new ArrayList<>();
		for (Permission p : permissions) {
			AccessPath q = p.getPath().replacePrefix(from, to);
			types.rebase(p.getPath(), q);
			r.add(p.withPath(q));
		}
		return r;
	}

	private static List<Permission> halve(List<Permission> permissions) {
		ArrayList<Permission> r = new ArrayList<>();
		for (Permission p : permissions) {
			r.add(p.withAmount(p.getAmount().half()));
		}
		return r;
	}
}
