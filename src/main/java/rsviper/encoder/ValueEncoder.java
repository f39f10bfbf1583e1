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

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import rsviper.core.ViperFile.Expr;
import rsviper.core.ViperFile.Type;
import rsviper.lang.AccessPath;
import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.Ty;
import rsviper.lang.UnsupportedException;
import rsviper.mir.BinOp;
import rsviper.mir.Body;
import rsviper.mir.Operand;
import rsviper.mir.Rvalue;
import rsviper.spec.ResolvedExpr;
import rsviper.spec.SpecExpr;

/**
 * Translates places, operands and specification expressions into
 * expressions of the generated program.
 *
 * @author The Rust2Viper Project Developers
 */
public class ValueEncoder {
	public static final String DIV = "div$trunc";
	public static final String REM = "rem$trunc";
	public static final String SUM = "seq_sum";

	private final Body body;
	private final TypeEncoder types;

	public ValueEncoder(Body body, TypeEncoder types) {
		this.body = body;
		this.types = types;
	}

	public Body getBody() {
		return body;
	}

	// =========================================================================
	// Places and operands
	// =========================================================================

	/**
	 * Determine the access path of a place.
	 *
	 * @param place
	 * @param span
	 * @return
	 * @throws UnsupportedException
	 *             if the place selects an array element, since elements are
	 *             not stored in objects of their own.
	 */
	public AccessPath path(Place place, Span span) {
		AccessPath r = AccessPath.root(body.getLocal(place.getLocal()).getVariable());
		Place current = Place.local(place.getLocal());
		for (Place.Projection p : place.getProjections()) {
			Ty type = body.typeOf(current);
			switch (p.getKind()) {
			case FIELD:
				r = r.append(types.fieldOf(type, p.getName()));
				current = current.field(p.getName());
				break;
			case DEREF:
				r = r.append(types.useField(TypeEncoder.VAL_REF));
				current = current.deref();
				break;
			default:
				throw new UnsupportedException("array element " + place + " cannot be borrowed or moved", span);
			}
		}
		return r;
	}

	public Expr location(Place place, Span span) {
		return TypeEncoder.location(path(place, span));
	}

	/**
	 * Read the value stored in a place of scalar type.
	 *
	 * @param place
	 * @param span
	 * @return
	 */
	public Expr value(Place place, Span span) {
		Ty type = body.typeOf(place);
		if (place.isIndexed()) {
			Place.Projection last = place.getLast();
			if (last.getKind() != Place.Projection.Kind.INDEX || place.getParent().isIndexed()) {
				throw new UnsupportedException("only elements of integer arrays can be accessed: " + place, span);
			}
			Expr index = value(Place.local(last.getIndexLocal()), span);
			return SEQ_INDEX(sequence(place.getParent(), span), index);
		}
		String field = TypeEncoder.valueField(type);
		if (field == null) {
			throw new UnsupportedException("value of " + place + " has no direct representation", span);
		}
		return FIELD(location(place, span), types.useField(field));
	}

	/**
	 * Get the field holding the contents of an integer array.
	 *
	 * @param place
	 * @param span
	 * @return
	 */
	public Expr.FieldAccess sequence(Place place, Span span) {
		Ty type = body.typeOf(place);
		if (!TypeEncoder.VAL_SEQ.equals(TypeEncoder.valueField(type))) {
			throw new UnsupportedException("only integer arrays are supported: " + place, span);
		}
		return FIELD(location(place, span), types.useField(TypeEncoder.VAL_SEQ));
	}

	public Ty typeOf(Operand o) {
		if (o instanceof Operand.Constant) {
			return ((Operand.Constant) o).getType();
		}
		return body.typeOf(o.getPlace());
	}

	public Expr operand(Operand o, Span span) {
		if (o instanceof Operand.Constant) {
			Object v = ((Operand.Constant) o).getValue();
			if (v instanceof Boolean) {
				return CONST((Boolean) v);
			}
			return CONST((BigInteger) v);
		}
		return value(o.getPlace(), span);
	}

	/**
	 * Translate a binary operation, without regard for overflow.
	 *
	 * @param b
	 * @param span
	 * @return
	 */
	public Expr binary(Rvalue.Binary b, Span span) {
		Expr l = operand(b.getLeftHandSide(), span);
		Expr r = operand(b.getRightHandSide(), span);
		switch (b.getOp()) {
		case ADD:
			return ADD(l, r);
		case SUB:
			return SUB(l, r);
		case MUL:
			return MUL(l, r);
		case DIV:
			return INVOKE(DIV, l, r);
		case REM:
			return INVOKE(REM, l, r);
		case EQ:
			return EQ(l, r);
		case NE:
			return NEQ(l, r);
		case LT:
			return LT(l, r);
		case LE:
			return LTEQ(l, r);
		case GT:
			return GT(l, r);
		case GE:
			return GTEQ(l, r);
		case BIT_AND:
		case BIT_OR:
			if (typeOf(b.getLeftHandSide()).getKind() != Ty.Kind.BOOL) {
				throw new UnsupportedException("bitwise operations on integers are not supported", span);
			}
			return b.getOp() == BinOp.BIT_AND ? AND(logical(l), logical(r)) : OR(logical(l), logical(r));
		default:
			throw new IllegalArgumentException("unknown operator " + b.getOp());
		}
	}

	public Expr unary(Rvalue.Unary u, Span span) {
		Expr v = operand(u.getOperand(), span);
		switch (u.getOp()) {
		case NOT:
			if (typeOf(u.getOperand()).getKind() != Ty.Kind.BOOL) {
				throw new UnsupportedException("bitwise negation of integers is not supported", span);
			}
			return NOT(logical(v));
		case NEG:
			return NEG(v);
		default:
			throw new IllegalArgumentException("unknown operator " + u.getOp());
		}
	}

	// =========================================================================
	// Specifications
	// =========================================================================

	public Expr.Logical condition(ResolvedExpr e, Bindings bindings) {
		return logical(encode(e, bindings));
	}

	public Expr encode(ResolvedExpr e, Bindings bindings) {
		switch (e.getKind()) {
		case CONSTANT: {
			Object v = ((ResolvedExpr.Constant) e).getValue();
			return v instanceof Boolean ? CONST((Boolean) v) : CONST((BigInteger) v);
		}
		case LOCAL: {
			int index = ((ResolvedExpr.Local) e).getIndex();
			Expr b = bindings.getLocation(index);
			return b != null ? b : VAR(body.getLocal(index).getVariable());
		}
		case FIELD: {
			ResolvedExpr.Field f = (ResolvedExpr.Field) e;
			return FIELD(encode(f.getSource(), bindings), types.fieldOf(f.getContainer(), f.getName()));
		}
		case DEREF:
			if (TypeEncoder.isFolded(e.getType())) {
				throw new UnsupportedException("specifications cannot look inside recursive structures", e.getSpan());
			}
			// The location of a target is the address held by the reference
			return encode(((ResolvedExpr.Deref) e).getReference(), bindings);
		case READ: {
			ResolvedExpr location = ((ResolvedExpr.Read) e).getLocation();
			if (location instanceof ResolvedExpr.Local) {
				Expr v = bindings.getValue(((ResolvedExpr.Local) location).getIndex());
				if (v != null) {
					return v;
				}
			}
			String field = TypeEncoder.valueField(location.getCategory());
			if (field == null) {
				throw new UnsupportedException("compound values cannot be read in specifications", e.getSpan());
			}
			return FIELD(encode(location, bindings), types.useField(field));
		}
		case SNAPSHOT: {
			ResolvedExpr.Snapshot s = (ResolvedExpr.Snapshot) e;
			Expr b = bindings.getSnapshot(s.getIndex());
			return b != null ? b : VAR(s.getName());
		}
		case BOUND:
			return VAR(((ResolvedExpr.Bound) e).getName());
		case UNARY: {
			ResolvedExpr.Unary u = (ResolvedExpr.Unary) e;
			Expr v = encode(u.getOperand(), bindings);
			return u.getOp() == SpecExpr.UnaryOp.NOT ? NOT(logical(v)) : NEG(v);
		}
		case BINARY:
			return binary((ResolvedExpr.Binary) e, bindings);
		case CONDITIONAL: {
			ResolvedExpr.Conditional c = (ResolvedExpr.Conditional) e;
			return CONDITIONAL(condition(c.getCondition(), bindings), encode(c.getTrueBranch(), bindings),
					encode(c.getFalseBranch(), bindings));
		}
		case INDEX: {
			ResolvedExpr.Index i = (ResolvedExpr.Index) e;
			return SEQ_INDEX(encode(i.getSource(), bindings), encode(i.getIndex(), bindings));
		}
		case LENGTH:
			return SEQ_LENGTH(encode(((ResolvedExpr.Length) e).getOperand(), bindings));
		case SUM: {
			ResolvedExpr.Sum s = (ResolvedExpr.Sum) e;
			return INVOKE(SUM, encode(s.getSource(), bindings), encode(s.getFrom(), bindings),
					encode(s.getTo(), bindings));
		}
		case QUANTIFIER: {
			ResolvedExpr.Quantifier q = (ResolvedExpr.Quantifier) e;
			Expr.Logical b = condition(q.getBody(), bindings);
			return q.isUniversal() ? FORALL(q.getVariable(), Type.Int, b) : EXISTS(q.getVariable(), Type.Int, b);
		}
		default:
			throw new IllegalArgumentException("unknown expression " + e);
		}
	}

	private Expr binary(ResolvedExpr.Binary b, Bindings bindings) {
		Expr l = encode(b.getLeftHandSide(), bindings);
		Expr r = encode(b.getRightHandSide(), bindings);
		switch (b.getOp()) {
		case ADD:
			return ADD(l, r);
		case SUB:
			return SUB(l, r);
		case MUL:
			return MUL(l, r);
		case DIV:
			return INVOKE(DIV, l, r);
		case REM:
			return INVOKE(REM, l, r);
		case EQ:
			return EQ(l, r);
		case NE:
			return NEQ(l, r);
		case LT:
			return LT(l, r);
		case LE:
			return LTEQ(l, r);
		case GT:
			return GT(l, r);
		case GE:
			return GTEQ(l, r);
		case AND:
			return AND(logical(l), logical(r));
		case OR:
			return OR(logical(l), logical(r));
		case IMPLIES:
			return IMPLIES(logical(l), logical(r));
		case IFF:
			return IFF(logical(l), logical(r));
		default:
			throw new IllegalArgumentException("unknown operator " + b.getOp());
		}
	}

	/**
	 * Translate the snapshots of a callee, evaluated in the state at a given
	 * label of the caller.
	 *
	 * @param snapshots
	 * @param label
	 * @param locations
	 * @param values
	 * @return Bindings for the callee's specification.
	 */
	public Bindings bindCall(List<ResolvedExpr.Snapshot> snapshots, String label, Map<Integer, Expr> locations,
			Map<Integer, Expr> values) {
		Bindings outer = new Bindings(locations, values, Collections.emptyMap());
		HashMap<Integer, Expr> snaps = new HashMap<>();
		for (ResolvedExpr.Snapshot s : snapshots) {
			snaps.put(s.getIndex(), OLD(label, encode(s.getValue(), outer)));
		}
		return new Bindings(locations, values, snaps);
	}

	public static Expr.Logical logical(Expr e) {
		if (e instanceof Expr.Logical) {
			return (Expr.Logical) e;
		}
		throw new IllegalArgumentException("expected a boolean expression, found " + e);
	}

	/**
	 * Determines what the locals of a specification denote. By default a local
	 * denotes the variable of the function being encoded, and a snapshot
	 * denotes the variable it was captured in; a function's specification is
	 * instantiated at a call site by binding its parameters to the arguments.
	 */
	public static final class Bindings {
		public static final Bindings NONE = new Bindings(Collections.emptyMap(), Collections.emptyMap(),
				Collections.emptyMap());

		private final ImmutableMap<Integer, Expr> locations;
		private final ImmutableMap<Integer, Expr> values;
		private final ImmutableMap<Integer, Expr> snapshots;

		public Bindings(Map<Integer, Expr> locations, Map<Integer, Expr> values, Map<Integer, Expr> snapshots) {
			this.locations = ImmutableMap.copyOf(locations);
			this.values = ImmutableMap.copyOf(values);
			this.snapshots = ImmutableMap.copyOf(snapshots);
		}

		/**
		 * Get the object bound to a given local.
		 *
		 * @param local
		 * @return The object, or <code>null</code> if unbound.
		 */
		public Expr getLocation(int local) {
			return locations.get(local);
		}

		/**
		 * Get the value bound to a given local, when the argument is a constant
		 * rather than an object.
		 *
		 * @param local
		 * @return
		 */
		public Expr getValue(int local) {
			return values.get(local);
		}

		public Expr getSnapshot(int index) {
			return snapshots.get(index);
		}
	}
}
