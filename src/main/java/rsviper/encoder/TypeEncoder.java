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
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import rsviper.core.ViperFile.Expr;
import rsviper.core.ViperFile.Type;
import rsviper.lang.AccessPath;
import rsviper.lang.IntKind;
import rsviper.lang.PermAmount;
import rsviper.lang.Permission;
import rsviper.lang.Span;
import rsviper.lang.Ty;
import rsviper.lang.UnsupportedException;
import rsviper.spec.SpecKind;

/**
 * Determines how values of each source type are laid out in the heap of the
 * generated program. Every value lives in an object, and a scalar is stored
 * in one of the value fields of its object. A compound value has one field
 * per component, each of which refers to the object holding that component.
 * A reference (or box) stores the address of its target in
 * <code>val_ref</code>.
 * <p>
 * The target of a reference or box whose type is a recursive structure
 * cannot be laid out in full. It is held instead as an instance of a
 * predicate for that structure, whose body holds one level of the structure
 * and which is unfolded wherever that level is accessed.
 * <p>
 * An instance is used for a single procedure, and records every field,
 * predicate, type tag and integer kind that the procedure mentions so that
 * exactly those can be declared.
 *
 * @author The Rust2Viper Project Developers
 */
public class TypeEncoder {
	public static final String VAL_INT = "val_int";
	public static final String VAL_BOOL = "val_bool";
	public static final String VAL_REF = "val_ref";
	public static final String VAL_SEQ = "val_seq";
	/**
	 * The parameter of every predicate.
	 */
	public static final String SELF = "self";

	private final boolean checkOverflow;
	private final Span span;
	private final TreeSet<String> fields = new TreeSet<>();
	private final TreeSet<String> predicates = new TreeSet<>();
	/**
	 * The structures whose predicates have a body, by predicate name.
	 */
	private final TreeMap<String, Ty.Adt> structures = new TreeMap<>();
	private final TreeSet<String> tags = new TreeSet<>();
	private final EnumSet<IntKind> intKinds = EnumSet.noneOf(IntKind.class);
	private final HashMap<AccessPath, IntKind> intPaths = new HashMap<>();

	public TypeEncoder(boolean checkOverflow, Span span) {
		this.checkOverflow = checkOverflow;
		this.span = span;
	}

	public boolean isCheckingOverflow() {
		return checkOverflow;
	}

	// =========================================================================
	// Names
	// =========================================================================

	/**
	 * Determine the field holding a value of a given type directly.
	 *
	 * @param type
	 * @return The field, or <code>null</code> if values of this type are not
	 *         stored in a single field.
	 */
	public static String valueField(Ty type) {
		switch (type.getKind()) {
		case BOOL:
			return VAL_BOOL;
		case INT:
			return VAL_INT;
		case REF:
		case BOX:
			return VAL_REF;
		case ARRAY:
			return ((Ty.Array) type).getElement().isInt() ? VAL_SEQ : null;
		default:
			return null;
		}
	}

	public static String valueField(SpecKind kind) {
		switch (kind) {
		case BOOL:
			return VAL_BOOL;
		case INT:
			return VAL_INT;
		case REF:
			return VAL_REF;
		case SEQ:
			return VAL_SEQ;
		default:
			return null;
		}
	}

	/**
	 * Check whether values of a given type are held in a single value field.
	 *
	 * @param type
	 * @return
	 */
	public static boolean isScalar(Ty type) {
		Ty.Kind k = type.getKind();
		return k == Ty.Kind.BOOL || k == Ty.Kind.INT || (k == Ty.Kind.ARRAY && valueField(type) != null);
	}

	/**
	 * Get the field which selects a given component of a struct or tuple.
	 *
	 * @param container
	 * @param name
	 * @return
	 */
	public String fieldOf(Ty container, String name) {
		String f;
		if (container.getKind() == Ty.Kind.TUPLE) {
			f = "tuple_" + sanitise(name);
		} else if (container.getKind() == Ty.Kind.ADT) {
			f = "f$" + sanitise(((Ty.Adt) container).getName()) + "$" + sanitise(name);
		} else {
			throw new UnsupportedException("cannot select " + name + " from values of type " + container, span);
		}
		fields.add(f);
		return f;
	}

	public String useField(String field) {
		fields.add(field);
		return field;
	}

	/**
	 * Get the type of a given field. The value fields have the type of the
	 * value they store, whilst every other field refers to an object.
	 *
	 * @param field
	 * @return
	 */
	public static Type fieldType(String field) {
		switch (field) {
		case VAL_INT:
			return Type.Int;
		case VAL_BOOL:
			return Type.Bool;
		case VAL_SEQ:
			return new Type.Sequence(Type.Int);
		default:
			return Type.Ref;
		}
	}

	/**
	 * Get the type of variables holding a value of a given category, for
	 * example a snapshot.
	 *
	 * @param kind
	 * @return
	 */
	public Type valueType(SpecKind kind) {
		switch (kind) {
		case BOOL:
			return Type.Bool;
		case INT:
			return Type.Int;
		case REF:
			return Type.Ref;
		case SEQ:
			return new Type.Sequence(Type.Int);
		default:
			throw new UnsupportedException("compound values cannot be captured", span);
		}
	}

	public String tagOf(Ty type) {
		String t = "tag$" + sanitise(type.getMangledName());
		tags.add(t);
		return t;
	}

	public String predicateOf(Ty.Param type) {
		String p = "param$" + sanitise(type.getName());
		predicates.add(p);
		return p;
	}

	public String predicateOf(Ty.Adt type) {
		String p = sanitise(type.getMangledName());
		structures.put(p, type);
		return p;
	}

	private static String sanitise(String name) {
		return name.replaceAll("[^A-Za-z0-9_$]", "_");
	}

	// =========================================================================
	// Permission trees
	// =========================================================================

	/**
	 * Determine the permissions needed to hold a value of a given type rooted
	 * at a given path, parents before children.
	 *
	 * @param type
	 * @param base
	 * @param amount
	 * @param targets
	 *            Whether to include what references and boxes point to. The
	 *            target of a shared reference is held at half the amount of
	 *            the reference itself.
	 * @return
	 */
	public List<Permission> tree(Ty type, AccessPath base, PermAmount amount, boolean targets) {
		ArrayList<Permission> r = new ArrayList<>();
		tree(type, base, amount, targets, r);
		return r;
	}

	private void tree(Ty type, AccessPath base, PermAmount amount, boolean targets, List<Permission> r) {
		switch (type.getKind()) {
		case BOOL:
			r.add(leaf(base, VAL_BOOL, amount));
			break;
		case INT: {
			Permission p = leaf(base, VAL_INT, amount);
			intPaths.put(p.getPath(), ((Ty.Int) type).getIntKind());
			r.add(p);
			break;
		}
		case ARRAY:
			if (valueField(type) == null) {
				throw new UnsupportedException("arrays of " + ((Ty.Array) type).getElement() + " are not supported",
						span);
			}
			r.add(leaf(base, VAL_SEQ, amount));
			break;
		case REF: {
			Ty.Ref ref = (Ty.Ref) type;
			r.add(leaf(base, VAL_REF, amount));
			if (targets) {
				PermAmount a = ref.isMutable() ? amount : amount.half();
				target(ref.getTarget(), base.append(VAL_REF), a, r);
			}
			break;
		}
		case BOX:
			r.add(leaf(base, VAL_REF, amount));
			if (targets) {
				target(((Ty.Box) type).getTarget(), base.append(VAL_REF), amount, r);
			}
			break;
		case TUPLE: {
			List<Ty> elements = ((Ty.Tuple) type).getElements();
			for (int i = 0; i != elements.size(); ++i) {
				AccessPath p = base.append(fieldOf(type, Integer.toString(i)));
				r.add(new Permission(p, amount));
				tree(elements.get(i), p, amount, targets, r);
			}
			break;
		}
		case ADT:
			for (Ty.Adt.Field f : ((Ty.Adt) type).getFields()) {
				AccessPath p = base.append(fieldOf(type, f.getName()));
				r.add(new Permission(p, amount));
				tree(f.getType(), p, amount, targets, r);
			}
			break;
		case PARAM: {
			String pred = predicateOf((Ty.Param) type);
			r.add(new Permission(base.append(pred), amount, pred));
			break;
		}
		case NEVER:
			break;
		}
	}

	private void target(Ty type, AccessPath object, PermAmount amount, List<Permission> r) {
		if (isFolded(type)) {
			r.add(instance((Ty.Adt) type, object, amount));
		} else {
			tree(type, object, amount, true, r);
		}
	}

	/**
	 * Construct the permission to the predicate instance which holds a
	 * recursive structure.
	 *
	 * @param type
	 * @param object
	 *            Path of the object holding the structure.
	 * @param amount
	 * @return
	 */
	public Permission instance(Ty.Adt type, AccessPath object, PermAmount amount) {
		String p = predicateOf(type);
		return new Permission(object.append(p), amount, p);
	}

	/**
	 * Determine the permissions which an instance of a structure's predicate
	 * stands for, i.e. what it is exchanged for when unfolded.
	 *
	 * @param instance
	 * @return Permissions in the order of {@link #tree}.
	 */
	public List<Permission> unfold(Permission instance) {
		Ty.Adt type = structures.get(instance.getPredicate());
		if (type == null) {
			throw new IllegalArgumentException("predicate " + instance.getPredicate() + " has no body");
		}
		return tree(type, instance.getObject(), instance.getAmount(), true);
	}

	/**
	 * Check whether a type is a structure which contains itself, and so is
	 * held behind references and boxes as a predicate instance.
	 *
	 * @param type
	 * @return
	 */
	public static boolean isFolded(Ty type) {
		if (type.getKind() != Ty.Kind.ADT) {
			return false;
		}
		Ty.Adt adt = (Ty.Adt) type;
		HashSet<String> seen = new HashSet<>();
		for (Ty.Adt.Field f : adt.getFields()) {
			if (contains(f.getType(), adt, seen)) {
				return true;
			}
		}
		return false;
	}

	private static boolean contains(Ty type, Ty.Adt adt, Set<String> seen) {
		switch (type.getKind()) {
		case REF:
			return contains(((Ty.Ref) type).getTarget(), adt, seen);
		case BOX:
			return contains(((Ty.Box) type).getTarget(), adt, seen);
		case ARRAY:
			return contains(((Ty.Array) type).getElement(), adt, seen);
		case TUPLE:
			for (Ty t : ((Ty.Tuple) type).getElements()) {
				if (contains(t, adt, seen)) {
					return true;
				}
			}
			return false;
		case ADT: {
			Ty.Adt a = (Ty.Adt) type;
			if (a.equals(adt)) {
				return true;
			} else if (!seen.add(a.getName())) {
				return false;
			}
			for (Ty.Adt.Field f : a.getFields()) {
				if (contains(f.getType(), adt, seen)) {
					return true;
				}
			}
			return false;
		}
		default:
			return false;
		}
	}

	private Permission leaf(AccessPath base, String field, PermAmount amount) {
		fields.add(field);
		return new Permission(base.append(field), amount);
	}

	/**
	 * Determine the paths of the reference fields in the structure of a value,
	 * i.e. the roots of everything it points to.
	 *
	 * @param type
	 * @param base
	 * @return
	 */
	public List<AccessPath> targetRoots(Ty type, AccessPath base) {
		ArrayList<AccessPath> r = new ArrayList<>();
		for (Permission p : tree(type, base, PermAmount.WRITE, false)) {
			if (VAL_REF.equals(p.getPath().getLastField())) {
				r.add(p.getPath());
			}
		}
		return r;
	}

	/**
	 * Check whether the structure of a value contains any references or boxes.
	 *
	 * @param type
	 * @return
	 */
	public static boolean hasTargets(Ty type) {
		switch (type.getKind()) {
		case REF:
		case BOX:
			return true;
		case TUPLE:
			for (Ty t : ((Ty.Tuple) type).getElements()) {
				if (hasTargets(t)) {
					return true;
				}
			}
			return false;
		case ADT:
			for (Ty.Adt.Field f : ((Ty.Adt) type).getFields()) {
				if (hasTargets(f.getType())) {
					return true;
				}
			}
			return false;
		default:
			return false;
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * Construct the heap location denoted by a given path.
	 *
	 * @param path
	 * @return
	 */
	public static Expr location(AccessPath path) {
		Expr e = VAR(path.getRoot());
		for (String f : path.getFields()) {
			e = FIELD(e, f);
		}
		return e;
	}

	public static Expr amount(PermAmount amount) {
		return amount.isWrite() ? WRITE() : PERMISSION(amount.toString());
	}

	/**
	 * Construct the accessibility predicate for a given permission.
	 *
	 * @param p
	 * @return
	 */
	public static Expr.Logical access(Permission p) {
		Expr loc = location(p.getObject());
		if (p.isPredicate()) {
			return ACC(p.getPredicate(), loc, amount(p.getAmount()));
		}
		return ACC((Expr.FieldAccess) loc, amount(p.getAmount()));
	}

	/**
	 * Record that the integer stored at one path has been moved to another.
	 *
	 * @param from
	 * @param to
	 */
	public void rebase(AccessPath from, AccessPath to) {
		IntKind k = intPaths.get(from);
		if (k != null) {
			intPaths.put(to, k);
		}
	}

	public IntKind intKindOf(AccessPath path) {
		return intPaths.get(path);
	}

	/**
	 * Construct the facts that the integers covered by some permissions lie
	 * within the bounds of their types. These are only generated when
	 * overflow checking is enabled.
	 *
	 * @param permissions
	 * @return
	 */
	public List<Expr.Logical> bounds(List<Permission> permissions) {
		ArrayList<Expr.Logical> r = new ArrayList<>();
		if (checkOverflow) {
			for (Permission p : permissions) {
				IntKind k = intPaths.get(p.getPath());
				if (k != null && !p.isPredicate() && !p.getAmount().isNone()) {
					r.add(inBounds(k, location(p.getPath())));
				}
			}
		}
		return r;
	}

	/**
	 * Construct the fact that a value lies within the bounds of a given kind of
	 * integer.
	 *
	 * @param kind
	 * @param value
	 * @return
	 */
	public Expr.Logical inBounds(IntKind kind, Expr value) {
		intKinds.add(kind);
		return INVOKE("in$" + kind.getName(), value);
	}

	public SortedSet<String> getFields() {
		return fields;
	}

	/**
	 * Get every predicate in use, together with its body. Predicates for
	 * values of generic type are abstract, and have no body.
	 *
	 * @return
	 */
	public SortedMap<String, Expr> getPredicates() {
		TreeMap<String, Expr> r = new TreeMap<>();
		for (String p : predicates) {
			r.put(p, null);
		}
		// A body may mention further structures
		boolean changed = true;
		while (changed) {
			changed = false;
			for (String p : new ArrayList<>(structures.keySet())) {
				if (!r.containsKey(p)) {
					AccessPath self = AccessPath.root(SELF);
					ArrayList<Expr.Logical> parts = new ArrayList<>();
					for (Permission q : unfold(new Permission(self.append(p), PermAmount.WRITE, p))) {
						parts.add(access(q));
					}
					r.put(p, AND(parts));
					changed = true;
				}
			}
		}
		return r;
	}

	public SortedSet<String> getTags() {
		return tags;
	}

	public Set<IntKind> getIntKinds() {
		return intKinds;
	}
}
