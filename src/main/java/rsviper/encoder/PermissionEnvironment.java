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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.google.common.collect.Lists;

import rsviper.lang.AccessPath;
import rsviper.lang.Borrow;
import rsviper.lang.PermAmount;
import rsviper.lang.Permission;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;

/**
 * The permissions held at a program point, together with the borrows which
 * are live there. Permissions are tracked per access path; a location can be
 * reached along more than one path only through a live borrow, in which case
 * the permissions along the origin and holder paths together must not exceed
 * a full permission.
 *
 * @author The Rust2Viper Project Developers
 */
public final class PermissionEnvironment {
	private final TreeMap<AccessPath, Permission> held;
	/**
	 * Live borrows in the order they were created.
	 */
	private final LinkedHashMap<Integer, Borrow> borrows;
	/**
	 * Maps each borrow derived from another (e.g. a copy of a shared
	 * reference, or a reborrow) to the borrow it was derived from.
	 */
	private final HashMap<Integer, Integer> parents;
	/**
	 * Predicate instances which have been unfolded and are to be folded back
	 * once their bodies are complete again, by path.
	 */
	private final TreeMap<AccessPath, Permission> unfolded;
	private int nextDerived;

	public PermissionEnvironment() {
		this.held = new TreeMap<>();
		this.borrows = new LinkedHashMap<>();
		this.parents = new HashMap<>();
		this.unfolded = new TreeMap<>();
		this.nextDerived = -1;
	}

	private PermissionEnvironment(PermissionEnvironment env) {
		this.held = new TreeMap<>(env.held);
		this.borrows = new LinkedHashMap<>(env.borrows);
		this.parents = new HashMap<>(env.parents);
		this.unfolded = new TreeMap<>(env.unfolded);
		this.nextDerived = env.nextDerived;
	}

	public PermissionEnvironment copy() {
		return new PermissionEnvironment(this);
	}

	// =========================================================================
	// Permissions
	// =========================================================================

	public PermAmount amountOf(AccessPath path) {
		Permission p = held.get(path);
		return p == null ? PermAmount.NONE : p.getAmount();
	}

	public Permission get(AccessPath path) {
		return held.get(path);
	}

	/**
	 * Get every held permission, parents before children.
	 *
	 * @return
	 */
	public List<Permission> getPermissions() {
		return new ArrayList<>(held.values());
	}

	/**
	 * Get the held permissions on paths beneath a given path.
	 *
	 * @param prefix
	 * @param strict
	 *            Whether to exclude the permission on the path itself.
	 * @return Permissions in ascending order of path.
	 */
	public List<Permission> under(AccessPath prefix, boolean strict) {
		ArrayList<Permission> r = new ArrayList<>();
		for (Permission p : held.tailMap(prefix, !strict).values()) {
			if (!p.getPath().hasPrefix(prefix)) {
				break;
			}
			r.add(p);
		}
		return r;
	}

	/**
	 * Add a given permission to this environment.
	 *
	 * @param p
	 * @param span
	 * @throws StructuralException
	 *             if the total held on the path would exceed a full
	 *             permission.
	 */
	public void add(Permission p, Span span) {
		if (p.getAmount().isNone()) {
			return;
		}
		Permission q = held.get(p.getPath());
		PermAmount total = q == null ? p.getAmount() : q.getAmount().add(p.getAmount());
		if (total.compareTo(PermAmount.WRITE) > 0) {
			throw new StructuralException(StructuralException.Kind.CONSERVATION,
					"permission to " + p.getPath() + " would exceed write (" + total + ")", span);
		}
		held.put(p.getPath(), p.withAmount(total));
	}

	/**
	 * Remove (up to) a given permission from this environment.
	 *
	 * @param p
	 * @return The amount actually removed.
	 */
	public PermAmount remove(Permission p) {
		Permission q = held.get(p.getPath());
		if (q == null) {
			return PermAmount.NONE;
		}
		PermAmount removed = PermAmount.min(q.getAmount(), p.getAmount());
		PermAmount rest = q.getAmount().subtract(removed);
		if (rest.isNone()) {
			held.remove(p.getPath());
		} else {
			held.put(p.getPath(), q.withAmount(rest));
		}
		return removed;
	}

	// =========================================================================
	// Predicates
	// =========================================================================

	/**
	 * Record that a predicate instance has been exchanged for its body.
	 *
	 * @param instance
	 */
	public void markUnfolded(Permission instance) {
		unfolded.put(instance.getPath(), instance);
	}

	public void markFolded(Permission instance) {
		unfolded.remove(instance.getPath());
	}

	/**
	 * Get the unfolded predicate instances, outermost first.
	 *
	 * @return
	 */
	public List<Permission> getUnfolded() {
		return new ArrayList<>(unfolded.values());
	}

	// =========================================================================
	// Borrows
	// =========================================================================

	/**
	 * Record a new live borrow.
	 *
	 * @param b
	 * @param parent
	 *            The borrow this one was derived from, or <code>null</code>.
	 */
	public void addBorrow(Borrow b, Integer parent) {
		borrows.put(b.getId(), b);
		if (parent != null) {
			parents.put(b.getId(), parent);
		}
	}

	/**
	 * Allocate an identifier for a borrow which does not appear in the input,
	 * such as a copy of a shared reference.
	 *
	 * @return
	 */
	public int nextDerivedId() {
		return nextDerived--;
	}

	public Borrow getBorrow(int id) {
		return borrows.get(id);
	}

	public Borrow removeBorrow(int id) {
		parents.remove(id);
		return borrows.remove(id);
	}

	/**
	 * Get the live borrows, oldest first.
	 *
	 * @return
	 */
	public Collection<Borrow> getBorrows() {
		return new ArrayList<>(borrows.values());
	}

	/**
	 * Get the live borrows derived from a given borrow, most recent first.
	 *
	 * @param id
	 * @return
	 */
	public List<Integer> getDerived(int id) {
		ArrayList<Integer> r = new ArrayList<>();
		for (Integer b : borrows.keySet()) {
			if (Objects.equals(parents.get(b), id)) {
				r.add(0, b);
			}
		}
		return r;
	}

	/**
	 * Find the live borrow through which a given path is reached, i.e. the one
	 * whose holder is the longest prefix of the path.
	 *
	 * @param path
	 * @return The borrow, or <code>null</code> if there is none.
	 */
	public Borrow holderOf(AccessPath path) {
		Borrow r = null;
		for (Borrow b : borrows.values()) {
			if (path.hasPrefix(b.getHolder()) && (r == null || b.getHolder().size() > r.getHolder().size())) {
				r = b;
			}
		}
		return r;
	}

	/**
	 * End a live borrow without generating any code for it, returning what
	 * its holder still has to the origin. Borrows derived from it end first.
	 * This mirrors {@link PermissionEncoder#expire}.
	 *
	 * @param id
	 * @param span
	 */
	public void endBorrow(int id, Span span) {
		Borrow b = borrows.get(id);
		if (b == null) {
			return;
		}
		for (int d : getDerived(id)) {
			endBorrow(d, span);
		}
		for (Permission p : b.getHeld()) {
			remove(p);
		}
		removeBorrow(id);
		for (Permission p : b.getTransferred()) {
			add(p, span);
		}
		if (b.getKind() == Borrow.Kind.MUTABLE) {
			rehome(b.getHolder(), b.getOriginPath(), true);
		}
	}

	/**
	 * Move the holders of any live borrows held beneath one path to the
	 * corresponding positions beneath another.
	 *
	 * @param from
	 * @param to
	 * @param strict
	 *            Whether to leave a borrow held at exactly <code>from</code>.
	 */
	public void rehome(AccessPath from, AccessPath to, boolean strict) {
		for (Map.Entry<Integer, Borrow> e : borrows.entrySet()) {
			Borrow b = e.getValue();
			if (b.getHolder().hasPrefix(from) && !(strict && b.getHolder().equals(from))) {
				e.setValue(b.withHolder(b.getHolder().replacePrefix(from, to)));
			}
		}
	}

	// =========================================================================
	// Invariants
	// =========================================================================

	/**
	 * Check that no location is held at more than a full permission in total.
	 * A location reached through a live borrow is counted along its origin
	 * path and along the holder path of every borrow derived from it.
	 *
	 * @param span
	 * @throws StructuralException
	 *             if the check fails.
	 */
	public void checkConservation(Span span) {
		for (Permission p : held.values()) {
			if (p.getAmount().compareTo(PermAmount.WRITE) > 0) {
				throw new StructuralException(StructuralException.Kind.CONSERVATION,
						"permission to " + p.getPath() + " exceeds write", span);
			}
		}
		for (Borrow b : borrows.values()) {
			if (parents.containsKey(b.getId())) {
				continue;
			}
			for (Permission t : b.getTransferred()) {
				List<String> suffix = t.getPath().suffixAfter(b.getOriginPath());
				PermAmount total = amountOf(t.getPath()).add(heldThrough(b, suffix));
				if (total.compareTo(PermAmount.WRITE) > 0) {
					throw new StructuralException(StructuralException.Kind.CONSERVATION, "location " + t.getPath()
							+ " is held at " + total + " through " + b, span);
				}
			}
		}
	}

	private PermAmount heldThrough(Borrow b, List<String> suffix) {
		PermAmount r = amountOf(b.getHolder().append(suffix));
		for (int d : getDerived(b.getId())) {
			r = r.add(heldThrough(borrows.get(d), suffix));
		}
		return r;
	}

	/**
	 * Compute the environment at a control-flow join. A borrow which is not
	 * live, with the same holder, along every incoming edge is ended along the
	 * edges where it is, so the origin gets back what it lent before the
	 * environments are met. None of the given environments is changed.
	 *
	 * @param envs
	 * @param span
	 * @return
	 */
	public static PermissionEnvironment join(List<PermissionEnvironment> envs, Span span) {
		ArrayList<PermissionEnvironment> settled = new ArrayList<>();
		for (PermissionEnvironment e : envs) {
			PermissionEnvironment s = e.copy();
			for (Borrow b : Lists.reverse(new ArrayList<>(e.borrows.values()))) {
				if (s.borrows.containsKey(b.getId()) && !isLiveEverywhere(b, envs)) {
					s.endBorrow(b.getId(), span);
				}
			}
			settled.add(s);
		}
		return meet(settled);
	}

	private static boolean isLiveEverywhere(Borrow b, List<PermissionEnvironment> envs) {
		for (PermissionEnvironment e : envs) {
			if (!b.equals(e.borrows.get(b.getId()))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Compute the greatest environment which is contained in every one of a
	 * given set of environments. A borrow survives only if it is live, with
	 * the same holder, in all of them.
	 *
	 * @param envs
	 * @return
	 */
	public static PermissionEnvironment meet(List<PermissionEnvironment> envs) {
		PermissionEnvironment r = envs.get(0).copy();
		for (int i = 1; i < envs.size(); ++i) {
			PermissionEnvironment e = envs.get(i);
			Iterator<Map.Entry<AccessPath, Permission>> it = r.held.entrySet().iterator();
			while (it.hasNext()) {
				Map.Entry<AccessPath, Permission> entry = it.next();
				PermAmount a = PermAmount.min(entry.getValue().getAmount(), e.amountOf(entry.getKey()));
				if (a.isNone()) {
					it.remove();
				} else {
					entry.setValue(entry.getValue().withAmount(a));
				}
			}
			Iterator<Map.Entry<Integer, Borrow>> bs = r.borrows.entrySet().iterator();
			while (bs.hasNext()) {
				Map.Entry<Integer, Borrow> entry = bs.next();
				if (!entry.getValue().equals(e.borrows.get(entry.getKey()))) {
					r.parents.remove(entry.getKey());
					bs.remove();
				}
			}
			r.unfolded.keySet().retainAll(e.unfolded.keySet());
			r.nextDerived = Math.min(r.nextDerived, e.nextDerived);
		}
		return r;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof PermissionEnvironment) {
			PermissionEnvironment e = (PermissionEnvironment) o;
			return held.equals(e.held) && borrows.equals(e.borrows) && unfolded.equals(e.unfolded);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(held, borrows.keySet());
	}

	@Override
	public String toString() {
		return held.values() + " " + borrows.values();
	}
}
