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
package rsviper.lang;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A live borrow. It records the place borrowed from (the origin), the location
 * through which the borrowed permissions are now reached (the holder, i.e. the
 * <code>val_ref</code> field of the reference), and exactly which permissions
 * were transferred, so that they can be handed back when the borrow expires.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Borrow implements Comparable<Borrow> {

	public enum Kind {
		SHARED,
		MUTABLE
	}

	private final int id;
	private final Kind kind;
	private final Place origin;
	private final AccessPath originPath;
	private final AccessPath holder;
	private final ImmutableList<Permission> transferred;

	public Borrow(int id, Kind kind, Place origin, AccessPath originPath, AccessPath holder,
			List<Permission> transferred) {
		this.id = id;
		this.kind = Objects.requireNonNull(kind);
		this.origin = Objects.requireNonNull(origin);
		this.originPath = Objects.requireNonNull(originPath);
		this.holder = Objects.requireNonNull(holder);
		this.transferred = ImmutableList.copyOf(transferred);
	}

	public int getId() {
		return id;
	}

	public Kind getKind() {
		return kind;
	}

	public Place getOrigin() {
		return origin;
	}

	public AccessPath getOriginPath() {
		return originPath;
	}

	public AccessPath getHolder() {
		return holder;
	}

	/**
	 * The permissions taken from the origin, expressed on the origin's paths.
	 *
	 * @return
	 */
	public List<Permission> getTransferred() {
		return transferred;
	}

	/**
	 * The permissions now held through the holder, i.e. the transferred
	 * permissions re-rooted onto the holder path.
	 *
	 * @return
	 */
	public List<Permission> getHeld() {
		ImmutableList.Builder<Permission> r = ImmutableList.builder();
		for (Permission p : transferred) {
			r.add(p.withPath(p.getPath().replacePrefix(originPath, holder)));
		}
		return r.build();
	}

	/**
	 * Create a copy of this borrow whose holder has been moved elsewhere (e.g.
	 * because the reference itself was moved into another local).
	 *
	 * @param holder
	 * @return
	 */
	public Borrow withHolder(AccessPath holder) {
		return new Borrow(id, kind, origin, originPath, holder, transferred);
	}

	@Override
	public int compareTo(Borrow o) {
		return Integer.compare(id, o.id);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Borrow) {
			Borrow b = (Borrow) o;
			return id == b.id && kind == b.kind && originPath.equals(b.originPath) && holder.equals(b.holder)
					&& transferred.equals(b.transferred);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, kind, originPath, holder);
	}

	@Override
	public String toString() {
		return "borrow#" + id + "(" + (kind == Kind.SHARED ? "&" : "&mut ") + origin + " -> " + holder + ")";
	}
}
