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

import java.util.Objects;

/**
 * An access right of a given amount to a single location. When a predicate
 * name is present, the location is the argument of an abstract predicate
 * instance (used for values of generic type) rather than a field.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Permission implements Comparable<Permission> {
	private final AccessPath path;
	private final PermAmount amount;
	private final String predicate;

	public Permission(AccessPath path, PermAmount amount) {
		this(path, amount, null);
	}

	public Permission(AccessPath path, PermAmount amount, String predicate) {
		this.path = Objects.requireNonNull(path);
		this.amount = Objects.requireNonNull(amount);
		this.predicate = predicate;
	}

	/**
	 * Get the path this permission is tracked under. The permission to a
	 * predicate instance is tracked beneath the object it is applied to, using
	 * the predicate's name as the final segment.
	 *
	 * @return
	 */
	public AccessPath getPath() {
		return path;
	}

	/**
	 * Get the path of the object a predicate is applied to.
	 *
	 * @return
	 */
	public AccessPath getObject() {
		return predicate != null ? path.getParent() : path;
	}

	public PermAmount getAmount() {
		return amount;
	}

	/**
	 * Get the abstract predicate guarding this location, or <code>null</code>
	 * if this is a plain field permission.
	 *
	 * @return
	 */
	public String getPredicate() {
		return predicate;
	}

	public boolean isPredicate() {
		return predicate != null;
	}

	public Permission withAmount(PermAmount amount) {
		return new Permission(path, amount, predicate);
	}

	public Permission withPath(AccessPath path) {
		return new Permission(path, amount, predicate);
	}

	@Override
	public int compareTo(Permission o) {
		return path.compareTo(o.path);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Permission) {
			Permission p = (Permission) o;
			return path.equals(p.path) && amount.equals(p.amount) && Objects.equals(predicate, p.predicate);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, amount, predicate);
	}

	@Override
	public String toString() {
		if (predicate != null) {
			return "acc(" + predicate + "(" + getObject() + "), " + amount + ")";
		}
		return "acc(" + path + ", " + amount + ")";
	}
}
