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

import com.google.common.collect.ImmutableList;

/**
 * A heap location in the generated program, written as a root variable
 * followed by zero or more field selections (e.g.
 * <code>_1.val_ref.val_int</code>). Permissions are always held on access
 * paths, never on places.
 *
 * @author The Rust2Viper Project Developers
 */
public final class AccessPath implements Comparable<AccessPath> {
	private final String root;
	private final ImmutableList<String> fields;

	private AccessPath(String root, ImmutableList<String> fields) {
		this.root = root;
		this.fields = fields;
	}

	public static AccessPath root(String name) {
		return new AccessPath(name, ImmutableList.of());
	}

	public String getRoot() {
		return root;
	}

	public List<String> getFields() {
		return fields;
	}

	public int size() {
		return fields.size();
	}

	public String getLastField() {
		return fields.isEmpty() ? null : fields.get(fields.size() - 1);
	}

	public AccessPath append(String field) {
		return new AccessPath(root, ImmutableList.<String>builder().addAll(fields).add(field).build());
	}

	public AccessPath append(List<String> suffix) {
		return new AccessPath(root, ImmutableList.<String>builder().addAll(fields).addAll(suffix).build());
	}

	public AccessPath getParent() {
		if (fields.isEmpty()) {
			return null;
		}
		return new AccessPath(root, fields.subList(0, fields.size() - 1));
	}

	/**
	 * Check whether this path starts with (or is equal to) a given path.
	 *
	 * @param prefix
	 * @return
	 */
	public boolean hasPrefix(AccessPath prefix) {
		if (!root.equals(prefix.root) || prefix.fields.size() > fields.size()) {
			return false;
		}
		return fields.subList(0, prefix.fields.size()).equals(prefix.fields);
	}

	/**
	 * Get the fields of this path which follow a given prefix.
	 *
	 * @param prefix
	 * @return
	 */
	public List<String> suffixAfter(AccessPath prefix) {
		if (!hasPrefix(prefix)) {
			throw new IllegalArgumentException(prefix + " is not a prefix of " + this);
		}
		return fields.subList(prefix.fields.size(), fields.size());
	}

	/**
	 * Replace a given prefix of this path with another path.
	 *
	 * @param prefix
	 * @param replacement
	 * @return
	 */
	public AccessPath replacePrefix(AccessPath prefix, AccessPath replacement) {
		return replacement.append(suffixAfter(prefix));
	}

	@Override
	public int compareTo(AccessPath o) {
		int c = root.compareTo(o.root);
		for (int i = 0; c == 0 && i < Math.min(fields.size(), o.fields.size()); ++i) {
			c = fields.get(i).compareTo(o.fields.get(i));
		}
		if (c == 0) {
			c = Integer.compare(fields.size(), o.fields.size());
		}
		return c;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof AccessPath) {
			AccessPath p = (AccessPath) o;
			return root.equals(p.root) && fields.equals(p.fields);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return root.hashCode() * 31 + fields.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(root);
		for (String f : fields) {
			sb.append('.').append(f);
		}
		return sb.toString();
	}
}
