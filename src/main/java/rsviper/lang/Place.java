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
 * A storage location reachable from a function-local root through a sequence
 * of projections. For example, <code>(*_1).f</code> is local <code>1</code>
 * followed by a dereference and a field selection. Places say nothing about
 * aliasing; that is determined solely by the borrow facts of the host.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Place {
	private final int local;
	private final ImmutableList<Projection> projections;

	private Place(int local, ImmutableList<Projection> projections) {
		if (local < 0) {
			throw new IllegalArgumentException("invalid local");
		}
		this.local = local;
		this.projections = projections;
	}

	public static Place local(int index) {
		return new Place(index, ImmutableList.of());
	}

	public int getLocal() {
		return local;
	}

	public List<Projection> getProjections() {
		return projections;
	}

	public boolean isLocal() {
		return projections.isEmpty();
	}

	/**
	 * Check whether this place indexes into an array, in which case it has no
	 * access path of its own.
	 *
	 * @return
	 */
	public boolean isIndexed() {
		for (Projection p : projections) {
			if (p.getKind() == Projection.Kind.INDEX) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Check whether this place is reached through a reference, in which case
	 * what it holds was lent to the function rather than owned by it.
	 *
	 * @return
	 */
	public boolean isDereferenced() {
		for (Projection p : projections) {
			if (p.getKind() == Projection.Kind.DEREF) {
				return true;
			}
		}
		return false;
	}

	public Place field(String name) {
		return extend(new Projection(Projection.Kind.FIELD, name, -1));
	}

	public Place deref() {
		return extend(new Projection(Projection.Kind.DEREF, null, -1));
	}

	public Place index(int indexLocal) {
		return extend(new Projection(Projection.Kind.INDEX, null, indexLocal));
	}

	/**
	 * Get this place without its last projection.
	 *
	 * @return
	 */
	public Place getParent() {
		if (projections.isEmpty()) {
			return null;
		}
		return new Place(local, projections.subList(0, projections.size() - 1));
	}

	public Projection getLast() {
		return projections.isEmpty() ? null : projections.get(projections.size() - 1);
	}

	private Place extend(Projection p) {
		return new Place(local, ImmutableList.<Projection>builder().addAll(projections).add(p).build());
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Place) {
			Place p = (Place) o;
			return local == p.local && projections.equals(p.projections);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return local * 31 + projections.hashCode();
	}

	@Override
	public String toString() {
		String r = "_" + local;
		for (Projection p : projections) {
			switch (p.getKind()) {
			case FIELD:
				r = r + "." + p.getName();
				break;
			case DEREF:
				r = "(*" + r + ")";
				break;
			case INDEX:
				r = r + "[_" + p.getIndexLocal() + "]";
				break;
			}
		}
		return r;
	}

	public static final class Projection {
		public enum Kind {
			FIELD,
			DEREF,
			INDEX
		}

		private final Kind kind;
		private final String name;
		private final int indexLocal;

		private Projection(Kind kind, String name, int indexLocal) {
			this.kind = kind;
			this.name = name;
			this.indexLocal = indexLocal;
		}

		public Kind getKind() {
			return kind;
		}

		/**
		 * The selected field name (for field projections only).
		 *
		 * @return
		 */
		public String getName() {
			return name;
		}

		/**
		 * The local holding the index (for index projections only).
		 *
		 * @return
		 */
		public int getIndexLocal() {
			return indexLocal;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Projection) {
				Projection p = (Projection) o;
				return kind == p.kind && Objects.equals(name, p.name) && indexLocal == p.indexLocal;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, name, indexLocal);
		}
	}
}
