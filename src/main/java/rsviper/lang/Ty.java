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
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * The types of places as handed over by the host compiler. This is a closed
 * set: every case is a nested final class, and every consumer switches over
 * {@link #getKind()}.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class Ty {

	public enum Kind {
		BOOL,
		INT,
		REF,
		BOX,
		TUPLE,
		ADT,
		ARRAY,
		NEVER,
		PARAM
	}

	public static final Bool BOOL = new Bool();
	public static final Never NEVER = new Never();
	public static final Tuple UNIT = new Tuple(ImmutableList.of());

	private Ty() {
	}

	public abstract Kind getKind();

	/**
	 * Get a name for this type which is usable as part of an identifier in the
	 * generated program. For example, <code>&amp;mut i32</code> becomes
	 * <code>refmut$i32</code>.
	 *
	 * @return
	 */
	public abstract String getMangledName();

	/**
	 * Check whether values of this type are copied rather than moved. Moving a
	 * value of a copyable type does not consume the source.
	 *
	 * @return
	 */
	public boolean isCopyable() {
		return false;
	}

	public boolean isInt() {
		return getKind() == Kind.INT;
	}

	public boolean isReference() {
		return getKind() == Kind.REF || getKind() == Kind.BOX;
	}

	// =========================================================================
	// Constructors
	// =========================================================================

	public static Int INT(IntKind kind) {
		return new Int(kind);
	}

	public static Ref REF(Ty target) {
		return new Ref(false, target);
	}

	public static Ref MUTREF(Ty target) {
		return new Ref(true, target);
	}

	public static Box BOX(Ty target) {
		return new Box(target);
	}

	public static Tuple TUPLE(Ty... elements) {
		return new Tuple(ImmutableList.copyOf(elements));
	}

	public static Adt ADT(String name, Adt.Field... fields) {
		return new Adt(name, ImmutableList.copyOf(fields));
	}

	/**
	 * Construct a structure which refers to itself, such as a list node whose
	 * tail is boxed. The given function receives the structure being defined
	 * and returns its fields.
	 *
	 * @param name
	 * @param fields
	 * @return
	 */
	public static Adt RECURSIVE(String name, Function<Adt, Adt.Field[]> fields) {
		Adt r = new Adt(name, ImmutableList.of());
		r.fields = ImmutableList.copyOf(fields.apply(r));
		return r;
	}

	public static Adt.Field FIELD(String name, Ty type) {
		return new Adt.Field(name, type);
	}

	public static Array ARRAY(Ty element, int length) {
		return new Array(element, length);
	}

	public static Array SLICE(Ty element) {
		return new Array(element, null);
	}

	public static Param PARAM(String name) {
		return new Param(name);
	}

	// =========================================================================
	// Cases
	// =========================================================================

	public static final class Bool extends Ty {
		private Bool() {
		}

		@Override
		public Kind getKind() {
			return Kind.BOOL;
		}

		@Override
		public String getMangledName() {
			return "bool";
		}

		@Override
		public boolean isCopyable() {
			return true;
		}

		@Override
		public String toString() {
			return "bool";
		}
	}

	public static final class Int extends Ty {
		private final IntKind kind;

		private Int(IntKind kind) {
			this.kind = kind;
		}

		public IntKind getIntKind() {
			return kind;
		}

		@Override
		public Kind getKind() {
			return Kind.INT;
		}

		@Override
		public String getMangledName() {
			return kind.getName();
		}

		@Override
		public boolean isCopyable() {
			return true;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Int && ((Int) o).kind == kind;
		}

		@Override
		public int hashCode() {
			return kind.hashCode();
		}

		@Override
		public String toString() {
			return kind.getName();
		}
	}

	public static final class Ref extends Ty {
		private final boolean mutable;
		private final Ty target;

		private Ref(boolean mutable, Ty target) {
			this.mutable = mutable;
			this.target = Objects.requireNonNull(target);
		}

		public boolean isMutable() {
			return mutable;
		}

		public Ty getTarget() {
			return target;
		}

		@Override
		public Kind getKind() {
			return Kind.REF;
		}

		@Override
		public String getMangledName() {
			return (mutable ? "refmut$" : "ref$") + target.getMangledName();
		}

		@Override
		public boolean isCopyable() {
			return !mutable;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Ref) {
				Ref r = (Ref) o;
				return mutable == r.mutable && target.equals(r.target);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(mutable, target);
		}

		@Override
		public String toString() {
			return (mutable ? "&mut " : "&") + target;
		}
	}

	public static final class Box extends Ty {
		private final Ty target;

		private Box(Ty target) {
			this.target = Objects.requireNonNull(target);
		}

		public Ty getTarget() {
			return target;
		}

		@Override
		public Kind getKind() {
			return Kind.BOX;
		}

		@Override
		public String getMangledName() {
			return "box$" + target.getMangledName();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Box && ((Box) o).target.equals(target);
		}

		@Override
		public int hashCode() {
			return target.hashCode() * 31 + 1;
		}

		@Override
		public String toString() {
			return "Box<" + target + ">";
		}
	}

	public static final class Tuple extends Ty {
		private final ImmutableList<Ty> elements;

		private Tuple(ImmutableList<Ty> elements) {
			this.elements = elements;
		}

		public List<Ty> getElements() {
			return elements;
		}

		public int size() {
			return elements.size();
		}

		@Override
		public Kind getKind() {
			return Kind.TUPLE;
		}

		@Override
		public String getMangledName() {
			StringBuilder sb = new StringBuilder("tuple" + elements.size());
			for (Ty t : elements) {
				sb.append('$').append(t.getMangledName());
			}
			return sb.toString();
		}

		@Override
		public boolean isCopyable() {
			for (Ty t : elements) {
				if (!t.isCopyable()) {
					return false;
				}
			}
			return true;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Tuple && ((Tuple) o).elements.equals(elements);
		}

		@Override
		public int hashCode() {
			return elements.hashCode();
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder("(");
			for (int i = 0; i != elements.size(); ++i) {
				if (i != 0) {
					sb.append(", ");
				}
				sb.append(elements.get(i));
			}
			return sb.append(")").toString();
		}
	}

	/**
	 * A user-defined structure. Enumerations are not represented. Structures
	 * are identified by name, as a structure may contain itself.
	 */
	public static final class Adt extends Ty {
		private final String name;
		private ImmutableList<Field> fields;

		private Adt(String name, ImmutableList<Field> fields) {
			this.name = Objects.requireNonNull(name);
			this.fields = fields;
		}

		public String getName() {
			return name;
		}

		public List<Field> getFields() {
			return fields;
		}

		public Field getField(String name) {
			for (Field f : fields) {
				if (f.getName().equals(name)) {
					return f;
				}
			}
			return null;
		}

		@Override
		public Kind getKind() {
			return Kind.ADT;
		}

		@Override
		public String getMangledName() {
			return "adt$" + name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Adt && ((Adt) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}

		public static final class Field {
			private final String name;
			private final Ty type;

			private Field(String name, Ty type) {
				this.name = Objects.requireNonNull(name);
				this.type = Objects.requireNonNull(type);
			}

			public String getName() {
				return name;
			}

			public Ty getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Field) {
					Field f = (Field) o;
					return name.equals(f.name) && type.equals(f.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(name, type);
			}
		}
	}

	/**
	 * A fixed-length array, or a slice when no length is given.
	 */
	public static final class Array extends Ty {
		private final Ty element;
		private final Integer length;

		private Array(Ty element, Integer length) {
			this.element = Objects.requireNonNull(element);
			this.length = length;
		}

		public Ty getElement() {
			return element;
		}

		/**
		 * Get the statically known length, or <code>null</code> for a slice.
		 *
		 * @return
		 */
		public Integer getLength() {
			return length;
		}

		public boolean isSlice() {
			return length == null;
		}

		@Override
		public Kind getKind() {
			return Kind.ARRAY;
		}

		@Override
		public String getMangledName() {
			if (length == null) {
				return "slice$" + element.getMangledName();
			} else {
				return "array" + length + "$" + element.getMangledName();
			}
		}

		@Override
		public boolean isCopyable() {
			return element.isCopyable();
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Array) {
				Array a = (Array) o;
				return element.equals(a.element) && Objects.equals(length, a.length);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(element, length);
		}

		@Override
		public String toString() {
			return length == null ? "[" + element + "]" : "[" + element + "; " + length + "]";
		}
	}

	public static final class Never extends Ty {
		private Never() {
		}

		@Override
		public Kind getKind() {
			return Kind.NEVER;
		}

		@Override
		public String getMangledName() {
			return "never";
		}

		@Override
		public String toString() {
			return "!";
		}
	}

	/**
	 * A generic type parameter. Values of such types are opaque, and their
	 * permissions are abstract predicate instances.
	 */
	public static final class Param extends Ty {
		private final String name;

		private Param(String name) {
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public Kind getKind() {
			return Kind.PARAM;
		}

		@Override
		public String getMangledName() {
			return "param$" + name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Param && ((Param) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}
}
