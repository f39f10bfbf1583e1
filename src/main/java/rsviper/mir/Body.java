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
package rsviper.mir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import rsviper.lang.Place;
import rsviper.lang.Span;
import rsviper.lang.StructuralException;
import rsviper.lang.Ty;

/**
 * The body of a single function as handed over by the host compiler: its
 * locals, an arena of basic blocks indexed by block id (block <code>0</code>
 * is the entry), and the borrow checker's region-end facts. Bodies are already
 * type checked and borrow checked.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Body {
	private final FunctionSig signature;
	private final ImmutableList<Local> locals;
	private final ImmutableList<BasicBlock> blocks;
	private final BorrowFacts borrowFacts;

	public Body(FunctionSig signature, List<Local> locals, List<BasicBlock> blocks, BorrowFacts borrowFacts) {
		this.signature = Objects.requireNonNull(signature);
		this.locals = ImmutableList.copyOf(locals);
		this.blocks = ImmutableList.copyOf(blocks);
		this.borrowFacts = Objects.requireNonNull(borrowFacts);
		if (this.locals.size() <= signature.getArity()) {
			throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
					"body of " + signature.getName() + " is missing locals for its parameters", signature.getSpan());
		}
		for (int i = 0; i != this.blocks.size(); ++i) {
			if (this.blocks.get(i).getId() != i) {
				throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
						"block " + i + " of " + signature.getName() + " has inconsistent id", signature.getSpan());
			}
		}
	}

	public String getName() {
		return signature.getName();
	}

	public FunctionSig getSignature() {
		return signature;
	}

	public List<Local> getLocals() {
		return locals;
	}

	public Local getLocal(int index) {
		if (index < 0 || index >= locals.size()) {
			throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
					"unknown local _" + index + " in " + getName(), signature.getSpan());
		}
		return locals.get(index);
	}

	/**
	 * Find the local with a given source name. Where a name is shadowed, the
	 * most recently declared local wins.
	 *
	 * @param name
	 * @return The local, or <code>null</code> if there is none.
	 */
	public Local findLocal(String name) {
		for (int i = locals.size() - 1; i >= 0; --i) {
			if (name.equals(locals.get(i).getName())) {
				return locals.get(i);
			}
		}
		return null;
	}

	public List<BasicBlock> getBlocks() {
		return blocks;
	}

	public BasicBlock getBlock(int id) {
		if (id < 0 || id >= blocks.size()) {
			throw new StructuralException(StructuralException.Kind.MISSING_BLOCK,
					"missing block bb" + id + " in " + getName(), signature.getSpan());
		}
		return blocks.get(id);
	}

	public BorrowFacts getBorrowFacts() {
		return borrowFacts;
	}

	/**
	 * Determine the type of a given place in this body.
	 *
	 * @param place
	 * @return
	 */
	public Ty typeOf(Place place) {
		Ty type = getLocal(place.getLocal()).getType();
		for (Place.Projection p : place.getProjections()) {
			type = project(type, p);
		}
		return type;
	}

	private Ty project(Ty type, Place.Projection p) {
		switch (p.getKind()) {
		case DEREF:
			if (type.getKind() == Ty.Kind.REF) {
				return ((Ty.Ref) type).getTarget();
			} else if (type.getKind() == Ty.Kind.BOX) {
				return ((Ty.Box) type).getTarget();
			}
			break;
		case FIELD:
			if (type.getKind() == Ty.Kind.ADT) {
				Ty.Adt.Field f = ((Ty.Adt) type).getField(p.getName());
				if (f != null) {
					return f.getType();
				}
			} else if (type.getKind() == Ty.Kind.TUPLE) {
				Ty.Tuple t = (Ty.Tuple) type;
				int i = tupleIndex(p.getName());
				if (i >= 0 && i < t.size()) {
					return t.getElements().get(i);
				}
			}
			break;
		case INDEX:
			if (type.getKind() == Ty.Kind.ARRAY) {
				return ((Ty.Array) type).getElement();
			}
			break;
		}
		throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
				"invalid projection of type " + type + " in " + getName(), signature.getSpan());
	}

	private static int tupleIndex(String name) {
		try {
			return Integer.parseInt(name);
		} catch (NumberFormatException e) {
			return -1;
		}
	}

	@Override
	public String toString() {
		return signature.toString();
	}

	/**
	 * Incrementally constructs a body. Locals for the return value and the
	 * formal parameters are created from the signature.
	 */
	public static class Builder {
		private final FunctionSig signature;
		private final ArrayList<Local> locals = new ArrayList<>();
		private final ArrayList<List<Statement>> statements = new ArrayList<>();
		private final ArrayList<Terminator> terminators = new ArrayList<>();
		private final BorrowFacts.Builder facts = new BorrowFacts.Builder();

		public Builder(FunctionSig signature) {
			this.signature = signature;
			locals.add(new Local(0, null, signature.getReturnType()));
			for (int i = 0; i != signature.getArity(); ++i) {
				locals.add(new Local(i + 1, signature.getParameterNames().get(i), signature.getParameterTypes().get(i)));
			}
		}

		/**
		 * Declare a named user variable.
		 *
		 * @return The index of the new local.
		 */
		public int local(String name, Ty type) {
			locals.add(new Local(locals.size(), name, type));
			return locals.size() - 1;
		}

		/**
		 * Declare an anonymous temporary.
		 *
		 * @return The index of the new local.
		 */
		public int temp(Ty type) {
			return local(null, type);
		}

		/**
		 * Allocate a fresh, empty block.
		 *
		 * @return The id of the new block.
		 */
		public int block() {
			statements.add(new ArrayList<>());
			terminators.add(null);
			return statements.size() - 1;
		}

		public Builder add(int block, Statement stmt) {
			statements.get(block).add(stmt);
			return this;
		}

		public Builder assign(int block, Place place, Rvalue rvalue, Span span) {
			return add(block, Statement.ASSIGN(place, rvalue, span));
		}

		public Builder storageLive(int block, int local, Span span) {
			return add(block, Statement.STORAGE_LIVE(local, span));
		}

		public Builder storageDead(int block, int local, Span span) {
			return add(block, Statement.STORAGE_DEAD(local, span));
		}

		public Builder terminate(int block, Terminator terminator) {
			terminators.set(block, terminator);
			return this;
		}

		/**
		 * Record that a borrow's region ends immediately before the next
		 * statement added to a block (or before its terminator, if no further
		 * statement is added).
		 */
		public Builder endBorrow(int block, int borrow) {
			facts.endAt(new Location(block, statements.get(block).size()), borrow);
			return this;
		}

		public Builder endBorrow(Location location, int borrow) {
			facts.endAt(location, borrow);
			return this;
		}

		public Body build() {
			ArrayList<BasicBlock> blocks = new ArrayList<>();
			for (int i = 0; i != statements.size(); ++i) {
				Terminator t = terminators.get(i);
				if (t == null) {
					throw new StructuralException(StructuralException.Kind.INVALID_INPUT,
							"block bb" + i + " of " + signature.getName() + " has no terminator", signature.getSpan());
				}
				blocks.add(new BasicBlock(i, statements.get(i), t));
			}
			return new Body(signature, locals, blocks, facts.build());
		}
	}
}
