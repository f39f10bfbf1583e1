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

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import rsviper.core.ViperFile;
import rsviper.lang.IntKind;
import rsviper.lang.Span;

/**
 * The result of encoding a single function: the method which checks it,
 * the obligations attached to that method, and the declarations it needs.
 *
 * @author The Rust2Viper Project Developers
 */
public final class EncodedProcedure {
	private final String name;
	private final Span span;
	private final ViperFile.Decl.Method method;
	private final ImmutableList<Obligation> obligations;
	private final ImmutableSortedSet<String> fields;
	private final SortedMap<String, ViperFile.Expr> predicates;
	private final ImmutableSortedSet<String> tags;
	private final Set<IntKind> intKinds;

	public EncodedProcedure(String name, Span span, ViperFile.Decl.Method method, List<Obligation> obligations,
			SortedSet<String> fields, SortedMap<String, ViperFile.Expr> predicates, SortedSet<String> tags,
			Set<IntKind> intKinds) {
		this.name = name;
		this.span = span;
		this.method = method;
		this.obligations = ImmutableList.copyOf(obligations);
		this.fields = ImmutableSortedSet.copyOfSorted(fields);
		this.predicates = Collections.unmodifiableSortedMap(new TreeMap<>(predicates));
		this.tags = ImmutableSortedSet.copyOfSorted(tags);
		this.intKinds = Sets.immutableEnumSet(intKinds);
	}

	/**
	 * The name of the source function.
	 *
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * The span of the source function's signature.
	 *
	 * @return
	 */
	public Span getSpan() {
		return span;
	}

	public ViperFile.Decl.Method getMethod() {
		return method;
	}

	/**
	 * Get the obligations registered for this function, in order of
	 * registration.
	 *
	 * @return
	 */
	public List<Obligation> getObligations() {
		return obligations;
	}

	public SortedSet<String> getFields() {
		return fields;
	}

	/**
	 * Get the predicates this procedure uses, mapped to their bodies. A
	 * predicate without a body is abstract.
	 *
	 * @return
	 */
	public SortedMap<String, ViperFile.Expr> getPredicates() {
		return predicates;
	}

	public SortedSet<String> getTags() {
		return tags;
	}

	public Set<IntKind> getIntKinds() {
		return intKinds;
	}

	@Override
	public String toString() {
		return name + " (" + obligations.size() + " obligations)";
	}
}
