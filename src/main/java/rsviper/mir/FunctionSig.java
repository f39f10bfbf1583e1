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

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import rsviper.lang.Span;
import rsviper.lang.Ty;

/**
 * The signature of a function, which is all a caller ever sees of it besides
 * its specification.
 *
 * @author The Rust2Viper Project Developers
 */
public final class FunctionSig {
	private final String name;
	private final ImmutableList<String> parameterNames;
	private final ImmutableList<Ty> parameterTypes;
	private final Ty returnType;
	private final Span span;

	public FunctionSig(String name, List<String> parameterNames, List<Ty> parameterTypes, Ty returnType, Span span) {
		if (parameterNames.size() != parameterTypes.size()) {
			throw new IllegalArgumentException("mismatched parameter names and types");
		}
		this.name = Objects.requireNonNull(name);
		this.parameterNames = ImmutableList.copyOf(parameterNames);
		this.parameterTypes = ImmutableList.copyOf(parameterTypes);
		this.returnType = Objects.requireNonNull(returnType);
		this.span = span == null ? Span.UNKNOWN : span;
	}

	public String getName() {
		return name;
	}

	public List<String> getParameterNames() {
		return parameterNames;
	}

	public List<Ty> getParameterTypes() {
		return parameterTypes;
	}

	public int getArity() {
		return parameterTypes.size();
	}

	public Ty getReturnType() {
		return returnType;
	}

	public Span getSpan() {
		return span;
	}

	/**
	 * Check whether this function can never return normally.
	 *
	 * @return
	 */
	public boolean isDiverging() {
		return returnType.getKind() == Ty.Kind.NEVER;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("fn " + name + "(");
		for (int i = 0; i != parameterTypes.size(); ++i) {
			if (i != 0) {
				sb.append(", ");
			}
			sb.append(parameterNames.get(i)).append(": ").append(parameterTypes.get(i));
		}
		return sb.append(") -> ").append(returnType).toString();
	}
}
