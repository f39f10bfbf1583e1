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

import java.util.Collection;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSortedMap;

/**
 * Everything the host compiler hands over: the bodies of the functions to be
 * verified, and the signatures of any external functions they call. Bodies
 * are kept in name order so that every traversal is deterministic.
 *
 * @author The Rust2Viper Project Developers
 */
public final class MirProgram {
	private final ImmutableSortedMap<String, Body> bodies;
	private final ImmutableSortedMap<String, FunctionSig> externals;

	private MirProgram(ImmutableSortedMap<String, Body> bodies, ImmutableSortedMap<String, FunctionSig> externals) {
		this.bodies = bodies;
		this.externals = externals;
	}

	public Collection<Body> getBodies() {
		return bodies.values();
	}

	public Body getBody(String name) {
		return bodies.get(name);
	}

	public SortedMap<String, FunctionSig> getExternals() {
		return externals;
	}

	/**
	 * Get the signature of any function known to this program, whether it has
	 * a body or not.
	 *
	 * @param name
	 * @return The signature, or <code>null</code> if the function is unknown.
	 */
	public FunctionSig getSignature(String name) {
		Body b = bodies.get(name);
		if (b != null) {
			return b.getSignature();
		}
		return externals.get(name);
	}

	/**
	 * Get the signatures of all functions known to this program.
	 *
	 * @return
	 */
	public SortedMap<String, FunctionSig> getSignatures() {
		TreeMap<String, FunctionSig> r = new TreeMap<>(externals);
		for (Body b : bodies.values()) {
			r.put(b.getName(), b.getSignature());
		}
		return r;
	}

	public static class Builder {
		private final TreeMap<String, Body> bodies = new TreeMap<>();
		private final TreeMap<String, FunctionSig> externals = new TreeMap<>();

		public Builder add(Body body) {
			bodies.put(body.getName(), body);
			return this;
		}

		public Builder addExternal(FunctionSig signature) {
			externals.put(signature.getName(), signature);
			return this;
		}

		public MirProgram build() {
			return new MirProgram(ImmutableSortedMap.copyOf(bodies), ImmutableSortedMap.copyOf(externals));
		}
	}
}
