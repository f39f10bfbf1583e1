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

import com.google.common.collect.ImmutableSortedMap;

import rsviper.mir.FunctionSig;
import rsviper.spec.ResolvedSpec;

/**
 * What a caller may rely on when calling a function: its signature together
 * with its resolved preconditions and postconditions.
 *
 * @author The Rust2Viper Project Developers
 */
public final class ProcedureContract {
	private final FunctionSig signature;
	private final ResolvedSpec spec;

	public ProcedureContract(FunctionSig signature, ResolvedSpec spec) {
		this.signature = signature;
		this.spec = spec;
	}

	/**
	 * Construct the contract of a function with no specification (or whose
	 * specification could not be resolved).
	 *
	 * @param signature
	 * @return
	 */
	public static ProcedureContract unspecified(FunctionSig signature) {
		return new ProcedureContract(signature, new ResolvedSpec(Collections.emptyList(), Collections.emptyList(),
				ImmutableSortedMap.of(), Collections.emptyList()));
	}

	public FunctionSig getSignature() {
		return signature;
	}

	public ResolvedSpec getSpec() {
		return spec;
	}

	@Override
	public String toString() {
		return signature + " requires " + spec.getRequires() + " ensures " + spec.getEnsures();
	}
}
