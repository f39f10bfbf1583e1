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
package rsviper.tasks;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;

import com.google.common.collect.ImmutableSortedMap;

import rsviper.lang.Diagnostic;

/**
 * The results of a verification run, one report per function, ordered by
 * function name.
 *
 * @author The Rust2Viper Project Developers
 */
public final class VerificationReport {
	private final ImmutableSortedMap<String, FunctionReport> functions;

	public VerificationReport(Collection<FunctionReport> reports) {
		ImmutableSortedMap.Builder<String, FunctionReport> b = ImmutableSortedMap.naturalOrder();
		for (FunctionReport r : reports) {
			b.put(r.getFunction(), r);
		}
		this.functions = b.build();
	}

	public SortedMap<String, FunctionReport> getFunctions() {
		return functions;
	}

	public FunctionReport get(String function) {
		return functions.get(function);
	}

	public boolean isVerified() {
		for (FunctionReport r : functions.values()) {
			if (!r.isVerified()) {
				return false;
			}
		}
		return true;
	}

	public int count(FunctionReport.Outcome outcome) {
		int n = 0;
		for (FunctionReport r : functions.values()) {
			if (r.getOutcome() == outcome) {
				n = n + 1;
			}
		}
		return n;
	}

	/**
	 * All diagnostics of the run, grouped by function.
	 *
	 * @return
	 */
	public List<Diagnostic> getDiagnostics() {
		ArrayList<Diagnostic> r = new ArrayList<>();
		for (FunctionReport f : functions.values()) {
			r.addAll(f.getDiagnostics());
		}
		return r;
	}

	@Override
	public String toString() {
		return functions.values().toString();
	}
}
