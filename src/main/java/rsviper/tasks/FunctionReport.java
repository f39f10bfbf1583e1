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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import rsviper.encoder.Obligation;
import rsviper.lang.Diagnostic;
import rsviper.lang.Span;
import rsviper.lang.SpecificationError;
import rsviper.lang.Verdict;

/**
 * The result of verifying a single function: a verdict for each of its
 * obligations, plus the diagnostics which the user should see.
 *
 * @author The Rust2Viper Project Developers
 */
public final class FunctionReport {

	public enum Outcome {
		VERIFIED,
		FAILED,
		INCONCLUSIVE,
		SPECIFICATION_ERROR,
		INTERNAL_ERROR
	}

	private final String function;
	private final Outcome outcome;
	private final ImmutableSortedMap<Obligation, Verdict> verdicts;
	private final ImmutableList<Diagnostic> diagnostics;

	private FunctionReport(String function, Outcome outcome, Map<Obligation, Verdict> verdicts,
			List<Diagnostic> diagnostics) {
		this.function = function;
		this.outcome = outcome;
		this.verdicts = ImmutableSortedMap.copyOf(verdicts);
		ArrayList<Diagnostic> sorted = new ArrayList<>(diagnostics);
		Collections.sort(sorted);
		this.diagnostics = ImmutableList.copyOf(sorted);
	}

	/**
	 * Construct the report for a function whose program was checked by the
	 * backend.
	 *
	 * @param function
	 * @param verdicts
	 *            The verdict of every obligation.
	 * @param internal
	 *            Problems with the backend's output which could not be
	 *            attributed to any obligation.
	 * @return
	 */
	public static FunctionReport of(String function, Map<Obligation, Verdict> verdicts, List<Diagnostic> internal) {
		ArrayList<Diagnostic> diagnostics = new ArrayList<>(internal);
		boolean failed = false;
		boolean inconclusive = false;
		for (Map.Entry<Obligation, Verdict> e : verdicts.entrySet()) {
			Obligation o = e.getKey();
			Verdict v = e.getValue();
			switch (v.getKind()) {
			case FAILED: {
				failed = true;
				String cex = ((Verdict.Failed) v).getCounterexample();
				String message = cex.isEmpty() ? o.getDescription()
						: o.getDescription() + " (counterexample: " + cex + ")";
				diagnostics.add(new Diagnostic(function, o.getSpan(), Diagnostic.Severity.ERROR,
						Diagnostic.Category.VERIFICATION, message));
				break;
			}
			case INCONCLUSIVE:
				inconclusive = true;
				diagnostics.add(new Diagnostic(function, o.getSpan(), Diagnostic.Severity.WARNING,
						Diagnostic.Category.VERIFICATION, o.getDescription() + " (" + v + ")"));
				break;
			default:
				break;
			}
		}
		Outcome outcome;
		if (failed) {
			outcome = Outcome.FAILED;
		} else if (!internal.isEmpty()) {
			outcome = Outcome.INTERNAL_ERROR;
		} else if (inconclusive) {
			outcome = Outcome.INCONCLUSIVE;
		} else {
			outcome = Outcome.VERIFIED;
		}
		return new FunctionReport(function, outcome, verdicts, diagnostics);
	}

	public static FunctionReport specificationError(String function, SpecificationError e) {
		Diagnostic d = new Diagnostic(function, e.getSpan(), Diagnostic.Severity.ERROR,
				Diagnostic.Category.SPECIFICATION, e.getMessage());
		return new FunctionReport(function, Outcome.SPECIFICATION_ERROR, Collections.emptyMap(),
				Collections.singletonList(d));
	}

	public static FunctionReport internalError(String function, String message, Span span) {
		Diagnostic d = new Diagnostic(function, span, Diagnostic.Severity.ERROR, Diagnostic.Category.INTERNAL,
				message);
		return new FunctionReport(function, Outcome.INTERNAL_ERROR, Collections.emptyMap(),
				Collections.singletonList(d));
	}

	/**
	 * Construct the report for a function which could not be decided as a
	 * whole, for example because it uses an unsupported construct or because
	 * it ran out of time before any obligation was known.
	 *
	 * @param function
	 * @param reason
	 * @param message
	 * @param span
	 * @return
	 */
	public static FunctionReport inconclusive(String function, Verdict.Reason reason, String message, Span span) {
		Diagnostic d = new Diagnostic(function, span, Diagnostic.Severity.WARNING, Diagnostic.Category.VERIFICATION,
				message + " (" + Verdict.INCONCLUSIVE(reason) + ")");
		return new FunctionReport(function, Outcome.INCONCLUSIVE, Collections.emptyMap(),
				Collections.singletonList(d));
	}

	public String getFunction() {
		return function;
	}

	public Outcome getOutcome() {
		return outcome;
	}

	public boolean isVerified() {
		return outcome == Outcome.VERIFIED;
	}

	public Map<Obligation, Verdict> getVerdicts() {
		return verdicts;
	}

	/**
	 * Get the verdicts of every obligation of a given kind, in the order the
	 * obligations were registered.
	 *
	 * @param kind
	 * @return
	 */
	public List<Verdict> getVerdicts(Obligation.Kind kind) {
		ArrayList<Verdict> r = new ArrayList<>();
		for (Map.Entry<Obligation, Verdict> e : verdicts.entrySet()) {
			if (e.getKey().getKind() == kind) {
				r.add(e.getValue());
			}
		}
		return r;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * Check whether any verdict was inconclusive because the backend ran out
	 * of time. Such reports are not worth remembering.
	 *
	 * @return
	 */
	public boolean isTimeout() {
		for (Verdict v : verdicts.values()) {
			if (v instanceof Verdict.Inconclusive && ((Verdict.Inconclusive) v).getReason() == Verdict.Reason.TIMEOUT) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof FunctionReport) {
			FunctionReport r = (FunctionReport) o;
			return function.equals(r.function) && outcome == r.outcome && verdicts.equals(r.verdicts)
					&& diagnostics.equals(r.diagnostics);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return function.hashCode() ^ outcome.hashCode() ^ verdicts.hashCode();
	}

	@Override
	public String toString() {
		return function + ": " + outcome.name().toLowerCase() + " " + verdicts.values();
	}
}
