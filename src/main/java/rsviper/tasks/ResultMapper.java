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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;

import rsviper.core.ViperFile;
import rsviper.encoder.EncodedProcedure;
import rsviper.encoder.Obligation;
import rsviper.lang.Diagnostic;
import rsviper.lang.Verdict;
import rsviper.util.Viper;

/**
 * Maps the messages reported by the backend for a program back onto the
 * obligations of the procedure it was generated from. Every obligation which
 * no error is attributed to has been verified.
 *
 * @author The Rust2Viper Project Developers
 */
public class ResultMapper {
	private static final Logger logger = LoggerFactory.getLogger(ResultMapper.class);

	/**
	 * Matches a counterexample entry for the initial value of a parameter.
	 */
	private static final Pattern ARGUMENT_MATCH = Pattern.compile("^arg\\$(\\w+)\\s*(?:->|:|=)\\s*(.+)$");

	/**
	 * Determine the verdicts of a procedure's obligations.
	 *
	 * @param procedure
	 * @param messages
	 *            The messages reported by the backend, or <code>null</code>
	 *            if it timed out.
	 * @return
	 */
	public FunctionReport map(EncodedProcedure procedure, Viper.Message[] messages) {
		String function = procedure.getName();
		LinkedHashMap<Obligation, Verdict> verdicts = new LinkedHashMap<>();
		ArrayList<Diagnostic> internal = new ArrayList<>();
		if (messages == null) {
			logger.warn("{} timed out", function);
			fill(procedure, verdicts, Verdict.INCONCLUSIVE(Verdict.Reason.TIMEOUT));
			return FunctionReport.of(function, verdicts, internal);
		}
		for (Viper.Message m : messages) {
			if (m instanceof Viper.FatalError) {
				// The program itself was rejected, so nothing is known about it
				logger.error("backend rejected {}: {}", function, ((Viper.FatalError) m).getMessage());
				verdicts.clear();
				fill(procedure, verdicts, Verdict.INCONCLUSIVE(Verdict.Reason.BACKEND_ERROR));
				return FunctionReport.of(function, verdicts, internal);
			}
		}
		for (Viper.Message m : messages) {
			Viper.Error err = (Viper.Error) m;
			Obligation o = obligationOf(err);
			if (o == null) {
				logger.error("unregistered verification error in {}: {}", function, err);
				internal.add(new Diagnostic(function, procedure.getSpan(), Diagnostic.Severity.ERROR,
						Diagnostic.Category.INTERNAL, "unregistered verification error: " + err.getMessage()));
			} else if (!verdicts.containsKey(o)) {
				logger.debug("{} failed: {}", o.getName(), err.getMessage());
				verdicts.put(o, Verdict.FAILED(counterexample(err.getCounterexample())));
			}
		}
		fill(procedure, verdicts, Verdict.VERIFIED);
		return FunctionReport.of(function, verdicts, internal);
	}

	private static void fill(EncodedProcedure procedure, LinkedHashMap<Obligation, Verdict> verdicts, Verdict v) {
		for (Obligation o : procedure.getObligations()) {
			if (!verdicts.containsKey(o)) {
				verdicts.put(o, v);
			}
		}
	}

	/**
	 * Determine the obligation an error belongs to. This is attached either to
	 * the item at the position of the error or, when the backend reports the
	 * position of a subexpression, to the statement on the same line.
	 *
	 * @param err
	 * @return
	 */
	private static Obligation obligationOf(Viper.Error err) {
		ViperFile.Item item = err.getEnclosingItem();
		if (item != null) {
			Obligation o = item.getAttribute(Obligation.class);
			if (o != null) {
				return o;
			}
		}
		for (ViperFile.Item i : err.getLineItems()) {
			Obligation o = i.getAttribute(Obligation.class);
			if (o != null) {
				return o;
			}
		}
		return null;
	}

	/**
	 * Summarise the model reported with an error. Where the model gives the
	 * initial values of parameters, these are reported by their source names.
	 *
	 * @param lines
	 * @return
	 */
	static String counterexample(List<String> lines) {
		ArrayList<String> arguments = new ArrayList<>();
		for (String l : lines) {
			Matcher m = ARGUMENT_MATCH.matcher(l.trim());
			if (m.matches()) {
				arguments.add(m.group(1) + " = " + m.group(2).trim());
			}
		}
		if (!arguments.isEmpty()) {
			return Joiner.on(", ").join(arguments);
		}
		return Joiner.on("; ").join(lines);
	}
}
