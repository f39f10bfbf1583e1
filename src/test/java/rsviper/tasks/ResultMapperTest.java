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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static rsviper.core.ViperFile.ASSERT;
import static rsviper.core.ViperFile.ATTRIBUTE;
import static rsviper.core.ViperFile.CONST;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.core.ViperFile;
import rsviper.encoder.EncodedProcedure;
import rsviper.encoder.Obligation;
import rsviper.lang.Diagnostic;
import rsviper.lang.Verdict;
import rsviper.mir.MirProgram;
import rsviper.util.Viper;

public class ResultMapperTest {
	private final ResultMapper mapper = new ResultMapper();

	private EncodedProcedure divide;

	@BeforeEach
	public void compile() {
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		divide = new ViperCompileTask(program, Collections.emptyMap(), Config.DEFAULT)
				.compile(program.getBody("divide"));
	}

	private Obligation divisorCheck() {
		for (Obligation o : divide.getObligations()) {
			if (o.getKind() == Obligation.Kind.PANIC_FREEDOM) {
				return o;
			}
		}
		throw new AssertionError("no divisor check");
	}

	private static Viper.Error failure(Obligation o, List<String> model) {
		ViperFile.Stmt s = ASSERT(CONST(false), ATTRIBUTE(o));
		return new Viper.Error(3, 3, "Assert might fail.", s, Collections.emptyList(), model);
	}

	@Test
	public void noErrorsMeansVerified() {
		FunctionReport r = mapper.map(divide, new Viper.Message[0]);
		assertEquals(FunctionReport.Outcome.VERIFIED, r.getOutcome());
		assertEquals(divide.getObligations().size(), r.getVerdicts().size());
		assertTrue(r.getDiagnostics().isEmpty());
	}

	@Test
	public void errorFailsItsObligation() {
		Obligation o = divisorCheck();
		FunctionReport r = mapper.map(divide,
				new Viper.Message[] { failure(o, Arrays.asList("arg$a -> 7", "arg$b -> 0")) });
		assertEquals(FunctionReport.Outcome.FAILED, r.getOutcome());
		Map<Obligation, Verdict> verdicts = r.getVerdicts();
		assertEquals(Verdict.FAILED("a = 7, b = 0"), verdicts.get(o));
		for (Map.Entry<Obligation, Verdict> e : verdicts.entrySet()) {
			if (!e.getKey().equals(o)) {
				assertEquals(Verdict.VERIFIED, e.getValue());
			}
		}
		Diagnostic d = r.getDiagnostics().get(0);
		assertEquals(Diagnostic.Severity.ERROR, d.getSeverity());
		assertEquals(2, d.getSpan().getLine());
		assertTrue(d.getMessage().contains("attempt to divide by zero"), d.getMessage());
		assertTrue(d.getMessage().contains("b = 0"), d.getMessage());
	}

	@Test
	public void errorIsFoundThroughItsLine() {
		Obligation o = divisorCheck();
		ViperFile.Stmt s = ASSERT(CONST(false), ATTRIBUTE(o));
		Viper.Error e = new Viper.Error(3, 10, "Assert might fail.", null, Collections.singletonList(s),
				Collections.emptyList());
		FunctionReport r = mapper.map(divide, new Viper.Message[] { e });
		assertEquals(Verdict.FAILED(""), r.getVerdicts().get(o));
	}

	@Test
	public void timeoutIsInconclusive() {
		FunctionReport r = mapper.map(divide, null);
		assertEquals(FunctionReport.Outcome.INCONCLUSIVE, r.getOutcome());
		assertTrue(r.isTimeout());
		for (Verdict v : r.getVerdicts().values()) {
			assertEquals(Verdict.INCONCLUSIVE(Verdict.Reason.TIMEOUT), v);
		}
	}

	@Test
	public void rejectedProgramIsInconclusive() {
		FunctionReport r = mapper.map(divide, new Viper.Message[] { new Viper.FatalError("Parse error") });
		assertEquals(FunctionReport.Outcome.INCONCLUSIVE, r.getOutcome());
		for (Verdict v : r.getVerdicts().values()) {
			assertEquals(Verdict.INCONCLUSIVE(Verdict.Reason.BACKEND_ERROR), v);
		}
	}

	@Test
	public void unregisteredErrorIsInternal() {
		Viper.Error e = new Viper.Error(1, 1, "Assert might fail.", ASSERT(CONST(false)), Collections.emptyList(),
				Collections.emptyList());
		FunctionReport r = mapper.map(divide, new Viper.Message[] { e });
		assertEquals(FunctionReport.Outcome.INTERNAL_ERROR, r.getOutcome());
		assertEquals(Diagnostic.Category.INTERNAL, r.getDiagnostics().get(0).getCategory());
	}

	@Test
	public void failureOutranksInternalError() {
		Viper.Error stray = new Viper.Error(1, 1, "Assert might fail.", ASSERT(CONST(false)),
				Collections.emptyList(), Collections.emptyList());
		FunctionReport r = mapper.map(divide,
				new Viper.Message[] { stray, failure(divisorCheck(), Collections.emptyList()) });
		assertEquals(FunctionReport.Outcome.FAILED, r.getOutcome());
	}

	@Test
	public void counterexampleFallsBackToRawModel() {
		assertEquals("x = 1, y = -2", ResultMapper.counterexample(Arrays.asList("arg$x -> 1", "  arg$y: -2")));
		assertEquals("_3 -> true; _4 -> 0", ResultMapper.counterexample(Arrays.asList("_3 -> true", "_4 -> 0")));
		assertEquals("", ResultMapper.counterexample(Collections.emptyList()));
	}
}
