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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.fail;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import rsviper.Programs;
import rsviper.encoder.Obligation;
import rsviper.lang.Verdict;
import rsviper.mir.MirProgram;
import rsviper.spec.FunctionSpec;
import rsviper.spec.SpecExpr;
import rsviper.util.Viper;

/**
 * End-to-end checks against a real installation of the verifier. These are
 * skipped when it cannot be found on the path.
 *
 * @author The Rust2Viper Project Developers
 */
public class VerificationScenariosTest {

	@BeforeAll
	public static void requireVerifier() {
		assumeTrue(Viper.isInstalled(Viper.DEFAULT_COMMAND), "silicon is not installed");
	}

	private static VerificationReport verify(MirProgram program, Map<String, FunctionSpec> specs) {
		return new ViperBuildTask().setTimeout(60).setWorkers(1).run(program, specs);
	}

	private static void assertFailed(List<Verdict> verdicts) {
		for (Verdict v : verdicts) {
			if (v.getKind() == Verdict.Kind.FAILED) {
				return;
			}
		}
		fail("expected a failure in " + verdicts);
	}

	@Test
	public void divisionWithoutPrecondition() {
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		FunctionReport r = verify(program, Collections.emptyMap()).get("divide");
		assertEquals(FunctionReport.Outcome.FAILED, r.getOutcome());
		assertFailed(r.getVerdicts(Obligation.Kind.PANIC_FREEDOM));
		assertEquals(2, r.getDiagnostics().get(0).getSpan().getLine());
	}

	/**
	 * Programs whose every function should verify.
	 */
	private static Stream<String> valid() {
		return Stream.of("divide", "sum", "half", "trivial");
	}

	@ParameterizedTest
	@MethodSource("valid")
	public void verifies(String name) {
		Map<String, FunctionSpec> specs = new HashMap<>();
		specs.put("divide", Programs.divideSpec(true));
		specs.put("sum", Programs.sumSpec(true));
		MirProgram.Builder program = new MirProgram.Builder().add(Programs.divide());
		if (name.equals("sum")) {
			program.add(Programs.sum());
		} else if (name.equals("half")) {
			program.add(Programs.half(2));
		} else if (name.equals("trivial")) {
			program = new MirProgram.Builder().add(Programs.divide("trivial"));
			specs.put("trivial", FunctionSpec.builder().requires(Programs.divideSpec(true).getRequires().get(0))
					.ensures(SpecExpr.BOOL(true)).build());
		}
		FunctionReport r = verify(program.build(), specs).get(name);
		assertEquals(FunctionReport.Outcome.VERIFIED, r.getOutcome(), r.getDiagnostics().toString());
	}

	@Test
	public void sumWithoutInvariants() {
		MirProgram program = new MirProgram.Builder().add(Programs.sum()).build();
		FunctionReport r = verify(program, Collections.singletonMap("sum", Programs.sumSpec(false))).get("sum");
		assertNotEquals(FunctionReport.Outcome.VERIFIED, r.getOutcome());
		assertFailed(r.getVerdicts(Obligation.Kind.POSTCONDITION));
	}

	@Test
	public void callerMustEstablishCalleePrecondition() {
		Map<String, FunctionSpec> specs = Collections.singletonMap("divide", Programs.divideSpec(true));
		MirProgram bad = new MirProgram.Builder().add(Programs.divide()).add(Programs.half(0)).build();
		FunctionReport r = verify(bad, specs).get("half");
		assertEquals(FunctionReport.Outcome.FAILED, r.getOutcome());
		assertFailed(r.getVerdicts(Obligation.Kind.PRECONDITION));
	}
}
