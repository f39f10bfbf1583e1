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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.core.ViperFile;
import rsviper.encoder.Obligation;
import rsviper.io.ViperFilePrinter;
import rsviper.lang.BackendUnavailableException;
import rsviper.lang.Verdict;
import rsviper.mir.MirProgram;
import rsviper.spec.FunctionSpec;
import rsviper.spec.SpecExpr;
import rsviper.util.Backend;
import rsviper.util.Viper;

public class ViperBuildTaskTest {

	/**
	 * Times out on the first few requests, then reports no errors.
	 */
	private static class ScriptedBackend implements Backend {
		private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
		private int timeouts;

		public ScriptedBackend(int timeouts) {
			this.timeouts = timeouts;
		}

		@Override
		public synchronized Viper.Message[] check(int timeout, String id, ViperFile program) {
			requests.add(id);
			if (timeouts > 0) {
				timeouts = timeouts - 1;
				return null;
			}
			return new Viper.Message[0];
		}
	}

	/**
	 * Never answers until released.
	 */
	private static class StuckBackend implements Backend {
		private final CountDownLatch release = new CountDownLatch(1);

		@Override
		public Viper.Message[] check(int timeout, String id, ViperFile program) {
			try {
				release.await();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return null;
		}
	}

	private static Obligation first(FunctionReport r, Obligation.Kind kind) {
		for (Obligation o : r.getVerdicts().keySet()) {
			if (o.getKind() == kind) {
				return o;
			}
		}
		throw new AssertionError("no " + kind + " obligation in " + r);
	}

	private static MirProgram program() {
		return new MirProgram.Builder().add(Programs.divide()).add(Programs.sum()).build();
	}

	private static Map<String, FunctionSpec> specs() {
		Map<String, FunctionSpec> specs = new HashMap<>();
		specs.put("divide", Programs.divideSpec(true));
		specs.put("sum", Programs.sumSpec(true));
		return specs;
	}

	@Test
	public void everyFunctionIsReported() {
		ScriptedBackend backend = new ScriptedBackend(0);
		VerificationReport r = new ViperBuildTask(backend).setWorkers(2).run(program(), specs());
		assertTrue(r.isVerified(), r.toString());
		assertEquals(2, r.getFunctions().size());
		assertEquals(2, backend.requests.size());
		assertTrue(backend.requests.contains("m$divide"));
		assertTrue(backend.requests.contains("m$sum"));
	}

	@Test
	public void badSpecificationOnlyAffectsItsFunction() {
		Map<String, FunctionSpec> specs = specs();
		specs.put("divide", FunctionSpec.builder()
				.requires(SpecExpr.GT(SpecExpr.VAR("c").at(Programs.at("divide.rs", 1)), SpecExpr.INT(0))).build());
		ScriptedBackend backend = new ScriptedBackend(0);
		VerificationReport r = new ViperBuildTask(backend).run(program(), specs);
		assertEquals(FunctionReport.Outcome.SPECIFICATION_ERROR, r.get("divide").getOutcome());
		assertEquals(1, r.get("divide").getDiagnostics().get(0).getSpan().getLine());
		assertEquals(FunctionReport.Outcome.VERIFIED, r.get("sum").getOutcome());
		assertEquals(Collections.singletonList("m$sum"), backend.requests);
	}

	@Test
	public void cachedFunctionIsNotCheckedAgain() {
		VerdictCache cache = new VerdictCache();
		ScriptedBackend backend = new ScriptedBackend(0);
		ViperBuildTask task = new ViperBuildTask(backend).setCache(cache);
		VerificationReport first = task.run(program(), specs());
		VerificationReport second = task.run(program(), specs());
		assertEquals(2, backend.requests.size());
		assertEquals(2, cache.size());
		assertEquals(first.getFunctions(), second.getFunctions());
		// A different setting is a different question
		task.setOverflowChecks(true).run(program(), specs());
		assertEquals(4, backend.requests.size());
	}

	@Test
	public void movedFunctionIsReportedAtItsNewLocation() {
		VerdictCache cache = new VerdictCache();
		ScriptedBackend backend = new ScriptedBackend(0);
		ViperBuildTask task = new ViperBuildTask(backend).setCache(cache);
		Map<String, FunctionSpec> specs = Collections.singletonMap("divide", Programs.divideSpec(false));
		FunctionReport before = task.run(new MirProgram.Builder().add(Programs.divide("divide", 0)).build(), specs)
				.get("divide");
		assertEquals(2, first(before, Obligation.Kind.PANIC_FREEDOM).getSpan().getLine());
		FunctionReport after = task.run(new MirProgram.Builder().add(Programs.divide("divide", 10)).build(), specs)
				.get("divide");
		assertEquals(12, first(after, Obligation.Kind.PANIC_FREEDOM).getSpan().getLine());
		assertEquals(2, backend.requests.size());
		// Unchanged again, so remembered
		task.run(new MirProgram.Builder().add(Programs.divide("divide", 10)).build(), specs);
		assertEquals(2, backend.requests.size());
	}

	@Test
	public void timeoutIsRetriedWhenEnabled() {
		ScriptedBackend backend = new ScriptedBackend(1);
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		VerificationReport r = new ViperBuildTask(backend).setRetry(true).run(program, specs());
		assertEquals(FunctionReport.Outcome.VERIFIED, r.get("divide").getOutcome());
		assertEquals(2, backend.requests.size());
	}

	@Test
	public void timeoutIsInconclusiveAndForgotten() {
		VerdictCache cache = new VerdictCache();
		ScriptedBackend backend = new ScriptedBackend(Integer.MAX_VALUE);
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		VerificationReport r = new ViperBuildTask(backend).setCache(cache).run(program, specs());
		FunctionReport divide = r.get("divide");
		assertEquals(FunctionReport.Outcome.INCONCLUSIVE, divide.getOutcome());
		for (Verdict v : divide.getVerdicts().values()) {
			assertEquals(Verdict.INCONCLUSIVE(Verdict.Reason.TIMEOUT), v);
		}
		assertEquals(0, cache.size());
		assertEquals(1, backend.requests.size());
	}

	@Test
	public void abandonedFunctionHasTimeoutForEveryObligation() {
		StuckBackend backend = new StuckBackend();
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		Map<String, FunctionSpec> specs = Collections.singletonMap("divide", Programs.divideSpec(false));
		try {
			FunctionReport divide = new ViperBuildTask(backend).setTimeout(1).run(program, specs).get("divide");
			assertEquals(FunctionReport.Outcome.INCONCLUSIVE, divide.getOutcome());
			assertTrue(divide.isTimeout());
			assertEquals(1, divide.getVerdicts(Obligation.Kind.PANIC_FREEDOM).size());
			for (Verdict v : divide.getVerdicts().values()) {
				assertEquals(Verdict.INCONCLUSIVE(Verdict.Reason.TIMEOUT), v);
			}
			assertEquals(2, first(divide, Obligation.Kind.PANIC_FREEDOM).getSpan().getLine());
		} finally {
			backend.release.countDown();
		}
	}

	@Test
	public void missingBackendStopsTheRun() {
		Backend missing = new Backend() {
			@Override
			public Viper.Message[] check(int timeout, String id, ViperFile program) {
				throw new BackendUnavailableException("cannot start silicon", null);
			}
		};
		assertThrows(BackendUnavailableException.class, () -> new ViperBuildTask(missing).run(program(), specs()));
	}

	@Test
	public void emitProducesOneProgram() {
		String text = ViperFilePrinter.toString(new ViperBuildTask().emit(program(), specs()));
		assertTrue(text.contains("method m$divide()"), text);
		assertTrue(text.contains("method m$sum()"), text);
	}
}
