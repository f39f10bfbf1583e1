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
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rsviper.core.ViperFile;
import rsviper.encoder.EncodedProcedure;
import rsviper.lang.BackendUnavailableException;
import rsviper.lang.Span;
import rsviper.lang.SpecificationError;
import rsviper.lang.StructuralException;
import rsviper.lang.UnsupportedException;
import rsviper.lang.Verdict;
import rsviper.mir.Body;
import rsviper.mir.MirProgram;
import rsviper.spec.FunctionSpec;
import rsviper.util.Backend;
import rsviper.util.Viper;

/**
 * Verifies every function of a program. Functions are translated and checked
 * independently on a fixed pool of workers, so that a problem with one
 * function never affects the result of another. The per-function reports are
 * merged once every worker has finished.
 *
 * @author The Rust2Viper Project Developers
 */
public class ViperBuildTask {
	private static final Logger logger = LoggerFactory.getLogger(ViperBuildTask.class);

	/**
	 * Time allowed on top of the backend's own timeout before the scheduler
	 * gives up on a function (in seconds).
	 */
	private static final int GRACE = 5;

	/**
	 * Handle for the verifier, or <code>null</code> to start one from the
	 * configured command.
	 */
	private final Backend verifier;

	private Config config = Config.DEFAULT;

	private VerdictCache cache = null;

	private final ProgramEmitter emitter = new ProgramEmitter();

	public ViperBuildTask() {
		this(null);
	}

	public ViperBuildTask(Backend verifier) {
		this.verifier = verifier;
	}

	public ViperBuildTask setConfig(Config config) {
		this.config = config;
		return this;
	}

	public Config getConfig() {
		return config;
	}

	public ViperBuildTask setTimeout(int timeout) {
		this.config = config.withTimeout(timeout);
		return this;
	}

	public ViperBuildTask setOverflowChecks(boolean flag) {
		this.config = config.withOverflowChecks(flag);
		return this;
	}

	public ViperBuildTask setRetry(boolean flag) {
		this.config = config.withRetry(flag);
		return this;
	}

	public ViperBuildTask setWorkers(int workers) {
		this.config = config.withWorkers(workers);
		return this;
	}

	public ViperBuildTask setVerbose(boolean flag) {
		this.config = config.withVerbose(flag);
		return this;
	}

	public ViperBuildTask setCache(VerdictCache cache) {
		this.cache = cache;
		return this;
	}

	/**
	 * Translate every function into a single program, without checking it.
	 *
	 * @param program
	 * @param specs
	 * @return
	 */
	public ViperFile emit(MirProgram program, Map<String, FunctionSpec> specs) {
		ViperCompileTask compiler = new ViperCompileTask(program, specs, config);
		return emitter.emit(compiler.compileAll().values());
	}

	/**
	 * Verify every function of a program which has a body.
	 *
	 * @param program
	 * @param specs
	 *            The specifications of functions, by name. Functions without
	 *            one have the empty specification.
	 * @return
	 * @throws BackendUnavailableException
	 *             If the backend cannot be started at all.
	 */
	public VerificationReport run(MirProgram program, Map<String, FunctionSpec> specs) {
		ViperCompileTask compiler = new ViperCompileTask(program, specs, config);
		Backend backend = verifier != null ? verifier : new Viper(config.getCommand(), config.getOptions());
		// Resolve contracts up front, so workers only ever read them
		compiler.getContracts();
		// Workers publish what they encode, so a function abandoned by the
		// scheduler still gets a verdict for each of its obligations
		ConcurrentHashMap<String, EncodedProcedure> encoded = new ConcurrentHashMap<>();
		ExecutorService pool = Executors.newFixedThreadPool(config.getWorkers());
		LinkedHashMap<Body, Future<FunctionReport>> futures = new LinkedHashMap<>();
		try {
			for (Body b : program.getBodies()) {
				futures.put(b, pool.submit(new Worker(compiler, backend, b, encoded)));
			}
			ArrayList<FunctionReport> reports = new ArrayList<>();
			for (Map.Entry<Body, Future<FunctionReport>> e : futures.entrySet()) {
				reports.add(await(e.getKey(), e.getValue(), encoded));
			}
			VerificationReport r = new VerificationReport(reports);
			logger.info("verified {} of {} functions", r.count(FunctionReport.Outcome.VERIFIED), reports.size());
			return r;
		} finally {
			pool.shutdownNow();
		}
	}

	private FunctionReport await(Body body, Future<FunctionReport> future, Map<String, EncodedProcedure> encoded) {
		String name = body.getName();
		Span span = body.getSignature().getSpan();
		int budget = config.getTimeout() * (config.isRetrying() ? 3 : 1) + GRACE;
		try {
			return future.get(budget, TimeUnit.SECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("{} timed out after {}s", name, budget);
			EncodedProcedure procedure = encoded.get(name);
			if (procedure != null) {
				return new ResultMapper().map(procedure, null);
			}
			return FunctionReport.inconclusive(name, Verdict.Reason.TIMEOUT, "verification timed out", span);
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			return FunctionReport.inconclusive(name, Verdict.Reason.TIMEOUT, "verification interrupted", span);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof BackendUnavailableException) {
				throw (BackendUnavailableException) cause;
			}
			logger.error("internal failure verifying " + name, cause);
			return FunctionReport.internalError(name, "internal failure: " + cause, span);
		}
	}

	/**
	 * Translates and checks a single function, turning the errors which are
	 * specific to that function into its report.
	 */
	private class Worker implements Callable<FunctionReport> {
		private final ViperCompileTask compiler;
		private final Backend backend;
		private final Body body;
		private final Map<String, EncodedProcedure> encoded;

		public Worker(ViperCompileTask compiler, Backend backend, Body body, Map<String, EncodedProcedure> encoded) {
			this.compiler = compiler;
			this.backend = backend;
			this.body = body;
			this.encoded = encoded;
		}

		@Override
		public FunctionReport call() {
			String name = body.getName();
			logger.info("verifying {}", name);
			try {
				EncodedProcedure procedure = compiler.compile(body);
				encoded.put(name, procedure);
				ViperFile file = emitter.emit(procedure);
				String key = cache == null ? null : VerdictCache.key(procedure, file, config);
				if (key != null) {
					FunctionReport r = cache.get(key);
					if (r != null) {
						return r;
					}
				}
				FunctionReport r = new ViperVerifyTask(backend).configure(config).apply(procedure, file);
				if (key != null) {
					cache.put(key, r);
				}
				log(r);
				return r;
			} catch (SpecificationError e) {
				logger.error("invalid specification for {}: {}", name, e.getMessage());
				return FunctionReport.specificationError(name, e);
			} catch (StructuralException e) {
				logger.error("cannot encode {}: {}", name, e.getMessage());
				return FunctionReport.internalError(name, e.getMessage(), e.getSpan());
			} catch (UnsupportedException e) {
				logger.warn("cannot verify {}: {}", name, e.getMessage());
				return FunctionReport.inconclusive(name, Verdict.Reason.UNSUPPORTED_CONSTRUCT, e.getMessage(),
						e.getSpan());
			}
		}

		private void log(FunctionReport r) {
			switch (r.getOutcome()) {
			case VERIFIED:
				logger.info("{} verified", r.getFunction());
				break;
			case INCONCLUSIVE:
				logger.warn("{} inconclusive", r.getFunction());
				break;
			default:
				logger.info("{} {}", r.getFunction(), r.getOutcome().name().toLowerCase());
				break;
			}
		}
	}
}
