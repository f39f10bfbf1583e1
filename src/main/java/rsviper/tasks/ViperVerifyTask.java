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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rsviper.core.ViperFile;
import rsviper.encoder.EncodedProcedure;
import rsviper.util.Backend;
import rsviper.util.Viper;

/**
 * Checks the program generated for a single function with the backend, and
 * maps the outcome back onto the function's obligations.
 *
 * @author The Rust2Viper Project Developers
 */
public class ViperVerifyTask {
	private static final Logger logger = LoggerFactory.getLogger(ViperVerifyTask.class);

	/**
	 * Handle for the verifier.
	 */
	private final Backend verifier;
	/**
	 * Backend process timeout (in seconds)
	 */
	private int timeout = 10;
	/**
	 * Whether to retry once, with twice the timeout, when the first attempt
	 * runs out of time.
	 */
	private boolean retry = false;
	/**
	 * Specify whether to log every error reported or not
	 */
	private boolean verbose = false;

	private final ResultMapper mapper = new ResultMapper();

	public ViperVerifyTask(Backend verifier) {
		if (verifier == null) {
			throw new IllegalArgumentException("invalid backend");
		}
		this.verifier = verifier;
	}

	public ViperVerifyTask setTimeout(int timeout) {
		this.timeout = timeout;
		return this;
	}

	public ViperVerifyTask setRetry(boolean flag) {
		this.retry = flag;
		return this;
	}

	public ViperVerifyTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public ViperVerifyTask configure(Config config) {
		return setTimeout(config.getTimeout()).setRetry(config.isRetrying()).setVerbose(config.isVerbose());
	}

	/**
	 * Check a program generated for a given procedure.
	 *
	 * @param procedure
	 * @param program
	 *            The complete program containing the procedure's method.
	 * @return
	 */
	public FunctionReport apply(EncodedProcedure procedure, ViperFile program) {
		String id = procedure.getMethod().getName();
		Viper.Message[] errors = verifier.check(timeout * 1000, id, program);
		if (errors == null && retry) {
			logger.info("{} timed out after {}s, retrying", procedure.getName(), timeout);
			errors = verifier.check(timeout * 2000, id, program);
		}
		if (verbose && errors != null && errors.length > 0) {
			logger.info("=================================================");
			logger.info("Errors: {}", procedure.getName());
			logger.info("=================================================");
			for (int i = 0; i != errors.length; ++i) {
				logger.info("{}", errors[i]);
			}
		}
		return mapper.map(procedure, errors);
	}
}
