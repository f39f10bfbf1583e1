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

import java.util.List;
import java.util.Objects;
import java.util.Properties;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import rsviper.util.Viper;

/**
 * The global settings of a verification run. A configuration is immutable;
 * each <code>with</code> method returns an updated copy.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Config {
	public static final String BUILD_VIPER_TIMEOUT = "build.viper.timeout";
	public static final String BUILD_VIPER_OVERFLOW = "build.viper.overflow";
	public static final String BUILD_VIPER_RETRY = "build.viper.retry";
	public static final String BUILD_VIPER_WORKERS = "build.viper.workers";
	public static final String BUILD_VIPER_COMMAND = "build.viper.command";
	public static final String BUILD_VIPER_OPTIONS = "build.viper.options";
	public static final String BUILD_VIPER_VERBOSE = "build.viper.verbose";

	public static final Config DEFAULT = new Config(10, false, false, Runtime.getRuntime().availableProcessors(),
			Viper.DEFAULT_COMMAND, Viper.DEFAULT_OPTIONS, false);

	/**
	 * Backend timeout per function (in seconds).
	 */
	private final int timeout;
	/**
	 * Whether arithmetic must be shown to stay within the bounds of its type.
	 */
	private final boolean overflow;
	/**
	 * Whether a timed out function is retried once with twice the timeout.
	 */
	private final boolean retry;
	private final int workers;
	private final String command;
	private final ImmutableList<String> options;
	/**
	 * Specify whether to log the backend's errors or not.
	 */
	private final boolean verbose;

	private Config(int timeout, boolean overflow, boolean retry, int workers, String command, List<String> options,
			boolean verbose) {
		if (timeout <= 0) {
			throw new IllegalArgumentException("invalid timeout: " + timeout);
		} else if (workers <= 0) {
			throw new IllegalArgumentException("invalid worker count: " + workers);
		}
		this.timeout = timeout;
		this.overflow = overflow;
		this.retry = retry;
		this.workers = workers;
		this.command = Objects.requireNonNull(command);
		this.options = ImmutableList.copyOf(options);
		this.verbose = verbose;
	}

	/**
	 * Read a configuration from a set of properties. Missing keys keep their
	 * default values.
	 *
	 * @param properties
	 * @return
	 */
	public static Config load(Properties properties) {
		Config c = DEFAULT;
		String v;
		if ((v = properties.getProperty(BUILD_VIPER_TIMEOUT)) != null) {
			c = c.withTimeout(parseInt(BUILD_VIPER_TIMEOUT, v));
		}
		if ((v = properties.getProperty(BUILD_VIPER_OVERFLOW)) != null) {
			c = c.withOverflowChecks(parseBoolean(BUILD_VIPER_OVERFLOW, v));
		}
		if ((v = properties.getProperty(BUILD_VIPER_RETRY)) != null) {
			c = c.withRetry(parseBoolean(BUILD_VIPER_RETRY, v));
		}
		if ((v = properties.getProperty(BUILD_VIPER_WORKERS)) != null) {
			c = c.withWorkers(parseInt(BUILD_VIPER_WORKERS, v));
		}
		if ((v = properties.getProperty(BUILD_VIPER_COMMAND)) != null) {
			c = c.withCommand(v.trim());
		}
		if ((v = properties.getProperty(BUILD_VIPER_OPTIONS)) != null) {
			c = c.withOptions(Splitter.on(' ').omitEmptyStrings().trimResults().splitToList(v));
		}
		if ((v = properties.getProperty(BUILD_VIPER_VERBOSE)) != null) {
			c = c.withVerbose(parseBoolean(BUILD_VIPER_VERBOSE, v));
		}
		return c;
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("invalid value for " + key + ": " + value, e);
		}
	}

	private static boolean parseBoolean(String key, String value) {
		switch (value.trim().toLowerCase()) {
		case "true":
			return true;
		case "false":
			return false;
		default:
			throw new IllegalArgumentException("invalid value for " + key + ": " + value);
		}
	}

	public int getTimeout() {
		return timeout;
	}

	public boolean isCheckingOverflow() {
		return overflow;
	}

	public boolean isRetrying() {
		return retry;
	}

	public int getWorkers() {
		return workers;
	}

	public String getCommand() {
		return command;
	}

	public List<String> getOptions() {
		return options;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public Config withTimeout(int timeout) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	public Config withOverflowChecks(boolean overflow) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	public Config withRetry(boolean retry) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	public Config withWorkers(int workers) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	public Config withCommand(String command) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	public Config withOptions(List<String> options) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	public Config withVerbose(boolean verbose) {
		return new Config(timeout, overflow, retry, workers, command, options, verbose);
	}

	/**
	 * The settings which change the meaning of an emitted program or of its
	 * verdicts, as a string. Two runs with the same fingerprint can share
	 * cached verdicts.
	 *
	 * @return
	 */
	public String getFingerprint() {
		return "overflow=" + overflow + ";timeout=" + timeout + ";retry=" + retry + ";command=" + command
				+ ";options=" + String.join(" ", options);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Config) {
			Config c = (Config) o;
			return timeout == c.timeout && overflow == c.overflow && retry == c.retry && workers == c.workers
					&& command.equals(c.command) && options.equals(c.options) && verbose == c.verbose;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(timeout, overflow, retry, workers, command, options, verbose);
	}

	@Override
	public String toString() {
		return "Config{" + getFingerprint() + ";workers=" + workers + ";verbose=" + verbose + "}";
	}
}
