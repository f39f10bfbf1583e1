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
package rsviper.util;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import rsviper.core.ViperFile;
import rsviper.io.ViperFilePrinter;
import rsviper.lang.BackendUnavailableException;

/**
 * A wrapper for the command-line front ends of the Viper verifiers (e.g.
 * <code>silicon</code> or <code>carbon</code>).
 *
 * @author The Rust2Viper Project Developers
 */
public class Viper implements Backend {
	private static final Logger logger = LoggerFactory.getLogger(Viper.class);

	public static final String DEFAULT_COMMAND = "silicon";

	public static final List<String> DEFAULT_OPTIONS = ImmutableList.of("--numberOfErrorsToReport", "0",
			"--counterexample", "variables");

	/**
	 * The following regex matches the error lines reported by the verifier. The
	 * regex identifies the message itself, followed by the file, line number
	 * and column number.
	 */
	private static final Pattern ERROR_MATCH = Pattern.compile("^\\s*\\[(\\d+)\\]\\s+(.*)\\s+\\((\\S*)@(\\d+)\\.(\\d+)\\)\\s*$");

	/**
	 * Matches the line which states verification succeeded.
	 */
	private static final Pattern SUCCESS_MATCH = Pattern.compile("^.*finished verification successfully.*$");

	/**
	 * Matches the line which introduces the list of errors.
	 */
	private static final Pattern FOUND_MATCH = Pattern.compile("^.*found (\\d+) errors?.*$");

	/**
	 * Matches problems with the program itself, rather than failures to verify
	 * it.
	 */
	private static final Pattern FATAL_MATCH = Pattern.compile("^.*(Parse error|Type error|Consistency error|Internal error|Exception).*$");

	private final String command;

	private final List<String> options;

	public Viper() {
		this(DEFAULT_COMMAND, DEFAULT_OPTIONS);
	}

	public Viper(String command, List<String> options) {
		this.command = command;
		this.options = ImmutableList.copyOf(options);
	}

	public String getCommand() {
		return command;
	}

	/**
	 * Check whether a given command can be found on the search path.
	 *
	 * @param command
	 * @return
	 */
	public static boolean isInstalled(String command) {
		if (command.contains(File.separator)) {
			return new File(command).canExecute();
		}
		String path = System.getenv("PATH");
		if (path == null) {
			return false;
		}
		for (String dir : path.split(File.pathSeparator)) {
			if (new File(dir, command).canExecute()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public Message[] check(int timeout, String id, ViperFile program) {
		File file = null;
		try {
			// Convert the program into a byte sequence
			ByteArrayOutputStream output = new ByteArrayOutputStream();
			ViperFilePrinter vfp = new ViperFilePrinter(output);
			vfp.write(program);
			vfp.flush();
			// Create the temporary file.
			file = createTemporaryFile(id, ".vpr", output.toByteArray());
			// ===================================================
			// Construct command
			// ===================================================
			ArrayList<String> cmd = new ArrayList<>();
			cmd.add(command);
			cmd.addAll(options);
			cmd.add(file.getAbsolutePath());
			logger.debug("running {}", Joiner.on(' ').join(cmd));
			// ===================================================
			// Construct the process
			// ===================================================
			ProcessBuilder builder = new ProcessBuilder(cmd);
			builder.redirectErrorStream(true);
			Process child;
			try {
				child = builder.start();
			} catch (IOException e) {
				throw new BackendUnavailableException("cannot start " + command + ": " + e.getMessage(), e);
			}
			try {
				StreamReader reader = new StreamReader(child.getInputStream());
				reader.start();
				boolean success = child.waitFor(timeout, TimeUnit.MILLISECONDS);
				if (!success) {
					logger.debug("{} timed out after {}ms", id, timeout);
					return null;
				}
				reader.join();
				String stdout = new String(reader.getBytes(), StandardCharsets.UTF_8);
				return parseErrors(stdout, vfp.getMapping());
			} finally {
				// make sure child process is destroyed.
				child.destroyForcibly();
			}
		} catch (IOException e) {
			throw new BackendUnavailableException(e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return null;
		} finally {
			if (file != null && !file.delete()) {
				logger.debug("could not delete {}", file);
			}
		}
	}

	public static interface Message {
	}

	/**
	 * Indicates the verifier could not process the program at all.
	 */
	public static class FatalError implements Message {
		private final String message;

		public FatalError(String message) {
			this.message = message;
		}

		public String getMessage() {
			return message;
		}

		@Override
		public String toString() {
			return "fatal: " + message;
		}
	}

	public static class Error implements Message {
		private final int line;
		private final int column;
		private final String message;
		private final ViperFile.Item item;
		private final List<ViperFile.Item> lineItems;
		private final List<String> counterexample;

		public Error(int line, int col, String message, ViperFile.Item item, List<ViperFile.Item> lineItems,
				List<String> counterexample) {
			this.line = line;
			this.column = col;
			this.message = message;
			this.item = item;
			this.lineItems = ImmutableList.copyOf(lineItems);
			this.counterexample = ImmutableList.copyOf(counterexample);
		}

		/**
		 * Get the line number of this error.
		 *
		 * @return
		 */
		public int getLine() {
			return line;
		}

		/**
		 * Get the column number within the given line where this error occurs.
		 *
		 * @return
		 */
		public int getColumn() {
			return column;
		}

		/**
		 * Get the error message.
		 *
		 * @return
		 */
		public String getMessage() {
			return message;
		}

		/**
		 * Get the item at the position of this error message.
		 *
		 * @return The item, or <code>null</code> if the position is unknown.
		 */
		public ViperFile.Item getEnclosingItem() {
			return item;
		}

		/**
		 * Get every item printed on the line of this error, outermost first.
		 *
		 * @return
		 */
		public List<ViperFile.Item> getLineItems() {
			return lineItems;
		}

		/**
		 * Get the lines of the counterexample reported with this error (if any).
		 *
		 * @return
		 */
		public List<String> getCounterexample() {
			return counterexample;
		}

		@Override
		public String toString() {
			return Integer.toString(line) + ":" + column + ":" + message;
		}
	}

	/**
	 * Parse the output of the verifier into a useful form.
	 *
	 * @param output
	 * @param m
	 *            Mapping from positions in the program to the items printed
	 *            there.
	 * @return
	 */
	public static Message[] parseErrors(String output, MappablePrintWriter.Mapping<ViperFile.Item> m) {
		String[] lines = output.split("\n");
		ArrayList<Message> errors = new ArrayList<>();
		boolean finished = false;
		for (int i = 0; i < lines.length; ++i) {
			String ith = lines[i].trim(); // discards carriage returns
			Matcher matcher = ERROR_MATCH.matcher(ith);
			if (matcher.matches()) {
				int line = Integer.parseInt(matcher.group(4));
				int col = Integer.parseInt(matcher.group(5));
				String message = matcher.group(2);
				// Columns are reported from 1
				ViperFile.Item item = m.get(line, col - 1);
				// Gather any counterexample which follows
				ArrayList<String> model = new ArrayList<>();
				while (i + 1 < lines.length && !isStructural(lines[i + 1].trim())) {
					String cex = lines[++i].trim();
					if (!cex.isEmpty()) {
						model.add(cex);
					}
				}
				errors.add(new Error(line, col, message, item, m.getAll(line), model));
			} else if (SUCCESS_MATCH.matcher(ith).matches() || FOUND_MATCH.matcher(ith).matches()) {
				finished = true;
			} else if (FATAL_MATCH.matcher(ith).matches()) {
				errors.add(new FatalError(ith));
			}
		}
		if (!finished && errors.isEmpty()) {
			// If we don't do this, then we can end up silently losing errors!
			errors.add(new FatalError("unrecognised verifier output: '" + output.trim() + "'"));
		}
		return errors.toArray(new Message[errors.size()]);
	}

	private static boolean isStructural(String line) {
		return ERROR_MATCH.matcher(line).matches() || SUCCESS_MATCH.matcher(line).matches()
				|| FOUND_MATCH.matcher(line).matches();
	}

	/**
	 * Write a given program into a temporary file which can then be checked.
	 *
	 * @param contents
	 * @return
	 */
	private static File createTemporaryFile(String prefix, String suffix, byte[] contents) throws IOException {
		// Prefixes must be at least three characters long
		String p = (prefix + "___").replaceAll("[^A-Za-z0-9_]", "_");
		File f = File.createTempFile(p, suffix);
		Files.write(f.toPath(), contents);
		return f;
	}

	/**
	 * Drains the output of the child process so that it cannot block on a full
	 * pipe.
	 */
	private static class StreamReader extends Thread {
		private final InputStream input;
		private final ByteArrayOutputStream output = new ByteArrayOutputStream();

		public StreamReader(InputStream input) {
			this.input = input;
			setDaemon(true);
		}

		@Override
		public void run() {
			byte[] buffer = new byte[1024];
			try {
				int count;
				while ((count = input.read(buffer)) >= 0) {
					synchronized (output) {
						output.write(buffer, 0, count);
					}
				}
			} catch (IOException e) {
				logger.debug("verifier output closed: {}", e.getMessage());
			}
		}

		public byte[] getBytes() {
			synchronized (output) {
				return output.toByteArray();
			}
		}
	}
}
