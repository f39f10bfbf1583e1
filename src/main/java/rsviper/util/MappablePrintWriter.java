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

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A print writer which remembers which tag produced each region of the text
 * written. This allows a position reported against the output (for example,
 * by a verifier) to be traced back to the item it came from.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	private final PrintWriter out;
	private final Mapping<T> mapping;
	private int index;

	public MappablePrintWriter(OutputStream os) {
		this(new PrintWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8)));
	}

	public MappablePrintWriter(PrintWriter writer) {
		this.out = writer;
		this.mapping = new Mapping<T>();
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	/**
	 * Print a string associated with a given tag.
	 *
	 * @param text
	 * @param tag
	 */
	public void print(String text, T tag) {
		out.print(text);
		mapping.put(tag, index, text.length());
		index += text.length();
	}

	/**
	 * Print a newline. Lines are always terminated with <code>\n</code>, so
	 * output does not depend on the platform.
	 */
	public void println() {
		out.print('\n');
		mapping.newLine();
		index = 0;
	}

	/**
	 * Print a string associated with a given tag, followed by a newline.
	 *
	 * @param text
	 * @param tag
	 */
	public void println(String text, T tag) {
		print(text, tag);
		println();
	}

	/**
	 * Print a given level of indentation.
	 *
	 * @param n
	 */
	public void tab(int n) {
		for (int i = 0; i != n; ++i) {
			out.print("  ");
			index += 2;
		}
	}

	/**
	 * Flushes the stream
	 */
	public void flush() {
		out.flush();
	}

	public void close() {
		out.close();
	}

	public static class Mapping<T> {
		private final ArrayList<ArrayList<Region<T>>> lines = new ArrayList<>();

		public Mapping() {
			newLine();
		}

		public void put(T tag, int start, int length) {
			int end = (start + length) - 1;
			ArrayList<Region<T>> line = lines.get(lines.size() - 1);
			line.add(new Region<>(tag, start, end));
		}

		public void newLine() {
			lines.add(new ArrayList<>());
		}

		/**
		 * Get the tag at a given position.
		 *
		 * @param line
		 *            Line number, starting from 1.
		 * @param col
		 *            Column index, starting from 0.
		 * @return The tag, or <code>null</code> if there is none.
		 */
		public T get(int line, int col) {
			// Account for line numbers which start from 1
			line = line - 1;
			//
			if (line < 0 || line >= lines.size()) {
				return null;
			} else {
				List<Region<T>> l = lines.get(line);
				for (int i = 0; i != l.size(); ++i) {
					Region<T> s = l.get(i);
					if (s.contains(col)) {
						return s.tag;
					}
				}
				return null;
			}
		}

		/**
		 * Get every tag on a given line, in the order they were printed.
		 *
		 * @param line
		 *            Line number, starting from 1.
		 * @return
		 */
		public List<T> getAll(int line) {
			ArrayList<T> r = new ArrayList<>();
			if (line >= 1 && line <= lines.size()) {
				for (Region<T> s : lines.get(line - 1)) {
					if (s.tag != null) {
						r.add(s.tag);
					}
				}
			}
			return r;
		}
	}

	/**
	 * Represents a given region of text.
	 */
	public static class Region<T> {
		private final T tag;
		private final int start;
		private final int end;

		public Region(T tag, int start, int end) {
			this.tag = tag;
			this.start = start;
			this.end = end;
		}

		public boolean contains(int col) {
			return start <= col && col <= end;
		}
	}
}
