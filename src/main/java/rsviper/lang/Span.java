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
package rsviper.lang;

import java.util.Objects;

/**
 * Identifies a region of the original source program. Spans are attached by
 * the host compiler to statements and terminators, and by the specification
 * subsystem to clauses, and are ultimately what diagnostics point at.
 *
 * @author The Rust2Viper Project Developers
 */
public final class Span implements Comparable<Span> {
	/**
	 * Used for items which have no corresponding location in the source.
	 */
	public static final Span UNKNOWN = new Span("<unknown>", 0, 0);

	private final String file;
	private final int line;
	private final int column;

	public Span(String file, int line, int column) {
		if (file == null) {
			throw new IllegalArgumentException("invalid file");
		}
		this.file = file;
		this.line = line;
		this.column = column;
	}

	public String getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int compareTo(Span o) {
		int c = file.compareTo(o.file);
		if (c == 0) {
			c = Integer.compare(line, o.line);
		}
		if (c == 0) {
			c = Integer.compare(column, o.column);
		}
		return c;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Span) {
			Span s = (Span) o;
			return file.equals(s.file) && line == s.line && column == s.column;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, column);
	}

	@Override
	public String toString() {
		return file + ":" + line + ":" + column;
	}
}
