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
package rsviper.mir;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

public final class BasicBlock {
	private final int id;
	private final ImmutableList<Statement> statements;
	private final Terminator terminator;

	public BasicBlock(int id, List<Statement> statements, Terminator terminator) {
		this.id = id;
		this.statements = ImmutableList.copyOf(statements);
		this.terminator = Objects.requireNonNull(terminator);
	}

	public int getId() {
		return id;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public Terminator getTerminator() {
		return terminator;
	}

	@Override
	public String toString() {
		return "bb" + id + statements + " " + terminator;
	}
}
