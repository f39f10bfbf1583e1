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
 * The outcome of a single proof obligation. An inconclusive verdict is never a
 * disproof: it only says that the backend could not decide.
 *
 * @author The Rust2Viper Project Developers
 */
public abstract class Verdict {

	public enum Kind {
		VERIFIED,
		FAILED,
		INCONCLUSIVE
	}

	public enum Reason {
		TIMEOUT,
		UNSUPPORTED_CONSTRUCT,
		BACKEND_ERROR
	}

	public static final Verified VERIFIED = new Verified();

	private Verdict() {
	}

	public abstract Kind getKind();

	public static Failed FAILED(String counterexample) {
		return new Failed(counterexample);
	}

	public static Inconclusive INCONCLUSIVE(Reason reason) {
		return new Inconclusive(reason);
	}

	public static final class Verified extends Verdict {
		private Verified() {
		}

		@Override
		public Kind getKind() {
			return Kind.VERIFIED;
		}

		@Override
		public String toString() {
			return "Verified";
		}
	}

	public static final class Failed extends Verdict {
		private final String counterexample;

		private Failed(String counterexample) {
			this.counterexample = counterexample == null ? "" : counterexample;
		}

		/**
		 * A summary of the counterexample reported by the backend (which may be
		 * empty).
		 *
		 * @return
		 */
		public String getCounterexample() {
			return counterexample;
		}

		@Override
		public Kind getKind() {
			return Kind.FAILED;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Failed && ((Failed) o).counterexample.equals(counterexample);
		}

		@Override
		public int hashCode() {
			return counterexample.hashCode();
		}

		@Override
		public String toString() {
			return counterexample.isEmpty() ? "Failed" : "Failed(" + counterexample + ")";
		}
	}

	public static final class Inconclusive extends Verdict {
		private final Reason reason;

		private Inconclusive(Reason reason) {
			this.reason = Objects.requireNonNull(reason);
		}

		public Reason getReason() {
			return reason;
		}

		@Override
		public Kind getKind() {
			return Kind.INCONCLUSIVE;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Inconclusive && ((Inconclusive) o).reason == reason;
		}

		@Override
		public int hashCode() {
			return reason.hashCode();
		}

		@Override
		public String toString() {
			return "Inconclusive(" + reason.name().toLowerCase() + ")";
		}
	}
}
