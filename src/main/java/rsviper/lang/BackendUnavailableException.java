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

/**
 * Signals that the verification backend could not be started at all. Unlike
 * every other failure this one is fatal for the whole run.
 *
 * @author The Rust2Viper Project Developers
 */
public class BackendUnavailableException extends VerifierException {
	private static final long serialVersionUID = 1L;

	public BackendUnavailableException(String message, Throwable cause) {
		super(message, null, cause);
	}
}
