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

import rsviper.core.ViperFile;

/**
 * A verification engine which accepts programs in the Viper intermediate
 * verification language.
 *
 * @author The Rust2Viper Project Developers
 */
public interface Backend {

	/**
	 * Check a given program.
	 *
	 * @param timeout
	 *            Time allowed (in milliseconds).
	 * @param id
	 *            Name used when reporting on this program.
	 * @param program
	 *            The program to check.
	 * @return The errors reported, which are empty if verification succeeded,
	 *         or <code>null</code> if the timeout was exceeded.
	 * @throws rsviper.lang.BackendUnavailableException
	 *             If the engine could not be started at all.
	 */
	public Viper.Message[] check(int timeout, String id, ViperFile program);
}
