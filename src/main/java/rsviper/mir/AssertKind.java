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

/**
 * The reason a host compiler inserted an assertion terminator.
 *
 * @author The Rust2Viper Project Developers
 */
public enum AssertKind {
	BOUNDS_CHECK,
	OVERFLOW,
	DIVISION_BY_ZERO,
	REMAINDER_BY_ZERO,
	CUSTOM
}
