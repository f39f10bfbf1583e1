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

import java.math.BigInteger;

/**
 * The fixed-width integer types of the source language. Pointer-sized types
 * are taken to be 64 bits wide.
 *
 * @author The Rust2Viper Project Developers
 */
public enum IntKind {
	I8("i8", 8, true),
	I16("i16", 16, true),
	I32("i32", 32, true),
	I64("i64", 64, true),
	I128("i128", 128, true),
	ISIZE("isize", 64, true),
	U8("u8", 8, false),
	U16("u16", 16, false),
	U32("u32", 32, false),
	U64("u64", 64, false),
	U128("u128", 128, false),
	USIZE("usize", 64, false);

	private final String name;
	private final int bits;
	private final boolean signed;

	private IntKind(String name, int bits, boolean signed) {
		this.name = name;
		this.bits = bits;
		this.signed = signed;
	}

	public String getName() {
		return name;
	}

	public int getBits() {
		return bits;
	}

	public boolean isSigned() {
		return signed;
	}

	/**
	 * The smallest value representable in this type.
	 *
	 * @return
	 */
	public BigInteger getMin() {
		return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
	}

	/**
	 * The largest value representable in this type.
	 *
	 * @return
	 */
	public BigInteger getMax() {
		int width = signed ? bits - 1 : bits;
		return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
	}

	@Override
	public String toString() {
		return name;
	}
}
