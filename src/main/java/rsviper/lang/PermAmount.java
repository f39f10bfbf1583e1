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

import com.google.common.math.LongMath;

/**
 * An exact fractional permission amount. Full (exclusive) access is
 * {@link #WRITE}; shared borrows split an amount in half, and expiring them
 * adds the halves back together. Amounts are always kept in lowest terms.
 *
 * @author The Rust2Viper Project Developers
 */
public final class PermAmount implements Comparable<PermAmount> {
	public static final PermAmount NONE = new PermAmount(0, 1);
	public static final PermAmount WRITE = new PermAmount(1, 1);
	public static final PermAmount HALF = new PermAmount(1, 2);

	private final long numerator;
	private final long denominator;

	private PermAmount(long numerator, long denominator) {
		this.numerator = numerator;
		this.denominator = denominator;
	}

	public static PermAmount of(long numerator, long denominator) {
		if (denominator <= 0 || numerator < 0) {
			throw new IllegalArgumentException("invalid permission amount " + numerator + "/" + denominator);
		}
		long g = LongMath.gcd(numerator, denominator);
		if (g == 0) {
			return NONE;
		}
		return new PermAmount(numerator / g, denominator / g);
	}

	public long getNumerator() {
		return numerator;
	}

	public long getDenominator() {
		return denominator;
	}

	public boolean isWrite() {
		return numerator == denominator;
	}

	public boolean isNone() {
		return numerator == 0;
	}

	public PermAmount half() {
		return of(numerator, LongMath.checkedMultiply(denominator, 2));
	}

	public PermAmount add(PermAmount o) {
		long d = LongMath.checkedMultiply(denominator, o.denominator);
		long n = LongMath.checkedAdd(LongMath.checkedMultiply(numerator, o.denominator),
				LongMath.checkedMultiply(o.numerator, denominator));
		return of(n, d);
	}

	/**
	 * Subtract a given amount from this amount, which must be at least as
	 * large.
	 *
	 * @param o
	 * @return
	 */
	public PermAmount subtract(PermAmount o) {
		if (compareTo(o) < 0) {
			throw new IllegalArgumentException("cannot subtract " + o + " from " + this);
		}
		long d = LongMath.checkedMultiply(denominator, o.denominator);
		long n = LongMath.checkedMultiply(numerator, o.denominator) - LongMath.checkedMultiply(o.numerator, denominator);
		return of(n, d);
	}

	public static PermAmount min(PermAmount a, PermAmount b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	@Override
	public int compareTo(PermAmount o) {
		return Long.compare(LongMath.checkedMultiply(numerator, o.denominator),
				LongMath.checkedMultiply(o.numerator, denominator));
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof PermAmount) {
			PermAmount p = (PermAmount) o;
			return numerator == p.numerator && denominator == p.denominator;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(numerator) * 31 + Long.hashCode(denominator);
	}

	/**
	 * Render this amount as it appears in the generated program, i.e.
	 * <code>write</code>, <code>none</code> or a fraction such as
	 * <code>1/2</code>.
	 */
	@Override
	public String toString() {
		if (isWrite()) {
			return "write";
		} else if (isNone()) {
			return "none";
		} else {
			return numerator + "/" + denominator;
		}
	}
}
