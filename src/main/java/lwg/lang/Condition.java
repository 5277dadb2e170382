// Copyright 2026 The LWG Project Developers
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
package lwg.lang;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A comparison of two expressions, as used by WHILE and IF statements, and by
 * the conditional jump of GOTO programs.
 *
 * There is no boolean type, so negation is done by swapping the comparison
 * operator (see {@link #negate()}).
 *
 * @author The LWG Project Developers
 */
public final class Condition {

	public enum Comparator {
		EQ("="),
		NEQ("!="),
		LT("<"),
		GT(">"),
		LTEQ("<="),
		GTEQ(">=");

		private final String symbol;

		Comparator(String symbol) {
			this.symbol = symbol;
		}

		/**
		 * @return the comparator that holds exactly when this one does not.
		 */
		public Comparator negate() {
			switch (this) {
			case EQ: return NEQ;
			case NEQ: return EQ;
			case LT: return GTEQ;
			case GTEQ: return LT;
			case GT: return LTEQ;
			case LTEQ: return GT;
			default: throw new IllegalStateException("unknown comparator " + this.name());
			}
		}

		public boolean test(BigInteger lhs, BigInteger rhs) {
			final int c = lhs.compareTo(rhs);
			switch (this) {
			case EQ: return c == 0;
			case NEQ: return c != 0;
			case LT: return c < 0;
			case GT: return c > 0;
			case LTEQ: return c <= 0;
			case GTEQ: return c >= 0;
			default: throw new IllegalStateException("unknown comparator " + this.name());
			}
		}

		public static Comparator fromSymbol(String symbol) {
			for (Comparator cmp : values()) {
				if (cmp.symbol.equals(symbol)) {
					return cmp;
				}
			}
			throw new IllegalArgumentException("Unknown comparator " + symbol);
		}

		@Override
		public String toString() {
			return this.symbol;
		}
	}

	private final Expr lhs;
	private final Comparator comparator;
	private final Expr rhs;

	public Condition(Expr lhs, Comparator comparator, Expr rhs) {
		this.lhs = Objects.requireNonNull(lhs);
		this.comparator = Objects.requireNonNull(comparator);
		this.rhs = Objects.requireNonNull(rhs);
	}

	public Expr getLeftHandSide() {
		return this.lhs;
	}

	public Comparator getComparator() {
		return this.comparator;
	}

	public Expr getRightHandSide() {
		return this.rhs;
	}

	/**
	 * @return a new condition over the same operands with the opposite comparator.
	 */
	public Condition negate() {
		return new Condition(this.lhs, this.comparator.negate(), this.rhs);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Condition)) {
			return false;
		}
		Condition c = (Condition) o;
		return this.comparator == c.comparator && this.lhs.equals(c.lhs) && this.rhs.equals(c.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.lhs, this.comparator, this.rhs);
	}

	@Override
	public String toString() {
		return this.lhs + " " + this.comparator + " " + this.rhs;
	}
}
