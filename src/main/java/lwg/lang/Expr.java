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
 * Natural-number expressions, shared by all three languages.
 *
 * The <code>toString()</code> form of an expression is valid source text: a
 * binary operand on the right of another binary operator is bracketed, since
 * both operators are left associative and monus is not associative.
 *
 * @author The LWG Project Developers
 */
public abstract class Expr implements SyntacticItem {

	public static Constant constant(long value) {
		return new Constant(BigInteger.valueOf(value));
	}

	public static VariableAccess variable(String name) {
		return new VariableAccess(name);
	}

	public static BinaryOperator add(Expr lhs, Expr rhs) {
		return new BinaryOperator(lhs, Operator.ADD, rhs);
	}

	public static BinaryOperator sub(Expr lhs, Expr rhs) {
		return new BinaryOperator(lhs, Operator.SUB, rhs);
	}

	public enum Operator {
		ADD("+"),
		SUB("-");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		/**
		 * Apply this operator over the naturals. Subtraction is monus, so it never
		 * goes below zero.
		 */
		public BigInteger apply(BigInteger lhs, BigInteger rhs) {
			switch (this) {
			case ADD:
				return lhs.add(rhs);
			case SUB:
				return lhs.compareTo(rhs) <= 0 ? BigInteger.ZERO : lhs.subtract(rhs);
			default:
				throw new IllegalStateException("unknown operator " + this.name());
			}
		}

		public static Operator fromSymbol(String symbol) {
			for (Operator op : values()) {
				if (op.symbol.equals(symbol)) {
					return op;
				}
			}
			throw new IllegalArgumentException("Unknown operator " + symbol);
		}

		@Override
		public String toString() {
			return this.symbol;
		}
	}

	/**
	 * A natural-number literal.
	 */
	public static final class Constant extends Expr {
		private final BigInteger value;

		public Constant(BigInteger value) {
			if (value.signum() < 0) {
				throw new IllegalArgumentException("negative constant " + value);
			}
			this.value = value;
		}

		public BigInteger getValue() {
			return this.value;
		}

		@Override
		public int getOpcode() {
			return EXPR_const;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Constant && ((Constant) o).value.equals(this.value);
		}

		@Override
		public int hashCode() {
			return this.value.hashCode();
		}

		@Override
		public String toString() {
			return this.value.toString();
		}
	}

	public static final class VariableAccess extends Expr {
		private final String name;

		public VariableAccess(String name) {
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return this.name;
		}

		@Override
		public int getOpcode() {
			return EXPR_variable;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof VariableAccess && ((VariableAccess) o).name.equals(this.name);
		}

		@Override
		public int hashCode() {
			return this.name.hashCode();
		}

		@Override
		public String toString() {
			return this.name;
		}
	}

	public static final class BinaryOperator extends Expr {
		private final Expr lhs;
		private final Operator op;
		private final Expr rhs;

		public BinaryOperator(Expr lhs, Operator op, Expr rhs) {
			this.lhs = Objects.requireNonNull(lhs);
			this.op = Objects.requireNonNull(op);
			this.rhs = Objects.requireNonNull(rhs);
		}

		public Expr getLeftHandSide() {
			return this.lhs;
		}

		public Operator getOperator() {
			return this.op;
		}

		public Expr getRightHandSide() {
			return this.rhs;
		}

		@Override
		public int getOpcode() {
			return EXPR_binop;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof BinaryOperator)) {
				return false;
			}
			BinaryOperator b = (BinaryOperator) o;
			return this.op == b.op && this.lhs.equals(b.lhs) && this.rhs.equals(b.rhs);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.lhs, this.op, this.rhs);
		}

		@Override
		public String toString() {
			String right = this.rhs.toString();
			if (this.rhs instanceof BinaryOperator) {
				right = "(" + right + ")";
			}
			return this.lhs + " " + this.op + " " + right;
		}
	}
}
