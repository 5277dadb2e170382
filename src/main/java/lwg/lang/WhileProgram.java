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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A WHILE program: a sequence of assignments, while loops and if statements.
 *
 * @author The LWG Project Developers
 */
public final class WhileProgram implements Program {

	/**
	 * A WHILE statement: an {@link Assign}, a {@link While} or an {@link If}.
	 */
	public interface Stmt extends SyntacticItem {
	}

	/**
	 * <code>WHILE c DO body END</code>. The condition is re-evaluated before
	 * every iteration, including the first.
	 */
	public static final class While implements Stmt {
		private final Condition condition;
		private final List<Stmt> body;

		public While(Condition condition, List<? extends Stmt> body) {
			this.condition = Objects.requireNonNull(condition);
			this.body = Collections.unmodifiableList(new ArrayList<>(body));
		}

		public Condition getCondition() {
			return this.condition;
		}

		public List<Stmt> getBody() {
			return this.body;
		}

		@Override
		public int getOpcode() {
			return STMT_while;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof While)) {
				return false;
			}
			While w = (While) o;
			return this.condition.equals(w.condition) && this.body.equals(w.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.condition, this.body);
		}

		@Override
		public String toString() {
			return "WHILE " + this.condition + " DO " + this.body + " END";
		}
	}

	/**
	 * <code>IF c THEN trueBranch [ELSE falseBranch] END</code>.
	 *
	 * An absent ELSE is kept distinct from an empty one, so that printing gives
	 * back what was parsed.
	 */
	public static final class If implements Stmt {
		private final Condition condition;
		private final List<Stmt> trueBranch;
		private final List<Stmt> falseBranch;

		public If(Condition condition, List<? extends Stmt> trueBranch) {
			this.condition = Objects.requireNonNull(condition);
			this.trueBranch = Collections.unmodifiableList(new ArrayList<>(trueBranch));
			this.falseBranch = null;
		}

		public If(Condition condition, List<? extends Stmt> trueBranch, List<? extends Stmt> falseBranch) {
			this.condition = Objects.requireNonNull(condition);
			this.trueBranch = Collections.unmodifiableList(new ArrayList<>(trueBranch));
			this.falseBranch = Collections.unmodifiableList(new ArrayList<>(falseBranch));
		}

		public Condition getCondition() {
			return this.condition;
		}

		public List<Stmt> getTrueBranch() {
			return this.trueBranch;
		}

		public boolean hasFalseBranch() {
			return this.falseBranch != null;
		}

		/**
		 * @return the ELSE branch, or an empty list if there is none.
		 */
		public List<Stmt> getFalseBranch() {
			return this.falseBranch == null ? Collections.emptyList() : this.falseBranch;
		}

		@Override
		public int getOpcode() {
			return STMT_if;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof If)) {
				return false;
			}
			If i = (If) o;
			return this.condition.equals(i.condition) && this.trueBranch.equals(i.trueBranch)
					&& Objects.equals(this.falseBranch, i.falseBranch);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.condition, this.trueBranch, this.falseBranch);
		}

		@Override
		public String toString() {
			String str = "IF " + this.condition + " THEN " + this.trueBranch;
			if (this.falseBranch != null) {
				str += " ELSE " + this.falseBranch;
			}
			return str + " END";
		}
	}

	private final List<Stmt> statements;

	public WhileProgram(List<? extends Stmt> statements) {
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public List<Stmt> getStatements() {
		return this.statements;
	}

	@Override
	public Language getLanguage() {
		return Language.WHILE;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof WhileProgram && ((WhileProgram) o).statements.equals(this.statements);
	}

	@Override
	public int hashCode() {
		return this.statements.hashCode();
	}

	@Override
	public String toString() {
		return this.statements.toString();
	}
}
