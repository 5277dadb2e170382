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
 * A LOOP program: a sequence of assignments and bounded loops.
 *
 * @author The LWG Project Developers
 */
public final class LoopProgram implements Program {

	/**
	 * A LOOP statement: either an {@link Assign} or a {@link Loop}.
	 */
	public interface Stmt extends SyntacticItem {
	}

	/**
	 * <code>LOOP x DO body END</code>. The number of iterations is the value of
	 * <code>x</code> on entry, and nothing the body does can change it.
	 */
	public static final class Loop implements Stmt {
		private final String variable;
		private final List<Stmt> body;

		public Loop(String variable, List<? extends Stmt> body) {
			this.variable = Objects.requireNonNull(variable);
			this.body = Collections.unmodifiableList(new ArrayList<>(body));
		}

		public String getVariable() {
			return this.variable;
		}

		public List<Stmt> getBody() {
			return this.body;
		}

		@Override
		public int getOpcode() {
			return STMT_loop;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Loop)) {
				return false;
			}
			Loop l = (Loop) o;
			return this.variable.equals(l.variable) && this.body.equals(l.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.variable, this.body);
		}

		@Override
		public String toString() {
			return "LOOP " + this.variable + " DO " + this.body + " END";
		}
	}

	private final List<Stmt> statements;

	public LoopProgram(List<? extends Stmt> statements) {
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public List<Stmt> getStatements() {
		return this.statements;
	}

	@Override
	public Language getLanguage() {
		return Language.LOOP;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof LoopProgram && ((LoopProgram) o).statements.equals(this.statements);
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
