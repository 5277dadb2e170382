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

import java.util.Objects;

/**
 * An assignment <code>x := e</code>. It is the one statement all three
 * languages share, so it is a statement of each of them.
 *
 * @author The LWG Project Developers
 */
public final class Assign implements LoopProgram.Stmt, WhileProgram.Stmt, GotoProgram.Stmt {
	private final String variable;
	private final Expr value;

	public Assign(String variable, Expr value) {
		this.variable = Objects.requireNonNull(variable);
		this.value = Objects.requireNonNull(value);
	}

	public String getVariable() {
		return this.variable;
	}

	public Expr getValue() {
		return this.value;
	}

	@Override
	public int getOpcode() {
		return STMT_assign;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Assign)) {
			return false;
		}
		Assign a = (Assign) o;
		return this.variable.equals(a.variable) && this.value.equals(a.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.variable, this.value);
	}

	@Override
	public String toString() {
		return this.variable + " := " + this.value;
	}
}
