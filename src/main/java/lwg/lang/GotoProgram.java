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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A GOTO program: a flat sequence of optionally labelled instructions.
 *
 * Labels must be unique, and every jump must name a label of the program.
 * Neither rule is checked on construction; both are checked when the label
 * map is built (see {@link #getLabelMap()}) or a jump is resolved.
 *
 * @author The LWG Project Developers
 */
public final class GotoProgram implements Program {

	/**
	 * A GOTO statement: an {@link Assign}, {@link Goto}, {@link IfGoto} or {@link Halt}.
	 */
	public interface Stmt extends SyntacticItem {
	}

	/**
	 * A statement that may transfer control to a label.
	 */
	public interface Jump extends Stmt {
		String getTarget();
	}

	/** <code>GOTO L</code> */
	public static final class Goto implements Jump {
		private final String target;

		public Goto(String target) {
			this.target = Objects.requireNonNull(target);
		}

		@Override
		public String getTarget() {
			return this.target;
		}

		@Override
		public int getOpcode() {
			return STMT_goto;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Goto && ((Goto) o).target.equals(this.target);
		}

		@Override
		public int hashCode() {
			return this.target.hashCode();
		}

		@Override
		public String toString() {
			return "GOTO " + this.target;
		}
	}

	/** <code>IF c THEN GOTO L</code> */
	public static final class IfGoto implements Jump {
		private final Condition condition;
		private final String target;

		public IfGoto(Condition condition, String target) {
			this.condition = Objects.requireNonNull(condition);
			this.target = Objects.requireNonNull(target);
		}

		public Condition getCondition() {
			return this.condition;
		}

		@Override
		public String getTarget() {
			return this.target;
		}

		@Override
		public int getOpcode() {
			return STMT_ifgoto;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof IfGoto)) {
				return false;
			}
			IfGoto i = (IfGoto) o;
			return this.condition.equals(i.condition) && this.target.equals(i.target);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.condition, this.target);
		}

		@Override
		public String toString() {
			return "IF " + this.condition + " THEN GOTO " + this.target;
		}
	}

	/** <code>HALT</code> stops the program, whatever follows it. */
	public static final class Halt implements Stmt {

		@Override
		public int getOpcode() {
			return STMT_halt;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Halt;
		}

		@Override
		public int hashCode() {
			return STMT_halt;
		}

		@Override
		public String toString() {
			return "HALT";
		}
	}

	/**
	 * One line of a GOTO program: an optional label and a statement.
	 */
	public static final class Instruction implements SyntacticItem {
		private final String label;
		private final Stmt statement;

		public Instruction(Stmt statement) {
			this(null, statement);
		}

		/**
		 * @param label can be null if the instruction is unlabelled.
		 * @param statement
		 */
		public Instruction(String label, Stmt statement) {
			this.label = label;
			this.statement = Objects.requireNonNull(statement);
		}

		public boolean hasLabel() {
			return this.label != null;
		}

		/**
		 * @return the label, or null if there is none.
		 */
		public String getLabel() {
			return this.label;
		}

		public Stmt getStatement() {
			return this.statement;
		}

		@Override
		public int getOpcode() {
			return this.statement.getOpcode();
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Instruction)) {
				return false;
			}
			Instruction i = (Instruction) o;
			return Objects.equals(this.label, i.label) && this.statement.equals(i.statement);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.label, this.statement);
		}

		@Override
		public String toString() {
			return this.label == null ? this.statement.toString() : this.label + ": " + this.statement;
		}
	}

	private final List<Instruction> instructions;

	public GotoProgram(List<Instruction> instructions) {
		this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
	}

	public List<Instruction> getInstructions() {
		return this.instructions;
	}

	public int size() {
		return this.instructions.size();
	}

	/**
	 * Build a fresh map from each label to the index of the instruction it is on.
	 *
	 * @return a mutable map owned by the caller.
	 * @throws StructureError if a label is used twice.
	 */
	public Map<String, Integer> getLabelMap() {
		final Map<String, Integer> labels = new HashMap<>();
		for (int i = 0; i < this.instructions.size(); i++) {
			final Instruction instr = this.instructions.get(i);
			if (instr.hasLabel()) {
				if (labels.containsKey(instr.getLabel())) {
					throw new StructureError("Duplicate label: " + instr.getLabel(), instr);
				}
				labels.put(instr.getLabel(), i);
			}
		}
		return labels;
	}

	/**
	 * Find the index of the instruction a jump goes to.
	 *
	 * @param labels a map built by {@link #getLabelMap()}.
	 * @param jump
	 * @throws StructureError if the target label does not exist.
	 */
	public static int resolve(Map<String, Integer> labels, Jump jump) {
		final Integer index = labels.get(jump.getTarget());
		if (index == null) {
			throw new StructureError("Undefined label: " + jump.getTarget(), jump);
		}
		return index;
	}

	@Override
	public Language getLanguage() {
		return Language.GOTO;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof GotoProgram && ((GotoProgram) o).instructions.equals(this.instructions);
	}

	@Override
	public int hashCode() {
		return this.instructions.hashCode();
	}

	@Override
	public String toString() {
		return this.instructions.toString();
	}
}
