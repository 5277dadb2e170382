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
package lwg.translate;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import lwg.lang.AbstractVisitor;
import lwg.lang.Program;

/**
 * Allocates variable and label names that are not used anywhere in a program.
 *
 * One allocator is created per translation and threaded through it, so every
 * name it hands out is distinct from the program's names and from each other.
 * Candidates come from a counter that only ever increases: variables are named
 * <code>x0, x1, ...</code> and labels <code>M1, M2, ...</code>, skipping any
 * that are taken, so the output still reads like a hand-written program.
 *
 * @author The LWG Project Developers
 */
public final class FreshNames {
	public static final String VARIABLE_PREFIX = "x";
	public static final String LABEL_PREFIX = "M";

	/** Every identifier in use, including those already allocated. */
	private final Set<String> used;

	private int nextVariable = 0;
	private int nextLabel = 1;

	/**
	 * @param used identifiers which must never be returned.
	 */
	public FreshNames(Collection<String> used) {
		this.used = new HashSet<>(used);
	}

	/**
	 * Create an allocator which avoids every identifier of a program (variables
	 * and labels, at any depth), plus some extra reserved names.
	 *
	 * @param program
	 * @param reserved can be empty.
	 */
	public static FreshNames forProgram(Program program, Collection<String> reserved) {
		final Set<String> names = namesOf(program);
		names.addAll(reserved);
		return new FreshNames(names);
	}

	/**
	 * Collect every variable name and label occurring in a program.
	 */
	public static Set<String> namesOf(Program program) {
		final Set<String> names = new HashSet<>();
		new AbstractVisitor() {
			@Override
			public void visitVariableName(String name) {
				names.add(name);
			}

			@Override
			public void visitLabel(String label) {
				names.add(label);
			}
		}.visitProgram(program);
		return names;
	}

	public String freshVariable() {
		String name;
		do {
			name = VARIABLE_PREFIX + this.nextVariable++;
		} while (this.used.contains(name));
		this.used.add(name);
		return name;
	}

	public String freshLabel() {
		String name;
		do {
			name = LABEL_PREFIX + this.nextLabel++;
		} while (this.used.contains(name));
		this.used.add(name);
		return name;
	}

	public boolean isUsed(String name) {
		return this.used.contains(name);
	}
}
