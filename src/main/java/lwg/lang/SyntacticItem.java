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

/**
 * A node of one of the abstract syntax trees. Every node reports an opcode, so
 * that interpreters, translators and printers can dispatch with a single
 * <code>switch</code> and fail loudly on anything they do not know.
 *
 * @author The LWG Project Developers
 */
public interface SyntacticItem {

	// Expressions
	int EXPR_const = 1;
	int EXPR_variable = 2;
	int EXPR_binop = 3;

	// Statements shared by all three languages
	int STMT_assign = 10;

	// LOOP
	int STMT_loop = 20;

	// WHILE
	int STMT_while = 30;
	int STMT_if = 31;

	// GOTO
	int STMT_goto = 40;
	int STMT_ifgoto = 41;
	int STMT_halt = 42;

	/**
	 * @return one of the opcode constants declared above.
	 */
	int getOpcode();
}
