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
package lwg.io;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import lwg.lang.Assign;
import lwg.lang.GotoProgram;
import lwg.lang.LoopProgram;
import lwg.lang.Program;
import lwg.lang.SyntacticItem;
import lwg.lang.WhileProgram;

/**
 * Writes programs back out as source text that the parsers accept.
 *
 * Block bodies are indented by two spaces per level. GOTO instructions are
 * written one per line, with the label (if any) at the start of the line and
 * unlabelled instructions indented to line up.
 *
 * @author The LWG Project Developers
 */
public class ProgramPrinter {
	private static final String INDENT = "  ";
	private static final String NO_LABEL = "    ";

	/** Where the program text is written. */
	protected final PrintWriter out;

	public ProgramPrinter(PrintWriter writer) {
		this.out = writer;
	}

	public ProgramPrinter(OutputStream stream) {
		this(new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
	}

	/**
	 * @return the source text of a program, one line per statement.
	 */
	public static String toText(Program program) {
		final StringWriter text = new StringWriter();
		final ProgramPrinter printer = new ProgramPrinter(new PrintWriter(text));
		printer.print(program);
		printer.out.flush();
		return text.toString();
	}

	public void print(Program program) {
		if (program instanceof LoopProgram) {
			writeLoopBlock(0, ((LoopProgram) program).getStatements());
		} else if (program instanceof WhileProgram) {
			writeWhileBlock(0, ((WhileProgram) program).getStatements());
		} else if (program instanceof GotoProgram) {
			for (GotoProgram.Instruction instr : ((GotoProgram) program).getInstructions()) {
				writeInstruction(instr);
			}
		} else {
			throw new IllegalArgumentException("unknown program kind: " + program);
		}
		this.out.flush();
	}

	private void writeLoopBlock(int indent, List<LoopProgram.Stmt> block) {
		for (LoopProgram.Stmt stmt : block) {
			tabIndent(indent);
			switch (stmt.getOpcode()) {
			case SyntacticItem.STMT_assign:
				writeAssign((Assign) stmt);
				break;
			case SyntacticItem.STMT_loop: {
				final LoopProgram.Loop loop = (LoopProgram.Loop) stmt;
				this.out.printf("LOOP %s DO\n", loop.getVariable());
				writeLoopBlock(indent + 1, loop.getBody());
				tabIndent(indent);
				this.out.print("END\n");
				break;
			}
			default:
				throw new IllegalArgumentException("unknown LOOP statement encountered: " + stmt);
			}
		}
	}

	private void writeWhileBlock(int indent, List<WhileProgram.Stmt> block) {
		for (WhileProgram.Stmt stmt : block) {
			tabIndent(indent);
			switch (stmt.getOpcode()) {
			case SyntacticItem.STMT_assign:
				writeAssign((Assign) stmt);
				break;
			case SyntacticItem.STMT_while: {
				final WhileProgram.While w = (WhileProgram.While) stmt;
				this.out.printf("WHILE %s DO\n", w.getCondition());
				writeWhileBlock(indent + 1, w.getBody());
				tabIndent(indent);
				this.out.print("END\n");
				break;
			}
			case SyntacticItem.STMT_if: {
				final WhileProgram.If i = (WhileProgram.If) stmt;
				this.out.printf("IF %s THEN\n", i.getCondition());
				writeWhileBlock(indent + 1, i.getTrueBranch());
				if (i.hasFalseBranch()) {
					tabIndent(indent);
					this.out.print("ELSE\n");
					writeWhileBlock(indent + 1, i.getFalseBranch());
				}
				tabIndent(indent);
				this.out.print("END\n");
				break;
			}
			default:
				throw new IllegalArgumentException("unknown WHILE statement encountered: " + stmt);
			}
		}
	}

	private void writeInstruction(GotoProgram.Instruction instr) {
		this.out.print(instr.hasLabel() ? instr.getLabel() + ": " : NO_LABEL);
		final GotoProgram.Stmt stmt = instr.getStatement();
		switch (stmt.getOpcode()) {
		case SyntacticItem.STMT_assign:
			writeAssign((Assign) stmt);
			break;
		case SyntacticItem.STMT_goto:
		case SyntacticItem.STMT_ifgoto:
		case SyntacticItem.STMT_halt:
			this.out.printf("%s;\n", stmt);
			break;
		default:
			throw new IllegalArgumentException("unknown GOTO statement encountered: " + stmt);
		}
	}

	private void writeAssign(Assign stmt) {
		this.out.printf("%s := %s;\n", stmt.getVariable(), stmt.getValue());
	}

	private void tabIndent(int indent) {
		this.out.print(createIndent(indent));
	}

	/** Returns an indent of the requested number of levels. */
	protected String createIndent(int indent) {
		return indent <= 0 ? "" : INDENT.repeat(indent);
	}
}
