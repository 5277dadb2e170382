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

import java.util.List;

/**
 * A simple visitor over all three kinds of abstract syntax tree. By default it
 * walks every statement, condition and expression, so subclasses only override
 * the nodes they are interested in.
 *
 * @author The LWG Project Developers
 */
public abstract class AbstractVisitor {

	public void visitProgram(Program program) {
		if (program instanceof LoopProgram) {
			visitLoopBlock(((LoopProgram) program).getStatements());
		} else if (program instanceof WhileProgram) {
			visitWhileBlock(((WhileProgram) program).getStatements());
		} else if (program instanceof GotoProgram) {
			for (GotoProgram.Instruction instr : ((GotoProgram) program).getInstructions()) {
				visitInstruction(instr);
			}
		} else {
			throw new IllegalArgumentException("unknown program kind: " + program);
		}
	}

	public void visitLoopBlock(List<LoopProgram.Stmt> block) {
		for (LoopProgram.Stmt stmt : block) {
			visitStatement(stmt);
		}
	}

	public void visitWhileBlock(List<WhileProgram.Stmt> block) {
		for (WhileProgram.Stmt stmt : block) {
			visitStatement(stmt);
		}
	}

	public void visitInstruction(GotoProgram.Instruction instr) {
		if (instr.hasLabel()) {
			visitLabel(instr.getLabel());
		}
		visitStatement(instr.getStatement());
	}

	public void visitStatement(SyntacticItem stmt) {
		switch (stmt.getOpcode()) {
		case SyntacticItem.STMT_assign:
			visitAssign((Assign) stmt);
			break;
		case SyntacticItem.STMT_loop:
			visitLoop((LoopProgram.Loop) stmt);
			break;
		case SyntacticItem.STMT_while:
			visitWhile((WhileProgram.While) stmt);
			break;
		case SyntacticItem.STMT_if:
			visitIf((WhileProgram.If) stmt);
			break;
		case SyntacticItem.STMT_goto:
			visitGoto((GotoProgram.Goto) stmt);
			break;
		case SyntacticItem.STMT_ifgoto:
			visitIfGoto((GotoProgram.IfGoto) stmt);
			break;
		case SyntacticItem.STMT_halt:
			break;
		default:
			throw new IllegalArgumentException("unknown statement encountered: " + stmt);
		}
	}

	public void visitAssign(Assign stmt) {
		visitVariableName(stmt.getVariable());
		visitExpression(stmt.getValue());
	}

	public void visitLoop(LoopProgram.Loop stmt) {
		visitVariableName(stmt.getVariable());
		visitLoopBlock(stmt.getBody());
	}

	public void visitWhile(WhileProgram.While stmt) {
		visitCondition(stmt.getCondition());
		visitWhileBlock(stmt.getBody());
	}

	public void visitIf(WhileProgram.If stmt) {
		visitCondition(stmt.getCondition());
		visitWhileBlock(stmt.getTrueBranch());
		visitWhileBlock(stmt.getFalseBranch());
	}

	public void visitGoto(GotoProgram.Goto stmt) {
		visitLabel(stmt.getTarget());
	}

	public void visitIfGoto(GotoProgram.IfGoto stmt) {
		visitCondition(stmt.getCondition());
		visitLabel(stmt.getTarget());
	}

	public void visitCondition(Condition cond) {
		visitExpression(cond.getLeftHandSide());
		visitExpression(cond.getRightHandSide());
	}

	public void visitExpression(Expr expr) {
		switch (expr.getOpcode()) {
		case SyntacticItem.EXPR_const:
			break;
		case SyntacticItem.EXPR_variable:
			visitVariableName(((Expr.VariableAccess) expr).getName());
			break;
		case SyntacticItem.EXPR_binop: {
			Expr.BinaryOperator b = (Expr.BinaryOperator) expr;
			visitExpression(b.getLeftHandSide());
			visitExpression(b.getRightHandSide());
			break;
		}
		default:
			throw new IllegalArgumentException("unknown expression encountered: " + expr);
		}
	}

	/** Called for every variable name, whether read or written. */
	public void visitVariableName(String name) {
	}

	/** Called for every label, whether defined or jumped to. */
	public void visitLabel(String label) {
	}
}
