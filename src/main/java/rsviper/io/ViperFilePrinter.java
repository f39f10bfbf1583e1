// Copyright 2024 The Rust2Viper Project Developers
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
package rsviper.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import rsviper.core.ViperFile;
import rsviper.core.ViperFile.Decl;
import rsviper.core.ViperFile.Expr;
import rsviper.core.ViperFile.Stmt;
import rsviper.core.ViperFile.Type;
import rsviper.util.MappablePrintWriter;

/**
 * Writes a {@link ViperFile} in the concrete syntax of Viper, recording which
 * item produced each region of the output.
 *
 * @author The Rust2Viper Project Developers
 */
public class ViperFilePrinter {
	private final MappablePrintWriter<ViperFile.Item> out;

	public ViperFilePrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<ViperFile.Item> getMapping() {
		return out.getMapping();
	}

	public void write(ViperFile file) {
		for(Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	private void writeDecl(int indent, Decl d) {
		if(d == null) {
			out.println();
		} else if(d instanceof Decl.Field) {
			writeField(indent, (Decl.Field) d);
		} else if(d instanceof Decl.Predicate) {
			writePredicate(indent, (Decl.Predicate) d);
		} else if(d instanceof Decl.Domain) {
			writeDomain(indent, (Decl.Domain) d);
		} else if(d instanceof Decl.Function) {
			writeFunction(indent, (Decl.Function) d);
		} else if(d instanceof Decl.Method) {
			writeMethod(indent, (Decl.Method) d);
		} else if(d instanceof Decl.LineComment) {
			writeLineComment(indent, (Decl.LineComment) d);
		} else if(d instanceof Decl.Sequence) {
			writeSequence(indent, (Decl.Sequence) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeField(int indent, Decl.Field d) {
		out.tab(indent);
		out.print("field ", d);
		out.print(d.getName(), d);
		out.print(": ", d);
		writeType(d.getType());
		out.println();
	}

	private void writePredicate(int indent, Decl.Predicate d) {
		out.tab(indent);
		out.print("predicate ", d);
		out.print(d.getName(), d);
		writeParameters(d.getParameters());
		if(d.getBody() != null) {
			out.print(" { ", d);
			writeExpression(d.getBody());
			out.print(" }", d);
		}
		out.println();
	}

	private void writeDomain(int indent, Decl.Domain d) {
		out.tab(indent);
		out.print("domain ", d);
		out.print(d.getName(), d);
		out.println(" {", d);
		for(Decl.DomainFunction f : d.getFunctions()) {
			out.tab(indent + 1);
			if(f.isUnique()) {
				out.print("unique ", f);
			}
			out.print("function ", f);
			out.print(f.getName(), f);
			writeParameters(f.getParameters());
			out.print(": ", f);
			writeType(f.getReturns());
			out.println();
		}
		for(Decl.Axiom a : d.getAxioms()) {
			out.tab(indent + 1);
			out.print("axiom ", a);
			out.print(a.getName(), a);
			out.print(" { ", a);
			writeExpression(a.getOperand());
			out.println(" }", a);
		}
		out.tab(indent);
		out.println("}", d);
	}

	private void writeFunction(int indent, Decl.Function d) {
		out.tab(indent);
		out.print("function ", d);
		out.print(d.getName(), d);
		writeParameters(d.getParameters());
		out.print(": ", d);
		writeType(d.getReturns());
		out.println();
		for(Expr e : d.getRequires()) {
			out.tab(indent + 1);
			out.print("requires ", e);
			writeExpression(e);
			out.println();
		}
		if(d.getBody() != null) {
			out.tab(indent);
			out.println("{", d);
			out.tab(indent + 1);
			writeExpression(d.getBody());
			out.println();
			out.tab(indent);
			out.println("}", d);
		}
	}

	private void writeMethod(int indent, Decl.Method d) {
		out.tab(indent);
		out.print("method ", d);
		out.print(d.getName(), d);
		writeParameters(d.getParameters());
		if(!d.getReturns().isEmpty()) {
			out.print(" returns ", d);
			writeParameters(d.getReturns());
		}
		out.println();
		for(Expr e : d.getRequires()) {
			out.tab(indent + 1);
			out.print("requires ", e);
			writeExpression(e);
			out.println();
		}
		for(Expr e : d.getEnsures()) {
			out.tab(indent + 1);
			out.print("ensures ", e);
			writeExpression(e);
			out.println();
		}
		if(d.getBody() != null) {
			out.tab(indent);
			out.println("{", d);
			writeStmt(indent + 1, d.getBody());
			out.tab(indent);
			out.println("}", d);
		}
	}

	private void writeLineComment(int indent, Decl.LineComment d) {
		out.tab(indent);
		out.println("// " + d.getMessage(), d);
	}

	private void writeSequence(int indent, Decl.Sequence s) {
		for(int i=0;i!=s.size();++i) {
			writeDecl(indent,s.get(i));
		}
	}

	private void writeParameters(List<Decl.Parameter> parameters) {
		out.print("(",null);
		for(int i=0;i!=parameters.size();++i) {
			Decl.Parameter ith = parameters.get(i);
			if(i != 0) {
				out.print(", ",ith);
			}
			out.print(ith.getName(), ith);
			out.print(": ", ith);
			writeType(ith.getType());
		}
		out.print(")",null);
	}

	private void writeStmt(int indent, Stmt s) {
		if(s instanceof Stmt.Inhale) {
			writeInhale(indent, (Stmt.Inhale) s);
		} else if(s instanceof Stmt.Exhale) {
			writeExhale(indent, (Stmt.Exhale) s);
		} else if(s instanceof Stmt.Fold) {
			writeFold(indent, (Stmt.Fold) s);
		} else if(s instanceof Stmt.Unfold) {
			writeUnfold(indent, (Stmt.Unfold) s);
		} else if(s instanceof Stmt.Assert) {
			writeAssert(indent, (Stmt.Assert) s);
		} else if(s instanceof Stmt.Assignment) {
			writeAssignment(indent, (Stmt.Assignment) s);
		} else if(s instanceof Stmt.VariableDeclaration) {
			writeVariableDeclaration(indent, (Stmt.VariableDeclaration) s);
		} else if(s instanceof Stmt.Goto) {
			writeGoto(indent, (Stmt.Goto) s);
		} else if(s instanceof Stmt.Label) {
			writeLabel(indent, (Stmt.Label) s);
		} else if(s instanceof Stmt.IfElse) {
			writeIfElse(indent, (Stmt.IfElse) s);
		} else if(s instanceof Stmt.Comment) {
			writeComment(indent, (Stmt.Comment) s);
		} else if(s instanceof Stmt.Sequence) {
			writeSequence(indent, (Stmt.Sequence) s);
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeInhale(int indent, Stmt.Inhale s) {
		out.tab(indent);
		out.print("inhale ", s);
		writeExpression(s.getOperand());
		out.println();
	}

	private void writeExhale(int indent, Stmt.Exhale s) {
		out.tab(indent);
		out.print("exhale ", s);
		writeExpression(s.getOperand());
		out.println();
	}

	private void writeFold(int indent, Stmt.Fold s) {
		out.tab(indent);
		out.print("fold ", s);
		writeExpression(s.getOperand());
		out.println();
	}

	private void writeUnfold(int indent, Stmt.Unfold s) {
		out.tab(indent);
		out.print("unfold ", s);
		writeExpression(s.getOperand());
		out.println();
	}

	private void writeAssert(int indent, Stmt.Assert s) {
		out.tab(indent);
		out.print("assert ", s);
		writeExpression(s.getCondition());
		out.println();
	}

	private void writeAssignment(int indent, Stmt.Assignment s) {
		out.tab(indent);
		writeExpression(s.getLeftHandSide());
		out.print(" := ", s);
		writeExpression(s.getRightHandSide());
		out.println();
	}

	private void writeVariableDeclaration(int indent, Stmt.VariableDeclaration s) {
		out.tab(indent);
		out.print("var ", s);
		out.print(s.getName(), s);
		out.print(": ", s);
		writeType(s.getType());
		out.println();
	}

	private void writeGoto(int indent, Stmt.Goto s) {
		out.tab(indent);
		out.print("goto ", s);
		out.println(s.getLabel(), s);
	}

	private void writeLabel(int indent, Stmt.Label s) {
		out.tab(indent);
		out.print("label ", s);
		out.println(s.getLabel(), s);
	}

	private void writeIfElse(int indent, Stmt.IfElse s) {
		out.tab(indent);
		out.print("if (", s);
		writeExpression(s.getCondition());
		out.println(") {",s);
		writeStmt(indent + 1, s.getTrueBranch());
		if(s.getFalseBranch() != null) {
			out.tab(indent);out.println("} else {",s);
			writeStmt(indent + 1, s.getFalseBranch());
		}
		out.tab(indent);out.println("}",s);
	}

	private void writeComment(int indent, Stmt.Comment s) {
		out.tab(indent);
		out.println("// " + s.getMessage(), s);
	}

	private void writeSequence(int indent, Stmt.Sequence s) {
		for(int i=0;i!=s.size();++i) {
			writeStmt(indent,s.get(i));
		}
	}

	private void writeExpressionWithBraces(Expr e) {
		boolean negative = e instanceof Expr.Integer && ((Expr.Integer) e).getValue().signum() < 0;
		if (e instanceof Expr.UnaryOperator || e instanceof Expr.BinaryOperator || e instanceof Expr.NaryOperator
				|| negative) {
			out.print("(",e);
			writeExpression(e);
			out.print(")",e);
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if(e instanceof Expr.Equals) {
			writeInfix(" == ", (Expr.Equals) e);
		} else if(e instanceof Expr.NotEquals) {
			writeInfix(" != ", (Expr.NotEquals) e);
		} else if(e instanceof Expr.Iff) {
			writeInfix(" <==> ", (Expr.Iff) e);
		} else if(e instanceof Expr.Implies) {
			writeInfix(" ==> ", (Expr.Implies) e);
		} else if(e instanceof Expr.LessThan) {
			writeInfix(" < ", (Expr.LessThan) e);
		} else if(e instanceof Expr.LessThanOrEqual) {
			writeInfix(" <= ", (Expr.LessThanOrEqual) e);
		} else if(e instanceof Expr.GreaterThan) {
			writeInfix(" > ", (Expr.GreaterThan) e);
		} else if(e instanceof Expr.GreaterThanOrEqual) {
			writeInfix(" >= ", (Expr.GreaterThanOrEqual) e);
		} else if(e instanceof Expr.Addition) {
			writeInfix(" + ", (Expr.Addition) e);
		} else if(e instanceof Expr.Subtraction) {
			writeInfix(" - ", (Expr.Subtraction) e);
		} else if(e instanceof Expr.Multiplication) {
			writeInfix(" * ", (Expr.Multiplication) e);
		} else if(e instanceof Expr.IntegerDivision) {
			writeInfix(" \\ ", (Expr.IntegerDivision) e);
		} else if(e instanceof Expr.Remainder) {
			writeInfix(" % ", (Expr.Remainder) e);
		} else if(e instanceof Expr.Boolean) {
			writeBoolean((Expr.Boolean) e);
		} else if(e instanceof Expr.Integer) {
			writeInteger((Expr.Integer) e);
		} else if(e instanceof Expr.LogicalAnd) {
			writeAnd((Expr.LogicalAnd) e);
		} else if(e instanceof Expr.LogicalOr) {
			writeOr((Expr.LogicalOr) e);
		} else if(e instanceof Expr.Quantifier) {
			writeQuantifier((Expr.Quantifier) e);
		} else if(e instanceof Expr.Invoke) {
			writeInvoke((Expr.Invoke) e);
		} else if(e instanceof Expr.LogicalNot) {
			writeLogicalNot((Expr.LogicalNot) e);
		} else if(e instanceof Expr.Old) {
			writeOld((Expr.Old) e);
		} else if(e instanceof Expr.Negation) {
			writeNegation((Expr.Negation) e);
		} else if(e instanceof Expr.VariableAccess) {
			writeVariableAccess((Expr.VariableAccess) e);
		} else if(e instanceof Expr.FieldAccess) {
			writeFieldAccess((Expr.FieldAccess) e);
		} else if(e instanceof Expr.FieldAccessPredicate) {
			writeFieldAccessPredicate((Expr.FieldAccessPredicate) e);
		} else if(e instanceof Expr.PredicateAccessPredicate) {
			writePredicateAccessPredicate((Expr.PredicateAccessPredicate) e);
		} else if(e instanceof Expr.PermissionLiteral) {
			out.print(((Expr.PermissionLiteral) e).getText(), e);
		} else if(e instanceof Expr.CurrentPermission) {
			writeCurrentPermission((Expr.CurrentPermission) e);
		} else if(e instanceof Expr.Conditional) {
			writeConditional((Expr.Conditional) e);
		} else if(e instanceof Expr.SequenceLength) {
			writeSequenceLength((Expr.SequenceLength) e);
		} else if(e instanceof Expr.SequenceIndex) {
			writeSequenceIndex((Expr.SequenceIndex) e);
		} else if(e instanceof Expr.SequenceUpdate) {
			writeSequenceUpdate((Expr.SequenceUpdate) e);
		} else if(e instanceof Expr.SequenceLiteral) {
			writeSequenceLiteral((Expr.SequenceLiteral) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private <T extends Expr & Expr.BinaryOperator> void writeInfix(String operator, T e) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator,e);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeBoolean(Expr.Boolean e) {
		out.print(Boolean.toString(e.getValue()),e);
	}

	private void writeInteger(Expr.Integer e) {
		out.print(e.getValue().toString(),e);
	}

	private void writeAnd(Expr.LogicalAnd e) {
		List<Expr.Logical> operands = e.getOperands();
		//
		for(int i=0;i!=operands.size();++i) {
			if(i != 0) {
				out.print(" && ",e);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeOr(Expr.LogicalOr e) {
		List<Expr.Logical> operands = e.getOperands();
		//
		for(int i=0;i!=operands.size();++i) {
			if(i != 0) {
				out.print(" || ",e);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeInvoke(Expr.Invoke e) {
		out.print(e.getName(),e);
		out.print("(",e);
		writeArguments(e.getArguments(), e);
		out.print(")",e);
	}

	private void writeArguments(List<Expr> arguments, Expr e) {
		boolean firstTime = true;
		for(Expr a : arguments) {
			if(!firstTime) {
				out.print(", ",e);
			}
			firstTime = false;
			writeExpression(a);
		}
	}

	private void writeQuantifier(Expr.Quantifier e) {
		out.print("(", e);
		List<Decl.Parameter> params = e.getParameters();
		if (e instanceof Expr.UniversalQuantifier) {
			out.print("forall ", e);
		} else {
			out.print("exists ", e);
		}
		for (int i = 0; i != params.size(); ++i) {
			Decl.Parameter ith = params.get(i);
			if (i != 0) {
				out.print(", ", ith);
			}
			out.print(ith.getName(), ith);
			out.print(": ", ith);
			writeType(ith.getType());
		}
		out.print(" :: ", e);
		writeExpression(e.getBody());
		out.print(")", e);
	}

	private void writeOld(Expr.Old e) {
		if(e.getLabel() == null) {
			out.print("old(",e);
		} else {
			out.print("old[" + e.getLabel() + "](",e);
		}
		writeExpression(e.getOperand());
		out.print(")",e);
	}

	private void writeNegation(Expr.Negation e) {
		out.print("-",e);
		writeExpressionWithBraces(e.getOperand());
	}

	private void writeLogicalNot(Expr.LogicalNot e) {
		out.print("!",e);
		writeExpressionWithBraces(e.getOperand());
	}

	private void writeVariableAccess(Expr.VariableAccess e) {
		out.print(e.getVariable(),e);
	}

	private void writeFieldAccess(Expr.FieldAccess e) {
		writeExpressionWithBraces(e.getReceiver());
		out.print(".",e);
		out.print(e.getField(),e);
	}

	private void writeFieldAccessPredicate(Expr.FieldAccessPredicate e) {
		out.print("acc(",e);
		writeExpression(e.getLocation());
		out.print(", ",e);
		writeExpression(e.getAmount());
		out.print(")",e);
	}

	private void writePredicateAccessPredicate(Expr.PredicateAccessPredicate e) {
		out.print("acc(",e);
		out.print(e.getPredicate(),e);
		out.print("(",e);
		writeArguments(e.getArguments(), e);
		out.print("), ",e);
		writeExpression(e.getAmount());
		out.print(")",e);
	}

	private void writeCurrentPermission(Expr.CurrentPermission e) {
		out.print("perm(",e);
		writeExpression(e.getLocation());
		out.print(")",e);
	}

	private void writeConditional(Expr.Conditional e) {
		out.print("(",e);
		writeExpressionWithBraces(e.getCondition());
		out.print(" ? ",e);
		writeExpressionWithBraces(e.getTrueBranch());
		out.print(" : ",e);
		writeExpressionWithBraces(e.getFalseBranch());
		out.print(")",e);
	}

	private void writeSequenceLength(Expr.SequenceLength e) {
		out.print("|",e);
		writeExpression(e.getOperand());
		out.print("|",e);
	}

	private void writeSequenceIndex(Expr.SequenceIndex e) {
		writeExpressionWithBraces(e.getSource());
		out.print("[",e);
		writeExpression(e.getIndex());
		out.print("]",e);
	}

	private void writeSequenceUpdate(Expr.SequenceUpdate e) {
		writeExpressionWithBraces(e.getSource());
		out.print("[",e);
		writeExpression(e.getIndex());
		out.print(" := ",e);
		writeExpression(e.getValue());
		out.print("]",e);
	}

	private void writeSequenceLiteral(Expr.SequenceLiteral e) {
		if(e.getElements().isEmpty()) {
			out.print("Seq[",e);
			writeType(e.getElementType());
			out.print("]()",e);
		} else {
			out.print("Seq(",e);
			writeArguments(e.getElements(), e);
			out.print(")",e);
		}
	}

	private void writeType(Type t) {
		if(t instanceof Type.Bool) {
			out.print("Bool",t);
		} else if(t instanceof Type.Int) {
			out.print("Int",t);
		} else if(t instanceof Type.Ref) {
			out.print("Ref",t);
		} else if(t instanceof Type.Perm) {
			out.print("Perm",t);
		} else if(t instanceof Type.Sequence) {
			out.print("Seq[",t);
			writeType(((Type.Sequence) t).getElement());
			out.print("]",t);
		} else if(t instanceof Type.Domain) {
			out.print(((Type.Domain) t).getName(),t);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	public static String toString(ViperFile.Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ViperFilePrinter p = new ViperFilePrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	public static String toString(ViperFile file) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ViperFilePrinter p = new ViperFilePrinter(buf);
		p.write(file);
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}
