// Copyright 2020 The Whiley Project Developers
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
package virfold.io;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

import virfold.core.VirFile;
import virfold.core.VirFile.ContainerOpKind;
import virfold.core.VirFile.Decl;
import virfold.core.VirFile.Expr;
import virfold.core.VirFile.Stmt;
import virfold.core.VirFile.Type;

/**
 * Write a VIR program in a Viper-like concrete syntax. This is primarily used
 * to render constructs in diagnostics and log messages.
 */
public class VirFilePrinter {
	private final PrintWriter out;

	public VirFilePrinter(OutputStream output) {
		this.out = new PrintWriter(output);
	}

	public VirFilePrinter(Writer output) {
		this.out = new PrintWriter(output);
	}

	public void flush() {
		out.flush();
	}

	public void write(VirFile file) {
		for(Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	private void writeDecl(int indent, Decl d) {
		if(d instanceof Decl.StructPredicate) {
			writeStructPredicate(indent, (Decl.StructPredicate) d);
		} else if(d instanceof Decl.EnumPredicate) {
			writeEnumPredicate(indent, (Decl.EnumPredicate) d);
		} else if(d instanceof Decl.Method) {
			writeMethod(indent, (Decl.Method) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeStructPredicate(int indent, Decl.StructPredicate d) {
		tab(indent);
		out.print("predicate ");
		out.print(d.getName());
		out.print("(");
		writeVariable(d.getSelf());
		out.print(")");
		if(d.isAbstract()) {
			out.println();
		} else {
			out.println(" {");
			tab(indent + 1);
			writeExpression(d.getBody());
			out.println();
			tab(indent);
			out.println("}");
		}
	}

	private void writeEnumPredicate(int indent, Decl.EnumPredicate d) {
		tab(indent);
		out.print("predicate ");
		out.print(d.getName());
		out.print("(");
		writeVariable(d.getSelf());
		out.println(") {");
		tab(indent + 1);
		out.print("acc(");
		out.print(d.getSelf().getName());
		out.print(".");
		out.print(d.getDiscriminantField().getName());
		out.println(", write)");
		for (Decl.EnumVariant v : d.getVariants()) {
			tab(indent + 1);
			out.print("variant ");
			out.print(v.getName());
			out.print(" if ");
			writeExpression(v.getGuard());
			out.print(": ");
			out.println(v.getPredicate().getName());
		}
		tab(indent);
		out.println("}");
	}

	private void writeMethod(int indent, Decl.Method d) {
		tab(indent);
		out.print("method ");
		out.print(d.getName());
		writeVariables(d.getParameters());
		if(!d.getReturns().isEmpty()) {
			out.print(" returns ");
			writeVariables(d.getReturns());
		}
		out.println(" {");
		writeStmts(indent + 1, d.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeVariables(List<Decl.Variable> variables) {
		out.print("(");
		for (int i = 0; i != variables.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeVariable(variables.get(i));
		}
		out.print(")");
	}

	private void writeVariable(Decl.Variable v) {
		out.print(v.getName());
		out.print(": ");
		writeType(v.getType());
	}

	private void writeStmts(int indent, List<Stmt> stmts) {
		for (int i = 0; i != stmts.size(); ++i) {
			writeStmt(indent, stmts.get(i));
		}
	}

	private void writeStmt(int indent, Stmt s) {
		tab(indent);
		if(s instanceof Stmt.Comment) {
			out.print("// ");
			out.println(((Stmt.Comment) s).getMessage());
		} else if(s instanceof Stmt.Label) {
			out.print("label ");
			out.println(((Stmt.Label) s).getLabel());
		} else if(s instanceof Stmt.Inhale) {
			writeUnary("inhale ", ((Stmt.Inhale) s).getExpr());
		} else if(s instanceof Stmt.Exhale) {
			writeUnary("exhale ", ((Stmt.Exhale) s).getExpr());
		} else if(s instanceof Stmt.Assert) {
			writeUnary("assert ", ((Stmt.Assert) s).getExpr());
		} else if(s instanceof Stmt.Obtain) {
			writeUnary("obtain ", ((Stmt.Obtain) s).getExpr());
		} else if(s instanceof Stmt.MethodCall) {
			writeMethodCall((Stmt.MethodCall) s);
		} else if(s instanceof Stmt.Assign) {
			Stmt.Assign a = (Stmt.Assign) s;
			writeExpression(a.getTarget());
			out.print(" := ");
			writeExpression(a.getSource());
			out.println();
		} else if(s instanceof Stmt.Fold) {
			Stmt.Fold f = (Stmt.Fold) s;
			out.print("fold ");
			writePredicateInstance(f.getPredicateName(), f.getArguments(), f.getPermission(), f.getVariant());
			out.println();
		} else if(s instanceof Stmt.Unfold) {
			Stmt.Unfold f = (Stmt.Unfold) s;
			out.print("unfold ");
			writePredicateInstance(f.getPredicateName(), f.getArguments(), f.getPermission(), f.getVariant());
			out.println();
		} else if(s instanceof Stmt.BeginFrame) {
			out.println("begin frame");
		} else if(s instanceof Stmt.EndFrame) {
			out.println("end frame");
		} else if(s instanceof Stmt.TransferPerm) {
			Stmt.TransferPerm t = (Stmt.TransferPerm) s;
			out.print("transfer perm ");
			writeExpression(t.getLeft());
			out.print(" --> ");
			writeExpression(t.getRight());
			out.println(t.isUnchecked() ? " // unchecked" : "");
		} else if(s instanceof Stmt.PackageMagicWand) {
			writePackageMagicWand(indent, (Stmt.PackageMagicWand) s);
		} else if(s instanceof Stmt.ApplyMagicWand) {
			writeUnary("apply ", ((Stmt.ApplyMagicWand) s).getWand());
		} else if(s instanceof Stmt.ExpireBorrows) {
			out.print("expire borrows ");
			out.println(((Stmt.ExpireBorrows) s).getBorrows());
		} else if(s instanceof Stmt.If) {
			writeIf(indent, (Stmt.If) s);
		} else if(s instanceof Stmt.Downcast) {
			Stmt.Downcast d = (Stmt.Downcast) s;
			out.print("downcast ");
			writeExpression(d.getBase());
			out.print(" to ");
			out.println(d.getField().getName());
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeUnary(String keyword, Expr e) {
		out.print(keyword);
		writeExpression(e);
		out.println();
	}

	private void writeMethodCall(Stmt.MethodCall s) {
		List<Decl.Variable> targets = s.getTargets();
		for (int i = 0; i != targets.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			out.print(targets.get(i).getName());
		}
		if (!targets.isEmpty()) {
			out.print(" := ");
		}
		out.print(s.getName());
		writeArguments(s.getArguments());
		out.println();
	}

	private void writePackageMagicWand(int indent, Stmt.PackageMagicWand s) {
		out.print("package[");
		out.print(s.getLabel());
		out.print("] ");
		writeExpression(s.getWand());
		out.println(" {");
		writeStmts(indent + 1, s.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeIf(int indent, Stmt.If s) {
		out.print("if (");
		writeExpression(s.getGuard());
		out.println(") {");
		writeStmts(indent + 1, s.getThenStmts());
		if (!s.getElseStmts().isEmpty()) {
			tab(indent);
			out.println("} else {");
			writeStmts(indent + 1, s.getElseStmts());
		}
		tab(indent);
		out.println("}");
	}

	private void writePredicateInstance(String name, List<Expr> arguments, VirFile.PermAmount amount,
			String variant) {
		out.print("acc(");
		out.print(name);
		if (variant != null) {
			out.print("<");
			out.print(variant);
			out.print(">");
		}
		writeArguments(arguments);
		out.print(", ");
		out.print(amount);
		out.print(")");
	}

	private void writeArguments(List<Expr> arguments) {
		out.print("(");
		for (int i = 0; i != arguments.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(arguments.get(i));
		}
		out.print(")");
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.UnaryOp || e instanceof Expr.BinOp || e instanceof Expr.ContainerOp
				|| e instanceof Expr.MagicWand) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if(e instanceof Expr.Const) {
			out.print(((Expr.Const) e).getValue());
		} else if(e instanceof Expr.Local) {
			out.print(((Expr.Local) e).getVariable().getName());
		} else if(e instanceof Expr.Field) {
			Expr.Field f = (Expr.Field) e;
			writeExpression(f.getBase());
			out.print(".");
			out.print(f.getField().getName());
		} else if(e instanceof Expr.Variant) {
			Expr.Variant v = (Expr.Variant) e;
			writeExpression(v.getBase());
			out.print(".");
			out.print(v.getField().getName());
		} else if(e instanceof Expr.AddrOf) {
			out.print("&");
			writeExpressionWithBraces(((Expr.AddrOf) e).getBase());
		} else if(e instanceof Expr.LabelledOld) {
			Expr.LabelledOld o = (Expr.LabelledOld) e;
			out.print("old[");
			out.print(o.getLabel());
			out.print("](");
			writeExpression(o.getBase());
			out.print(")");
		} else if(e instanceof Expr.MagicWand) {
			Expr.MagicWand w = (Expr.MagicWand) e;
			writeExpressionWithBraces(w.getLeft());
			out.print(" --* ");
			writeExpressionWithBraces(w.getRight());
		} else if(e instanceof Expr.PredicateAccessPredicate) {
			Expr.PredicateAccessPredicate p = (Expr.PredicateAccessPredicate) e;
			out.print("acc(");
			out.print(p.getPredicateName());
			out.print("(");
			writeExpression(p.getArgument());
			out.print("), ");
			out.print(p.getPermission());
			out.print(")");
		} else if(e instanceof Expr.FieldAccessPredicate) {
			Expr.FieldAccessPredicate p = (Expr.FieldAccessPredicate) e;
			out.print("acc(");
			writeExpression(p.getBase());
			out.print(", ");
			out.print(p.getPermission());
			out.print(")");
		} else if(e instanceof Expr.UnaryOp) {
			Expr.UnaryOp u = (Expr.UnaryOp) e;
			out.print(u.getKind().getSymbol());
			writeExpressionWithBraces(u.getArgument());
		} else if(e instanceof Expr.BinOp) {
			Expr.BinOp b = (Expr.BinOp) e;
			writeExpressionWithBraces(b.getLeft());
			out.print(" ");
			out.print(b.getKind().getSymbol());
			out.print(" ");
			writeExpressionWithBraces(b.getRight());
		} else if(e instanceof Expr.ContainerOp) {
			writeContainerOp((Expr.ContainerOp) e);
		} else if(e instanceof Expr.Seq) {
			Expr.Seq s = (Expr.Seq) e;
			out.print("Seq");
			if (s.getElements().isEmpty() && s.getType() instanceof Type.Sequence) {
				out.print("[");
				writeType(((Type.Sequence) s.getType()).getElement());
				out.print("]");
			}
			writeArguments(s.getElements());
		} else if(e instanceof Expr.Unfolding) {
			Expr.Unfolding u = (Expr.Unfolding) e;
			out.print("(unfolding ");
			writePredicateInstance(u.getPredicateName(), u.getArguments(), u.getPermission(), u.getVariant());
			out.print(" in ");
			writeExpression(u.getBase());
			out.print(")");
		} else if(e instanceof Expr.Cond) {
			Expr.Cond c = (Expr.Cond) e;
			out.print("(");
			writeExpressionWithBraces(c.getGuard());
			out.print(" ? ");
			writeExpressionWithBraces(c.getThenExpr());
			out.print(" : ");
			writeExpressionWithBraces(c.getElseExpr());
			out.print(")");
		} else if(e instanceof Expr.Quantifier) {
			writeQuantifier((Expr.Quantifier) e);
		} else if(e instanceof Expr.LetExpr) {
			Expr.LetExpr l = (Expr.LetExpr) e;
			out.print("(let ");
			out.print(l.getVariable().getName());
			out.print(" == (");
			writeExpression(l.getDef());
			out.print(") in ");
			writeExpression(l.getBody());
			out.print(")");
		} else if(e instanceof Expr.Application) {
			Expr.Application a = (Expr.Application) e;
			out.print(a.getName());
			writeArguments(a.getArguments());
		} else if(e instanceof Expr.InhaleExhale) {
			Expr.InhaleExhale ie = (Expr.InhaleExhale) e;
			out.print("[");
			writeExpression(ie.getInhale());
			out.print(", ");
			writeExpression(ie.getExhale());
			out.print("]");
		} else if(e instanceof Expr.Downcast) {
			Expr.Downcast d = (Expr.Downcast) e;
			out.print("(downcast ");
			writeExpression(d.getEnumPlace());
			out.print(" to ");
			out.print(d.getField().getName());
			out.print(" in ");
			writeExpression(d.getBase());
			out.print(")");
		} else if(e instanceof Expr.SnapApp) {
			out.print("snap(");
			writeExpression(((Expr.SnapApp) e).getBase());
			out.print(")");
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeContainerOp(Expr.ContainerOp e) {
		if (e.getKind() == ContainerOpKind.SEQ_INDEX) {
			writeExpressionWithBraces(e.getLeft());
			out.print("[");
			writeExpression(e.getRight());
			out.print("]");
		} else if (e.getKind() == ContainerOpKind.SEQ_CONCAT) {
			writeExpressionWithBraces(e.getLeft());
			out.print(" ++ ");
			writeExpressionWithBraces(e.getRight());
		} else {
			writeExpressionWithBraces(e.getRight());
			out.print(" in ");
			writeExpressionWithBraces(e.getLeft());
		}
	}

	private void writeQuantifier(Expr.Quantifier e) {
		out.print("(");
		if (e instanceof Expr.ForAll) {
			out.print("forall ");
		} else {
			out.print("exists ");
		}
		List<Decl.Variable> variables = e.getVariables();
		for (int i = 0; i != variables.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeVariable(variables.get(i));
		}
		out.print(" :: ");
		writeExpression(e.getBody());
		out.print(")");
	}

	private void writeType(Type t) {
		if(t instanceof Type.Int) {
			out.print("Int");
		} else if(t instanceof Type.Bool) {
			out.print("Bool");
		} else if(t instanceof Type.TypedRef) {
			out.print("Ref(");
			out.print(t.getName());
			out.print(")");
		} else if(t instanceof Type.TypeVar || t instanceof Type.Domain) {
			out.print(t.getName());
		} else if(t instanceof Type.Sequence) {
			out.print("Seq[");
			writeType(((Type.Sequence) t).getElement());
			out.print("]");
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void tab(int indent) {
		for (int i = 0; i < indent; ++i) {
			out.print("\t");
		}
	}

	/**
	 * Render any item of a VIR program as a string. Statements are rendered
	 * without their trailing line break.
	 *
	 * @param item
	 * @return
	 */
	public static String toString(VirFile.Item item) {
		StringWriter buf = new StringWriter();
		VirFilePrinter p = new VirFilePrinter(buf);
		if (item instanceof Expr) {
			p.writeExpression((Expr) item);
		} else if (item instanceof Stmt) {
			p.writeStmt(0, (Stmt) item);
		} else if (item instanceof Type) {
			p.writeType((Type) item);
		} else if (item instanceof Decl.Variable) {
			p.writeVariable((Decl.Variable) item);
		} else if (item instanceof Decl.Field) {
			p.out.print(((Decl.Field) item).getName());
		} else if (item instanceof Decl.EnumVariant) {
			p.out.print(((Decl.EnumVariant) item).getName());
		} else if (item instanceof Decl) {
			p.writeDecl(0, (Decl) item);
		} else {
			p.out.print(item.getClass().getSimpleName());
		}
		p.flush();
		return buf.toString().trim();
	}
}
