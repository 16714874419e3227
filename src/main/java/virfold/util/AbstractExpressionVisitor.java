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
package virfold.util;

import virfold.core.VirFile.Expr;

import java.util.ArrayList;
import java.util.List;

public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Const) {
            return constructConst((Expr.Const) expr);
        } else if(expr instanceof Expr.Local) {
            return constructLocal((Expr.Local) expr);
        } else if(expr instanceof Expr.Field) {
            return visitField((Expr.Field) expr);
        } else if(expr instanceof Expr.Variant) {
            return visitVariant((Expr.Variant) expr);
        } else if(expr instanceof Expr.AddrOf) {
            return visitAddrOf((Expr.AddrOf) expr);
        } else if(expr instanceof Expr.LabelledOld) {
            return visitLabelledOld((Expr.LabelledOld) expr);
        } else if(expr instanceof Expr.MagicWand) {
            return visitMagicWand((Expr.MagicWand) expr);
        } else if(expr instanceof Expr.PredicateAccessPredicate) {
            return visitPredicateAccessPredicate((Expr.PredicateAccessPredicate) expr);
        } else if(expr instanceof Expr.FieldAccessPredicate) {
            return visitFieldAccessPredicate((Expr.FieldAccessPredicate) expr);
        } else if(expr instanceof Expr.UnaryOp) {
            return visitUnaryOp((Expr.UnaryOp) expr);
        } else if(expr instanceof Expr.BinOp) {
            return visitBinOp((Expr.BinOp) expr);
        } else if(expr instanceof Expr.ContainerOp) {
            return visitContainerOp((Expr.ContainerOp) expr);
        } else if(expr instanceof Expr.Seq) {
            return visitSeq((Expr.Seq) expr);
        } else if(expr instanceof Expr.Unfolding) {
            return visitUnfolding((Expr.Unfolding) expr);
        } else if(expr instanceof Expr.Cond) {
            return visitCond((Expr.Cond) expr);
        } else if(expr instanceof Expr.ForAll) {
            return visitForAll((Expr.ForAll) expr);
        } else if(expr instanceof Expr.Exists) {
            return visitExists((Expr.Exists) expr);
        } else if(expr instanceof Expr.LetExpr) {
            return visitLetExpr((Expr.LetExpr) expr);
        } else if(expr instanceof Expr.FuncApp) {
            return visitFuncApp((Expr.FuncApp) expr);
        } else if(expr instanceof Expr.DomainFuncApp) {
            return visitDomainFuncApp((Expr.DomainFuncApp) expr);
        } else if(expr instanceof Expr.InhaleExhale) {
            return visitInhaleExhale((Expr.InhaleExhale) expr);
        } else if(expr instanceof Expr.Downcast) {
            return visitDowncast((Expr.Downcast) expr);
        } else if(expr instanceof Expr.SnapApp) {
            return visitSnapApp((Expr.SnapApp) expr);
        } else {
            throw new UnsupportedOperationException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitField(Expr.Field expr) {
        E base = visitExpression(expr.getBase());
        return constructField(expr, base);
    }

    protected E visitVariant(Expr.Variant expr) {
        E base = visitExpression(expr.getBase());
        return constructVariant(expr, base);
    }

    protected E visitAddrOf(Expr.AddrOf expr) {
        E base = visitExpression(expr.getBase());
        return constructAddrOf(expr, base);
    }

    protected E visitLabelledOld(Expr.LabelledOld expr) {
        E base = visitExpression(expr.getBase());
        return constructLabelledOld(expr, base);
    }

    protected E visitMagicWand(Expr.MagicWand expr) {
        E lhs = visitExpression(expr.getLeft());
        E rhs = visitExpression(expr.getRight());
        return constructMagicWand(expr, lhs, rhs);
    }

    protected E visitPredicateAccessPredicate(Expr.PredicateAccessPredicate expr) {
        E argument = visitExpression(expr.getArgument());
        return constructPredicateAccessPredicate(expr, argument);
    }

    protected E visitFieldAccessPredicate(Expr.FieldAccessPredicate expr) {
        E base = visitExpression(expr.getBase());
        return constructFieldAccessPredicate(expr, base);
    }

    protected E visitUnaryOp(Expr.UnaryOp expr) {
        E operand = visitExpression(expr.getArgument());
        return constructUnaryOp(expr, operand);
    }

    protected E visitBinOp(Expr.BinOp expr) {
        E lhs = visitExpression(expr.getLeft());
        E rhs = visitExpression(expr.getRight());
        return constructBinOp(expr, lhs, rhs);
    }

    protected E visitContainerOp(Expr.ContainerOp expr) {
        E lhs = visitExpression(expr.getLeft());
        E rhs = visitExpression(expr.getRight());
        return constructContainerOp(expr, lhs, rhs);
    }

    protected E visitSeq(Expr.Seq expr) {
        List<E> elements = visitExpressions(expr.getElements());
        return constructSeq(expr, elements);
    }

    protected E visitUnfolding(Expr.Unfolding expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        E base = visitExpression(expr.getBase());
        return constructUnfolding(expr, arguments, base);
    }

    protected E visitCond(Expr.Cond expr) {
        E guard = visitExpression(expr.getGuard());
        E thenExpr = visitExpression(expr.getThenExpr());
        E elseExpr = visitExpression(expr.getElseExpr());
        return constructCond(expr, guard, thenExpr, elseExpr);
    }

    protected E visitForAll(Expr.ForAll expr) {
        E body = visitExpression(expr.getBody());
        return constructForAll(expr, body);
    }

    protected E visitExists(Expr.Exists expr) {
        E body = visitExpression(expr.getBody());
        return constructExists(expr, body);
    }

    protected E visitLetExpr(Expr.LetExpr expr) {
        E def = visitExpression(expr.getDef());
        E body = visitExpression(expr.getBody());
        return constructLetExpr(expr, def, body);
    }

    protected E visitFuncApp(Expr.FuncApp expr) {
        List<E> args = visitExpressions(expr.getArguments());
        return constructFuncApp(expr, args);
    }

    protected E visitDomainFuncApp(Expr.DomainFuncApp expr) {
        List<E> args = visitExpressions(expr.getArguments());
        return constructDomainFuncApp(expr, args);
    }

    protected E visitInhaleExhale(Expr.InhaleExhale expr) {
        E inhale = visitExpression(expr.getInhale());
        E exhale = visitExpression(expr.getExhale());
        return constructInhaleExhale(expr, inhale, exhale);
    }

    protected E visitDowncast(Expr.Downcast expr) {
        E base = visitExpression(expr.getBase());
        E enumPlace = visitExpression(expr.getEnumPlace());
        return constructDowncast(expr, base, enumPlace);
    }

    protected E visitSnapApp(Expr.SnapApp expr) {
        E base = visitExpression(expr.getBase());
        return constructSnapApp(expr, base);
    }

    protected abstract E constructConst(Expr.Const expr);
    protected abstract E constructLocal(Expr.Local expr);
    // places
    protected abstract E constructField(Expr.Field expr, E base);
    protected abstract E constructVariant(Expr.Variant expr, E base);
    protected abstract E constructAddrOf(Expr.AddrOf expr, E base);
    protected abstract E constructLabelledOld(Expr.LabelledOld expr, E base);
    // permissions
    protected abstract E constructMagicWand(Expr.MagicWand expr, E lhs, E rhs);
    protected abstract E constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, E argument);
    protected abstract E constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, E base);
    protected abstract E constructUnfolding(Expr.Unfolding expr, List<E> arguments, E base);
    protected abstract E constructInhaleExhale(Expr.InhaleExhale expr, E inhale, E exhale);
    // operators
    protected abstract E constructUnaryOp(Expr.UnaryOp expr, E operand);
    protected abstract E constructBinOp(Expr.BinOp expr, E lhs, E rhs);
    protected abstract E constructContainerOp(Expr.ContainerOp expr, E lhs, E rhs);
    protected abstract E constructSeq(Expr.Seq expr, List<E> elements);
    protected abstract E constructCond(Expr.Cond expr, E guard, E thenExpr, E elseExpr);
    protected abstract E constructForAll(Expr.ForAll expr, E body);
    protected abstract E constructExists(Expr.Exists expr, E body);
    protected abstract E constructLetExpr(Expr.LetExpr expr, E def, E body);
    protected abstract E constructFuncApp(Expr.FuncApp expr, List<E> args);
    protected abstract E constructDomainFuncApp(Expr.DomainFuncApp expr, List<E> args);
    protected abstract E constructDowncast(Expr.Downcast expr, E base, E enumPlace);
    protected abstract E constructSnapApp(Expr.SnapApp expr, E base);
}
