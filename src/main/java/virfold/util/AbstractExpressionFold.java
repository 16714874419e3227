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
import java.util.List;

public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructConst(Expr.Const expr) {
        return BOTTOM();
    }

    @Override
    protected E constructLocal(Expr.Local expr) {
        return BOTTOM();
    }

    @Override
    protected E constructField(Expr.Field expr, E base) {
        return base;
    }

    @Override
    protected E constructVariant(Expr.Variant expr, E base) {
        return base;
    }

    @Override
    protected E constructAddrOf(Expr.AddrOf expr, E base) {
        return base;
    }

    @Override
    protected E constructLabelledOld(Expr.LabelledOld expr, E base) {
        return base;
    }

    @Override
    protected E constructMagicWand(Expr.MagicWand expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, E argument) {
        return argument;
    }

    @Override
    protected E constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, E base) {
        return base;
    }

    @Override
    protected E constructUnfolding(Expr.Unfolding expr, List<E> arguments, E base) {
        return join(join(arguments), base);
    }

    @Override
    protected E constructInhaleExhale(Expr.InhaleExhale expr, E inhale, E exhale) {
        return join(inhale, exhale);
    }

    @Override
    protected E constructUnaryOp(Expr.UnaryOp expr, E operand) {
        return operand;
    }

    @Override
    protected E constructBinOp(Expr.BinOp expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructContainerOp(Expr.ContainerOp expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructSeq(Expr.Seq expr, List<E> elements) {
        return join(elements);
    }

    @Override
    protected E constructCond(Expr.Cond expr, E guard, E thenExpr, E elseExpr) {
        return join(guard, join(thenExpr, elseExpr));
    }

    @Override
    protected E constructForAll(Expr.ForAll expr, E body) {
        return body;
    }

    @Override
    protected E constructExists(Expr.Exists expr, E body) {
        return body;
    }

    @Override
    protected E constructLetExpr(Expr.LetExpr expr, E def, E body) {
        return join(def, body);
    }

    @Override
    protected E constructFuncApp(Expr.FuncApp expr, List<E> args) {
        return join(args);
    }

    @Override
    protected E constructDomainFuncApp(Expr.DomainFuncApp expr, List<E> args) {
        return join(args);
    }

    @Override
    protected E constructDowncast(Expr.Downcast expr, E base, E enumPlace) {
        return join(base, enumPlace);
    }

    @Override
    protected E constructSnapApp(Expr.SnapApp expr, E base) {
        return base;
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);

    protected abstract E join(List<E> operands);
}
