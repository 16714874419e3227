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

import java.util.List;
import virfold.core.VirFile;
import virfold.core.VirFile.Expr;

/**
 * Rebuild an expression bottom-up. A node is only reconstructed when one of its
 * children was replaced, so that untouched subtrees are shared with the
 * original.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructConst(Expr.Const expr) {
        return expr;
    }

    @Override
    protected Expr constructLocal(Expr.Local expr) {
        return expr;
    }

    // Places

    @Override
    protected Expr constructField(Expr.Field expr, Expr base) {
        if (expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.FIELD(base, expr.getField(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructVariant(Expr.Variant expr, Expr base) {
        if (expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.VARIANT(base, expr.getField(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructAddrOf(Expr.AddrOf expr, Expr base) {
        if (expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.ADDR_OF(base, expr.getType(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructLabelledOld(Expr.LabelledOld expr, Expr base) {
        if (expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.OLD(expr.getLabel(), base, expr.getAttributes());
        }
    }

    // Permissions

    @Override
    protected Expr constructMagicWand(Expr.MagicWand expr, Expr lhs, Expr rhs) {
        if (expr.getLeft() == lhs && expr.getRight() == rhs) {
            return expr;
        } else {
            return VirFile.MAGIC_WAND(lhs, rhs, expr.getBorrow(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, Expr argument) {
        if (expr.getArgument() == argument) {
            return expr;
        } else {
            return VirFile.PRED_ACC(expr.getPredicateName(), argument, expr.getPermission(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, Expr base) {
        if (expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.FIELD_ACC(base, expr.getPermission(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructUnfolding(Expr.Unfolding expr, List<Expr> arguments, Expr base) {
        if (equals(expr.getArguments(), arguments) && expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.UNFOLDING(expr.getPredicateName(), arguments, base, expr.getPermission(),
                    expr.getVariant(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructInhaleExhale(Expr.InhaleExhale expr, Expr inhale, Expr exhale) {
        if (expr.getInhale() == inhale && expr.getExhale() == exhale) {
            return expr;
        } else {
            return VirFile.INHALE_EXHALE(inhale, exhale, expr.getAttributes());
        }
    }

    // Operators

    @Override
    protected Expr constructUnaryOp(Expr.UnaryOp expr, Expr operand) {
        if (expr.getArgument() == operand) {
            return expr;
        } else if (expr.getKind() == VirFile.UnaryOpKind.NOT) {
            return VirFile.NOT(operand, expr.getAttributes());
        } else {
            return VirFile.NEG(operand, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructBinOp(Expr.BinOp expr, Expr lhs, Expr rhs) {
        if (expr.getLeft() == lhs && expr.getRight() == rhs) {
            return expr;
        } else {
            return VirFile.BINOP(expr.getKind(), lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructContainerOp(Expr.ContainerOp expr, Expr lhs, Expr rhs) {
        if (expr.getLeft() == lhs && expr.getRight() == rhs) {
            return expr;
        } else {
            return VirFile.CONTAINER_OP(expr.getKind(), lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructSeq(Expr.Seq expr, List<Expr> elements) {
        if (equals(expr.getElements(), elements)) {
            return expr;
        } else {
            return VirFile.SEQ(expr.getType(), elements, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructCond(Expr.Cond expr, Expr guard, Expr thenExpr, Expr elseExpr) {
        if (expr.getGuard() == guard && expr.getThenExpr() == thenExpr && expr.getElseExpr() == elseExpr) {
            return expr;
        } else {
            return VirFile.COND(guard, thenExpr, elseExpr, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructForAll(Expr.ForAll expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return VirFile.FORALL(expr.getVariables(), body, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructExists(Expr.Exists expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return VirFile.EXISTS(expr.getVariables(), body, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructLetExpr(Expr.LetExpr expr, Expr def, Expr body) {
        if (expr.getDef() == def && expr.getBody() == body) {
            return expr;
        } else {
            return VirFile.LET(expr.getVariable(), def, body, expr.getAttributes());
        }
    }

    // Applications

    @Override
    protected Expr constructFuncApp(Expr.FuncApp expr, List<Expr> args) {
        if (equals(expr.getArguments(), args)) {
            return expr;
        } else {
            return VirFile.FUNC_APP(expr.getName(), args, expr.getFormalArguments(), expr.getType(),
                    expr.getAttributes());
        }
    }

    @Override
    protected Expr constructDomainFuncApp(Expr.DomainFuncApp expr, List<Expr> args) {
        if (equals(expr.getArguments(), args)) {
            return expr;
        } else {
            return VirFile.DOMAIN_FUNC_APP(expr.getDomainName(), expr.getName(), args, expr.getFormalArguments(),
                    expr.getType(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructDowncast(Expr.Downcast expr, Expr base, Expr enumPlace) {
        if (expr.getBase() == base && expr.getEnumPlace() == enumPlace) {
            return expr;
        } else {
            return VirFile.DOWNCAST(base, enumPlace, expr.getField(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructSnapApp(Expr.SnapApp expr, Expr base) {
        if (expr.getBase() == base) {
            return expr;
        } else {
            return VirFile.SNAP_APP(base, expr.getAttributes());
        }
    }

    protected boolean equals(List<Expr> lhs, List<Expr> rhs) {
        if(lhs.size() == rhs.size()) {
            for(int i=0;i!=lhs.size();++i) {
                if(lhs.get(i) != rhs.get(i)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
