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

import static virfold.core.VirFile.*;
import static virfold.util.Util.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import virfold.core.Permission;
import virfold.core.Predicates;

/**
 * Determine the permissions which must be held in the current state for a
 * given statement or expression to be well-defined. For example, consider the
 * following statement:
 *
 * <pre>
 *     y.g := x.f.h + 1
 * </pre>
 * This reads <code>x.f</code> and <code>x.f.h</code> and writes
 * <code>y.g</code>, hence it requires <code>acc(x.f, read)</code>,
 * <code>acc(x.f.h, read)</code> and <code>acc(y.g, write)</code>. A fold/unfold
 * synthesis uses this to decide which predicate instances must be unfolded (or
 * folded) before the statement can be executed.
 * <p>
 * The requirements are exact except at function applications, where reference
 * arguments conservatively require their (dereferenced) predicate instances to
 * be available. Permissions are compared by kind, place and amount, so the
 * resulting sets are deterministic for equal inputs.
 * </p>
 *
 */
public class RequiredPermissionsExtractor extends AbstractExpressionFold<Set<Permission>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequiredPermissionsExtractor.class);

    private final Predicates predicates;
    private final StatementRequirements statements = new StatementRequirements();

    public RequiredPermissionsExtractor(Predicates predicates) {
        this.predicates = predicates;
    }

    /**
     * Determine the permissions required by a single statement or expression.
     *
     * @param item
     * @return
     */
    public Set<Permission> getRequiredPermissions(Item item) {
        if (item instanceof Stmt) {
            return statements.visitStatement((Stmt) item);
        } else if (item instanceof Expr) {
            return visitExpression((Expr) item);
        } else {
            throw new UnsupportedOperationException("unknown item encountered (" + item.getClass().getName() + ")");
        }
    }

    /**
     * Determine the permissions required by a sequence of statements or
     * expressions. This is simply the union of their requirements.
     *
     * @param items
     * @return
     */
    public Set<Permission> getRequiredPermissions(List<? extends Item> items) {
        HashSet<Permission> result = new HashSet<>();
        for (int i = 0; i != items.size(); ++i) {
            result.addAll(getRequiredPermissions(items.get(i)));
        }
        return result;
    }

    @Override
    public Set<Permission> visitExpression(Expr expr) {
        LOGGER.trace("[enter] getRequiredPermissions(expr={})", expr);
        Set<Permission> permissions = super.visitExpression(expr);
        LOGGER.trace("[exit] getRequiredPermissions(expr={}): {}", expr, permissions);
        return permissions;
    }

    @Override
    protected Set<Permission> BOTTOM() {
        return new HashSet<>();
    }

    @Override
    protected Set<Permission> join(Set<Permission> lhs, Set<Permission> rhs) {
        return Permission.union(lhs, rhs);
    }

    @Override
    protected Set<Permission> join(List<Set<Permission>> operands) {
        return flattern(operands);
    }

    // =======================================================
    // Places
    // =======================================================

    @Override
    protected Set<Permission> visitField(Expr.Field expr) {
        return singleton(Permission.acc(expr, PermAmount.READ));
    }

    @Override
    protected Set<Permission> visitVariant(Expr.Variant expr) {
        return singleton(Permission.acc(expr, PermAmount.READ));
    }

    @Override
    protected Set<Permission> visitAddrOf(Expr.AddrOf expr) {
        throw new UnsupportedOperationException("address-of is not supported (" + expr + ")");
    }

    @Override
    protected Set<Permission> visitLabelledOld(Expr.LabelledOld expr) {
        // old state is not required to be held now
        return BOTTOM();
    }

    // =======================================================
    // Permissions
    // =======================================================

    @Override
    protected Set<Permission> visitMagicWand(Expr.MagicWand expr) {
        return BOTTOM();
    }

    @Override
    protected Set<Permission> visitInhaleExhale(Expr.InhaleExhale expr) {
        return BOTTOM();
    }

    @Override
    protected Set<Permission> visitPredicateAccessPredicate(Expr.PredicateAccessPredicate expr) {
        Expr argument = expr.getArgument();
        checkPlace(argument, expr);
        String label = argument.getLabel();
        Expr place = (label == null) ? argument : argument.old(label);
        HashSet<Permission> result = new HashSet<>();
        result.add(Permission.pred(place, PermAmount.READ));
        if (!place.isOld()) {
            result.add(Permission.acc(place, PermAmount.READ));
        }
        return result;
    }

    @Override
    protected Set<Permission> visitUnfolding(Expr.Unfolding expr) {
        Expr place = getSinglePlace(expr.getArguments(), expr);
        Decl.Predicate predicate = predicates.get(place.getType());
        Expr self = predicate.getSelfPlace();
        PermAmount amount = expr.getPermission();
        // Simulate temporarily unfolding the place
        Set<Permission> opened = map(predicate.getBodyFootprint(expr.getVariant()),
                p -> p.mapPlace(q -> q.replacePlace(self, place)).updatePermAmount(amount));
        Set<Permission> result = Permission.difference(visitExpression(expr.getBase()), opened);
        result.add(Permission.pred(place, amount));
        return result;
    }

    // =======================================================
    // Binders
    // =======================================================

    @Override
    protected Set<Permission> visitForAll(Expr.ForAll expr) {
        return visitQuantifier(expr);
    }

    @Override
    protected Set<Permission> visitExists(Expr.Exists expr) {
        return visitQuantifier(expr);
    }

    private Set<Permission> visitQuantifier(Expr.Quantifier expr) {
        HashSet<Permission> bound = new HashSet<>();
        for (Decl.Variable v : expr.getVariables()) {
            if (v.getType().isTypedRefOrTypeVar()) {
                throw new IllegalArgumentException(
                        "quantified variable " + v.getName() + " has reference type (" + expr + ")");
            }
            bound.add(Permission.acc(LOCAL(v), PermAmount.WRITE));
        }
        return Permission.difference(visitExpression(expr.getBody()), bound);
    }

    @Override
    protected Set<Permission> visitLetExpr(Expr.LetExpr expr) {
        throw new UnsupportedOperationException("let expressions are not supported (" + expr + ")");
    }

    // =======================================================
    // Applications
    // =======================================================

    @Override
    protected Set<Permission> visitFuncApp(Expr.FuncApp expr) {
        return getRequiredPermissions(expandReferenceArguments(expr.getArguments()));
    }

    @Override
    protected Set<Permission> visitDomainFuncApp(Expr.DomainFuncApp expr) {
        return getRequiredPermissions(expandReferenceArguments(expr.getArguments()));
    }

    /**
     * Replace every reference argument of a function application by read access to
     * its predicate instance (and the referenced value, where the argument is a
     * reference). This over-approximates the function's actual precondition.
     *
     * @param arguments
     * @return
     */
    private List<Expr> expandReferenceArguments(List<Expr> arguments) {
        return map(arguments, arg -> {
            if (arg.isPlace() && arg.getType().isTypedRefOrTypeVar()) {
                Expr deref = arg.tryDeref();
                if (deref != null) {
                    return AND(FIELD_ACC(deref, PermAmount.READ),
                            PRED_ACC(deref.getType().getName(), deref, PermAmount.READ));
                } else {
                    return PRED_ACC(arg.getType().getName(), arg, PermAmount.READ);
                }
            } else {
                LOGGER.debug("arg {} is not a place with type ref", arg);
                return arg;
            }
        });
    }

    @Override
    protected Set<Permission> visitDowncast(Expr.Downcast expr) {
        Expr enumPlace = expr.getEnumPlace();
        Decl.Predicate predicate = predicates.get(enumPlace.getType());
        if (predicate instanceof Decl.EnumPredicate) {
            // The enum must be unfolded
            Decl.Field discriminant = ((Decl.EnumPredicate) predicate).getDiscriminantField();
            return visitExpression(enumPlace.field(discriminant));
        } else {
            throw new IllegalArgumentException(
                    "predicate " + predicate.getName() + " of downcast place is not an enum (" + expr + ")");
        }
    }

    @Override
    protected Set<Permission> visitSnapApp(Expr.SnapApp expr) {
        throw new UnsupportedOperationException("snapshots must be encoded before fold/unfold (" + expr + ")");
    }

    // =======================================================
    // Statements
    // =======================================================

    private class StatementRequirements extends AbstractStatementVisitor<Set<Permission>> {

        @Override
        protected Set<Permission> constructComment(Stmt.Comment s) {
            return BOTTOM();
        }

        @Override
        protected Set<Permission> constructLabel(Stmt.Label s) {
            return BOTTOM();
        }

        @Override
        protected Set<Permission> constructInhale(Stmt.Inhale s) {
            Set<Permission> footprint = new FootprintExtractor().getFootprint(s.getExpr());
            return Permission.difference(visitExpression(s.getExpr()), footprint);
        }

        @Override
        protected Set<Permission> constructExhale(Stmt.Exhale s) {
            return withDefaultPosition(visitExpression(s.getExpr()), s);
        }

        @Override
        protected Set<Permission> constructAssert(Stmt.Assert s) {
            return withDefaultPosition(visitExpression(s.getExpr()), s);
        }

        @Override
        protected Set<Permission> constructObtain(Stmt.Obtain s) {
            return withDefaultPosition(visitExpression(s.getExpr()), s);
        }

        @Override
        protected Set<Permission> constructMethodCall(Stmt.MethodCall s) {
            if (!s.getArguments().isEmpty()) {
                throw new IllegalArgumentException("method call with arguments (" + s + ")");
            }
            HashSet<Permission> result = new HashSet<>();
            for (Decl.Variable target : s.getTargets()) {
                result.add(Permission.acc(LOCAL(target), PermAmount.WRITE));
            }
            return result;
        }

        @Override
        protected Set<Permission> constructAssign(Stmt.Assign s) {
            Set<Permission> result = visitExpression(s.getSource());
            result.add(Permission.acc(s.getTarget(), PermAmount.WRITE));
            return result;
        }

        @Override
        protected Set<Permission> constructFold(Stmt.Fold s) {
            Expr place = getSinglePlace(s.getArguments(), s);
            Decl.Predicate predicate = predicates.get(place.getType());
            Expr self = predicate.getSelfPlace();
            PermAmount amount = s.getPermission();
            return map(predicate.getBodyFootprint(s.getVariant()),
                    p -> p.mapPlace(q -> q.replacePlace(self, place)).initPermAmount(amount));
        }

        @Override
        protected Set<Permission> constructUnfold(Stmt.Unfold s) {
            Expr place = getSinglePlace(s.getArguments(), s);
            PermAmount amount = s.getPermission();
            Set<Permission> required = visitExpression(place);
            required.add(Permission.pred(place, PermAmount.WRITE));
            return map(required, p -> p.initPermAmount(amount));
        }

        @Override
        protected Set<Permission> constructBeginFrame(Stmt.BeginFrame s) {
            return BOTTOM();
        }

        @Override
        protected Set<Permission> constructEndFrame(Stmt.EndFrame s) {
            return BOTTOM();
        }

        @Override
        protected Set<Permission> constructTransferPerm(Stmt.TransferPerm s) {
            if (s.isUnchecked()) {
                return BOTTOM();
            } else {
                return singleton(Permission.acc(s.getLeft(), PermAmount.READ));
            }
        }

        @Override
        protected Set<Permission> constructPackageMagicWand(Stmt.PackageMagicWand s) {
            return BOTTOM();
        }

        @Override
        protected Set<Permission> constructApplyMagicWand(Stmt.ApplyMagicWand s) {
            return visitExpression(s.getWand().getLeft());
        }

        @Override
        protected Set<Permission> constructExpireBorrows(Stmt.ExpireBorrows s) {
            // TODO: require the permissions consumed by the expiring magic wands.
            LOGGER.debug("requirements of {} are not computed", s);
            return BOTTOM();
        }

        @Override
        protected Set<Permission> constructIf(Stmt.If s, List<Set<Permission>> thenBranch,
                List<Set<Permission>> elseBranch) {
            Set<Permission> common = Permission.intersection(flattern(thenBranch), flattern(elseBranch));
            return Permission.union(visitExpression(s.getGuard()), common);
        }

        @Override
        protected Set<Permission> constructDowncast(Stmt.Downcast s) {
            return visitExpression(DOWNCAST(CONST(true), s.getBase(), s.getField()));
        }

        private Set<Permission> withDefaultPosition(Set<Permission> permissions, Stmt s) {
            Position position = s.getPosition();
            return map(permissions, p -> p.setDefaultPosition(position));
        }
    }

    // =======================================================
    // Helpers
    // =======================================================

    private static Expr getSinglePlace(List<Expr> arguments, Item item) {
        if (arguments.size() != 1) {
            throw new IllegalArgumentException("expected exactly one argument, found " + arguments.size() + " ("
                    + item + ")");
        }
        Expr place = arguments.get(0);
        checkPlace(place, item);
        return place;
    }

    private static void checkPlace(Expr expr, Item item) {
        if (!expr.isPlace()) {
            throw new IllegalArgumentException("expected place, found " + expr + " (" + item + ")");
        }
    }

    private static Set<Permission> singleton(Permission p) {
        HashSet<Permission> result = new HashSet<>();
        result.add(p);
        return result;
    }
}
