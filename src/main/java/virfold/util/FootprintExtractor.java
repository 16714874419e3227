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

import java.util.HashSet;
import java.util.Set;

import virfold.core.Permission;
import virfold.core.VirFile.BinaryOpKind;
import virfold.core.VirFile.Expr;

/**
 * Determine the permissions granted by inhaling a given assertion. For example,
 * the footprint of
 *
 * <pre>
 * acc(x.f, write) && (b ? T(x.f.g, read) : acc(x.f.g, write))
 * </pre>
 *
 * is just <code>acc(x.f, write)</code>, since neither branch of the
 * conditional is known to hold. Assertions other than access predicates,
 * conjunctions, conditionals and inhale-exhale pairs grant nothing.
 *
 */
public class FootprintExtractor {

    public Set<Permission> getFootprint(Expr expr) {
        if (expr instanceof Expr.PredicateAccessPredicate) {
            Expr.PredicateAccessPredicate e = (Expr.PredicateAccessPredicate) expr;
            HashSet<Permission> result = new HashSet<>();
            result.add(Permission.pred(e.getArgument(), e.getPermission(), e.getPosition()));
            return result;
        } else if (expr instanceof Expr.FieldAccessPredicate) {
            Expr.FieldAccessPredicate e = (Expr.FieldAccessPredicate) expr;
            HashSet<Permission> result = new HashSet<>();
            result.add(Permission.acc(e.getBase(), e.getPermission(), e.getPosition()));
            return result;
        } else if (expr instanceof Expr.BinOp && ((Expr.BinOp) expr).getKind() == BinaryOpKind.AND) {
            Expr.BinOp e = (Expr.BinOp) expr;
            return Permission.union(getFootprint(e.getLeft()), getFootprint(e.getRight()));
        } else if (expr instanceof Expr.Cond) {
            Expr.Cond e = (Expr.Cond) expr;
            return Permission.intersection(getFootprint(e.getThenExpr()), getFootprint(e.getElseExpr()));
        } else if (expr instanceof Expr.InhaleExhale) {
            return getFootprint(((Expr.InhaleExhale) expr).getInhale());
        } else if (expr instanceof Expr.LetExpr) {
            throw new UnsupportedOperationException("let expressions are not supported (" + expr + ")");
        } else {
            return new HashSet<>();
        }
    }
}
