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

/**
 * Substitute every occurrence of a given place within an expression. For
 * example, replacing <code>self</code> by <code>x.f</code> turns
 * <code>acc(self.g, write)</code> into <code>acc(x.f.g, write)</code>.
 * Occurrences are identified by structural equality, hence attributes are
 * ignored.
 */
public class PlaceReplacer extends AbstractExpressionTransform {
    private final Expr target;
    private final Expr replacement;

    public PlaceReplacer(Expr target, Expr replacement) {
        this.target = target;
        this.replacement = replacement;
    }

    @Override
    public Expr visitExpression(Expr expr) {
        if (expr.equals(target)) {
            return replacement;
        } else {
            return super.visitExpression(expr);
        }
    }
}
