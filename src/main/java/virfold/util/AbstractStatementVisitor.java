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

import java.util.ArrayList;
import java.util.List;

public abstract class AbstractStatementVisitor<S> {

    public S visitStatement(Stmt s) {
        if(s instanceof Stmt.Comment) {
            return constructComment((Stmt.Comment) s);
        } else if(s instanceof Stmt.Label) {
            return constructLabel((Stmt.Label) s);
        } else if(s instanceof Stmt.Inhale) {
            return constructInhale((Stmt.Inhale) s);
        } else if(s instanceof Stmt.Exhale) {
            return constructExhale((Stmt.Exhale) s);
        } else if(s instanceof Stmt.Assert) {
            return constructAssert((Stmt.Assert) s);
        } else if(s instanceof Stmt.Obtain) {
            return constructObtain((Stmt.Obtain) s);
        } else if(s instanceof Stmt.MethodCall) {
            return constructMethodCall((Stmt.MethodCall) s);
        } else if(s instanceof Stmt.Assign) {
            return constructAssign((Stmt.Assign) s);
        } else if(s instanceof Stmt.Fold) {
            return constructFold((Stmt.Fold) s);
        } else if(s instanceof Stmt.Unfold) {
            return constructUnfold((Stmt.Unfold) s);
        } else if(s instanceof Stmt.BeginFrame) {
            return constructBeginFrame((Stmt.BeginFrame) s);
        } else if(s instanceof Stmt.EndFrame) {
            return constructEndFrame((Stmt.EndFrame) s);
        } else if(s instanceof Stmt.TransferPerm) {
            return constructTransferPerm((Stmt.TransferPerm) s);
        } else if(s instanceof Stmt.PackageMagicWand) {
            return constructPackageMagicWand((Stmt.PackageMagicWand) s);
        } else if(s instanceof Stmt.ApplyMagicWand) {
            return constructApplyMagicWand((Stmt.ApplyMagicWand) s);
        } else if(s instanceof Stmt.ExpireBorrows) {
            return constructExpireBorrows((Stmt.ExpireBorrows) s);
        } else if(s instanceof Stmt.If) {
            return visitIf((Stmt.If) s);
        } else if(s instanceof Stmt.Downcast) {
            return constructDowncast((Stmt.Downcast) s);
        } else {
            throw new UnsupportedOperationException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    protected List<S> visitStatements(List<Stmt> stmts) {
        List<S> results = new ArrayList<>();
        for (int i = 0; i != stmts.size(); ++i) {
            results.add(visitStatement(stmts.get(i)));
        }
        return results;
    }

    protected S visitIf(Stmt.If s) {
        List<S> thenBranch = visitStatements(s.getThenStmts());
        List<S> elseBranch = visitStatements(s.getElseStmts());
        return constructIf(s, thenBranch, elseBranch);
    }

    protected abstract S constructComment(Stmt.Comment s);
    protected abstract S constructLabel(Stmt.Label s);
    protected abstract S constructInhale(Stmt.Inhale s);
    protected abstract S constructExhale(Stmt.Exhale s);
    protected abstract S constructAssert(Stmt.Assert s);
    protected abstract S constructObtain(Stmt.Obtain s);
    protected abstract S constructMethodCall(Stmt.MethodCall s);
    protected abstract S constructAssign(Stmt.Assign s);
    protected abstract S constructFold(Stmt.Fold s);
    protected abstract S constructUnfold(Stmt.Unfold s);
    protected abstract S constructBeginFrame(Stmt.BeginFrame s);
    protected abstract S constructEndFrame(Stmt.EndFrame s);
    protected abstract S constructTransferPerm(Stmt.TransferPerm s);
    protected abstract S constructPackageMagicWand(Stmt.PackageMagicWand s);
    protected abstract S constructApplyMagicWand(Stmt.ApplyMagicWand s);
    protected abstract S constructExpireBorrows(Stmt.ExpireBorrows s);
    protected abstract S constructIf(Stmt.If s, List<S> thenBranch, List<S> elseBranch);
    protected abstract S constructDowncast(Stmt.Downcast s);
}
