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
package virfold;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static virfold.Fixtures.*;
import static virfold.core.VirFile.*;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import virfold.core.Permission;
import virfold.util.RequiredPermissionsExtractor;

public class StatementRequirementTests {
	private static final PermAmount READ = PermAmount.READ;
	private static final PermAmount WRITE = PermAmount.WRITE;
	private static final Expr.Local Z = LOCAL("z", T);
	private static final Decl.Field ENUM_A = FIELD("enum_A", E_A);

	private final RequiredPermissionsExtractor extractor = new RequiredPermissionsExtractor(predicates());

	public static Collection<Stmt> emptyStatements() {
		Expr.MagicWand wand = MAGIC_WAND(EQ(X.field(F), CONST(0)), FIELD_ACC(Y.field(F), WRITE));
		return Arrays.asList(
				COMMENT("nothing to see"),
				LABEL("l0"),
				BEGIN_FRAME(),
				END_FRAME(),
				PACKAGE_MAGIC_WAND(wand, Arrays.asList(ASSIGN(Y.field(F), X.field(F))), "pkg",
						Collections.<Decl.Variable>emptyList()),
				EXPIRE_BORROWS(Arrays.asList("bw0", "bw1")),
				TRANSFER_PERM(X.field(F), Y.field(F), true));
	}

	@ParameterizedTest
	@MethodSource("emptyStatements")
	public void test_empty(Stmt s) {
		assertEquals(set(), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_inhale_01() {
		// the footprint of an inhale is not required beforehand
		Stmt s = INHALE(AND(FIELD_ACC(X.field(F), WRITE), EQ(Y.field(F), CONST(1))));
		assertEquals(set(acc(Y.field(F), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_inhale_02() {
		Stmt s = INHALE(PRED_ACC("T", X, WRITE));
		assertEquals(set(acc(X, READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_exhale() {
		Stmt s = EXHALE(EQ(X.field(F), CONST(1)), POSITION(3, 4, 7));
		Set<Permission> perms = extractor.getRequiredPermissions(s);
		assertEquals(set(acc(X.field(F), READ)), perms);
		for (Permission p : perms) {
			assertEquals(new Position(3, 4, 7), p.getPosition());
		}
	}

	@Test
	public void test_assert() {
		Stmt s = ASSERT(LT(X.field(F), Y.field(F)), POSITION(10, 1, 2));
		Set<Permission> perms = extractor.getRequiredPermissions(s);
		assertEquals(set(acc(X.field(F), READ), acc(Y.field(F), READ)), perms);
		for (Permission p : perms) {
			assertEquals(new Position(10, 1, 2), p.getPosition());
		}
	}

	@Test
	public void test_obtain() {
		Stmt s = OBTAIN(PRED_ACC("U", X.field(G), WRITE), POSITION(1, 1, 1));
		Set<Permission> perms = extractor.getRequiredPermissions(s);
		assertEquals(set(pred(X.field(G), READ), acc(X.field(G), READ)), perms);
		for (Permission p : perms) {
			assertEquals(1, p.getPosition().getId());
		}
	}

	@Test
	public void test_method_call() {
		Stmt s = CALL("m", Arrays.asList(VARIABLE("x", T), VARIABLE("i", Type.Int)));
		assertEquals(set(acc(X, WRITE), acc(I, WRITE)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_assign_01() {
		Stmt s = ASSIGN(X.field(F), ADD(Y.field(F), I));
		assertEquals(set(acc(X.field(F), WRITE), acc(Y.field(F), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_assign_02() {
		// the target is always written, whatever the source reads
		Expr source = COND(B, X.field(F), Z.field(F));
		Stmt s = ASSIGN(Y.field(F), source);
		Set<Permission> expected = Permission.union(extractor.getRequiredPermissions(source),
				set(acc(Y.field(F), WRITE)));
		assertEquals(expected, extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_fold_01() {
		Stmt s = FOLD(X, WRITE);
		assertEquals(set(acc(X.field(F), WRITE), acc(X.field(G), WRITE), pred(X.field(G), WRITE)),
				extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_fold_02() {
		Stmt s = FOLD(Y, READ);
		assertEquals(set(acc(Y.field(F), READ), acc(Y.field(G), READ), pred(Y.field(G), READ)),
				extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_fold_03() {
		// abstract predicates have nothing to fold
		Stmt s = FOLD(X.field(G), WRITE);
		assertEquals(set(), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_fold_04() {
		Stmt s = FOLD("E", Arrays.<Expr>asList(EN), WRITE, "A");
		assertEquals(set(acc(EN.field(DISCRIMINANT), WRITE), pred(EN.variant(ENUM_A), WRITE)),
				extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_fold_05() {
		Stmt s = FOLD("E", Arrays.<Expr>asList(EN), READ, null);
		assertEquals(set(acc(EN.field(DISCRIMINANT), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_unfold_01() {
		Stmt s = UNFOLD(X, WRITE);
		assertEquals(set(pred(X, WRITE)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_unfold_02() {
		Stmt s = UNFOLD(X.field(G), READ);
		assertEquals(set(pred(X.field(G), READ), acc(X.field(G), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_transfer_perm() {
		Stmt s = TRANSFER_PERM(X.field(F), Y.field(F), false);
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_apply_magic_wand() {
		Expr.MagicWand wand = MAGIC_WAND(EQ(X.field(F), CONST(0)), FIELD_ACC(Y.field(F), WRITE));
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(APPLY_MAGIC_WAND(wand)));
	}

	@Test
	public void test_if_01() {
		List<Stmt> thenStmts = Arrays.asList(ASSIGN(X.field(F), CONST(1)), ASSIGN(Y.field(F), CONST(1)));
		List<Stmt> elseStmts = Arrays.asList(ASSIGN(Y.field(F), CONST(2)), ASSIGN(Z.field(F), CONST(2)));
		Stmt s = IF(B, thenStmts, elseStmts);
		assertEquals(set(acc(Y.field(F), WRITE)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_if_02() {
		// the guard is always required
		List<Stmt> thenStmts = Arrays.asList(ASSIGN(X.field(F), CONST(1)));
		Stmt s = IF(EQ(Z.field(F), CONST(0)), thenStmts, Collections.<Stmt>emptyList());
		assertEquals(set(acc(Z.field(F), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_if_03() {
		// permissions common to both branches are weakened to read when their amounts differ
		List<Stmt> thenStmts = Arrays.asList(ASSIGN(X.field(F), CONST(1)));
		List<Stmt> elseStmts = Arrays.asList(ASSIGN(Y.field(F), X.field(F)));
		Stmt s = IF(B, thenStmts, elseStmts);
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_if_04() {
		List<Stmt> inner = Arrays.asList(IF(B, Arrays.asList(ASSIGN(X.field(F), CONST(1))),
				Arrays.asList(ASSIGN(X.field(F), CONST(2)), ASSIGN(Y.field(F), CONST(2)))));
		Stmt s = IF(B, inner, Arrays.asList(ASSIGN(X.field(F), I)));
		assertEquals(set(acc(X.field(F), WRITE)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_if_05() {
		// a branch needing both amounts of a place keeps write in common with the other branch
		for (int i = 0; i != 20; ++i) {
			Expr v = LOCAL("v" + i, T);
			List<Stmt> thenStmts = Arrays.asList(ASSIGN(v.field(F), CONST(1)));
			List<Stmt> elseStmts = Arrays.asList(ASSIGN(Y.field(F), v.field(F)), ASSIGN(v.field(F), CONST(2)));
			Stmt s = IF(B, thenStmts, elseStmts);
			assertEquals(set(acc(v.field(F), WRITE)), extractor.getRequiredPermissions(s));
		}
	}

	@Test
	public void test_downcast() {
		Stmt s = DOWNCAST(EN, ENUM_A);
		assertEquals(set(acc(EN.field(DISCRIMINANT), READ)), extractor.getRequiredPermissions(s));
	}

	@Test
	public void test_sequence() {
		List<Stmt> stmts = Arrays.asList(ASSIGN(X.field(F), CONST(1)), LABEL("l"), UNFOLD(Y, WRITE));
		assertEquals(set(acc(X.field(F), WRITE), pred(Y, WRITE)), extractor.getRequiredPermissions(stmts));
	}

	@Test
	public void test_method_body() {
		Decl.Method m = METHOD("m", Arrays.asList(VARIABLE("x", T)), Collections.<Decl.Variable>emptyList(),
				Arrays.asList(UNFOLD(X, WRITE), ASSIGN(X.field(F), CONST(0)), FOLD(X, WRITE)));
		Set<Permission> perms = extractor.getRequiredPermissions(m.getBody());
		assertTrue(perms.contains(pred(X, WRITE)));
		assertTrue(perms.contains(acc(X.field(F), WRITE)));
		assertTrue(perms.contains(pred(X.field(G), WRITE)));
	}

	@Test
	public void test_deterministic() {
		Stmt s = IF(EQ(X.field(F), I), Arrays.asList(FOLD(X, WRITE), ASSIGN(Y.field(F), CONST(1))),
				Arrays.asList(FOLD(X, READ), INHALE(FIELD_ACC(Z.field(F), WRITE))));
		Set<Permission> first = extractor.getRequiredPermissions(s);
		Set<Permission> second = extractor.getRequiredPermissions(s);
		Set<Permission> third = new RequiredPermissionsExtractor(predicates()).getRequiredPermissions(s);
		assertEquals(first, second);
		assertEquals(first, third);
	}
}
