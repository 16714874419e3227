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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static virfold.Fixtures.*;
import static virfold.core.VirFile.*;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import virfold.core.Permission;
import virfold.util.RequiredPermissionsExtractor;

public class ExpressionRequirementTests {
	private static final PermAmount READ = PermAmount.READ;
	private static final PermAmount WRITE = PermAmount.WRITE;
	private static final Decl.Field ENUM_A = FIELD("enum_A", E_A);
	private static final Decl.Field S = FIELD("s", SEQUENCE(Type.Int));

	private final RequiredPermissionsExtractor extractor = new RequiredPermissionsExtractor(predicates());

	public static Collection<Expr> emptyExpressions() {
		return Arrays.asList(
				CONST(true),
				CONST(42),
				I,
				X,
				OLD("l", X.field(F)),
				MAGIC_WAND(EQ(X.field(F), CONST(0)), FIELD_ACC(Y.field(F), WRITE)),
				INHALE_EXHALE(FIELD_ACC(X.field(F), WRITE), EQ(Y.field(F), CONST(1))),
				ADD(I, CONST(1)),
				FORALL(Arrays.asList(VARIABLE("k", Type.Int)), LT(LOCAL("k", Type.Int), I)));
	}

	@ParameterizedTest
	@MethodSource("emptyExpressions")
	public void test_empty(Expr e) {
		assertEquals(set(), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_field_01() {
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(X.field(F)));
	}

	@Test
	public void test_field_02() {
		// only the outermost field access is required
		Expr e = X.field(G).field(F);
		assertEquals(set(acc(e, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_variant() {
		Expr e = EN.variant(ENUM_A);
		assertEquals(set(acc(e, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_predicate_access_01() {
		Expr e = PRED_ACC("T", X, WRITE);
		assertEquals(set(pred(X, READ), acc(X, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_predicate_access_02() {
		// old places only require the predicate instance
		Expr place = X.field(G).old("l");
		Expr e = PRED_ACC("U", place, READ);
		assertEquals(set(pred(place, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_predicate_access_03() {
		// a label on an inner step is moved to the root of the place
		Expr place = OLD("l", X).field(G);
		Expr e = PRED_ACC("U", place, WRITE);
		assertEquals(set(pred(OLD("l", X.field(G)), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_field_access() {
		Expr e = FIELD_ACC(X.field(F), WRITE);
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_operators() {
		Expr e = NOT(AND(EQ(X.field(F), NEG(Y.field(F))), B));
		assertEquals(set(acc(X.field(F), READ), acc(Y.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_container_op() {
		Expr e = CONTAINER_OP(ContainerOpKind.SEQ_INDEX, X.field(S), Y.field(F));
		assertEquals(set(acc(X.field(S), READ), acc(Y.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_seq() {
		Expr e = SEQ(SEQUENCE(Type.Int), Arrays.<Expr>asList(X.field(F), CONST(1), Y.field(F)));
		assertEquals(set(acc(X.field(F), READ), acc(Y.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_cond() {
		// both arms of a conditional expression are required
		Expr e = COND(EQ(I, CONST(0)), X.field(F), Y.field(F));
		assertEquals(set(acc(X.field(F), READ), acc(Y.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_quantifier_01() {
		Expr k = LOCAL("k", Type.Int);
		Expr e = FORALL(Arrays.asList(VARIABLE("k", Type.Int)), LT(k, X.field(F)));
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_quantifier_02() {
		Expr k = LOCAL("k", Type.Int);
		Expr e = EXISTS(Arrays.asList(VARIABLE("k", Type.Int)),
				CONTAINER_OP(ContainerOpKind.SEQ_CONTAINS, X.field(S), k));
		assertEquals(set(acc(X.field(S), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_unfolding_01() {
		// permissions made available by the unfolding are not required
		Expr e = UNFOLDING(X, EQ(X.field(F), CONST(0)), READ);
		assertEquals(set(pred(X, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_unfolding_02() {
		Expr e = UNFOLDING(X, EQ(X.field(F), Y.field(F)), WRITE);
		assertEquals(set(pred(X, WRITE), acc(Y.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_unfolding_03() {
		Expr body = EQ(EN.variant(ENUM_A).field(A), EN.field(DISCRIMINANT));
		Expr e = UNFOLDING("E", Arrays.<Expr>asList(EN), body, WRITE, "A");
		Set<Permission> perms = extractor.getRequiredPermissions(e);
		Set<Permission> opened = set(acc(EN.field(DISCRIMINANT), WRITE), pred(EN.variant(ENUM_A), WRITE));
		assertTrue(perms.contains(pred(EN, WRITE)));
		for (Permission p : perms) {
			for (Permission q : opened) {
				assertFalse(p.isSameResource(q));
			}
		}
		assertEquals(set(pred(EN, WRITE), acc(EN.variant(ENUM_A).field(A), READ)), perms);
	}

	@Test
	public void test_unfolding_04() {
		// nested unfoldings
		Expr inner = UNFOLDING(X.field(G), EQ(X.field(F), CONST(1)), READ);
		Expr e = UNFOLDING(X, inner, READ);
		assertEquals(set(pred(X, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_func_app_01() {
		// reference arguments require their predicate instance
		Expr e = FUNC_APP("len", Arrays.<Expr>asList(X), Arrays.asList(VARIABLE("v", T)), Type.Int);
		Set<Permission> perms = extractor.getRequiredPermissions(e);
		assertTrue(perms.contains(pred(X, READ)));
		assertEquals(set(pred(X, READ), acc(X, READ)), perms);
	}

	@Test
	public void test_func_app_02() {
		// references are dereferenced first
		Expr target = R.field(VAL_REF);
		Expr e = FUNC_APP("len", Arrays.<Expr>asList(R), Arrays.asList(VARIABLE("v", REF_T)), Type.Int);
		assertEquals(set(acc(target, READ), pred(target, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_func_app_03() {
		// other arguments are unchanged
		Expr e = FUNC_APP("max", Arrays.<Expr>asList(I, X.field(F)),
				Arrays.asList(VARIABLE("a", Type.Int), VARIABLE("b", Type.Int)), Type.Int);
		assertEquals(set(acc(X.field(F), READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_domain_func_app() {
		Expr e = DOMAIN_FUNC_APP("Snap$T", "cons", Arrays.<Expr>asList(Y, CONST(1)),
				Arrays.asList(VARIABLE("v", T), VARIABLE("n", Type.Int)), DOMAIN("Snap$T"));
		assertEquals(set(pred(Y, READ), acc(Y, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_type_variable_argument() {
		Expr v = LOCAL("v", TYPE_VAR("Z"));
		Expr e = FUNC_APP("id", Arrays.asList(v), Arrays.asList(VARIABLE("a", TYPE_VAR("Z"))), TYPE_VAR("Z"));
		assertEquals(set(pred(v, READ), acc(v, READ)), extractor.getRequiredPermissions(e));
	}

	@Test
	public void test_downcast() {
		Expr e = DOWNCAST(B, EN, ENUM_A);
		assertEquals(set(acc(EN.field(DISCRIMINANT), READ)), extractor.getRequiredPermissions(e));
	}
}
