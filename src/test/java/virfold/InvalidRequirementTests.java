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

import static org.junit.jupiter.api.Assertions.assertThrows;
import static virfold.Fixtures.*;
import static virfold.core.VirFile.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import virfold.core.VirFile;
import virfold.util.RequiredPermissionsExtractor;

/**
 * Malformed or unsupported constructs which the analysis must reject rather
 * than silently compute a result for.
 */
public class InvalidRequirementTests {
	private static final PermAmount READ = PermAmount.READ;
	private static final PermAmount WRITE = PermAmount.WRITE;

	/**
	 * A statement kind the analysis knows nothing about.
	 */
	private static class Havoc extends AbstractItem implements Stmt {
		public Havoc() {
			super(new Attribute[0]);
		}
	}

	public static Collection<Object[]> data() {
		ArrayList<Object[]> cases = new ArrayList<>();
		Expr let = LET(VARIABLE("k", Type.Int), CONST(1), EQ(LOCAL("k", Type.Int), X.field(F)));
		Expr app = FUNC_APP("make", Collections.<Expr>emptyList(), Collections.<Decl.Variable>emptyList(), T);
		// Unsupported
		cases.add(new Object[] { "let", let, UnsupportedOperationException.class });
		cases.add(new Object[] { "let_in_assert", ASSERT(AND(B, let)), UnsupportedOperationException.class });
		cases.add(new Object[] { "addr_of", ADDR_OF(X, REF_T), UnsupportedOperationException.class });
		cases.add(new Object[] { "snapshot", EQ(SNAP_APP(X), SNAP_APP(Y)), UnsupportedOperationException.class });
		cases.add(new Object[] { "unknown_statement", new Havoc(), UnsupportedOperationException.class });
		// Malformed
		cases.add(new Object[] { "call_with_arguments",
				CALL("m", Arrays.<Expr>asList(X), Collections.<Decl.Variable>emptyList()),
				IllegalArgumentException.class });
		cases.add(new Object[] { "fold_two_arguments", FOLD("T", Arrays.<Expr>asList(X, Y), WRITE, null),
				IllegalArgumentException.class });
		cases.add(new Object[] { "fold_no_arguments", FOLD("T", Collections.<Expr>emptyList(), WRITE, null),
				IllegalArgumentException.class });
		cases.add(new Object[] { "unfold_not_place", UNFOLD("T", Arrays.<Expr>asList(app), WRITE, null),
				IllegalArgumentException.class });
		cases.add(new Object[] { "unfolding_two_arguments",
				UNFOLDING("T", Arrays.<Expr>asList(X, Y), CONST(true), READ, null), IllegalArgumentException.class });
		cases.add(new Object[] { "predicate_access_not_place", PRED_ACC("T", app, READ),
				IllegalArgumentException.class });
		cases.add(new Object[] { "downcast_not_enum", DOWNCAST(B, X, FIELD("enum_A", E_A)),
				IllegalArgumentException.class });
		cases.add(new Object[] { "forall_reference",
				FORALL(Arrays.asList(VARIABLE("v", T)), B), IllegalArgumentException.class });
		cases.add(new Object[] { "exists_type_variable",
				EXISTS(Arrays.asList(VARIABLE("v", TYPE_VAR("Z"))), B), IllegalArgumentException.class });
		cases.add(new Object[] { "unknown_predicate", FOLD(LOCAL("w", TYPED_REF("W")), WRITE),
				IllegalArgumentException.class });
		cases.add(new Object[] { "unknown_variant",
				UNFOLDING("E", Arrays.<Expr>asList(EN), CONST(true), WRITE, "Z"), IllegalArgumentException.class });
		return cases;
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("data")
	public void invalid(String name, VirFile.Item item, Class<? extends Throwable> expected) {
		RequiredPermissionsExtractor extractor = new RequiredPermissionsExtractor(predicates());
		assertThrows(expected, () -> extractor.getRequiredPermissions(item));
	}
}
