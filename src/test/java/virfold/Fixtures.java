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

import static virfold.core.VirFile.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import virfold.core.Permission;
import virfold.core.Predicates;
import virfold.core.VirFile;

/**
 * A small program shared by the tests. It declares the following predicates:
 *
 * <pre>
 * predicate T(self: Ref(T)) { acc(self.f, write) && acc(self.g, write) && acc(U(self.g), write) }
 * predicate U(self: Ref(U))
 * predicate E(self: Ref(E)) { acc(self.discriminant, write); variant A if self.discriminant == 0: E_A }
 * predicate E_A(self: Ref(E_A)) { acc(self.a, write) }
 * predicate ref$T(self: Ref(ref$T)) { acc(self.val_ref, write) && acc(T(self.val_ref), write) }
 * </pre>
 */
public class Fixtures {
	public static final Type.TypedRef T = TYPED_REF("T");
	public static final Type.TypedRef U = TYPED_REF("U");
	public static final Type.TypedRef E = TYPED_REF("E");
	public static final Type.TypedRef E_A = TYPED_REF("E_A");
	public static final Type.TypedRef REF_T = TYPED_REF("ref$T");

	public static final Decl.Field F = FIELD("f", Type.Int);
	public static final Decl.Field G = FIELD("g", U);
	public static final Decl.Field A = FIELD("a", Type.Int);
	public static final Decl.Field DISCRIMINANT = FIELD("discriminant", Type.Int);
	public static final Decl.Field VAL_REF = FIELD(REFERENCE_FIELD, T);

	public static final Expr.Local X = LOCAL("x", T);
	public static final Expr.Local Y = LOCAL("y", T);
	public static final Expr.Local B = LOCAL("b", Type.Bool);
	public static final Expr.Local I = LOCAL("i", Type.Int);
	public static final Expr.Local EN = LOCAL("e", E);
	public static final Expr.Local R = LOCAL("r", REF_T);

	public static final Decl.StructPredicate T_PREDICATE;
	public static final Decl.StructPredicate U_PREDICATE;
	public static final Decl.StructPredicate E_A_PREDICATE;
	public static final Decl.EnumPredicate E_PREDICATE;
	public static final Decl.StructPredicate REF_T_PREDICATE;

	static {
		Decl.Variable self = VARIABLE("self", T);
		Expr s = LOCAL(self);
		T_PREDICATE = PREDICATE("T", self, AND(FIELD_ACC(s.field(F), PermAmount.WRITE),
				AND(FIELD_ACC(s.field(G), PermAmount.WRITE), PRED_ACC("U", s.field(G), PermAmount.WRITE))));
		U_PREDICATE = PREDICATE("U", VARIABLE("self", U), null);
		Decl.Variable selfA = VARIABLE("self", E_A);
		E_A_PREDICATE = PREDICATE("E_A", selfA, FIELD_ACC(LOCAL(selfA).field(A), PermAmount.WRITE));
		Decl.Variable selfE = VARIABLE("self", E);
		E_PREDICATE = ENUM_PREDICATE("E", selfE, DISCRIMINANT, Arrays.asList(
				ENUM_VARIANT(EQ(LOCAL(selfE).field(DISCRIMINANT), CONST(0)), "A", E_A_PREDICATE)));
		Decl.Variable selfR = VARIABLE("self", REF_T);
		Expr r = LOCAL(selfR).field(VAL_REF);
		REF_T_PREDICATE = PREDICATE("ref$T", selfR,
				AND(FIELD_ACC(r, PermAmount.WRITE), PRED_ACC("T", r, PermAmount.WRITE)));
	}

	public static VirFile program() {
		return new VirFile(Arrays.asList(T_PREDICATE, U_PREDICATE, E_PREDICATE, E_A_PREDICATE, REF_T_PREDICATE));
	}

	public static Predicates predicates() {
		return Predicates.of(program());
	}

	public static Permission acc(Expr place, PermAmount amount) {
		return Permission.acc(place, amount);
	}

	public static Permission pred(Expr place, PermAmount amount) {
		return Permission.pred(place, amount);
	}

	public static Set<Permission> set(Permission... permissions) {
		return new HashSet<>(Arrays.asList(permissions));
	}
}
