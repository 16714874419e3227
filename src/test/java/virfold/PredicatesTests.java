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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static virfold.Fixtures.*;
import static virfold.core.VirFile.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import virfold.core.Predicates;
import virfold.core.VirFile;

public class PredicatesTests {

	@Test
	public void test_of() {
		VirFile file = program();
		file.getDeclarations().add(METHOD("m", Collections.<Decl.Variable>emptyList(),
				Collections.<Decl.Variable>emptyList(), Collections.<Stmt>emptyList()));
		Predicates predicates = Predicates.of(file);
		assertEquals(5, predicates.size());
		assertTrue(predicates.contains("E_A"));
		assertFalse(predicates.contains("m"));
	}

	@Test
	public void test_get() {
		Predicates predicates = predicates();
		assertSame(T_PREDICATE, predicates.get("T"));
		assertSame(E_PREDICATE, predicates.get(E));
		assertSame(REF_T_PREDICATE, predicates.get(R.getType()));
	}

	@Test
	public void test_missing() {
		Predicates predicates = predicates();
		assertThrows(IllegalArgumentException.class, () -> predicates.get("W"));
		assertThrows(IllegalArgumentException.class, () -> predicates.get(Type.Int));
	}

	@Test
	public void test_duplicate() {
		assertThrows(IllegalArgumentException.class,
				() -> new Predicates(Arrays.asList(T_PREDICATE, U_PREDICATE, PREDICATE("T", VARIABLE("self", T), null))));
	}

	@Test
	public void test_immutable() {
		Predicates predicates = predicates();
		assertThrows(UnsupportedOperationException.class, () -> predicates.getNames().remove("T"));
	}

	@Test
	public void test_enum_variant() {
		assertEquals("A", E_PREDICATE.getVariant("A").getName());
		assertSame(E_A_PREDICATE, E_PREDICATE.getVariant("A").getPredicate());
		assertEquals(FIELD("enum_A", E_A), E_PREDICATE.getVariant("A").getField());
		assertThrows(IllegalArgumentException.class, () -> E_PREDICATE.getVariant("Z"));
	}
}
