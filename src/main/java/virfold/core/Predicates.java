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
package virfold.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import virfold.core.VirFile.Decl;
import virfold.core.VirFile.Type;

/**
 * The set of predicates known to an analysis, indexed by name. This is fixed
 * once constructed.
 *
 */
public class Predicates {
	private final Map<String, Decl.Predicate> predicates;

	public Predicates(Collection<? extends Decl.Predicate> predicates) {
		HashMap<String, Decl.Predicate> map = new HashMap<>();
		for (Decl.Predicate p : predicates) {
			if (map.containsKey(p.getName())) {
				throw new IllegalArgumentException("duplicate predicate " + p.getName());
			}
			map.put(p.getName(), p);
		}
		this.predicates = Collections.unmodifiableMap(map);
	}

	/**
	 * Construct the registry of all predicates declared in a given file.
	 *
	 * @param file
	 * @return
	 */
	public static Predicates of(VirFile file) {
		List<Decl.Predicate> ps = new ArrayList<>();
		for (Decl d : file.getDeclarations()) {
			if (d instanceof Decl.Predicate) {
				ps.add((Decl.Predicate) d);
			}
		}
		return new Predicates(ps);
	}

	public Decl.Predicate get(String name) {
		Decl.Predicate p = predicates.get(name);
		if (p == null) {
			throw new IllegalArgumentException("unknown predicate " + name);
		}
		return p;
	}

	/**
	 * Get the predicate describing values of a given type.
	 *
	 * @param type
	 * @return
	 */
	public Decl.Predicate get(Type type) {
		return get(type.getName());
	}

	public boolean contains(String name) {
		return predicates.containsKey(name);
	}

	public Set<String> getNames() {
		return predicates.keySet();
	}

	public int size() {
		return predicates.size();
	}
}
