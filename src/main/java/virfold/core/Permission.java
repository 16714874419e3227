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

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import virfold.core.VirFile.Expr;
import virfold.core.VirFile.PermAmount;
import virfold.core.VirFile.Position;

/**
 * An access permission held over a place. A permission is either an
 * <em>access</em> permission to the memory location of a place (i.e.
 * <code>acc(x.f)</code>) or a <em>predicate</em> permission for the predicate
 * instance rooted at a place (i.e. <code>T(x.f)</code>). Every permission
 * carries an amount and, optionally, the position of the construct which gave
 * rise to it. Positions are purely diagnostic and do not take part in
 * equality.
 *
 */
public class Permission {

	public enum Kind {
		ACC,
		PRED
	}

	private final Kind kind;
	private final Expr place;
	private final PermAmount amount;
	private final Position position;

	private Permission(Kind kind, Expr place, PermAmount amount, Position position) {
		this.kind = kind;
		this.place = place;
		this.amount = amount;
		this.position = position;
	}

	public static Permission acc(Expr place, PermAmount amount) {
		return new Permission(Kind.ACC, place, amount, null);
	}

	public static Permission acc(Expr place, PermAmount amount, Position position) {
		return new Permission(Kind.ACC, place, amount, position);
	}

	public static Permission pred(Expr place, PermAmount amount) {
		return new Permission(Kind.PRED, place, amount, null);
	}

	public static Permission pred(Expr place, PermAmount amount, Position position) {
		return new Permission(Kind.PRED, place, amount, position);
	}

	public Kind getKind() {
		return kind;
	}

	public Expr getPlace() {
		return place;
	}

	public PermAmount getAmount() {
		return amount;
	}

	public Position getPosition() {
		return position;
	}

	public boolean isAcc() {
		return kind == Kind.ACC;
	}

	public boolean isPred() {
		return kind == Kind.PRED;
	}

	/**
	 * Construct a permission of the same kind and amount over a transformed place.
	 *
	 * @param fn
	 * @return
	 */
	public Permission mapPlace(Function<Expr, Expr> fn) {
		return new Permission(kind, fn.apply(place), amount, position);
	}

	/**
	 * Replace the amount of this permission.
	 *
	 * @param amount
	 * @return
	 */
	public Permission initPermAmount(PermAmount amount) {
		return new Permission(kind, place, amount, position);
	}

	/**
	 * Scale the amount of this permission by a given amount. A write permission
	 * becomes the given amount, whilst a read permission remains read.
	 *
	 * @param amount
	 * @return
	 */
	public Permission updatePermAmount(PermAmount amount) {
		if (this.amount == PermAmount.WRITE) {
			return new Permission(kind, place, amount, position);
		} else {
			return this;
		}
	}

	/**
	 * Attach a position to this permission, unless it already has one.
	 *
	 * @param position
	 * @return
	 */
	public Permission setDefaultPosition(Position position) {
		if (this.position == null) {
			return new Permission(kind, place, amount, position);
		} else {
			return this;
		}
	}

	/**
	 * Check whether this permission has the same kind and place as another,
	 * regardless of their amounts.
	 *
	 * @param other
	 * @return
	 */
	public boolean isSameResource(Permission other) {
		return kind == other.kind && place.equals(other.place);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Permission) {
			Permission p = (Permission) o;
			return kind == p.kind && place.equals(p.place) && amount == p.amount;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind.name(), place, amount.name());
	}

	@Override
	public String toString() {
		if (kind == Kind.ACC) {
			return "acc(" + place + ", " + amount + ")";
		} else {
			return "pred(" + place + ", " + amount + ")";
		}
	}

	// =======================================================
	// Set operations
	// =======================================================

	public static Set<Permission> union(Set<Permission> lhs, Set<Permission> rhs) {
		HashSet<Permission> result = new HashSet<>(lhs);
		result.addAll(rhs);
		return result;
	}

	/**
	 * Remove from <code>lhs</code> every permission for which <code>rhs</code>
	 * holds a permission of the same kind over the same place. Amounts are not
	 * compared.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Set<Permission> difference(Set<Permission> lhs, Set<Permission> rhs) {
		HashSet<Permission> result = new HashSet<>();
		for (Permission p : lhs) {
			if (find(p, rhs) == null) {
				result.add(p);
			}
		}
		return result;
	}

	/**
	 * Retain from <code>lhs</code> those permissions for which <code>rhs</code>
	 * holds a permission of the same kind over the same place. A permission is
	 * retained unchanged when <code>rhs</code> holds it with the same amount;
	 * otherwise only read permission is retained.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Set<Permission> intersection(Set<Permission> lhs, Set<Permission> rhs) {
		HashSet<Permission> result = new HashSet<>();
		for (Permission p : lhs) {
			if (rhs.contains(p)) {
				result.add(p);
			} else if (find(p, rhs) != null) {
				result.add(p.initPermAmount(PermAmount.READ));
			}
		}
		return result;
	}

	private static Permission find(Permission p, Set<Permission> perms) {
		for (Permission q : perms) {
			if (p.isSameResource(q)) {
				return q;
			}
		}
		return null;
	}
}
