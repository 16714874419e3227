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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import virfold.io.VirFilePrinter;
import virfold.util.FootprintExtractor;
import virfold.util.PlaceReplacer;

/**
 * An in-memory representation of a VIR program. VIR is the intermediate
 * verification language handed to the fold/unfold synthesis: a
 * separation-logic flavoured language of predicates, methods, statements and
 * (pure or permission-carrying) expressions. All nodes are immutable once
 * constructed; analyses derive new values rather than updating trees.
 */
public class VirFile {

	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public VirFile() {
		this.declarations = new ArrayList<>();
	}

	public VirFile(Collection<? extends Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();

		/**
		 * Get the source position attached to this item, or <code>null</code> if
		 * there is none.
		 *
		 * @return
		 */
		public Position getPosition();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		@Override
		public Position getPosition() {
			return getAttribute(Position.class);
		}

		public boolean isFalse() {
			return (this instanceof Expr.Const) && java.lang.Boolean.FALSE.equals(((Expr.Const) this).getValue());
		}

		public boolean isTrue() {
			return (this instanceof Expr.Const) && java.lang.Boolean.TRUE.equals(((Expr.Const) this).getValue());
		}

		@Override
		public String toString() {
			return VirFilePrinter.toString(this);
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * A named resource specification. Predicates are looked up by name (which
		 * coincides with the name of the <code>TypedRef</code> type they describe)
		 * and expose the place used for "self" inside their body, along with the
		 * footprint that body denotes when unfolded.
		 */
		public interface Predicate extends Decl {
			public String getName();

			/**
			 * The placeholder place used within the body of this predicate. This is
			 * substituted by the concrete place at a fold or unfolding site.
			 *
			 * @return
			 */
			public Expr getSelfPlace();

			/**
			 * Determine the permissions held by an unfolded instance of this predicate,
			 * expressed over the self place.
			 *
			 * @param variant The enum variant being unfolded, or <code>null</code>.
			 * @return
			 */
			public Set<Permission> getBodyFootprint(String variant);
		}

		/**
		 * A struct-like predicate whose body is a single assertion over the self
		 * place. A predicate without body is abstract and has an empty footprint.
		 *
		 */
		public static class StructPredicate extends AbstractItem implements Predicate {
			private final String name;
			private final Variable self;
			private final Expr body;

			public StructPredicate(String name, Variable self, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.self = self;
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public Variable getSelf() {
				return self;
			}

			public Expr getBody() {
				return body;
			}

			public boolean isAbstract() {
				return body == null;
			}

			@Override
			public Expr getSelfPlace() {
				return LOCAL(self);
			}

			@Override
			public Set<Permission> getBodyFootprint(String variant) {
				if (body == null) {
					return new HashSet<>();
				} else {
					return new FootprintExtractor().getFootprint(body);
				}
			}
		}

		/**
		 * A predicate describing an enumeration. The body owns the discriminant field
		 * and, depending on its value, exactly one of the variant predicates. The
		 * variants are reached through dedicated variant fields named
		 * <code>enum_NAME</code>.
		 *
		 */
		public static class EnumPredicate extends AbstractItem implements Predicate {
			private final String name;
			private final Variable self;
			private final Field discriminantField;
			private final List<EnumVariant> variants;

			public EnumPredicate(String name, Variable self, Field discriminantField, List<EnumVariant> variants,
					Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.self = self;
				this.discriminantField = discriminantField;
				this.variants = new ArrayList<>(variants);
			}

			@Override
			public String getName() {
				return name;
			}

			public Variable getSelf() {
				return self;
			}

			public Field getDiscriminantField() {
				return discriminantField;
			}

			public List<EnumVariant> getVariants() {
				return Collections.unmodifiableList(variants);
			}

			public EnumVariant getVariant(String variant) {
				for (int i = 0; i != variants.size(); ++i) {
					EnumVariant ith = variants.get(i);
					if (ith.getName().equals(variant)) {
						return ith;
					}
				}
				throw new IllegalArgumentException("unknown variant " + variant + " of enum predicate " + name);
			}

			@Override
			public Expr getSelfPlace() {
				return LOCAL(self);
			}

			@Override
			public Set<Permission> getBodyFootprint(String variant) {
				Expr place = getSelfPlace();
				HashSet<Permission> perms = new HashSet<>();
				perms.add(Permission.acc(place.field(discriminantField), PermAmount.WRITE));
				if (variant != null) {
					EnumVariant v = getVariant(variant);
					perms.add(Permission.pred(place.variant(v.getField()), PermAmount.WRITE));
				}
				return perms;
			}
		}

		public static class EnumVariant extends AbstractItem implements Item {
			private final Expr guard;
			private final String name;
			private final StructPredicate predicate;

			public EnumVariant(Expr guard, String name, StructPredicate predicate, Attribute... attributes) {
				super(attributes);
				this.guard = guard;
				this.name = name;
				this.predicate = predicate;
			}

			public Expr getGuard() {
				return guard;
			}

			public String getName() {
				return name;
			}

			public StructPredicate getPredicate() {
				return predicate;
			}

			/**
			 * The field through which the payload of this variant is reached from the
			 * enum place.
			 *
			 * @return
			 */
			public Field getField() {
				return FIELD("enum_" + name, TYPED_REF(predicate.getName()));
			}
		}

		public static class Method extends AbstractItem implements Decl {
			private final String name;
			private final List<Variable> parameters;
			private final List<Variable> returns;
			private final List<Stmt> body;

			public Method(String name, List<Variable> parameters, List<Variable> returns, List<Stmt> body,
					Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = new ArrayList<>(returns);
				this.body = new ArrayList<>(body);
			}

			public String getName() {
				return name;
			}

			public List<Variable> getParameters() {
				return parameters;
			}

			public List<Variable> getReturns() {
				return returns;
			}

			public List<Stmt> getBody() {
				return body;
			}
		}

		/**
		 * A typed local variable. Local variables appear as method parameters, as
		 * the "self" of a predicate and as variables bound by quantifiers or
		 * let-expressions.
		 */
		public static class Variable extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Variable(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Variable) {
					Variable v = (Variable) o;
					return name.equals(v.name) && type.equals(v.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ type.hashCode();
			}
		}

		public static class Field extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Field(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Field) {
					Field f = (Field) o;
					return name.equals(f.name) && type.equals(f.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ type.hashCode();
			}
		}
	}

	// =========================================================================
	// Permission amounts and operators
	// =========================================================================

	public enum PermAmount {
		READ("read"),
		WRITE("write");

		private final String text;

		PermAmount(String text) {
			this.text = text;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	public enum UnaryOpKind {
		NOT("!"),
		MINUS("-");

		private final String symbol;

		UnaryOpKind(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public enum BinaryOpKind {
		EQ("=="),
		NE("!="),
		GT(">"),
		GE(">="),
		LT("<"),
		LE("<="),
		ADD("+"),
		SUB("-"),
		MUL("*"),
		DIV("\\"),
		MOD("%"),
		AND("&&"),
		OR("||"),
		IMPLIES("==>");

		private final String symbol;

		BinaryOpKind(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		public boolean isArithmetic() {
			switch (this) {
			case ADD:
			case SUB:
			case MUL:
			case DIV:
			case MOD:
				return true;
			default:
				return false;
			}
		}
	}

	public enum ContainerOpKind {
		SEQ_INDEX,
		SEQ_CONCAT,
		SEQ_CONTAINS;
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Comment extends AbstractItem implements Stmt {
			private final String message;

			private Comment(String message, Attribute[] attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		public static class Label extends AbstractItem implements Stmt {
			private final String label;

			private Label(String label, Attribute[] attributes) {
				super(attributes);
				this.label = label;
			}

			public String getLabel() {
				return label;
			}
		}

		public static class Inhale extends AbstractItem implements Stmt {
			private final Expr expr;

			private Inhale(Expr expr, Attribute[] attributes) {
				super(attributes);
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		public static class Exhale extends AbstractItem implements Stmt {
			private final Expr expr;

			private Exhale(Expr expr, Attribute[] attributes) {
				super(attributes);
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr expr;

			private Assert(Expr expr, Attribute[] attributes) {
				super(attributes);
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		/**
		 * Obtain the permissions described by an expression, folding and unfolding
		 * as necessary. Only meaningful to the fold/unfold synthesis itself.
		 */
		public static class Obtain extends AbstractItem implements Stmt {
			private final Expr expr;

			private Obtain(Expr expr, Attribute[] attributes) {
				super(attributes);
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		public static class MethodCall extends AbstractItem implements Stmt {
			private final String name;
			private final List<Expr> arguments;
			private final List<Decl.Variable> targets;

			private MethodCall(String name, Collection<Expr> arguments, Collection<Decl.Variable> targets,
					Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
				this.targets = new ArrayList<>(targets);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public List<Decl.Variable> getTargets() {
				return targets;
			}
		}

		public static class Assign extends AbstractItem implements Stmt {
			private final Expr target;
			private final Expr source;

			private Assign(Expr target, Expr source, Attribute[] attributes) {
				super(attributes);
				this.target = target;
				this.source = source;
			}

			public Expr getTarget() {
				return target;
			}

			public Expr getSource() {
				return source;
			}
		}

		public static class Fold extends AbstractItem implements Stmt {
			private final String predicateName;
			private final List<Expr> arguments;
			private final PermAmount permission;
			private final String variant;

			private Fold(String predicateName, Collection<Expr> arguments, PermAmount permission, String variant,
					Attribute[] attributes) {
				super(attributes);
				this.predicateName = predicateName;
				this.arguments = new ArrayList<>(arguments);
				this.permission = permission;
				this.variant = variant;
			}

			public String getPredicateName() {
				return predicateName;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public PermAmount getPermission() {
				return permission;
			}

			public String getVariant() {
				return variant;
			}
		}

		public static class Unfold extends AbstractItem implements Stmt {
			private final String predicateName;
			private final List<Expr> arguments;
			private final PermAmount permission;
			private final String variant;

			private Unfold(String predicateName, Collection<Expr> arguments, PermAmount permission, String variant,
					Attribute[] attributes) {
				super(attributes);
				this.predicateName = predicateName;
				this.arguments = new ArrayList<>(arguments);
				this.permission = permission;
				this.variant = variant;
			}

			public String getPredicateName() {
				return predicateName;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public PermAmount getPermission() {
				return permission;
			}

			public String getVariant() {
				return variant;
			}
		}

		public static class BeginFrame extends AbstractItem implements Stmt {
			private BeginFrame(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class EndFrame extends AbstractItem implements Stmt {
			private EndFrame(Attribute[] attributes) {
				super(attributes);
			}
		}

		/**
		 * Move (or copy, when not <code>unchecked</code>) the permissions of the
		 * right-hand place to the left-hand one.
		 */
		public static class TransferPerm extends AbstractItem implements Stmt {
			private final Expr left;
			private final Expr right;
			private final boolean unchecked;

			private TransferPerm(Expr left, Expr right, boolean unchecked, Attribute[] attributes) {
				super(attributes);
				this.left = left;
				this.right = right;
				this.unchecked = unchecked;
			}

			public Expr getLeft() {
				return left;
			}

			public Expr getRight() {
				return right;
			}

			public boolean isUnchecked() {
				return unchecked;
			}
		}

		public static class PackageMagicWand extends AbstractItem implements Stmt {
			private final Expr.MagicWand wand;
			private final List<Stmt> body;
			private final String label;
			private final List<Decl.Variable> variables;

			private PackageMagicWand(Expr.MagicWand wand, Collection<Stmt> body, String label,
					Collection<Decl.Variable> variables, Attribute[] attributes) {
				super(attributes);
				this.wand = wand;
				this.body = new ArrayList<>(body);
				this.label = label;
				this.variables = new ArrayList<>(variables);
			}

			public Expr.MagicWand getWand() {
				return wand;
			}

			public List<Stmt> getBody() {
				return body;
			}

			public String getLabel() {
				return label;
			}

			public List<Decl.Variable> getVariables() {
				return variables;
			}
		}

		public static class ApplyMagicWand extends AbstractItem implements Stmt {
			private final Expr.MagicWand wand;

			private ApplyMagicWand(Expr.MagicWand wand, Attribute[] attributes) {
				super(attributes);
				this.wand = wand;
			}

			public Expr.MagicWand getWand() {
				return wand;
			}
		}

		public static class ExpireBorrows extends AbstractItem implements Stmt {
			private final List<String> borrows;

			private ExpireBorrows(Collection<String> borrows, Attribute[] attributes) {
				super(attributes);
				this.borrows = new ArrayList<>(borrows);
			}

			public List<String> getBorrows() {
				return borrows;
			}
		}

		public static class If extends AbstractItem implements Stmt {
			private final Expr guard;
			private final List<Stmt> thenStmts;
			private final List<Stmt> elseStmts;

			private If(Expr guard, Collection<Stmt> thenStmts, Collection<Stmt> elseStmts, Attribute[] attributes) {
				super(attributes);
				this.guard = guard;
				this.thenStmts = new ArrayList<>(thenStmts);
				this.elseStmts = new ArrayList<>(elseStmts);
			}

			public Expr getGuard() {
				return guard;
			}

			public List<Stmt> getThenStmts() {
				return thenStmts;
			}

			public List<Stmt> getElseStmts() {
				return elseStmts;
			}
		}

		/**
		 * Inform the verifier that the enum at <code>base</code> holds the variant
		 * reached through <code>field</code>.
		 */
		public static class Downcast extends AbstractItem implements Stmt {
			private final Expr base;
			private final Decl.Field field;

			private Downcast(Expr base, Decl.Field field, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.field = field;
			}

			public Expr getBase() {
				return base;
			}

			public Decl.Field getField() {
				return field;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public Type getType();

		/**
		 * Check whether this expression denotes a storage location, i.e. it is a
		 * chain of field, variant and address-of steps rooted at a local variable
		 * (optionally under an old label).
		 *
		 * @return
		 */
		public boolean isPlace();

		/**
		 * Get the label of the old state this place is evaluated in, or
		 * <code>null</code> if it refers to the current state.
		 *
		 * @return
		 */
		public String getLabel();

		public boolean isOld();

		/**
		 * Construct the same place evaluated in the state at the given label. Any
		 * existing label is replaced.
		 *
		 * @param label
		 * @return
		 */
		public Expr old(String label);

		public Expr field(Decl.Field field);

		public Expr variant(Decl.Field field);

		/**
		 * If this place is a reference, construct the place of the referenced value.
		 *
		 * @return The dereferenced place, or <code>null</code> if this place is not
		 *         a reference.
		 */
		public Expr tryDeref();

		/**
		 * Substitute every occurrence of <code>target</code> within this expression
		 * by <code>replacement</code>.
		 *
		 * @param target
		 * @param replacement
		 * @return
		 */
		public Expr replacePlace(Expr target, Expr replacement);

		public interface Quantifier extends Expr {
			public List<Decl.Variable> getVariables();

			public Expr getBody();
		}

		public interface Application extends Expr {
			public String getName();

			public List<Expr> getArguments();
		}

		public static abstract class AbstractExpr extends AbstractItem implements Expr {

			public AbstractExpr(Attribute[] attributes) {
				super(attributes);
			}

			@Override
			public boolean isPlace() {
				return false;
			}

			@Override
			public String getLabel() {
				return null;
			}

			@Override
			public boolean isOld() {
				return getLabel() != null;
			}

			@Override
			public Expr old(String label) {
				if (!isPlace()) {
					throw new IllegalArgumentException("expected place, found " + this);
				}
				return new LabelledOld(label, removeLabel(), getAttributes());
			}

			/**
			 * Strip old labels from this place.
			 *
			 * @return
			 */
			protected Expr removeLabel() {
				return this;
			}

			@Override
			public Expr field(Decl.Field field) {
				return new Field(this, field, getAttributes());
			}

			@Override
			public Expr variant(Decl.Field field) {
				return new Variant(this, field, getAttributes());
			}

			@Override
			public Expr tryDeref() {
				Type type = getType();
				if (type instanceof Type.TypedRef) {
					String name = type.getName();
					if (name.startsWith(REFERENCE_PREFIX)) {
						String target = name.substring(REFERENCE_PREFIX.length());
						return field(FIELD(REFERENCE_FIELD, TYPED_REF(target)));
					}
				}
				return null;
			}

			@Override
			public Expr replacePlace(Expr target, Expr replacement) {
				return new PlaceReplacer(target, replacement).visitExpression(this);
			}
		}

		public static class Local extends AbstractExpr {
			private final Decl.Variable variable;

			private Local(Decl.Variable variable, Attribute[] attributes) {
				super(attributes);
				this.variable = variable;
			}

			public Decl.Variable getVariable() {
				return variable;
			}

			@Override
			public Type getType() {
				return variable.getType();
			}

			@Override
			public boolean isPlace() {
				return true;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Local && variable.equals(((Local) o).variable);
			}

			@Override
			public int hashCode() {
				return variable.hashCode();
			}
		}

		public static class Field extends AbstractExpr {
			private final Expr base;
			private final Decl.Field field;

			private Field(Expr base, Decl.Field field, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.field = field;
			}

			public Expr getBase() {
				return base;
			}

			public Decl.Field getField() {
				return field;
			}

			@Override
			public Type getType() {
				return field.getType();
			}

			@Override
			public boolean isPlace() {
				return base.isPlace();
			}

			@Override
			public String getLabel() {
				return base.getLabel();
			}

			@Override
			protected Expr removeLabel() {
				return new Field(((AbstractExpr) base).removeLabel(), field, getAttributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Field) {
					Field e = (Field) o;
					return base.equals(e.base) && field.equals(e.field);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 31 * base.hashCode() + field.hashCode();
			}
		}

		/**
		 * Access the payload of an enum variant. Variant steps are places just like
		 * field steps.
		 */
		public static class Variant extends AbstractExpr {
			private final Expr base;
			private final Decl.Field field;

			private Variant(Expr base, Decl.Field field, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.field = field;
			}

			public Expr getBase() {
				return base;
			}

			public Decl.Field getField() {
				return field;
			}

			@Override
			public Type getType() {
				return field.getType();
			}

			@Override
			public boolean isPlace() {
				return base.isPlace();
			}

			@Override
			public String getLabel() {
				return base.getLabel();
			}

			@Override
			protected Expr removeLabel() {
				return new Variant(((AbstractExpr) base).removeLabel(), field, getAttributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Variant) {
					Variant e = (Variant) o;
					return base.equals(e.base) && field.equals(e.field);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 37 * base.hashCode() + field.hashCode();
			}
		}

		public static class AddrOf extends AbstractExpr {
			private final Expr base;
			private final Type type;

			private AddrOf(Expr base, Type type, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.type = type;
			}

			public Expr getBase() {
				return base;
			}

			@Override
			public Type getType() {
				return type;
			}

			@Override
			public boolean isPlace() {
				return base.isPlace();
			}

			@Override
			public String getLabel() {
				return base.getLabel();
			}

			@Override
			protected Expr removeLabel() {
				return new AddrOf(((AbstractExpr) base).removeLabel(), type, getAttributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof AddrOf) {
					AddrOf e = (AddrOf) o;
					return base.equals(e.base) && type.equals(e.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 41 * base.hashCode() + type.hashCode();
			}
		}

		public static class LabelledOld extends AbstractExpr {
			private final String label;
			private final Expr base;

			private LabelledOld(String label, Expr base, Attribute[] attributes) {
				super(attributes);
				this.label = label;
				this.base = base;
			}

			@Override
			public String getLabel() {
				return label;
			}

			public Expr getBase() {
				return base;
			}

			@Override
			public Type getType() {
				return base.getType();
			}

			@Override
			public boolean isPlace() {
				return base.isPlace();
			}

			@Override
			protected Expr removeLabel() {
				return ((AbstractExpr) base).removeLabel();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof LabelledOld) {
					LabelledOld e = (LabelledOld) o;
					return label.equals(e.label) && base.equals(e.base);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 43 * label.hashCode() + base.hashCode();
			}
		}

		/**
		 * A boolean or integer constant.
		 */
		public static class Const extends AbstractExpr {
			private final Object value;

			private Const(Object value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public Object getValue() {
				return value;
			}

			@Override
			public Type getType() {
				return (value instanceof java.lang.Boolean) ? Type.Bool : Type.Int;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Const && value.equals(((Const) o).value);
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}
		}

		public static class MagicWand extends AbstractExpr {
			private final Expr left;
			private final Expr right;
			private final String borrow;

			private MagicWand(Expr left, Expr right, String borrow, Attribute[] attributes) {
				super(attributes);
				this.left = left;
				this.right = right;
				this.borrow = borrow;
			}

			public Expr getLeft() {
				return left;
			}

			public Expr getRight() {
				return right;
			}

			/**
			 * The borrow this wand was created for, or <code>null</code>.
			 *
			 * @return
			 */
			public String getBorrow() {
				return borrow;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof MagicWand) {
					MagicWand e = (MagicWand) o;
					return left.equals(e.left) && right.equals(e.right) && Objects.equals(borrow, e.borrow);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(left, right, borrow);
			}
		}

		public static class PredicateAccessPredicate extends AbstractExpr {
			private final String predicateName;
			private final Expr argument;
			private final PermAmount permission;

			private PredicateAccessPredicate(String predicateName, Expr argument, PermAmount permission,
					Attribute[] attributes) {
				super(attributes);
				this.predicateName = predicateName;
				this.argument = argument;
				this.permission = permission;
			}

			public String getPredicateName() {
				return predicateName;
			}

			public Expr getArgument() {
				return argument;
			}

			public PermAmount getPermission() {
				return permission;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof PredicateAccessPredicate) {
					PredicateAccessPredicate e = (PredicateAccessPredicate) o;
					return predicateName.equals(e.predicateName) && argument.equals(e.argument)
							&& permission == e.permission;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(predicateName, argument, permission.name());
			}
		}

		public static class FieldAccessPredicate extends AbstractExpr {
			private final Expr base;
			private final PermAmount permission;

			private FieldAccessPredicate(Expr base, PermAmount permission, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.permission = permission;
			}

			public Expr getBase() {
				return base;
			}

			public PermAmount getPermission() {
				return permission;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof FieldAccessPredicate) {
					FieldAccessPredicate e = (FieldAccessPredicate) o;
					return base.equals(e.base) && permission == e.permission;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(base, permission.name());
			}
		}

		public static class UnaryOp extends AbstractExpr {
			private final UnaryOpKind kind;
			private final Expr argument;

			private UnaryOp(UnaryOpKind kind, Expr argument, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
				this.argument = argument;
			}

			public UnaryOpKind getKind() {
				return kind;
			}

			public Expr getArgument() {
				return argument;
			}

			@Override
			public Type getType() {
				return kind == UnaryOpKind.NOT ? Type.Bool : argument.getType();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof UnaryOp) {
					UnaryOp e = (UnaryOp) o;
					return kind == e.kind && argument.equals(e.argument);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(kind.name(), argument);
			}
		}

		public static class BinOp extends AbstractExpr {
			private final BinaryOpKind kind;
			private final Expr left;
			private final Expr right;

			private BinOp(BinaryOpKind kind, Expr left, Expr right, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
				this.left = left;
				this.right = right;
			}

			public BinaryOpKind getKind() {
				return kind;
			}

			public Expr getLeft() {
				return left;
			}

			public Expr getRight() {
				return right;
			}

			@Override
			public Type getType() {
				return kind.isArithmetic() ? left.getType() : Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof BinOp) {
					BinOp e = (BinOp) o;
					return kind == e.kind && left.equals(e.left) && right.equals(e.right);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(kind.name(), left, right);
			}
		}

		public static class ContainerOp extends AbstractExpr {
			private final ContainerOpKind kind;
			private final Expr left;
			private final Expr right;

			private ContainerOp(ContainerOpKind kind, Expr left, Expr right, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
				this.left = left;
				this.right = right;
			}

			public ContainerOpKind getKind() {
				return kind;
			}

			public Expr getLeft() {
				return left;
			}

			public Expr getRight() {
				return right;
			}

			@Override
			public Type getType() {
				switch (kind) {
				case SEQ_INDEX:
					Type type = left.getType();
					return (type instanceof Type.Sequence) ? ((Type.Sequence) type).getElement() : type;
				case SEQ_CONCAT:
					return left.getType();
				default:
					return Type.Bool;
				}
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof ContainerOp) {
					ContainerOp e = (ContainerOp) o;
					return kind == e.kind && left.equals(e.left) && right.equals(e.right);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(kind.name(), left, right);
			}
		}

		public static class Seq extends AbstractExpr {
			private final Type type;
			private final List<Expr> elements;

			private Seq(Type type, Collection<Expr> elements, Attribute[] attributes) {
				super(attributes);
				this.type = type;
				this.elements = new ArrayList<>(elements);
			}

			public List<Expr> getElements() {
				return elements;
			}

			@Override
			public Type getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Seq) {
					Seq e = (Seq) o;
					return type.equals(e.type) && elements.equals(e.elements);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(type, elements);
			}
		}

		/**
		 * Evaluate <code>base</code> in a state where the predicate instance over
		 * the (single) argument has been temporarily unfolded.
		 */
		public static class Unfolding extends AbstractExpr {
			private final String predicateName;
			private final List<Expr> arguments;
			private final Expr base;
			private final PermAmount permission;
			private final String variant;

			private Unfolding(String predicateName, Collection<Expr> arguments, Expr base, PermAmount permission,
					String variant, Attribute[] attributes) {
				super(attributes);
				this.predicateName = predicateName;
				this.arguments = new ArrayList<>(arguments);
				this.base = base;
				this.permission = permission;
				this.variant = variant;
			}

			public String getPredicateName() {
				return predicateName;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public Expr getBase() {
				return base;
			}

			public PermAmount getPermission() {
				return permission;
			}

			public String getVariant() {
				return variant;
			}

			@Override
			public Type getType() {
				return base.getType();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Unfolding) {
					Unfolding e = (Unfolding) o;
					return predicateName.equals(e.predicateName) && arguments.equals(e.arguments)
							&& base.equals(e.base) && permission == e.permission && Objects.equals(variant, e.variant);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(predicateName, arguments, base, permission.name(), variant);
			}
		}

		public static class Cond extends AbstractExpr {
			private final Expr guard;
			private final Expr thenExpr;
			private final Expr elseExpr;

			private Cond(Expr guard, Expr thenExpr, Expr elseExpr, Attribute[] attributes) {
				super(attributes);
				this.guard = guard;
				this.thenExpr = thenExpr;
				this.elseExpr = elseExpr;
			}

			public Expr getGuard() {
				return guard;
			}

			public Expr getThenExpr() {
				return thenExpr;
			}

			public Expr getElseExpr() {
				return elseExpr;
			}

			@Override
			public Type getType() {
				return thenExpr.getType();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Cond) {
					Cond e = (Cond) o;
					return guard.equals(e.guard) && thenExpr.equals(e.thenExpr) && elseExpr.equals(e.elseExpr);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(guard, thenExpr, elseExpr);
			}
		}

		public static class ForAll extends AbstractExpr implements Quantifier {
			private final List<Decl.Variable> variables;
			private final Expr body;

			private ForAll(Collection<Decl.Variable> variables, Expr body, Attribute[] attributes) {
				super(attributes);
				this.variables = new ArrayList<>(variables);
				this.body = body;
			}

			@Override
			public List<Decl.Variable> getVariables() {
				return variables;
			}

			@Override
			public Expr getBody() {
				return body;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof ForAll) {
					ForAll e = (ForAll) o;
					return variables.equals(e.variables) && body.equals(e.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(variables, body);
			}
		}

		public static class Exists extends AbstractExpr implements Quantifier {
			private final List<Decl.Variable> variables;
			private final Expr body;

			private Exists(Collection<Decl.Variable> variables, Expr body, Attribute[] attributes) {
				super(attributes);
				this.variables = new ArrayList<>(variables);
				this.body = body;
			}

			@Override
			public List<Decl.Variable> getVariables() {
				return variables;
			}

			@Override
			public Expr getBody() {
				return body;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Exists) {
					Exists e = (Exists) o;
					return variables.equals(e.variables) && body.equals(e.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(variables, body) + 1;
			}
		}

		public static class LetExpr extends AbstractExpr {
			private final Decl.Variable variable;
			private final Expr def;
			private final Expr body;

			private LetExpr(Decl.Variable variable, Expr def, Expr body, Attribute[] attributes) {
				super(attributes);
				this.variable = variable;
				this.def = def;
				this.body = body;
			}

			public Decl.Variable getVariable() {
				return variable;
			}

			public Expr getDef() {
				return def;
			}

			public Expr getBody() {
				return body;
			}

			@Override
			public Type getType() {
				return body.getType();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof LetExpr) {
					LetExpr e = (LetExpr) o;
					return variable.equals(e.variable) && def.equals(e.def) && body.equals(e.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(variable, def, body);
			}
		}

		public static class FuncApp extends AbstractExpr implements Application {
			private final String name;
			private final List<Expr> arguments;
			private final List<Decl.Variable> formalArguments;
			private final Type returnType;

			private FuncApp(String name, Collection<Expr> arguments, Collection<Decl.Variable> formalArguments,
					Type returnType, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
				this.formalArguments = new ArrayList<>(formalArguments);
				this.returnType = returnType;
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public List<Expr> getArguments() {
				return arguments;
			}

			public List<Decl.Variable> getFormalArguments() {
				return formalArguments;
			}

			@Override
			public Type getType() {
				return returnType;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof FuncApp) {
					FuncApp e = (FuncApp) o;
					return name.equals(e.name) && arguments.equals(e.arguments)
							&& formalArguments.equals(e.formalArguments) && returnType.equals(e.returnType);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(name, arguments, returnType);
			}
		}

		public static class DomainFuncApp extends AbstractExpr implements Application {
			private final String domainName;
			private final String name;
			private final List<Expr> arguments;
			private final List<Decl.Variable> formalArguments;
			private final Type returnType;

			private DomainFuncApp(String domainName, String name, Collection<Expr> arguments,
					Collection<Decl.Variable> formalArguments, Type returnType, Attribute[] attributes) {
				super(attributes);
				this.domainName = domainName;
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
				this.formalArguments = new ArrayList<>(formalArguments);
				this.returnType = returnType;
			}

			public String getDomainName() {
				return domainName;
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public List<Expr> getArguments() {
				return arguments;
			}

			public List<Decl.Variable> getFormalArguments() {
				return formalArguments;
			}

			@Override
			public Type getType() {
				return returnType;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof DomainFuncApp) {
					DomainFuncApp e = (DomainFuncApp) o;
					return domainName.equals(e.domainName) && name.equals(e.name) && arguments.equals(e.arguments)
							&& formalArguments.equals(e.formalArguments) && returnType.equals(e.returnType);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(domainName, name, arguments, returnType);
			}
		}

		/**
		 * An assertion that means <code>inhale</code> when inhaled and
		 * <code>exhale</code> when exhaled.
		 */
		public static class InhaleExhale extends AbstractExpr {
			private final Expr inhale;
			private final Expr exhale;

			private InhaleExhale(Expr inhale, Expr exhale, Attribute[] attributes) {
				super(attributes);
				this.inhale = inhale;
				this.exhale = exhale;
			}

			public Expr getInhale() {
				return inhale;
			}

			public Expr getExhale() {
				return exhale;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof InhaleExhale) {
					InhaleExhale e = (InhaleExhale) o;
					return inhale.equals(e.inhale) && exhale.equals(e.exhale);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(inhale, exhale);
			}
		}

		/**
		 * Evaluate <code>base</code> knowing that <code>enumPlace</code> holds the
		 * variant reached through <code>field</code>.
		 */
		public static class Downcast extends AbstractExpr {
			private final Expr base;
			private final Expr enumPlace;
			private final Decl.Field field;

			private Downcast(Expr base, Expr enumPlace, Decl.Field field, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.enumPlace = enumPlace;
				this.field = field;
			}

			public Expr getBase() {
				return base;
			}

			public Expr getEnumPlace() {
				return enumPlace;
			}

			public Decl.Field getField() {
				return field;
			}

			@Override
			public Type getType() {
				return base.getType();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Downcast) {
					Downcast e = (Downcast) o;
					return base.equals(e.base) && enumPlace.equals(e.enumPlace) && field.equals(e.field);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(base, enumPlace, field);
			}
		}

		/**
		 * The snapshot of a place. Snapshots are encoded away before fold/unfold
		 * synthesis runs.
		 */
		public static class SnapApp extends AbstractExpr {
			private final Expr base;

			private SnapApp(Expr base, Attribute[] attributes) {
				super(attributes);
				this.base = base;
			}

			public Expr getBase() {
				return base;
			}

			@Override
			public Type getType() {
				return DOMAIN("Snap$" + base.getType().getName());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof SnapApp && base.equals(((SnapApp) o).base);
			}

			@Override
			public int hashCode() {
				return 47 * base.hashCode();
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Int = new Int();
		public static final Type Bool = new Bool();

		/**
		 * Get the name of this type. For references this is the name of the predicate
		 * describing the referenced value.
		 *
		 * @return
		 */
		public String getName();

		public boolean isTypedRefOrTypeVar();

		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public String getName() {
				return "Int";
			}

			@Override
			public boolean isTypedRefOrTypeVar() {
				return false;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 1;
			}
		}

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public String getName() {
				return "Bool";
			}

			@Override
			public boolean isTypedRefOrTypeVar() {
				return false;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 2;
			}
		}

		public static class TypedRef extends AbstractItem implements Type {
			private final String name;

			public TypedRef(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public boolean isTypedRefOrTypeVar() {
				return true;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof TypedRef && name.equals(((TypedRef) o).name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}
		}

		public static class TypeVar extends AbstractItem implements Type {
			private final String name;

			public TypeVar(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public boolean isTypedRefOrTypeVar() {
				return true;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof TypeVar && name.equals(((TypeVar) o).name);
			}

			@Override
			public int hashCode() {
				return 3 * name.hashCode();
			}
		}

		public static class Domain extends AbstractItem implements Type {
			private final String name;

			public Domain(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public boolean isTypedRefOrTypeVar() {
				return false;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Domain && name.equals(((Domain) o).name);
			}

			@Override
			public int hashCode() {
				return 5 * name.hashCode();
			}
		}

		public static class Sequence extends AbstractItem implements Type {
			private final Type element;

			public Sequence(Type element, Attribute... attributes) {
				super(attributes);
				this.element = element;
			}

			public Type getElement() {
				return element;
			}

			@Override
			public String getName() {
				return "Seq[" + element.getName() + "]";
			}

			@Override
			public boolean isTypedRefOrTypeVar() {
				return false;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Sequence && element.equals(((Sequence) o).element);
			}

			@Override
			public int hashCode() {
				return 7 * element.hashCode();
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Attempt to view this attribute as an instance of a given class.
		 *
		 * @param kind
		 * @param <T>
		 * @return The attribute viewed as the given kind, or <code>null</code>.
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * A position within the source program, used to report verification errors
	 * against the construct they arise from.
	 */
	public static class Position {
		private final int line;
		private final int column;
		private final int id;

		public Position(int line, int column, int id) {
			this.line = line;
			this.column = column;
			this.id = id;
		}

		public int getLine() {
			return line;
		}

		public int getColumn() {
			return column;
		}

		public int getId() {
			return id;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Position) {
				Position p = (Position) o;
				return line == p.line && column == p.column && id == p.id;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(line, column, id);
		}

		@Override
		public String toString() {
			return line + ":" + column + "#" + id;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	/**
	 * The field through which a reference reaches the value it points to.
	 */
	public static final String REFERENCE_FIELD = "val_ref";

	/**
	 * The prefix identifying the predicates of reference types.
	 */
	public static final String REFERENCE_PREFIX = "ref$";

	@SuppressWarnings("unchecked")
	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static Attribute POSITION(int line, int column, int id) {
		return ATTRIBUTE(new Position(line, column, id));
	}

	// Declarations

	public static Decl.Variable VARIABLE(String name, Type type, Attribute... attributes) {
		return new Decl.Variable(name, type, attributes);
	}

	public static Decl.Field FIELD(String name, Type type, Attribute... attributes) {
		return new Decl.Field(name, type, attributes);
	}

	public static Decl.StructPredicate PREDICATE(String name, Decl.Variable self, Expr body, Attribute... attributes) {
		return new Decl.StructPredicate(name, self, body, attributes);
	}

	public static Decl.EnumPredicate ENUM_PREDICATE(String name, Decl.Variable self, Decl.Field discriminant,
			List<Decl.EnumVariant> variants, Attribute... attributes) {
		return new Decl.EnumPredicate(name, self, discriminant, variants, attributes);
	}

	public static Decl.EnumVariant ENUM_VARIANT(Expr guard, String name, Decl.StructPredicate predicate,
			Attribute... attributes) {
		return new Decl.EnumVariant(guard, name, predicate, attributes);
	}

	public static Decl.Method METHOD(String name, List<Decl.Variable> parameters, List<Decl.Variable> returns,
			List<Stmt> body, Attribute... attributes) {
		return new Decl.Method(name, parameters, returns, body, attributes);
	}

	// Types

	public static Type.TypedRef TYPED_REF(String name, Attribute... attributes) {
		return new Type.TypedRef(name, attributes);
	}

	public static Type.TypeVar TYPE_VAR(String name, Attribute... attributes) {
		return new Type.TypeVar(name, attributes);
	}

	public static Type.Domain DOMAIN(String name, Attribute... attributes) {
		return new Type.Domain(name, attributes);
	}

	public static Type.Sequence SEQUENCE(Type element, Attribute... attributes) {
		return new Type.Sequence(element, attributes);
	}

	// Statements

	public static Stmt.Comment COMMENT(String message, Attribute... attributes) {
		return new Stmt.Comment(message, attributes);
	}

	public static Stmt.Label LABEL(String label, Attribute... attributes) {
		return new Stmt.Label(label, attributes);
	}

	public static Stmt.Inhale INHALE(Expr expr, Attribute... attributes) {
		return new Stmt.Inhale(expr, attributes);
	}

	public static Stmt.Exhale EXHALE(Expr expr, Attribute... attributes) {
		return new Stmt.Exhale(expr, attributes);
	}

	public static Stmt.Assert ASSERT(Expr expr, Attribute... attributes) {
		return new Stmt.Assert(expr, attributes);
	}

	public static Stmt.Obtain OBTAIN(Expr expr, Attribute... attributes) {
		return new Stmt.Obtain(expr, attributes);
	}

	public static Stmt.MethodCall CALL(String name, List<Expr> arguments, List<Decl.Variable> targets,
			Attribute... attributes) {
		return new Stmt.MethodCall(name, arguments, targets, attributes);
	}

	public static Stmt.MethodCall CALL(String name, List<Decl.Variable> targets, Attribute... attributes) {
		return new Stmt.MethodCall(name, Collections.<Expr>emptyList(), targets, attributes);
	}

	public static Stmt.Assign ASSIGN(Expr target, Expr source, Attribute... attributes) {
		return new Stmt.Assign(target, source, attributes);
	}

	public static Stmt.Fold FOLD(String predicateName, List<Expr> arguments, PermAmount permission, String variant,
			Attribute... attributes) {
		return new Stmt.Fold(predicateName, arguments, permission, variant, attributes);
	}

	public static Stmt.Fold FOLD(Expr place, PermAmount permission, Attribute... attributes) {
		return new Stmt.Fold(place.getType().getName(), Arrays.asList(place), permission, null, attributes);
	}

	public static Stmt.Unfold UNFOLD(String predicateName, List<Expr> arguments, PermAmount permission,
			String variant, Attribute... attributes) {
		return new Stmt.Unfold(predicateName, arguments, permission, variant, attributes);
	}

	public static Stmt.Unfold UNFOLD(Expr place, PermAmount permission, Attribute... attributes) {
		return new Stmt.Unfold(place.getType().getName(), Arrays.asList(place), permission, null, attributes);
	}

	public static Stmt.BeginFrame BEGIN_FRAME(Attribute... attributes) {
		return new Stmt.BeginFrame(attributes);
	}

	public static Stmt.EndFrame END_FRAME(Attribute... attributes) {
		return new Stmt.EndFrame(attributes);
	}

	public static Stmt.TransferPerm TRANSFER_PERM(Expr left, Expr right, boolean unchecked,
			Attribute... attributes) {
		return new Stmt.TransferPerm(left, right, unchecked, attributes);
	}

	public static Stmt.PackageMagicWand PACKAGE_MAGIC_WAND(Expr.MagicWand wand, List<Stmt> body, String label,
			List<Decl.Variable> variables, Attribute... attributes) {
		return new Stmt.PackageMagicWand(wand, body, label, variables, attributes);
	}

	public static Stmt.ApplyMagicWand APPLY_MAGIC_WAND(Expr.MagicWand wand, Attribute... attributes) {
		return new Stmt.ApplyMagicWand(wand, attributes);
	}

	public static Stmt.ExpireBorrows EXPIRE_BORROWS(List<String> borrows, Attribute... attributes) {
		return new Stmt.ExpireBorrows(borrows, attributes);
	}

	public static Stmt.If IF(Expr guard, List<Stmt> thenStmts, List<Stmt> elseStmts, Attribute... attributes) {
		return new Stmt.If(guard, thenStmts, elseStmts, attributes);
	}

	public static Stmt.Downcast DOWNCAST(Expr base, Decl.Field field, Attribute... attributes) {
		return new Stmt.Downcast(base, field, attributes);
	}

	// Places

	public static Expr.Local LOCAL(Decl.Variable variable, Attribute... attributes) {
		return new Expr.Local(variable, attributes);
	}

	public static Expr.Local LOCAL(String name, Type type, Attribute... attributes) {
		return new Expr.Local(new Decl.Variable(name, type), attributes);
	}

	public static Expr.Field FIELD(Expr base, Decl.Field field, Attribute... attributes) {
		return new Expr.Field(base, field, attributes);
	}

	public static Expr.Variant VARIANT(Expr base, Decl.Field field, Attribute... attributes) {
		return new Expr.Variant(base, field, attributes);
	}

	public static Expr.AddrOf ADDR_OF(Expr base, Type type, Attribute... attributes) {
		return new Expr.AddrOf(base, type, attributes);
	}

	public static Expr.LabelledOld OLD(String label, Expr base, Attribute... attributes) {
		return new Expr.LabelledOld(label, base, attributes);
	}

	// Constants

	public static Expr.Const CONST(boolean b, Attribute... attributes) {
		return new Expr.Const(b, attributes);
	}

	public static Expr.Const CONST(int i, Attribute... attributes) {
		return new Expr.Const(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Const CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Const(i, attributes);
	}

	// Permissions

	public static Expr.MagicWand MAGIC_WAND(Expr left, Expr right, Attribute... attributes) {
		return new Expr.MagicWand(left, right, null, attributes);
	}

	public static Expr.MagicWand MAGIC_WAND(Expr left, Expr right, String borrow, Attribute... attributes) {
		return new Expr.MagicWand(left, right, borrow, attributes);
	}

	public static Expr.PredicateAccessPredicate PRED_ACC(String predicateName, Expr argument, PermAmount permission,
			Attribute... attributes) {
		return new Expr.PredicateAccessPredicate(predicateName, argument, permission, attributes);
	}

	/**
	 * Construct the predicate permission for the predicate describing the type of
	 * a given place.
	 *
	 * @param place
	 * @param permission
	 * @return The access predicate, or <code>null</code> if the place is not of
	 *         reference type.
	 */
	public static Expr.PredicateAccessPredicate PRED_ACC(Expr place, PermAmount permission, Attribute... attributes) {
		Type type = place.getType();
		if (type instanceof Type.TypedRef) {
			return new Expr.PredicateAccessPredicate(type.getName(), place, permission, attributes);
		} else {
			return null;
		}
	}

	public static Expr.FieldAccessPredicate FIELD_ACC(Expr base, PermAmount permission, Attribute... attributes) {
		return new Expr.FieldAccessPredicate(base, permission, attributes);
	}

	// Operators

	public static Expr.UnaryOp NOT(Expr operand, Attribute... attributes) {
		return new Expr.UnaryOp(UnaryOpKind.NOT, operand, attributes);
	}

	public static Expr.UnaryOp NEG(Expr operand, Attribute... attributes) {
		return new Expr.UnaryOp(UnaryOpKind.MINUS, operand, attributes);
	}

	public static Expr.BinOp BINOP(BinaryOpKind kind, Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(kind, lhs, rhs, attributes);
	}

	public static Expr.BinOp AND(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(BinaryOpKind.AND, lhs, rhs, attributes);
	}

	public static Expr.BinOp OR(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(BinaryOpKind.OR, lhs, rhs, attributes);
	}

	public static Expr.BinOp IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(BinaryOpKind.IMPLIES, lhs, rhs, attributes);
	}

	public static Expr.BinOp EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(BinaryOpKind.EQ, lhs, rhs, attributes);
	}

	public static Expr.BinOp LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(BinaryOpKind.LT, lhs, rhs, attributes);
	}

	public static Expr.BinOp ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(BinaryOpKind.ADD, lhs, rhs, attributes);
	}

	public static Expr.ContainerOp CONTAINER_OP(ContainerOpKind kind, Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.ContainerOp(kind, lhs, rhs, attributes);
	}

	public static Expr.Seq SEQ(Type type, List<Expr> elements, Attribute... attributes) {
		return new Expr.Seq(type, elements, attributes);
	}

	public static Expr.Cond COND(Expr guard, Expr thenExpr, Expr elseExpr, Attribute... attributes) {
		return new Expr.Cond(guard, thenExpr, elseExpr, attributes);
	}

	// Binding constructs

	public static Expr.Unfolding UNFOLDING(String predicateName, List<Expr> arguments, Expr base,
			PermAmount permission, String variant, Attribute... attributes) {
		return new Expr.Unfolding(predicateName, arguments, base, permission, variant, attributes);
	}

	public static Expr.Unfolding UNFOLDING(Expr place, Expr base, PermAmount permission, Attribute... attributes) {
		return new Expr.Unfolding(place.getType().getName(), Arrays.asList(place), base, permission, null,
				attributes);
	}

	public static Expr.ForAll FORALL(List<Decl.Variable> variables, Expr body, Attribute... attributes) {
		return new Expr.ForAll(variables, body, attributes);
	}

	public static Expr.Exists EXISTS(List<Decl.Variable> variables, Expr body, Attribute... attributes) {
		return new Expr.Exists(variables, body, attributes);
	}

	public static Expr.LetExpr LET(Decl.Variable variable, Expr def, Expr body, Attribute... attributes) {
		return new Expr.LetExpr(variable, def, body, attributes);
	}

	// Applications

	public static Expr.FuncApp FUNC_APP(String name, List<Expr> arguments, List<Decl.Variable> formalArguments,
			Type returnType, Attribute... attributes) {
		return new Expr.FuncApp(name, arguments, formalArguments, returnType, attributes);
	}

	public static Expr.DomainFuncApp DOMAIN_FUNC_APP(String domainName, String name, List<Expr> arguments,
			List<Decl.Variable> formalArguments, Type returnType, Attribute... attributes) {
		return new Expr.DomainFuncApp(domainName, name, arguments, formalArguments, returnType, attributes);
	}

	public static Expr.InhaleExhale INHALE_EXHALE(Expr inhale, Expr exhale, Attribute... attributes) {
		return new Expr.InhaleExhale(inhale, exhale, attributes);
	}

	public static Expr.Downcast DOWNCAST(Expr base, Expr enumPlace, Decl.Field field, Attribute... attributes) {
		return new Expr.Downcast(base, enumPlace, field, attributes);
	}

	public static Expr.SnapApp SNAP_APP(Expr base, Attribute... attributes) {
		return new Expr.SnapApp(base, attributes);
	}
}
