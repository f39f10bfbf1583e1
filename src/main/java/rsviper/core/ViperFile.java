// Copyright 2024 The Rust2Viper Project Developers
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
package rsviper.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An in-memory representation of a program in the Viper intermediate
 * verification language. Only the fragment of Viper which the encoder
 * produces is represented. Every item can carry attributes, which is how
 * proof obligations are attached to the statements that discharge them.
 *
 * @author The Rust2Viper Project Developers
 */
public class ViperFile {

	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public ViperFile() {
		this.declarations = new ArrayList<>();
	}

	public ViperFile(Collection<Decl> declarations) {
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

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * A heap field. Every object in Viper has every field; which ones a
		 * method may access is governed solely by permissions.
		 */
		public static class Field extends AbstractItem implements Decl {
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
		}

		/**
		 * A predicate. Predicates without a body are abstract, and are used to
		 * represent ownership of values whose layout is unknown.
		 */
		public static class Predicate extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Expr body;

			public Predicate(String name, List<Parameter> parameters, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * A domain declares a new type together with uninterpreted functions
		 * over it and axioms constraining them. Care must be taken to ensure
		 * axioms are consistent, since an inconsistent axiom makes every
		 * assertion in the program verify.
		 */
		public static class Domain extends AbstractItem implements Decl {
			private final String name;
			private final List<DomainFunction> functions;
			private final List<Axiom> axioms;

			public Domain(String name, List<DomainFunction> functions, List<Axiom> axioms, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.functions = new ArrayList<>(functions);
				this.axioms = new ArrayList<>(axioms);
			}

			public String getName() {
				return name;
			}

			public List<DomainFunction> getFunctions() {
				return functions;
			}

			public List<Axiom> getAxioms() {
				return axioms;
			}
		}

		public static class DomainFunction extends AbstractItem implements Item {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;
			private final boolean unique;

			public DomainFunction(String name, List<Parameter> parameters, Type returns, boolean unique,
					Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
				this.unique = unique;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public boolean isUnique() {
				return unique;
			}
		}

		public static class Axiom extends AbstractItem implements Item {
			private final String name;
			private final Expr operand;

			public Axiom(String name, Expr operand, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.operand = operand;
			}

			public String getName() {
				return name;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;
			private final List<Expr> requires;
			private final Expr body;

			public Function(String name, List<Parameter> parameters, Type returns, List<Expr> requires, Expr body,
					Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
				this.requires = new ArrayList<>(requires);
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public List<Expr> getRequires() {
				return requires;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Method extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final List<Parameter> returns;
			private final List<Expr> requires;
			private final List<Expr> ensures;
			private final Stmt body;

			public Method(String name, List<Parameter> parameters, List<Parameter> returns, List<Expr> requires,
					List<Expr> ensures, Stmt body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = new ArrayList<>(returns);
				this.requires = new ArrayList<>(requires);
				this.ensures = new ArrayList<>(ensures);
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public List<Parameter> getReturns() {
				return returns;
			}

			public List<Expr> getRequires() {
				return requires;
			}

			public List<Expr> getEnsures() {
				return ensures;
			}

			public Stmt getBody() {
				return body;
			}
		}

		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
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
		}

		public static class LineComment extends AbstractItem implements Decl {
			private final String message;

			public LineComment(String message, Attribute... attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		public static class Sequence extends AbstractItem implements Decl {
			private final List<Decl> decls;

			public Sequence(Decl... decls) {
				this(Arrays.asList(decls));
			}

			public Sequence(Collection<Decl> decls, Attribute... attributes) {
				super(attributes);
				this.decls = new ArrayList<>(decls);
			}

			public int size() {
				return decls.size();
			}

			public Decl get(int i) {
				return decls.get(i);
			}

			public List<Decl> getAll() {
				return decls;
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		/**
		 * Adds the permissions of an assertion to the current state, and assumes
		 * its pure parts.
		 */
		public static class Inhale extends AbstractItem implements Stmt {
			private final Expr operand;

			private Inhale(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		/**
		 * Checks an assertion holds in the current state, and removes its
		 * permissions (forgetting the values of locations for which no
		 * permission remains).
		 */
		public static class Exhale extends AbstractItem implements Stmt {
			private final Expr operand;

			private Exhale(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		/**
		 * Exchanges the permissions making up the body of a predicate for an
		 * instance of that predicate.
		 */
		public static class Fold extends AbstractItem implements Stmt {
			private final Expr.PredicateAccessPredicate operand;

			private Fold(Expr.PredicateAccessPredicate operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr.PredicateAccessPredicate getOperand() {
				return operand;
			}
		}

		/**
		 * Exchanges an instance of a predicate for the permissions making up
		 * its body.
		 */
		public static class Unfold extends AbstractItem implements Stmt {
			private final Expr.PredicateAccessPredicate operand;

			private Unfold(Expr.PredicateAccessPredicate operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr.PredicateAccessPredicate getOperand() {
				return operand;
			}
		}

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr condition;

			private Assert(Expr condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class Assignment extends AbstractItem implements Stmt {
			private final LVal lhs;
			private final Expr rhs;

			private Assignment(LVal lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public LVal getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class VariableDeclaration extends AbstractItem implements Stmt {
			private final String name;
			private final Type type;

			private VariableDeclaration(String name, Type type, Attribute[] attributes) {
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
		}

		public static class Goto extends AbstractItem implements Stmt {
			private final String label;

			private Goto(String label, Attribute[] attributes) {
				super(attributes);
				this.label = label;
			}

			public String getLabel() {
				return label;
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

		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr condition;
			private final Stmt trueBranch;
			private final Stmt falseBranch;

			private IfElse(Expr condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Stmt getTrueBranch() {
				return trueBranch;
			}

			public Stmt getFalseBranch() {
				return falseBranch;
			}
		}

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

		public static class Sequence extends AbstractItem implements Stmt {
			private final List<Stmt> stmts;

			private Sequence(Collection<Stmt> stmts, Attribute[] attributes) {
				super(attributes);
				this.stmts = new ArrayList<>(stmts);
			}

			public int size() {
				return stmts.size();
			}

			public Stmt get(int i) {
				return stmts.get(i);
			}

			public List<Stmt> getAll() {
				return stmts;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public interface Logical extends Expr {
			public boolean isFalse();
			public boolean isTrue();
		}

		public interface Quantifier extends Logical {
			public List<Decl.Parameter> getParameters();

			public Expr.Logical getBody();
		}

		public interface UnaryOperator {
			Expr getOperand();
		}

		public interface BinaryOperator {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		public interface NaryOperator {
			List<? extends Expr> getOperands();
		}

		public static abstract class AbstractBinaryOperator extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private AbstractBinaryOperator(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Equals extends AbstractBinaryOperator implements Logical {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class NotEquals extends AbstractBinaryOperator implements Logical {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThan extends AbstractBinaryOperator implements Logical {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThanOrEqual extends AbstractBinaryOperator implements Logical {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThan extends AbstractBinaryOperator implements Logical {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinaryOperator implements Logical {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Iff extends AbstractBinaryOperator implements Logical {
			private Iff(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Implies extends AbstractBinaryOperator implements Logical {
			private Implies(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Addition extends AbstractBinaryOperator implements Expr {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Subtraction extends AbstractBinaryOperator implements Expr {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Multiplication extends AbstractBinaryOperator implements Expr {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		/**
		 * Euclidean integer division, written <code>\</code> in Viper.
		 */
		public static class IntegerDivision extends AbstractBinaryOperator implements Expr {
			private IntegerDivision(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		/**
		 * Euclidean remainder, written <code>%</code> in Viper.
		 */
		public static class Remainder extends AbstractBinaryOperator implements Expr {
			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}
		}

		public static class Invoke extends AbstractItem implements Logical {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public String toString() {
				return "FNCALL(" + name + "," + arguments.toString() + ")";
			}
		}

		public static class Negation extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		/**
		 * Evaluates its operand in the state of a given label. The label
		 * <code>null</code> refers to the state on entry to the method.
		 */
		public static class Old extends AbstractItem implements Logical, UnaryOperator {
			private final String label;
			private final Expr operand;

			private Old(String label, Expr operand, Attribute[] attributes) {
				super(attributes);
				this.label = label;
				this.operand = operand;
			}

			public String getLabel() {
				return label;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			public String toString() {
				return "OLD[" + label + "](" + operand + ")";
			}
		}

		public static class LogicalNot extends AbstractItem implements Logical, UnaryOperator {
			private final Logical operand;

			private LogicalNot(Logical operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Logical getOperand() {
				return operand;
			}

			public String toString() {
				return "NOT(" + operand + ")";
			}
		}

		public static class LogicalAnd extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private LogicalAnd(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class LogicalOr extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private LogicalOr(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class UniversalQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Logical body;

			private UniversalQuantifier(List<Decl.Parameter> parameters, Logical body, Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Logical getBody() {
				return body;
			}
		}

		public static class ExistentialQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Logical body;

			private ExistentialQuantifier(List<Decl.Parameter> parameters, Logical body, Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Logical getBody() {
				return body;
			}
		}

		public static class Conditional extends AbstractItem implements Logical {
			private final Logical condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private Conditional(Logical condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Logical getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical, LVal {
			private final String var;

			private VariableAccess(String var, Attribute[] attributes) {
				super(attributes);
				this.var = var;
			}

			public String getVariable() {
				return var;
			}

			public String toString() {
				return var;
			}
		}

		/**
		 * Reads a field of the object referenced by the receiver, e.g.
		 * <code>_1.val_int</code>.
		 */
		public static class FieldAccess extends AbstractItem implements Logical, LVal {
			private final Expr receiver;
			private final String field;

			private FieldAccess(Expr receiver, String field, Attribute[] attributes) {
				super(attributes);
				this.receiver = receiver;
				this.field = field;
			}

			public Expr getReceiver() {
				return receiver;
			}

			public String getField() {
				return field;
			}

			public String toString() {
				return receiver + "." + field;
			}
		}

		/**
		 * An accessibility predicate such as <code>acc(_1.val_int, 1/2)</code>.
		 */
		public static class FieldAccessPredicate extends AbstractItem implements Logical {
			private final FieldAccess location;
			private final Expr amount;

			private FieldAccessPredicate(FieldAccess location, Expr amount, Attribute[] attributes) {
				super(attributes);
				this.location = location;
				this.amount = amount;
			}

			public FieldAccess getLocation() {
				return location;
			}

			public Expr getAmount() {
				return amount;
			}
		}

		/**
		 * A predicate instance accessibility such as
		 * <code>acc(param$T(_1), write)</code>.
		 */
		public static class PredicateAccessPredicate extends AbstractItem implements Logical {
			private final String predicate;
			private final List<Expr> arguments;
			private final Expr amount;

			private PredicateAccessPredicate(String predicate, List<Expr> arguments, Expr amount,
					Attribute[] attributes) {
				super(attributes);
				this.predicate = predicate;
				this.arguments = new ArrayList<>(arguments);
				this.amount = amount;
			}

			public String getPredicate() {
				return predicate;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public Expr getAmount() {
				return amount;
			}
		}

		/**
		 * A literal permission amount: <code>write</code>, <code>none</code>,
		 * <code>wildcard</code> or a fraction.
		 */
		public static class PermissionLiteral extends AbstractItem implements Expr {
			private final String text;

			private PermissionLiteral(String text, Attribute[] attributes) {
				super(attributes);
				this.text = text;
			}

			public String getText() {
				return text;
			}
		}

		/**
		 * The amount of permission currently held to a location, i.e.
		 * <code>perm(_1.val_int)</code>.
		 */
		public static class CurrentPermission extends AbstractItem implements Expr {
			private final FieldAccess location;

			private CurrentPermission(FieldAccess location, Attribute[] attributes) {
				super(attributes);
				this.location = location;
			}

			public FieldAccess getLocation() {
				return location;
			}
		}

		public static class SequenceLength extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private SequenceLength(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		public static class SequenceIndex extends AbstractItem implements Logical {
			private final Expr source;
			private final Expr index;

			private SequenceIndex(Expr source, Expr index, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.index = index;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}
		}

		public static class SequenceUpdate extends AbstractItem implements Expr {
			private final Expr source;
			private final Expr index;
			private final Expr value;

			private SequenceUpdate(Expr source, Expr index, Expr value, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.index = index;
				this.value = value;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}

			public Expr getValue() {
				return value;
			}
		}

		/**
		 * An explicit sequence such as <code>Seq(1, 2, 3)</code>. The element
		 * type is needed to print the empty sequence.
		 */
		public static class SequenceLiteral extends AbstractItem implements Expr {
			private final Type element;
			private final List<Expr> elements;

			private SequenceLiteral(Type element, List<Expr> elements, Attribute[] attributes) {
				super(attributes);
				this.element = element;
				this.elements = new ArrayList<>(elements);
			}

			public Type getElementType() {
				return element;
			}

			public List<Expr> getElements() {
				return elements;
			}
		}
	}

	public interface LVal extends Expr {

	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Ref = new Ref();
		public static final Type Perm = new Perm();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Ref extends AbstractItem implements Type {
			public Ref(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Perm extends AbstractItem implements Type {
			public Perm(Attribute... attributes) {
				super(attributes);
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
		}

		/**
		 * A type declared by a domain.
		 */
		public static class Domain extends AbstractItem implements Type {
			private final String name;

			public Domain(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}
	}

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static final Attribute[] NO_ATTRIBUTES = new Attribute[0];

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			@SuppressWarnings("unchecked")
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

	// Statements
	public static Stmt.Inhale INHALE(Expr operand, Attribute... attributes) {
		return new Stmt.Inhale(operand, attributes);
	}

	public static Stmt.Exhale EXHALE(Expr operand, Attribute... attributes) {
		return new Stmt.Exhale(operand, attributes);
	}

	public static Stmt.Fold FOLD(Expr.PredicateAccessPredicate operand, Attribute... attributes) {
		return new Stmt.Fold(operand, attributes);
	}

	public static Stmt.Unfold UNFOLD(Expr.PredicateAccessPredicate operand, Attribute... attributes) {
		return new Stmt.Unfold(operand, attributes);
	}

	public static Stmt.Assert ASSERT(Expr condition, Attribute... attributes) {
		return new Stmt.Assert(condition, attributes);
	}

	public static Stmt.Assignment ASSIGN(LVal lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.Assignment(lhs, rhs, attributes);
	}

	public static Stmt.VariableDeclaration VAR(String name, Type type, Attribute... attributes) {
		return new Stmt.VariableDeclaration(name, type, attributes);
	}

	public static Stmt.Label LABEL(String label, Attribute... attributes) {
		return new Stmt.Label(label, attributes);
	}

	public static Stmt.Goto GOTO(String label, Attribute... attributes) {
		return new Stmt.Goto(label, attributes);
	}

	public static Stmt.IfElse IFELSE(Expr condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, falseBranch, attributes);
	}

	public static Stmt.Comment COMMENT(String message, Attribute... attributes) {
		return new Stmt.Comment(message, attributes);
	}

	public static Stmt.Sequence SEQUENCE(List<Stmt> stmts, Attribute... attributes) {
		return new Stmt.Sequence(stmts, attributes);
	}

	public static Stmt.Sequence SEQUENCE(Stmt... stmts) {
		return new Stmt.Sequence(Arrays.asList(stmts), NO_ATTRIBUTES);
	}

	// Expressions
	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name, attributes);
	}

	public static Expr.FieldAccess FIELD(Expr receiver, String field, Attribute... attributes) {
		return new Expr.FieldAccess(receiver, field, attributes);
	}

	public static Expr.Old OLD(String label, Expr operand, Attribute... attributes) {
		return new Expr.Old(label, operand, attributes);
	}

	public static Expr.Invoke INVOKE(String name, List<Expr> arguments, Attribute... attributes) {
		return new Expr.Invoke(name, arguments, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr... arguments) {
		return new Expr.Invoke(name, Arrays.asList(arguments), NO_ATTRIBUTES);
	}

	public static Expr.Logical EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.Logical NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.Logical LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	public static Expr.Logical LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.Logical GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.Logical GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr IDIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.IntegerDivision(lhs, rhs, attributes);
	}

	public static Expr REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}

	public static Expr NEG(Expr operand, Attribute... attributes) {
		return new Expr.Negation(operand, attributes);
	}

	public static Expr.Logical CONDITIONAL(Expr.Logical condition, Expr trueBranch, Expr falseBranch,
			Attribute... attributes) {
		return new Expr.Conditional(condition, trueBranch, falseBranch, attributes);
	}

	// Logical Operators
	public static Expr.Logical AND(List<? extends Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isFalse()) {
				return new Expr.Boolean(false, attributes);
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(true,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalAnd(noperands, attributes);
		}
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2),attributes);
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Expr.Logical operand3, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2, operand3),attributes);
	}

	public static Expr.Logical OR(List<? extends Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if(ith.isTrue()) {
				return new Expr.Boolean(true,attributes);
			} else if(!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(false,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalOr(noperands, attributes);
		}
	}

	public static Expr.Logical OR(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return OR(Arrays.asList(operand1, operand2),attributes);
	}

	public static Expr.Logical IFF(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if(lhs instanceof Expr.Boolean && rhs instanceof Expr.Boolean) {
			return new Expr.Boolean(lhs.isTrue() == rhs.isTrue(), attributes);
		} else {
			return new Expr.Iff(lhs, rhs, attributes);
		}
	}

	public static Expr.Logical IMPLIES(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if(lhs.isFalse() || rhs.isTrue()) {
			return new Expr.Boolean(true,attributes);
		} else if(lhs.isTrue()) {
			return rhs;
		} else {
			return new Expr.Implies(lhs, rhs, attributes);
		}
	}

	public static Expr.Logical NOT(Expr.Logical lhs, Attribute... attributes) {
		if(lhs.isFalse()) {
			return new Expr.Boolean(true,attributes);
		} else if(lhs.isTrue()) {
			return new Expr.Boolean(false,attributes);
		} else {
			return new Expr.LogicalNot(lhs, attributes);
		}
	}

	public static Expr.UniversalQuantifier FORALL(String name, Type type, Expr.Logical body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(Arrays.asList(new Decl.Parameter(name, type)), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(String name, Type type, Expr.Logical body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(Arrays.asList(new Decl.Parameter(name, type)), body, attributes);
	}

	// Permissions
	public static Expr.FieldAccessPredicate ACC(Expr.FieldAccess location, Expr amount, Attribute... attributes) {
		return new Expr.FieldAccessPredicate(location, amount, attributes);
	}

	public static Expr.PredicateAccessPredicate ACC(String predicate, Expr argument, Expr amount,
			Attribute... attributes) {
		return new Expr.PredicateAccessPredicate(predicate, Arrays.asList(argument), amount, attributes);
	}

	public static Expr.PermissionLiteral PERMISSION(String text, Attribute... attributes) {
		return new Expr.PermissionLiteral(text, attributes);
	}

	public static Expr.PermissionLiteral WRITE() {
		return new Expr.PermissionLiteral("write", NO_ATTRIBUTES);
	}

	public static Expr.PermissionLiteral NONE() {
		return new Expr.PermissionLiteral("none", NO_ATTRIBUTES);
	}

	public static Expr.CurrentPermission PERM(Expr.FieldAccess location, Attribute... attributes) {
		return new Expr.CurrentPermission(location, attributes);
	}

	// Sequences
	public static Expr SEQ_LENGTH(Expr operand, Attribute... attributes) {
		return new Expr.SequenceLength(operand, attributes);
	}

	public static Expr.Logical SEQ_INDEX(Expr source, Expr index, Attribute... attributes) {
		return new Expr.SequenceIndex(source, index, attributes);
	}

	public static Expr SEQ_UPDATE(Expr source, Expr index, Expr value, Attribute... attributes) {
		return new Expr.SequenceUpdate(source, index, value, attributes);
	}

	public static Expr SEQ(Type element, List<Expr> elements, Attribute... attributes) {
		return new Expr.SequenceLiteral(element, elements, attributes);
	}

	public static Expr SEQ(Type element) {
		return new Expr.SequenceLiteral(element, Collections.emptyList(), NO_ATTRIBUTES);
	}
}
