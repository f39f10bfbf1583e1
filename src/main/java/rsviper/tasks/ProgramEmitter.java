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
package rsviper.tasks;

import static rsviper.core.ViperFile.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import rsviper.core.ViperFile;
import rsviper.core.ViperFile.Decl;
import rsviper.core.ViperFile.Expr;
import rsviper.core.ViperFile.Type;
import rsviper.encoder.EncodedProcedure;
import rsviper.encoder.TypeEncoder;
import rsviper.encoder.ValueEncoder;
import rsviper.lang.IntKind;

/**
 * Assembles encoded procedures into a complete Viper program. The program
 * starts with the declarations which the procedures share (fields,
 * predicates, domains and helper functions), followed by the methods
 * themselves. Everything is emitted in sorted order so that the same
 * procedures always produce the same program text.
 *
 * @author The Rust2Viper Project Developers
 */
public class ProgramEmitter {
	public static final String TYPE_TAG = "TypeTag";
	public static final String TYPE_OF = "type_of";
	public static final String INT_BOUNDS = "IntBounds";

	public ViperFile emit(EncodedProcedure procedure) {
		return emit(Collections.singletonList(procedure));
	}

	public ViperFile emit(Collection<EncodedProcedure> procedures) {
		TreeMap<String, EncodedProcedure> methods = new TreeMap<>();
		TreeSet<String> fields = new TreeSet<>();
		TreeMap<String, Expr> predicates = new TreeMap<>();
		TreeSet<String> tags = new TreeSet<>();
		EnumSet<IntKind> kinds = EnumSet.noneOf(IntKind.class);
		for (EncodedProcedure p : procedures) {
			if (methods.put(p.getMethod().getName(), p) != null) {
				throw new IllegalArgumentException("duplicate procedure " + p.getName());
			}
			fields.addAll(p.getFields());
			predicates.putAll(p.getPredicates());
			tags.addAll(p.getTags());
			kinds.addAll(p.getIntKinds());
		}
		ArrayList<Decl> decls = new ArrayList<>();
		for (String f : fields) {
			decls.add(new Decl.Field(f, TypeEncoder.fieldType(f)));
		}
		for (Map.Entry<String, Expr> p : predicates.entrySet()) {
			decls.add(new Decl.Predicate(p.getKey(), Arrays.asList(new Decl.Parameter(TypeEncoder.SELF, Type.Ref)),
					p.getValue()));
		}
		decls.add(typeTags(tags));
		if (!kinds.isEmpty()) {
			decls.add(intBounds(kinds));
		}
		decls.addAll(helpers());
		for (EncodedProcedure p : methods.values()) {
			decls.add(new Decl.LineComment(p.getName()));
			decls.add(p.getMethod());
		}
		return new ViperFile(decls);
	}

	/**
	 * The domain which gives every object a type, with one distinct tag for
	 * every type in use.
	 */
	private static Decl typeTags(Collection<String> tags) {
		Type tag = new Type.Domain(TYPE_TAG);
		ArrayList<Decl.DomainFunction> functions = new ArrayList<>();
		functions.add(new Decl.DomainFunction(TYPE_OF, Arrays.asList(new Decl.Parameter("r", Type.Ref)), tag, false));
		for (String t : tags) {
			functions.add(new Decl.DomainFunction(t, Collections.emptyList(), tag, true));
		}
		return new Decl.Domain(TYPE_TAG, functions, Collections.emptyList());
	}

	/**
	 * The domain of range predicates, one per kind of integer which needs one.
	 */
	private static Decl intBounds(Collection<IntKind> kinds) {
		ArrayList<Decl.DomainFunction> functions = new ArrayList<>();
		ArrayList<Decl.Axiom> axioms = new ArrayList<>();
		for (IntKind k : kinds) {
			String name = "in$" + k.getName();
			functions.add(new Decl.DomainFunction(name, Arrays.asList(new Decl.Parameter("v", Type.Int)), Type.Bool,
					false));
			Expr v = VAR("v");
			Expr.Logical range = AND(LTEQ(CONST(k.getMin()), v), LTEQ(v, CONST(k.getMax())));
			axioms.add(new Decl.Axiom(k.getName() + "_range", FORALL("v", Type.Int, IFF(INVOKE(name, v), range))));
		}
		return new Decl.Domain(INT_BOUNDS, functions, axioms);
	}

	/**
	 * Division and remainder which round towards zero, and the sum of a slice
	 * of a sequence.
	 */
	private static List<Decl> helpers() {
		ArrayList<Decl> r = new ArrayList<>();
		List<Decl.Parameter> ab = Arrays.asList(new Decl.Parameter("a", Type.Int), new Decl.Parameter("b", Type.Int));
		Expr a = VAR("a");
		Expr b = VAR("b");
		List<Expr> nonzero = Arrays.<Expr>asList(NEQ(b, CONST(0)));
		Expr quotient = IDIV(CONDITIONAL(GTEQ(a, CONST(0)), a, NEG(a)), CONDITIONAL(GTEQ(b, CONST(0)), b, NEG(b)));
		Expr div = CONDITIONAL(IFF(GTEQ(a, CONST(0)), GT(b, CONST(0))), quotient, NEG(quotient));
		r.add(new Decl.Function(ValueEncoder.DIV, ab, Type.Int, nonzero, div));
		Expr rem = SUB(a, MUL(b, INVOKE(ValueEncoder.DIV, a, b)));
		r.add(new Decl.Function(ValueEncoder.REM, ab, Type.Int, nonzero, rem));
		// seq_sum(s, lo, hi) == s[lo] + ... + s[hi-1]
		Type seq = new Type.Sequence(Type.Int);
		Expr s = VAR("s");
		Expr lo = VAR("lo");
		Expr hi = VAR("hi");
		List<Decl.Parameter> params = Arrays.asList(new Decl.Parameter("s", seq), new Decl.Parameter("lo", Type.Int),
				new Decl.Parameter("hi", Type.Int));
		List<Expr> range = Arrays.<Expr>asList(LTEQ(CONST(0), lo), LTEQ(lo, hi), LTEQ(hi, SEQ_LENGTH(s)));
		Expr hi1 = SUB(hi, CONST(1));
		Expr sum = CONDITIONAL(EQ(lo, hi), CONST(0), ADD(INVOKE(ValueEncoder.SUM, s, lo, hi1), SEQ_INDEX(s, hi1)));
		r.add(new Decl.Function(ValueEncoder.SUM, params, Type.Int, range, sum));
		return r;
	}
}
