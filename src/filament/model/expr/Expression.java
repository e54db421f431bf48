package filament.model.expr;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An immutable polynomial with integer coefficients over {@link Atom}s, kept in canonical form: a sorted map from
 * monomial to non-zero coefficient. Two expressions are equal exactly when their canonical forms are equal, which
 * makes {@link #equals(Object)} the cheap syntactic check used before anything is sent to a solver.
 *
 * Arithmetic overflow throws {@link ArithmeticException}.
 */
public final class Expression {

	public static final Expression ZERO = new Expression(new TreeMap<>());
	public static final Expression ONE = constant(1);

	private final SortedMap<Monomial, Long> terms;

	private Expression(SortedMap<Monomial, Long> terms) {
		this.terms = Collections.unmodifiableSortedMap(terms);
	}

	public static Expression constant(long value) {
		TreeMap<Monomial, Long> terms = new TreeMap<>();
		if (value != 0) {
			terms.put(Monomial.ONE, value);
		}
		return new Expression(terms);
	}

	public static Expression of(Atom atom) {
		TreeMap<Monomial, Long> terms = new TreeMap<>();
		terms.put(Monomial.of(atom), 1L);
		return new Expression(terms);
	}

	public static Expression term(long coefficient, Monomial monomial) {
		TreeMap<Monomial, Long> terms = new TreeMap<>();
		if (coefficient != 0) {
			terms.put(monomial, coefficient);
		}
		return new Expression(terms);
	}

	private static void accumulate(TreeMap<Monomial, Long> into, Monomial monomial, long coefficient) {
		long sum = Math.addExact(into.getOrDefault(monomial, 0L), coefficient);
		if (sum == 0) {
			into.remove(monomial);
		} else {
			into.put(monomial, sum);
		}
	}

	public Expression plus(Expression other) {
		TreeMap<Monomial, Long> result = new TreeMap<>(terms);
		for (Map.Entry<Monomial, Long> e : other.terms.entrySet()) {
			accumulate(result, e.getKey(), e.getValue());
		}
		return new Expression(result);
	}

	public Expression plus(long value) {
		return plus(constant(value));
	}

	public Expression minus(Expression other) {
		return plus(other.negate());
	}

	public Expression negate() {
		return times(-1);
	}

	public Expression times(long factor) {
		TreeMap<Monomial, Long> result = new TreeMap<>();
		if (factor != 0) {
			for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
				result.put(e.getKey(), Math.multiplyExact(e.getValue(), factor));
			}
		}
		return new Expression(result);
	}

	public Expression times(Expression other) {
		TreeMap<Monomial, Long> result = new TreeMap<>();
		for (Map.Entry<Monomial, Long> a : terms.entrySet()) {
			for (Map.Entry<Monomial, Long> b : other.terms.entrySet()) {
				accumulate(result, a.getKey().times(b.getKey()), Math.multiplyExact(a.getValue(), b.getValue()));
			}
		}
		return new Expression(result);
	}

	public boolean isDivisibleBy(long divisor) {
		for (long coefficient : terms.values()) {
			if (coefficient % divisor != 0) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Exact division of every coefficient.
	 *
	 * @throws ArithmeticException if some coefficient is not a multiple of divisor
	 */
	public Expression divideExact(long divisor) {
		TreeMap<Monomial, Long> result = new TreeMap<>();
		for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
			if (e.getValue() % divisor != 0) {
				throw new ArithmeticException(this + " is not divisible by " + divisor);
			}
			result.put(e.getKey(), e.getValue() / divisor);
		}
		return new Expression(result);
	}

	/**
	 * Replaces every atom that is a key of the substitution. Atoms without a mapping are kept.
	 */
	public Expression substitute(Map<Atom, Expression> substitution) {
		if (substitution.isEmpty()) {
			return this;
		}
		Expression result = ZERO;
		for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
			Expression product = constant(e.getValue());
			for (Atom factor : e.getKey().getFactors()) {
				Expression replacement = substitution.get(factor);
				product = product.times(replacement != null ? replacement : of(factor));
			}
			result = result.plus(product);
		}
		return result;
	}

	/**
	 * @throws IllegalArgumentException if an atom of this expression has no value
	 */
	public long evaluate(Map<Atom, Long> valuation) {
		long result = 0;
		for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
			long product = e.getValue();
			for (Atom factor : e.getKey().getFactors()) {
				Long value = valuation.get(factor);
				if (value == null) {
					throw new IllegalArgumentException("no value for " + factor + " while evaluating " + this);
				}
				product = Math.multiplyExact(product, value);
			}
			result = Math.addExact(result, product);
		}
		return result;
	}

	public boolean isConstant() {
		return terms.isEmpty() || (terms.size() == 1 && terms.containsKey(Monomial.ONE));
	}

	/**
	 * @return the constant term; for a constant expression this is its value
	 */
	public long getConstant() {
		return terms.getOrDefault(Monomial.ONE, 0L);
	}

	public SortedMap<Monomial, Long> getTerms() {
		return terms;
	}

	public SortedSet<Atom> getAtoms() {
		SortedSet<Atom> atoms = new TreeSet<>();
		for (Monomial m : terms.keySet()) {
			atoms.addAll(m.getFactors());
		}
		return atoms;
	}

	public boolean mentions(Atom atom) {
		for (Monomial m : terms.keySet()) {
			if (m.getFactors().contains(atom)) {
				return true;
			}
		}
		return false;
	}

	public boolean isLinear() {
		for (Monomial m : terms.keySet()) {
			if (m.degree() > 1) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Writes this expression as c*atom + rest where neither c nor rest mention atom.
	 *
	 * @return c, or empty if atom occurs with degree two or more in some monomial
	 */
	public Optional<Expression> linearCoefficient(Atom atom) {
		Expression coefficient = ZERO;
		for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
			int degree = e.getKey().degreeOf(atom);
			if (degree > 1) {
				return Optional.empty();
			}
			if (degree == 1) {
				coefficient = coefficient.plus(term(e.getValue(), e.getKey().divide(atom)));
			}
		}
		return Optional.of(coefficient);
	}

	/**
	 * @return the terms of this expression that do not mention atom
	 */
	public Expression withoutAtom(Atom atom) {
		TreeMap<Monomial, Long> result = new TreeMap<>();
		for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
			if (!e.getKey().getFactors().contains(atom)) {
				result.put(e.getKey(), e.getValue());
			}
		}
		return new Expression(result);
	}

	/**
	 * Renders in the surface syntax, e.g. "G+L+1", "M*M", "2*W-1".
	 */
	public String render() {
		if (terms.isEmpty()) {
			return "0";
		}
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<Monomial, Long> e : terms.entrySet()) {
			Monomial monomial = e.getKey();
			long coefficient = e.getValue();
			String text;
			if (monomial.isConstant()) {
				text = Long.toString(coefficient);
			} else if (coefficient == 1) {
				text = monomial.render();
			} else if (coefficient == -1) {
				text = "-" + monomial.render();
			} else {
				text = coefficient + "*" + monomial.render();
			}
			if (builder.length() > 0 && !text.startsWith("-")) {
				builder.append('+');
			}
			builder.append(text);
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return terms.equals(((Expression) o).terms);
	}

	@Override
	public int hashCode() {
		return terms.hashCode();
	}

	@Override
	public String toString() {
		return render();
	}
}
