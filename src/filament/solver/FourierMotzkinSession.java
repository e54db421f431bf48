package filament.solver;

import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.model.expr.Monomial;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The built-in decision procedure: exact Fourier-Motzkin elimination over the rationals, with integer tightening
 * of every derived inequality and an integer model rebuilt by back-substitution.
 *
 * Each distinct product of atoms is an opaque natural-valued variable, bounded below by the product of the lower
 * bounds of its factors. This over-approximates nonlinear constraints: UNSAT is always exact, and a model whose
 * product variables disagree with the product of its atoms is answered UNKNOWN rather than SAT. Disjunctive
 * assumptions are decided by splitting into cases.
 */
public class FourierMotzkinSession implements SolverSession {
	private static final Logger logger = Logger.getLogger(FourierMotzkinSession.class.getName());

	static final int MAX_CASES = 1 << 12;
	static final int MAX_ROWS = 20000;

	private final Set<Atom> declared = new LinkedHashSet<>();
	private final Deque<List<List<Constraint>>> frames = new ArrayDeque<>();
	private Map<Atom, Long> lastModel = null;

	public FourierMotzkinSession() {
		frames.push(new ArrayList<>());
	}

	@Override
	public void declare(Atom variable) {
		declared.add(variable);
	}

	@Override
	public void assume(Constraint constraint) {
		frames.peek().add(Collections.singletonList(constraint));
	}

	@Override
	public void assumeAny(List<Constraint> alternatives) {
		frames.peek().add(new ArrayList<>(alternatives));
	}

	@Override
	public void push() {
		frames.push(new ArrayList<>());
	}

	@Override
	public void pop() {
		if (frames.size() == 1) {
			throw new IllegalStateException("pop without matching push");
		}
		frames.pop();
	}

	@Override
	public SatResult check() {
		lastModel = null;
		List<List<Constraint>> clauses = new ArrayList<>();
		for (List<List<Constraint>> frame : frames) {
			clauses.addAll(frame);
		}

		Map<Monomial, Integer> index = new LinkedHashMap<>();
		for (Atom atom : declared) {
			index.putIfAbsent(Monomial.of(atom), index.size());
		}
		long cases = 1;
		for (List<Constraint> clause : clauses) {
			if (clause.isEmpty()) {
				return SatResult.UNSAT;
			}
			cases *= clause.size();
			if (cases > MAX_CASES) {
				logger.fine("too many disjunctive cases, giving up");
				return SatResult.UNKNOWN;
			}
			for (Constraint c : clause) {
				for (Monomial m : c.difference().getTerms().keySet()) {
					if (!m.isConstant()) {
						index.putIfAbsent(m, index.size());
					}
				}
			}
		}

		boolean unknown = false;
		int[] choice = new int[clauses.size()];
		do {
			List<Constraint> chosen = new ArrayList<>(clauses.size());
			for (int i = 0; i < clauses.size(); i++) {
				chosen.add(clauses.get(i).get(choice[i]));
			}
			CaseSolver solver = new CaseSolver(index);
			Rational[] values = solver.solve(chosen);
			if (values != null) {
				Map<Atom, Long> model = new LinkedHashMap<>();
				for (Atom atom : declared) {
					model.put(atom, values[index.get(Monomial.of(atom))].getNumerator().longValueExact());
				}
				lastModel = model;
				return SatResult.SAT;
			}
			unknown |= solver.isUnknown();
		} while (advance(choice, clauses));
		return unknown ? SatResult.UNKNOWN : SatResult.UNSAT;
	}

	private static boolean advance(int[] choice, List<List<Constraint>> clauses) {
		for (int i = 0; i < choice.length; i++) {
			choice[i]++;
			if (choice[i] < clauses.get(i).size()) {
				return true;
			}
			choice[i] = 0;
		}
		return false;
	}

	@Override
	public Map<Atom, Long> model(Collection<Atom> variables) {
		if (lastModel == null) {
			throw new IllegalStateException("no model available; the last check was not satisfiable");
		}
		Map<Atom, Long> result = new LinkedHashMap<>();
		for (Atom variable : variables) {
			result.put(variable, lastModel.getOrDefault(variable, 0L));
		}
		return result;
	}

	@Override
	public void close() {
		frames.clear();
		declared.clear();
	}

	/**
	 * sum(coefficients[i] * v[i]) + constant, compared with 0 by = or >=.
	 */
	static final class Row {
		final BigInteger[] coefficients;
		final BigInteger constant;
		final boolean equality;

		Row(BigInteger[] coefficients, BigInteger constant, boolean equality) {
			this.coefficients = coefficients;
			this.constant = constant;
			this.equality = equality;
		}

		static Row of(Constraint constraint, Map<Monomial, Integer> index) {
			Expression diff = constraint.difference();
			BigInteger[] coefficients = new BigInteger[index.size()];
			Arrays.fill(coefficients, BigInteger.ZERO);
			BigInteger constant = BigInteger.ZERO;
			for (Map.Entry<Monomial, Long> term : diff.getTerms().entrySet()) {
				if (term.getKey().isConstant()) {
					constant = BigInteger.valueOf(term.getValue());
				} else {
					coefficients[index.get(term.getKey())] = BigInteger.valueOf(term.getValue());
				}
			}
			switch (constraint.getComparison()) {
				case EQ:
					return new Row(coefficients, constant, true);
				case GT:
					// strict over the integers: e > 0 iff e - 1 >= 0
					return new Row(coefficients, constant.subtract(BigInteger.ONE), false);
				default:
					return new Row(coefficients, constant, false);
			}
		}

		static Row atLeast(int variable, int size, BigInteger bound) {
			BigInteger[] coefficients = new BigInteger[size];
			Arrays.fill(coefficients, BigInteger.ZERO);
			coefficients[variable] = BigInteger.ONE;
			return new Row(coefficients, bound.negate(), false);
		}

		boolean isConstant() {
			for (BigInteger c : coefficients) {
				if (c.signum() != 0) {
					return false;
				}
			}
			return true;
		}

		boolean constantHolds() {
			return equality ? constant.signum() == 0 : constant.signum() >= 0;
		}

		int onlyVariable() {
			int found = -1;
			for (int i = 0; i < coefficients.length; i++) {
				if (coefficients[i].signum() != 0) {
					if (found != -1) {
						return -1;
					}
					found = i;
				}
			}
			return found;
		}

		Row scaled(BigInteger factor) {
			BigInteger[] result = new BigInteger[coefficients.length];
			for (int i = 0; i < result.length; i++) {
				result[i] = coefficients[i].multiply(factor);
			}
			return new Row(result, constant.multiply(factor), equality);
		}

		Row plus(Row other, boolean resultEquality) {
			BigInteger[] result = new BigInteger[coefficients.length];
			for (int i = 0; i < result.length; i++) {
				result[i] = coefficients[i].add(other.coefficients[i]);
			}
			return new Row(result, constant.add(other.constant), resultEquality);
		}

		/**
		 * Divides by the gcd of the coefficients; inequalities round their constant down, which is exact over
		 * the integers.
		 *
		 * @return null if the row has no integer solution
		 */
		Row normalized() {
			BigInteger gcd = BigInteger.ZERO;
			for (BigInteger c : coefficients) {
				gcd = gcd.gcd(c);
			}
			if (gcd.signum() == 0 || gcd.equals(BigInteger.ONE)) {
				return this;
			}
			BigInteger[] result = new BigInteger[coefficients.length];
			for (int i = 0; i < result.length; i++) {
				result[i] = coefficients[i].divide(gcd);
			}
			if (equality) {
				BigInteger[] qr = constant.divideAndRemainder(gcd);
				if (qr[1].signum() != 0) {
					return null;
				}
				return new Row(result, qr[0], true);
			}
			return new Row(result, Rational.of(constant, gcd).floor(), false);
		}

		/**
		 * @return the value v[variable] must be at least (coefficient positive) or at most (negative), given
		 * every other variable's value
		 */
		Rational bound(int variable, Rational[] values) {
			Rational rest = Rational.of(constant);
			for (int i = 0; i < coefficients.length; i++) {
				if (i != variable && coefficients[i].signum() != 0) {
					rest = rest.plus(Rational.of(coefficients[i]).times(values[i]));
				}
			}
			return rest.negate().dividedBy(Rational.of(coefficients[variable]));
		}

		boolean holds(Rational[] values) {
			Rational sum = Rational.of(constant);
			for (int i = 0; i < coefficients.length; i++) {
				if (coefficients[i].signum() != 0) {
					sum = sum.plus(Rational.of(coefficients[i]).times(values[i]));
				}
			}
			return equality ? sum.signum() == 0 : sum.signum() >= 0;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Row row = (Row) o;
			return equality == row.equality && constant.equals(row.constant) &&
					Arrays.equals(coefficients, row.coefficients);
		}

		@Override
		public int hashCode() {
			return 31 * Arrays.hashCode(coefficients) + constant.hashCode() + (equality ? 1 : 0);
		}
	}

	/**
	 * Decides one conjunction of constraints.
	 */
	static final class CaseSolver {
		private final Map<Monomial, Integer> index;
		private final int size;
		private final List<Step> steps = new ArrayList<>();
		private boolean unknown = false;

		private static final class Step {
			final int variable;
			final Row equality;
			final List<Row> lower;
			final List<Row> upper;

			Step(int variable, Row equality, List<Row> lower, List<Row> upper) {
				this.variable = variable;
				this.equality = equality;
				this.lower = lower;
				this.upper = upper;
			}
		}

		CaseSolver(Map<Monomial, Integer> index) {
			this.index = index;
			this.size = index.size();
		}

		boolean isUnknown() {
			return unknown;
		}

		/**
		 * @return an integer solution, or null if there is none or none was found (see {@link #isUnknown()})
		 */
		Rational[] solve(List<Constraint> constraints) {
			List<Row> original = new ArrayList<>();
			for (Constraint c : constraints) {
				original.add(Row.of(c, index));
			}
			for (int i = 0; i < size; i++) {
				original.add(Row.atLeast(i, size, BigInteger.ZERO));
			}
			original.addAll(monomialBounds(original));

			List<Row> active = new ArrayList<>();
			for (Row row : original) {
				Row normalized = row.normalized();
				if (normalized == null) {
					return null;
				}
				if (normalized.isConstant()) {
					if (!normalized.constantHolds()) {
						return null;
					}
				} else {
					active.add(normalized);
				}
			}

			active = eliminateEqualities(active);
			if (active == null) {
				return null;
			}
			for (int variable = 0; variable < size; variable++) {
				active = eliminate(variable, active);
				if (active == null) {
					return null;
				}
			}

			Rational[] values = backSubstitute();
			for (Rational value : values) {
				if (!value.isInteger()) {
					unknown = true;
					return null;
				}
			}
			for (Row row : original) {
				if (!row.holds(values)) {
					unknown = true;
					return null;
				}
			}
			if (!productsAgree(values)) {
				unknown = true;
				return null;
			}
			return values;
		}

		private boolean productsAgree(Rational[] values) {
			for (Map.Entry<Monomial, Integer> e : index.entrySet()) {
				if (e.getKey().degree() < 2) {
					continue;
				}
				BigInteger product = BigInteger.ONE;
				for (Atom factor : e.getKey().getFactors()) {
					Integer column = index.get(Monomial.of(factor));
					if (column == null) {
						return false;
					}
					product = product.multiply(values[column].getNumerator());
				}
				if (!product.equals(values[e.getValue()].getNumerator())) {
					return false;
				}
			}
			return true;
		}

		private List<Row> monomialBounds(List<Row> rows) {
			Map<Atom, BigInteger> lowerBounds = new LinkedHashMap<>();
			for (Map.Entry<Monomial, Integer> e : index.entrySet()) {
				if (e.getKey().degree() != 1) {
					continue;
				}
				Atom atom = e.getKey().getFactors().get(0);
				int variable = e.getValue();
				BigInteger best = BigInteger.ZERO;
				for (Row row : rows) {
					if (row.onlyVariable() != variable || (!row.equality && row.coefficients[variable].signum() < 0)) {
						continue;
					}
					BigInteger bound = Rational.of(row.constant.negate(), row.coefficients[variable]).ceil();
					best = best.max(bound);
				}
				lowerBounds.put(atom, best);
			}
			List<Row> result = new ArrayList<>();
			for (Map.Entry<Monomial, Integer> e : index.entrySet()) {
				if (e.getKey().degree() < 2) {
					continue;
				}
				BigInteger product = BigInteger.ONE;
				for (Atom factor : e.getKey().getFactors()) {
					product = product.multiply(lowerBounds.getOrDefault(factor, BigInteger.ZERO));
				}
				if (product.signum() > 0) {
					result.add(Row.atLeast(e.getValue(), size, product));
				}
			}
			return result;
		}

		private List<Row> eliminateEqualities(List<Row> active) {
			while (true) {
				Row equality = null;
				for (Row row : active) {
					if (row.equality) {
						equality = row;
						break;
					}
				}
				if (equality == null) {
					return active;
				}
				Row chosen = equality;
				int variable = -1;
				for (int i = 0; i < size; i++) {
					BigInteger c = equality.coefficients[i].abs();
					if (c.signum() != 0 && (variable == -1 || c.compareTo(equality.coefficients[variable].abs()) < 0)) {
						variable = i;
					}
				}
				if (equality.coefficients[variable].signum() < 0) {
					equality = equality.scaled(BigInteger.ONE.negate());
				}
				BigInteger pivot = equality.coefficients[variable];
				List<Row> next = new ArrayList<>();
				for (Row row : active) {
					if (row == chosen) {
						continue;
					}
					Row substituted = row;
					BigInteger c = row.coefficients[variable];
					if (c.signum() != 0) {
						substituted = row.scaled(pivot).plus(equality.scaled(c.negate()), row.equality).normalized();
						if (substituted == null) {
							return null;
						}
					}
					if (substituted.isConstant()) {
						if (!substituted.constantHolds()) {
							return null;
						}
						continue;
					}
					next.add(substituted);
				}
				steps.add(new Step(variable, equality, null, null));
				active = next;
			}
		}

		private List<Row> eliminate(int variable, List<Row> active) {
			List<Row> lower = new ArrayList<>();
			List<Row> upper = new ArrayList<>();
			Set<Row> next = new LinkedHashSet<>();
			for (Row row : active) {
				int sign = row.coefficients[variable].signum();
				if (sign > 0) {
					lower.add(row);
				} else if (sign < 0) {
					upper.add(row);
				} else {
					next.add(row);
				}
			}
			if (lower.isEmpty() && upper.isEmpty()) {
				return active;
			}
			steps.add(new Step(variable, null, lower, upper));
			for (Row p : lower) {
				for (Row q : upper) {
					Row combined = p.scaled(q.coefficients[variable].negate())
							.plus(q.scaled(p.coefficients[variable]), false)
							.normalized();
					if (combined.isConstant()) {
						if (!combined.constantHolds()) {
							return null;
						}
						continue;
					}
					next.add(combined);
					if (next.size() > MAX_ROWS) {
						unknown = true;
						return null;
					}
				}
			}
			return new ArrayList<>(next);
		}

		private Rational[] backSubstitute() {
			Rational[] values = new Rational[size];
			Arrays.fill(values, Rational.ZERO);
			for (int s = steps.size() - 1; s >= 0; s--) {
				Step step = steps.get(s);
				int variable = step.variable;
				if (step.equality != null) {
					values[variable] = step.equality.bound(variable, values);
					continue;
				}
				Rational lo = null;
				for (Row row : step.lower) {
					Rational b = row.bound(variable, values);
					if (lo == null || b.compareTo(lo) > 0) {
						lo = b;
					}
				}
				Rational hi = null;
				for (Row row : step.upper) {
					Rational b = row.bound(variable, values);
					if (hi == null || b.compareTo(hi) < 0) {
						hi = b;
					}
				}
				Rational value;
				if (lo != null) {
					value = Rational.of(lo.ceil());
					if (hi != null && value.compareTo(hi) > 0) {
						value = lo;
					}
				} else {
					value = Rational.of(hi.floor());
				}
				values[variable] = value;
			}
			return values;
		}
	}
}
