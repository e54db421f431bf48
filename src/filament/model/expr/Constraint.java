package filament.model.expr;

import filament.util.SourceLocatable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A comparison between two expressions over naturals, tagged with the clause that produced it.
 */
public final class Constraint {

	public enum Comparison {
		EQ("="),
		GE(">="),
		GT(">");

		private final String symbol;

		Comparison(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public enum Reason {
		GUARD("guard"),
		INTERVAL_MATCH("interval match"),
		WIDTH_MATCH("width match"),
		INTERVAL_WELL_FORMED("interval well-formedness"),
		REUSE("instance reuse"),
		EXISTENTIAL_DEFINITION("existential definition"),
		EXISTENTIAL_GUARD("existential guard"),
		DELAY_BOUND("delay bound");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Expression lhs;
	private final Comparison comparison;
	private final Expression rhs;
	private final Reason reason;
	private final SourceLocatable origin;

	public Constraint(Expression lhs, Comparison comparison, Expression rhs, Reason reason, SourceLocatable origin) {
		this.lhs = lhs;
		this.comparison = comparison;
		this.rhs = rhs;
		this.reason = reason;
		this.origin = origin;
	}

	public static Constraint eq(Expression lhs, Expression rhs, Reason reason, SourceLocatable origin) {
		return new Constraint(lhs, Comparison.EQ, rhs, reason, origin);
	}

	public static Constraint ge(Expression lhs, Expression rhs, Reason reason, SourceLocatable origin) {
		return new Constraint(lhs, Comparison.GE, rhs, reason, origin);
	}

	public static Constraint gt(Expression lhs, Expression rhs, Reason reason, SourceLocatable origin) {
		return new Constraint(lhs, Comparison.GT, rhs, reason, origin);
	}

	public Expression getLhs() {
		return lhs;
	}

	public Comparison getComparison() {
		return comparison;
	}

	public Expression getRhs() {
		return rhs;
	}

	public Reason getReason() {
		return reason;
	}

	/**
	 * @return the source node that produced this constraint, or null for synthesized constraints
	 */
	public SourceLocatable getOrigin() {
		return origin;
	}

	/**
	 * @return lhs - rhs, so that this constraint reads "difference (=|>=|>) 0"
	 */
	public Expression difference() {
		return lhs.minus(rhs);
	}

	public Constraint substitute(Map<Atom, Expression> substitution) {
		return new Constraint(lhs.substitute(substitution), comparison, rhs.substitute(substitution), reason, origin);
	}

	public Constraint withReason(Reason newReason, SourceLocatable newOrigin) {
		return new Constraint(lhs, comparison, rhs, newReason, newOrigin);
	}

	public SortedSet<Atom> getAtoms() {
		SortedSet<Atom> atoms = new TreeSet<>(lhs.getAtoms());
		atoms.addAll(rhs.getAtoms());
		return atoms;
	}

	public boolean mentions(Atom atom) {
		return lhs.mentions(atom) || rhs.mentions(atom);
	}

	public boolean isGround() {
		return difference().isConstant();
	}

	/**
	 * @return true when the constraint holds by its canonical form alone, without knowing any atom
	 */
	public boolean isTriviallyTrue() {
		Expression diff = difference();
		if (!diff.isConstant()) {
			return false;
		}
		return holds(diff.getConstant());
	}

	private boolean holds(long diff) {
		switch (comparison) {
			case EQ:
				return diff == 0;
			case GE:
				return diff >= 0;
			case GT:
				return diff > 0;
			default:
				throw new IllegalStateException("unknown comparison " + comparison);
		}
	}

	public boolean evaluate(Map<Atom, Long> valuation) {
		return holds(difference().evaluate(valuation));
	}

	/**
	 * @return constraints whose disjunction is the negation of this one
	 */
	public List<Constraint> negation() {
		switch (comparison) {
			case EQ:
				return Arrays.asList(gt(lhs, rhs, reason, origin), gt(rhs, lhs, reason, origin));
			case GE:
				return Collections.singletonList(gt(rhs, lhs, reason, origin));
			case GT:
				return Collections.singletonList(ge(rhs, lhs, reason, origin));
			default:
				throw new IllegalStateException("unknown comparison " + comparison);
		}
	}

	public String render() {
		return lhs.render() + " " + comparison.getSymbol() + " " + rhs.render();
	}

	// reason and origin are bookkeeping and do not take part in equality
	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Constraint that = (Constraint) o;
		return lhs.equals(that.lhs) && comparison == that.comparison && rhs.equals(that.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, comparison, rhs);
	}

	@Override
	public String toString() {
		return render();
	}
}
