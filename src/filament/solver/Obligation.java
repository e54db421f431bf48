package filament.solver;

import filament.errors.Issue;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * A conjunction of constraints that must hold for every value of the atoms it mentions, together with the issue
 * to report when it does not. The issue factory receives a counterexample, or null when none is available.
 */
public final class Obligation {
	private final List<Constraint> clauses;
	private final Function<Map<Atom, Long>, Issue> onFailure;

	public Obligation(List<Constraint> clauses, Function<Map<Atom, Long>, Issue> onFailure) {
		this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
		this.onFailure = onFailure;
	}

	public static Obligation of(Constraint clause, Function<Map<Atom, Long>, Issue> onFailure) {
		return new Obligation(Collections.singletonList(clause), onFailure);
	}

	public List<Constraint> getClauses() {
		return clauses;
	}

	public Issue failure(Map<Atom, Long> counterexample) {
		return onFailure.apply(counterexample);
	}

	public SortedSet<Atom> getAtoms() {
		SortedSet<Atom> atoms = new TreeSet<>();
		for (Constraint c : clauses) {
			atoms.addAll(c.getAtoms());
		}
		return atoms;
	}

	public Obligation substitute(Map<Atom, Expression> substitution) {
		List<Constraint> substituted = new ArrayList<>();
		for (Constraint c : clauses) {
			substituted.add(c.substitute(substitution));
		}
		return new Obligation(substituted, onFailure);
	}

	/**
	 * @return the obligation without clauses that hold by their canonical form alone
	 */
	public Obligation simplified() {
		List<Constraint> remaining = new ArrayList<>();
		for (Constraint c : clauses) {
			if (!c.isTriviallyTrue()) {
				remaining.add(c);
			}
		}
		return new Obligation(remaining, onFailure);
	}

	public boolean isGround() {
		for (Constraint c : clauses) {
			if (!c.isGround()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the constraints whose disjunction is the negation of this obligation
	 */
	public List<Constraint> negation() {
		List<Constraint> result = new ArrayList<>();
		for (Constraint c : clauses) {
			result.addAll(c.negation());
		}
		return result;
	}
}
