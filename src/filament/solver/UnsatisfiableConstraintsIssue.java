package filament.solver;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;

import java.util.List;
import java.util.Map;

public class UnsatisfiableConstraintsIssue extends Issue {
	private final String subject;
	private final List<Constraint> clauses;
	private final Map<Atom, Long> counterexample;

	/**
	 * @param subject what was being solved or proved, e.g. "existentials of Mul[32, 3]"
	 * @param clauses the offending clauses, each tagged with the source that produced it
	 */
	public UnsatisfiableConstraintsIssue(String subject, List<Constraint> clauses, Map<Atom, Long> counterexample) {
		this.subject = subject;
		this.clauses = clauses;
		this.counterexample = counterexample;
	}

	public String getSubject() {
		return subject;
	}

	public List<Constraint> getClauses() {
		return clauses;
	}

	public Map<Atom, Long> getCounterexample() {
		return counterexample;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
