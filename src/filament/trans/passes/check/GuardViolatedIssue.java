package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.util.SourceLocatable;

import java.util.Map;

public class GuardViolatedIssue extends Issue {
	private final SourceLocatable where;
	private final String target;
	private final Constraint guard;
	private final Map<Atom, Long> counterexample;

	/**
	 * @param target the component whose guard is not met, with its arguments
	 * @param guard the guard after substituting the arguments
	 */
	public GuardViolatedIssue(SourceLocatable where, String target, Constraint guard, Map<Atom, Long> counterexample) {
		this.where = where;
		this.target = target;
		this.guard = guard;
		this.counterexample = counterexample;
	}

	public SourceLocatable getWhere() {
		return where;
	}

	public String getTarget() {
		return target;
	}

	public Constraint getGuard() {
		return guard;
	}

	public Map<Atom, Long> getCounterexample() {
		return counterexample;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
