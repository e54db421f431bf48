package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.expr.Atom;
import filament.util.SourceLocatable;

import java.util.Map;

public class MalformedIntervalIssue extends Issue {
	private final SourceLocatable where;
	private final String description;
	private final Map<Atom, Long> counterexample;

	public MalformedIntervalIssue(SourceLocatable where, String description, Map<Atom, Long> counterexample) {
		this.where = where;
		this.description = description;
		this.counterexample = counterexample;
	}

	public SourceLocatable getWhere() {
		return where;
	}

	public String getDescription() {
		return description;
	}

	public Map<Atom, Long> getCounterexample() {
		return counterexample;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
