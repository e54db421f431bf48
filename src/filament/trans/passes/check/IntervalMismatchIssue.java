package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.expr.Atom;
import filament.model.expr.Interval;
import filament.util.SourceLocatable;

import java.util.Map;

public class IntervalMismatchIssue extends Issue {
	private final SourceLocatable where;
	private final String port;
	private final Interval required;
	private final Interval supplied;
	private final Map<Atom, Long> counterexample;

	public IntervalMismatchIssue(SourceLocatable where, String port, Interval required, Interval supplied,
	                             Map<Atom, Long> counterexample) {
		this.where = where;
		this.port = port;
		this.required = required;
		this.supplied = supplied;
		this.counterexample = counterexample;
	}

	public SourceLocatable getWhere() {
		return where;
	}

	public String getPort() {
		return port;
	}

	public Interval getRequired() {
		return required;
	}

	public Interval getSupplied() {
		return supplied;
	}

	public Map<Atom, Long> getCounterexample() {
		return counterexample;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
