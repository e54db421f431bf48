package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.expr.Atom;
import filament.model.expr.Expression;
import filament.util.SourceLocatable;

import java.util.Map;

public class BitwidthMismatchIssue extends Issue {
	private final SourceLocatable where;
	private final String port;
	private final Expression required;
	private final Expression supplied;
	private final Map<Atom, Long> counterexample;

	public BitwidthMismatchIssue(SourceLocatable where, String port, Expression required, Expression supplied,
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

	public Expression getRequired() {
		return required;
	}

	public Expression getSupplied() {
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
