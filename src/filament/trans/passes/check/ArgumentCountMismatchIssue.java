package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.util.SourceLocatable;

public class ArgumentCountMismatchIssue extends Issue {
	private final SourceLocatable where;
	private final String target;
	private final int expected;
	private final int actual;

	public ArgumentCountMismatchIssue(SourceLocatable where, String target, int expected, int actual) {
		this.where = where;
		this.target = target;
		this.expected = expected;
		this.actual = actual;
	}

	public SourceLocatable getWhere() {
		return where;
	}

	public String getTarget() {
		return target;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
