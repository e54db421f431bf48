package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.util.SourceLocatable;

public class UnderconstrainedExistentialIssue extends Issue {
	private final SourceLocatable where;
	private final String existential;
	private final String description;

	public UnderconstrainedExistentialIssue(SourceLocatable where, String existential, String description) {
		this.where = where;
		this.existential = existential;
		this.description = description;
	}

	public SourceLocatable getWhere() {
		return where;
	}

	public String getExistential() {
		return existential;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
