package filament.trans.passes.scope;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.util.SourceLocatable;

public class DuplicateDefinitionIssue extends Issue {
	private final String name;
	private final SourceLocatable first;
	private final SourceLocatable second;

	public DuplicateDefinitionIssue(String name, SourceLocatable first, SourceLocatable second) {
		this.name = name;
		this.first = first;
		this.second = second;
	}

	public String getName() {
		return name;
	}

	public SourceLocatable getFirst() {
		return first;
	}

	public SourceLocatable getSecond() {
		return second;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
