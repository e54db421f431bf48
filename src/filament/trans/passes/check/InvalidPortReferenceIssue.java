package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.util.SourceLocatable;

public class InvalidPortReferenceIssue extends Issue {
	private final SourceLocatable reference;
	private final String port;
	private final String description;

	public InvalidPortReferenceIssue(SourceLocatable reference, String port, String description) {
		this.reference = reference;
		this.port = port;
		this.description = description;
	}

	public SourceLocatable getReference() {
		return reference;
	}

	public String getPort() {
		return port;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
