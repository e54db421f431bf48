package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.ast.FilPort;

public class InterfaceTimingIssue extends Issue {
	private final FilPort port;
	private final String description;

	public InterfaceTimingIssue(FilPort port, String description) {
		this.port = port;
		this.description = description;
	}

	public FilPort getPort() {
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
