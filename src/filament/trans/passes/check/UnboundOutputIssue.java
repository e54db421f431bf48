package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.ast.FilPort;

public class UnboundOutputIssue extends Issue {
	private final FilPort port;
	private final int bindings;

	public UnboundOutputIssue(FilPort port, int bindings) {
		this.port = port;
		this.bindings = bindings;
	}

	public FilPort getPort() {
		return port;
	}

	/**
	 * @return how many times the output is bound; anything but exactly one is an error
	 */
	public int getBindings() {
		return bindings;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
