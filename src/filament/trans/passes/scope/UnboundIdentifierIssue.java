package filament.trans.passes.scope;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.util.SourceLocatable;

public class UnboundIdentifierIssue extends Issue {
	private final SourceLocatable reference;
	private final String name;
	private final String usage;

	/**
	 * @param usage where the name was looked up, e.g. "instance arguments"
	 */
	public UnboundIdentifierIssue(SourceLocatable reference, String name, String usage) {
		this.reference = reference;
		this.name = name;
		this.usage = usage;
	}

	public SourceLocatable getReference() {
		return reference;
	}

	public String getName() {
		return name;
	}

	public String getUsage() {
		return usage;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
