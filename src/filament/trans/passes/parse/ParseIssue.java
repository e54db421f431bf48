package filament.trans.passes.parse;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.parser.FilParseException;

public class ParseIssue extends Issue {
	private final FilParseException error;

	public ParseIssue(FilParseException error) {
		this.error = error;
	}

	public FilParseException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
