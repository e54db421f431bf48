package filament.trans.passes.load;

import filament.errors.Issue;
import filament.errors.IssueVisitor;

import java.io.IOException;
import java.nio.file.Path;

public class IOErrorIssue extends Issue {
	private final Path path;
	private final IOException error;

	public IOErrorIssue(Path path, IOException error) {
		this.path = path;
		this.error = error;
	}

	public Path getPath() {
		return path;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
