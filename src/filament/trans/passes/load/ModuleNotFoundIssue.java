package filament.trans.passes.load;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.ast.FilImport;

import java.nio.file.Path;
import java.util.List;

public class ModuleNotFoundIssue extends Issue {
	private final FilImport fileImport;
	private final List<Path> searched;

	public ModuleNotFoundIssue(FilImport fileImport, List<Path> searched) {
		this.fileImport = fileImport;
		this.searched = searched;
	}

	public FilImport getImport() {
		return fileImport;
	}

	public List<Path> getSearched() {
		return searched;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
