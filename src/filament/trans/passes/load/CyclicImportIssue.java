package filament.trans.passes.load;

import filament.errors.Issue;
import filament.errors.IssueVisitor;
import filament.model.ast.FilImport;

import java.nio.file.Path;
import java.util.List;

public class CyclicImportIssue extends Issue {
	private final FilImport fileImport;
	private final List<Path> chain;

	/**
	 * @param chain the files on the load stack, starting and ending with the file imported twice
	 */
	public CyclicImportIssue(FilImport fileImport, List<Path> chain) {
		this.fileImport = fileImport;
		this.chain = chain;
	}

	public FilImport getImport() {
		return fileImport;
	}

	public List<Path> getChain() {
		return chain;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
