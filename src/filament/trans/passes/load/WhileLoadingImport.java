package filament.trans.passes.load;

import filament.errors.Context;
import filament.errors.ContextVisitor;
import filament.model.ast.FilImport;

public class WhileLoadingImport extends Context {

	private final FilImport fileImport;

	public WhileLoadingImport(FilImport fileImport) {
		super(fileImport.getPath());
		this.fileImport = fileImport;
	}

	public FilImport getImport() {
		return fileImport;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
