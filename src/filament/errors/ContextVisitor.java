package filament.errors;

import filament.trans.passes.check.WhileCheckingComponent;
import filament.trans.passes.load.WhileLoadingImport;
import filament.trans.passes.mono.WhileSpecializing;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileLoadingImport whileLoadingImport) throws E;
	public abstract T visit(WhileCheckingComponent whileCheckingComponent) throws E;
	public abstract T visit(WhileSpecializing whileSpecializing) throws E;

}
