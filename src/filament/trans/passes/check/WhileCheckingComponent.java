package filament.trans.passes.check;

import filament.errors.Context;
import filament.errors.ContextVisitor;
import filament.model.ast.FilComponent;

public class WhileCheckingComponent extends Context {

	public WhileCheckingComponent(FilComponent component) {
		super(component.getName().getId());
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
