package filament.trans.passes.mono;

import filament.errors.Context;
import filament.errors.ContextVisitor;

public class WhileSpecializing extends Context {

	public WhileSpecializing(SpecializationKey key) {
		super(key.render());
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
