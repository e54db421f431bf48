package filament.model.ast;

public abstract class FilPortRefVisitor<T, E extends Throwable> {
	public abstract T visit(FilThisPortRef thisPortRef) throws E;
	public abstract T visit(FilInvocationPortRef invocationPortRef) throws E;
	public abstract T visit(FilConstantPortRef constantPortRef) throws E;
}
