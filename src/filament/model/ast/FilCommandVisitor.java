package filament.model.ast;

public abstract class FilCommandVisitor<T, E extends Throwable> {
	public abstract T visit(FilInstance instance) throws E;
	public abstract T visit(FilInvocation invocation) throws E;
	public abstract T visit(FilExistentialDefinition existentialDefinition) throws E;
	public abstract T visit(FilOutputBinding outputBinding) throws E;
}
