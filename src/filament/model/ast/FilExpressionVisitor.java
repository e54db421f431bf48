package filament.model.ast;

public abstract class FilExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(FilNumber number) throws E;
	public abstract T visit(FilVariable variable) throws E;
	public abstract T visit(FilFieldAccess fieldAccess) throws E;
	public abstract T visit(FilBinOp binOp) throws E;
}
