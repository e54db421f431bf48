package filament.trans.passes.scope;

import filament.model.ast.FilBinOp;
import filament.model.ast.FilComponent;
import filament.model.ast.FilExistential;
import filament.model.ast.FilExpressionVisitor;
import filament.model.ast.FilFieldAccess;
import filament.model.ast.FilNumber;
import filament.model.ast.FilVariable;
import filament.scope.Declaration;
import filament.scope.ScopeBuilder;
import filament.trans.intermediate.DefinitionRegistry;

import java.util.EnumSet;
import java.util.Optional;

public class FilExpressionScopingVisitor extends FilExpressionVisitor<Void, RuntimeException> {
	private final ScopeBuilder scope;
	private final DefinitionRegistry registry;
	private final EnumSet<Declaration.Kind> allowed;
	private final boolean allowInstanceExistentials;
	private final String usage;

	/**
	 * @param allowInstanceExistentials whether instance.existential references are allowed here
	 * @param usage describes this position in diagnostics
	 */
	public FilExpressionScopingVisitor(ScopeBuilder scope, DefinitionRegistry registry,
	                                   EnumSet<Declaration.Kind> allowed, boolean allowInstanceExistentials,
	                                   String usage) {
		this.scope = scope;
		this.registry = registry;
		this.allowed = allowed;
		this.allowInstanceExistentials = allowInstanceExistentials;
		this.usage = usage;
	}

	@Override
	public Void visit(FilNumber number) {
		return null;
	}

	@Override
	public Void visit(FilVariable variable) {
		scope.reference(variable, variable.getName(), allowed, usage);
		return null;
	}

	@Override
	public Void visit(FilFieldAccess fieldAccess) {
		String rendered = fieldAccess.getInstance().getId() + "." + fieldAccess.getField().getId();
		if (!allowInstanceExistentials) {
			scope.getIssueContext().error(new UnboundIdentifierIssue(fieldAccess, rendered, usage));
			return null;
		}
		Optional<Declaration> instance = scope.reference(
				fieldAccess.getInstance(), fieldAccess.getInstance().getId(), EnumSet.of(Declaration.Kind.INSTANCE),
				usage);
		if (!instance.isPresent()) {
			return null;
		}
		Optional<FilComponent> callee = registry.findComponent(instance.get().getTarget());
		if (!callee.isPresent()) {
			// the instance itself is reported as unbound
			return null;
		}
		for (FilExistential existential : callee.get().getExistentials()) {
			if (existential.getName().getId().equals(fieldAccess.getField().getId())) {
				return null;
			}
		}
		scope.getIssueContext().error(new UnboundIdentifierIssue(
				fieldAccess.getField(), rendered, "existentials of " + callee.get().getName().getId()));
		return null;
	}

	@Override
	public Void visit(FilBinOp binOp) {
		binOp.getLhs().accept(this);
		binOp.getRhs().accept(this);
		return null;
	}
}
