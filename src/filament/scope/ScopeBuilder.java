package filament.scope;

import filament.errors.IssueContext;
import filament.trans.passes.scope.DuplicateDefinitionIssue;
import filament.trans.passes.scope.UnboundIdentifierIssue;
import filament.util.SourceLocatable;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class ScopeBuilder {
	private final IssueContext ctx;
	private final Map<String, Declaration> declarations;

	public ScopeBuilder(IssueContext ctx) {
		this(ctx, new LinkedHashMap<>());
	}

	private ScopeBuilder(IssueContext ctx, Map<String, Declaration> declarations) {
		this.ctx = ctx;
		this.declarations = declarations;
	}

	public ScopeBuilder makeNestedScope() {
		return new ScopeBuilder(ctx, new ChainMap<>(declarations));
	}

	public IssueContext getIssueContext() {
		return ctx;
	}

	public boolean declare(Declaration declaration) {
		Declaration existing = declarations.get(declaration.getName());
		if (existing != null) {
			ctx.error(new DuplicateDefinitionIssue(declaration.getName(), existing.getNode(), declaration.getNode()));
			return false;
		}
		declarations.put(declaration.getName(), declaration);
		return true;
	}

	public Optional<Declaration> lookup(String name) {
		return Optional.ofNullable(declarations.get(name));
	}

	/**
	 * Resolves a use of a name, reporting it as unbound if it is undeclared or declares something not allowed
	 * at this use.
	 *
	 * @param usage describes the use in diagnostics, e.g. "instance arguments"
	 */
	public Optional<Declaration> reference(SourceLocatable from, String name, EnumSet<Declaration.Kind> allowed,
	                                       String usage) {
		Declaration declaration = declarations.get(name);
		if (declaration == null || !allowed.contains(declaration.getKind())) {
			ctx.error(new UnboundIdentifierIssue(from, name, usage));
			return Optional.empty();
		}
		return Optional.of(declaration);
	}
}
