package filament.model.ast;

import filament.util.SourceLocation;

import java.util.List;

/**
 * AST node:
 *
 * exists L (= definition)? (where guards)?;
 */
public class FilExistential extends FilNode {
	private final FilName name;
	private final FilExpression definition;
	private final List<FilGuard> guards;

	public FilExistential(SourceLocation location, FilName name, FilExpression definition, List<FilGuard> guards) {
		super(location);
		this.name = name;
		this.definition = definition;
		this.guards = guards;
	}

	public FilName getName() {
		return name;
	}

	/**
	 * @return the defining expression, or null when the existential is left to the solver
	 */
	public FilExpression getDefinition() {
		return definition;
	}

	public List<FilGuard> getGuards() {
		return guards;
	}
}
