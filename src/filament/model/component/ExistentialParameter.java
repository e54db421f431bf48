package filament.model.component;

import filament.model.ast.FilExistential;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;

import java.util.List;

/**
 * An existential parameter. Its guards are published to users of the component; its definition is not.
 */
public final class ExistentialParameter {
	private final String name;
	private final Expression definition;
	private final List<Constraint> guards;
	private final FilExistential node;

	public ExistentialParameter(String name, Expression definition, List<Constraint> guards, FilExistential node) {
		this.name = name;
		this.definition = definition;
		this.guards = guards;
		this.node = node;
	}

	public String getName() {
		return name;
	}

	public Atom getAtom() {
		return Atom.existential(name);
	}

	/**
	 * @return the definition given in the signature's with block, or null
	 */
	public Expression getDefinition() {
		return definition;
	}

	public List<Constraint> getGuards() {
		return guards;
	}

	public FilExistential getNode() {
		return node;
	}
}
