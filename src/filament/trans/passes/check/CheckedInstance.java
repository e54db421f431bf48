package filament.trans.passes.check;

import filament.model.ast.FilInstance;
import filament.model.expr.Expression;

import java.util.List;

public final class CheckedInstance {
	private final String name;
	private final String component;
	private final List<Expression> arguments;
	private final FilInstance node;

	public CheckedInstance(String name, String component, List<Expression> arguments, FilInstance node) {
		this.name = name;
		this.component = component;
		this.arguments = arguments;
		this.node = node;
	}

	public String getName() {
		return name;
	}

	public String getComponent() {
		return component;
	}

	/**
	 * @return the arguments, over the value parameters of the enclosing component
	 */
	public List<Expression> getArguments() {
		return arguments;
	}

	public FilInstance getNode() {
		return node;
	}
}
