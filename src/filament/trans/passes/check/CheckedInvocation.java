package filament.trans.passes.check;

import filament.model.ast.FilInvocation;
import filament.model.ast.FilPortRef;
import filament.model.expr.TimeExpression;

import java.util.List;

public final class CheckedInvocation {
	private final String name;
	private final String instance;
	private final TimeExpression time;
	private final List<FilPortRef> arguments;
	private final FilInvocation node;

	public CheckedInvocation(String name, String instance, TimeExpression time, List<FilPortRef> arguments,
	                         FilInvocation node) {
		this.name = name;
		this.instance = instance;
		this.time = time;
		this.arguments = arguments;
		this.node = node;
	}

	public String getName() {
		return name;
	}

	public String getInstance() {
		return instance;
	}

	/**
	 * @return the start time; its offset mentions value parameters and instance existentials only
	 */
	public TimeExpression getTime() {
		return time;
	}

	public List<FilPortRef> getArguments() {
		return arguments;
	}

	public FilInvocation getNode() {
		return node;
	}
}
