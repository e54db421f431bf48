package filament.model.ast;

import filament.util.SourceLocation;

import java.util.List;

/**
 * AST node:
 *
 * extern? comp Name[params]&lt;G: delay&gt;(inputs) -&gt; (outputs) with { existentials } where guards { body }
 *
 * The body is null for extern components.
 */
public class FilComponent extends FilNode {
	private final FilName name;
	private final boolean extern;
	private final List<FilName> params;
	private final FilName event;
	private final FilExpression delay;
	private final List<FilPort> inputs;
	private final List<FilPort> outputs;
	private final List<FilExistential> existentials;
	private final List<FilGuard> guards;
	private final List<FilCommand> body;

	public FilComponent(SourceLocation location, FilName name, boolean extern, List<FilName> params, FilName event,
	                    FilExpression delay, List<FilPort> inputs, List<FilPort> outputs,
	                    List<FilExistential> existentials, List<FilGuard> guards, List<FilCommand> body) {
		super(location);
		this.name = name;
		this.extern = extern;
		this.params = params;
		this.event = event;
		this.delay = delay;
		this.inputs = inputs;
		this.outputs = outputs;
		this.existentials = existentials;
		this.guards = guards;
		this.body = body;
	}

	public FilName getName() {
		return name;
	}

	public boolean isExtern() {
		return extern;
	}

	public List<FilName> getParams() {
		return params;
	}

	public FilName getEvent() {
		return event;
	}

	public FilExpression getDelay() {
		return delay;
	}

	public List<FilPort> getInputs() {
		return inputs;
	}

	public List<FilPort> getOutputs() {
		return outputs;
	}

	public List<FilExistential> getExistentials() {
		return existentials;
	}

	public List<FilGuard> getGuards() {
		return guards;
	}

	public List<FilCommand> getBody() {
		return body;
	}
}
