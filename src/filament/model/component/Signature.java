package filament.model.component;

import filament.model.ast.FilComponent;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The part of a component its users see: parameters, event and delay, ports, existentials and guards. All
 * intervals are relative to the component's own event.
 */
public final class Signature {
	private final FilComponent node;
	private final List<String> params;
	private final String event;
	private final Expression delay;
	private final Port interfacePort;
	private final List<Port> inputs;
	private final List<Port> outputs;
	private final List<ExistentialParameter> existentials;
	private final List<Constraint> guards;

	public Signature(FilComponent node, List<String> params, String event, Expression delay, Port interfacePort,
	                 List<Port> inputs, List<Port> outputs, List<ExistentialParameter> existentials,
	                 List<Constraint> guards) {
		this.node = node;
		this.params = Collections.unmodifiableList(new ArrayList<>(params));
		this.event = event;
		this.delay = delay;
		this.interfacePort = interfacePort;
		this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
		this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
		this.existentials = Collections.unmodifiableList(new ArrayList<>(existentials));
		this.guards = Collections.unmodifiableList(new ArrayList<>(guards));
	}

	public String getName() {
		return node.getName().getId();
	}

	public boolean isExtern() {
		return node.isExtern();
	}

	public FilComponent getNode() {
		return node;
	}

	public List<String> getParams() {
		return params;
	}

	public String getEvent() {
		return event;
	}

	public Expression getDelay() {
		return delay;
	}

	/**
	 * @return the interface port, which is never passed explicitly, or null
	 */
	public Port getInterfacePort() {
		return interfacePort;
	}

	/**
	 * @return the data inputs, in the order invocations supply them
	 */
	public List<Port> getInputs() {
		return inputs;
	}

	public List<Port> getOutputs() {
		return outputs;
	}

	public Optional<Port> findPort(String name) {
		if (interfacePort != null && interfacePort.getName().equals(name)) {
			return Optional.of(interfacePort);
		}
		for (Port port : inputs) {
			if (port.getName().equals(name)) {
				return Optional.of(port);
			}
		}
		for (Port port : outputs) {
			if (port.getName().equals(name)) {
				return Optional.of(port);
			}
		}
		return Optional.empty();
	}

	public List<ExistentialParameter> getExistentials() {
		return existentials;
	}

	public Optional<ExistentialParameter> findExistential(String name) {
		for (ExistentialParameter existential : existentials) {
			if (existential.getName().equals(name)) {
				return Optional.of(existential);
			}
		}
		return Optional.empty();
	}

	public List<Constraint> getGuards() {
		return guards;
	}

	public List<Atom> getParamAtoms() {
		List<Atom> atoms = new ArrayList<>();
		for (String param : params) {
			atoms.add(Atom.parameter(param));
		}
		return atoms;
	}
}
