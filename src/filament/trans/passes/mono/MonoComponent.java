package filament.trans.passes.mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A fully concrete component: every value parameter is a literal, every existential has its value, and every
 * interval is a pair of cycle offsets from the component's event at cycle 0.
 */
public final class MonoComponent {
	private final SpecializationKey key;
	private final boolean extern;
	private final String event;
	private final long delay;
	private final Map<String, Long> existentials;
	private final MonoPort interfacePort;
	private final List<MonoPort> inputs;
	private final List<MonoPort> outputs;
	private final List<MonoInstance> instances;
	private final List<MonoInvocation> invocations;
	private final List<MonoOutputBinding> bindings;

	public MonoComponent(SpecializationKey key, boolean extern, String event, long delay,
	                     Map<String, Long> existentials, MonoPort interfacePort, List<MonoPort> inputs,
	                     List<MonoPort> outputs, List<MonoInstance> instances, List<MonoInvocation> invocations,
	                     List<MonoOutputBinding> bindings) {
		this.key = key;
		this.extern = extern;
		this.event = event;
		this.delay = delay;
		this.existentials = Collections.unmodifiableMap(existentials);
		this.interfacePort = interfacePort;
		this.inputs = Collections.unmodifiableList(inputs);
		this.outputs = Collections.unmodifiableList(outputs);
		this.instances = Collections.unmodifiableList(instances);
		this.invocations = Collections.unmodifiableList(invocations);
		this.bindings = Collections.unmodifiableList(bindings);
	}

	public SpecializationKey getKey() {
		return key;
	}

	public String getName() {
		return key.mangledName();
	}

	public boolean isExtern() {
		return extern;
	}

	public String getEvent() {
		return event;
	}

	public long getDelay() {
		return delay;
	}

	public Map<String, Long> getExistentials() {
		return existentials;
	}

	public Optional<MonoPort> getInterfacePort() {
		return Optional.ofNullable(interfacePort);
	}

	public List<MonoPort> getInputs() {
		return inputs;
	}

	public List<MonoPort> getOutputs() {
		return outputs;
	}

	/**
	 * @return the interface port, if any, then the data inputs, then the outputs
	 */
	public List<MonoPort> getPorts() {
		List<MonoPort> ports = new ArrayList<>();
		if (interfacePort != null) {
			ports.add(interfacePort);
		}
		ports.addAll(inputs);
		ports.addAll(outputs);
		return ports;
	}

	public List<MonoInstance> getInstances() {
		return instances;
	}

	public List<MonoInvocation> getInvocations() {
		return invocations;
	}

	public List<MonoOutputBinding> getBindings() {
		return bindings;
	}
}
