package filament.trans.intermediate;

import filament.trans.passes.check.CheckedComponent;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Every component of a program after type checking, keyed by name in topological order of instantiation.
 */
public final class CheckedProgram {
	private final DefinitionRegistry registry;
	private final Map<String, CheckedComponent> components;

	public CheckedProgram(DefinitionRegistry registry, Map<String, CheckedComponent> components) {
		this.registry = registry;
		this.components = Collections.unmodifiableMap(components);
	}

	public DefinitionRegistry getRegistry() {
		return registry;
	}

	public Map<String, CheckedComponent> getComponents() {
		return components;
	}

	public Optional<CheckedComponent> findComponent(String name) {
		return Optional.ofNullable(components.get(name));
	}
}
