package filament.trans.passes.mono;

import java.util.Collections;
import java.util.Map;

/**
 * The specializations reachable from the entry point, callees before callers.
 */
public final class MonomorphizedProgram {
	private final SpecializationKey entry;
	private final Map<SpecializationKey, MonoComponent> components;

	public MonomorphizedProgram(SpecializationKey entry, Map<SpecializationKey, MonoComponent> components) {
		this.entry = entry;
		this.components = Collections.unmodifiableMap(components);
	}

	public SpecializationKey getEntry() {
		return entry;
	}

	public MonoComponent getEntryComponent() {
		return components.get(entry);
	}

	public Map<SpecializationKey, MonoComponent> getComponents() {
		return components;
	}
}
