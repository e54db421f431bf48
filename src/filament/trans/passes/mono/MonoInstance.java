package filament.trans.passes.mono;

public final class MonoInstance {
	private final String name;
	private final SpecializationKey component;

	public MonoInstance(String name, SpecializationKey component) {
		this.name = name;
		this.component = component;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the key of the specialization this instance refers to, shared with every other instance of it
	 */
	public SpecializationKey getComponent() {
		return component;
	}
}
