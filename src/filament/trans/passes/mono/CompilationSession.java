package filament.trans.passes.mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the specialization cache of one compilation. Created before monomorphization and dropped after emission.
 *
 * The cache is only ever extended through {@link #insertIfAbsent}, so workers racing on the same key all end up
 * with the instance that was stored first.
 */
public final class CompilationSession {
	private final Map<SpecializationKey, MonoComponent> specializations = new ConcurrentHashMap<>();

	public Optional<MonoComponent> lookup(SpecializationKey key) {
		return Optional.ofNullable(specializations.get(key));
	}

	/**
	 * @return the cached specialization for the key of the argument, which is the argument itself unless another
	 * one was stored first
	 */
	public MonoComponent insertIfAbsent(MonoComponent component) {
		MonoComponent existing = specializations.putIfAbsent(component.getKey(), component);
		return existing == null ? component : existing;
	}

	public int size() {
		return specializations.size();
	}
}
