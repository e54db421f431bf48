package filament.scope;

import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A map that extends another map. Lookups fall through to the parent, but modifications only affect the local
 * map, never the parent.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class ChainMap<K, V> extends AbstractMap<K, V> {
	private final Map<K, V> parent;
	private final Map<K, V> members;

	public ChainMap(Map<K, V> parent) {
		this.parent = parent;
		this.members = new LinkedHashMap<>();
	}

	@Override
	public boolean containsKey(Object k) {
		return members.containsKey(k) || parent.containsKey(k);
	}

	@Override
	public V get(Object k) {
		V result = members.get(k);
		if (result == null) {
			return parent.get(k);
		}
		return result;
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		// local members shadow the parent
		Map<K, V> result = new LinkedHashMap<>(parent);
		result.putAll(members);
		return result.entrySet();
	}

	@Override
	public V put(K k, V v) {
		return members.put(k, v);
	}

	@Override
	public V remove(Object k) {
		return members.remove(k);
	}

	@Override
	public void clear() {
		members.clear();
	}
}
