package filament.trans.intermediate;

import filament.InternalCompilerError;
import filament.model.ast.FilComponent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Every component definition of a program, with the instantiation graph between them. Owns the definitions;
 * everything downstream refers to them by name.
 */
public class DefinitionRegistry {
	private final Map<String, FilComponent> components;
	private final Map<String, Set<String>> instantiations;
	private List<List<String>> levels;

	public DefinitionRegistry() {
		this.components = new LinkedHashMap<>();
		this.instantiations = new LinkedHashMap<>();
		this.levels = null;
	}

	/**
	 * @return false, leaving the registry unchanged, if a component of that name already exists
	 */
	public boolean addComponent(FilComponent component) {
		String name = component.getName().getId();
		if (components.containsKey(name)) {
			return false;
		}
		components.put(name, component);
		instantiations.put(name, new LinkedHashSet<>());
		levels = null;
		return true;
	}

	public Optional<FilComponent> findComponent(String name) {
		return Optional.ofNullable(components.get(name));
	}

	public FilComponent getComponent(String name) {
		FilComponent component = components.get(name);
		if (component == null) {
			throw new InternalCompilerError("component " + name + " was not registered");
		}
		return component;
	}

	public Collection<FilComponent> getComponents() {
		return Collections.unmodifiableCollection(components.values());
	}

	public void addInstantiation(String from, String to) {
		instantiations.get(from).add(to);
		levels = null;
	}

	public Set<String> getInstantiations(String from) {
		return Collections.unmodifiableSet(instantiations.get(from));
	}

	/**
	 * Groups components so that each one only instantiates components of earlier groups. Components on an
	 * instantiation cycle cannot be ordered and are put together in a final group.
	 */
	public List<List<String>> getLevels() {
		if (levels != null) {
			return levels;
		}
		Map<String, Integer> pending = new LinkedHashMap<>();
		Map<String, List<String>> users = new LinkedHashMap<>();
		for (String name : components.keySet()) {
			users.put(name, new ArrayList<>());
		}
		for (Map.Entry<String, Set<String>> e : instantiations.entrySet()) {
			pending.put(e.getKey(), e.getValue().size());
			for (String callee : e.getValue()) {
				users.get(callee).add(e.getKey());
			}
		}
		List<List<String>> result = new ArrayList<>();
		List<String> ready = new ArrayList<>();
		for (Map.Entry<String, Integer> e : pending.entrySet()) {
			if (e.getValue() == 0) {
				ready.add(e.getKey());
			}
		}
		while (!ready.isEmpty()) {
			result.add(Collections.unmodifiableList(ready));
			List<String> next = new ArrayList<>();
			for (String done : ready) {
				pending.remove(done);
				for (String user : users.get(done)) {
					int remaining = pending.merge(user, -1, Integer::sum);
					if (remaining == 0) {
						next.add(user);
					}
				}
			}
			ready = next;
		}
		if (!pending.isEmpty()) {
			result.add(Collections.unmodifiableList(new ArrayList<>(pending.keySet())));
		}
		levels = Collections.unmodifiableList(result);
		return levels;
	}

	public List<String> getTopologicalOrder() {
		List<String> order = new ArrayList<>();
		for (List<String> level : getLevels()) {
			order.addAll(level);
		}
		return order;
	}
}
