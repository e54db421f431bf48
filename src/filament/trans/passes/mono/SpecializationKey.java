package filament.trans.passes.mono;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Identifies one specialization: a definition name and the literal value of each of its parameters.
 */
public final class SpecializationKey {
	private final String definition;
	private final List<Long> arguments;

	public SpecializationKey(String definition, List<Long> arguments) {
		this.definition = definition;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public String getDefinition() {
		return definition;
	}

	public List<Long> getArguments() {
		return arguments;
	}

	/**
	 * @return the name of the specialized component, e.g. Mul_32_3
	 */
	public String mangledName() {
		if (arguments.isEmpty()) {
			return definition;
		}
		return definition + "_" + arguments.stream().map(String::valueOf).collect(Collectors.joining("_"));
	}

	public String render() {
		if (arguments.isEmpty()) {
			return definition;
		}
		return definition + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpecializationKey that = (SpecializationKey) o;
		return definition.equals(that.definition) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(definition, arguments);
	}

	@Override
	public String toString() {
		return render();
	}
}
