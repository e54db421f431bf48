package filament.scope;

import filament.util.SourceLocatable;

import java.util.Objects;

/**
 * What a name inside a component resolves to.
 */
public final class Declaration {
	public enum Kind {
		PARAMETER("value parameter"),
		EVENT("event"),
		EXISTENTIAL("existential parameter"),
		PORT("port"),
		INSTANCE("instance"),
		INVOCATION("invocation");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Kind kind;
	private final String name;
	private final SourceLocatable node;
	private final String target;

	private Declaration(Kind kind, String name, SourceLocatable node, String target) {
		this.kind = kind;
		this.name = name;
		this.node = node;
		this.target = target;
	}

	public static Declaration of(Kind kind, String name, SourceLocatable node) {
		return new Declaration(kind, name, node, null);
	}

	/**
	 * @param component the name of the instantiated component definition
	 */
	public static Declaration instance(String name, SourceLocatable node, String component) {
		return new Declaration(Kind.INSTANCE, name, node, component);
	}

	/**
	 * @param instance the name of the invoked instance
	 */
	public static Declaration invocation(String name, SourceLocatable node, String instance) {
		return new Declaration(Kind.INVOCATION, name, node, instance);
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public SourceLocatable getNode() {
		return node;
	}

	/**
	 * @return the component an instance instantiates, or the instance an invocation invokes; null otherwise
	 */
	public String getTarget() {
		return target;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Declaration that = (Declaration) o;
		return kind == that.kind && name.equals(that.name) && Objects.equals(target, that.target);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, target);
	}

	@Override
	public String toString() {
		return kind.getDescription() + " " + name;
	}
}
