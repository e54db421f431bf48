package filament.model.expr;

import java.util.Objects;

/**
 * A symbolic natural-valued variable appearing in an {@link Expression}.
 *
 * Value parameters and a component's own existentials are written by their bare name; the existential of an
 * instance is written instance.name. Events only appear while a time expression is being split into its event
 * and offset, never inside an offset.
 */
public final class Atom implements Comparable<Atom> {

	public enum Kind {
		PARAMETER,
		EXISTENTIAL,
		INSTANCE_EXISTENTIAL,
		EVENT,
	}

	private final Kind kind;
	private final String instance;
	private final String name;

	private Atom(Kind kind, String instance, String name) {
		this.kind = kind;
		this.instance = instance;
		this.name = name;
	}

	public static Atom parameter(String name) {
		return new Atom(Kind.PARAMETER, null, name);
	}

	public static Atom existential(String name) {
		return new Atom(Kind.EXISTENTIAL, null, name);
	}

	public static Atom instanceExistential(String instance, String name) {
		return new Atom(Kind.INSTANCE_EXISTENTIAL, instance, name);
	}

	public static Atom event(String name) {
		return new Atom(Kind.EVENT, null, name);
	}

	public Kind getKind() {
		return kind;
	}

	public String getInstance() {
		return instance;
	}

	public String getName() {
		return name;
	}

	public String render() {
		return instance == null ? name : instance + "." + name;
	}

	@Override
	public int compareTo(Atom o) {
		int c = render().compareTo(o.render());
		if (c != 0) {
			return c;
		}
		return kind.compareTo(o.kind);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Atom atom = (Atom) o;
		return kind == atom.kind && Objects.equals(instance, atom.instance) && name.equals(atom.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, instance, name);
	}

	@Override
	public String toString() {
		return render();
	}
}
