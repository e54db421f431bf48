package filament.model.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A product of atoms, kept as a sorted list so that equal products compare equal. The empty product is the
 * constant monomial.
 */
public final class Monomial implements Comparable<Monomial> {

	public static final Monomial ONE = new Monomial(Collections.emptyList());

	private final List<Atom> factors;

	private Monomial(List<Atom> sortedFactors) {
		this.factors = Collections.unmodifiableList(sortedFactors);
	}

	public static Monomial of(Atom atom) {
		return new Monomial(Collections.singletonList(atom));
	}

	public Monomial times(Monomial other) {
		List<Atom> result = new ArrayList<>(factors);
		result.addAll(other.factors);
		Collections.sort(result);
		return new Monomial(result);
	}

	public List<Atom> getFactors() {
		return factors;
	}

	public boolean isConstant() {
		return factors.isEmpty();
	}

	public int degree() {
		return factors.size();
	}

	public int degreeOf(Atom atom) {
		int n = 0;
		for (Atom a : factors) {
			if (a.equals(atom)) {
				n++;
			}
		}
		return n;
	}

	/**
	 * @return this monomial with one occurrence of atom removed
	 */
	public Monomial divide(Atom atom) {
		List<Atom> result = new ArrayList<>(factors);
		if (!result.remove(atom)) {
			throw new IllegalArgumentException(atom + " does not divide " + this);
		}
		return new Monomial(result);
	}

	public String render() {
		return factors.stream().map(Atom::render).collect(Collectors.joining("*"));
	}

	// non-constant monomials first, ordered by their factors; the constant monomial sorts last
	@Override
	public int compareTo(Monomial o) {
		if (isConstant() || o.isConstant()) {
			return Boolean.compare(isConstant(), o.isConstant());
		}
		int n = Math.min(factors.size(), o.factors.size());
		for (int i = 0; i < n; i++) {
			int c = factors.get(i).compareTo(o.factors.get(i));
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(factors.size(), o.factors.size());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return factors.equals(((Monomial) o).factors);
	}

	@Override
	public int hashCode() {
		return factors.hashCode();
	}

	@Override
	public String toString() {
		return render();
	}
}
