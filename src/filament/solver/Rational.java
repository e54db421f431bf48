package filament.solver;

import java.math.BigInteger;

/**
 * An exact rational number, always stored with a positive denominator and in lowest terms.
 */
final class Rational implements Comparable<Rational> {
	static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
	static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

	private final BigInteger numerator;
	private final BigInteger denominator;

	private Rational(BigInteger numerator, BigInteger denominator) {
		this.numerator = numerator;
		this.denominator = denominator;
	}

	static Rational of(BigInteger numerator, BigInteger denominator) {
		if (denominator.signum() == 0) {
			throw new ArithmeticException("division by zero");
		}
		if (denominator.signum() < 0) {
			numerator = numerator.negate();
			denominator = denominator.negate();
		}
		BigInteger gcd = numerator.gcd(denominator);
		if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
			numerator = numerator.divide(gcd);
			denominator = denominator.divide(gcd);
		}
		return new Rational(numerator, denominator);
	}

	static Rational of(BigInteger value) {
		return new Rational(value, BigInteger.ONE);
	}

	static Rational of(long value) {
		return of(BigInteger.valueOf(value));
	}

	Rational plus(Rational o) {
		return of(numerator.multiply(o.denominator).add(o.numerator.multiply(denominator)),
				denominator.multiply(o.denominator));
	}

	Rational minus(Rational o) {
		return plus(o.negate());
	}

	Rational times(Rational o) {
		return of(numerator.multiply(o.numerator), denominator.multiply(o.denominator));
	}

	Rational dividedBy(Rational o) {
		return of(numerator.multiply(o.denominator), denominator.multiply(o.numerator));
	}

	Rational negate() {
		return new Rational(numerator.negate(), denominator);
	}

	int signum() {
		return numerator.signum();
	}

	boolean isInteger() {
		return denominator.equals(BigInteger.ONE);
	}

	BigInteger ceil() {
		BigInteger[] qr = numerator.divideAndRemainder(denominator);
		return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
	}

	BigInteger floor() {
		BigInteger[] qr = numerator.divideAndRemainder(denominator);
		return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
	}

	BigInteger getNumerator() {
		return numerator;
	}

	@Override
	public int compareTo(Rational o) {
		return numerator.multiply(o.denominator).compareTo(o.numerator.multiply(denominator));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Rational that = (Rational) o;
		return numerator.equals(that.numerator) && denominator.equals(that.denominator);
	}

	@Override
	public int hashCode() {
		return 31 * numerator.hashCode() + denominator.hashCode();
	}

	@Override
	public String toString() {
		return isInteger() ? numerator.toString() : numerator + "/" + denominator;
	}
}
