package filament.errors;

/**
 * What a pass was doing when an issue was reported, e.g. checking a component or specializing an instance.
 */
public abstract class Context {

	private final String subject;

	protected Context(String subject) {
		this.subject = subject;
	}

	/**
	 * @return the name of the component, import or specialization being processed
	 */
	public String getSubject() {
		return subject;
	}

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E;
}
