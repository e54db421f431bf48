package filament.trans.passes.mono;

/**
 * The source of a value inside a specialized component: a port of the component, an output of one of its
 * invocations, or a literal.
 */
public final class MonoPortRef {
	public enum Kind {
		THIS,
		INVOCATION,
		CONSTANT,
	}

	private final Kind kind;
	private final String invocation;
	private final String port;
	private final long value;

	private MonoPortRef(Kind kind, String invocation, String port, long value) {
		this.kind = kind;
		this.invocation = invocation;
		this.port = port;
		this.value = value;
	}

	public static MonoPortRef ofThis(String port) {
		return new MonoPortRef(Kind.THIS, null, port, 0);
	}

	public static MonoPortRef ofInvocation(String invocation, String port) {
		return new MonoPortRef(Kind.INVOCATION, invocation, port, 0);
	}

	public static MonoPortRef ofConstant(long value) {
		return new MonoPortRef(Kind.CONSTANT, null, null, value);
	}

	public Kind getKind() {
		return kind;
	}

	public String getInvocation() {
		return invocation;
	}

	public String getPort() {
		return port;
	}

	public long getValue() {
		return value;
	}

	public String render() {
		switch (kind) {
			case THIS:
				return port;
			case INVOCATION:
				return invocation + "." + port;
			default:
				return Long.toString(value);
		}
	}
}
