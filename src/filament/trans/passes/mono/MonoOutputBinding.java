package filament.trans.passes.mono;

public final class MonoOutputBinding {
	private final String port;
	private final MonoPortRef source;

	public MonoOutputBinding(String port, MonoPortRef source) {
		this.port = port;
		this.source = source;
	}

	public String getPort() {
		return port;
	}

	public MonoPortRef getSource() {
		return source;
	}
}
