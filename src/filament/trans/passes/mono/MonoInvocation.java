package filament.trans.passes.mono;

import java.util.Collections;
import java.util.List;

public final class MonoInvocation {
	private final String name;
	private final String instance;
	private final long time;
	private final List<MonoPortRef> arguments;

	public MonoInvocation(String name, String instance, long time, List<MonoPortRef> arguments) {
		this.name = name;
		this.instance = instance;
		this.time = time;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public String getName() {
		return name;
	}

	public String getInstance() {
		return instance;
	}

	/**
	 * @return the cycle, relative to the enclosing component's event, at which the invocation starts
	 */
	public long getTime() {
		return time;
	}

	public List<MonoPortRef> getArguments() {
		return arguments;
	}
}
