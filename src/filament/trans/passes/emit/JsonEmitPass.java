package filament.trans.passes.emit;

import filament.trans.passes.mono.MonoComponent;
import filament.trans.passes.mono.MonoInstance;
import filament.trans.passes.mono.MonoInvocation;
import filament.trans.passes.mono.MonoOutputBinding;
import filament.trans.passes.mono.MonoPort;
import filament.trans.passes.mono.MonoPortRef;
import filament.trans.passes.mono.MonomorphizedProgram;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

/**
 * Describes a monomorphized program as JSON for a downstream code generator. Every interval is a pair of literal
 * cycle offsets; nothing in the output refers to a parameter or an existential.
 */
public class JsonEmitPass {
	private JsonEmitPass() {}

	public static JSONObject perform(MonomorphizedProgram program) {
		JSONArray components = new JSONArray();
		for (MonoComponent component : program.getComponents().values()) {
			components.put(component(component));
		}
		JSONObject result = new JSONObject();
		result.put("entry", program.getEntry().mangledName());
		result.put("components", components);
		return result;
	}

	private static JSONObject component(MonoComponent component) {
		JSONObject result = new JSONObject();
		result.put("name", component.getName());
		result.put("definition", component.getKey().getDefinition());
		result.put("arguments", new JSONArray(component.getKey().getArguments()));
		result.put("extern", component.isExtern());
		result.put("event", component.getEvent());
		result.put("delay", component.getDelay());

		JSONObject existentials = new JSONObject();
		for (Map.Entry<String, Long> e : component.getExistentials().entrySet()) {
			existentials.put(e.getKey(), e.getValue().longValue());
		}
		result.put("existentials", existentials);

		JSONArray ports = new JSONArray();
		for (MonoPort port : component.getPorts()) {
			JSONObject p = new JSONObject();
			p.put("name", port.getName());
			p.put("direction", port.getDirection().name().toLowerCase());
			p.put("interface", port.isInterface());
			p.put("start", port.getStart());
			p.put("end", port.getEnd());
			p.put("width", port.getWidth());
			ports.put(p);
		}
		result.put("ports", ports);

		JSONArray instances = new JSONArray();
		for (MonoInstance instance : component.getInstances()) {
			JSONObject i = new JSONObject();
			i.put("name", instance.getName());
			i.put("component", instance.getComponent().mangledName());
			instances.put(i);
		}
		result.put("instances", instances);

		JSONArray invocations = new JSONArray();
		for (MonoInvocation invocation : component.getInvocations()) {
			JSONObject i = new JSONObject();
			i.put("name", invocation.getName());
			i.put("instance", invocation.getInstance());
			i.put("time", invocation.getTime());
			JSONArray arguments = new JSONArray();
			for (MonoPortRef argument : invocation.getArguments()) {
				arguments.put(portRef(argument));
			}
			i.put("arguments", arguments);
			invocations.put(i);
		}
		result.put("invocations", invocations);

		JSONArray bindings = new JSONArray();
		for (MonoOutputBinding binding : component.getBindings()) {
			JSONObject b = new JSONObject();
			b.put("port", binding.getPort());
			b.put("source", portRef(binding.getSource()));
			bindings.put(b);
		}
		result.put("bindings", bindings);
		return result;
	}

	private static JSONObject portRef(MonoPortRef ref) {
		JSONObject result = new JSONObject();
		switch (ref.getKind()) {
			case THIS:
				result.put("kind", "port");
				result.put("port", ref.getPort());
				break;
			case INVOCATION:
				result.put("kind", "invocation");
				result.put("invocation", ref.getInvocation());
				result.put("port", ref.getPort());
				break;
			case CONSTANT:
				result.put("kind", "constant");
				result.put("value", ref.getValue());
				break;
		}
		return result;
	}
}
