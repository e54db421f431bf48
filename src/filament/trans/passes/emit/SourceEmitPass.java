package filament.trans.passes.emit;

import filament.Unreachable;
import filament.formatters.IndentingWriter;
import filament.trans.passes.mono.MonoComponent;
import filament.trans.passes.mono.MonoInstance;
import filament.trans.passes.mono.MonoInvocation;
import filament.trans.passes.mono.MonoOutputBinding;
import filament.trans.passes.mono.MonoPort;
import filament.trans.passes.mono.MonoPortRef;
import filament.trans.passes.mono.MonomorphizedProgram;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prints a monomorphized program back in the surface syntax. The output has no value parameters and defines
 * every existential by a literal, so checking it again needs no solver.
 */
public class SourceEmitPass {
	private SourceEmitPass() {}

	public static void perform(MonomorphizedProgram program, IndentingWriter out) throws IOException {
		boolean first = true;
		for (MonoComponent component : program.getComponents().values()) {
			if (!first) {
				out.newLine();
				out.newLine();
			}
			first = false;
			component(component, out);
		}
		out.newLine();
	}

	public static String perform(MonomorphizedProgram program) {
		StringWriter w = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(w)) {
			perform(program, out);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	private static String time(String event, long offset) {
		if (offset == 0) {
			return event;
		}
		return offset > 0 ? event + "+" + offset : event + "-" + (-offset);
	}

	private static String ports(String event, List<MonoPort> ports) {
		return ports.stream().map(port -> {
			if (port.isInterface()) {
				return port.getName() + ": interface[" + time(event, port.getStart()) + "]";
			}
			return port.getName() + ": [" + time(event, port.getStart()) + ", " + time(event, port.getEnd()) + "] " +
					port.getWidth();
		}).collect(Collectors.joining(", "));
	}

	private static void component(MonoComponent component, IndentingWriter out) throws IOException {
		String event = component.getEvent();
		if (component.isExtern()) {
			out.write("extern ");
		}
		out.write("comp ");
		out.write(component.getName());
		out.write("<");
		out.write(event);
		out.write(": ");
		out.write(Long.toString(component.getDelay()));
		out.write(">(");
		List<MonoPort> inputs = new ArrayList<>();
		component.getInterfacePort().ifPresent(inputs::add);
		inputs.addAll(component.getInputs());
		out.write(ports(event, inputs));
		out.write(") -> (");
		out.write(ports(event, component.getOutputs()));
		out.write(")");
		if (!component.getExistentials().isEmpty()) {
			out.write(" with {");
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (Map.Entry<String, Long> e : component.getExistentials().entrySet()) {
					out.newLine();
					out.write("exists " + e.getKey() + " = " + e.getValue() + ";");
				}
			}
			out.newLine();
			out.write("}");
		}
		if (component.isExtern()) {
			out.write(";");
			return;
		}

		out.write(" {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (MonoInstance instance : component.getInstances()) {
				out.newLine();
				out.write(instance.getName() + " := new " + instance.getComponent().mangledName() + ";");
			}
			for (MonoInvocation invocation : component.getInvocations()) {
				out.newLine();
				out.write(invocation.getName() + " := " + invocation.getInstance() + "<" +
						time(event, invocation.getTime()) + ">(" +
						invocation.getArguments().stream().map(MonoPortRef::render).collect(Collectors.joining(", ")) +
						");");
			}
			for (MonoOutputBinding binding : component.getBindings()) {
				out.newLine();
				out.write(binding.getPort() + " = " + binding.getSource().render() + ";");
			}
		}
		out.newLine();
		out.write("}");
	}
}
