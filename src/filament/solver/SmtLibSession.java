package filament.solver;

import filament.model.expr.Atom;
import filament.model.expr.Constraint;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A session backed by an external solver process speaking SMT-LIB 2 on its standard streams.
 */
public class SmtLibSession implements SolverSession {
	private static final Logger logger = Logger.getLogger(SmtLibSession.class.getName());
	private static final Pattern VALUE = Pattern.compile("\\(\\s*\\|([^|]*)\\|\\s+(\\(\\s*-\\s*\\d+\\s*\\)|-?\\d+)\\s*\\)");

	private final Process process;
	private final Writer input;
	private final BufferedReader output;
	private final Consumer<String> recorder;
	private boolean closed = false;

	SmtLibSession(List<String> command, Consumer<String> recorder) {
		this.recorder = recorder;
		try {
			process = new ProcessBuilder(command)
					.redirectError(ProcessBuilder.Redirect.DISCARD)
					.start();
		} catch (IOException e) {
			throw new SolverException("could not start solver " + String.join(" ", command), e);
		}
		input = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
		output = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
		send("(set-option :produce-models true)");
	}

	private void send(String command) {
		recorder.accept(command);
		try {
			input.write(command);
			input.write('\n');
			input.flush();
		} catch (IOException e) {
			throw new SolverException("lost connection to solver while sending " + command, e);
		}
	}

	private String readLine() {
		try {
			String line;
			do {
				line = output.readLine();
				if (line == null) {
					throw new SolverException("solver exited unexpectedly");
				}
				line = line.trim();
			} while (line.isEmpty());
			if (line.startsWith("(error")) {
				throw new SolverException("solver reported " + line);
			}
			return line;
		} catch (IOException e) {
			throw new SolverException("lost connection to solver", e);
		}
	}

	@Override
	public void declare(Atom variable) {
		for (String command : SmtLibFormatter.declare(variable)) {
			send(command);
		}
	}

	@Override
	public void assume(Constraint constraint) {
		send(SmtLibFormatter.assertion(SmtLibFormatter.constraint(constraint)));
	}

	@Override
	public void assumeAny(List<Constraint> alternatives) {
		send(SmtLibFormatter.assertion(SmtLibFormatter.disjunction(alternatives)));
	}

	@Override
	public void push() {
		send("(push 1)");
	}

	@Override
	public void pop() {
		send("(pop 1)");
	}

	@Override
	public SatResult check() {
		send("(check-sat)");
		String answer = readLine();
		switch (answer) {
			case "sat":
				return SatResult.SAT;
			case "unsat":
				return SatResult.UNSAT;
			case "unknown":
				return SatResult.UNKNOWN;
			default:
				throw new SolverException("unexpected answer to check-sat: " + answer);
		}
	}

	@Override
	public Map<Atom, Long> model(Collection<Atom> variables) {
		Map<Atom, Long> result = new LinkedHashMap<>();
		if (variables.isEmpty()) {
			return result;
		}
		send(SmtLibFormatter.getValue(variables));
		StringBuilder response = new StringBuilder();
		int depth = 0;
		do {
			String line = readLine();
			response.append(line).append(' ');
			for (int i = 0; i < line.length(); i++) {
				char c = line.charAt(i);
				if (c == '(') {
					depth++;
				} else if (c == ')') {
					depth--;
				}
			}
		} while (depth > 0);

		Map<String, Long> byName = new LinkedHashMap<>();
		Matcher m = VALUE.matcher(response);
		while (m.find()) {
			String value = m.group(2).replaceAll("[()\\s]", "");
			byName.put(m.group(1), Long.parseLong(value));
		}
		for (Atom variable : variables) {
			Long value = byName.get(variable.render());
			if (value == null) {
				throw new SolverException("solver gave no value for " + variable.render() + " in " + response);
			}
			result.put(variable, value);
		}
		return result;
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		try {
			send("(exit)");
		} catch (SolverException e) {
			logger.fine("solver already gone on exit: " + e.getMessage());
		}
		process.destroy();
	}
}
