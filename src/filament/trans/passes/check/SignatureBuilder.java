package filament.trans.passes.check;

import filament.errors.Issue;
import filament.errors.IssueContext;
import filament.model.ast.FilComponent;
import filament.model.ast.FilExistential;
import filament.model.ast.FilGuard;
import filament.model.ast.FilName;
import filament.model.ast.FilPort;
import filament.model.component.ExistentialParameter;
import filament.model.component.Port;
import filament.model.component.Signature;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.model.expr.Interval;
import filament.model.expr.MalformedIntervalException;
import filament.model.expr.TimeExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the signature of a component and checks the parts of its well-formedness that need no solver: literal
 * interval ordering and interface timing.
 */
public class SignatureBuilder {
	private final IssueContext ctx;
	private final FilComponent component;
	private final ExpressionBuilder expressions;
	private boolean failed = false;

	private SignatureBuilder(IssueContext ctx, FilComponent component) {
		this.ctx = ctx;
		this.component = component;
		this.expressions = new ExpressionBuilder(signatureNames(component), component.getEvent().getId());
	}

	/**
	 * @return the signature, or empty if an issue was reported
	 */
	public static Optional<Signature> perform(IssueContext ctx, FilComponent component) {
		SignatureBuilder builder = new SignatureBuilder(ctx, component);
		Signature signature = builder.build();
		return builder.failed ? Optional.empty() : Optional.of(signature);
	}

	/**
	 * @return the atom each name declared by the signature stands for
	 */
	public static Map<String, Atom> signatureNames(FilComponent component) {
		Map<String, Atom> names = new LinkedHashMap<>();
		for (FilName param : component.getParams()) {
			names.put(param.getId(), Atom.parameter(param.getId()));
		}
		names.put(component.getEvent().getId(), Atom.event(component.getEvent().getId()));
		for (FilExistential existential : component.getExistentials()) {
			names.put(existential.getName().getId(), Atom.existential(existential.getName().getId()));
		}
		return names;
	}

	private Signature build() {
		List<String> params = new ArrayList<>();
		for (FilName param : component.getParams()) {
			params.add(param.getId());
		}
		Expression delay = expressions.build(component.getDelay());

		Port interfacePort = null;
		List<Port> inputs = new ArrayList<>();
		for (FilPort node : component.getInputs()) {
			if (node.isInterface()) {
				if (interfacePort != null) {
					report(new InterfaceTimingIssue(node,
							"at most one interface port is allowed, but " + interfacePort.getName() + " is one"));
					continue;
				}
				interfacePort = buildInterfacePort(node);
			} else {
				Port port = buildDataPort(node, Port.Direction.INPUT);
				if (port != null) {
					inputs.add(port);
				}
			}
		}
		List<Port> outputs = new ArrayList<>();
		for (FilPort node : component.getOutputs()) {
			if (node.isInterface()) {
				report(new InterfaceTimingIssue(node, "interface ports must be inputs"));
				continue;
			}
			Port port = buildDataPort(node, Port.Direction.OUTPUT);
			if (port != null) {
				outputs.add(port);
			}
		}

		List<ExistentialParameter> existentials = new ArrayList<>();
		for (FilExistential existential : component.getExistentials()) {
			Expression definition = existential.getDefinition() == null
					? null : expressions.build(existential.getDefinition());
			List<Constraint> guards = new ArrayList<>();
			for (FilGuard guard : existential.getGuards()) {
				guards.add(expressions.buildGuard(guard, Constraint.Reason.EXISTENTIAL_GUARD));
			}
			existentials.add(new ExistentialParameter(
					existential.getName().getId(), definition, guards, existential));
		}

		List<Constraint> guards = new ArrayList<>();
		for (FilGuard guard : component.getGuards()) {
			guards.add(expressions.buildGuard(guard, Constraint.Reason.GUARD));
		}

		return new Signature(component, params, component.getEvent().getId(), delay, interfacePort, inputs, outputs,
				existentials, guards);
	}

	private void report(Issue issue) {
		failed = true;
		ctx.error(issue);
	}

	private Port buildInterfacePort(FilPort node) {
		String name = node.getName().getId();
		Optional<TimeExpression> time = expressions.buildTime(ctx, node.getStart(), "the time of port " + name);
		if (!time.isPresent()) {
			failed = true;
			return null;
		}
		if (!time.get().getOffset().equals(Expression.ZERO)) {
			report(new InterfaceTimingIssue(node, "must be triggered at " + component.getEvent().getId() +
					", found " + time.get().render()));
			return null;
		}
		return new Port(name, Port.Direction.INPUT, true, Interval.cycle(time.get()), Expression.ONE, node);
	}

	private Port buildDataPort(FilPort node, Port.Direction direction) {
		String name = node.getName().getId();
		Optional<TimeExpression> start = expressions.buildTime(ctx, node.getStart(), "the start of port " + name);
		Optional<TimeExpression> end = expressions.buildTime(ctx, node.getEnd(), "the end of port " + name);
		Expression width = expressions.build(node.getWidth());
		if (!start.isPresent() || !end.isPresent()) {
			failed = true;
			return null;
		}
		try {
			return new Port(name, direction, false, Interval.of(start.get(), end.get()), width, node);
		} catch (MalformedIntervalException e) {
			report(new MalformedIntervalIssue(node, "interval [" + e.getStart().render() + ", " +
					e.getEnd().render() + "] of port " + name + " is empty", null));
			return null;
		}
	}
}
