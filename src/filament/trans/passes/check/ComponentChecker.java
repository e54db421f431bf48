package filament.trans.passes.check;

import filament.errors.IssueContext;
import filament.model.ast.FilCommand;
import filament.model.ast.FilComponent;
import filament.model.ast.FilConstantPortRef;
import filament.model.ast.FilExistentialDefinition;
import filament.model.ast.FilExpression;
import filament.model.ast.FilInstance;
import filament.model.ast.FilInvocation;
import filament.model.ast.FilInvocationPortRef;
import filament.model.ast.FilOutputBinding;
import filament.model.ast.FilPortRef;
import filament.model.ast.FilPortRefVisitor;
import filament.model.ast.FilThisPortRef;
import filament.model.component.ExistentialParameter;
import filament.model.component.Port;
import filament.model.component.Signature;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.model.expr.Interval;
import filament.model.expr.MalformedIntervalException;
import filament.model.expr.TimeExpression;
import filament.solver.DischargePass;
import filament.solver.ExistentialSolver;
import filament.solver.Obligation;
import filament.solver.SatResult;
import filament.solver.SolverException;
import filament.solver.SolverFactory;
import filament.solver.SolverFailureIssue;
import filament.solver.UnsatisfiableConstraintsIssue;
import filament.trans.passes.scope.DuplicateDefinitionIssue;
import filament.util.SourceLocatable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Type checks one component against the signatures of the components it instantiates.
 *
 * Checking collects obligations: constraints that must hold for all natural values of the value parameters and
 * the instances' existentials, given the component's guards and what its instances publish. Existentials of the
 * component are first eliminated, using their definitions or an equality that determines them. Obligations
 * about an existential that cannot be eliminated symbolically are left for specialization.
 */
public class ComponentChecker {
	private final IssueContext ctx;
	private final Signature signature;
	private final Map<String, Signature> signatures;
	private final SolverFactory solver;
	private final boolean showModels;
	private final FilComponent component;
	private final ExpressionBuilder expressions;

	private final List<Constraint> facts = new ArrayList<>();
	private final List<Obligation> obligations = new ArrayList<>();
	private final Map<String, Expression> definitions = new LinkedHashMap<>();
	private final Map<String, SourceLocatable> definitionSites = new LinkedHashMap<>();
	private final Map<Atom, Expression> resolved = new LinkedHashMap<>();
	private final Map<String, InstanceInfo> instances = new LinkedHashMap<>();
	private final Map<String, InvocationInfo> invocations = new LinkedHashMap<>();
	private final List<FilOutputBinding> bindings = new ArrayList<>();
	private final List<ReuseCheck> deferredReuse = new ArrayList<>();

	private static final class InstanceInfo {
		final FilInstance node;
		final Signature callee;
		final List<Expression> arguments;
		final Map<Atom, Expression> substitution;

		InstanceInfo(FilInstance node, Signature callee, List<Expression> arguments,
		             Map<Atom, Expression> substitution) {
			this.node = node;
			this.callee = callee;
			this.arguments = arguments;
			this.substitution = substitution;
		}

		String getName() {
			return node.getName().getId();
		}
	}

	private static final class InvocationInfo {
		final FilInvocation node;
		final InstanceInfo instance;
		final TimeExpression time;
		final Expression delay;
		final Map<String, Interval> intervals;
		final Map<String, Expression> widths;

		InvocationInfo(FilInvocation node, InstanceInfo instance, TimeExpression time, Expression delay,
		               Map<String, Interval> intervals, Map<String, Expression> widths) {
			this.node = node;
			this.instance = instance;
			this.time = time;
			this.delay = delay;
			this.intervals = intervals;
			this.widths = widths;
		}

		String getName() {
			return node.getName().getId();
		}
	}

	// what a port reference supplies; constants have neither interval nor width
	private static final class Source {
		final Interval interval;
		final Expression width;

		Source(Interval interval, Expression width) {
			this.interval = interval;
			this.width = width;
		}
	}

	private ComponentChecker(IssueContext ctx, Signature signature, Map<String, Signature> signatures,
	                         SolverFactory solver, boolean showModels) {
		this.ctx = ctx;
		this.signature = signature;
		this.signatures = signatures;
		this.solver = solver;
		this.showModels = showModels;
		this.component = signature.getNode();
		this.expressions = new ExpressionBuilder(
				SignatureBuilder.signatureNames(component), signature.getEvent());
	}

	/**
	 * @param ctx must collect this component's issues only
	 * @param signatures the signatures of every component this one instantiates
	 * @return the checked component, or empty if an issue was reported
	 */
	public static Optional<CheckedComponent> perform(IssueContext ctx, Signature signature,
	                                                 Map<String, Signature> signatures, SolverFactory solver,
	                                                 boolean showModels) {
		ComponentChecker checker = new ComponentChecker(ctx, signature, signatures, solver, showModels);
		CheckedComponent checked = checker.check();
		if (ctx.hasErrors()) {
			return Optional.empty();
		}
		return Optional.of(checked);
	}

	private CheckedComponent check() {
		facts.addAll(signature.getGuards());
		collectDefinitions();
		List<FilCommand> body = component.getBody() == null ? Collections.emptyList() : component.getBody();
		for (FilCommand command : body) {
			if (command instanceof FilInstance) {
				checkInstance((FilInstance) command);
			}
		}
		for (FilCommand command : body) {
			if (command instanceof FilInvocation) {
				prepareInvocation((FilInvocation) command);
			}
		}
		for (InvocationInfo invocation : invocations.values()) {
			checkInvocationArguments(invocation);
		}
		for (FilCommand command : body) {
			if (command instanceof FilOutputBinding) {
				checkOutputBinding((FilOutputBinding) command);
			}
		}
		if (!component.isExtern()) {
			checkOutputsBoundOnce();
		}
		checkReuse();
		checkSignature();

		List<Obligation> remaining = resolveExistentials();
		List<Atom> deferred = signature.getExistentials().stream()
				.map(ExistentialParameter::getAtom)
				.filter(atom -> !resolved.containsKey(atom))
				.collect(Collectors.toList());
		List<Obligation> provable = new ArrayList<>();
		List<Constraint> concrete = new ArrayList<>();
		for (Obligation obligation : remaining) {
			if (mentionsAny(obligation, deferred)) {
				concrete.addAll(obligation.getClauses());
			} else {
				provable.add(obligation);
			}
		}
		DischargePass.perform(ctx, solver, facts, provable, showModels);

		List<CheckedInstance> checkedInstances = new ArrayList<>();
		for (InstanceInfo instance : instances.values()) {
			checkedInstances.add(new CheckedInstance(
					instance.getName(), instance.callee.getName(), instance.arguments, instance.node));
		}
		List<CheckedInvocation> checkedInvocations = new ArrayList<>();
		for (InvocationInfo invocation : invocations.values()) {
			checkedInvocations.add(new CheckedInvocation(invocation.getName(), invocation.instance.getName(),
					invocation.time, invocation.node.getArgs(), invocation.node));
		}
		return new CheckedComponent(signature, checkedInstances, checkedInvocations, bindings,
				new LinkedHashMap<>(resolved), deferred, concrete, deferredReuse);
	}

	private static boolean mentionsAny(Obligation obligation, List<Atom> atoms) {
		for (Atom atom : atoms) {
			if (obligation.getAtoms().contains(atom)) {
				return true;
			}
		}
		return false;
	}

	private void collectDefinitions() {
		for (ExistentialParameter existential : signature.getExistentials()) {
			if (existential.getDefinition() != null) {
				definitions.put(existential.getName(), existential.getDefinition());
				definitionSites.put(existential.getName(), existential.getNode());
			}
		}
		if (component.getBody() != null) {
			for (FilCommand command : component.getBody()) {
				if (!(command instanceof FilExistentialDefinition)) {
					continue;
				}
				FilExistentialDefinition definition = (FilExistentialDefinition) command;
				String name = definition.getName().getId();
				if (definitions.containsKey(name)) {
					ctx.error(new DuplicateDefinitionIssue(name, definitionSites.get(name), definition));
					continue;
				}
				definitions.put(name, expressions.build(definition.getValue()));
				definitionSites.put(name, definition);
			}
		}

		// flatten definitions that refer to other defined existentials
		for (String name : definitions.keySet()) {
			Expression expanded = expand(name, new HashSet<>());
			if (expanded == null) {
				ctx.error(new UnderconstrainedExistentialIssue(
						definitionSites.get(name), name, "its definition refers to itself"));
				continue;
			}
			resolved.put(Atom.existential(name), expanded);
			Constraint natural = Constraint.ge(expanded, Expression.ZERO,
					Constraint.Reason.EXISTENTIAL_DEFINITION, definitionSites.get(name));
			obligations.add(Obligation.of(natural, cex -> new UnsatisfiableConstraintsIssue(
					"definition of " + name, Collections.singletonList(natural), cex)));
		}
	}

	private Expression expand(String name, Set<String> expanding) {
		Atom atom = Atom.existential(name);
		if (resolved.containsKey(atom)) {
			return resolved.get(atom);
		}
		if (!expanding.add(name)) {
			return null;
		}
		Expression definition = definitions.get(name);
		Map<Atom, Expression> substitution = new LinkedHashMap<>();
		for (Atom used : definition.getAtoms()) {
			if (used.getKind() == Atom.Kind.EXISTENTIAL && definitions.containsKey(used.getName())) {
				Expression value = expand(used.getName(), expanding);
				if (value == null) {
					return null;
				}
				substitution.put(used, value);
			}
		}
		expanding.remove(name);
		return definition.substitute(substitution);
	}

	private static String renderApplication(String name, List<Expression> arguments) {
		return name + "[" + arguments.stream().map(Expression::render).collect(Collectors.joining(", ")) + "]";
	}

	private void checkInstance(FilInstance node) {
		String name = node.getName().getId();
		Signature callee = signatures.get(node.getComponent().getId());
		if (callee == null) {
			// the callee's own signature failed and was reported there
			return;
		}
		List<Expression> arguments = new ArrayList<>();
		for (FilExpression arg : node.getArgs()) {
			arguments.add(expressions.build(arg));
		}
		String target = renderApplication(callee.getName(), arguments);
		if (arguments.size() != callee.getParams().size()) {
			ctx.error(new ArgumentCountMismatchIssue(
					node, "instance " + name + " of " + callee.getName(), callee.getParams().size(), arguments.size()));
			return;
		}

		Map<Atom, Expression> substitution = new LinkedHashMap<>();
		for (int i = 0; i < arguments.size(); i++) {
			Atom param = Atom.parameter(callee.getParams().get(i));
			substitution.put(param, arguments.get(i));
			// value parameters are naturals
			Constraint natural = Constraint.ge(arguments.get(i), Expression.ZERO, Constraint.Reason.GUARD, node);
			Constraint declared = Constraint.ge(Expression.of(param), Expression.ZERO, Constraint.Reason.GUARD, node);
			requireGuard(node, target, natural, declared);
		}
		for (ExistentialParameter existential : callee.getExistentials()) {
			substitution.put(existential.getAtom(),
					Expression.of(Atom.instanceExistential(name, existential.getName())));
		}
		for (Constraint guard : callee.getGuards()) {
			requireGuard(node, target, guard.substitute(substitution).withReason(Constraint.Reason.GUARD, node), guard);
		}

		// what the callee publishes
		for (ExistentialParameter existential : callee.getExistentials()) {
			for (Constraint guard : existential.getGuards()) {
				facts.add(guard.substitute(substitution));
			}
		}
		facts.add(Constraint.ge(callee.getDelay().substitute(substitution), Expression.ONE,
				Constraint.Reason.DELAY_BOUND, node));

		instances.put(name, new InstanceInfo(node, callee, arguments, substitution));
	}

	private void requireGuard(FilInstance node, String target, Constraint instantiated, Constraint guard) {
		if (instantiated.isGround()) {
			if (!instantiated.evaluate(Collections.emptyMap())) {
				ctx.error(new GuardViolatedIssue(node, target, guard, null));
			}
			return;
		}
		obligations.add(Obligation.of(instantiated, cex -> new GuardViolatedIssue(node, target, guard, cex)));
	}

	private void prepareInvocation(FilInvocation node) {
		InstanceInfo instance = instances.get(node.getInstance().getId());
		if (instance == null) {
			return;
		}
		String name = node.getName().getId();
		Optional<TimeExpression> time = expressions.buildTime(ctx, node.getTime(), "the time of invocation " + name);
		if (!time.isPresent()) {
			return;
		}
		Signature callee = instance.callee;
		List<Port> ports = new ArrayList<>();
		if (callee.getInterfacePort() != null) {
			ports.add(callee.getInterfacePort());
		}
		ports.addAll(callee.getInputs());
		ports.addAll(callee.getOutputs());

		Map<String, Interval> intervals = new LinkedHashMap<>();
		Map<String, Expression> widths = new LinkedHashMap<>();
		for (Port port : ports) {
			try {
				intervals.put(port.getName(),
						port.getInterval().substitute(instance.substitution).substituteEvent(time.get()));
			} catch (MalformedIntervalException e) {
				ctx.error(new MalformedIntervalIssue(node, "port " + port.getName() + " of " + name + " has the empty interval [" +
						e.getStart().render() + ", " + e.getEnd().render() + "] for these arguments", null));
				return;
			}
			widths.put(port.getName(), port.getWidth().substitute(instance.substitution));
		}
		Expression delay = callee.getDelay().substitute(instance.substitution);
		invocations.put(name, new InvocationInfo(node, instance, time.get(), delay, intervals, widths));
	}

	private void checkInvocationArguments(InvocationInfo invocation) {
		List<Port> inputs = invocation.instance.callee.getInputs();
		List<FilPortRef> args = invocation.node.getArgs();
		if (args.size() != inputs.size()) {
			ctx.error(new ArgumentCountMismatchIssue(invocation.node,
					"invocation " + invocation.getName() + " of " + invocation.instance.getName(),
					inputs.size(), args.size()));
			return;
		}
		for (int i = 0; i < args.size(); i++) {
			Port port = inputs.get(i);
			FilPortRef arg = args.get(i);
			String label = invocation.getName() + "." + port.getName();
			Optional<Source> source = arg.accept(new SourceResolver());
			source.ifPresent(s -> requireMatch(arg, label, invocation.intervals.get(port.getName()),
					invocation.widths.get(port.getName()), s));
		}
	}

	private void requireMatch(SourceLocatable where, String label, Interval required, Expression requiredWidth,
	                          Source supplied) {
		if (supplied.interval == null) {
			// constants are always available
			return;
		}
		Interval available = supplied.interval;
		List<Constraint> timing = new ArrayList<>();
		timing.add(Constraint.eq(required.getStart().getOffset(), available.getStart().getOffset(),
				Constraint.Reason.INTERVAL_MATCH, where));
		timing.add(Constraint.eq(required.getEnd().getOffset(), available.getEnd().getOffset(),
				Constraint.Reason.INTERVAL_MATCH, where));
		obligations.add(new Obligation(timing,
				cex -> new IntervalMismatchIssue(where, label, required, available, cex)));
		Expression availableWidth = supplied.width;
		obligations.add(Obligation.of(
				Constraint.eq(requiredWidth, availableWidth, Constraint.Reason.WIDTH_MATCH, where),
				cex -> new BitwidthMismatchIssue(where, label, requiredWidth, availableWidth, cex)));
	}

	private class SourceResolver extends FilPortRefVisitor<Optional<Source>, RuntimeException> {
		@Override
		public Optional<Source> visit(FilThisPortRef thisPortRef) {
			String name = thisPortRef.getPort().getId();
			Optional<Port> port = signature.findPort(name);
			if (!port.isPresent()) {
				return Optional.empty();
			}
			if (port.get().isInterface()) {
				ctx.error(new InvalidPortReferenceIssue(thisPortRef, name,
						"interface ports are driven by invocations and cannot be passed as data"));
				return Optional.empty();
			}
			if (port.get().getDirection() == Port.Direction.OUTPUT) {
				ctx.error(new InvalidPortReferenceIssue(thisPortRef, name,
						"outputs of the component cannot be read"));
				return Optional.empty();
			}
			return Optional.of(new Source(port.get().getInterval(), port.get().getWidth()));
		}

		@Override
		public Optional<Source> visit(FilInvocationPortRef invocationPortRef) {
			String rendered = invocationPortRef.getInvocation().getId() + "." + invocationPortRef.getPort().getId();
			InvocationInfo invocation = invocations.get(invocationPortRef.getInvocation().getId());
			if (invocation == null) {
				return Optional.empty();
			}
			Optional<Port> port = invocation.instance.callee.findPort(invocationPortRef.getPort().getId());
			if (!port.isPresent()) {
				return Optional.empty();
			}
			if (port.get().getDirection() != Port.Direction.OUTPUT) {
				ctx.error(new InvalidPortReferenceIssue(invocationPortRef, rendered,
						"inputs of an invocation cannot be read"));
				return Optional.empty();
			}
			return Optional.of(new Source(invocation.intervals.get(port.get().getName()),
					invocation.widths.get(port.get().getName())));
		}

		@Override
		public Optional<Source> visit(FilConstantPortRef constantPortRef) {
			return Optional.of(new Source(null, null));
		}
	}

	private void checkOutputBinding(FilOutputBinding binding) {
		String name = binding.getPort().getId();
		Optional<Port> port = signature.findPort(name);
		if (!port.isPresent()) {
			return;
		}
		if (port.get().getDirection() != Port.Direction.OUTPUT) {
			ctx.error(new InvalidPortReferenceIssue(binding.getPort(), name, "only outputs can be bound"));
			return;
		}
		bindings.add(binding);
		Optional<Source> source = binding.getSource().accept(new SourceResolver());
		source.ifPresent(s -> requireMatch(binding, name, port.get().getInterval(), port.get().getWidth(), s));
	}

	private void checkOutputsBoundOnce() {
		for (Port output : signature.getOutputs()) {
			int count = 0;
			for (FilOutputBinding binding : bindings) {
				if (binding.getPort().getId().equals(output.getName())) {
					count++;
				}
			}
			if (count != 1) {
				ctx.error(new UnboundOutputIssue(output.getNode(), count));
			}
		}
	}

	private void checkSignature() {
		List<Port> ports = new ArrayList<>(signature.getInputs());
		ports.addAll(signature.getOutputs());
		for (Port port : ports) {
			Interval interval = port.getInterval();
			if (interval.length().isConstant()) {
				// literal lengths were checked when the interval was built
				continue;
			}
			obligations.add(Obligation.of(
					Constraint.gt(interval.getEnd().getOffset(), interval.getStart().getOffset(),
							Constraint.Reason.INTERVAL_WELL_FORMED, port.getNode()),
					cex -> new MalformedIntervalIssue(port.getNode(),
							"interval " + interval.render() + " of port " + port.getName() + " may be empty", cex)));
		}

		Constraint delay = Constraint.ge(signature.getDelay(), Expression.ONE, Constraint.Reason.DELAY_BOUND,
				component.getDelay());
		obligations.add(Obligation.of(delay, cex -> new UnsatisfiableConstraintsIssue(
				"the delay of " + signature.getName(), Collections.singletonList(delay), cex)));

		for (ExistentialParameter existential : signature.getExistentials()) {
			for (Constraint guard : existential.getGuards()) {
				obligations.add(Obligation.of(guard, cex -> new UnsatisfiableConstraintsIssue(
						"the guards of existential " + existential.getName(), Collections.singletonList(guard), cex)));
			}
		}
	}

	/**
	 * Eliminates existentials without a definition through an equality that determines them, in declaration
	 * order.
	 *
	 * @return the obligations with every eliminated existential substituted
	 */
	private List<Obligation> resolveExistentials() {
		List<Obligation> working = new ArrayList<>();
		for (Obligation obligation : obligations) {
			working.add(obligation.substitute(resolved));
		}
		for (ExistentialParameter existential : signature.getExistentials()) {
			Atom atom = existential.getAtom();
			if (resolved.containsKey(atom) || definitions.containsKey(existential.getName())) {
				continue;
			}
			boolean constrained = false;
			Expression solution = null;
			for (Obligation obligation : working) {
				for (Constraint clause : obligation.getClauses()) {
					Expression difference = clause.difference();
					if (clause.getComparison() != Constraint.Comparison.EQ || !difference.mentions(atom)) {
						continue;
					}
					constrained = true;
					Optional<Expression> coefficient = difference.linearCoefficient(atom);
					if (!coefficient.isPresent() || !coefficient.get().isConstant()) {
						continue;
					}
					long c = coefficient.get().getConstant();
					Expression rest = difference.withoutAtom(atom).negate();
					if (rest.isDivisibleBy(c)) {
						solution = rest.divideExact(c);
						break;
					}
				}
				if (solution != null) {
					break;
				}
			}
			if (!constrained) {
				solution = solveFromGuards(existential, working);
			}
			if (solution == null) {
				// determined only once the value parameters are literals
				continue;
			}

			Expression value = solution;
			Map<Atom, Expression> substitution = Collections.singletonMap(atom, value);
			resolved.replaceAll((a, e) -> e.substitute(substitution));
			resolved.put(atom, value);
			List<Obligation> next = new ArrayList<>();
			for (Obligation obligation : working) {
				next.add(obligation.substitute(substitution));
			}
			Constraint natural = Constraint.ge(value, Expression.ZERO, Constraint.Reason.EXISTENTIAL_DEFINITION,
					existential.getNode());
			next.add(Obligation.of(natural, cex -> new UnsatisfiableConstraintsIssue(
					"existential " + existential.getName() + " = " + value.render(),
					Collections.singletonList(natural), cex)));
			working = next;
		}
		return working;
	}

	/**
	 * Solves an existential that no equality mentions from the inequalities that bound it. Bounds that also mention
	 * other atoms are left for specialization, where the solver sees literal values.
	 *
	 * @return the unique value, or null if it is left for specialization or an issue was reported
	 */
	private Expression solveFromGuards(ExistentialParameter existential, List<Obligation> working) {
		Atom atom = existential.getAtom();
		List<Constraint> bounds = new ArrayList<>();
		for (Obligation obligation : working) {
			for (Constraint clause : obligation.getClauses()) {
				if (!clause.mentions(atom)) {
					continue;
				}
				if (!clause.getAtoms().equals(Collections.singleton(atom))) {
					return null;
				}
				bounds.add(clause);
			}
		}
		if (bounds.isEmpty()) {
			ctx.error(new UnderconstrainedExistentialIssue(existential.getNode(), existential.getName(),
					"no definition is given and nothing constrains it"));
			return null;
		}
		Optional<Map<Atom, Long>> solved = ExistentialSolver.perform(ctx, solver,
				"existential " + existential.getName() + " of " + signature.getName(), existential.getNode(),
				Collections.singletonList(atom), bounds);
		return solved.map(values -> Expression.constant(values.get(atom))).orElse(null);
	}

	private static List<Interval> window(InvocationInfo invocation) {
		List<Interval> window = new ArrayList<>();
		TimeExpression start = invocation.time;
		if (invocation.delay.isConstant() && invocation.delay.getConstant() <= 0) {
			window.add(Interval.cycle(start));
		} else {
			window.add(Interval.of(start, start.shift(invocation.delay)));
		}
		Port interfacePort = invocation.instance.callee.getInterfacePort();
		if (interfacePort != null) {
			window.add(invocation.intervals.get(interfacePort.getName()));
		}
		for (Port input : invocation.instance.callee.getInputs()) {
			window.add(invocation.intervals.get(input.getName()));
		}
		return window;
	}

	private static List<Constraint> before(List<Interval> earlier, List<Interval> later, SourceLocatable where) {
		List<Constraint> result = new ArrayList<>();
		for (Interval a : earlier) {
			for (Interval b : later) {
				result.add(Constraint.ge(b.getStart().getOffset(), a.getEnd().getOffset(),
						Constraint.Reason.REUSE, where));
			}
		}
		return result;
	}

	private void checkReuse() {
		Map<String, List<InvocationInfo>> byInstance = new LinkedHashMap<>();
		for (InvocationInfo invocation : invocations.values()) {
			byInstance.computeIfAbsent(invocation.instance.getName(), k -> new ArrayList<>()).add(invocation);
		}
		for (Map.Entry<String, List<InvocationInfo>> e : byInstance.entrySet()) {
			List<InvocationInfo> uses = e.getValue();
			for (int i = 0; i < uses.size(); i++) {
				for (int j = i + 1; j < uses.size(); j++) {
					InvocationInfo first = uses.get(i);
					InvocationInfo second = uses.get(j);
					List<Interval> firstWindow = window(first);
					List<Interval> secondWindow = window(second);
					ReuseCheck check = new ReuseCheck(e.getKey(), first.node, second.node, firstWindow, secondWindow);
					try {
						SatResult firstThenSecond = DischargePass.refute(
								solver, facts, before(firstWindow, secondWindow, second.node));
						if (firstThenSecond == SatResult.UNSAT) {
							continue;
						}
						SatResult secondThenFirst = DischargePass.refute(
								solver, facts, before(secondWindow, firstWindow, first.node));
						if (secondThenFirst == SatResult.UNSAT) {
							continue;
						}
						if (firstThenSecond == SatResult.SAT && secondThenFirst == SatResult.SAT) {
							ctx.error(check.toIssue());
						} else {
							deferredReuse.add(check);
						}
					} catch (SolverException ex) {
						ctx.error(new SolverFailureIssue(ex.getMessage(), ex));
					}
				}
			}
		}
	}
}
