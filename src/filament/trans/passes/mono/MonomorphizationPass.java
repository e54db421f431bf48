package filament.trans.passes.mono;

import filament.InternalCompilerError;
import filament.errors.IssueContext;
import filament.model.ast.FilConstantPortRef;
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
import filament.solver.ExistentialSolver;
import filament.solver.SolverFactory;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.passes.check.ArgumentCountMismatchIssue;
import filament.trans.passes.check.CheckedComponent;
import filament.trans.passes.check.CheckedInstance;
import filament.trans.passes.check.CheckedInvocation;
import filament.trans.passes.check.GuardViolatedIssue;
import filament.trans.passes.check.ReuseCheck;
import filament.trans.passes.scope.UnboundIdentifierIssue;
import filament.util.SourceLocatable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Specializes the instantiation graph below an entry component into concrete components.
 *
 * Each (definition, arguments) pair is specialized once per {@link CompilationSession}; every instance with the
 * same key refers to the same {@link MonoComponent}. A key that reappears while it is being specialized is an
 * instantiation cycle, and so is a chain of nested specializations deeper than the configured limit, since
 * arguments that keep growing never repeat a key.
 */
public class MonomorphizationPass {
	private static final Logger logger = Logger.getLogger(MonomorphizationPass.class.getName());

	public static final int DEFAULT_MAX_DEPTH = 256;

	private final CheckedProgram program;
	private final CompilationSession session;
	private final SolverFactory solver;
	private final int maxDepth;
	private final Set<SpecializationKey> onStack = new LinkedHashSet<>();

	private MonomorphizationPass(CheckedProgram program, CompilationSession session, SolverFactory solver,
	                             int maxDepth) {
		this.program = program;
		this.session = session;
		this.solver = solver;
		this.maxDepth = maxDepth;
	}

	public static Optional<MonomorphizedProgram> perform(IssueContext ctx, CheckedProgram program,
	                                                     CompilationSession session, SolverFactory solver,
	                                                     String main, List<Long> arguments) {
		return perform(ctx, program, session, solver, main, arguments, DEFAULT_MAX_DEPTH);
	}

	/**
	 * @param main the name of the entry component
	 * @param arguments literal values of the entry component's value parameters
	 * @param maxDepth how many specializations may be nested below the entry
	 * @return the program reachable from the entry, or empty if an issue was reported
	 */
	public static Optional<MonomorphizedProgram> perform(IssueContext ctx, CheckedProgram program,
	                                                     CompilationSession session, SolverFactory solver,
	                                                     String main, List<Long> arguments, int maxDepth) {
		Optional<CheckedComponent> entry = program.findComponent(main);
		if (!entry.isPresent()) {
			ctx.error(new UnboundIdentifierIssue(null, main, "the entry component"));
			return Optional.empty();
		}
		Signature signature = entry.get().getSignature();
		if (signature.getParams().size() != arguments.size()) {
			ctx.error(new ArgumentCountMismatchIssue(signature.getNode(), "entry component " + main,
					signature.getParams().size(), arguments.size()));
			return Optional.empty();
		}
		SpecializationKey key = new SpecializationKey(main, arguments);
		MonomorphizationPass pass = new MonomorphizationPass(program, session, solver, maxDepth);
		Optional<MonoComponent> specialized = pass.specialize(ctx, key, signature.getNode());
		if (!specialized.isPresent()) {
			return Optional.empty();
		}

		Map<SpecializationKey, MonoComponent> reachable = new LinkedHashMap<>();
		collect(session, key, reachable);
		return Optional.of(new MonomorphizedProgram(key, reachable));
	}

	/**
	 * Specializes one key without an enclosing walk.
	 *
	 * @param site where the specialization is requested, used in diagnostics
	 */
	public static Optional<MonoComponent> specialize(IssueContext ctx, CheckedProgram program,
	                                                 CompilationSession session, SolverFactory solver,
	                                                 SpecializationKey key, SourceLocatable site) {
		return new MonomorphizationPass(program, session, solver, DEFAULT_MAX_DEPTH).specialize(ctx, key, site);
	}

	private static void collect(CompilationSession session, SpecializationKey key,
	                            Map<SpecializationKey, MonoComponent> reachable) {
		if (reachable.containsKey(key)) {
			return;
		}
		MonoComponent component = session.lookup(key)
				.orElseThrow(() -> new InternalCompilerError("specialization " + key.render() + " is not cached"));
		for (MonoInstance instance : component.getInstances()) {
			collect(session, instance.getComponent(), reachable);
		}
		reachable.put(key, component);
	}

	private Optional<MonoComponent> specialize(IssueContext ctx, SpecializationKey key, SourceLocatable site) {
		if (onStack.contains(key)) {
			List<SpecializationKey> cycle = new ArrayList<>();
			boolean inCycle = false;
			for (SpecializationKey k : onStack) {
				inCycle = inCycle || k.equals(key);
				if (inCycle) {
					cycle.add(k);
				}
			}
			cycle.add(key);
			ctx.error(new InstantiationCycleIssue(cycle));
			return Optional.empty();
		}
		Optional<MonoComponent> cached = session.lookup(key);
		if (cached.isPresent()) {
			return cached;
		}
		if (onStack.size() > maxDepth) {
			List<SpecializationKey> chain = new ArrayList<>(onStack);
			chain.add(key);
			ctx.error(new InstantiationCycleIssue(chain, maxDepth));
			return Optional.empty();
		}
		CheckedComponent checked = program.findComponent(key.getDefinition())
				.orElseThrow(() -> new InternalCompilerError("component " + key.getDefinition() + " was not checked"));

		onStack.add(key);
		try {
			IssueContext nested = ctx.withContext(new WhileSpecializing(key));
			Optional<MonoComponent> result = build(nested, key, checked, site);
			return result.map(session::insertIfAbsent);
		} finally {
			onStack.remove(key);
		}
	}

	private Optional<MonoComponent> build(IssueContext ctx, SpecializationKey key, CheckedComponent checked,
	                                      SourceLocatable site) {
		Signature signature = checked.getSignature();
		Map<Atom, Long> valuation = new HashMap<>();
		for (int i = 0; i < signature.getParams().size(); i++) {
			valuation.put(Atom.parameter(signature.getParams().get(i)), key.getArguments().get(i));
		}
		boolean guardsHold = true;
		for (Constraint guard : signature.getGuards()) {
			if (!guard.evaluate(valuation)) {
				ctx.error(new GuardViolatedIssue(site, key.render(), guard, null));
				guardsHold = false;
			}
		}
		if (!guardsHold) {
			return Optional.empty();
		}

		// callees first: their existentials are facts of this component
		List<MonoInstance> instances = new ArrayList<>();
		for (CheckedInstance instance : checked.getInstances()) {
			List<Long> arguments = new ArrayList<>();
			for (Expression argument : instance.getArguments()) {
				arguments.add(argument.evaluate(valuation));
			}
			SpecializationKey calleeKey = new SpecializationKey(instance.getComponent(), arguments);
			Optional<MonoComponent> callee = specialize(ctx, calleeKey, instance.getNode());
			if (!callee.isPresent()) {
				return Optional.empty();
			}
			for (Map.Entry<String, Long> e : callee.get().getExistentials().entrySet()) {
				valuation.put(Atom.instanceExistential(instance.getName(), e.getKey()), e.getValue());
			}
			instances.add(new MonoInstance(instance.getName(), calleeKey));
		}

		if (!resolveExistentials(ctx, key, checked, valuation)) {
			return Optional.empty();
		}
		boolean hazard = false;
		for (ReuseCheck reuse : checked.getDeferredReuse()) {
			if (!reuse.holds(valuation)) {
				ctx.error(reuse.toIssue());
				hazard = true;
			}
		}
		if (hazard) {
			return Optional.empty();
		}

		Map<String, Long> existentials = new LinkedHashMap<>();
		for (ExistentialParameter existential : signature.getExistentials()) {
			existentials.put(existential.getName(), valuation.get(existential.getAtom()));
		}
		logger.fine(() -> "specialized " + key.render() + " with existentials " + existentials);

		MonoPort interfacePort = signature.getInterfacePort() == null
				? null
				: port(signature.getInterfacePort(), valuation);
		List<MonoPort> inputs = new ArrayList<>();
		for (Port input : signature.getInputs()) {
			inputs.add(port(input, valuation));
		}
		List<MonoPort> outputs = new ArrayList<>();
		for (Port output : signature.getOutputs()) {
			outputs.add(port(output, valuation));
		}
		List<MonoInvocation> invocations = new ArrayList<>();
		for (CheckedInvocation invocation : checked.getInvocations()) {
			List<MonoPortRef> arguments = new ArrayList<>();
			for (FilPortRef argument : invocation.getArguments()) {
				arguments.add(argument.accept(new PortRefConverter()));
			}
			invocations.add(new MonoInvocation(invocation.getName(), invocation.getInstance(),
					invocation.getTime().getOffset().evaluate(valuation), arguments));
		}
		List<MonoOutputBinding> bindings = new ArrayList<>();
		for (FilOutputBinding binding : checked.getBindings()) {
			bindings.add(new MonoOutputBinding(binding.getPort().getId(),
					binding.getSource().accept(new PortRefConverter())));
		}
		return Optional.of(new MonoComponent(key, signature.isExtern(), signature.getEvent(),
				signature.getDelay().evaluate(valuation), existentials, interfacePort, inputs, outputs, instances,
				invocations, bindings));
	}

	/**
	 * Extends the valuation with a value for every existential of the component.
	 */
	private boolean resolveExistentials(IssueContext ctx, SpecializationKey key, CheckedComponent checked,
	                                    Map<Atom, Long> valuation) {
		Map<Atom, Expression> known = new HashMap<>();
		for (Map.Entry<Atom, Long> e : valuation.entrySet()) {
			known.put(e.getKey(), Expression.constant(e.getValue()));
		}
		List<Constraint> concrete = new ArrayList<>();
		for (Constraint constraint : checked.getConcreteConstraints()) {
			concrete.add(constraint.substitute(known));
		}
		Optional<Map<Atom, Long>> solved = ExistentialSolver.perform(ctx, solver, key.render(),
				checked.getSignature().getNode(), checked.getDeferred(), concrete);
		if (!solved.isPresent()) {
			return false;
		}
		valuation.putAll(solved.get());
		for (Map.Entry<Atom, Expression> e : checked.getResolved().entrySet()) {
			valuation.put(e.getKey(), e.getValue().evaluate(valuation));
		}
		return true;
	}

	private static MonoPort port(Port port, Map<Atom, Long> valuation) {
		return new MonoPort(port.getName(), port.getDirection(), port.isInterface(),
				port.getInterval().getStart().getOffset().evaluate(valuation),
				port.getInterval().getEnd().getOffset().evaluate(valuation),
				port.getWidth().evaluate(valuation));
	}

	private static class PortRefConverter extends FilPortRefVisitor<MonoPortRef, RuntimeException> {
		@Override
		public MonoPortRef visit(FilThisPortRef thisPortRef) {
			return MonoPortRef.ofThis(thisPortRef.getPort().getId());
		}

		@Override
		public MonoPortRef visit(FilInvocationPortRef invocationPortRef) {
			return MonoPortRef.ofInvocation(invocationPortRef.getInvocation().getId(),
					invocationPortRef.getPort().getId());
		}

		@Override
		public MonoPortRef visit(FilConstantPortRef constantPortRef) {
			return MonoPortRef.ofConstant(constantPortRef.getValue());
		}
	}
}
