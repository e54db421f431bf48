package filament.trans.passes.scope;

import filament.errors.IssueContext;
import filament.model.ast.FilCommand;
import filament.model.ast.FilCommandVisitor;
import filament.model.ast.FilComponent;
import filament.model.ast.FilConstantPortRef;
import filament.model.ast.FilExistential;
import filament.model.ast.FilExistentialDefinition;
import filament.model.ast.FilExpression;
import filament.model.ast.FilGuard;
import filament.model.ast.FilInstance;
import filament.model.ast.FilInvocation;
import filament.model.ast.FilInvocationPortRef;
import filament.model.ast.FilName;
import filament.model.ast.FilOutputBinding;
import filament.model.ast.FilPort;
import filament.model.ast.FilPortRef;
import filament.model.ast.FilPortRefVisitor;
import filament.model.ast.FilThisPortRef;
import filament.model.ast.FilUnit;
import filament.scope.Declaration;
import filament.scope.ScopeBuilder;
import filament.trans.intermediate.DefinitionRegistry;
import filament.trans.passes.check.WhileCheckingComponent;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Registers every component of the program and resolves every name used inside each component. Also records
 * which components each component instantiates.
 */
public class ScopingPass {
	private static final EnumSet<Declaration.Kind> PARAMETERS = EnumSet.of(Declaration.Kind.PARAMETER);
	private static final EnumSet<Declaration.Kind> SIGNATURE_VALUES =
			EnumSet.of(Declaration.Kind.PARAMETER, Declaration.Kind.EXISTENTIAL);
	private static final EnumSet<Declaration.Kind> PORT_VALUES =
			EnumSet.of(Declaration.Kind.PARAMETER, Declaration.Kind.EVENT, Declaration.Kind.EXISTENTIAL);
	private static final EnumSet<Declaration.Kind> TIME_VALUES =
			EnumSet.of(Declaration.Kind.PARAMETER, Declaration.Kind.EVENT);

	private ScopingPass() {}

	public static DefinitionRegistry perform(IssueContext ctx, List<FilUnit> units) {
		DefinitionRegistry registry = new DefinitionRegistry();
		for (FilUnit unit : units) {
			for (FilComponent component : unit.getComponents()) {
				if (!registry.addComponent(component)) {
					FilComponent first = registry.getComponent(component.getName().getId());
					ctx.error(new DuplicateDefinitionIssue(
							component.getName().getId(), first.getName(), component.getName()));
				}
			}
		}
		for (FilComponent component : new ArrayList<>(registry.getComponents())) {
			scopeComponent(ctx.withContext(new WhileCheckingComponent(component)), registry, component);
		}
		return registry;
	}

	private static void scopeExpression(ScopeBuilder scope, DefinitionRegistry registry, FilExpression expression,
	                                    EnumSet<Declaration.Kind> allowed, boolean allowInstanceExistentials,
	                                    String usage) {
		expression.accept(new FilExpressionScopingVisitor(
				scope, registry, allowed, allowInstanceExistentials, usage));
	}

	private static void scopeGuards(ScopeBuilder scope, DefinitionRegistry registry, List<FilGuard> guards,
	                                EnumSet<Declaration.Kind> allowed, String usage) {
		for (FilGuard guard : guards) {
			scopeExpression(scope, registry, guard.getLhs(), allowed, false, usage);
			scopeExpression(scope, registry, guard.getRhs(), allowed, false, usage);
		}
	}

	private static void scopeComponent(IssueContext ctx, DefinitionRegistry registry, FilComponent component) {
		ScopeBuilder signature = new ScopeBuilder(ctx);
		for (FilName param : component.getParams()) {
			signature.declare(Declaration.of(Declaration.Kind.PARAMETER, param.getId(), param));
		}
		signature.declare(Declaration.of(
				Declaration.Kind.EVENT, component.getEvent().getId(), component.getEvent()));
		for (FilExistential existential : component.getExistentials()) {
			signature.declare(Declaration.of(
					Declaration.Kind.EXISTENTIAL, existential.getName().getId(), existential.getName()));
		}

		// ports live in their own namespace; only port references see them
		ScopeBuilder ports = new ScopeBuilder(ctx);
		List<FilPort> allPorts = new ArrayList<>(component.getInputs());
		allPorts.addAll(component.getOutputs());
		for (FilPort port : allPorts) {
			ports.declare(Declaration.of(Declaration.Kind.PORT, port.getName().getId(), port.getName()));
		}

		scopeExpression(signature, registry, component.getDelay(), SIGNATURE_VALUES, false, "delay");
		for (FilPort port : allPorts) {
			String usage = "port " + port.getName().getId();
			scopeExpression(signature, registry, port.getStart(), PORT_VALUES, false, usage);
			if (!port.isInterface()) {
				scopeExpression(signature, registry, port.getEnd(), PORT_VALUES, false, usage);
				scopeExpression(signature, registry, port.getWidth(), PORT_VALUES, false, usage);
			}
		}
		scopeGuards(signature, registry, component.getGuards(), PARAMETERS, "guards");
		for (FilExistential existential : component.getExistentials()) {
			String usage = "existential " + existential.getName().getId();
			if (existential.getDefinition() != null) {
				scopeExpression(signature, registry, existential.getDefinition(), SIGNATURE_VALUES, false, usage);
			}
			scopeGuards(signature, registry, existential.getGuards(), SIGNATURE_VALUES, usage);
		}

		if (component.getBody() == null) {
			return;
		}
		ScopeBuilder body = signature.makeNestedScope();
		for (FilCommand command : component.getBody()) {
			if (command instanceof FilInstance) {
				FilInstance instance = (FilInstance) command;
				body.declare(Declaration.instance(
						instance.getName().getId(), instance.getName(), instance.getComponent().getId()));
			} else if (command instanceof FilInvocation) {
				FilInvocation invocation = (FilInvocation) command;
				body.declare(Declaration.invocation(
						invocation.getName().getId(), invocation.getName(), invocation.getInstance().getId()));
			}
		}
		for (FilCommand command : component.getBody()) {
			command.accept(new BodyScopingVisitor(registry, component, body, ports));
		}
	}

	private static class BodyScopingVisitor extends FilCommandVisitor<Void, RuntimeException> {
		private final DefinitionRegistry registry;
		private final FilComponent component;
		private final ScopeBuilder body;
		private final PortRefScopingVisitor portRefs;
		private final ScopeBuilder ports;

		BodyScopingVisitor(DefinitionRegistry registry, FilComponent component, ScopeBuilder body,
		                   ScopeBuilder ports) {
			this.registry = registry;
			this.component = component;
			this.body = body;
			this.ports = ports;
			this.portRefs = new PortRefScopingVisitor(registry, body, ports);
		}

		@Override
		public Void visit(FilInstance instance) {
			String callee = instance.getComponent().getId();
			if (registry.findComponent(callee).isPresent()) {
				registry.addInstantiation(component.getName().getId(), callee);
			} else {
				body.getIssueContext().error(new UnboundIdentifierIssue(
						instance.getComponent(), callee, "component definitions"));
			}
			for (FilExpression arg : instance.getArgs()) {
				scopeExpression(body, registry, arg, PARAMETERS, false,
						"arguments of instance " + instance.getName().getId());
			}
			return null;
		}

		@Override
		public Void visit(FilInvocation invocation) {
			body.reference(invocation.getInstance(), invocation.getInstance().getId(),
					EnumSet.of(Declaration.Kind.INSTANCE), "invoked instances");
			scopeExpression(body, registry, invocation.getTime(), TIME_VALUES, true,
					"time of invocation " + invocation.getName().getId());
			for (FilPortRef arg : invocation.getArgs()) {
				arg.accept(portRefs);
			}
			return null;
		}

		@Override
		public Void visit(FilExistentialDefinition existentialDefinition) {
			body.reference(existentialDefinition.getName(), existentialDefinition.getName().getId(),
					EnumSet.of(Declaration.Kind.EXISTENTIAL), "existential definitions");
			scopeExpression(body, registry, existentialDefinition.getValue(), SIGNATURE_VALUES, true,
					"definition of " + existentialDefinition.getName().getId());
			return null;
		}

		@Override
		public Void visit(FilOutputBinding outputBinding) {
			ports.reference(outputBinding.getPort(), outputBinding.getPort().getId(),
					EnumSet.of(Declaration.Kind.PORT), "output bindings");
			outputBinding.getSource().accept(portRefs);
			return null;
		}
	}

	private static class PortRefScopingVisitor extends FilPortRefVisitor<Void, RuntimeException> {
		private final DefinitionRegistry registry;
		private final ScopeBuilder body;
		private final ScopeBuilder ports;

		PortRefScopingVisitor(DefinitionRegistry registry, ScopeBuilder body, ScopeBuilder ports) {
			this.registry = registry;
			this.body = body;
			this.ports = ports;
		}

		@Override
		public Void visit(FilThisPortRef thisPortRef) {
			ports.reference(thisPortRef.getPort(), thisPortRef.getPort().getId(),
					EnumSet.of(Declaration.Kind.PORT), "port references");
			return null;
		}

		@Override
		public Void visit(FilInvocationPortRef invocationPortRef) {
			Optional<Declaration> invocation = body.reference(
					invocationPortRef.getInvocation(), invocationPortRef.getInvocation().getId(),
					EnumSet.of(Declaration.Kind.INVOCATION), "port references");
			if (!invocation.isPresent()) {
				return null;
			}
			Optional<FilComponent> callee = body.lookup(invocation.get().getTarget())
					.filter(d -> d.getKind() == Declaration.Kind.INSTANCE)
					.flatMap(d -> registry.findComponent(d.getTarget()));
			if (!callee.isPresent()) {
				// reported where the instance or its component is referenced
				return null;
			}
			String port = invocationPortRef.getPort().getId();
			List<FilPort> calleePorts = new ArrayList<>(callee.get().getInputs());
			calleePorts.addAll(callee.get().getOutputs());
			for (FilPort candidate : calleePorts) {
				if (candidate.getName().getId().equals(port)) {
					return null;
				}
			}
			body.getIssueContext().error(new UnboundIdentifierIssue(
					invocationPortRef.getPort(), invocationPortRef.getInvocation().getId() + "." + port,
					"ports of " + callee.get().getName().getId()));
			return null;
		}

		@Override
		public Void visit(FilConstantPortRef constantPortRef) {
			return null;
		}
	}
}
