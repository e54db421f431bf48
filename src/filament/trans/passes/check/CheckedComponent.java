package filament.trans.passes.check;

import filament.model.ast.FilOutputBinding;
import filament.model.component.Signature;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A component that passed type checking, with what specialization still needs: how each existential follows
 * from the value parameters, and the constraints that could only be settled once parameters are literals.
 */
public final class CheckedComponent {
	private final Signature signature;
	private final List<CheckedInstance> instances;
	private final List<CheckedInvocation> invocations;
	private final List<FilOutputBinding> bindings;
	private final Map<Atom, Expression> resolved;
	private final List<Atom> deferred;
	private final List<Constraint> concreteConstraints;
	private final List<ReuseCheck> deferredReuse;

	public CheckedComponent(Signature signature, List<CheckedInstance> instances,
	                        List<CheckedInvocation> invocations, List<FilOutputBinding> bindings,
	                        Map<Atom, Expression> resolved, List<Atom> deferred,
	                        List<Constraint> concreteConstraints, List<ReuseCheck> deferredReuse) {
		this.signature = signature;
		this.instances = Collections.unmodifiableList(instances);
		this.invocations = Collections.unmodifiableList(invocations);
		this.bindings = Collections.unmodifiableList(bindings);
		this.resolved = Collections.unmodifiableMap(resolved);
		this.deferred = Collections.unmodifiableList(deferred);
		this.concreteConstraints = Collections.unmodifiableList(concreteConstraints);
		this.deferredReuse = Collections.unmodifiableList(deferredReuse);
	}

	public String getName() {
		return signature.getName();
	}

	public Signature getSignature() {
		return signature;
	}

	public List<CheckedInstance> getInstances() {
		return instances;
	}

	public List<CheckedInvocation> getInvocations() {
		return invocations;
	}

	public List<FilOutputBinding> getBindings() {
		return bindings;
	}

	/**
	 * @return for each existential that has one, an expression over value parameters, instance existentials
	 * and {@link #getDeferred() deferred} existentials
	 */
	public Map<Atom, Expression> getResolved() {
		return resolved;
	}

	/**
	 * @return existentials that must be solved for once the value parameters are literals
	 */
	public List<Atom> getDeferred() {
		return deferred;
	}

	public List<Constraint> getConcreteConstraints() {
		return concreteConstraints;
	}

	public List<ReuseCheck> getDeferredReuse() {
		return deferredReuse;
	}
}
