package filament.solver;

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SolverFactoryTest {

	@Test
	public void testBuiltin() {
		try (SolverSession session = SolverFactory.create("builtin", null).open()) {
			assertThat(session, instanceOf(FourierMotzkinSession.class));
		}
	}

	@Test
	public void testExternalSolvers() {
		SolverFactory z3 = SolverFactory.create("z3", null);
		assertThat(z3, instanceOf(SmtLibSolverFactory.class));
		assertThat(((SmtLibSolverFactory) z3).getCommand(), is(Arrays.asList("z3", "-smt2", "-in")));
		assertThat(((SmtLibSolverFactory) SolverFactory.create("cvc5", null)).getCommand().get(0), is("cvc5"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownSolver() {
		SolverFactory.create("yices", null);
	}
}
