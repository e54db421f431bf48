package filament.trans.passes.emit;

import filament.CompilationTestingUtils;
import filament.errors.TopLevelIssueContext;
import filament.solver.SolverFactory;
import filament.trans.intermediate.CheckedProgram;
import filament.trans.passes.mono.CompilationSession;
import filament.trans.passes.mono.MonomorphizationPass;
import filament.trans.passes.mono.MonomorphizedProgram;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class JsonEmitPassTest {

	private JSONObject json;

	@Before
	public void setUp() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		CheckedProgram checked = CompilationTestingUtils.check(ctx, "worked_example.fil");
		MonomorphizedProgram program = MonomorphizationPass.perform(ctx, checked, new CompilationSession(),
				SolverFactory.builtin(), "main", Collections.emptyList()).get();
		// through text, as a consumer would read it
		json = new JSONObject(JsonEmitPass.perform(program).toString(2));
	}

	private JSONObject component(String name) {
		JSONArray components = json.getJSONArray("components");
		for (int i = 0; i < components.length(); i++) {
			if (components.getJSONObject(i).getString("name").equals(name)) {
				return components.getJSONObject(i);
			}
		}
		throw new AssertionError("no component " + name);
	}

	@Test
	public void testComponents() {
		assertThat(json.getString("entry"), is("main"));
		assertThat(json.getJSONArray("components").length(), is(3));

		JSONObject mul = component("Mul_32_3");
		assertThat(mul.getString("definition"), is("Mul"));
		assertThat(mul.getJSONArray("arguments").getLong(1), is(3L));
		assertThat(mul.getBoolean("extern"), is(true));
		assertThat(mul.getLong("delay"), is(9L));
		assertThat(mul.getJSONObject("existentials").getLong("L"), is(9L));
		assertThat(mul.getJSONArray("instances").length(), is(0));
	}

	@Test
	public void testPorts() {
		JSONArray ports = component("Mul_32_2").getJSONArray("ports");
		assertThat(ports.length(), is(4));
		JSONObject go = ports.getJSONObject(0);
		assertThat(go.getString("name"), is("go"));
		assertThat(go.getBoolean("interface"), is(true));
		JSONObject out = ports.getJSONObject(3);
		assertThat(out.getString("direction"), is("output"));
		assertThat(out.getLong("start"), is(4L));
		assertThat(out.getLong("end"), is(5L));
		assertThat(out.getLong("width"), is(32L));
	}

	@Test
	public void testBody() {
		JSONObject main = component("main");
		assertThat(main.getLong("delay"), is(22L));
		JSONArray instances = main.getJSONArray("instances");
		assertThat(instances.getJSONObject(1).getString("component"), is("Mul_32_3"));

		JSONObject z = main.getJSONArray("invocations").getJSONObject(2);
		assertThat(z.getString("instance"), is("m3"));
		assertThat(z.getLong("time"), is(13L));
		JSONObject argument = z.getJSONArray("arguments").getJSONObject(0);
		assertThat(argument.getString("kind"), is("invocation"));
		assertThat(argument.getString("invocation"), is("y"));
		assertThat(argument.getString("port"), is("out"));

		JSONObject x = main.getJSONArray("invocations").getJSONObject(0);
		assertThat(x.getJSONArray("arguments").getJSONObject(0).getString("kind"), is("port"));

		JSONObject binding = main.getJSONArray("bindings").getJSONObject(0);
		assertThat(binding.getString("port"), is("out"));
		assertThat(binding.getJSONObject("source").getString("invocation"), is("z"));
	}
}
