package filament.scope;

import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

public class ChainMapTest {

	@Test
	public void testLookupFallsThrough() {
		Map<String, Integer> outer = new LinkedHashMap<>();
		outer.put("W", 1);
		ChainMap<String, Integer> inner = new ChainMap<>(outer);
		inner.put("m2", 2);
		assertThat(inner.get("W"), is(1));
		assertThat(inner.containsKey("m2"), is(true));
		assertThat(inner.size(), is(2));
		assertThat(outer.containsKey("m2"), is(false));
	}

	@Test
	public void testShadowingLeavesParentIntact() {
		Map<String, Integer> outer = new LinkedHashMap<>();
		outer.put("W", 1);
		ChainMap<String, Integer> inner = new ChainMap<>(outer);
		inner.put("W", 5);
		assertThat(inner.get("W"), is(5));
		assertThat(outer.get("W"), is(1));
		inner.remove("W");
		assertThat(inner.get("W"), is(1));
		inner.clear();
		assertThat(outer.size(), is(1));
		assertThat(inner.get("L"), is(nullValue()));
	}
}
