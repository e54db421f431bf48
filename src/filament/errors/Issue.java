package filament.errors;

import filament.Unreachable;
import filament.formatters.IndentingWriter;
import filament.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem in the program under compilation. Issues are reported to an {@link IssueContext}, never thrown.
 */
public abstract class Issue {

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

	public String render() {
		StringWriter sw = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(new IndentingWriter(sw)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	@Override
	public String toString() {
		return render();
	}
}
