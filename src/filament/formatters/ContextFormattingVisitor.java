package filament.formatters;

import filament.errors.ContextVisitor;
import filament.trans.passes.check.WhileCheckingComponent;
import filament.trans.passes.load.WhileLoadingImport;
import filament.trans.passes.mono.WhileSpecializing;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileLoadingImport whileLoadingImport) throws IOException {
		out.write("while loading \"");
		out.write(whileLoadingImport.getSubject());
		out.write("\" imported ");
		whileLoadingImport.getImport().getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(WhileCheckingComponent whileCheckingComponent) throws IOException {
		out.write("while checking component ");
		out.write(whileCheckingComponent.getSubject());
		return null;
	}

	@Override
	public Void visit(WhileSpecializing whileSpecializing) throws IOException {
		out.write("while specializing ");
		out.write(whileSpecializing.getSubject());
		return null;
	}

}
