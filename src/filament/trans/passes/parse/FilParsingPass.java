package filament.trans.passes.parse;

import filament.errors.IssueContext;
import filament.model.ast.FilUnit;
import filament.parser.FilParseException;
import filament.parser.FilParser;

import java.nio.file.Path;

public class FilParsingPass {

	private FilParsingPass() {}

	public static FilUnit perform(IssueContext ctx, Path filename, CharSequence fileContents) {
		try {
			return FilParser.readUnit(filename, fileContents);
		} catch (FilParseException e) {
			ctx.error(new ParseIssue(e));
			return null;
		}
	}

}
