package pymig.trans.passes.parse;

import pymig.errors.Issue;
import pymig.lexer.PyMigLexerException;
import pymig.lexer.PythonLexer;
import pymig.lexer.PythonToken;
import pymig.model.python.PyModule;
import pymig.model.python.PySourceFile;
import pymig.model.python.PyTrivia;
import pymig.parser.PythonParseException;
import pymig.parser.PythonParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class PythonParsingPass {
	private PythonParsingPass() {}

	public static PySourceFile perform(Path inputFileName, CharSequence inputFileContents) throws Issue {
		PythonLexer lexer = new PythonLexer(inputFileName, inputFileContents);
		List<String> lines = Arrays.asList(lexer.getText().split("\n", -1));
		try {
			List<PythonToken> tokens = lexer.readTokens();
			PythonParser parser = new PythonParser(inputFileName, tokens);
			PyModule module = parser.parseModule();
			List<PyTrivia> trivia = new ArrayList<>(lexer.getTrivia());
			trivia.addAll(parser.getGroupingParens());
			return new PySourceFile(inputFileName, lexer.getText(), module, trivia, parser.getGroupedExpressions());
		} catch (PyMigLexerException | PythonParseException e) {
			throw new ParsingIssue("Python", e, lines);
		}
	}
}
