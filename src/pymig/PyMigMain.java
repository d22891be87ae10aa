package pymig;

import org.apache.commons.io.IOUtils;
import pymig.errors.Issue;
import pymig.errors.TopLevelIssueContext;
import pymig.model.python.PySourceFile;
import pymig.trans.IOErrorIssue;
import pymig.trans.PyMigTransException;
import pymig.trans.passes.migrate.FStringMigrationPass;
import pymig.trans.passes.parse.PythonParsingPass;
import pymig.trans.passes.parse.option.OptionParsingPass;

import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class PyMigMain {
	private String[] cmdArgs;
	private static Logger logger;

	public PyMigMain(String[] args) {
		cmdArgs = args;
		// Get the top Logger instance
		logger = Logger.getLogger("PyMigMain");
	}

	// Creates a PyMigMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new PyMigMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	private static String readInput(String inputFilePath) throws IOException {
		if (inputFilePath == null) {
			return IOUtils.toString(System.in, StandardCharsets.UTF_8);
		}
		try (InputStream in = new FileInputStream(inputFilePath)) {
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	private static Writer openOutput(String outputFilePath) throws IOException {
		if (outputFilePath == null) {
			return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		}
		return Files.newBufferedWriter(Paths.get(outputFilePath), StandardCharsets.UTF_8);
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			// Check options, set up logging.
			PyMigOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}

			logger.info(opts.inputFilePath == null ? "Reading standard input" : "Opening source file");
			String contents = readInput(opts.inputFilePath);
			Path inputFilePath = Paths.get(opts.inputFilePath == null ? "stdin" : opts.inputFilePath);

			logger.info("Parsing Python module");
			final PySourceFile source;
			try {
				source = PythonParsingPass.perform(inputFilePath, contents);
			} catch (Issue issue) {
				ctx.error(issue);
				throw new PyMigTransException(ctx.format());
			}

			logger.info("Migrating format expressions");
			Writer output = openOutput(opts.outputFilePath);
			try {
				FStringMigrationPass.perform(ctx, source, output, opts.firstLine, opts.lastLine);
			} finally {
				if (opts.outputFilePath == null) {
					// standard output stays open
					output.flush();
				} else {
					output.close();
				}
			}
			checkErrors(ctx);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			logger.severe("found issues");
			System.err.println(ctx.format());
			return false;
		} catch (PyMigTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMsg());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws PyMigTransException {
		if (ctx.hasErrors()) {
			throw new PyMigTransException(ctx.format());
		}
	}
}
