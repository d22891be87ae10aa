package pymig.trans.passes.parse.option;

import pymig.PyMigOptionException;
import pymig.PyMigOptions;
import pymig.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static PyMigOptions perform(IssueContext ctx, Logger logger, String[] args) {
		PyMigOptions opts = new PyMigOptions(args);
		try {
			opts.parse();
		} catch (PyMigOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
			// the console handler drops anything below INFO otherwise
			for (Handler handler : Logger.getLogger("").getHandlers()) {
				handler.setLevel(Level.FINE);
			}
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
