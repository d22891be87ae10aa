package pymig.trans.passes.migrate;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import pymig.errors.TopLevelIssueContext;
import pymig.model.python.PySourceFile;
import pymig.trans.passes.parse.PythonParsingPass;

import java.io.StringWriter;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.hamcrest.MatcherAssert.assertThat;

@RunWith(Parameterized.class)
public class FStringMigrationPassTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						"print(\"%s%s, %s!\" % (greeting[0].upper(), greeting[1:], target))\n",
						"print(f'{greeting[0].upper()}{greeting[1:]}, {target}!')\n",
				},
				{
						"x = '%r' % (x,)\n",
						"x = f'{x!r}'\n",
				},
				// %d formats differently from a replacement field
				{
						"x = '%d' % (n,)\n",
						"x = '%d' % (n,)\n",
				},
				// padding and truncation carry over to the converted text
				{
						"x = '%5s' % (n,)\n",
						"x = f'{n!s:>5}'\n",
				},
				{
						"x = '%-8s|%.2r' % (a, b)\n",
						"x = f'{a!s:<8}|{b!r:.2}'\n",
				},
				// the width is itself an argument
				{
						"x = '%*s' % (w, n)\n",
						"x = '%*s' % (w, n)\n",
				},
				{
						"x = '%\\n' % (n,)\n",
						"x = '%\\n' % (n,)\n",
				},
				{
						"x = '%(name)s' % {'name': n}\n",
						"x = '%(name)s' % {'name': n}\n",
				},
				{
						"x = 'hello %s' % name\n",
						"x = f'hello {name}'\n",
				},
				{
						"x = '%s and %s' % (a,)\n",
						"x = '%s and %s' % (a,)\n",
				},
				{
						"x = '%s' % (a, b)\n",
						"x = '%s' % (a, b)\n",
				},
				{
						"x = '%s' % (*args,)\n",
						"x = '%s' % (*args,)\n",
				},
				{
						"x = '%s%%' % (ratio,)\n",
						"x = f'{ratio}%'\n",
				},
				{
						"x = '{%s}' % (key,)\n",
						"x = f'{{{key}}}'\n",
				},
				{
						"x = \"it's %s\" % (who,)\n",
						"x = f'it\\'s {who}'\n",
				},
				{
						"x = '%s' % (d['k'],)\n",
						"x = f'{d[\"k\"]}'\n",
				},
				// the key would need a quote the f-string already uses
				{
						"x = '%s' % (d[\"it's\"],)\n",
						"x = '%s' % (d[\"it's\"],)\n",
				},
				{
						"x = '%s' % ({1: 2},)\n",
						"x = f'{ {1: 2}}'\n",
				},
				{
						"x = '%s' % (lambda: 1,)\n",
						"x = f'{(lambda: 1)}'\n",
				},
				{
						"x = '%s' % (a if b else c,)\n",
						"x = f'{a if b else c}'\n",
				},
				{
						"x = '%s' % ('%s' % y,)\n",
						"x = f'{f\"{y}\"}'\n",
				},
				{
						"x = '%s' % (a + b,) + suffix\n",
						"x = f'{a + b}' + suffix\n",
				},
				{
						"x = '%s' % (f(a, *b, k=1),)\n",
						"x = f'{f(a, *b, k=1)}'\n",
				},
				{
						"x = '%s' % ((a + b),)\n",
						"x = f'{a + b}'\n",
				},
				{
						"x = ('%s' % y)\n",
						"x = (f'{y}')\n",
				},
				{
						"x = '%s' % (a +\n            b)\n",
						"x = f'{a + b}'\n\n",
				},
				// the lines a collapsed expression leaves behind stay part of the joined line
				{
						"x = '%s %s' % (a,\n     b) + c + \\\n    d\n",
						"x = f'{a} {b}' + c + \\\n\\\n    d\n",
				},
				{
						"x = '%s %s' % (a, b) + c + \\\n    d\n",
						"x = f'{a} {b}' + c + \\\n    d\n",
				},
				{
						"x = '%s' % (a +\n b) + \\\n    c\n",
						"x = f'{a + b}' + \\\n\\\n    c\n",
				},
				{
						"x = '%s' % (a + b) + \\\n    c\n",
						"x = f'{a + b}' + \\\n    c\n",
				},
				{
						"x = '%s %s' % (a,\n     b) + \\\n    '%s' % (c,)\n",
						"x = f'{a} {b}' + \\\n\\\n    f'{c}'\n",
				},
				{
						"x = ('%s' % (a,  # first\n             ))\n",
						"x = ('%s' % (a,  # first\n             ))\n",
				},
				{
						"x = 1 + '%s' % y  # note\ny = 2\n",
						"x = 1 + f'{y}'  # note\ny = 2\n",
				},
				{
						"print('%s' % (x,),  # keep\n      sep='')\n",
						"print(f'{x}',  # keep\n      sep='')\n",
				},
				{
						"x = '%s' % y; z = '%s' % w\n",
						"x = f'{y}'; z = f'{w}'\n",
				},
				{
						"x = '%s' % y if c else '%r' % (z,)\n",
						"x = f'{y}' if c else f'{z!r}'\n",
				},
				{
						"x = b'%s' % (y,)\n",
						"x = b'%s' % (y,)\n",
				},
				{
						"x = '%s' % ('a' 'b',)\n",
						"x = f'{\"ab\"}'\n",
				},
				{
						"x = '%s' % (y.z,) % w\n",
						"x = f'{y.z}' % w\n",
				},
				{
						"x = '%s:%s' % (a[1:2], not b)\n",
						"x = f'{a[1:2]}:{not b}'\n",
				},
		});
	}

	private final String source;
	private final String expected;

	public FStringMigrationPassTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	static String migrate(String source) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PySourceFile file = PythonParsingPass.perform(Paths.get("test.py"), source);
		StringWriter out = new StringWriter();
		FStringMigrationPass.perform(ctx, file, out);
		assertFalse(ctx.format(), ctx.hasErrors());
		return out.toString();
	}

	@Test
	public void test() {
		assertThat(migrate(source), is(expected));
	}

	@Test
	public void testMigratedOutputIsFixedPoint() {
		String once = migrate(source);
		assertThat(migrate(once), is(once));
	}

}
