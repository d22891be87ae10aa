package pymig.trans.passes.migrate;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Modules with nothing to rewrite come out exactly as they went in.
 */
@RunWith(Parameterized.class)
public class LayoutFidelityTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						"x = 1\n",
				},
				{
						"",
				},
				{
						"import os, sys  # tools\n" +
						"from collections import (\n" +
						"    OrderedDict,\n" +
						"    defaultdict,\n" +
						")\n" +
						"\n" +
						"\n" +
						"@decorator(1)\n" +
						"class Greeter(Base, metaclass=Meta):\n" +
						"    \"\"\"Says hello.\"\"\"\n" +
						"\n" +
						"    def __init__(self, name, *args, greeting='hello', **kwargs):\n" +
						"        self.name = name  ;  self.greeting = greeting\n" +
						"        self.extra = [a for a in args if a]\n" +
						"\n" +
						"    def greet(self, target=None) -> str:\n" +
						"        if target is None:\n" +
						"            return self.greeting\n" +
						"        elif target not in self.seen:\n" +
						"            self.seen[target] = 1\n" +
						"        else:\n" +
						"            return None\n" +
						"        return '%d, %s' % (count, target)\n",
				},
				{
						"def gen(n):\n" +
						"\tfor i in range(n):\n" +
						"\t\tyield i ** 2\n" +
						"\telse:\n" +
						"\t\tpass\n" +
						"\twhile not done and (x or\n" +
						"\t                    y):\n" +
						"\t\tx -= 1; continue\n" +
						"\ttry:\n" +
						"\t\traise ValueError('bad') from None\n" +
						"\texcept (KeyError, ValueError) as e:\n" +
						"\t\tdel e\n" +
						"\texcept Exception:\n" +
						"\t\traise\n" +
						"\tfinally:\n" +
						"\t\tassert n > 0, \"positive\"\n" +
						"\twith open(p) as f, lock:\n" +
						"\t\tdata = f.read()[1:-1:2]\n" +
						"\tlam = lambda a, b=2, *c: a if b else -c\n" +
						"\treturn {'k': v, **rest}, {1, 2}, (), x[1:2, ::3]\n",
				},
				{
						"# leading comment\n" +
						"\n" +
						"x = {  # open\n" +
						"    'a': 1,  # one\n" +
						"    # standalone\n" +
						"    'b': [1,\n" +
						"          2],\n" +
						"}  # close\n",
				},
				{
						"total = first + \\\n" +
						"        second\n" +
						"ok = 0 < total <= 10 and not (a is not b)\n",
				},
				{
						"x =\t1   \n" +
						"    \n" +
						"y = (x)  # grouped\n",
				},
				{
						"def counter():\n" +
						"    count: int = 0\n" +
						"    def bump(step=1):\n" +
						"        nonlocal count\n" +
						"        global total\n" +
						"        count += step\n" +
						"        return -count ** 2 // 3\n" +
						"    return bump\n",
				},
				{
						"x = f'{a}' % b\n" +
						"y = u'%s %s' % (a, *b)\n",
				},
		});
	}

	private final String source;

	public LayoutFidelityTest(String source) {
		this.source = source;
	}

	@Test
	public void test() {
		assertThat(FStringMigrationPassTest.migrate(source), is(source));
	}

}
