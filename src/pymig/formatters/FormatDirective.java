package pymig.formatters;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One printf-style conversion specifier inside a format string, such as "%s", "%-5.2f", "%(name)r" or "%%".
 */
public class FormatDirective {

	private static final Pattern DIRECTIVE = Pattern.compile(
			"%(\\([^)]*\\))?([#0 +-]*)(\\*|\\d+)?(?:\\.(\\*|\\d+))?([hlL])?(.)", Pattern.DOTALL);

	private final int start;
	private final int end;
	private final String key;
	private final String flags;
	private final String width;
	private final String precision;
	private final char conversion;

	public FormatDirective(int start, int end, String key, String flags, String width, String precision,
	                       char conversion) {
		this.start = start;
		this.end = end;
		this.key = key;
		this.flags = flags;
		this.width = width;
		this.precision = precision;
		this.conversion = conversion;
	}

	/**
	 * @return the directives of format in order; text between them is literal
	 */
	public static List<FormatDirective> scan(String format) {
		List<FormatDirective> directives = new ArrayList<>();
		Matcher m = DIRECTIVE.matcher(format);
		while (m.find()) {
			directives.add(new FormatDirective(m.start(), m.end(), m.group(1), m.group(2), m.group(3), m.group(4),
					m.group(6).charAt(0)));
		}
		return directives;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public String getKey() {
		return key;
	}

	public String getFlags() {
		return flags;
	}

	public String getWidth() {
		return width;
	}

	public String getPrecision() {
		return precision;
	}

	public char getConversion() {
		return conversion;
	}

	public boolean isLiteralPercent() {
		return conversion == '%';
	}

	/**
	 * @return whether the directive takes the next positional argument and formats it with str() or repr()
	 */
	public boolean isSubstitution() {
		return key == null && !"*".equals(width) && !"*".equals(precision)
				&& (conversion == 's' || conversion == 'r');
	}

	/**
	 * The format spec of a replacement field that pads and truncates the converted text the way this directive
	 * does: "-" aligns left, a width pads, a precision truncates. Other flags do nothing to strings.
	 *
	 * @return the spec, empty when the directive has no width and no precision
	 */
	public String getFormatSpec() {
		StringBuilder spec = new StringBuilder();
		if (width != null) {
			spec.append(flags.indexOf('-') != -1 ? '<' : '>').append(width);
		}
		if (precision != null) {
			spec.append('.').append(precision);
		}
		return spec.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FormatDirective that = (FormatDirective) o;
		return start == that.start &&
				end == that.end &&
				conversion == that.conversion &&
				Objects.equals(key, that.key) &&
				Objects.equals(flags, that.flags) &&
				Objects.equals(width, that.width) &&
				Objects.equals(precision, that.precision);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end, key, flags, width, precision, conversion);
	}

	@Override
	public String toString() {
		return "FormatDirective(" + start + ", " + end + ", '" + conversion + "')";
	}

}
