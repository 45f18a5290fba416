package works.ragged.forms;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * The column specifiers still in play at one record level.
 * Each specifier is the list of its remaining dot-separated segments;
 * a specifier with no segments left matches everything below it.
 */
final class SpecifierMatcher {
	static final SpecifierMatcher EVERYTHING = new SpecifierMatcher(true, Map.of(), List.of());

	private final boolean matchesEverything;
	private final Map<String, List<List<String>>> fixedStrings;
	private final List<Glob> globs;

	private record Glob(Pattern pattern, List<String> remainder) { }

	private SpecifierMatcher(boolean matchesEverything, Map<String, List<List<String>>> fixedStrings, List<Glob> globs) {
		this.matchesEverything = matchesEverything;
		this.fixedStrings = fixedStrings;
		this.globs = globs;
	}

	/**
	 * @param specifiers dotted specifier strings; {@code ""} matches everything
	 */
	static SpecifierMatcher of(Collection<String> specifiers) {
		List<List<String>> segmented = new ArrayList<>();
		for (String specifier : specifiers) {
			segmented.add(specifier.isEmpty() ? List.of() : List.of(specifier.split("\\.", -1)));
		}
		return ofSegments(segmented);
	}

	private static SpecifierMatcher ofSegments(List<List<String>> specifiers) {
		Map<String, List<List<String>>> fixedStrings = new LinkedHashMap<>();
		List<Glob> globs = new ArrayList<>();
		for (List<String> specifier : specifiers) {
			if (specifier.isEmpty()) {
				return EVERYTHING;
			}
			String head = specifier.get(0);
			List<String> remainder = specifier.subList(1, specifier.size());
			if (isGlob(head)) {
				globs.add(new Glob(globToRegex(head), remainder));
			} else {
				fixedStrings.computeIfAbsent(head, k -> new ArrayList<>()).add(remainder);
			}
		}
		return new SpecifierMatcher(false, fixedStrings, globs);
	}

	/**
	 * @return the matcher for the contents of {@code field}, or null if no specifier
	 * selects that field
	 */
	@Nullable SpecifierMatcher matchField(String field) {
		if (matchesEverything) {
			return this;
		}
		List<List<String>> next = new ArrayList<>();
		List<List<String>> fixed = fixedStrings.get(field);
		if (fixed != null) {
			next.addAll(fixed);
		}
		for (Glob glob : globs) {
			if (glob.pattern().matcher(field).matches()) {
				next.add(glob.remainder());
			}
		}
		return next.isEmpty() ? null : ofSegments(next);
	}

	private static boolean isGlob(String segment) {
		return segment.indexOf('*') >= 0 || segment.indexOf('?') >= 0 || segment.indexOf('[') >= 0;
	}

	/**
	 * Shell-style, case-sensitive: {@code *}, {@code ?}, {@code [seq]} and {@code [!seq]}.
	 * An unclosed {@code [} is literal.
	 */
	static Pattern globToRegex(String glob) {
		StringBuilder sb = new StringBuilder();
		int i = 0;
		int n = glob.length();
		while (i < n) {
			char c = glob.charAt(i++);
			if (c == '*') {
				sb.append(".*");
			} else if (c == '?') {
				sb.append('.');
			} else if (c == '[') {
				int j = i;
				if (j < n && glob.charAt(j) == '!') {
					j++;
				}
				if (j < n && glob.charAt(j) == ']') {
					j++;
				}
				while (j < n && glob.charAt(j) != ']') {
					j++;
				}
				if (j >= n) {
					sb.append("\\[");
				} else {
					String body = glob.substring(i, j);
					i = j + 1;
					StringBuilder set = new StringBuilder("[");
					int k = 0;
					if (body.startsWith("!")) {
						set.append('^');
						k = 1;
					}
					for (; k < body.length(); k++) {
						char b = body.charAt(k);
						if (b == '\\' || b == '[' || b == ']' || b == '&' || b == '^') {
							set.append('\\');
						}
						set.append(b);
					}
					sb.append(set).append(']');
				}
			} else {
				sb.append(Pattern.quote(String.valueOf(c)));
			}
		}
		return Pattern.compile(sb.toString(), Pattern.DOTALL);
	}

	@Override
	public String toString() {
		if (matchesEverything) {
			return "SpecifierMatcher(*)";
		}
		return "SpecifierMatcher(" + fixedStrings.keySet() + ", " + globs.size() + " globs)";
	}
}
