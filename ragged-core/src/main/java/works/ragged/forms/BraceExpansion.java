package works.ragged.forms;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands shell-style alternations: {@code "{x,y}.z"} becomes
 * {@code "x.z"} and {@code "y.z"}. Groups nest; textually identical
 * expansions appear once.
 */
final class BraceExpansion {
	private static final Pattern INNERMOST_GROUP = Pattern.compile("\\{[^{}]*\\}");

	private BraceExpansion() { }

	static List<String> expand(String text) {
		Set<String> seen = new LinkedHashSet<>();
		expand(text, seen);
		return new ArrayList<>(seen);
	}

	private static void expand(String text, Set<String> seen) {
		List<int[]> spans = new ArrayList<>();
		List<String[]> alternatives = new ArrayList<>();
		Matcher m = INNERMOST_GROUP.matcher(text);
		while (m.find()) {
			spans.add(new int[] { m.start(), m.end() });
			alternatives.add(text.substring(m.start() + 1, m.end() - 1).split(",", -1));
		}
		if (spans.isEmpty()) {
			seen.add(text);
			return;
		}
		int[] choice = new int[spans.size()];
		while (true) {
			StringBuilder sb = new StringBuilder();
			int pos = 0;
			for (int g = 0; g < spans.size(); g++) {
				sb.append(text, pos, spans.get(g)[0]).append(alternatives.get(g)[choice[g]]);
				pos = spans.get(g)[1];
			}
			sb.append(text.substring(pos));
			expand(sb.toString(), seen);

			// Advance like an odometer, last group fastest
			int g = spans.size() - 1;
			while (g >= 0 && ++choice[g] == alternatives.get(g).length) {
				choice[g] = 0;
				g--;
			}
			if (g < 0) {
				return;
			}
		}
	}
}
