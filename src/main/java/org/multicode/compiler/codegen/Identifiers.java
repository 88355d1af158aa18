package org.multicode.compiler.codegen;

import java.util.Locale;
import java.util.Map;

/**
 * Turns display names, which may be Cyrillic, into valid C++ identifiers.
 */
public final class Identifiers {

	private static final Map<Character, String> CYRILLIC = Map.ofEntries(
			Map.entry('а', "a"), Map.entry('б', "b"), Map.entry('в', "v"), Map.entry('г', "g"),
			Map.entry('д', "d"), Map.entry('е', "e"), Map.entry('ё', "yo"), Map.entry('ж', "zh"),
			Map.entry('з', "z"), Map.entry('и', "i"), Map.entry('й', "y"), Map.entry('к', "k"),
			Map.entry('л', "l"), Map.entry('м', "m"), Map.entry('н', "n"), Map.entry('о', "o"),
			Map.entry('п', "p"), Map.entry('р', "r"), Map.entry('с', "s"), Map.entry('т', "t"),
			Map.entry('у', "u"), Map.entry('ф', "f"), Map.entry('х', "h"), Map.entry('ц', "ts"),
			Map.entry('ч', "ch"), Map.entry('ш', "sh"), Map.entry('щ', "sch"), Map.entry('ъ', ""),
			Map.entry('ы', "y"), Map.entry('ь', ""), Map.entry('э', "e"), Map.entry('ю', "yu"),
			Map.entry('я', "ya"),
			Map.entry('А', "A"), Map.entry('Б', "B"), Map.entry('В', "V"), Map.entry('Г', "G"),
			Map.entry('Д', "D"), Map.entry('Е', "E"), Map.entry('Ё', "Yo"), Map.entry('Ж', "Zh"),
			Map.entry('З', "Z"), Map.entry('И', "I"), Map.entry('Й', "Y"), Map.entry('К', "K"),
			Map.entry('Л', "L"), Map.entry('М', "M"), Map.entry('Н', "N"), Map.entry('О', "O"),
			Map.entry('П', "P"), Map.entry('Р', "R"), Map.entry('С', "S"), Map.entry('Т', "T"),
			Map.entry('У', "U"), Map.entry('Ф', "F"), Map.entry('Х', "H"), Map.entry('Ц', "Ts"),
			Map.entry('Ч', "Ch"), Map.entry('Ш', "Sh"), Map.entry('Щ', "Sch"), Map.entry('Ъ', ""),
			Map.entry('Ы', "Y"), Map.entry('Ь', ""), Map.entry('Э', "E"), Map.entry('Ю', "Yu"),
			Map.entry('Я', "Ya"));

	private Identifiers() {}

	/**
	 * Replaces Cyrillic letters by their Latin transliteration; other characters are kept.
	 *
	 * @param text The text.
	 * @return The transliterated text.
	 */
	public static String transliterate(String text) {
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			String mapped = CYRILLIC.get(c);
			if (mapped != null) sb.append(mapped);
			else sb.append(c);
		}
		return sb.toString();
	}

	/**
	 * Converts a display name into a lowercase variable identifier:
	 * transliteration, whitespace runs to {@code _}, removal of everything outside
	 * {@code [A-Za-z0-9_]}, a {@code var_} prefix before a leading digit and {@code unnamed}
	 * for an empty result.
	 *
	 * @param name The display name.
	 * @return A valid identifier.
	 */
	public static String toIdentifier(String name) {
		return toTypeName(name).toLowerCase(Locale.ROOT);
	}

	/**
	 * Like {@link #toIdentifier(String)} but preserves case. Used for function and type names.
	 *
	 * @param name The display name.
	 * @return A valid identifier.
	 */
	public static String toTypeName(String name) {
		String result = transliterate(name == null ? "" : name)
				.replaceAll("\\s+", "_")
				.replaceAll("[^a-zA-Z0-9_]", "");
		if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
			result = "var_" + result;
		}
		return result.isEmpty() ? "unnamed" : result;
	}

	/**
	 * The last six alphanumeric characters of a node id, used to derive unique local names
	 * such as loop counters ({@code i_<suffix>}).
	 *
	 * @param nodeId The node id.
	 * @return The suffix.
	 */
	public static String nodeSuffix(String nodeId) {
		String alnum = nodeId.replaceAll("[^a-zA-Z0-9]", "");
		return alnum.length() <= 6 ? alnum : alnum.substring(alnum.length() - 6);
	}
}
