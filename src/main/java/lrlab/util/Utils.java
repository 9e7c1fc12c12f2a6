package lrlab.util;

import java.util.*;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects.
	 *
	 * @param objs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objs, String separator){
		StringBuilder builder = new StringBuilder();
		int i = 0;
		for (T obj : objs){
			if (i++ != 0){
				builder.append(separator);
			}
			builder.append(obj);
		}
		return builder.toString();
	}

	/**
	 * Formats a set like <code>{a, b, c}</code>, the elements are sorted if they are comparable
	 */
	public static <T extends Comparable<? super T>> String formatSet(Collection<T> set){
		List<T> sorted = new ArrayList<>(set);
		Collections.sort(sorted);
		return "{" + join(sorted, ", ") + "}";
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		return new ArrayList<>(Arrays.asList(elements));
	}

	/**
	 * Formats rows as a table with left aligned columns, the first row is the header
	 */
	public static String formatTable(List<List<String>> rows){
		int columns = 0;
		for (List<String> row : rows){
			columns = Math.max(columns, row.size());
		}
		int[] widths = new int[columns];
		for (List<String> row : rows){
			for (int i = 0; i < row.size(); i++){
				widths[i] = Math.max(widths[i], row.get(i).length());
			}
		}
		StringBuilder builder = new StringBuilder();
		for (int r = 0; r < rows.size(); r++){
			List<String> row = rows.get(r);
			StringBuilder line = new StringBuilder();
			for (int i = 0; i < columns; i++){
				String cell = i < row.size() ? row.get(i) : "";
				line.append(pad(cell, widths[i]));
				if (i < columns - 1){
					line.append(" | ");
				}
			}
			builder.append(line.toString().replaceAll("\\s+$", "")).append("\n");
			if (r == 0){
				int width = 0;
				for (int w : widths){
					width += w;
				}
				builder.append(repeat('-', width + 3 * Math.max(columns - 1, 0))).append("\n");
			}
		}
		return builder.toString();
	}

	public static String pad(String str, int width){
		StringBuilder builder = new StringBuilder(str);
		while (builder.length() < width){
			builder.append(' ');
		}
		return builder.toString();
	}

	public static String repeat(char c, int times){
		char[] chars = new char[Math.max(times, 0)];
		Arrays.fill(chars, c);
		return new String(chars);
	}
}
