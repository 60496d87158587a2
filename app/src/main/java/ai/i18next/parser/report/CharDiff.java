package ai.i18next.parser.report;

/**
 * Character-level diff used in value conflict warnings.
 *
 * <p>Both strings are compared code point by code point at the same index. Runs of differing positions are
 * rendered as {@code [-removed-]{+added+}}; equal positions are copied as is.</p>
 */
public final class CharDiff {

    private CharDiff() {
    }

    public static String diff(String oldValue, String newValue) {
        int[] left = oldValue == null ? new int[0] : oldValue.codePoints().toArray();
        int[] right = newValue == null ? new int[0] : newValue.codePoints().toArray();
        StringBuilder result = new StringBuilder();
        StringBuilder removed = new StringBuilder();
        StringBuilder added = new StringBuilder();
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            boolean hasLeft = i < left.length;
            boolean hasRight = i < right.length;
            if (hasLeft && hasRight && left[i] == right[i]) {
                flush(result, removed, added);
                result.appendCodePoint(left[i]);
                continue;
            }
            if (hasLeft) {
                removed.appendCodePoint(left[i]);
            }
            if (hasRight) {
                added.appendCodePoint(right[i]);
            }
        }
        flush(result, removed, added);
        return result.toString();
    }

    private static void flush(StringBuilder result, StringBuilder removed, StringBuilder added) {
        if (removed.length() > 0) {
            result.append("[-").append(removed).append("-]");
            removed.setLength(0);
        }
        if (added.length() > 0) {
            result.append("{+").append(added).append("+}");
            added.setLength(0);
        }
    }
}
