package com.paxkun.binder.service.merge;

import org.jetbrains.annotations.Contract;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Orders names so that embedded digit runs compare by numeric value:
 * {@code page2 < page10}, {@code page2 < page2a}, and {@code img001} ties
 * with {@code img1}. Text runs compare by plain code unit order.
 * <p>
 * Ties keep their input order when used with {@link List#sort}.
 */
public final class NaturalSorter implements Comparator<String> {

    public static final NaturalSorter INSTANCE = new NaturalSorter();

    private NaturalSorter() {
    }

    public static <T> void sort(List<T> items, Function<? super T, String> nameOf) {
        items.sort(Comparator.comparing(nameOf, INSTANCE));
    }

    @Override
    @Contract(pure = true)
    public int compare(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int leftEnd = runEnd(left, i);
            int rightEnd = runEnd(right, j);

            int cmp;
            if (isDigit(left.charAt(i)) && isDigit(right.charAt(j))) {
                cmp = compareNumeric(left, i, leftEnd, right, j, rightEnd);
            } else {
                cmp = left.substring(i, leftEnd).compareTo(right.substring(j, rightEnd));
            }
            if (cmp != 0) {
                return cmp;
            }
            i = leftEnd;
            j = rightEnd;
        }
        // a name with runs left over is the longer one
        return Boolean.compare(i < left.length(), j < right.length());
    }

    private static int runEnd(String s, int start) {
        boolean digit = isDigit(s.charAt(start));
        int end = start + 1;
        while (end < s.length() && isDigit(s.charAt(end)) == digit) {
            end++;
        }
        return end;
    }

    // Compares digit runs of any length without parsing them.
    private static int compareNumeric(String left, int leftStart, int leftEnd,
                                      String right, int rightStart, int rightEnd) {
        while (leftStart < leftEnd - 1 && left.charAt(leftStart) == '0') {
            leftStart++;
        }
        while (rightStart < rightEnd - 1 && right.charAt(rightStart) == '0') {
            rightStart++;
        }
        int lengthCmp = Integer.compare(leftEnd - leftStart, rightEnd - rightStart);
        if (lengthCmp != 0) {
            return lengthCmp;
        }
        for (int k = 0; k < leftEnd - leftStart; k++) {
            int cmp = Character.compare(left.charAt(leftStart + k), right.charAt(rightStart + k));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
