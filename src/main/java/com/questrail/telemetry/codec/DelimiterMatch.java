package com.questrail.telemetry.codec;

import java.util.List;
import java.util.Optional;

/**
 * Location of the first delimiter occurring in a fragment.
 *
 * <p>"First occurring" means lowest index; among delimiters found at that same
 * index, the longest wins.</p>
 *
 * @param index  position of the delimiter within the fragment
 * @param length length of the matched delimiter
 */
public record DelimiterMatch(int index, int length)
{
    public static Optional<DelimiterMatch> find(String text, List<String> delimiters) {
        int bestIndex = -1;
        int bestLength = 0;
        for (String d : delimiters) {
            int i = text.indexOf(d);
            if (i < 0) {
                continue;
            }
            if (bestIndex < 0 || i < bestIndex || (i == bestIndex && d.length() > bestLength)) {
                bestIndex = i;
                bestLength = d.length();
            }
        }
        return bestIndex < 0 ? Optional.empty() : Optional.of(new DelimiterMatch(bestIndex, bestLength));
    }

    /** Text before the delimiter. */
    public String head(String text) {
        return text.substring(0, index);
    }

    /** Text after the delimiter. */
    public String tail(String text) {
        return text.substring(index + length);
    }
}
