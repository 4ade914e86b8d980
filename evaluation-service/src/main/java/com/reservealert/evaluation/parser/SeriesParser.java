package com.reservealert.evaluation.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns free-form text ({@code "93, 91;90 89"}) into a bounded list of integer samples.
 *
 * <p>Tokens are separated by commas, semicolons or whitespace. Anything that is not a signed
 * integer is skipped; integers beyond the {@code int} range saturate to its bounds. Parsing stops
 * once {@code maxPoints} integers have been accepted.
 */
public class SeriesParser {

    private static final Pattern SEPARATORS = Pattern.compile("[,\\s;]+");
    private static final Pattern INTEGER    = Pattern.compile("[+-]?\\d+");

    private final int maxPoints;

    public SeriesParser(int maxPoints) {
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be positive, got " + maxPoints);
        }
        this.maxPoints = maxPoints;
    }

    public ParsedSeries parse(String text) {
        if (text == null || text.isBlank()) {
            return new ParsedSeries(List.of(), false, 0);
        }
        List<Integer> values = new ArrayList<>();
        int skipped = 0;
        boolean truncated = false;
        for (String token : SEPARATORS.split(text.trim())) {
            if (token.isEmpty()) continue;
            if (!INTEGER.matcher(token).matches()) {
                skipped++;
                continue;
            }
            if (values.size() == maxPoints) {
                truncated = true;
                break;
            }
            values.add(toInt(token));
        }
        return new ParsedSeries(values, truncated, skipped);
    }

    public int maxPoints() {
        return maxPoints;
    }

    // out-of-range values saturate; the engine clamps them into the sample range anyway
    private static int toInt(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return token.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }
}
