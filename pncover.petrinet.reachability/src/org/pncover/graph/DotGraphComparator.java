package org.pncover.graph;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares two DOT reachability graphs by the set of markings in their node
 * labels, ignoring node names, edges and ordering. Two explorations of the same
 * net (concurrent and sequential, or two concurrent runs) agree when these sets
 * are equal.
 */
public final class DotGraphComparator {

    private static final Pattern NODE_LABEL = Pattern.compile("\\[label\\s*=\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\]");

    private DotGraphComparator() {
    }

    /**
     * Marking part of every node label (the text after the last {@code \n}
     * escape, or the whole label when there is none). Edge lines are skipped.
     */
    public static Set<String> extractNodeMarkings(String dot) {
        Set<String> markings = new HashSet<>();
        for (String line : dot.split("\\r?\\n")) {
            if (line.contains("->")) {
                continue;
            }
            Matcher matcher = NODE_LABEL.matcher(line);
            if (matcher.find()) {
                String label = matcher.group(1);
                int split = label.lastIndexOf("\\n");
                markings.add(split >= 0 ? label.substring(split + 2) : label);
            }
        }
        return markings;
    }

    public static boolean sameNodeMarkings(String dotA, String dotB) {
        return extractNodeMarkings(dotA).equals(extractNodeMarkings(dotB));
    }
}
