/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.definition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.github.graydavid.exactbayes.core.Combinations;
import io.github.graydavid.exactbayes.core.NetworkGraph;
import io.github.graydavid.exactbayes.core.Node;

/**
 * Renders a node's CPT as a GitHub-flavored markdown table. There's one column per parent, holding that parent's
 * value, followed by one column per value of the node, holding P(node=value | parent values). There's one row per
 * combination of parent values, in the order {@link Combinations#cartesianProduct(List)} enumerates them. E.g.
 *
 * <pre>
 * | Burglary | Earthquake | P(Alarm=t) | P(Alarm=f) |
 * | :------- | :--------- | ---------: | ---------: |
 * | t        | t          |       0.95 |       0.05 |
 * ...
 * </pre>
 *
 * Cells missing from the CPT are left blank.
 */
public class CptTableFormatter {
    private CptTableFormatter() {}

    /**
     * Formats node's CPT, looking up its parents' values in network.
     *
     * @throws IllegalArgumentException if any of node's parents is not part of network.
     */
    public static String format(Node node, NetworkGraph network) {
        return format(node, network.symbolTable());
    }

    /**
     * Formats node's CPT, looking up its parents' values in symbolTable (see {@link NetworkGraph#symbolTable()}).
     *
     * @throws IllegalArgumentException if any of node's parents is missing from symbolTable.
     */
    public static String format(Node node, Map<String, List<String>> symbolTable) {
        List<List<String>> parentValueSets = new ArrayList<>(node.getParents().size());
        for (String parent : node.getParents()) {
            List<String> values = symbolTable.get(parent);
            if (values == null) {
                String message = String.format("Can't format node '%s': parent '%s' is missing from %s",
                        node.getName(), parent, symbolTable.keySet());
                throw new IllegalArgumentException(message);
            }
            parentValueSets.add(values);
        }

        List<String> header = new ArrayList<>(node.getParents());
        node.getValues().forEach(value -> header.add("P(" + node.getName() + "=" + value + ")"));

        List<List<String>> rows = new ArrayList<>();
        for (List<String> parentValues : Combinations.cartesianProduct(parentValueSets)) {
            List<String> row = new ArrayList<>(parentValues);
            for (String value : node.getValues()) {
                List<String> combination = new ArrayList<>(parentValues);
                combination.add(value);
                Double probability = node.getCpt().get(Node.cptKey(combination));
                row.add(probability == null ? "" : renderProbability(probability));
            }
            rows.add(row);
        }

        int[] widths = new int[header.size()];
        for (int i = 0; i < widths.length; ++i) {
            widths[i] = Math.max(3, header.get(i).length());
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        int parentCount = node.getParents().size();
        StringBuilder table = new StringBuilder();
        appendRow(table, header, widths, parentCount);
        List<String> separators = new ArrayList<>(widths.length);
        for (int i = 0; i < widths.length; ++i) {
            String dashes = "-".repeat(widths[i] - 1);
            separators.add(i < parentCount ? ":" + dashes : dashes + ":");
        }
        appendRow(table, separators, widths, parentCount);
        rows.forEach(row -> appendRow(table, row, widths, parentCount));
        return table.toString();
    }

    private static String renderProbability(double probability) {
        return BigDecimal.valueOf(probability).stripTrailingZeros().toPlainString();
    }

    // Parent columns are left-aligned, probability columns right-aligned
    private static void appendRow(StringBuilder table, List<String> cells, int[] widths, int parentCount) {
        List<String> padded = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); ++i) {
            String cell = cells.get(i);
            String padding = " ".repeat(widths[i] - cell.length());
            padded.add(i < parentCount ? cell + padding : padding + cell);
        }
        table.append(padded.stream().collect(Collectors.joining(" | ", "| ", " |"))).append('\n');
    }
}
