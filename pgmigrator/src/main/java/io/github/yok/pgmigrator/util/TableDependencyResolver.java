package io.github.yok.pgmigrator.util;

import io.github.yok.pgmigrator.db.CatalogReader;
import io.github.yok.pgmigrator.model.ForeignKeyEdge;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Resolves a deterministic, foreign-key-safe order over the base tables of a schema.
 *
 * <h2>Algorithm</h2>
 *
 * <p>
 * The resolver builds a graph where {@code child -> parent} exists if {@code child} holds a foreign
 * key referencing {@code parent}. Tables without dependencies start at depth 0. Using an explicit
 * worklist, a table becomes resolved once all of its parents are resolved, at depth
 * {@code 1 + max(depth of parents)}. Resolved tables are ordered by ascending depth, then name.
 * </p>
 *
 * <h2>Rules / limitations</h2>
 *
 * <ul>
 * <li>Self-referencing foreign keys are ignored.</li>
 * <li>Edges to tables outside the schema are ignored.</li>
 * <li>Several constraints between the same pair count as one edge.</li>
 * <li>A table whose depth would exceed the depth cap is left unresolved.</li>
 * <li>Tables that never resolve (cycle members, tables depending on them, and tables beyond the
 * cap) are appended in alphabetical order after all resolved tables.</li>
 * </ul>
 *
 * <h2>Degradation</h2>
 *
 * <p>
 * If foreign-key metadata cannot be read, the tables are returned alphabetically. If the table list
 * itself cannot be read, the failure is logged and an empty list is returned. {@link #resolve}
 * never throws for catalog failures.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableDependencyResolver {

    /**
     * Depth cap applied when none is configured.
     */
    public static final int DEFAULT_MAX_DEPTH = 20;

    private final CatalogReader catalogReader;
    private final int maxDepth;

    /**
     * Creates a resolver.
     *
     * @param catalogReader catalog access
     * @param maxDepth depth cap, must be non-negative
     */
    public TableDependencyResolver(CatalogReader catalogReader, int maxDepth) {
        Validate.isTrue(catalogReader != null, "catalogReader must not be null.");
        Validate.isTrue(maxDepth >= 0, "maxDepth must be >= 0: %d", maxDepth);
        this.catalogReader = catalogReader;
        this.maxDepth = maxDepth;
    }

    /**
     * Resolves the parent-first order of every base table in {@code schema}.
     *
     * @param schema schema name
     * @return each base table exactly once; empty if the table list cannot be read
     */
    public List<String> resolve(String schema) {
        List<String> tables;
        try {
            tables = catalogReader.listTables(schema);
        } catch (SQLException e) {
            log.error("Failed to list tables of schema [{}]: {}", schema, e.getMessage(), e);
            return new ArrayList<>();
        }

        List<ForeignKeyEdge> edges;
        try {
            edges = catalogReader.listForeignKeys(schema);
        } catch (SQLException e) {
            log.warn("Failed to read foreign keys of schema [{}] ({}). "
                    + "Falling back to alphabetical order.", schema, e.getMessage());
            return new ArrayList<>(new TreeSet<>(tables));
        }

        List<String> result = order(tables, edges, maxDepth);
        log.info("Resolved table order (parent-first) for schema [{}]: {}", schema, result);
        return result;
    }

    /**
     * Orders tables parent-first.
     *
     * @param tables table names; duplicates are collapsed
     * @param edges foreign-key edges; edges naming unknown tables and self references are ignored
     * @param maxDepth depth cap
     * @return ordered table names
     */
    public static List<String> order(Collection<String> tables, Collection<ForeignKeyEdge> edges,
            int maxDepth) {
        Set<String> all = new TreeSet<>(tables);

        // parents per child and children per parent, distinct pairs only
        Map<String, Set<String>> parents = new HashMap<>();
        Map<String, Set<String>> children = new HashMap<>();
        for (String t : all) {
            parents.put(t, new TreeSet<>());
            children.put(t, new TreeSet<>());
        }
        for (ForeignKeyEdge edge : edges) {
            if (edge.isSelfReference() || !all.contains(edge.getChild())
                    || !all.contains(edge.getParent())) {
                continue;
            }
            if (parents.get(edge.getChild()).add(edge.getParent())) {
                children.get(edge.getParent()).add(edge.getChild());
            }
        }

        Map<String, Integer> pending = new HashMap<>();
        Map<String, Integer> depth = new TreeMap<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (String t : all) {
            int count = parents.get(t).size();
            pending.put(t, count);
            if (count == 0) {
                depth.put(t, 0);
                worklist.add(t);
            }
        }

        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            for (String child : children.get(current)) {
                int remaining = pending.merge(child, -1, Integer::sum);
                if (remaining > 0) {
                    continue;
                }
                int childDepth = 1 + parents.get(child).stream().mapToInt(depth::get).max()
                        .orElse(-1);
                if (childDepth > maxDepth) {
                    log.warn("Table [{}] exceeds the dependency depth cap ({})", child, maxDepth);
                    continue;
                }
                depth.put(child, childDepth);
                worklist.add(child);
            }
        }

        List<String> resolved = new ArrayList<>(depth.keySet());
        resolved.sort(Comparator.<String>comparingInt(depth::get)
                .thenComparing(Comparator.naturalOrder()));

        List<String> unresolved = all.stream().filter(t -> !depth.containsKey(t))
                .collect(Collectors.toList());
        if (!unresolved.isEmpty()) {
            log.warn("Circular or too deep foreign key references detected for tables: {}. "
                    + "These tables will be appended in alphabetical order.", unresolved);
        }

        List<String> result = new ArrayList<>(resolved.size() + unresolved.size());
        result.addAll(resolved);
        result.addAll(unresolved);
        return Collections.unmodifiableList(result);
    }
}
