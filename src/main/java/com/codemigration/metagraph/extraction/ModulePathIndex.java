package com.codemigration.metagraph.extraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves module candidate paths against the files of one project.
 *
 * <p>A candidate matches a file with exactly that path first; failing that, any file whose path
 * ends with {@code "/" + candidate}, preferring the shortest path and then the lexicographically
 * smallest one. A candidate ending in {@code /} names a directory and matches every file
 * directly inside it.
 */
public class ModulePathIndex {

    private static final Comparator<String> SHORTEST_FIRST =
        Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final Set<String> paths = new TreeSet<>();
    private final Map<String, List<String>> byFileName = new HashMap<>();
    private final Map<String, List<String>> byDirectory = new HashMap<>();

    public ModulePathIndex(Collection<String> filePaths) {
        for (String path : filePaths) {
            paths.add(path);
            byFileName.computeIfAbsent(fileName(path), k -> new ArrayList<>()).add(path);
            byDirectory.computeIfAbsent(directory(path), k -> new ArrayList<>()).add(path);
        }
        byDirectory.values().forEach(list -> list.sort(Comparator.naturalOrder()));
    }

    /**
     * Files the first matching candidate resolves to; empty when no candidate matches.
     */
    public List<String> resolve(List<String> candidates) {
        for (String candidate : candidates) {
            List<String> matched = candidate.endsWith("/") ? matchDirectory(candidate) : matchFile(candidate);
            if (!matched.isEmpty()) {
                return matched;
            }
        }
        return List.of();
    }

    private List<String> matchFile(String candidate) {
        if (paths.contains(candidate)) {
            return List.of(candidate);
        }
        String suffix = "/" + candidate;
        return byFileName.getOrDefault(fileName(candidate), List.of()).stream()
            .filter(p -> p.endsWith(suffix))
            .min(SHORTEST_FIRST)
            .map(List::of)
            .orElse(List.of());
    }

    private List<String> matchDirectory(String candidate) {
        String dir = candidate.substring(0, candidate.length() - 1);
        List<String> exact = byDirectory.get(dir);
        if (exact != null) {
            return exact;
        }
        String suffix = "/" + dir;
        return byDirectory.keySet().stream()
            .filter(d -> d.endsWith(suffix))
            .min(SHORTEST_FIRST)
            .map(byDirectory::get)
            .orElse(List.of());
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static String directory(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
