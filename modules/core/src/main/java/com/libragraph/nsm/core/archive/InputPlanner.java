package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Expands create inputs into the ordered list of files to archive and the
 * archive path each one is stored under. Writes nothing.
 *
 * <p>A file input is stored under its file name. A directory input is
 * walked recursively; its regular files are stored as
 * {@code dirName/relative/path}, sorted by that path.
 *
 * <p>Archive paths must be unique, and no stored file may sit where another
 * stored path needs a directory ({@code a} next to {@code a/f}); either would
 * make the archive impossible to extract.
 */
final class InputPlanner {

    private static final int MAX_PATH_BYTES = 0xFFFF;

    record PlannedInput(Path source, String archivePath) {
    }

    private InputPlanner() {
    }

    static List<PlannedInput> plan(List<Path> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input path is required");
        }
        List<PlannedInput> planned = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> dirs = new HashSet<>();
        for (Path input : inputs) {
            Path source = input.toAbsolutePath().normalize();
            if (Files.isDirectory(source)) {
                for (PlannedInput p : walk(source)) {
                    add(planned, seen, dirs, p);
                }
            } else if (Files.isRegularFile(source) && Files.isReadable(source)) {
                add(planned, seen, dirs, new PlannedInput(source, source.getFileName().toString()));
            } else {
                throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                        "Input is not a readable file or directory: " + input);
            }
        }
        if (planned.isEmpty()) {
            throw new IllegalArgumentException("Inputs contain no regular files: " + inputs);
        }
        return planned;
    }

    private static List<PlannedInput> walk(Path dir) {
        Path base = dir.getParent() == null ? dir : dir.getParent();
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(f -> new PlannedInput(f, toArchivePath(base.relativize(f))))
                    .sorted(Comparator.comparing(PlannedInput::archivePath))
                    .toList();
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "Failed to walk input directory " + dir + ": " + e.getMessage(), e);
        }
    }

    private static String toArchivePath(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private static void add(List<PlannedInput> planned, Set<String> seen, Set<String> dirs, PlannedInput input) {
        if (!Files.isReadable(input.source())) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE, "Input is not readable: " + input.source());
        }
        if (input.archivePath().getBytes(StandardCharsets.UTF_8).length > MAX_PATH_BYTES) {
            throw new IllegalArgumentException("Archive path too long: " + input.archivePath());
        }
        if (!seen.add(input.archivePath())) {
            throw new IllegalArgumentException("Duplicate archive path: " + input.archivePath());
        }
        // A stored file may not also be a directory of another stored file.
        String path = input.archivePath();
        if (dirs.contains(path)) {
            throw new IllegalArgumentException("Archive path is both a file and a directory: " + path);
        }
        for (int slash = path.indexOf('/'); slash >= 0; slash = path.indexOf('/', slash + 1)) {
            String parent = path.substring(0, slash);
            if (seen.contains(parent)) {
                throw new IllegalArgumentException("Archive path is both a file and a directory: " + parent);
            }
            dirs.add(parent);
        }
        planned.add(input);
    }
}
