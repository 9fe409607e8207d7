package com.zzf.clawcontrol.sync;

import com.zzf.clawcontrol.protocol.FileRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recursive scan of the notes root. Dot-prefixed entries are skipped, subdirectories are
 * walked, and only recognized documents are read. Unreadable entries are skipped.
 */
@Slf4j
public class DirectoryScanner {
    private final Path root;
    private final DocumentFilter filter;

    public DirectoryScanner(Path root, DocumentFilter filter) {
        this.root = root;
        this.filter = filter;
    }

    public List<FileRecord> scan() {
        List<FileRecord> files = new ArrayList<>();
        walk(root, "", files);
        return files;
    }

    private void walk(Path dir, String prefix, List<FileRecord> files) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException e) {
            log.debug("Cannot list {}: {}", dir, e.toString());
            return;
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));

        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (filter.isHidden(name)) {
                continue;
            }
            String relPath = prefix.isEmpty() ? name : prefix + "/" + name;
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                walk(entry, relPath, files);
            } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS) && filter.isDocumentName(name)) {
                try {
                    files.add(new FileRecord(relPath, Files.readString(entry, StandardCharsets.UTF_8)));
                } catch (IOException e) {
                    log.debug("Skipping unreadable file {}: {}", relPath, e.toString());
                }
            }
        }
    }
}
