package com.postsync.backend.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.config.PostSyncProperties;
import com.postsync.backend.domain.ExportDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Export documents on disk, one pretty-printed JSON file each.
 */
@Component
public class BackupStore {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper om;
    private final Path dir;
    private final ReentrantLock lock = new ReentrantLock(true);

    public BackupStore(ObjectMapper om, PostSyncProperties props) {
        this.om = om;
        this.dir = Paths.get(props.backup().dir());
    }

    /** @return the file name the document was written to */
    public String write(String prefix, ExportDocument doc) {
        lock.lock();
        try {
            Files.createDirectories(dir);
            String base = prefix + "-" + STAMP.format(doc.exportedAt());
            Path target = dir.resolve(base + ".json");
            for (int n = 1; Files.exists(target); n++) {
                target = dir.resolve(base + "-" + n + ".json");
            }
            byte[] out = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc);
            Files.write(target, out, StandardOpenOption.CREATE_NEW);
            return target.getFileName().toString();
        } catch (IOException e) {
            throw new UncheckedIOException("backup write failed in " + dir, e);
        } finally {
            lock.unlock();
        }
    }

    public ExportDocument read(String fileName) {
        Path p = dir.resolve(fileName).normalize();
        if (!p.startsWith(dir.normalize())) throw new IllegalArgumentException("invalid_backup_name");
        try {
            return om.readValue(Files.readAllBytes(p), ExportDocument.class);
        } catch (NoSuchFileException e) {
            throw new NoSuchElementException("backup_not_found: " + fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("backup read failed: " + fileName, e);
        }
    }

    public List<String> list() {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(f -> f.getFileName().toString())
                    .filter(n -> n.endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("backup listing failed in " + dir, e);
        }
    }
}
