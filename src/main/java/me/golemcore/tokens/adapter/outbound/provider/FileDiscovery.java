package me.golemcore.tokens.adapter.outbound.provider;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.model.DiscoveredFile;
import me.golemcore.tokens.domain.model.FileFingerprint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lists candidate source files under provider roots.
 *
 * <p>
 * Roots are walked in the given order and files within a root are sorted by
 * path. Symbolic links are not followed and missing roots are skipped.
 */
@Component
@Slf4j
public class FileDiscovery {

    public List<DiscoveredFile> discover(List<Path> roots, String extension) {
        String suffix = "." + extension;
        List<DiscoveredFile> files = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            List<DiscoveredFile> found = new ArrayList<>();
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && file.getFileName().toString().endsWith(suffix)) {
                            found.add(new DiscoveredFile(file, fingerprint(attrs)));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        log.debug("[Discovery] Skipping unreadable {}: {}", file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                log.debug("[Discovery] Failed to walk {}: {}", root, e.getMessage());
            }
            found.sort(Comparator.comparing(DiscoveredFile::path));
            files.addAll(found);
        }
        return files;
    }

    static FileFingerprint fingerprint(BasicFileAttributes attrs) {
        return new FileFingerprint(attrs.lastModifiedTime().toMillis() / 1000, attrs.size());
    }
}
