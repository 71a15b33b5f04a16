package com.sattline.lint.loader.resolve;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** File system access used by {@link DependencyResolver}. */
interface SourceReader {

    /** Reads files as UTF-8; malformed bytes become replacement characters. */
    SourceReader FILES =
            new SourceReader() {
                @Override
                public String read(Path file) throws IOException {
                    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
                }

                @Override
                public List<Path> list(Path dir) throws IOException {
                    try (Stream<Path> entries = Files.list(dir)) {
                        return entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
                    }
                }
            };

    String read(Path file) throws IOException;

    /** Regular files directly inside {@code dir}, sorted by path. */
    List<Path> list(Path dir) throws IOException;
}
